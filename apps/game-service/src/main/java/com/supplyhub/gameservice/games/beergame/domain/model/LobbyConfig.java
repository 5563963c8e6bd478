package com.supplyhub.gameservice.games.beergame.domain.model;

import lombok.Builder;

import java.util.UUID;

/**
 * 引擎需要的大厅配置视图（大厅的增删改由外部负责）
 */
@Builder(toBuilder = true)
public record LobbyConfig(
        UUID id,
        String name,
        int maxPlayers,
        UUID ownerId,
        boolean started,
        boolean finished,
        Settings settings,
        GameEvents events
) {

    public LobbyConfig {
        settings = settings == null ? Settings.empty() : settings;
        events = events == null ? GameEvents.none() : events;
    }
}
