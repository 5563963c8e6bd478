package com.supplyhub.gameservice.games.beergame.domain.repository;

import com.supplyhub.gameservice.games.beergame.domain.model.LobbyConfig;
import com.supplyhub.gameservice.games.beergame.domain.model.Settings;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 大厅记录（外部维护，引擎只读配置并回写开局/结束标记与设置）
 */
public interface LobbyRepository {

    Optional<LobbyConfig> findById(UUID lobbyId);

    List<LobbyConfig> findAll();

    void updateSettings(UUID lobbyId, Settings settings);

    void markStarted(UUID lobbyId);

    void markFinished(UUID lobbyId);
}
