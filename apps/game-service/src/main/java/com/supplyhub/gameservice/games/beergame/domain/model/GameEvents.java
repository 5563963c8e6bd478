package com.supplyhub.gameservice.games.beergame.domain.model;

import java.util.List;

/**
 * 大厅配置的事件列表，顺序即求值顺序
 */
public record GameEvents(List<GameEvent> events) {

    public GameEvents {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static GameEvents none() {
        return new GameEvents(List.of());
    }
}
