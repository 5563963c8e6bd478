package com.supplyhub.gameservice.games.beergame.domain.model;

import java.util.List;

/**
 * 一条事件规则。
 * <p>
 * runOnce 仅随配置持久化，当前求值流程不读取它：条件每次成立都会再次触发。
 */
public record GameEvent(String name, EventCondition condition, List<EventAction> actions, boolean runOnce) {

    public GameEvent {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
