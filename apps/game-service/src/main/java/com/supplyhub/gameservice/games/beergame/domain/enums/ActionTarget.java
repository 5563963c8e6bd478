package com.supplyhub.gameservice.games.beergame.domain.enums;

/**
 * 事件动作的作用范围
 */
public enum ActionTarget {

    EVENT_TARGET, // 仅条件命中的玩家
    ALL_PLAYERS   // 全体玩家
}
