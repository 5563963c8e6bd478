package com.supplyhub.gameservice.games.beergame.domain.enums;

public enum LobbyPhase {

    NOT_STARTED, // 未开局（可调整职业分配）
    ACTIVE,      // 进行中（接受回合提交）
    FINISHED     // 已达到最大回合数
}
