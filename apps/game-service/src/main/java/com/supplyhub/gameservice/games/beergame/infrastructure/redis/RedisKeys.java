package com.supplyhub.gameservice.games.beergame.infrastructure.redis;

import java.util.UUID;

/**
 * 啤酒游戏的 Redis Key 统一在这里拼接。
 */
public final class RedisKeys {

    private static final String PFX = "beergame:";

    private RedisKeys() {}

    /** 玩家 → 当前大厅 */
    public static String playerLobby(UUID playerId) {
        return PFX + "player:" + playerId + ":lobby";
    }
}
