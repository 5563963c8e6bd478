package com.supplyhub.gameservice.games.beergame.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * 玩家当前所在大厅（存 Redis，断线处理时据此定位大厅）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerLobbyBinding {

    private UUID playerId;

    private UUID lobbyId;

    /** 绑定时间（epoch 毫秒） */
    private long boundAt;

    public static PlayerLobbyBinding of(UUID playerId, UUID lobbyId) {
        return new PlayerLobbyBinding(playerId, lobbyId, System.currentTimeMillis());
    }
}
