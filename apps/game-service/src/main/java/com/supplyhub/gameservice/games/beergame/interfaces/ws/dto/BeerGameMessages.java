package com.supplyhub.gameservice.games.beergame.interfaces.ws.dto;

import lombok.Data;

import java.util.Map;
import java.util.UUID;

/**
 * WebSocket 指令（客户端 → 服务端），通过 /app/... 发送。
 */
public class BeerGameMessages {

    /**
     * 回合提交：/app/beergame.roundEnd
     */
    @Data
    public static class RoundEndCmd {
        private UUID lobbyId;
        private long quantity;
    }

    /**
     * 开局前调整职业：/app/beergame.classes
     */
    @Data
    public static class ClassesCmd {
        private UUID lobbyId;
        private Map<UUID, Integer> assignments;
    }
}
