package com.supplyhub.gameservice.games.beergame.domain.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 终局广播：最终账本 + 全程统计（统计名 → 玩家 → 按回合的序列）
 */
public record GameEnd(Map<UUID, UserState> playerStates, Map<String, Map<UUID, List<Long>>> stats) {
}
