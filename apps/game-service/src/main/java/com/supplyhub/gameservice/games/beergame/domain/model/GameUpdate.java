package com.supplyhub.gameservice.games.beergame.domain.model;

import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 开局 / 新回合广播以及断线重连时下发的完整视图
 */
public record GameUpdate(
        Map<UUID, UserState> playerStates,
        long round,
        Flow flow,
        Settings settings,
        Map<UUID, Order> roundOrders,
        Map<UUID, Order> sentOrders,
        Map<UUID, Integer> playerClasses
) {

    /**
     * 从运行时状态截取视图；玩家账本做拷贝，避免广播后被继续修改
     */
    public static GameUpdate of(RoundState state) {
        Map<UUID, UserState> users = new TreeMap<>();
        state.getUsersStates().forEach((id, u) -> users.put(id, u.copy()));
        return new GameUpdate(users, state.getRound(), state.getFlow(), state.getSettings(),
                new TreeMap<>(state.getRoundOrders()), new TreeMap<>(state.getSentOrders()),
                new TreeMap<>(state.getPlayerClasses()));
    }
}
