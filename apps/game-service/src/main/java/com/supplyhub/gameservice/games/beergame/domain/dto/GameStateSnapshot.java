package com.supplyhub.gameservice.games.beergame.domain.dto;

import com.supplyhub.gameservice.games.beergame.domain.model.Flow;
import com.supplyhub.gameservice.games.beergame.domain.model.Order;
import com.supplyhub.gameservice.games.beergame.domain.model.RoundState;
import com.supplyhub.gameservice.games.beergame.domain.model.Settings;
import com.supplyhub.gameservice.games.beergame.domain.model.UserState;

import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * GameStateSnapshot
 * -------------------------------------------------------
 * 回合边界的持久化快照（一回合一行，只追加不修改）。
 * 用途：进程重启后的状态恢复、全程统计、SingleChange 与上一回合比较。
 * 设置不入快照，恢复时以大厅记录中的设置为准。
 * -------------------------------------------------------
 */
public record GameStateSnapshot(
        UUID lobbyId,
        long round,
        Map<UUID, UserState> userStates,
        Map<UUID, Order> roundOrders,
        Map<UUID, Order> sentOrders,
        Map<UUID, Integer> playerClasses,
        Flow flow,
        long demand,
        long supply
) {

    public static GameStateSnapshot of(UUID lobbyId, RoundState state) {
        Map<UUID, UserState> users = new TreeMap<>();
        state.getUsersStates().forEach((id, u) -> users.put(id, u.copy()));
        return new GameStateSnapshot(lobbyId, state.getRound(), users,
                new TreeMap<>(state.getRoundOrders()), new TreeMap<>(state.getSentOrders()),
                new TreeMap<>(state.getPlayerClasses()), state.getFlow(), state.getDemand(), state.getSupply());
    }

    /**
     * 还原为可继续提交的运行时状态。
     * 快照写于回合结算之后，本回合订单已并入各玩家队列，因此这里清空订单表、计数归零。
     */
    public RoundState toRoundState(Settings settings) {
        RoundState state = new RoundState();
        state.setRound(round);
        Map<UUID, UserState> users = new TreeMap<>();
        userStates.forEach((id, u) -> users.put(id, u.copy()));
        state.setUsersStates(users);
        state.setPlayers(users.size());
        state.setPlayerClasses(new TreeMap<>(playerClasses));
        state.setFlow(flow);
        state.setDemand(demand);
        state.setSupply(supply);
        state.setSettings(settings == null ? Settings.empty() : settings);
        return state;
    }
}
