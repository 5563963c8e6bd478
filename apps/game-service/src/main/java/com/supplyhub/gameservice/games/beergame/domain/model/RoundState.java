package com.supplyhub.gameservice.games.beergame.domain.model;

import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import lombok.Data;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 单局游戏的权威运行时状态。
 * <p>
 * playersFinished 在回合内只增不减，只在进入新回合时归零；
 * 只有 playersFinished == players 时才触发回合结算。
 * roundOrders：本回合各玩家下的订单（含 NIL 键下的外部需求）；
 * sentOrders：本回合各玩家发出的货（含 NIL 键下的外部供给）。
 */
@Data
public class RoundState {

    private long round;
    private int players;
    private int playersFinished;
    /** 本回合已提交的玩家，防止同一玩家重复提交把计数推满 */
    private Set<UUID> submittedPlayers = new HashSet<>();
    private Map<UUID, UserState> usersStates = new TreeMap<>();
    private Map<UUID, Order> roundOrders = new TreeMap<>();
    private Map<UUID, Order> sentOrders = new TreeMap<>();
    private Map<UUID, Integer> playerClasses = new TreeMap<>();
    private Settings settings = Settings.empty();
    private Flow flow;
    private long demand;
    private long supply;

    /** 大厅创建时的空状态 */
    public static RoundState empty() {
        return new RoundState();
    }

    /**
     * 深拷贝：所有提交 / 结算都在拷贝上进行，成功后整体替换。
     */
    public RoundState copy() {
        RoundState c = new RoundState();
        c.round = round;
        c.players = players;
        c.playersFinished = playersFinished;
        c.submittedPlayers = new HashSet<>(submittedPlayers);
        Map<UUID, UserState> users = new TreeMap<>();
        usersStates.forEach((id, u) -> users.put(id, u.copy()));
        c.usersStates = users;
        c.roundOrders = new TreeMap<>(roundOrders);
        c.sentOrders = new TreeMap<>(sentOrders);
        c.playerClasses = new TreeMap<>(playerClasses);
        c.settings = settings;
        c.flow = flow;
        c.demand = demand;
        c.supply = supply;
        return c;
    }

    public boolean allPlayersFinished() {
        return players > 0 && playersFinished == players;
    }

    public UserState requireUser(UUID playerId) {
        UserState user = usersStates.get(playerId);
        if (user == null) {
            throw new GameException(GameErrorCode.PLAYER_STATE_MISSING, "缺少玩家状态: " + playerId);
        }
        return user;
    }

    public int requireClass(UUID playerId) {
        Integer playerClass = playerClasses.get(playerId);
        if (playerClass == null) {
            throw new GameException(GameErrorCode.CLASS_NOT_ASSIGNED, "玩家未分配职业: " + playerId);
        }
        return playerClass;
    }
}
