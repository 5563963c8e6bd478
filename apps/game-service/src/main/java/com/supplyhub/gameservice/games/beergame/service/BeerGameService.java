package com.supplyhub.gameservice.games.beergame.service;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbySubscription;
import com.supplyhub.gameservice.games.beergame.domain.enums.LobbyPhase;
import com.supplyhub.gameservice.games.beergame.domain.enums.UserStatsType;
import com.supplyhub.gameservice.games.beergame.domain.model.GameUpdate;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 啤酒游戏引擎对传输层暴露的操作。
 * 失败统一抛出 GameException（错误码 + 可读消息），不会留下部分写入。
 */
public interface BeerGameService {

    /** 为已存在的大厅注册运行时状态与广播；大厅已开局时从最新快照恢复 */
    void openLobby(UUID lobbyId);

    /** 广播 KickAll 并移除运行时状态（快照保留） */
    void closeLobby(UUID lobbyId);

    /**
     * 开局：按名单顺序建立供应链，初始化各玩家账本，写入第 0 回合快照并广播。
     * classes 为空时使用开局前通过 {@link #updatePlayerClasses} 保存的分配。
     */
    void startGame(UUID lobbyId, List<UUID> roster, Map<UUID, Integer> classes);

    /** 提交本回合订单；最后一名玩家提交时同步完成回合结算 */
    void submitRoundEnd(UUID lobbyId, UUID playerId, long quantity);

    /** 开局前更新职业分配 */
    void updatePlayerClasses(UUID lobbyId, Map<UUID, Integer> assignments);

    /** 订阅大厅广播（有界缓冲，落后会丢最旧消息） */
    LobbySubscription subscribe(UUID lobbyId);

    /** 回放全部快照得到的统计：统计名 → 玩家 → 按回合序列 */
    Map<String, Map<UUID, List<Long>>> getPlayerStats(UUID lobbyId, Collection<UserStatsType> kinds);

    /** 当前完整视图（断线重连 / 丢消息后重新同步） */
    GameUpdate currentState(UUID lobbyId);

    LobbyPhase getPhase(UUID lobbyId);

    /** 传输层检测到断线：清除玩家的大厅关联并广播离开 */
    void disconnect(UUID playerId);
}
