package com.supplyhub.gameservice.games.beergame.service.impl;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEvent;
import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEventBus;
import com.supplyhub.gameservice.games.beergame.application.bus.LobbySubscription;
import com.supplyhub.gameservice.games.beergame.application.event.GameEventProcessor;
import com.supplyhub.gameservice.games.beergame.application.registry.LobbyRegistry;
import com.supplyhub.gameservice.games.beergame.application.registry.LobbySession;
import com.supplyhub.gameservice.games.beergame.application.stats.PlayerStatsService;
import com.supplyhub.gameservice.games.beergame.config.BeerGameProperties;
import com.supplyhub.gameservice.games.beergame.domain.constants.GameMessages;
import com.supplyhub.gameservice.games.beergame.domain.dto.GameStateSnapshot;
import com.supplyhub.gameservice.games.beergame.domain.dto.PlayerLobbyBinding;
import com.supplyhub.gameservice.games.beergame.domain.enums.LobbyPhase;
import com.supplyhub.gameservice.games.beergame.domain.enums.UserStatsType;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.domain.model.GameEnd;
import com.supplyhub.gameservice.games.beergame.domain.model.GameEvents;
import com.supplyhub.gameservice.games.beergame.domain.model.GameUpdate;
import com.supplyhub.gameservice.games.beergame.domain.model.LobbyConfig;
import com.supplyhub.gameservice.games.beergame.domain.model.RoundState;
import com.supplyhub.gameservice.games.beergame.domain.repository.GameStateRepository;
import com.supplyhub.gameservice.games.beergame.domain.repository.LobbyRepository;
import com.supplyhub.gameservice.games.beergame.domain.repository.PlayerLobbyRepository;
import com.supplyhub.gameservice.games.beergame.domain.rule.RoundRules;
import com.supplyhub.gameservice.games.beergame.domain.rule.SubmissionResult;
import com.supplyhub.gameservice.games.beergame.service.BeerGameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 啤酒游戏引擎服务实现。
 * <p>
 * 并发模型：每个大厅一把锁（见 {@link LobbySession}）。提交在状态拷贝上执行，
 * 回合结算时先写快照再替换内存状态，写失败则内存状态保持在上一次提交的样子。
 * 广播在状态替换之后、仍持锁时发出，保证同一大厅内的消息顺序与状态顺序一致。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BeerGameServiceImpl implements BeerGameService {

    private final LobbyRegistry registry;
    private final LobbyRepository lobbyRepository;
    private final GameStateRepository gameStateRepository;
    private final PlayerLobbyRepository playerLobbyRepository;
    private final GameEventProcessor eventProcessor;
    private final PlayerStatsService statsService;
    private final TransactionOperations transactionOperations;
    private final BeerGameProperties properties;

    // ================== 大厅生命周期 ==================

    @Override
    public void openLobby(UUID lobbyId) {
        LobbyConfig lobby = requireLobby(lobbyId);
        LobbySession session = registry.open(lobbyId, properties.backlogFor(lobby.maxPlayers()));
        if (!lobby.started()) {
            return;
        }
        try {
            restoreFromSnapshot(session, lobby);
        } catch (GameException e) {
            // 恢复失败的大厅不保留半初始化的运行时状态
            if (session.getPhase() == LobbyPhase.NOT_STARTED) {
                registry.remove(lobbyId);
            }
            throw e;
        }
    }

    private void restoreFromSnapshot(LobbySession session, LobbyConfig lobby) {
        UUID lobbyId = lobby.id();
        session.runWithLock(() -> {
            if (session.getPhase() != LobbyPhase.NOT_STARTED) {
                return;
            }
            GameStateSnapshot latest = gameStateRepository.findLatest(lobbyId)
                    .orElseThrow(() -> new GameException(GameErrorCode.LOBBY_STATE_MISSING,
                            "大厅已开局但没有任何回合快照: " + lobbyId));
            RoundState restored = latest.toRoundState(lobby.settings());
            session.commit(restored);
            session.setPhase(lobby.finished() || RoundRules.isGameOver(restored)
                    ? LobbyPhase.FINISHED : LobbyPhase.ACTIVE);
            log.info("已从快照恢复大厅: lobbyId={}, round={}, players={}, phase={}",
                    lobbyId, restored.getRound(), restored.getPlayers(), session.getPhase());
        });
    }

    @Override
    public void closeLobby(UUID lobbyId) {
        registry.find(lobbyId).ifPresent(session -> session.runWithLock(() ->
                session.getBus().publish(new LobbyEvent.KickAll(GameMessages.LOBBY_CLOSED))));
        registry.remove(lobbyId);
    }

    // ================== 开局 ==================

    @Override
    public void startGame(UUID lobbyId, List<UUID> roster, Map<UUID, Integer> classes) {
        LobbyConfig lobby = requireLobby(lobbyId);
        LobbySession session = registry.open(lobbyId, properties.backlogFor(lobby.maxPlayers()));
        session.runWithLock(() -> {
            if (lobby.started() || session.getPhase() != LobbyPhase.NOT_STARTED) {
                throw new GameException(GameErrorCode.GAME_ALREADY_STARTED, GameMessages.GAME_ALREADY_STARTED);
            }
            Map<UUID, Integer> assignment = (classes == null || classes.isEmpty())
                    ? session.getPendingClasses() : classes;
            RoundState initial = RoundRules.initialState(lobby.settings(), roster, assignment);

            // 第 0 回合快照与开局标记同一事务
            transactionOperations.executeWithoutResult(status -> {
                gameStateRepository.append(GameStateSnapshot.of(lobbyId, initial));
                lobbyRepository.markStarted(lobbyId);
            });

            session.commit(initial);
            session.setPhase(LobbyPhase.ACTIVE);
            bindPlayers(lobbyId, roster);
            session.getBus().publish(new LobbyEvent.GameStarted(GameUpdate.of(initial)));
            log.info("游戏开始: lobbyId={}, players={}, demand={}, supply={}, maxRounds={}",
                    lobbyId, initial.getPlayers(), initial.getDemand(), initial.getSupply(),
                    initial.getSettings().maxRounds());
        });
    }

    @Override
    public void updatePlayerClasses(UUID lobbyId, Map<UUID, Integer> assignments) {
        LobbySession session = registry.require(lobbyId);
        session.runWithLock(() -> {
            if (session.getPhase() != LobbyPhase.NOT_STARTED) {
                throw new GameException(GameErrorCode.GAME_ALREADY_STARTED, GameMessages.GAME_ALREADY_STARTED);
            }
            session.setPendingClasses(assignments == null ? Map.of() : assignments);
            session.getBus().publish(new LobbyEvent.ClassesUpdated(new TreeMap<>(session.getPendingClasses())));
            log.debug("职业分配已更新: lobbyId={}, classes={}", lobbyId, session.getPendingClasses());
        });
    }

    // ================== 回合 ==================

    @Override
    public void submitRoundEnd(UUID lobbyId, UUID playerId, long quantity) {
        LobbySession session = registry.require(lobbyId);
        session.runWithLock(() -> {
            requireActive(session);
            RoundState working = session.getRoundState().copy();
            SubmissionResult result = RoundRules.applySubmission(working, playerId, quantity);
            log.debug("回合提交已受理: lobbyId={}, round={}, playerId={}, quantity={}, finished={}/{}",
                    lobbyId, working.getRound(), playerId, quantity,
                    working.getPlayersFinished(), working.getPlayers());

            if (!result.roundComplete()) {
                session.commit(working);
                session.getBus().publish(new LobbyEvent.Ack(playerId));
                return;
            }
            finishRound(session, working, playerId);
        });
    }

    /**
     * 回合结算：快照写入成功才替换内存状态
     */
    private void finishRound(LobbySession session, RoundState working, UUID lastPlayer) {
        UUID lobbyId = session.getLobbyId();
        LobbyEventBus bus = session.getBus();
        long finishedRound = working.getRound();
        try {
            RoundRules.finishRound(working);
            gameStateRepository.append(GameStateSnapshot.of(lobbyId, working));
        } catch (GameException e) {
            log.error("回合结算失败，内存状态未推进: lobbyId={}, round={}, code={}",
                    lobbyId, finishedRound, e.getCode(), e);
            bus.publish(new LobbyEvent.LobbyError(e.getCode(), GameMessages.ROUND_FINISH_FAILED));
            throw e;
        }

        session.commit(working);
        bus.publish(new LobbyEvent.Ack(lastPlayer));
        bus.publish(new LobbyEvent.RoundEnded(finishedRound));
        log.info("回合结算完成: lobbyId={}, round={} -> {}, demand={}, supply={}",
                lobbyId, finishedRound, working.getRound(), working.getDemand(), working.getSupply());

        if (RoundRules.isGameOver(working)) {
            finishGame(session, working);
        } else {
            startNextRound(session);
        }
    }

    /**
     * 新回合：处理事件 → 计数归零、清空订单表 → 广播新回合。
     * 事件处理失败时丢弃本轮事件效果并广播错误，新回合照常开始。
     */
    private void startNextRound(LobbySession session) {
        UUID lobbyId = session.getLobbyId();
        RoundState next = session.getRoundState().copy();
        List<LobbyEvent> outbox = new ArrayList<>();
        try {
            GameEvents events = requireLobby(lobbyId).events();
            int fired = eventProcessor.process(lobbyId, next, events, outbox::add);
            if (fired > 0) {
                log.info("回合事件触发: lobbyId={}, round={}, fired={}", lobbyId, next.getRound(), fired);
            }
        } catch (RuntimeException e) {
            GameErrorCode code = e instanceof GameException ge ? ge.getCode() : GameErrorCode.EVENT_PROCESSING_FAILED;
            log.error("回合事件处理失败，已丢弃本轮事件效果: lobbyId={}, round={}, code={}",
                    lobbyId, next.getRound(), code, e);
            next = session.getRoundState().copy();
            outbox.clear();
            outbox.add(new LobbyEvent.LobbyError(code, GameMessages.EVENT_PROCESSING_FAILED));
        }

        RoundRules.resetForNewRound(next);
        session.commit(next);
        outbox.forEach(session.getBus()::publish);
        session.getBus().publish(new LobbyEvent.RoundStarted(GameUpdate.of(next)));
    }

    private void finishGame(LobbySession session, RoundState state) {
        UUID lobbyId = session.getLobbyId();
        LobbyEventBus bus = session.getBus();
        session.setPhase(LobbyPhase.FINISHED);

        Map<String, Map<UUID, List<Long>>> stats = Map.of();
        try {
            lobbyRepository.markFinished(lobbyId);
            stats = statsService.collect(lobbyId, PlayerStatsService.GAME_END_STATS);
        } catch (GameException e) {
            log.error("终局收尾失败: lobbyId={}, code={}", lobbyId, e.getCode(), e);
            bus.publish(new LobbyEvent.LobbyError(e.getCode(), e.getMessage()));
        }
        bus.publish(new LobbyEvent.GameEnded(new GameEnd(GameUpdate.of(state).playerStates(), stats)));
        log.info("游戏结束: lobbyId={}, rounds={}", lobbyId, state.getRound());
    }

    // ================== 查询 / 订阅 ==================

    @Override
    public LobbySubscription subscribe(UUID lobbyId) {
        return registry.require(lobbyId).getBus().subscribe();
    }

    @Override
    public Map<String, Map<UUID, List<Long>>> getPlayerStats(UUID lobbyId, Collection<UserStatsType> kinds) {
        LobbyConfig lobby = requireLobby(lobbyId);
        if (!lobby.started()) {
            throw new GameException(GameErrorCode.GAME_NOT_STARTED, GameMessages.GAME_NOT_STARTED);
        }
        Collection<UserStatsType> requested = (kinds == null || kinds.isEmpty())
                ? Arrays.asList(UserStatsType.values()) : kinds;
        return statsService.collect(lobbyId, requested);
    }

    @Override
    public GameUpdate currentState(UUID lobbyId) {
        LobbySession session = registry.require(lobbyId);
        return session.withLock(() -> GameUpdate.of(session.getRoundState()));
    }

    @Override
    public LobbyPhase getPhase(UUID lobbyId) {
        LobbySession session = registry.require(lobbyId);
        return session.withLock(session::getPhase);
    }

    // ================== 断线 ==================

    @Override
    public void disconnect(UUID playerId) {
        Optional<PlayerLobbyBinding> binding = playerLobbyRepository.find(playerId);
        if (binding.isEmpty()) {
            log.debug("断线玩家没有大厅关联: playerId={}", playerId);
            return;
        }
        UUID lobbyId = binding.get().getLobbyId();
        playerLobbyRepository.clear(playerId);
        registry.find(lobbyId).ifPresent(session ->
                session.getBus().publish(new LobbyEvent.PlayerDisconnected(playerId)));
        log.info("玩家断线: playerId={}, lobbyId={}", playerId, lobbyId);
    }

    // ================== 工具 ==================

    private LobbyConfig requireLobby(UUID lobbyId) {
        return lobbyRepository.findById(lobbyId)
                .orElseThrow(() -> new GameException(GameErrorCode.LOBBY_NOT_FOUND,
                        GameMessages.formatLobbyNotFound(lobbyId)));
    }

    private static void requireActive(LobbySession session) {
        switch (session.getPhase()) {
            case NOT_STARTED -> throw new GameException(GameErrorCode.GAME_NOT_STARTED, GameMessages.GAME_NOT_STARTED);
            case FINISHED -> throw new GameException(GameErrorCode.GAME_FINISHED, GameMessages.GAME_FINISHED);
            default -> {
            }
        }
    }

    /**
     * 记录玩家 → 大厅关联，供断线处理定位大厅；失败不影响已提交的开局
     */
    private void bindPlayers(UUID lobbyId, List<UUID> roster) {
        for (UUID player : roster) {
            try {
                playerLobbyRepository.bind(player, lobbyId);
            } catch (RuntimeException e) {
                log.warn("记录玩家大厅关联失败: playerId={}, lobbyId={}", player, lobbyId, e);
            }
        }
    }
}
