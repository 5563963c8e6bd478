package com.supplyhub.gameservice.games.beergame.service.impl;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEvent;
import com.supplyhub.gameservice.games.beergame.application.bus.LobbySubscription;
import com.supplyhub.gameservice.games.beergame.application.event.GameEventProcessor;
import com.supplyhub.gameservice.games.beergame.application.registry.LobbyRegistry;
import com.supplyhub.gameservice.games.beergame.application.stats.PlayerStatsService;
import com.supplyhub.gameservice.games.beergame.config.BeerGameProperties;
import com.supplyhub.gameservice.games.beergame.domain.constants.GameMessages;
import com.supplyhub.gameservice.games.beergame.domain.enums.ActionTarget;
import com.supplyhub.gameservice.games.beergame.domain.enums.LobbyPhase;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.domain.model.EventAction;
import com.supplyhub.gameservice.games.beergame.domain.model.EventCondition;
import com.supplyhub.gameservice.games.beergame.domain.model.GameEvent;
import com.supplyhub.gameservice.games.beergame.domain.model.GameEvents;
import com.supplyhub.gameservice.games.beergame.domain.model.GameUpdate;
import com.supplyhub.gameservice.games.beergame.domain.model.Settings;
import com.supplyhub.gameservice.games.beergame.support.InMemoryGameStateRepository;
import com.supplyhub.gameservice.games.beergame.support.InMemoryLobbyRepository;
import com.supplyhub.gameservice.games.beergame.support.InMemoryPlayerLobbyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.A;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.B;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.C;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.LOBBY;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.classOne;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.lobby;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.settings;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class BeerGameServiceImplTest {

    private static final String ROUND_ONE_MESSAGE = "第一回合结束，请关注库存";

    private InMemoryLobbyRepository lobbies;
    private InMemoryGameStateRepository snapshots;
    private InMemoryPlayerLobbyRepository bindings;
    private BeerGameServiceImpl service;

    @BeforeEach
    void setUp() {
        lobbies = spy(new InMemoryLobbyRepository());
        snapshots = new InMemoryGameStateRepository();
        bindings = new InMemoryPlayerLobbyRepository();
        service = newService();
    }

    private BeerGameServiceImpl newService() {
        return new BeerGameServiceImpl(new LobbyRegistry(List.of()), lobbies, snapshots, bindings,
                new GameEventProcessor(snapshots, lobbies), new PlayerStatsService(snapshots),
                TransactionOperations.withoutTransaction(), new BeerGameProperties());
    }

    private static GameEvents roundOneNotice() {
        return new GameEvents(List.of(new GameEvent("回合提示", new EventCondition.RoundMet(1L),
                List.of(new EventAction.ShowMessage(ROUND_ONE_MESSAGE, ActionTarget.ALL_PLAYERS)), false)));
    }

    private LobbySubscription startTwoPlayerGame(long maxRounds, GameEvents events) {
        lobbies.save(lobby(settings(maxRounds), events));
        service.openLobby(LOBBY);
        LobbySubscription sub = service.subscribe(LOBBY);
        service.startGame(LOBBY, List.of(A, B), classOne(A, B));
        return sub;
    }

    private static List<String> types(List<LobbyEvent> events) {
        return events.stream().map(LobbyEvent::type).toList();
    }

    @Test
    void fullGameCascade() {
        LobbySubscription sub = startTwoPlayerGame(2, roundOneNotice());
        assertEquals(List.of("GAME_START"), types(sub.drain()));
        assertEquals(1, snapshots.size());
        assertTrue(lobbies.findById(LOBBY).orElseThrow().started());

        service.submitRoundEnd(LOBBY, A, 5L);
        assertEquals(List.of(new LobbyEvent.Ack(A)), sub.drain());
        assertEquals(0L, service.currentState(LOBBY).round());

        service.submitRoundEnd(LOBBY, B, 3L);
        List<LobbyEvent> boundary = sub.drain();
        assertEquals(List.of("ACK", "ROUND_END", "POP_UP", "ROUND_START"), types(boundary));
        assertEquals(new LobbyEvent.RoundEnded(0L), boundary.get(1));
        assertEquals(new LobbyEvent.PopUpAll(ROUND_ONE_MESSAGE), boundary.get(2));

        GameUpdate round1 = service.currentState(LOBBY);
        assertEquals(1L, round1.round());
        assertEquals(977L, round1.playerStates().get(A).getMoney());
        assertEquals(981L, round1.playerStates().get(B).getMoney());
        assertTrue(round1.roundOrders().isEmpty());
        assertEquals(2, snapshots.size());

        service.submitRoundEnd(LOBBY, A, 0L);
        service.submitRoundEnd(LOBBY, B, 0L);
        List<LobbyEvent> end = sub.drain();
        assertEquals(List.of("ACK", "ACK", "ROUND_END", "GAME_END"), types(end));

        LobbyEvent.GameEnded gameEnded = assertInstanceOf(LobbyEvent.GameEnded.class, end.get(3));
        assertEquals(List.of(1000L, 977L, 965L), gameEnded.result().stats().get("money").get(A));
        assertEquals(969L, gameEnded.result().playerStates().get(B).getMoney());
        assertEquals(LobbyPhase.FINISHED, service.getPhase(LOBBY));
        assertTrue(lobbies.findById(LOBBY).orElseThrow().finished());

        GameException late = assertThrows(GameException.class, () -> service.submitRoundEnd(LOBBY, A, 1L));
        assertEquals(GameErrorCode.GAME_FINISHED, late.getCode());
    }

    @Test
    void failedSnapshotWriteKeepsRoundUnadvanced() {
        LobbySubscription sub = startTwoPlayerGame(5, GameEvents.none());
        sub.drain();

        service.submitRoundEnd(LOBBY, A, 5L);
        snapshots.setFailWrites(true);
        GameException e = assertThrows(GameException.class, () -> service.submitRoundEnd(LOBBY, B, 3L));
        assertEquals(GameErrorCode.SNAPSHOT_WRITE_FAILED, e.getCode());

        GameUpdate state = service.currentState(LOBBY);
        assertEquals(0L, state.round());
        assertEquals(1000L, state.playerStates().get(B).getMoney());
        assertEquals(1, state.playerStates().get(B).getIncomingOrders().size());
        List<LobbyEvent> events = sub.drain();
        assertEquals(new LobbyEvent.LobbyError(GameErrorCode.SNAPSHOT_WRITE_FAILED, GameMessages.ROUND_FINISH_FAILED),
                events.get(events.size() - 1));

        snapshots.setFailWrites(false);
        service.submitRoundEnd(LOBBY, B, 3L);
        assertEquals(1L, service.currentState(LOBBY).round());
        assertEquals(2, snapshots.size());
    }

    @Test
    void rejectedSubmissionPublishesNothing() {
        LobbySubscription sub = startTwoPlayerGame(5, GameEvents.none());
        sub.drain();

        GameException e = assertThrows(GameException.class, () -> service.submitRoundEnd(LOBBY, A, 500L));

        assertEquals(GameErrorCode.INSUFFICIENT_MONEY, e.getCode());
        assertTrue(sub.drain().isEmpty());
        assertEquals(1000L, service.currentState(LOBBY).playerStates().get(A).getMoney());
    }

    @Test
    void eventFailureStillStartsNextRound() {
        Settings changed = settings(5).toBuilder().resourceBasicPrice(9L).build();
        GameEvents events = new GameEvents(List.of(new GameEvent("改设置", new EventCondition.RoundMet(1L),
                List.of(new EventAction.ChangeSettings(changed)), false)));
        doThrow(new GameException(GameErrorCode.LOBBY_WRITE_FAILED)).when(lobbies).updateSettings(any(), any());
        LobbySubscription sub = startTwoPlayerGame(5, events);
        sub.drain();

        service.submitRoundEnd(LOBBY, A, 1L);
        service.submitRoundEnd(LOBBY, B, 1L);

        List<LobbyEvent> after = sub.drain();
        assertEquals(List.of("ACK", "ACK", "ROUND_END", "ERROR", "ROUND_START"), types(after));
        assertEquals(new LobbyEvent.LobbyError(GameErrorCode.LOBBY_WRITE_FAILED, GameMessages.EVENT_PROCESSING_FAILED),
                after.get(3));
        GameUpdate state = service.currentState(LOBBY);
        assertEquals(1L, state.round());
        assertEquals(1L, state.settings().resourceBasicPrice());
    }

    private static GameEvents twoPriceChanges() {
        Settings first = settings(5).toBuilder().resourceBasicPrice(7L).build();
        Settings second = settings(5).toBuilder().resourceBasicPrice(9L).build();
        return new GameEvents(List.of(
                new GameEvent("涨价", new EventCondition.RoundMet(1L), List.of(new EventAction.ChangeSettings(first)), false),
                new GameEvent("再涨价", new EventCondition.RoundMet(1L), List.of(new EventAction.ChangeSettings(second)), false)));
    }

    @Test
    void storedAndLiveSettingsAgreeAfterEventPass() {
        LobbySubscription sub = startTwoPlayerGame(5, twoPriceChanges());
        sub.drain();

        service.submitRoundEnd(LOBBY, A, 1L);
        service.submitRoundEnd(LOBBY, B, 1L);

        assertEquals(9L, service.currentState(LOBBY).settings().resourceBasicPrice());
        assertEquals(9L, lobbies.findById(LOBBY).orElseThrow().settings().resourceBasicPrice());
    }

    @Test
    void storedAndLiveSettingsAgreeAfterFailedSettingsWrite() {
        doThrow(new GameException(GameErrorCode.LOBBY_WRITE_FAILED)).when(lobbies).updateSettings(any(), any());
        LobbySubscription sub = startTwoPlayerGame(5, twoPriceChanges());
        sub.drain();

        service.submitRoundEnd(LOBBY, A, 1L);
        service.submitRoundEnd(LOBBY, B, 1L);

        assertEquals(1L, service.currentState(LOBBY).round());
        assertEquals(1L, service.currentState(LOBBY).settings().resourceBasicPrice());
        assertEquals(1L, lobbies.findById(LOBBY).orElseThrow().settings().resourceBasicPrice());

        // 重启后从大厅记录恢复，设置不变
        BeerGameServiceImpl restarted = newService();
        restarted.openLobby(LOBBY);
        assertEquals(1L, restarted.currentState(LOBBY).settings().resourceBasicPrice());
    }

    @Test
    void lifecycleGuards() {
        GameException missing = assertThrows(GameException.class, () -> service.openLobby(LOBBY));
        assertEquals(GameErrorCode.LOBBY_NOT_FOUND, missing.getCode());

        lobbies.save(lobby(settings(5), GameEvents.none()));
        service.openLobby(LOBBY);
        assertEquals(LobbyPhase.NOT_STARTED, service.getPhase(LOBBY));
        assertEquals(GameErrorCode.GAME_NOT_STARTED,
                assertThrows(GameException.class, () -> service.submitRoundEnd(LOBBY, A, 1L)).getCode());
        assertEquals(GameErrorCode.GAME_NOT_STARTED,
                assertThrows(GameException.class, () -> service.getPlayerStats(LOBBY, null)).getCode());

        service.startGame(LOBBY, List.of(A, B), classOne(A, B));
        assertEquals(GameErrorCode.GAME_ALREADY_STARTED,
                assertThrows(GameException.class, () -> service.startGame(LOBBY, List.of(A, B), classOne(A, B))).getCode());
        assertEquals(GameErrorCode.GAME_ALREADY_STARTED,
                assertThrows(GameException.class, () -> service.updatePlayerClasses(LOBBY, classOne(A))).getCode());
    }

    @Test
    void failedStartExposesNothing() {
        lobbies.save(lobby(settings(5), GameEvents.none()));
        service.openLobby(LOBBY);

        GameException e = assertThrows(GameException.class,
                () -> service.startGame(LOBBY, List.of(A, B), Map.of(A, 1)));

        assertEquals(GameErrorCode.CLASS_NOT_ASSIGNED, e.getCode());
        assertEquals(LobbyPhase.NOT_STARTED, service.getPhase(LOBBY));
        assertEquals(0, snapshots.size());
        assertFalse(lobbies.findById(LOBBY).orElseThrow().started());
    }

    @Test
    void pendingClassesUsedWhenStartOmitsThem() {
        lobbies.save(lobby(settings(5), GameEvents.none()));
        service.openLobby(LOBBY);
        LobbySubscription sub = service.subscribe(LOBBY);

        service.updatePlayerClasses(LOBBY, classOne(A, B));
        service.startGame(LOBBY, List.of(A, B), null);

        assertEquals(List.of("CLASSES_UPDATE", "GAME_START"), types(sub.drain()));
        assertEquals(Map.of(A, 1, B, 1), service.currentState(LOBBY).playerClasses());
    }

    @Test
    void disconnectClearsBindingAndNotifiesLobby() {
        LobbySubscription sub = startTwoPlayerGame(5, GameEvents.none());
        sub.drain();
        assertTrue(bindings.find(A).isPresent());

        service.disconnect(A);
        service.disconnect(C);

        assertEquals(List.of(new LobbyEvent.PlayerDisconnected(A)), sub.drain());
        assertTrue(bindings.find(A).isEmpty());
        assertTrue(bindings.find(B).isPresent());
    }

    @Test
    void closeLobbyKicksEveryone() {
        LobbySubscription sub = startTwoPlayerGame(5, GameEvents.none());
        sub.drain();

        service.closeLobby(LOBBY);

        assertTrue(sub.isClosed());
        assertEquals(List.of(new LobbyEvent.KickAll(GameMessages.LOBBY_CLOSED)), sub.drain());
        assertEquals(GameErrorCode.LOBBY_NOT_FOUND,
                assertThrows(GameException.class, () -> service.subscribe(LOBBY)).getCode());
    }

    @Test
    void statsDefaultToAllKinds() {
        startTwoPlayerGame(5, GameEvents.none());
        Map<String, Map<UUID, List<Long>>> stats = service.getPlayerStats(LOBBY, List.of());
        assertEquals(7, stats.size());
        assertEquals(List.of(1000L), stats.get("money").get(A));
    }
}
