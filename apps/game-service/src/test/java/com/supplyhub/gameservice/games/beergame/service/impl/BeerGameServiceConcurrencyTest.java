package com.supplyhub.gameservice.games.beergame.service.impl;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEvent;
import com.supplyhub.gameservice.games.beergame.application.bus.LobbySubscription;
import com.supplyhub.gameservice.games.beergame.application.event.GameEventProcessor;
import com.supplyhub.gameservice.games.beergame.application.registry.LobbyRegistry;
import com.supplyhub.gameservice.games.beergame.application.registry.LobbySession;
import com.supplyhub.gameservice.games.beergame.application.stats.PlayerStatsService;
import com.supplyhub.gameservice.games.beergame.config.BeerGameProperties;
import com.supplyhub.gameservice.games.beergame.domain.model.GameEvents;
import com.supplyhub.gameservice.games.beergame.domain.model.GameUpdate;
import com.supplyhub.gameservice.games.beergame.support.InMemoryGameStateRepository;
import com.supplyhub.gameservice.games.beergame.support.InMemoryLobbyRepository;
import com.supplyhub.gameservice.games.beergame.support.InMemoryPlayerLobbyRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.A;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.B;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.LOBBY;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.classOne;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.lobby;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.settings;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 同一大厅的并发提交串行化为一次回合推进；不同大厅互不阻塞
 */
class BeerGameServiceConcurrencyTest {

    private static final UUID OTHER_LOBBY = UUID.fromString("7b0c1f5e-2d4a-4c55-9a71-3c3b8f1d0a02");
    private static final int PLAYERS = 8;

    private InMemoryLobbyRepository lobbies;
    private InMemoryGameStateRepository snapshots;
    private LobbyRegistry registry;
    private BeerGameServiceImpl service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        lobbies = new InMemoryLobbyRepository();
        snapshots = new InMemoryGameStateRepository();
        registry = new LobbyRegistry(List.of());
        service = new BeerGameServiceImpl(registry, lobbies, snapshots, new InMemoryPlayerLobbyRepository(),
                new GameEventProcessor(snapshots, lobbies), new PlayerStatsService(snapshots),
                TransactionOperations.withoutTransaction(), new BeerGameProperties());
        executor = Executors.newFixedThreadPool(PLAYERS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static List<UUID> roster(int size) {
        List<UUID> players = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            players.add(new UUID(0L, i));
        }
        return players;
    }

    @Test
    void simultaneousSubmissionsProduceExactlyOneRoundTransition() throws Exception {
        List<UUID> players = roster(PLAYERS);
        lobbies.save(lobby(settings(5), GameEvents.none()));
        service.openLobby(LOBBY);
        LobbySubscription sub = service.subscribe(LOBBY);
        service.startGame(LOBBY, players, classOne(players.toArray(new UUID[0])));
        sub.drain();
        int snapshotsBefore = snapshots.size();

        CountDownLatch ready = new CountDownLatch(PLAYERS);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> submissions = new ArrayList<>();
        for (UUID player : players) {
            submissions.add(executor.submit(() -> {
                ready.countDown();
                go.await();
                service.submitRoundEnd(LOBBY, player, 1L);
                return null;
            }));
        }
        assertTrue(ready.await(5, TimeUnit.SECONDS));
        go.countDown();
        for (Future<?> f : submissions) {
            f.get(10, TimeUnit.SECONDS);
        }

        List<String> types = sub.drain().stream().map(LobbyEvent::type).toList();
        assertEquals(1, types.stream().filter("ROUND_END"::equals).count());
        assertEquals(1, types.stream().filter("ROUND_START"::equals).count());
        assertEquals(PLAYERS, types.stream().filter("ACK"::equals).count());
        assertEquals("ROUND_START", types.get(types.size() - 1));

        GameUpdate state = service.currentState(LOBBY);
        assertEquals(1L, state.round());
        assertEquals(snapshotsBefore + 1, snapshots.size());
        for (UUID player : players) {
            assertEquals(1, state.playerStates().get(player).getIncomingOrders().size());
        }
    }

    @Test
    void otherLobbyProgressesWhileFirstLobbyIsLocked() {
        lobbies.save(lobby(settings(5), GameEvents.none()));
        lobbies.save(lobby(settings(5), GameEvents.none()).toBuilder().id(OTHER_LOBBY).build());
        service.openLobby(LOBBY);
        service.openLobby(OTHER_LOBBY);
        service.startGame(LOBBY, List.of(A, B), classOne(A, B));
        service.startGame(OTHER_LOBBY, List.of(A, B), classOne(A, B));

        LobbySession first = registry.require(LOBBY);
        Future<?> blocked = first.withLock(() -> {
            Future<?> other = executor.submit(() -> {
                service.submitRoundEnd(OTHER_LOBBY, A, 1L);
                service.submitRoundEnd(OTHER_LOBBY, B, 1L);
            });
            assertDoesNotThrow(() -> other.get(5, TimeUnit.SECONDS));
            assertEquals(1L, service.currentState(OTHER_LOBBY).round());

            Future<?> waiting = executor.submit(() -> service.submitRoundEnd(LOBBY, A, 1L));
            assertThrows(TimeoutException.class, () -> waiting.get(200, TimeUnit.MILLISECONDS));
            return waiting;
        });

        assertDoesNotThrow(() -> blocked.get(5, TimeUnit.SECONDS));
        assertEquals(1, service.currentState(LOBBY).playerStates().get(A).getSentOrders().size());
        assertEquals(0L, service.currentState(LOBBY).round());
    }
}
