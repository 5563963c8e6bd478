package com.supplyhub.gameservice.games.beergame.support;

import com.supplyhub.gameservice.games.beergame.domain.dto.GameStateSnapshot;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.domain.repository.GameStateRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 内存版快照仓库；failWrites 打开后 append 抛出持久化错误
 */
public class InMemoryGameStateRepository implements GameStateRepository {

    private final List<GameStateSnapshot> rows = new ArrayList<>();
    private boolean failWrites;

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    @Override
    public synchronized void append(GameStateSnapshot snapshot) {
        if (failWrites) {
            throw new GameException(GameErrorCode.SNAPSHOT_WRITE_FAILED, "模拟写入失败");
        }
        rows.add(snapshot);
    }

    @Override
    public synchronized Optional<GameStateSnapshot> findLatest(UUID lobbyId) {
        return rows.stream()
                .filter(s -> s.lobbyId().equals(lobbyId))
                .max(Comparator.comparingLong(GameStateSnapshot::round));
    }

    @Override
    public synchronized Optional<GameStateSnapshot> findByRound(UUID lobbyId, long round) {
        return rows.stream()
                .filter(s -> s.lobbyId().equals(lobbyId) && s.round() == round)
                .findFirst();
    }

    @Override
    public synchronized List<GameStateSnapshot> findAllOrdered(UUID lobbyId) {
        return rows.stream()
                .filter(s -> s.lobbyId().equals(lobbyId))
                .sorted(Comparator.comparingLong(GameStateSnapshot::round))
                .toList();
    }

    public synchronized int size() {
        return rows.size();
    }
}
