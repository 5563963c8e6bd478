package com.supplyhub.gameservice.games.beergame.infrastructure.jpa;

import com.supplyhub.gameservice.games.beergame.domain.dto.GameStateSnapshot;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.domain.repository.GameStateRepository;
import com.supplyhub.gameservice.games.beergame.infrastructure.jpa.entity.GameStateEntity;
import com.supplyhub.gameservice.games.beergame.infrastructure.jpa.repo.GameStateJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 基于 PostgreSQL（jsonb）的回合快照仓库
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaGameStateRepository implements GameStateRepository {

    private final GameStateJpaRepository jpa;

    @Override
    @Transactional
    public void append(GameStateSnapshot snapshot) {
        try {
            jpa.saveAndFlush(toEntity(snapshot));
        } catch (DataAccessException e) {
            log.error("写入回合快照失败: lobbyId={}, round={}", snapshot.lobbyId(), snapshot.round(), e);
            throw new GameException(GameErrorCode.SNAPSHOT_WRITE_FAILED,
                    "回合快照写入失败: round=" + snapshot.round(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GameStateSnapshot> findLatest(UUID lobbyId) {
        try {
            return jpa.findFirstByLobbyIdOrderByRoundDesc(lobbyId).map(JpaGameStateRepository::toSnapshot);
        } catch (DataAccessException e) {
            throw readFailed(lobbyId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GameStateSnapshot> findByRound(UUID lobbyId, long round) {
        try {
            return jpa.findByLobbyIdAndRound(lobbyId, round).map(JpaGameStateRepository::toSnapshot);
        } catch (DataAccessException e) {
            throw readFailed(lobbyId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<GameStateSnapshot> findAllOrdered(UUID lobbyId) {
        try {
            return jpa.findAllByLobbyOrdered(lobbyId).stream().map(JpaGameStateRepository::toSnapshot).toList();
        } catch (DataAccessException e) {
            throw readFailed(lobbyId, e);
        }
    }

    private static GameException readFailed(UUID lobbyId, DataAccessException e) {
        log.error("读取回合快照失败: lobbyId={}", lobbyId, e);
        return new GameException(GameErrorCode.SNAPSHOT_READ_FAILED, "回合快照读取失败: lobbyId=" + lobbyId, e);
    }

    static GameStateEntity toEntity(GameStateSnapshot s) {
        return GameStateEntity.builder()
                .lobbyId(s.lobbyId())
                .round(s.round())
                .userStates(s.userStates())
                .roundOrders(s.roundOrders())
                .sendOrders(s.sentOrders())
                .playersClasses(s.playerClasses())
                .flow(s.flow())
                .demand(s.demand())
                .supply(s.supply())
                .build();
    }

    static GameStateSnapshot toSnapshot(GameStateEntity e) {
        return new GameStateSnapshot(e.getLobbyId(), e.getRound(), e.getUserStates(), e.getRoundOrders(),
                e.getSendOrders(), e.getPlayersClasses(), e.getFlow(), e.getDemand(), e.getSupply());
    }
}
