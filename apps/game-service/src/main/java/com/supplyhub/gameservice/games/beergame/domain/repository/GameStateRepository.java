package com.supplyhub.gameservice.games.beergame.domain.repository;

import com.supplyhub.gameservice.games.beergame.domain.dto.GameStateSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 回合快照仓库：一回合一行，只追加。
 * 读写失败统一抛出持久化类 GameException。
 */
public interface GameStateRepository {

    void append(GameStateSnapshot snapshot);

    /** 最新一行（恢复用） */
    Optional<GameStateSnapshot> findLatest(UUID lobbyId);

    Optional<GameStateSnapshot> findByRound(UUID lobbyId, long round);

    /** 按回合升序的全部行（统计用） */
    List<GameStateSnapshot> findAllOrdered(UUID lobbyId);
}
