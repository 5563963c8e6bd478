package com.supplyhub.gameservice.games.beergame.infrastructure.jpa.repo;

import com.supplyhub.gameservice.games.beergame.infrastructure.jpa.entity.GameStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 回合快照 Repository。
 */
@Repository
public interface GameStateJpaRepository extends JpaRepository<GameStateEntity, UUID> {

    Optional<GameStateEntity> findFirstByLobbyIdOrderByRoundDesc(UUID lobbyId);

    Optional<GameStateEntity> findByLobbyIdAndRound(UUID lobbyId, long round);

    /**
     * 全部快照，按回合升序。
     */
    @Query("""
            SELECT g FROM GameStateEntity g
            WHERE g.lobbyId = :lobbyId
            ORDER BY g.round ASC
            """)
    List<GameStateEntity> findAllByLobbyOrdered(@Param("lobbyId") UUID lobbyId);
}
