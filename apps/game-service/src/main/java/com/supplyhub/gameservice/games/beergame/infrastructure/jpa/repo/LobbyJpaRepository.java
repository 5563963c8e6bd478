package com.supplyhub.gameservice.games.beergame.infrastructure.jpa.repo;

import com.supplyhub.gameservice.games.beergame.infrastructure.jpa.entity.LobbyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * 大厅 Repository（引擎只改开局/结束标记，设置改写走实体保存）。
 */
@Repository
public interface LobbyJpaRepository extends JpaRepository<LobbyEntity, UUID> {

    @Modifying
    @Query("UPDATE LobbyEntity l SET l.started = true WHERE l.id = :id")
    int markStarted(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE LobbyEntity l SET l.finished = true WHERE l.id = :id")
    int markFinished(@Param("id") UUID id);
}
