package com.supplyhub.gameservice.games.beergame.infrastructure.jpa.entity;

import com.supplyhub.gameservice.games.beergame.domain.model.GameEvents;
import com.supplyhub.gameservice.games.beergame.domain.model.Settings;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.UUID;

/**
 * 大厅表实体：映射 lobby。
 * 大厅的创建、成员与口令由外部维护，这里只映射引擎需要的列。
 */
@Entity
@Table(name = "lobby")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LobbyEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", length = 100, nullable = false)
    private String name;

    @Column(name = "max_players", nullable = false)
    private int maxPlayers;

    @Column(name = "owner_id")
    private UUID ownerId;

    @Column(name = "started", nullable = false)
    private boolean started;

    @Column(name = "finished", nullable = false)
    private boolean finished;

    /**
     * 经济参数（jsonb）。
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "settings", columnDefinition = "jsonb")
    private Settings settings;

    /**
     * 事件规则（jsonb）。
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "events", columnDefinition = "jsonb")
    private GameEvents events;
}
