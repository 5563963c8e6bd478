package com.supplyhub.gameservice.games.beergame.infrastructure.jpa.entity;

import com.supplyhub.gameservice.games.beergame.domain.model.Flow;
import com.supplyhub.gameservice.games.beergame.domain.model.Order;
import com.supplyhub.gameservice.games.beergame.domain.model.UserState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * 回合快照表实体：映射 game_state。一回合一行，只追加不更新。
 */
@Entity
@Table(name = "game_state",
        uniqueConstraints = @UniqueConstraint(name = "uk_game_state_lobby_round", columnNames = {"lobby_id", "round"}),
        indexes = @Index(name = "idx_game_state_lobby", columnList = "lobby_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameStateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "lobby_id", nullable = false, updatable = false)
    private UUID lobbyId;

    @Column(name = "round", nullable = false, updatable = false)
    private long round;

    /**
     * 玩家ID → 账本（jsonb）。
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "user_states", columnDefinition = "jsonb", nullable = false, updatable = false)
    private Map<UUID, UserState> userStates;

    /**
     * 本回合各玩家下的订单，NIL 键为外部需求（jsonb）。
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "round_orders", columnDefinition = "jsonb", nullable = false, updatable = false)
    private Map<UUID, Order> roundOrders;

    /**
     * 本回合各玩家发出的货，NIL 键为外部供给（jsonb）。
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "send_orders", columnDefinition = "jsonb", nullable = false, updatable = false)
    private Map<UUID, Order> sendOrders;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "players_classes", columnDefinition = "jsonb", nullable = false, updatable = false)
    private Map<UUID, Integer> playersClasses;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "flow", columnDefinition = "jsonb", updatable = false)
    private Flow flow;

    @Column(name = "demand", nullable = false, updatable = false)
    private long demand;

    @Column(name = "supply", nullable = false, updatable = false)
    private long supply;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
