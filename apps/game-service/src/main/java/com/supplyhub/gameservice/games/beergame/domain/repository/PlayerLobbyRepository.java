package com.supplyhub.gameservice.games.beergame.domain.repository;

import com.supplyhub.gameservice.games.beergame.domain.dto.PlayerLobbyBinding;

import java.util.Optional;
import java.util.UUID;

/**
 * 玩家 → 当前大厅 关联
 */
public interface PlayerLobbyRepository {

    void bind(UUID playerId, UUID lobbyId);

    Optional<PlayerLobbyBinding> find(UUID playerId);

    void clear(UUID playerId);
}
