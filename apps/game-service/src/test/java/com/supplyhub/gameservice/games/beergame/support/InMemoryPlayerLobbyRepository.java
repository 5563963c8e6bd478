package com.supplyhub.gameservice.games.beergame.support;

import com.supplyhub.gameservice.games.beergame.domain.dto.PlayerLobbyBinding;
import com.supplyhub.gameservice.games.beergame.domain.repository.PlayerLobbyRepository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPlayerLobbyRepository implements PlayerLobbyRepository {

    private final Map<UUID, PlayerLobbyBinding> bindings = new ConcurrentHashMap<>();

    @Override
    public void bind(UUID playerId, UUID lobbyId) {
        bindings.put(playerId, PlayerLobbyBinding.of(playerId, lobbyId));
    }

    @Override
    public Optional<PlayerLobbyBinding> find(UUID playerId) {
        return Optional.ofNullable(bindings.get(playerId));
    }

    @Override
    public void clear(UUID playerId) {
        bindings.remove(playerId);
    }
}
