package com.supplyhub.gameservice.games.beergame.infrastructure.redis.repo;

import com.supplyhub.gameservice.games.beergame.config.BeerGameProperties;
import com.supplyhub.gameservice.games.beergame.domain.dto.PlayerLobbyBinding;
import com.supplyhub.gameservice.games.beergame.domain.repository.PlayerLobbyRepository;
import com.supplyhub.gameservice.games.beergame.infrastructure.redis.RedisKeys;
import com.supplyhub.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * 玩家 → 大厅 关联：Redis String，TTL 取 beergame.player-binding-ttl。
 */
@Repository
@RequiredArgsConstructor
public class RedisPlayerLobbyRepository implements PlayerLobbyRepository {

    private final RedisOps redisOps;
    private final BeerGameProperties properties;

    @Override
    public void bind(UUID playerId, UUID lobbyId) {
        if (playerId == null || lobbyId == null) {
            return;
        }
        redisOps.setEx(RedisKeys.playerLobby(playerId), PlayerLobbyBinding.of(playerId, lobbyId),
                properties.getPlayerBindingTtl());
    }

    @Override
    public Optional<PlayerLobbyBinding> find(UUID playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(redisOps.get(RedisKeys.playerLobby(playerId), PlayerLobbyBinding.class));
    }

    @Override
    public void clear(UUID playerId) {
        if (playerId == null) {
            return;
        }
        redisOps.del(RedisKeys.playerLobby(playerId));
    }
}
