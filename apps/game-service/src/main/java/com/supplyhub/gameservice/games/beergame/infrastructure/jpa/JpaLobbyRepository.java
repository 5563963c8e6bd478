package com.supplyhub.gameservice.games.beergame.infrastructure.jpa;

import com.supplyhub.gameservice.games.beergame.domain.constants.GameMessages;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.domain.model.LobbyConfig;
import com.supplyhub.gameservice.games.beergame.domain.model.Settings;
import com.supplyhub.gameservice.games.beergame.domain.repository.LobbyRepository;
import com.supplyhub.gameservice.games.beergame.infrastructure.jpa.entity.LobbyEntity;
import com.supplyhub.gameservice.games.beergame.infrastructure.jpa.repo.LobbyJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 大厅记录仓库（PostgreSQL）
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaLobbyRepository implements LobbyRepository {

    private final LobbyJpaRepository jpa;

    @Override
    @Transactional(readOnly = true)
    public Optional<LobbyConfig> findById(UUID lobbyId) {
        return jpa.findById(lobbyId).map(JpaLobbyRepository::toConfig);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LobbyConfig> findAll() {
        return jpa.findAll().stream().map(JpaLobbyRepository::toConfig).toList();
    }

    @Override
    @Transactional
    public void updateSettings(UUID lobbyId, Settings settings) {
        try {
            LobbyEntity entity = jpa.findById(lobbyId)
                    .orElseThrow(() -> new GameException(GameErrorCode.LOBBY_NOT_FOUND,
                            GameMessages.formatLobbyNotFound(lobbyId)));
            entity.setSettings(settings);
            jpa.saveAndFlush(entity);
        } catch (DataAccessException e) {
            throw writeFailed(lobbyId, "settings", e);
        }
    }

    @Override
    @Transactional
    public void markStarted(UUID lobbyId) {
        try {
            requireUpdated(lobbyId, jpa.markStarted(lobbyId));
        } catch (DataAccessException e) {
            throw writeFailed(lobbyId, "started", e);
        }
    }

    @Override
    @Transactional
    public void markFinished(UUID lobbyId) {
        try {
            requireUpdated(lobbyId, jpa.markFinished(lobbyId));
        } catch (DataAccessException e) {
            throw writeFailed(lobbyId, "finished", e);
        }
    }

    private static void requireUpdated(UUID lobbyId, int rows) {
        if (rows == 0) {
            throw new GameException(GameErrorCode.LOBBY_NOT_FOUND, GameMessages.formatLobbyNotFound(lobbyId));
        }
    }

    private static GameException writeFailed(UUID lobbyId, String column, DataAccessException e) {
        log.error("写入大厅记录失败: lobbyId={}, column={}", lobbyId, column, e);
        return new GameException(GameErrorCode.LOBBY_WRITE_FAILED, "大厅记录写入失败: " + column, e);
    }

    static LobbyConfig toConfig(LobbyEntity e) {
        return LobbyConfig.builder()
                .id(e.getId())
                .name(e.getName())
                .maxPlayers(e.getMaxPlayers())
                .ownerId(e.getOwnerId())
                .started(e.isStarted())
                .finished(e.isFinished())
                .settings(e.getSettings())
                .events(e.getEvents())
                .build();
    }
}
