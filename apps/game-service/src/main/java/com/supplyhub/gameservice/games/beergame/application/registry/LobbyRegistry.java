package com.supplyhub.gameservice.games.beergame.application.registry;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEventBus;
import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEventListener;
import com.supplyhub.gameservice.games.beergame.domain.constants.GameMessages;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内大厅注册表：lobbyId → LobbySession。
 * <p>
 * 查找走并发 Map，不与各大厅自己的锁竞争；不同大厅之间互不阻塞。
 */
@Slf4j
@Component
public class LobbyRegistry {

    private final Map<UUID, LobbySession> sessions = new ConcurrentHashMap<>();
    private final List<LobbyEventListener> listeners;

    @Autowired
    public LobbyRegistry(ObjectProvider<LobbyEventListener> listeners) {
        this(listeners.orderedStream().toList());
    }

    public LobbyRegistry(List<LobbyEventListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    /**
     * 注册大厅；已存在则直接返回现有句柄
     *
     * @param backlog 广播缓冲容量（大厅最大人数）
     */
    public LobbySession open(UUID lobbyId, int backlog) {
        return sessions.computeIfAbsent(lobbyId, id -> {
            log.info("注册大厅运行时状态: lobbyId={}, backlog={}", id, backlog);
            return new LobbySession(id, new LobbyEventBus(id, backlog, listeners));
        });
    }

    public Optional<LobbySession> find(UUID lobbyId) {
        return Optional.ofNullable(sessions.get(lobbyId));
    }

    /**
     * @throws GameException 大厅未注册
     */
    public LobbySession require(UUID lobbyId) {
        LobbySession session = sessions.get(lobbyId);
        if (session == null) {
            throw new GameException(GameErrorCode.LOBBY_NOT_FOUND, GameMessages.formatLobbyNotFound(lobbyId));
        }
        return session;
    }

    /**
     * 移除大厅并关闭其广播（快照仍保留在库中）
     */
    public Optional<LobbySession> remove(UUID lobbyId) {
        LobbySession removed = sessions.remove(lobbyId);
        if (removed != null) {
            removed.getBus().close();
            log.info("移除大厅运行时状态: lobbyId={}", lobbyId);
        }
        return Optional.ofNullable(removed);
    }

    public Collection<LobbySession> sessions() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
