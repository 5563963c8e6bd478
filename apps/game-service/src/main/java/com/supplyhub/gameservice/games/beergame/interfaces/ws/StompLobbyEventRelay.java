package com.supplyhub.gameservice.games.beergame.interfaces.ws;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEvent;
import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEventListener;
import com.supplyhub.gameservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 把大厅广播转发到 STOMP：
 *   - 定向事件 → /user/{playerId}/queue/beergame.events
 *   - 其余事件 → /topic/lobby.{lobbyId}
 * 每个大厅维护递增 seq，客户端据此发现丢消息并走 GET state 重新同步。
 */
@Slf4j
@Component
public class StompLobbyEventRelay implements LobbyEventListener {

    public static final String GAME = "beergame";
    public static final String USER_QUEUE = "/queue/beergame.events";

    private final SimpMessagingTemplate messaging;
    private final Map<UUID, AtomicLong> sequences = new ConcurrentHashMap<>();

    public StompLobbyEventRelay(SimpMessagingTemplate messaging) {
        this.messaging = messaging;
    }

    public static String lobbyTopic(UUID lobbyId) {
        return "/topic/lobby." + lobbyId;
    }

    @Override
    public void onEvent(UUID lobbyId, LobbyEvent event) {
        long seq = sequences.computeIfAbsent(lobbyId, id -> new AtomicLong()).incrementAndGet();
        Envelope<LobbyEvent> envelope = Envelope.of(kindOf(event), GAME, lobbyId.toString(), event.type(), event, seq);
        UUID target = event.targetPlayer();
        if (target != null) {
            messaging.convertAndSendToUser(target.toString(), USER_QUEUE, envelope);
        } else {
            messaging.convertAndSend(lobbyTopic(lobbyId), envelope);
        }
        // 终局或关闭后不再保留序号
        if (event instanceof LobbyEvent.KickAll || event instanceof LobbyEvent.GameEnded) {
            sequences.remove(lobbyId);
        }
        log.debug("STOMP 转发: lobbyId={}, type={}, seq={}, target={}", lobbyId, event.type(), seq, target);
    }

    /**
     * 不经过大厅广播、直接回给请求方的错误（大厅不存在等场景）
     */
    public void sendToPlayer(UUID lobbyId, UUID playerId, LobbyEvent event) {
        String roomId = lobbyId == null ? "" : lobbyId.toString();
        messaging.convertAndSendToUser(playerId.toString(), USER_QUEUE,
                Envelope.of(kindOf(event), GAME, roomId, event.type(), event, 0));
    }

    static Envelope.Kind kindOf(LobbyEvent event) {
        if (event.isError()) {
            return Envelope.Kind.ERROR;
        }
        if (event instanceof LobbyEvent.GameStarted
                || event instanceof LobbyEvent.RoundStarted
                || event instanceof LobbyEvent.GameEnded) {
            return Envelope.Kind.STATE;
        }
        return Envelope.Kind.EVENT;
    }
}
