package com.supplyhub.gameservice.games.beergame.application.bus;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 单个大厅的广播总线：多订阅者、有界缓冲（容量 = 大厅最大人数）。
 * <p>
 * 发布永不阻塞，也不会因为没有订阅者或监听器异常而失败：
 * 状态修改在发布之前已经提交，广播失败只记日志。
 */
@Slf4j
public class LobbyEventBus {

    private final UUID lobbyId;
    private final int backlog;
    private final List<LobbyEventListener> listeners;
    private final List<LobbySubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public LobbyEventBus(UUID lobbyId, int backlog, List<LobbyEventListener> listeners) {
        if (backlog <= 0) {
            throw new IllegalArgumentException("backlog 必须为正数: " + backlog);
        }
        this.lobbyId = lobbyId;
        this.backlog = backlog;
        this.listeners = List.copyOf(listeners);
    }

    public LobbySubscription subscribe() {
        if (closed) {
            throw new IllegalStateException("大厅广播已关闭: " + lobbyId);
        }
        LobbySubscription subscription = new LobbySubscription(this, backlog);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * 发布事件
     *
     * @return 收到该事件的订阅者数量（不含监听器）
     */
    public int publish(LobbyEvent event) {
        if (closed) {
            log.warn("大厅广播已关闭，丢弃事件: lobbyId={}, type={}", lobbyId, event.type());
            return 0;
        }
        for (LobbyEventListener listener : listeners) {
            try {
                listener.onEvent(lobbyId, event);
            } catch (RuntimeException e) {
                log.warn("大厅事件监听器处理失败: lobbyId={}, type={}", lobbyId, event.type(), e);
            }
        }
        int delivered = 0;
        for (LobbySubscription s : subscriptions) {
            if (!s.deliver(event)) {
                log.warn("订阅者落后，已丢弃最旧消息: lobbyId={}, dropped={}", lobbyId, s.droppedCount());
            }
            delivered++;
        }
        if (delivered == 0 && listeners.isEmpty()) {
            log.debug("大厅无订阅者: lobbyId={}, type={}", lobbyId, event.type());
        }
        return delivered;
    }

    void unsubscribe(LobbySubscription subscription) {
        subscriptions.remove(subscription);
    }

    public void close() {
        closed = true;
        subscriptions.forEach(LobbySubscription::close);
        subscriptions.clear();
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public int backlog() {
        return backlog;
    }

    public boolean isClosed() {
        return closed;
    }
}
