package com.supplyhub.gameservice.platform.transport;

import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳（平台通用）
 * - 最少字段：kind / game / roomId / type / payload / ts / seq
 * - 提供静态工厂：state/event/error
 *
 * 用法示例：
 *   Envelope<GameUpdate> msg = Envelope.state("beergame", lobbyId, "ROUND_START", update);
 *   Envelope<ErrorView>  err = Envelope.error("beergame", lobbyId, "ERROR", view);
 */
public record Envelope<T>(Kind kind, String game, String roomId, String type, T payload, long ts, long seq) {

    /** 消息类别：STATE=完整状态，EVENT=增量事件，ERROR=错误通知 */
    public enum Kind { STATE, EVENT, ERROR }

    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(game, "game");
        Objects.requireNonNull(roomId, "roomId");
    }

    public static <T> Envelope<T> of(Kind kind, String game, String roomId, String type, T payload, long seq) {
        return new Envelope<>(kind, game, roomId, type, payload, Instant.now().toEpochMilli(), seq);
    }

    public static <T> Envelope<T> state(String game, String roomId, String type, T payload) {
        return of(Kind.STATE, game, roomId, type, payload, 0);
    }

    public static <T> Envelope<T> event(String game, String roomId, String type, T payload) {
        return of(Kind.EVENT, game, roomId, type, payload, 0);
    }

    public static <T> Envelope<T> error(String game, String roomId, String type, T payload) {
        return of(Kind.ERROR, game, roomId, type, payload, 0);
    }
}
