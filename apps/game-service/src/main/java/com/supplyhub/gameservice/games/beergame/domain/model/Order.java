package com.supplyhub.gameservice.games.beergame.domain.model;

import java.util.UUID;

/**
 * 订单（不可变值）。
 * <p>
 * recipient / sender 为玩家ID；链路两端的外部需求、外部供给用 {@link #NIL} 表示。
 * cost 在订单定稿时一次性计算，之后不再变化。
 */
public record Order(UUID recipient, UUID sender, long value, long cost) {

    /** 链路外部（需求汇 / 供给源）的哨兵ID */
    public static final UUID NIL = new UUID(0L, 0L);

    public Order {
        recipient = recipient == null ? NIL : recipient;
        sender = sender == null ? NIL : sender;
    }

    /** 空订单：尚未下单 / 尚未收货时的占位 */
    public static Order empty() {
        return new Order(NIL, NIL, 0L, 0L);
    }

    public static boolean isNil(UUID id) {
        return id == null || NIL.equals(id);
    }
}
