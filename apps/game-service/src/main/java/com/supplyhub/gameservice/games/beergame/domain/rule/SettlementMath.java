package com.supplyhub.gameservice.games.beergame.domain.rule;

import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.domain.model.GeneratedOrderStyle;

import java.util.List;

/**
 * 结算数学：订单金额、欠货结算、需求/供给曲线。
 * 纯函数，无 I/O。
 */
public final class SettlementMath {

    /** Default 风格的初始值 */
    public static final long DEFAULT_START = 10L;

    private SettlementMath() {
    }

    /**
     * 下一回合的需求 / 供给值。
     * List 风格：找到与 previous 相等的元素则返回其后一个；找不到或已在末尾则返回最后一个。
     */
    public static long generateNext(long previous, GeneratedOrderStyle style) {
        if (style instanceof GeneratedOrderStyle.Default) {
            return (long) (previous * 1.5);
        }
        if (style instanceof GeneratedOrderStyle.Linear linear) {
            return previous + linear.increase();
        }
        if (style instanceof GeneratedOrderStyle.Multiplication mul) {
            return previous * mul.increase();
        }
        if (style instanceof GeneratedOrderStyle.Exponential exp) {
            return previous * (exp.modulator() * (long) Math.pow(Math.E, exp.power()));
        }
        if (style instanceof GeneratedOrderStyle.ValueList list) {
            List<Long> values = requireValues(list);
            int index = values.indexOf(previous);
            if (index < 0 || index + 1 >= values.size()) {
                return values.get(values.size() - 1);
            }
            return values.get(index + 1);
        }
        throw new IllegalStateException("未知的需求风格: " + style);
    }

    /**
     * 开局时的需求 / 供给初始值
     *
     * @throws GameException List 风格且序列为空
     */
    public static long initialValue(GeneratedOrderStyle style) {
        if (style instanceof GeneratedOrderStyle.Default) {
            return DEFAULT_START;
        }
        if (style instanceof GeneratedOrderStyle.Linear linear) {
            return linear.start();
        }
        if (style instanceof GeneratedOrderStyle.Multiplication mul) {
            return mul.start();
        }
        if (style instanceof GeneratedOrderStyle.Exponential exp) {
            return exp.start();
        }
        if (style instanceof GeneratedOrderStyle.ValueList list) {
            return requireValues(list).get(0);
        }
        throw new IllegalStateException("未知的需求风格: " + style);
    }

    /**
     * 订单金额：数量为 0 时不收固定费用
     */
    public static long orderCost(long value, long unitPrice, long fixedCost) {
        if (value == 0) {
            return 0L;
        }
        return value * unitPrice + fixedCost;
    }

    /**
     * 欠货结算：先用库存偿还欠货，再满足本次需求。
     * 库存不足时缺口记为新欠货，但发货量仍按完整需求计。
     */
    public static BackorderSettlement settleBackorder(long magazine, long backOrderSum, long requested) {
        long send = 0L;
        long mag = magazine;
        long back = backOrderSum;

        if (back > mag) {
            send = mag;
            back -= mag;
            mag = 0L;
        } else if (back > 0) {
            mag -= back;
            send = back;
            back = 0L;
        }

        if (mag > requested) {
            mag -= requested;
        } else {
            back += requested - mag;
            mag = 0L;
        }
        send += requested;
        return new BackorderSettlement(send, mag, back);
    }

    private static List<Long> requireValues(GeneratedOrderStyle.ValueList list) {
        if (list.values().isEmpty()) {
            throw new GameException(GameErrorCode.EMPTY_ORDER_LIST);
        }
        return list.values();
    }
}
