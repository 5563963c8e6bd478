package com.supplyhub.gameservice.games.beergame.domain.enums;

import com.supplyhub.gameservice.games.beergame.domain.model.UserState;

import java.util.function.ObjLongConsumer;
import java.util.function.ToLongFunction;

/**
 * 可被事件读取 / 修改的玩家数值字段。
 * <p>
 * 条件判断与动作执行共用这一张读写表。
 */
public enum Resource {

    MONEY(UserState::getMoney, (u, v) -> u.setMoney(u.getMoney() + v)),
    MAGAZINE_STATE(UserState::getMagazineState, (u, v) -> u.setMagazineState(u.getMagazineState() + v)),
    PERFORMANCE(UserState::getPerformance, (u, v) -> u.setPerformance(u.getPerformance() + v)),
    BACK_ORDER_VALUE(UserState::getBackOrderSum, (u, v) -> u.setBackOrderSum(u.getBackOrderSum() + v));

    private final ToLongFunction<UserState> reader;
    private final ObjLongConsumer<UserState> adder;

    Resource(ToLongFunction<UserState> reader, ObjLongConsumer<UserState> adder) {
        this.reader = reader;
        this.adder = adder;
    }

    public long read(UserState state) {
        return reader.applyAsLong(state);
    }

    public void add(UserState state, long delta) {
        adder.accept(state, delta);
    }
}
