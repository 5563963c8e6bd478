package com.supplyhub.gameservice.games.beergame.domain.enums;

import com.supplyhub.gameservice.games.beergame.domain.model.UserState;

import java.util.function.ToLongFunction;

/**
 * 统计指标：statName 为结果中的键。
 * PLACED_ORDER / RECEIVED_ORDER 统计的是最近一笔订单的金额。
 */
public enum UserStatsType {

    MONEY("money", UserState::getMoney),
    PERFORMANCE("performance", UserState::getPerformance),
    MAGAZINE_STATE("magazine_state", UserState::getMagazineState),
    PLACED_ORDER("placed_order", u -> u.getPlacedOrder().cost()),
    RECEIVED_ORDER("received_order", u -> u.getReceivedOrder().cost()),
    BACK_ORDER("back_order", UserState::getBackOrderSum),
    SPENT_MONEY("spent_money", UserState::getSpentMoney);

    private final String statName;
    private final ToLongFunction<UserState> extractor;

    UserStatsType(String statName, ToLongFunction<UserState> extractor) {
        this.statName = statName;
        this.extractor = extractor;
    }

    public String statName() {
        return statName;
    }

    public long extract(UserState state) {
        return extractor.applyAsLong(state);
    }
}
