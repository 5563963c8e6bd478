package com.supplyhub.gameservice.games.beergame.domain.rule;

import com.supplyhub.gameservice.games.beergame.domain.model.Order;

/**
 * 单次回合提交的结果
 *
 * @param placedOrder   玩家下给上游的订单
 * @param sentOrder     玩家发给下游的货
 * @param roundComplete 本次提交后全体玩家是否都已提交
 */
public record SubmissionResult(Order placedOrder, Order sentOrder, boolean roundComplete) {
}
