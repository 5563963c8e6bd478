package com.supplyhub.gameservice.games.beergame.domain.rule;

/**
 * 欠货结算结果
 *
 * @param sendValue        本回合实际承诺发出的数量
 * @param magazine         结算后库存
 * @param backOrderSum     结算后欠货
 */
public record BackorderSettlement(long sendValue, long magazine, long backOrderSum) {
}
