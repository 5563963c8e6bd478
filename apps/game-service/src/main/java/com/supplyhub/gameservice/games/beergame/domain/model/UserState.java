package com.supplyhub.gameservice.games.beergame.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 单个玩家的账本。
 * <p>
 * incomingOrders / requestedOrders 为 FIFO 队列：回合结算时追加到队尾，提交时从队首弹出。
 * money >= 0 不由类型保证，扣款前由提交流程校验。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserState {

    private UUID userId;
    private long money;
    /** 累计花费（下单 + 仓储） */
    private long spentMoney;
    /** 库存 */
    private long magazineState;
    private long performance;
    /** 欠货累计 */
    private long backOrderSum;

    @Builder.Default
    private List<Order> incomingOrders = new ArrayList<>();
    @Builder.Default
    private List<Order> requestedOrders = new ArrayList<>();
    @Builder.Default
    private List<Order> sentOrders = new ArrayList<>();

    /** 最近一次下的订单 */
    @Builder.Default
    private Order placedOrder = Order.empty();
    /** 最近一次收到的货 */
    @Builder.Default
    private Order receivedOrder = Order.empty();

    /**
     * 深拷贝；Order 本身不可变，只需复制队列。
     */
    public UserState copy() {
        return UserState.builder()
                .userId(userId)
                .money(money)
                .spentMoney(spentMoney)
                .magazineState(magazineState)
                .performance(performance)
                .backOrderSum(backOrderSum)
                .incomingOrders(new ArrayList<>(incomingOrders))
                .requestedOrders(new ArrayList<>(requestedOrders))
                .sentOrders(new ArrayList<>(sentOrders))
                .placedOrder(placedOrder)
                .receivedOrder(receivedOrder)
                .build();
    }

    /** 弹出最早的一笔到货，队列为空返回 null */
    public Order pollIncoming() {
        return incomingOrders.isEmpty() ? null : incomingOrders.remove(0);
    }

    /** 弹出最早的一笔下游需求，队列为空返回 null */
    public Order pollRequested() {
        return requestedOrders.isEmpty() ? null : requestedOrders.remove(0);
    }
}
