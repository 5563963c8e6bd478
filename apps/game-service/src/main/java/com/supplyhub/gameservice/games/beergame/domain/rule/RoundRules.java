package com.supplyhub.gameservice.games.beergame.domain.rule;

import com.supplyhub.gameservice.games.beergame.domain.constants.GameMessages;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.domain.model.Flow;
import com.supplyhub.gameservice.games.beergame.domain.model.Order;
import com.supplyhub.gameservice.games.beergame.domain.model.RoundState;
import com.supplyhub.gameservice.games.beergame.domain.model.Settings;
import com.supplyhub.gameservice.games.beergame.domain.model.UserState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 回合状态机规则：开局、回合提交、回合结算、新回合重置。
 * <p>
 * 所有方法就地修改传入的 RoundState，且在任何修改之前完成全部校验；
 * 调用方应在拷贝上执行，成功后再整体替换运行时状态。
 */
public final class RoundRules {

    private RoundRules() {
    }

    /**
     * 构建开局（第 0 回合）状态
     *
     * @throws GameException 名单为空、玩家未分配职业、职业配置缺失、需求序列为空
     */
    public static RoundState initialState(Settings settings, List<UUID> roster, Map<UUID, Integer> classes) {
        Flow flow = Flow.of(roster);
        long basicPrice = settings.resourceBasicPrice();
        Map<UUID, UserState> users = new TreeMap<>();
        Map<UUID, Integer> playerClasses = new TreeMap<>();

        for (UUID player : roster) {
            Integer playerClass = classes == null ? null : classes.get(player);
            if (playerClass == null) {
                throw new GameException(GameErrorCode.CLASS_NOT_ASSIGNED, "玩家未分配职业: " + player);
            }
            // 回合提交时才用到的定价也在开局时校验，避免开局后才暴露配置缺失
            settings.resourcePriceOf(playerClass);
            settings.fixOrderCostOf(playerClass);
            settings.magazineCostOf(playerClass);

            UUID sender = flow.senderOf(player);
            UUID recipient = flow.recipientOf(player);
            List<Order> incoming = new ArrayList<>();
            for (Long v : settings.incomingStartQueueOf(playerClass)) {
                incoming.add(new Order(player, sender, v, basicPrice * v));
            }
            List<Order> requested = new ArrayList<>();
            for (Long v : settings.requestedStartQueueOf(playerClass)) {
                requested.add(new Order(recipient, player, v, basicPrice * v));
            }

            users.put(player, UserState.builder()
                    .userId(player)
                    .money(settings.startMoneyOf(playerClass))
                    .magazineState(settings.startMagazineOf(playerClass))
                    .incomingOrders(incoming)
                    .requestedOrders(requested)
                    .build());
            playerClasses.put(player, playerClass);
        }

        RoundState state = new RoundState();
        state.setRound(0L);
        state.setPlayers(roster.size());
        state.setUsersStates(users);
        state.setPlayerClasses(playerClasses);
        state.setSettings(settings);
        state.setFlow(flow);
        state.setDemand(SettlementMath.initialValue(settings.demandStyle()));
        state.setSupply(SettlementMath.initialValue(settings.supplyStyle()));
        return state;
    }

    /**
     * 处理一名玩家的回合提交。
     * <p>
     * 校验失败（数量非法、重复提交、职业配置缺失、余额不足、缺少排队订单）时抛出异常且不做任何修改。
     */
    public static SubmissionResult applySubmission(RoundState state, UUID player, long quantity) {
        if (quantity < 0) {
            throw new GameException(GameErrorCode.INVALID_ORDER, GameMessages.formatNegativeOrder(quantity));
        }
        UserState user = state.getUsersStates().get(player);
        if (user == null) {
            throw new GameException(GameErrorCode.NOT_IN_GAME, GameMessages.NOT_IN_GAME);
        }
        if (state.getSubmittedPlayers().contains(player)) {
            throw new GameException(GameErrorCode.ALREADY_SUBMITTED, GameMessages.ALREADY_SUBMITTED);
        }

        Settings settings = state.getSettings();
        int playerClass = state.requireClass(player);
        long price = settings.resourcePriceOf(playerClass);
        long fixedCost = settings.fixOrderCostOf(playerClass);
        long magazineCost = settings.magazineCostOf(playerClass);

        long cost = SettlementMath.orderCost(quantity, price, fixedCost);
        if (cost > user.getMoney()) {
            throw new GameException(GameErrorCode.INSUFFICIENT_MONEY,
                    GameMessages.formatInsufficientMoney(cost, user.getMoney()));
        }
        if (user.getIncomingOrders().isEmpty() || user.getRequestedOrders().isEmpty()) {
            throw new GameException(GameErrorCode.PENDING_ORDER_MISSING,
                    "玩家 " + player + " 缺少待处理的到货或需求订单");
        }

        Flow flow = state.getFlow();

        // 1. 下单：扣款并登记到本回合订单表
        Order placed = new Order(player, flow.senderOf(player), quantity, cost);
        user.setMoney(user.getMoney() - cost);
        user.setSpentMoney(user.getSpentMoney() + cost);
        user.setPlacedOrder(placed);
        state.getRoundOrders().put(player, placed);

        // 2. 仓储费按收货前的库存计
        long holding = user.getMagazineState() * magazineCost;
        user.setMoney(user.getMoney() - holding);
        user.setSpentMoney(user.getSpentMoney() + holding);

        // 3. 收货
        Order incoming = user.pollIncoming();
        user.setMagazineState(user.getMagazineState() + incoming.value());
        user.setReceivedOrder(incoming);

        // 4. 发货：先还欠货，再满足本次需求
        Order requested = user.pollRequested();
        BackorderSettlement settlement =
                SettlementMath.settleBackorder(user.getMagazineState(), user.getBackOrderSum(), requested.value());
        user.setMagazineState(settlement.magazine());
        user.setBackOrderSum(settlement.backOrderSum());

        long sendValue = settlement.sendValue();
        Order sent = new Order(flow.recipientOf(player), player, sendValue,
                SettlementMath.orderCost(sendValue, price, fixedCost));
        state.getSentOrders().put(player, sent);
        user.getSentOrders().add(sent);

        state.getSubmittedPlayers().add(player);
        state.setPlayersFinished(state.getPlayersFinished() + 1);
        return new SubmissionResult(placed, sent, state.allPlayersFinished());
    }

    /**
     * 回合结算：生成外部需求与供给，把本回合订单分发到各玩家队列，回合数 +1。
     *
     * @throws GameException 首位玩家本回合没有订单（内部一致性错误）
     */
    public static void finishRound(RoundState state) {
        Settings settings = state.getSettings();
        Flow flow = state.getFlow();
        long basicPrice = settings.resourceBasicPrice();

        Order firstPlayerOrder = state.getRoundOrders().get(flow.firstPlayer());
        if (firstPlayerOrder == null) {
            throw new GameException(GameErrorCode.PENDING_ORDER_MISSING, "缺少首位玩家本回合的订单");
        }

        // 外部需求进入末位玩家
        long nextDemand = SettlementMath.generateNext(state.getDemand(), settings.demandStyle());
        state.getRoundOrders().put(Order.NIL,
                new Order(Order.NIL, flow.lastPlayer(), nextDemand, basicPrice * nextDemand));

        // 外部供给进入首位玩家，最多满足其订单量
        long nextSupply = SettlementMath.generateNext(state.getSupply(), settings.supplyStyle());
        Order supplyOrder = firstPlayerOrder;
        if (nextSupply < firstPlayerOrder.value()) {
            supplyOrder = new Order(flow.firstPlayer(), Order.NIL, nextSupply, basicPrice * nextSupply);
        }
        state.getSentOrders().put(Order.NIL, supplyOrder);

        for (Order order : state.getRoundOrders().values()) {
            if (!Order.isNil(order.sender())) {
                state.requireUser(order.sender()).getRequestedOrders().add(order);
            }
        }
        for (Order order : state.getSentOrders().values()) {
            if (!Order.isNil(order.recipient())) {
                state.requireUser(order.recipient()).getIncomingOrders().add(order);
            }
        }

        state.setRound(state.getRound() + 1);
        // 只推进需求，供给始终由开局值生成
        state.setDemand(nextDemand);
    }

    /**
     * 是否已到最大回合数
     */
    public static boolean isGameOver(RoundState state) {
        long maxRounds = state.getSettings().maxRounds();
        return maxRounds > 0 && state.getRound() >= maxRounds;
    }

    /**
     * 新回合重置：计数归零、清空本回合订单表（已在结算时并入各玩家队列）
     */
    public static void resetForNewRound(RoundState state) {
        state.setPlayersFinished(0);
        state.getSubmittedPlayers().clear();
        state.getRoundOrders().clear();
        state.getSentOrders().clear();
    }
}
