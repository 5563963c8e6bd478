package com.supplyhub.gameservice.games.beergame.domain.model;

import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * 大厅经济参数（按玩家职业 class 区分）。
 * <p>
 * 回合内不可变；只能被事件动作或开局前的设置更新整体替换。
 * 职业查不到对应参数属于配置错误，不做默认值兜底。
 */
@Builder(toBuilder = true)
public record Settings(
        Map<Integer, Long> startMoney,
        Map<Integer, Long> startMagazine,
        Map<Integer, List<Long>> incomingStartQueue,
        Map<Integer, List<Long>> requestedStartQueue,
        Map<Integer, Long> resourcePrice,
        Map<Integer, Long> fixOrderCost,
        Map<Integer, Long> magazineCost,
        long resourceBasicPrice,
        GeneratedOrderStyle demandStyle,
        GeneratedOrderStyle supplyStyle,
        long maxRounds
) {

    public Settings {
        startMoney = startMoney == null ? Map.of() : Map.copyOf(startMoney);
        startMagazine = startMagazine == null ? Map.of() : Map.copyOf(startMagazine);
        incomingStartQueue = incomingStartQueue == null ? Map.of() : Map.copyOf(incomingStartQueue);
        requestedStartQueue = requestedStartQueue == null ? Map.of() : Map.copyOf(requestedStartQueue);
        resourcePrice = resourcePrice == null ? Map.of() : Map.copyOf(resourcePrice);
        fixOrderCost = fixOrderCost == null ? Map.of() : Map.copyOf(fixOrderCost);
        magazineCost = magazineCost == null ? Map.of() : Map.copyOf(magazineCost);
        demandStyle = demandStyle == null ? new GeneratedOrderStyle.Default() : demandStyle;
        supplyStyle = supplyStyle == null ? new GeneratedOrderStyle.Default() : supplyStyle;
    }

    public static Settings empty() {
        return Settings.builder().build();
    }

    public long startMoneyOf(int playerClass) {
        return require(startMoney, playerClass, "startMoney");
    }

    public long startMagazineOf(int playerClass) {
        return require(startMagazine, playerClass, "startMagazine");
    }

    public List<Long> incomingStartQueueOf(int playerClass) {
        return require(incomingStartQueue, playerClass, "incomingStartQueue");
    }

    public List<Long> requestedStartQueueOf(int playerClass) {
        return require(requestedStartQueue, playerClass, "requestedStartQueue");
    }

    public long resourcePriceOf(int playerClass) {
        return require(resourcePrice, playerClass, "resourcePrice");
    }

    public long fixOrderCostOf(int playerClass) {
        return require(fixOrderCost, playerClass, "fixOrderCost");
    }

    public long magazineCostOf(int playerClass) {
        return require(magazineCost, playerClass, "magazineCost");
    }

    private static <V> V require(Map<Integer, V> table, int playerClass, String field) {
        V value = table.get(playerClass);
        if (value == null) {
            throw new GameException(GameErrorCode.CLASS_SETTING_MISSING,
                    String.format("职业 %d 缺少配置项 %s", playerClass, field));
        }
        return value;
    }
}
