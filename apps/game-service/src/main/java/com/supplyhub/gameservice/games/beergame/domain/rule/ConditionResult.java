package com.supplyhub.gameservice.games.beergame.domain.rule;

import java.util.List;
import java.util.UUID;

/**
 * 条件求值结果：是否成立 + 命中的玩家
 */
public record ConditionResult(boolean met, List<UUID> targets) {

    public ConditionResult {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static ConditionResult notMet() {
        return new ConditionResult(false, List.of());
    }
}
