package com.supplyhub.gameservice.games.beergame.domain.rule;

import com.supplyhub.gameservice.games.beergame.domain.dto.GameStateSnapshot;
import com.supplyhub.gameservice.games.beergame.domain.enums.Resource;
import com.supplyhub.gameservice.games.beergame.domain.model.EventCondition;
import com.supplyhub.gameservice.games.beergame.domain.model.MetBy;
import com.supplyhub.gameservice.games.beergame.domain.model.RoundState;
import com.supplyhub.gameservice.games.beergame.domain.model.UserState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 事件条件求值（纯函数）。
 * 玩家遍历顺序即 usersStates 的键顺序。
 */
public final class EventConditions {

    private EventConditions() {
    }

    /**
     * @param priorSnapshot 上一回合快照的加载器，仅 SingleChange 会调用；快照不存在时条件不成立
     */
    public static ConditionResult evaluate(EventCondition condition, RoundState state,
                                           Supplier<Optional<GameStateSnapshot>> priorSnapshot) {
        if (condition instanceof EventCondition.RoundMet roundMet) {
            return roundMet(state, roundMet.round());
        }
        if (condition instanceof EventCondition.ValueExceed exceed) {
            return valueExceed(state, exceed.resource(), exceed.metBy(), exceed.value());
        }
        if (condition instanceof EventCondition.SingleChange change) {
            return priorSnapshot.get()
                    .map(prior -> singleChange(state, prior, change.resource(), change.value()))
                    .orElseGet(ConditionResult::notMet);
        }
        throw new IllegalStateException("未知的事件条件: " + condition);
    }

    public static ConditionResult roundMet(RoundState state, long round) {
        if (state.getRound() != round || state.getUsersStates().isEmpty()) {
            return ConditionResult.notMet();
        }
        return new ConditionResult(true, new ArrayList<>(state.getUsersStates().keySet()));
    }

    public static ConditionResult valueExceed(RoundState state, Resource resource, MetBy metBy, long value) {
        Map<UUID, UserState> users = state.getUsersStates();
        if (users.isEmpty()) {
            return ConditionResult.notMet();
        }
        List<UUID> targets = new ArrayList<>();

        if (metBy instanceof MetBy.SinglePlayer) {
            users.forEach((id, u) -> {
                if (resource.read(u) > value) {
                    targets.add(id);
                }
            });
            return new ConditionResult(!targets.isEmpty(), targets);
        }
        if (metBy instanceof MetBy.Average) {
            long sum = 0L;
            for (Map.Entry<UUID, UserState> e : users.entrySet()) {
                sum += resource.read(e.getValue());
                targets.add(e.getKey());
            }
            return new ConditionResult(sum / users.size() > value, targets);
        }
        if (metBy instanceof MetBy.AllPlayers) {
            for (Map.Entry<UUID, UserState> e : users.entrySet()) {
                if (resource.read(e.getValue()) < value) {
                    return new ConditionResult(false, targets);
                }
                targets.add(e.getKey());
            }
            return new ConditionResult(true, targets);
        }
        if (metBy instanceof MetBy.PlayerPercent percent) {
            users.forEach((id, u) -> {
                if (resource.read(u) > value) {
                    targets.add(id);
                }
            });
            // 先整除再乘 100，与历史配置的行为保持一致
            long share = (targets.size() / users.size()) * 100L;
            return new ConditionResult(share > percent.percent(), targets);
        }
        throw new IllegalStateException("未知的判定方式: " + metBy);
    }

    /**
     * 上一回合快照中不存在的玩家直接跳过
     */
    public static ConditionResult singleChange(RoundState state, GameStateSnapshot prior, Resource resource, long value) {
        List<UUID> targets = new ArrayList<>();
        state.getUsersStates().forEach((id, current) -> {
            UserState before = prior.userStates().get(id);
            if (before == null) {
                return;
            }
            if (Math.abs(resource.read(current) - resource.read(before)) > value) {
                targets.add(id);
            }
        });
        return new ConditionResult(!targets.isEmpty(), targets);
    }
}
