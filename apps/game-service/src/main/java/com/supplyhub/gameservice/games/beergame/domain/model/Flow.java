package com.supplyhub.gameservice.games.beergame.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 供应链拓扑：flow[p] = p 的下游（货物流向）。
 * <p>
 * 由开局名单按顺序构建，之后不可变。名单第一个为 firstPlayer（外部供给进入点），
 * 最后一个为 lastPlayer（外部需求进入点），其下游为 {@link Order#NIL}。
 */
public record Flow(UUID firstPlayer, UUID lastPlayer, Map<UUID, UUID> flow) {

    public Flow {
        flow = flow == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(flow));
    }

    /**
     * 按名单顺序构建拓扑
     *
     * @throws GameException 名单为空或存在重复玩家
     */
    public static Flow of(List<UUID> roster) {
        if (roster == null || roster.isEmpty()) {
            throw new GameException(GameErrorCode.EMPTY_ROSTER);
        }
        Map<UUID, UUID> links = new LinkedHashMap<>();
        for (int i = 0; i < roster.size(); i++) {
            UUID player = roster.get(i);
            if (player == null || links.containsKey(player)) {
                throw new GameException(GameErrorCode.INVALID_ROSTER, "名单中存在空或重复的玩家: " + player);
            }
            links.put(player, i + 1 < roster.size() ? roster.get(i + 1) : Order.NIL);
        }
        return new Flow(roster.get(0), roster.get(roster.size() - 1), links);
    }

    /**
     * 上游玩家（向 player 发货的人）；firstPlayer 的上游为 NIL
     */
    public UUID senderOf(UUID player) {
        for (Map.Entry<UUID, UUID> e : flow.entrySet()) {
            if (e.getValue().equals(player)) {
                return e.getKey();
            }
        }
        return Order.NIL;
    }

    /**
     * 下游玩家（player 发货的对象）；lastPlayer 的下游为 NIL
     */
    public UUID recipientOf(UUID player) {
        return flow.getOrDefault(player, Order.NIL);
    }

    @JsonIgnore
    public List<UUID> players() {
        return List.copyOf(flow.keySet());
    }
}
