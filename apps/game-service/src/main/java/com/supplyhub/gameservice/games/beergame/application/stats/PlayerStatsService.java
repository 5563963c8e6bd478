package com.supplyhub.gameservice.games.beergame.application.stats;

import com.supplyhub.gameservice.games.beergame.domain.dto.GameStateSnapshot;
import com.supplyhub.gameservice.games.beergame.domain.enums.UserStatsType;
import com.supplyhub.gameservice.games.beergame.domain.repository.GameStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 全程统计：按回合顺序回放全部快照，抽取指定数值。
 * 结果结构：统计名 → 玩家ID → 按回合排列的序列。
 */
@Service
@RequiredArgsConstructor
public class PlayerStatsService {

    /** 终局广播附带的统计项 */
    public static final List<UserStatsType> GAME_END_STATS = List.of(
            UserStatsType.MONEY,
            UserStatsType.MAGAZINE_STATE,
            UserStatsType.BACK_ORDER,
            UserStatsType.PLACED_ORDER,
            UserStatsType.RECEIVED_ORDER,
            UserStatsType.SPENT_MONEY);

    private final GameStateRepository gameStateRepository;

    public Map<String, Map<UUID, List<Long>>> collect(UUID lobbyId, Collection<UserStatsType> kinds) {
        return aggregate(gameStateRepository.findAllOrdered(lobbyId), kinds);
    }

    public static Map<String, Map<UUID, List<Long>>> aggregate(List<GameStateSnapshot> snapshots,
                                                               Collection<UserStatsType> kinds) {
        List<GameStateSnapshot> ordered = new ArrayList<>(snapshots);
        ordered.sort(Comparator.comparingLong(GameStateSnapshot::round));

        Map<String, Map<UUID, List<Long>>> result = new LinkedHashMap<>();
        for (UserStatsType kind : kinds) {
            Map<UUID, List<Long>> perPlayer = new TreeMap<>();
            for (GameStateSnapshot snapshot : ordered) {
                snapshot.userStates().forEach((id, user) ->
                        perPlayer.computeIfAbsent(id, k -> new ArrayList<>()).add(kind.extract(user)));
            }
            result.put(kind.statName(), perPlayer);
        }
        return result;
    }
}
