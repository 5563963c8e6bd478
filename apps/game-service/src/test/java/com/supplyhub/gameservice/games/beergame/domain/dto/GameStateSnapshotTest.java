package com.supplyhub.gameservice.games.beergame.domain.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplyhub.gameservice.games.beergame.domain.model.GeneratedOrderStyle;
import com.supplyhub.gameservice.games.beergame.domain.model.RoundState;
import com.supplyhub.gameservice.games.beergame.domain.model.Settings;
import com.supplyhub.gameservice.games.beergame.domain.rule.RoundRules;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.A;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.B;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.C;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.LOBBY;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.classOne;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.settings;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GameStateSnapshotTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static void playRound(RoundState state, long a, long b, long c) {
        RoundRules.applySubmission(state, A, a);
        RoundRules.applySubmission(state, B, b);
        RoundRules.applySubmission(state, C, c);
        RoundRules.finishRound(state);
        RoundRules.resetForNewRound(state);
    }

    @Test
    void restoredStateBehavesLikeTheOriginal() throws Exception {
        Settings settings = settings(10).toBuilder()
                .demandStyle(new GeneratedOrderStyle.ValueList(List.of(4L, 8L, 8L, 12L)))
                .build();
        RoundState live = RoundRules.initialState(settings, List.of(A, B, C), classOne(A, B, C));
        playRound(live, 6L, 2L, 9L);

        // 经过 jsonb 同样的 JSON 序列化边界
        String json = mapper.writeValueAsString(GameStateSnapshot.of(LOBBY, live));
        GameStateSnapshot stored = mapper.readValue(json, GameStateSnapshot.class);
        RoundState restored = stored.toRoundState(settings);

        assertEquals(GameStateSnapshot.of(LOBBY, live), GameStateSnapshot.of(LOBBY, restored));

        playRound(live, 3L, 0L, 14L);
        playRound(restored, 3L, 0L, 14L);

        assertEquals(GameStateSnapshot.of(LOBBY, live), GameStateSnapshot.of(LOBBY, restored));
        assertEquals(2L, restored.getRound());
        assertEquals(8L, restored.getDemand());
    }

    @Test
    void settingsSurviveJsonWithPolymorphicStyles() throws Exception {
        Settings settings = settings(3).toBuilder()
                .supplyStyle(new GeneratedOrderStyle.Exponential(2L, 1, 3L))
                .build();

        String json = mapper.writeValueAsString(settings);

        assertEquals(settings, mapper.readValue(json, Settings.class));
    }
}
