package com.supplyhub.gameservice.games.beergame.application.event;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEvent;
import com.supplyhub.gameservice.games.beergame.domain.dto.GameStateSnapshot;
import com.supplyhub.gameservice.games.beergame.domain.enums.ActionTarget;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.domain.model.EventAction;
import com.supplyhub.gameservice.games.beergame.domain.model.GameEvent;
import com.supplyhub.gameservice.games.beergame.domain.model.GameEvents;
import com.supplyhub.gameservice.games.beergame.domain.model.RoundState;
import com.supplyhub.gameservice.games.beergame.domain.model.Settings;
import com.supplyhub.gameservice.games.beergame.domain.model.UserState;
import com.supplyhub.gameservice.games.beergame.domain.repository.GameStateRepository;
import com.supplyhub.gameservice.games.beergame.domain.repository.LobbyRepository;
import com.supplyhub.gameservice.games.beergame.domain.rule.ConditionResult;
import com.supplyhub.gameservice.games.beergame.domain.rule.EventConditions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * 新回合事件处理：按配置顺序逐条求值，条件成立则按顺序执行动作。
 * <p>
 * 后面的事件能看到前面事件对状态的修改（同一个 state 实例）。
 * 产生的广播交给 outbox，由调用方在状态提交后统一发布。
 * ChangeSettings 只改内存，整轮动作全部成功后才把最终设置写回大厅记录；
 * 中途失败时大厅记录保持原样，调用方丢弃内存副本即可。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameEventProcessor {

    private final GameStateRepository gameStateRepository;
    private final LobbyRepository lobbyRepository;

    /**
     * @param state  当前回合状态（会被就地修改）
     * @param outbox 待发布的广播
     * @return 触发的事件数
     * @throws GameException 设置写回失败
     */
    public int process(UUID lobbyId, RoundState state, GameEvents events, Consumer<LobbyEvent> outbox) {
        Settings before = state.getSettings();
        int fired = 0;
        for (GameEvent event : events.events()) {
            ConditionResult result = EventConditions.evaluate(event.condition(), state,
                    () -> loadPrior(lobbyId, state.getRound() - 1));
            log.debug("事件求值: lobbyId={}, round={}, event={}, met={}, targets={}",
                    lobbyId, state.getRound(), event.name(), result.met(), result.targets());
            if (!result.met()) {
                continue;
            }
            fired++;
            for (EventAction action : event.actions()) {
                execute(lobbyId, state, action, result.targets(), outbox);
            }
        }
        if (state.getSettings() != before) {
            lobbyRepository.updateSettings(lobbyId, state.getSettings());
            log.info("事件修改了大厅设置: lobbyId={}, round={}", lobbyId, state.getRound());
        }
        return fired;
    }

    private void execute(UUID lobbyId, RoundState state, EventAction action, List<UUID> targets,
                         Consumer<LobbyEvent> outbox) {
        if (action instanceof EventAction.ShowMessage show) {
            if (show.target() == ActionTarget.EVENT_TARGET) {
                targets.forEach(id -> outbox.accept(new LobbyEvent.PopUpUser(id, show.message())));
            } else {
                outbox.accept(new LobbyEvent.PopUpAll(show.message()));
            }
        } else if (action instanceof EventAction.ChangeSettings change) {
            state.setSettings(change.newSettings());
            outbox.accept(new LobbyEvent.SettingsChanged(change.newSettings()));
        } else if (action instanceof EventAction.AddResource add) {
            if (add.target() == ActionTarget.EVENT_TARGET) {
                for (UUID id : targets) {
                    add.resource().add(state.requireUser(id), add.value());
                    outbox.accept(new LobbyEvent.ResourceAddedUser(id, add.resource(), add.value()));
                }
            } else {
                for (UserState user : state.getUsersStates().values()) {
                    add.resource().add(user, add.value());
                }
                outbox.accept(new LobbyEvent.ResourceAddedAll(add.resource(), add.value()));
            }
        } else {
            throw new IllegalStateException("未知的事件动作: " + action);
        }
    }

    private Optional<GameStateSnapshot> loadPrior(UUID lobbyId, long round) {
        Optional<GameStateSnapshot> prior = gameStateRepository.findByRound(lobbyId, round);
        if (prior.isEmpty()) {
            log.warn("SingleChange 找不到上一回合快照，条件视为不成立: lobbyId={}, round={}", lobbyId, round);
        }
        return prior;
    }
}
