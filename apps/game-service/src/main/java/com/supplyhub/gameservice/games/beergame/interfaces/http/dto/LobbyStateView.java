package com.supplyhub.gameservice.games.beergame.interfaces.http.dto;

import com.supplyhub.gameservice.games.beergame.domain.enums.LobbyPhase;
import com.supplyhub.gameservice.games.beergame.domain.model.GameUpdate;

/**
 * 重新同步用的完整视图
 */
public record LobbyStateView(LobbyPhase phase, GameUpdate state) {
}
