package com.supplyhub.gameservice.games.beergame.interfaces.ws;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEvent;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.interfaces.ws.dto.BeerGameMessages.ClassesCmd;
import com.supplyhub.gameservice.games.beergame.interfaces.ws.dto.BeerGameMessages.RoundEndCmd;
import com.supplyhub.gameservice.games.beergame.service.BeerGameService;
import com.supplyhub.web.common.CurrentUserHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.UUID;

/**
 * 啤酒游戏 WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/beergame.* 指令并交给引擎处理。
 * 成功结果由引擎通过大厅广播发出；失败以 ERROR 信封只回给发送者。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class BeerGameWsController {

    private final BeerGameService beerGameService;
    private final StompLobbyEventRelay relay;

    /**
     * 路径：/app/beergame.roundEnd
     */
    @MessageMapping("/beergame.roundEnd")
    public void roundEnd(RoundEndCmd cmd, SimpMessageHeaderAccessor sha) {
        UUID playerId = requirePlayer(sha);
        try {
            beerGameService.submitRoundEnd(cmd.getLobbyId(), playerId, cmd.getQuantity());
        } catch (GameException e) {
            log.debug("回合提交被拒绝: lobbyId={}, playerId={}, code={}", cmd.getLobbyId(), playerId, e.getCode());
            replyError(cmd.getLobbyId(), playerId, e);
        }
    }

    /**
     * 路径：/app/beergame.classes
     */
    @MessageMapping("/beergame.classes")
    public void classes(ClassesCmd cmd, SimpMessageHeaderAccessor sha) {
        UUID playerId = requirePlayer(sha);
        try {
            beerGameService.updatePlayerClasses(cmd.getLobbyId(), cmd.getAssignments());
        } catch (GameException e) {
            replyError(cmd.getLobbyId(), playerId, e);
        }
    }

    private void replyError(UUID lobbyId, UUID playerId, GameException e) {
        relay.sendToPlayer(lobbyId, playerId, new LobbyEvent.PlayerError(playerId, e.getCode(), e.getMessage()));
    }

    private static UUID requirePlayer(SimpMessageHeaderAccessor sha) {
        Principal user = sha.getUser();
        if (user == null) {
            throw new GameException(GameErrorCode.NOT_IN_GAME, "未认证的连接");
        }
        return CurrentUserHelper.parsePlayerId(user.getName());
    }
}
