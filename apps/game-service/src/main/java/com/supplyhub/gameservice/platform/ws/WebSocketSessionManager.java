package com.supplyhub.gameservice.platform.ws;

import com.supplyhub.gameservice.games.beergame.service.BeerGameService;
import com.supplyhub.web.common.CurrentUserHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.util.UUID;

/**
 * 监听 STOMP 断开事件，通知引擎玩家离线。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    private final BeerGameService beerGameService;

    public WebSocketSessionManager(BeerGameService beerGameService) {
        this.beerGameService = beerGameService;
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        Principal principal = event.getUser();
        if (principal == null) {
            log.debug("匿名连接断开，session={}", event.getSessionId());
            return;
        }
        UUID playerId;
        try {
            playerId = CurrentUserHelper.parsePlayerId(principal.getName());
        } catch (IllegalArgumentException e) {
            log.warn("断开连接的用户标识不是合法 UUID：{}", principal.getName());
            return;
        }
        log.info("玩家断开连接：playerId={}, session={}, status={}", playerId, event.getSessionId(), event.getCloseStatus());
        beerGameService.disconnect(playerId);
    }
}
