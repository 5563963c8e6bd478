package com.supplyhub.gameservice.games.beergame.interfaces.ws;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEvent;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.interfaces.ws.dto.BeerGameMessages.RoundEndCmd;
import com.supplyhub.gameservice.games.beergame.service.BeerGameService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;

import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.A;
import static com.supplyhub.gameservice.games.beergame.support.BeerGameFixtures.LOBBY;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BeerGameWsControllerTest {

    @Mock
    private BeerGameService beerGameService;
    @Mock
    private StompLobbyEventRelay relay;

    private static SimpMessageHeaderAccessor asPlayerA() {
        SimpMessageHeaderAccessor sha = SimpMessageHeaderAccessor.create();
        sha.setUser(new UsernamePasswordAuthenticationToken(A.toString(), null));
        return sha;
    }

    private static RoundEndCmd cmd(long quantity) {
        RoundEndCmd cmd = new RoundEndCmd();
        cmd.setLobbyId(LOBBY);
        cmd.setQuantity(quantity);
        return cmd;
    }

    @Test
    void submissionUsesPrincipalAsPlayer() {
        new BeerGameWsController(beerGameService, relay).roundEnd(cmd(4L), asPlayerA());

        verify(beerGameService).submitRoundEnd(LOBBY, A, 4L);
        verifyNoInteractions(relay);
    }

    @Test
    void rejectionIsSentBackToTheSender() {
        doThrow(new GameException(GameErrorCode.INSUFFICIENT_MONEY, "余额不足"))
                .when(beerGameService).submitRoundEnd(LOBBY, A, 900L);

        new BeerGameWsController(beerGameService, relay).roundEnd(cmd(900L), asPlayerA());

        verify(relay).sendToPlayer(LOBBY, A, new LobbyEvent.PlayerError(A, GameErrorCode.INSUFFICIENT_MONEY, "余额不足"));
    }
}
