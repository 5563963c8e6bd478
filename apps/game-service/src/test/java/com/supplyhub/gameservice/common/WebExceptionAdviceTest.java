package com.supplyhub.gameservice.common;

import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.web.common.ApiResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WebExceptionAdviceTest {

    private final WebExceptionAdvice advice = new WebExceptionAdvice();

    @Test
    void gameErrorUsesCodeStatus() {
        ResponseEntity<ApiResponse<Object>> notFound = advice.gameError(new GameException(GameErrorCode.LOBBY_NOT_FOUND, "大厅不存在"));
        ResponseEntity<ApiResponse<Object>> broke = advice.gameError(new GameException(GameErrorCode.SNAPSHOT_WRITE_FAILED));

        assertEquals(404, notFound.getStatusCode().value());
        assertEquals(404, notFound.getBody().code());
        assertEquals("大厅不存在", notFound.getBody().message());
        assertEquals(500, broke.getStatusCode().value());
    }

    @Test
    void plainExceptionsKeepTheirMapping() {
        assertEquals(400, advice.badRequest(new IllegalArgumentException("x")).getStatusCode().value());
        assertEquals(409, advice.conflict(new IllegalStateException("y")).getStatusCode().value());
        assertEquals(500, advice.unexpected(new RuntimeException("z")).getStatusCode().value());
    }
}
