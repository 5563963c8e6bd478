package com.supplyhub.gameservice.games.beergame.domain.error;

/**
 * 引擎统一异常：携带错误码与可读消息。
 * <p>
 * 抛出即代表本次操作整体失败，调用方看不到任何部分写入。
 */
public class GameException extends RuntimeException {

    private final GameErrorCode code;

    public GameException(GameErrorCode code) {
        this(code, code.defaultMessage());
    }

    public GameException(GameErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GameException(GameErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public GameErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.category();
    }
}
