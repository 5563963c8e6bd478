package com.supplyhub.gameservice.games.beergame.domain.error;

/**
 * 引擎错误码：每个错误码归属一个 {@link ErrorCategory}，并给出对外的 HTTP 状态与默认提示。
 */
public enum GameErrorCode {

    CLASS_SETTING_MISSING(ErrorCategory.CONFIGURATION, 400, "职业配置缺失"),
    CLASS_NOT_ASSIGNED(ErrorCategory.CONFIGURATION, 400, "玩家未分配职业"),
    EMPTY_ORDER_LIST(ErrorCategory.CONFIGURATION, 400, "需求/供给序列为空"),
    EMPTY_ROSTER(ErrorCategory.CONFIGURATION, 400, "玩家名单为空"),
    INVALID_ROSTER(ErrorCategory.CONFIGURATION, 400, "玩家名单非法"),

    INVALID_ORDER(ErrorCategory.REJECTED, 400, "订单数量非法"),
    INSUFFICIENT_MONEY(ErrorCategory.REJECTED, 409, "余额不足"),
    ALREADY_SUBMITTED(ErrorCategory.REJECTED, 409, "本回合已提交"),
    NOT_IN_GAME(ErrorCategory.REJECTED, 403, "玩家不在本局游戏中"),
    LOBBY_NOT_FOUND(ErrorCategory.REJECTED, 404, "大厅不存在"),
    GAME_ALREADY_STARTED(ErrorCategory.REJECTED, 409, "游戏已开始"),
    GAME_NOT_STARTED(ErrorCategory.REJECTED, 409, "游戏尚未开始"),
    GAME_FINISHED(ErrorCategory.REJECTED, 409, "游戏已结束"),

    PENDING_ORDER_MISSING(ErrorCategory.INTERNAL, 500, "缺少待处理订单"),
    PLAYER_STATE_MISSING(ErrorCategory.INTERNAL, 500, "缺少玩家状态"),
    LOBBY_STATE_MISSING(ErrorCategory.INTERNAL, 500, "缺少大厅运行时状态"),
    EVENT_PROCESSING_FAILED(ErrorCategory.INTERNAL, 500, "回合事件处理失败"),

    SNAPSHOT_WRITE_FAILED(ErrorCategory.PERSISTENCE, 500, "回合快照写入失败"),
    SNAPSHOT_READ_FAILED(ErrorCategory.PERSISTENCE, 500, "回合快照读取失败"),
    LOBBY_WRITE_FAILED(ErrorCategory.PERSISTENCE, 500, "大厅记录写入失败");

    private final ErrorCategory category;
    private final int httpStatus;
    private final String defaultMessage;

    GameErrorCode(ErrorCategory category, int httpStatus, String defaultMessage) {
        this.category = category;
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public ErrorCategory category() {
        return category;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
