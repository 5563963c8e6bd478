package com.supplyhub.gameservice.games.beergame.domain.constants;

/**
 * 啤酒游戏相关的用户可见消息常量
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    /** 余额不足（需要格式化：订单金额、当前余额） */
    public static final String INSUFFICIENT_MONEY = "余额不足：订单金额 %d，当前余额 %d";

    public static String formatInsufficientMoney(long cost, long money) {
        return String.format(INSUFFICIENT_MONEY, cost, money);
    }

    /** 订单数量为负 */
    public static final String NEGATIVE_ORDER = "订单数量不能为负数: %d";

    public static String formatNegativeOrder(long quantity) {
        return String.format(NEGATIVE_ORDER, quantity);
    }

    public static final String ALREADY_SUBMITTED = "本回合已提交订单，请等待其他玩家";

    public static final String NOT_IN_GAME = "你不在本局游戏中";

    public static final String LOBBY_NOT_FOUND = "大厅不存在: %s";

    public static String formatLobbyNotFound(Object lobbyId) {
        return String.format(LOBBY_NOT_FOUND, lobbyId);
    }

    public static final String GAME_ALREADY_STARTED = "游戏已开始，无法执行该操作";

    public static final String GAME_NOT_STARTED = "游戏尚未开始";

    public static final String GAME_FINISHED = "游戏已结束";

    /** 回合结算失败时广播给整个大厅 */
    public static final String ROUND_FINISH_FAILED = "回合结算失败，本回合最后一笔订单未生效，请重新提交";

    /** 新回合事件处理失败时广播给整个大厅 */
    public static final String EVENT_PROCESSING_FAILED = "回合事件处理失败";

    /** 大厅关闭时通知客户端断开 */
    public static final String LOBBY_CLOSED = "大厅已关闭";

    public static final String ONLY_ADMIN = "只有管理员可以执行该操作";
}
