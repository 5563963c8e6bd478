package com.supplyhub.gameservice.games.beergame.domain.error;

/**
 * 错误大类
 */
public enum ErrorCategory {

    CONFIGURATION, // 配置缺失 / 非法（职业定价、起始队列、空序列、空名单）
    REJECTED,      // 业务拒绝（余额不足、大厅不存在、状态不符）
    INTERNAL,      // 内部一致性被破坏（应有的排队订单 / 大厅状态缺失）
    PERSISTENCE    // 快照或大厅记录读写失败
}
