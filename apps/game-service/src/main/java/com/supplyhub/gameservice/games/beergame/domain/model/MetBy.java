package com.supplyhub.gameservice.games.beergame.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * ValueExceed 条件的判定方式
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MetBy.SinglePlayer.class, name = "SinglePlayer"),
        @JsonSubTypes.Type(value = MetBy.Average.class, name = "Average"),
        @JsonSubTypes.Type(value = MetBy.AllPlayers.class, name = "AllPlayers"),
        @JsonSubTypes.Type(value = MetBy.PlayerPercent.class, name = "PlayerPercent")
})
public sealed interface MetBy {

    /** 任一玩家严格超过阈值，目标为超过的玩家 */
    @JsonTypeName("SinglePlayer")
    record SinglePlayer() implements MetBy {
    }

    /** 平均值严格超过阈值，目标为全体 */
    @JsonTypeName("Average")
    record Average() implements MetBy {
    }

    /** 全体玩家均不低于阈值；遇到第一个不达标即判否 */
    @JsonTypeName("AllPlayers")
    record AllPlayers() implements MetBy {
    }

    /** 超过阈值的玩家占比（百分数）大于 percent；旧版配置兼容 */
    record PlayerPercent(long percent) implements MetBy {
    }
}
