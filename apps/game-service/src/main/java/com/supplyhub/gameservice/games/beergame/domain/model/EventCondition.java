package com.supplyhub.gameservice.games.beergame.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.supplyhub.gameservice.games.beergame.domain.enums.Resource;

/**
 * 事件触发条件
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EventCondition.RoundMet.class, name = "RoundMet"),
        @JsonSubTypes.Type(value = EventCondition.ValueExceed.class, name = "ValueExceed"),
        @JsonSubTypes.Type(value = EventCondition.SingleChange.class, name = "SingleChange")
})
public sealed interface EventCondition {

    /** 当前回合等于 round */
    record RoundMet(long round) implements EventCondition {
    }

    record ValueExceed(Resource resource, MetBy metBy, long value) implements EventCondition {
    }

    /** 与上一回合快照相比，某玩家该数值变化的绝对值超过 value */
    record SingleChange(Resource resource, long value) implements EventCondition {
    }
}
