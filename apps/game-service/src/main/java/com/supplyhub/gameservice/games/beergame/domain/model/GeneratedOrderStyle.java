package com.supplyhub.gameservice.games.beergame.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * 需求 / 供给逐回合演化方式。
 * <p>
 * JSON 以 type 字段区分：Default / Linear / Multiplication / Exponential / List。
 * 具体计算见 {@code SettlementMath}。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = GeneratedOrderStyle.Default.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = GeneratedOrderStyle.Default.class, name = "Default"),
        @JsonSubTypes.Type(value = GeneratedOrderStyle.Linear.class, name = "Linear"),
        @JsonSubTypes.Type(value = GeneratedOrderStyle.Multiplication.class, name = "Multiplication"),
        @JsonSubTypes.Type(value = GeneratedOrderStyle.Exponential.class, name = "Exponential"),
        @JsonSubTypes.Type(value = GeneratedOrderStyle.ValueList.class, name = "List")
})
public sealed interface GeneratedOrderStyle {

    /** 上一值 ×1.5，初始值 10 */
    @JsonTypeName("Default")
    record Default() implements GeneratedOrderStyle {
    }

    /** 上一值 + increase */
    record Linear(long start, long increase) implements GeneratedOrderStyle {
    }

    /** 上一值 × increase */
    record Multiplication(long start, long increase) implements GeneratedOrderStyle {
    }

    /** 上一值 × modulator × (long) e^power */
    record Exponential(long start, int power, long modulator) implements GeneratedOrderStyle {
    }

    /** 按脚本回放固定序列，超出后停在最后一个值 */
    record ValueList(List<Long> values) implements GeneratedOrderStyle {
        public ValueList {
            values = values == null ? List.of() : List.copyOf(values);
        }
    }
}
