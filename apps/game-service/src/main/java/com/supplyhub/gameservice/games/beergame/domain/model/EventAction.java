package com.supplyhub.gameservice.games.beergame.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.supplyhub.gameservice.games.beergame.domain.enums.ActionTarget;
import com.supplyhub.gameservice.games.beergame.domain.enums.Resource;

/**
 * 事件动作，条件成立后按配置顺序执行
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EventAction.ShowMessage.class, name = "ShowMessage"),
        @JsonSubTypes.Type(value = EventAction.ChangeSettings.class, name = "ChangeSettings"),
        @JsonSubTypes.Type(value = EventAction.AddResource.class, name = "AddResource")
})
public sealed interface EventAction {

    record ShowMessage(String message, ActionTarget target) implements EventAction {
    }

    /** 整体替换设置：写回大厅记录并覆盖内存中的设置 */
    record ChangeSettings(Settings newSettings) implements EventAction {
    }

    record AddResource(Resource resource, ActionTarget target, long value) implements EventAction {
    }
}
