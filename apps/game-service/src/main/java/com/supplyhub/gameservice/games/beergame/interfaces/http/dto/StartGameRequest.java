package com.supplyhub.gameservice.games.beergame.interfaces.http.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 开局请求：roster 的顺序即供应链顺序：首位接收外部供给，末位面对外部需求
 */
@Data
public class StartGameRequest {
    @NotEmpty
    private List<@NotNull UUID> roster;
    /** 可空：为空时使用开局前保存的职业分配 */
    private Map<UUID, Integer> classes;
}
