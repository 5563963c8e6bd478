package com.supplyhub.gameservice.games.beergame.interfaces.http.dto;

import com.supplyhub.gameservice.games.beergame.domain.enums.UserStatsType;
import lombok.Data;

import java.util.List;

@Data
public class StatsRequest {
    /** 为空表示全部统计项 */
    private List<UserStatsType> kinds;
}
