package com.supplyhub.gameservice.games.beergame.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 啤酒游戏相关配置。
 *
 * 支持通过 application.yml（beergame.*）或环境变量覆盖。
 */
@Component
@ConfigurationProperties(prefix = "beergame")
public class BeerGameProperties {

    /**
     * 大厅未声明最大人数时的广播缓冲容量
     */
    private int broadcastBacklog = 33;

    /**
     * 玩家 → 大厅 关联在 Redis 中的存活时间
     */
    private Duration playerBindingTtl = Duration.ofHours(48);

    /**
     * 允许开局 / 开关大厅的 realm 角色
     */
    private String adminRole = "game-admin";

    /**
     * STOMP 端点路径
     */
    private String wsEndpoint = "/beergame-ws";

    /**
     * 广播缓冲容量：优先使用大厅最大人数
     */
    public int backlogFor(int maxPlayers) {
        return maxPlayers > 0 ? maxPlayers : broadcastBacklog;
    }

    public int getBroadcastBacklog() {
        return broadcastBacklog;
    }

    public void setBroadcastBacklog(int broadcastBacklog) {
        this.broadcastBacklog = broadcastBacklog;
    }

    public Duration getPlayerBindingTtl() {
        return playerBindingTtl;
    }

    public void setPlayerBindingTtl(Duration playerBindingTtl) {
        this.playerBindingTtl = playerBindingTtl;
    }

    public String getAdminRole() {
        return adminRole;
    }

    public void setAdminRole(String adminRole) {
        this.adminRole = adminRole;
    }

    public String getWsEndpoint() {
        return wsEndpoint;
    }

    public void setWsEndpoint(String wsEndpoint) {
        this.wsEndpoint = wsEndpoint;
    }
}
