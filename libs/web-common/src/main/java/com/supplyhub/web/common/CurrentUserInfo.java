package com.supplyhub.web.common;

import java.util.Collection;
import java.util.UUID;

/**
 * 当前玩家信息 DTO
 * 从 JWT token 中提取，统一封装
 */
public record CurrentUserInfo(
    /** 玩家ID（Keycloak subject，UUID格式） */
    UUID playerId,

    /** 用户名（preferred_username，没有则使用 playerId） */
    String username,

    /** Realm 角色列表 */
    Collection<String> realmRoles
) {
    /**
     * 检查玩家是否有指定 realm 角色
     */
    public boolean hasRealmRole(String role) {
        return realmRoles != null && realmRoles.contains(role);
    }
}
