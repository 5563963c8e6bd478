package com.supplyhub.web.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 当前玩家信息提取工具类
 *
 * 统一从 JWT token 中提取玩家ID、用户名与 Realm 角色。
 * 游戏引擎内玩家以 UUID 标识，因此 subject 必须是合法 UUID。
 *
 * 使用方式：
 * <pre>
 * {@code
 * @PostMapping("/start")
 * public ApiResponse<?> start(@AuthenticationPrincipal Jwt jwt) {
 *     CurrentUserInfo user = CurrentUserHelper.from(jwt);
 *     if (!user.hasRealmRole("game-admin")) { ... }
 * }
 * }
 * </pre>
 */
@Slf4j
public final class CurrentUserHelper {

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 从 JWT token 中提取当前玩家信息
     *
     * @param jwt JWT token（从 @AuthenticationPrincipal 注入）
     * @return 当前玩家信息，jwt 为 null 时返回 null
     * @throws IllegalArgumentException subject 不是合法 UUID
     */
    public static CurrentUserInfo from(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        UUID playerId = parsePlayerId(jwt.getSubject());
        String username = Optional.ofNullable(jwt.getClaimAsString("preferred_username"))
                .filter(s -> !s.isBlank())
                .orElse(jwt.getSubject());
        return new CurrentUserInfo(playerId, username, extractRealmRoles(jwt));
    }

    /**
     * 快速获取玩家ID
     */
    public static UUID getPlayerId(Jwt jwt) {
        return jwt != null ? parsePlayerId(jwt.getSubject()) : null;
    }

    /**
     * 把 Principal 名称 / subject 解析为玩家ID
     */
    public static UUID parsePlayerId(String subject) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("缺少玩家身份");
        }
        try {
            return UUID.fromString(subject.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("玩家身份不是合法 UUID: " + subject, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Collection<String> extractRealmRoles(Jwt jwt) {
        try {
            Object realmAccess = jwt.getClaim("realm_access");
            if (realmAccess instanceof Map<?, ?> realm) {
                Object roles = realm.get("roles");
                if (roles instanceof Collection<?> r) {
                    return (Collection<String>) r;
                }
            }
        } catch (Exception e) {
            log.debug("提取 Realm 角色失败", e);
        }
        return Collections.emptyList();
    }
}
