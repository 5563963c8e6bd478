package com.supplyhub.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * WebSocket STOMP 认证拦截器
 *
 * 在 CONNECT 阶段验证 JWT 并设置用户身份。
 * Principal 名称取 JWT subject（玩家 UUID），/user 点对点投递依赖这一点。
 * 验证失败时不设置用户，后续操作会因缺少用户而失败。
 */
@Slf4j
@Component
public class WebSocketAuthChannelInterceptor implements ChannelInterceptor {

    private final JwtDecoder jwtDecoder;
    private final JwtGrantedAuthoritiesConverter authoritiesConverter = new JwtGrantedAuthoritiesConverter();

    public WebSocketAuthChannelInterceptor(JwtDecoder jwtDecoder) {
        this.jwtDecoder = jwtDecoder;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        String token = extractToken(accessor);
        if (token == null) {
            log.debug("STOMP CONNECT 未携带 token，session={}", accessor.getSessionId());
            return message;
        }
        try {
            Jwt jwt = jwtDecoder.decode(token);
            Collection<GrantedAuthority> authorities = authoritiesConverter.convert(jwt);
            accessor.setUser(new JwtAuthenticationToken(jwt, authorities, jwt.getSubject()));
        } catch (JwtException e) {
            log.warn("STOMP CONNECT token 校验失败，session={}, reason={}", accessor.getSessionId(), e.getMessage());
        }
        return message;
    }

    /**
     * 支持 Authorization: Bearer xxx 或 access_token: xxx
     */
    static String extractToken(StompHeaderAccessor accessor) {
        String auth = firstHeader(accessor, "Authorization");
        if (auth == null) auth = firstHeader(accessor, "authorization");
        if (StringUtils.startsWithIgnoreCase(auth, "Bearer ")) {
            return StringUtils.trimToNull(auth.substring(7));
        }
        return StringUtils.trimToNull(firstHeader(accessor, "access_token"));
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
