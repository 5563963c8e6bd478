package com.supplyhub.gameservice.platform.ws;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebSocketAuthChannelInterceptorTest {

    private static final UUID PLAYER = UUID.fromString("0f8d8f58-6a65-4f5e-9c55-2c1b7f0f4a11");

    @Mock
    private JwtDecoder jwtDecoder;
    @Mock
    private MessageChannel channel;

    private static StompHeaderAccessor connect(String header, String value) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        accessor.setNativeHeader(header, value);
        accessor.setLeaveMutable(true);
        return accessor;
    }

    private static Message<byte[]> message(StompHeaderAccessor accessor) {
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    @Test
    void principalNameIsJwtSubject() {
        Jwt jwt = Jwt.withTokenValue("abc").header("alg", "none").subject(PLAYER.toString())
                .claim("preferred_username", "alice").build();
        when(jwtDecoder.decode("abc")).thenReturn(jwt);
        StompHeaderAccessor accessor = connect("Authorization", "Bearer abc");

        new WebSocketAuthChannelInterceptor(jwtDecoder).preSend(message(accessor), channel);

        assertEquals(PLAYER.toString(), accessor.getUser().getName());
    }

    @Test
    void invalidTokenLeavesConnectionAnonymous() {
        when(jwtDecoder.decode("bad")).thenThrow(new BadJwtException("expired"));
        StompHeaderAccessor accessor = connect("access_token", "bad");

        new WebSocketAuthChannelInterceptor(jwtDecoder).preSend(message(accessor), channel);

        assertNull(accessor.getUser());
    }
}
