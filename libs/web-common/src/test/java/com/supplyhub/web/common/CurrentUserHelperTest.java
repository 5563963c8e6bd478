package com.supplyhub.web.common;

import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CurrentUserHelperTest {

    private static Jwt jwt(String subject, Map<String, Object> claims) {
        Jwt.Builder builder = Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject(subject);
        claims.forEach(builder::claim);
        return builder.build();
    }

    @Test
    void extractsPlayerIdUsernameAndRoles() {
        UUID id = UUID.randomUUID();
        Jwt token = jwt(id.toString(), Map.of(
                "preferred_username", "alice",
                "realm_access", Map.of("roles", List.of("game-admin", "player"))));

        CurrentUserInfo user = CurrentUserHelper.from(token);

        assertEquals(id, user.playerId());
        assertEquals("alice", user.username());
        assertTrue(user.hasRealmRole("game-admin"));
        assertFalse(user.hasRealmRole("owner"));
    }

    @Test
    void fallsBackToSubjectWhenUsernameMissing() {
        UUID id = UUID.randomUUID();
        CurrentUserInfo user = CurrentUserHelper.from(jwt(id.toString(), Map.of("scope", "openid")));

        assertEquals(id.toString(), user.username());
        assertTrue(user.realmRoles().isEmpty());
    }

    @Test
    void rejectsNonUuidSubject() {
        assertThrows(IllegalArgumentException.class, () -> CurrentUserHelper.parsePlayerId("not-a-uuid"));
        assertThrows(IllegalArgumentException.class, () -> CurrentUserHelper.parsePlayerId(" "));
        assertNull(CurrentUserHelper.from(null));
    }
}
