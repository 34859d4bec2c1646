package io.hypha.core.auth;

import io.hypha.core.AccessDeniedException;
import io.hypha.core.CallerContext;
import io.hypha.core.HyphaException;
import io.hypha.core.UserInfo;
import io.hypha.core.security.AccessGuard;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TokenIssuerTest {

    private static final long NOW = 1_700_000_000L;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);

    private final TokenIssuer issuer =
        new TokenIssuer("s3cret", Duration.ofSeconds(86400), "hypha-core", "hypha-api", CLOCK, new AccessGuard());

    private static CallerContext caller(String workspace, String client) {
        UserInfo user = new UserInfo("user-1", "u@example.com", List.of("member"), List.of(), false);
        return CallerContext.of(workspace, client, user);
    }

    @Test
    void fillsDefaultClaimsFromCaller() throws Exception {
        String token = issuer.issue(TokenRequest.defaults(), caller("ws1", "alice"));

        TokenClaims claims = issuer.verify(token);
        assertEquals("user-1", claims.sub());
        assertEquals("ws1", claims.workspace());
        assertEquals("alice", claims.clientId());
        assertEquals("u@example.com", claims.email());
        assertEquals(List.of("member"), claims.roles());
        assertEquals(Long.valueOf(NOW), claims.iat());
        assertEquals(Long.valueOf(NOW + 86400), claims.exp());
        assertEquals("hypha-core", claims.iss());
        assertEquals("hypha-api", claims.aud());
    }

    @Test
    void requestOverridesDefaults() throws Exception {
        TokenRequest request = TokenRequest.builder()
            .userId("temp-user")
            .clientId("worker")
            .scopes(List.of("read", "write"))
            .expiresIn(300L)
            .build();

        TokenClaims claims = issuer.verify(issuer.issue(request, caller("ws1", "alice")));

        assertEquals("temp-user", claims.sub());
        assertEquals("worker", claims.clientId());
        assertEquals("read write", claims.scope());
        assertEquals(Long.valueOf(NOW + 300), claims.exp());
    }

    @Test
    void crossWorkspaceTokensRequireRootInDefault() throws Exception {
        TokenRequest request = TokenRequest.builder().workspace("ws2").build();

        AccessDeniedException ex =
            assertThrows(AccessDeniedException.class, () -> issuer.issue(request, caller("ws1", "alice")));
        assertEquals("ws2", ex.getWorkspace());

        String token = issuer.issue(request, caller("default", "root"));
        assertEquals("ws2", issuer.verify(token).workspace());
    }

    @Test
    void missingSecretIsReported() {
        TokenIssuer unconfigured =
            new TokenIssuer(null, Duration.ofSeconds(60), "hypha-core", "hypha-api", CLOCK, new AccessGuard());

        HyphaException ex = assertThrows(HyphaException.class,
            () -> unconfigured.issue(TokenRequest.defaults(), caller("ws1", "alice")));
        assertEquals("JWT secret not configured on server", ex.getMessage());
    }
}
