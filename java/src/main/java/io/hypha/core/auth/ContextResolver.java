package io.hypha.core.auth;

import io.hypha.core.CallerContext;
import io.hypha.core.HyphaException;
import io.hypha.core.UserInfo;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Logger;

/**
 * Turns bearer tokens into caller contexts. Missing or invalid tokens yield an anonymous caller in
 * the {@code default} workspace.
 */
public final class ContextResolver {

    private static final Logger LOGGER = Logger.getLogger(ContextResolver.class.getName());
    private static final String FALLBACK_WORKSPACE = "default";

    private final TokenIssuer issuer;
    private final Clock clock;

    public ContextResolver(TokenIssuer issuer, Clock clock) {
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CallerContext fromToken(String token) {
        return fromToken(token, null, null);
    }

    /**
     * @param token             bearer token, may be {@code null}
     * @param workspaceOverride workspace to use instead of the token's, may be {@code null}
     * @param clientOverride    client id to use instead of the token's, may be {@code null}
     */
    public CallerContext fromToken(String token, String workspaceOverride, String clientOverride) {
        TokenClaims claims = null;
        if (token != null && !token.isBlank()) {
            try {
                claims = issuer.verify(token);
            } catch (HyphaException ex) {
                LOGGER.warning(() -> "[hypha-core] invalid auth token, falling back to anonymous context: " + ex.getMessage());
            }
        }

        UserInfo user = claims == null
            ? UserInfo.anonymousUser()
            : new UserInfo(
                claims.sub() == null ? UserInfo.ANONYMOUS_ID : claims.sub(),
                claims.email() == null ? "" : claims.email(),
                claims.roles(),
                claims.scopes(),
                false);

        String workspace = firstNonEmpty(workspaceOverride, claims == null ? null : claims.workspace(), FALLBACK_WORKSPACE);
        String clientId = firstNonEmpty(clientOverride, claims == null ? null : claims.clientId(), anonymousClientId());
        CallerContext context = CallerContext.of(workspace, clientId, user);
        LOGGER.fine(() -> String.format(Locale.ROOT, "[hypha-core] %s caller: user=%s, from=%s",
            user.anonymous() ? "anonymous" : "authenticated", user.id(), context.from()));
        return context;
    }

    private String anonymousClientId() {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "anonymous-http-" + clock.millis() + "-" + random.substring(0, Math.min(6, random.length()));
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
