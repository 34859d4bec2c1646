package io.hypha.core.auth;

import io.hypha.core.CallerContext;
import io.hypha.core.HyphaException;
import io.hypha.core.UserInfo;
import io.hypha.core.security.AccessGuard;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Mints and verifies workspace-scoped HS256 tokens with the deployment's shared secret.
 */
public final class TokenIssuer {

    private static final Logger LOGGER = Logger.getLogger(TokenIssuer.class.getName());

    private final String secret;
    private final Duration defaultTtl;
    private final String issuer;
    private final String audience;
    private final Clock clock;
    private final AccessGuard guard;

    public TokenIssuer(String secret, Duration defaultTtl, String issuer, String audience, Clock clock, AccessGuard guard) {
        this.secret = secret;
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.audience = Objects.requireNonNull(audience, "audience");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    public String generate(TokenClaims claims) throws HyphaException {
        return JwtHs256.generate(claims, requireSecret());
    }

    public TokenClaims verify(String token) throws HyphaException {
        return JwtHs256.verify(token, requireSecret(), clock);
    }

    /**
     * Assembles default claims for the caller and signs them.
     *
     * @throws io.hypha.core.AccessDeniedException when the target workspace differs from the caller's
     *                                             and the caller is not root in {@code default}
     */
    public String issue(TokenRequest request, CallerContext context) throws HyphaException {
        Objects.requireNonNull(context, "context");
        TokenRequest effective = request == null ? TokenRequest.defaults() : request;
        String targetWorkspace = effective.getWorkspace() != null ? effective.getWorkspace() : context.workspace();
        guard.checkTokenIssuance(targetWorkspace, context);

        TokenClaims claims = assemble(effective, targetWorkspace, context);
        String token = generate(claims);
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[hypha-core] issued token for %s in workspace %s (client %s, expires %d)",
            claims.sub(), claims.workspace(), claims.clientId(), claims.exp()));
        return token;
    }

    TokenClaims assemble(TokenRequest request, String targetWorkspace, CallerContext context) {
        UserInfo user = context.user();
        long now = clock.instant().getEpochSecond();
        long ttl = request.getExpiresIn() != null ? request.getExpiresIn() : defaultTtl.getSeconds();

        String sub = firstNonEmpty(request.getUserId(), user.id(), UserInfo.ANONYMOUS_ID);
        String clientId = firstNonEmpty(request.getClientId(), context.clientId(), "anonymous-" + clock.millis());
        String email = firstNonEmpty(request.getEmail(), user.email(), "");
        List<String> roles = request.getRoles() != null ? request.getRoles() : user.roles();
        String scope = request.getScopes() != null
            ? String.join(" ", request.getScopes())
            : firstNonEmpty(request.getScope(), "");

        return new TokenClaims(sub, targetWorkspace, clientId, email, roles, scope, now, now + ttl, issuer, audience);
    }

    private String requireSecret() throws HyphaException {
        if (secret == null || secret.isEmpty()) {
            throw new HyphaException("JWT secret not configured on server");
        }
        return secret;
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
