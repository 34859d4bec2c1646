package io.hypha.core;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable configuration used to bootstrap {@link HyphaCore} instances.
 */
public final class HyphaConfig {

    public static final Duration DEFAULT_SERVICE_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofSeconds(86400);
    public static final List<Duration> DEFAULT_SETUP_RETRY_DELAYS =
        List.of(Duration.ofMillis(100), Duration.ofMillis(400), Duration.ofMillis(1600));
    public static final Duration DEFAULT_READY_TIMEOUT = Duration.ofSeconds(60);
    public static final String DEFAULT_ISSUER = "hypha-core";
    public static final String DEFAULT_AUDIENCE = "hypha-api";
    public static final String DEFAULT_MANAGER_CLIENT_ID = "workspace-manager";

    private final String jwtSecret;
    private final Duration serviceTimeout;
    private final Duration tokenTtl;
    private final List<Duration> setupRetryDelays;
    private final Duration clientReadyTimeout;
    private final Duration connectionReadyTimeout;
    private final String issuer;
    private final String audience;
    private final String managerClientId;
    private final Clock clock;

    private HyphaConfig(Builder builder) {
        this.jwtSecret = builder.jwtSecret;
        this.serviceTimeout = builder.serviceTimeout;
        this.tokenTtl = builder.tokenTtl;
        this.setupRetryDelays = builder.setupRetryDelays == null ? null : List.copyOf(builder.setupRetryDelays);
        this.clientReadyTimeout = builder.clientReadyTimeout;
        this.connectionReadyTimeout = builder.connectionReadyTimeout;
        this.issuer = builder.issuer;
        this.audience = builder.audience;
        this.managerClientId = builder.managerClientId;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fills unset values with defaults and validates the rest.
     *
     * @throws IllegalArgumentException for negative retry delays or a manager client id holding separators
     */
    public HyphaConfig withDefaults() {
        List<Duration> delays = Optional.ofNullable(setupRetryDelays).orElse(DEFAULT_SETUP_RETRY_DELAYS);
        for (Duration delay : delays) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("SetupRetryDelays cannot contain negative values");
            }
        }

        String manager = Optional.ofNullable(managerClientId)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_MANAGER_CLIENT_ID);
        if (manager.contains("/") || manager.contains(":") || manager.contains("@")) {
            throw new IllegalArgumentException("ManagerClientId must not contain '/', ':' or '@'");
        }

        return new Builder()
            .jwtSecret(jwtSecret == null || jwtSecret.isEmpty() ? null : jwtSecret)
            .serviceTimeout(positiveOr(serviceTimeout, DEFAULT_SERVICE_TIMEOUT))
            .tokenTtl(positiveOr(tokenTtl, DEFAULT_TOKEN_TTL))
            .setupRetryDelays(delays)
            .clientReadyTimeout(positiveOr(clientReadyTimeout, DEFAULT_READY_TIMEOUT))
            .connectionReadyTimeout(positiveOr(connectionReadyTimeout, DEFAULT_READY_TIMEOUT))
            .issuer(textOr(issuer, DEFAULT_ISSUER))
            .audience(textOr(audience, DEFAULT_AUDIENCE))
            .managerClientId(manager)
            .clock(Optional.ofNullable(clock).orElse(Clock.systemUTC()))
            .build();
    }

    public String getJwtSecret() {
        return jwtSecret;
    }

    public Duration getServiceTimeout() {
        return serviceTimeout;
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public List<Duration> getSetupRetryDelays() {
        return setupRetryDelays;
    }

    public Duration getClientReadyTimeout() {
        return clientReadyTimeout;
    }

    public Duration getConnectionReadyTimeout() {
        return connectionReadyTimeout;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getAudience() {
        return audience;
    }

    public String getManagerClientId() {
        return managerClientId;
    }

    public Clock getClock() {
        return clock;
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    private static String textOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    public static final class Builder {
        private String jwtSecret;
        private Duration serviceTimeout;
        private Duration tokenTtl;
        private List<Duration> setupRetryDelays;
        private Duration clientReadyTimeout;
        private Duration connectionReadyTimeout;
        private String issuer;
        private String audience;
        private String managerClientId;
        private Clock clock;

        private Builder() {
        }

        public Builder jwtSecret(String jwtSecret) {
            this.jwtSecret = jwtSecret;
            return this;
        }

        public Builder serviceTimeout(Duration serviceTimeout) {
            this.serviceTimeout = serviceTimeout;
            return this;
        }

        public Builder tokenTtl(Duration tokenTtl) {
            this.tokenTtl = tokenTtl;
            return this;
        }

        public Builder setupRetryDelays(List<Duration> setupRetryDelays) {
            this.setupRetryDelays = setupRetryDelays;
            return this;
        }

        public Builder clientReadyTimeout(Duration clientReadyTimeout) {
            this.clientReadyTimeout = clientReadyTimeout;
            return this;
        }

        public Builder connectionReadyTimeout(Duration connectionReadyTimeout) {
            this.connectionReadyTimeout = connectionReadyTimeout;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audience(String audience) {
            this.audience = audience;
            return this;
        }

        public Builder managerClientId(String managerClientId) {
            this.managerClientId = managerClientId;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public HyphaConfig build() {
            return new HyphaConfig(this);
        }
    }
}
