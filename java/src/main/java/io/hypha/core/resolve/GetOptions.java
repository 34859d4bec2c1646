package io.hypha.core.resolve;

import java.time.Duration;
import java.util.Locale;

/**
 * Options for {@link ServiceResolver#get}.
 */
public final class GetOptions {

    public static final String MODE_DEFAULT = "default";
    public static final String MODE_RANDOM = "random";

    private final String mode;
    private final boolean skipTimeout;
    private final Duration timeout;

    private GetOptions(Builder builder) {
        this.mode = builder.mode;
        this.skipTimeout = builder.skipTimeout;
        this.timeout = builder.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GetOptions defaults() {
        return builder().build();
    }

    public String getMode() {
        return mode;
    }

    public boolean isRandom() {
        return MODE_RANDOM.equals(mode);
    }

    public boolean isSkipTimeout() {
        return skipTimeout;
    }

    /**
     * @return the per-fetch timeout, or {@code null} to use the resolver's default.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public static final class Builder {
        private String mode = MODE_DEFAULT;
        private boolean skipTimeout;
        private Duration timeout;

        private Builder() {
        }

        public Builder mode(String mode) {
            String value = mode == null ? MODE_DEFAULT : mode.trim().toLowerCase(Locale.ROOT);
            if (!MODE_DEFAULT.equals(value) && !MODE_RANDOM.equals(value)) {
                throw new IllegalArgumentException("unsupported mode " + mode);
            }
            this.mode = value;
            return this;
        }

        public Builder skipTimeout(boolean skipTimeout) {
            this.skipTimeout = skipTimeout;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public GetOptions build() {
            return new GetOptions(this);
        }
    }
}
