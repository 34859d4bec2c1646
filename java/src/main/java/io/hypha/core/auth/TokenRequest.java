package io.hypha.core.auth;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters for minting a workspace token. Unset fields fall back to the caller's context.
 */
public final class TokenRequest {

    private final String workspace;
    private final String userId;
    private final String clientId;
    private final String email;
    private final List<String> roles;
    private final String scope;
    private final List<String> scopes;
    private final Long expiresIn;

    private TokenRequest(Builder builder) {
        this.workspace = builder.workspace;
        this.userId = builder.userId;
        this.clientId = builder.clientId;
        this.email = builder.email;
        this.roles = builder.roles == null ? null : List.copyOf(builder.roles);
        this.scope = builder.scope;
        this.scopes = builder.scopes == null ? null : List.copyOf(builder.scopes);
        this.expiresIn = builder.expiresIn;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TokenRequest defaults() {
        return builder().build();
    }

    public String getWorkspace() {
        return workspace;
    }

    public String getUserId() {
        return userId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getEmail() {
        return email;
    }

    public List<String> getRoles() {
        return roles;
    }

    public String getScope() {
        return scope;
    }

    public List<String> getScopes() {
        return scopes;
    }

    /**
     * @return lifetime in seconds, or {@code null} for the configured default.
     */
    public Long getExpiresIn() {
        return expiresIn;
    }

    public static final class Builder {
        private String workspace;
        private String userId;
        private String clientId;
        private String email;
        private List<String> roles;
        private String scope;
        private List<String> scopes;
        private Long expiresIn;

        public Builder workspace(String workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder roles(List<String> roles) {
            this.roles = roles == null ? null : new ArrayList<>(roles);
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        /**
         * Takes precedence over {@link #scope(String)}; joined with single spaces.
         */
        public Builder scopes(List<String> scopes) {
            this.scopes = scopes == null ? null : new ArrayList<>(scopes);
            return this;
        }

        public Builder expiresIn(Long expiresIn) {
            this.expiresIn = expiresIn;
            return this;
        }

        public TokenRequest build() {
            return new TokenRequest(this);
        }
    }
}
