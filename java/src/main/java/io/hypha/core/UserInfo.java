package io.hypha.core;

import java.util.List;

/**
 * Identity attached to a caller context.
 */
public record UserInfo(
    String id,
    String email,
    List<String> roles,
    List<String> scopes,
    boolean anonymous
) {

    public static final String ANONYMOUS_ID = "anonymous";

    public UserInfo {
        roles = roles == null ? List.of() : List.copyOf(roles);
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public static UserInfo anonymousUser() {
        return new UserInfo(ANONYMOUS_ID, "anonymous@localhost", List.of("anonymous"), List.of("read"), true);
    }
}
