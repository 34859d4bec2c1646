package io.hypha.core;

import java.util.Objects;

/**
 * Who is calling and from which workspace. {@code from} is the caller's fully qualified client id,
 * {@code <workspace>/<client>}.
 */
public record CallerContext(String workspace, String from, UserInfo user) {

    public CallerContext {
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(from, "from");
        user = user == null ? UserInfo.anonymousUser() : user;
    }

    public static CallerContext of(String workspace, String clientId, UserInfo user) {
        Objects.requireNonNull(clientId, "clientId");
        return new CallerContext(workspace, workspace + "/" + clientId, user);
    }

    /**
     * @return the client part of {@link #from()}, i.e. the text after the first {@code /}.
     */
    public String clientId() {
        int slash = from.indexOf('/');
        return slash < 0 ? from : from.substring(slash + 1);
    }
}
