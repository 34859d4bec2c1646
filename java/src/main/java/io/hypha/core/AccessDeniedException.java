package io.hypha.core;

/**
 * Raised when a caller violates a workspace security rule. Callers can inspect the workspace the
 * operation targeted and the client that attempted it.
 */
public final class AccessDeniedException extends HyphaException {

    private static final long serialVersionUID = 1L;

    private final String workspace;
    private final String caller;

    public AccessDeniedException(String workspace, String caller, String message) {
        super(message);
        this.workspace = workspace;
        this.caller = caller;
    }

    /**
     * @return workspace the denied operation targeted.
     */
    public String getWorkspace() {
        return workspace;
    }

    /**
     * @return client id of the caller (nullable when the context carried none).
     */
    public String getCaller() {
        return caller;
    }
}
