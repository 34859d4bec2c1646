package io.hypha.core.security;

import io.hypha.core.AccessDeniedException;
import io.hypha.core.CallerContext;
import io.hypha.core.address.AddressNormalizer;
import io.hypha.core.address.RegistrationId;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Security rules for registration and token issuance.
 *
 * <p>
 * Rules are evaluated on the id the caller supplied (without the workspace prefix added during
 * canonicalization) so that rewriting cannot turn a denied id into an allowed one.
 * </p>
 */
public final class AccessGuard {

    private static final Logger LOGGER = Logger.getLogger(AccessGuard.class.getName());

    public static final String DEFAULT_WORKSPACE = "default";
    public static final String ROOT_CLIENT = "root";

    /**
     * Only root may register ordinary services into the {@code default} workspace. Built-in services
     * and a client's own default service are exempt.
     */
    public void checkRegistration(RegistrationId id, CallerContext context) throws AccessDeniedException {
        if (!DEFAULT_WORKSPACE.equals(id.workspace())) {
            return;
        }
        if (isRoot(context) || isBuiltIn(id.simpleId()) || isLegitimateDefault(id.simpleId(), context)) {
            return;
        }
        LOGGER.warning(() -> String.format(Locale.ROOT,
            "[hypha-core] denied registration of %s by %s", id.fullId(), context.from()));
        throw new AccessDeniedException(id.workspace(), context.from(),
            "Access denied: Only root user can register services in '" + id.workspace()
                + "' workspace. Current client: " + context.from());
    }

    /**
     * Tokens for another workspace may only be minted by the root client of the default workspace.
     */
    public void checkTokenIssuance(String targetWorkspace, CallerContext context) throws AccessDeniedException {
        if (targetWorkspace.equals(context.workspace())) {
            return;
        }
        if (DEFAULT_WORKSPACE.equals(context.workspace()) && ROOT_CLIENT.equals(context.clientId())) {
            return;
        }
        throw new AccessDeniedException(targetWorkspace, context.from(),
            "Access denied: Cannot generate token for workspace '" + targetWorkspace + "' from workspace '"
                + context.workspace() + "' with client '" + context.clientId()
                + "'. Only root client in default workspace can generate cross-workspace tokens.");
    }

    static boolean isRoot(CallerContext context) {
        return context.from().endsWith("/" + ROOT_CLIENT);
    }

    static boolean isBuiltIn(String simpleId) {
        return simpleId.contains(":" + AddressNormalizer.BUILT_IN_SERVICE)
            || AddressNormalizer.BUILT_IN_SERVICE.equals(simpleId);
    }

    static boolean isLegitimateDefault(String simpleId, CallerContext context) {
        if (AddressNormalizer.DEFAULT_SERVICE.equals(simpleId)) {
            return true;
        }
        String suffix = ":" + AddressNormalizer.DEFAULT_SERVICE;
        if (!simpleId.endsWith(suffix)) {
            return false;
        }
        String owner = simpleId.substring(0, simpleId.indexOf(':'));
        return owner.equals(context.clientId());
    }
}
