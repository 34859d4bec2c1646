package io.hypha.core.address;

import io.hypha.core.InvalidIdentifierException;
import io.hypha.core.InvalidQueryException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AddressNormalizerTest {

    private static final String WS = "ws1";

    @Test
    void workspaceAndClientResolvesToDefaultService() throws Exception {
        NormalizedQuery q = AddressNormalizer.normalize(ServiceQuery.ofId("ws2/bob"), WS);

        assertEquals(new ServiceIdentifier("*", "ws2", "bob", "default", "*"), q.address());
        assertNull(q.callerScoped());
        assertFalse(q.explicitAppId());
    }

    @Test
    void bareNameMatchesAnyClientInCallerWorkspace() throws Exception {
        NormalizedQuery q = AddressNormalizer.normalize(ServiceQuery.ofId("calc"), WS);

        assertEquals(new ServiceIdentifier("*", WS, "*", "calc", "*"), q.address());
        assertFalse(q.direct());
    }

    @Test
    void bareNameUsesQueryWorkspaceWhenGiven() throws Exception {
        ServiceQuery query = ServiceQuery.builder().id("calc").workspace("ws3").build();

        assertEquals("ws3", AddressNormalizer.normalize(query, WS).address().workspace());
    }

    @Test
    void clientAndServiceStayInCallerWorkspace() throws Exception {
        NormalizedQuery q = AddressNormalizer.normalize(ServiceQuery.ofId("bob:calc"), WS);

        assertEquals(new ServiceIdentifier("*", WS, "bob", "calc", "*"), q.address());
        assertFalse(q.direct());
    }

    @Test
    void fullyQualifiedIdIsDirect() throws Exception {
        NormalizedQuery q = AddressNormalizer.normalize(ServiceQuery.ofId("ws2/bob:calc"), WS);

        assertEquals("ws2/bob:calc", q.address().fullId());
        assertTrue(q.direct());
    }

    @Test
    void appSuffixDisablesDirectFetchAndAllowsLaunch() throws Exception {
        NormalizedQuery q = AddressNormalizer.normalize(ServiceQuery.ofId("ws2/bob:calc@app1"), WS);

        assertEquals("app1", q.address().appId());
        assertFalse(q.direct());
        assertTrue(q.launchable());
    }

    @Test
    void wildcardAppIsNotLaunchable() throws Exception {
        NormalizedQuery q = AddressNormalizer.normalize(ServiceQuery.ofId("calc@*"), WS);

        assertTrue(q.explicitAppId());
        assertFalse(q.launchable());
    }

    @Test
    void allWorkspacesForcesPublicAndAddsCallerScopedPattern() throws Exception {
        ServiceQuery query = ServiceQuery.builder().id("calc").workspace("*").build();

        NormalizedQuery q = AddressNormalizer.normalize(query, WS);

        assertEquals("services:public:*/*:calc@*", q.address().storageKey());
        assertEquals("services:*:ws1/*:calc@*", q.callerScoped().storageKey());
    }

    @Test
    void rejectsRepeatedSeparators() {
        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.normalize(ServiceQuery.ofId("a/b/c:d"), WS));
        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.normalize(ServiceQuery.ofId("a:b:c"), WS));
        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.normalize(ServiceQuery.ofId("a:b@c@d"), WS));
    }

    @Test
    void rejectsConflictingAppId() {
        ServiceQuery query = ServiceQuery.builder().id("bob:calc@one").appId("two").build();

        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.normalize(query, WS));
    }

    @Test
    void rejectsConflictingClientIdForDefaultShorthand() {
        ServiceQuery query = ServiceQuery.builder().id("ws2/bob").clientId("alice").build();

        InvalidIdentifierException ex =
            assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.normalize(query, WS));
        assertTrue(ex.getMessage().contains("alice"));
    }

    @Test
    void rejectsDisallowedCharacters() {
        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.normalize(ServiceQuery.ofId("bob:ca.lc"), WS));
    }

    @Test
    void normalizingTwiceGivesTheSameAddress() throws Exception {
        for (String id : List.of("calc", "bob:calc", "ws2/bob", "ws2/bob:calc", "ws2/bob:calc@app1", "bob:calc@x")) {
            ServiceIdentifier once = AddressNormalizer.normalize(ServiceQuery.ofId(id), WS).address();
            ServiceIdentifier twice = AddressNormalizer.normalize(ServiceQuery.ofId(once.toString()), WS).address();
            assertEquals(once, twice, id);
        }
    }

    @Test
    void registrationReusesQualifiedIds() throws Exception {
        RegistrationId id = AddressNormalizer.canonicalizeForRegistration("ws2/alice:calc", WS, "alice");

        assertEquals("ws2", id.workspace());
        assertEquals("alice:calc", id.simpleId());
        assertEquals("ws2/alice:calc", id.fullId());
    }

    @Test
    void registrationPrefixesCallerWorkspace() throws Exception {
        assertEquals("ws1/alice:default",
            AddressNormalizer.canonicalizeForRegistration("alice:default", WS, "alice").fullId());
        assertEquals("ws1/alice:built-in",
            AddressNormalizer.canonicalizeForRegistration("alice:built-in", WS, "alice").fullId());
    }

    @Test
    void bareReservedNameIsBoundToCallingClient() throws Exception {
        RegistrationId id = AddressNormalizer.canonicalizeForRegistration("built-in", WS, "alice");

        assertEquals("ws1/alice:built-in", id.fullId());
        assertEquals("built-in", id.simpleId());
    }

    @Test
    void registrationRejectsMalformedIds() {
        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.canonicalizeForRegistration("calc", WS, "alice"));
        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.canonicalizeForRegistration("alice:calc", WS, "alice"));
        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.canonicalizeForRegistration("alice:default@a", WS, "alice"));
        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.canonicalizeForRegistration(" ", WS, "alice"));
    }

    @Test
    void registrationScopeDoesNotValidateShape() throws Exception {
        RegistrationId scope = AddressNormalizer.registrationScope("foo", "default");

        assertEquals("default", scope.workspace());
        assertEquals("foo", scope.simpleId());
    }

    @Test
    void unregisterPatternSpansVisibilitiesAndApps() throws Exception {
        assertEquals("services:*:ws1/alice:calc@*", AddressNormalizer.unregisterPattern("alice:calc", WS));
        assertEquals("services:*:ws2/alice:calc@x", AddressNormalizer.unregisterPattern("ws2/alice:calc@x", WS));
        assertThrows(InvalidIdentifierException.class, () -> AddressNormalizer.unregisterPattern("calc", WS));
    }

    @Test
    void nullListingCoversCallerWorkspace() throws Exception {
        ListPlan plan = AddressNormalizer.planListing(null, WS);

        assertEquals("services:*:ws1/*:*@*", plan.pattern().storageKey());
        assertNull(plan.callerScoped());
    }

    @Test
    void listingAllWorkspacesIsPublicOnly() throws Exception {
        ListPlan plan = AddressNormalizer.planListing(ServiceQuery.builder().workspace("*").build(), WS);

        assertEquals("public", plan.pattern().visibility());
        assertEquals("services:*:ws1/*:*@*", plan.callerScoped().storageKey());
    }

    @Test
    void listingProtectedAcrossWorkspacesIsRejected() {
        ServiceQuery query = ServiceQuery.builder().workspace("*").visibility("protected").build();

        assertThrows(InvalidQueryException.class, () -> AddressNormalizer.planListing(query, WS));
    }

    @Test
    void listingRejectsIdTogetherWithServiceId() {
        ServiceQuery query = ServiceQuery.builder().id("a").serviceId("b").build();

        assertThrows(InvalidQueryException.class, () -> AddressNormalizer.planListing(query, WS));
    }

    @Test
    void listingSplitsAppSuffix() throws Exception {
        ServiceQuery query = ServiceQuery.builder().workspace(WS).serviceId("calc@a1").type("math").build();

        ListPlan plan = AddressNormalizer.planListing(query, WS);

        assertEquals("calc", plan.pattern().serviceId());
        assertEquals("a1", plan.pattern().appId());
        assertEquals("math", plan.typeFilter());
    }

    @Test
    void parsesListShorthands() {
        ServiceQuery full = AddressNormalizer.parseListShorthand("ws2/bob:calc");
        assertEquals("ws2", full.getWorkspace());
        assertEquals("bob", full.getClientId());
        assertEquals("calc", full.getServiceId());

        ServiceQuery clientOnly = AddressNormalizer.parseListShorthand("bob:");
        assertEquals("*", clientOnly.getWorkspace());
        assertEquals("bob", clientOnly.getClientId());
        assertEquals("*", clientOnly.getServiceId());

        assertEquals("public", AddressNormalizer.parseListShorthand("*/calc").getWorkspace());
        assertEquals("ws3", AddressNormalizer.parseListShorthand("ws3").getWorkspace());
    }

    @Test
    void queryFromMapRejectsUnknownKeys() {
        InvalidQueryException ex =
            assertThrows(InvalidQueryException.class, () -> ServiceQuery.fromMap(java.util.Map.of("name", "x", "id", "y")));
        assertEquals("Invalid query keys: name", ex.getMessage());
    }
}
