package io.hypha.core.resolve;

import io.hypha.core.CallerContext;
import io.hypha.core.HyphaException;
import io.hypha.core.InvalidQueryException;
import io.hypha.core.ServiceTimeoutException;
import io.hypha.core.address.ServiceIdentifier;
import io.hypha.core.address.ServiceQuery;
import io.hypha.core.events.EventBus;
import io.hypha.core.registry.ServiceRegistry;
import io.hypha.core.security.AccessGuard;
import io.hypha.core.service.ServiceConfig;
import io.hypha.core.service.ServiceHandle;
import io.hypha.core.service.ServiceImplementation;
import io.hypha.core.service.ServiceRecord;
import io.hypha.core.spi.AppLauncher;
import io.hypha.core.spi.RemoteTransport;
import io.hypha.core.store.InMemoryPatternStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceResolverTest {

    private static final CallerContext ROOT = CallerContext.of("default", "root", null);
    private static final CallerContext ALICE = CallerContext.of("ws1", "alice", null);

    private InMemoryPatternStore store;
    private ServiceRegistry registry;
    private FakeTransport transport;

    @BeforeEach
    void setUp() {
        store = new InMemoryPatternStore();
        registry = new ServiceRegistry(store, new EventBus(), new AccessGuard());
        transport = new FakeTransport();
    }

    private ServiceResolver resolver(AppLauncher launcher) {
        return new ServiceResolver(store, transport, launcher, Duration.ofSeconds(5), new Random(7));
    }

    private void register(String id, String visibility, CallerContext context) throws HyphaException {
        ServiceRecord record = ServiceRecord.of(id, ServiceImplementation.remote(id))
            .withConfig(new ServiceConfig(visibility, null, false, Map.of()));
        registry.register(record, context);
        transport.serve(id);
    }

    @Test
    void registeredServiceIsListedAndResolvedByShorthand() throws Exception {
        register("default/alice:calc", "protected", ROOT);
        ServiceResolver resolver = resolver(null);

        List<ServiceRecord> listed = resolver.list(Map.of("workspace", "default"), ROOT);
        assertTrue(listed.stream().anyMatch(r -> r.id().equals("default/alice:calc")));

        ServiceHandle handle = resolver.get("alice:calc", CallerContext.of("default", "alice", null));
        assertNotNull(handle);
        assertEquals("default/alice:calc", handle.getId());
        assertEquals("default", handle.getConfig().workspace());
    }

    @Test
    void qualifiedIdIsFetchedWithoutStoreLookup() throws Exception {
        transport.serve("ws2/bob:calc");

        ServiceHandle handle = resolver(null).get("ws2/bob:calc", ALICE);

        assertEquals("ws2", handle.getConfig().workspace());
        assertEquals(List.of("ws2/bob:calc"), transport.requested);
    }

    @Test
    void missingQualifiedServiceIsNull() throws Exception {
        assertNull(resolver(null).get("ws2/bob:ghost", ALICE));
    }

    @Test
    void callerWorkspaceIsTriedFirst() throws Exception {
        register("ws2/zed:calc", "public", CallerContext.of("ws2", "zed", null));
        register("ws1/bob:calc", "protected", ALICE);
        register("ws1/alice:calc", "protected", ALICE);
        transport.absent.add("ws1/alice:calc");

        ServiceQuery query = ServiceQuery.builder().id("calc").workspace("*").build();
        ServiceHandle handle = resolver(null).get(query, GetOptions.defaults(), ALICE);

        assertEquals("ws1/bob:calc", handle.getId());
        assertEquals(List.of("ws1/alice:calc", "ws1/bob:calc"), transport.requested);
    }

    @Test
    void otherWorkspacesAreUsedWhenCallerHasNoMatch() throws Exception {
        register("ws2/zed:calc", "public", CallerContext.of("ws2", "zed", null));

        ServiceQuery query = ServiceQuery.builder().id("calc").workspace("*").build();
        ServiceHandle handle = resolver(null).get(query, GetOptions.defaults(), ALICE);

        assertEquals("ws2", handle.getConfig().workspace());
    }

    @Test
    void rankingKeepsBucketsApartInRandomMode() {
        List<String> keys = List.of(
            "services:public:ws2/a:calc@*",
            "services:public:ws3/a:calc@*",
            "services:protected:ws1/c:calc@*",
            "services:protected:ws1/a:calc@*",
            "services:protected:ws1/b:calc@*");
        ServiceResolver resolver = resolver(null);

        for (int i = 0; i < 20; i++) {
            List<String> workspaces = resolver.rank(keys, "ws1", true).stream()
                .map(ServiceIdentifier::workspace)
                .collect(Collectors.toList());
            assertEquals(List.of("ws1", "ws1", "ws1"), workspaces.subList(0, 3));
        }
        List<String> sorted = resolver.rank(keys, "ws1", false).stream()
            .map(ServiceIdentifier::fullId)
            .collect(Collectors.toList());
        assertEquals(List.of("ws1/a:calc", "ws1/b:calc", "ws1/c:calc", "ws2/a:calc", "ws3/a:calc"), sorted);
    }

    @Test
    void candidateTimeoutAbortsByDefault() throws Exception {
        register("ws1/alice:calc", "protected", ALICE);
        register("ws1/bob:calc", "protected", ALICE);
        transport.slow.add("ws1/alice:calc");

        assertThrows(ServiceTimeoutException.class,
            () -> resolver(null).get(ServiceQuery.ofId("calc"), GetOptions.defaults(), ALICE));
    }

    @Test
    void candidateTimeoutIsSkippedOnRequest() throws Exception {
        register("ws1/alice:calc", "protected", ALICE);
        register("ws1/bob:calc", "protected", ALICE);
        transport.slow.add("ws1/alice:calc");

        GetOptions options = GetOptions.builder().skipTimeout(true).timeout(Duration.ofMillis(100)).build();
        ServiceHandle handle = resolver(null).get(ServiceQuery.ofId("calc"), options, ALICE);

        assertEquals("ws1/bob:calc", handle.getId());
        assertEquals(Duration.ofMillis(100), transport.lastTimeout);
    }

    @Test
    void explicitAppIdLaunchesAndRetriesOnce() throws Exception {
        AtomicInteger launches = new AtomicInteger();
        AppLauncher launcher = (address, context) -> {
            launches.incrementAndGet();
            register("ws1/alice:calc", "protected", ALICE);
            registry.register(ServiceRecord.of("ws1/alice:calc", ServiceImplementation.remote("ws1/alice:calc"))
                .withAppId(address.appId()), context);
        };

        ServiceHandle handle = resolver(launcher).get("alice:calc@app1", ALICE);

        assertNotNull(handle);
        assertEquals(1, launches.get());
    }

    @Test
    void launchThatRegistersNothingYieldsNull() throws Exception {
        AtomicInteger launches = new AtomicInteger();

        assertNull(resolver((address, context) -> launches.incrementAndGet()).get("alice:calc@app1", ALICE));
        assertEquals(1, launches.get());
    }

    @Test
    void missWithoutAppIdDoesNotLaunch() throws Exception {
        AtomicInteger launches = new AtomicInteger();

        assertNull(resolver((address, context) -> launches.incrementAndGet()).get("calc", ALICE));
        assertEquals(0, launches.get());
    }

    @Test
    void listingIsSortedAndFilteredByType() throws Exception {
        registry.register(ServiceRecord.of("ws1/bob:calc", ServiceImplementation.remote("x")).withType("math"), ALICE);
        registry.register(ServiceRecord.of("ws1/alice:calc", ServiceImplementation.remote("x")).withType("math"), ALICE);
        registry.register(ServiceRecord.of("ws1/alice:echo", ServiceImplementation.remote("x")), ALICE);
        ServiceResolver resolver = resolver(null);

        List<String> all = ids(resolver.list((ServiceQuery) null, ALICE));
        assertEquals(List.of("ws1/alice:calc", "ws1/alice:echo", "ws1/bob:calc"), all);

        List<String> math = ids(resolver.list(Map.of("workspace", "ws1", "type", "math"), ALICE));
        assertEquals(List.of("ws1/alice:calc", "ws1/bob:calc"), math);

        assertEquals(List.of("ws1/alice:echo"), ids(resolver.list("ws1/alice:echo", ALICE)));
    }

    @Test
    void listingAcrossWorkspacesShowsPublicAndOwnServices() throws Exception {
        register("ws2/zed:calc", "public", CallerContext.of("ws2", "zed", null));
        register("ws2/zed:hidden", "protected", CallerContext.of("ws2", "zed", null));
        register("ws1/alice:own", "protected", ALICE);

        List<String> listed = ids(resolver(null).list(Map.of("workspace", "*"), ALICE));

        assertEquals(List.of("ws1/alice:own", "ws2/zed:calc"), listed);
    }

    @Test
    void listingRejectsBadQueries() {
        ServiceResolver resolver = resolver(null);

        assertThrows(InvalidQueryException.class,
            () -> resolver.list(Map.of("workspace", "*", "visibility", "protected"), ALICE));
        assertThrows(InvalidQueryException.class, () -> resolver.list(Map.of("owner", "me"), ALICE));
    }

    private static List<String> ids(List<ServiceRecord> records) {
        return records.stream().map(ServiceRecord::id).collect(Collectors.toList());
    }

    private static final class FakeTransport implements RemoteTransport {
        private final Map<String, ServiceHandle> handles = new HashMap<>();
        private final Set<String> slow = new HashSet<>();
        private final Set<String> absent = new HashSet<>();
        private final List<String> requested = new ArrayList<>();
        private Duration lastTimeout;

        void serve(String id) {
            handles.put(id, new ServiceHandle(id, null, null, null, Map.of()));
        }

        @Override
        public ServiceHandle getRemoteService(String serviceId, Duration timeout) throws HyphaException {
            requested.add(serviceId);
            lastTimeout = timeout;
            if (slow.contains(serviceId)) {
                throw new ServiceTimeoutException(serviceId, timeout);
            }
            if (absent.contains(serviceId)) {
                return null;
            }
            return handles.get(serviceId);
        }
    }
}
