package io.hypha.core;

import io.hypha.core.address.ServiceQuery;
import io.hypha.core.auth.TokenRequest;
import io.hypha.core.resolve.GetOptions;
import io.hypha.core.service.ServiceConfig;
import io.hypha.core.service.ServiceFunction;
import io.hypha.core.service.ServiceHandle;
import io.hypha.core.service.ServiceImplementation;
import io.hypha.core.service.ServiceRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Functions of the workspace-manager default service. Every function acts on behalf of the calling
 * context, so the registry and token rules apply to the remote caller, not to the manager.
 */
final class WorkspaceManagerService {

    private static final Logger LOGGER = Logger.getLogger(WorkspaceManagerService.class.getName());

    private final HyphaCore core;

    WorkspaceManagerService(HyphaCore core) {
        this.core = core;
    }

    Map<String, ServiceFunction> functions() {
        Map<String, ServiceFunction> functions = new LinkedHashMap<>();
        functions.put("echo", (args, context) -> arg(args, 0));
        functions.put("log", this::log);
        functions.put("emit", this::emit);
        functions.put("register_service", this::registerService);
        functions.put("unregister_service", (args, context) -> core.unregisterService(text(args, 0), require(context)));
        functions.put("get_service", this::getService);
        functions.put("list_services", this::listServices);
        functions.put("generate_token", this::generateToken);
        return functions;
    }

    private Object log(List<Object> args, CallerContext context) {
        String from = context == null ? "unknown" : context.from();
        LOGGER.info(() -> String.format(Locale.ROOT, "[hypha-core] %s: %s", from, arg(args, 0)));
        return null;
    }

    private Object emit(List<Object> args, CallerContext context) throws HyphaException {
        require(context);
        String event = text(args, 0);
        if (event == null || event.isBlank()) {
            throw new HyphaException("event name is required");
        }
        core.events().emit(event, arg(args, 1));
        return null;
    }

    private Object registerService(List<Object> args, CallerContext context) throws HyphaException {
        CallerContext caller = require(context);
        Map<String, Object> spec = map(args, 0);
        if (spec == null || spec.get("id") == null) {
            throw new InvalidIdentifierException("Service id is required");
        }
        String id = HyphaCore.qualify(spec.get("id").toString(), caller);
        ServiceRecord record = new ServiceRecord(
            id,
            stringOrNull(spec.get("name")),
            stringOrNull(spec.get("description")),
            stringOrNull(spec.get("type")),
            stringOrNull(spec.get("app_id")),
            ServiceConfig.fromMap(asMap(spec.get("config"))),
            ServiceImplementation.remote(id));
        return describe(core.registerService(record, caller));
    }

    private Object getService(List<Object> args, CallerContext context) throws HyphaException {
        CallerContext caller = require(context);
        Object query = arg(args, 0);
        GetOptions options = options(map(args, 1));
        ServiceQuery serviceQuery = query instanceof Map
            ? ServiceQuery.fromMap(asMap(query))
            : ServiceQuery.ofId(String.valueOf(query));
        ServiceHandle handle = core.getService(serviceQuery, options, caller);
        if (handle == null) {
            throw new HyphaException("Service not found: " + query);
        }
        return handle;
    }

    private Object listServices(List<Object> args, CallerContext context) throws HyphaException {
        CallerContext caller = require(context);
        Object query = arg(args, 0);
        List<ServiceRecord> records;
        if (query == null) {
            records = core.listServices((ServiceQuery) null, caller);
        } else if (query instanceof Map) {
            records = core.listServices(asMap(query), caller);
        } else {
            records = core.listServices(query.toString(), caller);
        }
        List<Map<String, Object>> described = new ArrayList<>(records.size());
        for (ServiceRecord record : records) {
            described.add(describe(record));
        }
        return described;
    }

    private Object generateToken(List<Object> args, CallerContext context) throws HyphaException {
        CallerContext caller = require(context);
        Map<String, Object> spec = map(args, 0);
        TokenRequest.Builder request = TokenRequest.builder();
        if (spec != null) {
            request.workspace(stringOrNull(spec.get("workspace")))
                .userId(stringOrNull(spec.get("user_id")))
                .clientId(stringOrNull(spec.get("client_id")))
                .email(stringOrNull(spec.get("email")))
                .roles(stringList(spec.get("roles")));
            Object scope = spec.get("scope");
            if (scope instanceof List) {
                request.scopes(stringList(scope));
            } else {
                request.scope(stringOrNull(scope));
            }
            Object expiresIn = spec.get("expires_in");
            if (expiresIn instanceof Number) {
                request.expiresIn(((Number) expiresIn).longValue());
            }
        }
        return core.generateToken(request.build(), caller);
    }

    static Map<String, Object> describe(ServiceRecord record) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", record.id());
        if (record.name() != null) {
            out.put("name", record.name());
        }
        if (record.description() != null) {
            out.put("description", record.description());
        }
        if (record.type() != null) {
            out.put("type", record.type());
        }
        out.put("app_id", record.appId());
        out.put("config", record.config().toMap());
        return out;
    }

    private static GetOptions options(Map<String, Object> values) {
        GetOptions.Builder builder = GetOptions.builder();
        if (values == null) {
            return builder.build();
        }
        builder.mode(stringOrNull(values.get("mode")));
        builder.skipTimeout(Boolean.TRUE.equals(values.get("skip_timeout")));
        Object timeout = values.get("timeout");
        if (timeout instanceof Number) {
            builder.timeout(Duration.ofMillis(Math.round(((Number) timeout).doubleValue() * 1000)));
        }
        return builder.build();
    }

    private static CallerContext require(CallerContext context) throws HyphaException {
        if (context == null) {
            throw new HyphaException("caller context is required");
        }
        return context;
    }

    private static Object arg(List<Object> args, int index) {
        return args != null && args.size() > index ? args.get(index) : null;
    }

    private static String text(List<Object> args, int index) {
        return stringOrNull(arg(args, index));
    }

    private static Map<String, Object> map(List<Object> args, int index) throws HyphaException {
        Object value = arg(args, index);
        if (value != null && !(value instanceof Map)) {
            throw new HyphaException("argument " + index + " must be an object");
        }
        return asMap(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof List)) {
            return null;
        }
        List<String> out = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                out.add(item.toString());
            }
        }
        return out;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
