package io.hypha.core.service;

import io.hypha.core.CallerContext;
import io.hypha.core.HyphaException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A resolved service that can be invoked.
 */
public final class ServiceHandle {

    private final String id;
    private final String name;
    private final String type;
    private final ServiceConfig config;
    private final Map<String, ServiceFunction> functions;

    public ServiceHandle(String id, String name, String type, ServiceConfig config, Map<String, ServiceFunction> functions) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.type = type;
        this.config = config == null ? ServiceConfig.empty() : config;
        this.functions = functions == null ? Map.of() : Map.copyOf(functions);
    }

    /**
     * Builds a handle from registry metadata; local implementations contribute their functions.
     */
    public static ServiceHandle fromRecord(ServiceRecord record) {
        Map<String, ServiceFunction> functions = Map.of();
        if (record.implementation() instanceof ServiceImplementation.Local) {
            functions = ((ServiceImplementation.Local) record.implementation()).functions();
        }
        return new ServiceHandle(record.id(), record.name(), record.type(), record.config(), functions);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public ServiceConfig getConfig() {
        return config;
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    public boolean has(String function) {
        return functions.containsKey(function);
    }

    /**
     * @return a copy whose {@code config.workspace} is the given workspace.
     */
    public ServiceHandle withWorkspace(String workspace) {
        return new ServiceHandle(id, name, type, config.withWorkspace(workspace), functions);
    }

    public Object call(String function, Object... args) throws HyphaException {
        return call(function, Arrays.asList(args), null);
    }

    public Object call(String function, List<Object> args, CallerContext context) throws HyphaException {
        ServiceFunction target = functions.get(function);
        if (target == null) {
            throw new HyphaException("service " + id + " has no function " + function);
        }
        try {
            return target.invoke(args == null ? List.of() : args, context);
        } catch (HyphaException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new HyphaException("call " + id + "." + function + " interrupted", ex);
        } catch (Exception ex) {
            throw new HyphaException("call " + id + "." + function + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public String toString() {
        return "ServiceHandle{" + id + "}";
    }
}
