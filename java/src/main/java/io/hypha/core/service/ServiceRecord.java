package io.hypha.core.service;

import java.util.Objects;

/**
 * A registered service: identifying metadata plus the implementation serving it.
 */
public record ServiceRecord(
    String id,
    String name,
    String description,
    String type,
    String appId,
    ServiceConfig config,
    ServiceImplementation implementation
) {

    public ServiceRecord {
        Objects.requireNonNull(id, "id");
        config = config == null ? ServiceConfig.empty() : config;
    }

    public static ServiceRecord of(String id, ServiceImplementation implementation) {
        return new ServiceRecord(id, null, null, null, null, ServiceConfig.empty(), implementation);
    }

    public ServiceRecord withId(String value) {
        return new ServiceRecord(value, name, description, type, appId, config, implementation);
    }

    public ServiceRecord withAppId(String value) {
        return new ServiceRecord(id, name, description, type, value, config, implementation);
    }

    public ServiceRecord withConfig(ServiceConfig value) {
        return new ServiceRecord(id, name, description, type, appId, value, implementation);
    }

    public ServiceRecord withName(String value) {
        return new ServiceRecord(id, value, description, type, appId, config, implementation);
    }

    public ServiceRecord withDescription(String value) {
        return new ServiceRecord(id, name, value, type, appId, config, implementation);
    }

    public ServiceRecord withType(String value) {
        return new ServiceRecord(id, name, description, value, appId, config, implementation);
    }
}
