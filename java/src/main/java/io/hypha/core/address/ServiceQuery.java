package io.hypha.core.address;

import io.hypha.core.InvalidQueryException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Caller-supplied lookup for {@code get} and {@code list}. Every field is optional.
 */
public final class ServiceQuery {

    public static final List<String> ALLOWED_KEYS =
        List.of("id", "visibility", "workspace", "client_id", "service_id", "type", "app_id");

    private final String id;
    private final String visibility;
    private final String workspace;
    private final String clientId;
    private final String serviceId;
    private final String type;
    private final String appId;

    private ServiceQuery(Builder builder) {
        this.id = builder.id;
        this.visibility = builder.visibility;
        this.workspace = builder.workspace;
        this.clientId = builder.clientId;
        this.serviceId = builder.serviceId;
        this.type = builder.type;
        this.appId = builder.appId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ServiceQuery ofId(String id) {
        return builder().id(Objects.requireNonNull(id, "id")).build();
    }

    /**
     * Builds a query from loosely typed key/value pairs, rejecting keys outside {@link #ALLOWED_KEYS}.
     */
    public static ServiceQuery fromMap(Map<String, ?> values) throws InvalidQueryException {
        if (values == null || values.isEmpty()) {
            return builder().build();
        }
        List<String> unknown = values.keySet().stream()
            .filter(key -> !ALLOWED_KEYS.contains(key))
            .sorted()
            .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new InvalidQueryException("Invalid query keys: " + String.join(",", unknown));
        }
        return builder()
            .id(text(values, "id"))
            .visibility(text(values, "visibility"))
            .workspace(text(values, "workspace"))
            .clientId(text(values, "client_id"))
            .serviceId(text(values, "service_id"))
            .type(text(values, "type"))
            .appId(text(values, "app_id"))
            .build();
    }

    public String getId() {
        return id;
    }

    public String getVisibility() {
        return visibility;
    }

    public String getWorkspace() {
        return workspace;
    }

    public String getClientId() {
        return clientId;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getType() {
        return type;
    }

    public String getAppId() {
        return appId;
    }

    public Builder toBuilder() {
        return builder()
            .id(id)
            .visibility(visibility)
            .workspace(workspace)
            .clientId(clientId)
            .serviceId(serviceId)
            .type(type)
            .appId(appId);
    }

    @Override
    public String toString() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("visibility", visibility);
        fields.put("workspace", workspace);
        fields.put("client_id", clientId);
        fields.put("service_id", serviceId);
        fields.put("type", type);
        fields.put("app_id", appId);
        fields.values().removeIf(Objects::isNull);
        return fields.toString();
    }

    private static String text(Map<String, ?> values, String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public static final class Builder {
        private String id;
        private String visibility;
        private String workspace;
        private String clientId;
        private String serviceId;
        private String type;
        private String appId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder visibility(String visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder workspace(String workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder serviceId(String serviceId) {
            this.serviceId = serviceId;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public ServiceQuery build() {
            return new ServiceQuery(this);
        }
    }
}
