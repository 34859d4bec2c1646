package io.hypha.core.registry;

import io.hypha.core.InvalidIdentifierException;
import io.hypha.core.address.ServiceIdentifier;
import io.hypha.core.internal.Json;
import io.hypha.core.service.ServiceConfig;
import io.hypha.core.service.ServiceImplementation;
import io.hypha.core.service.ServiceRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps service records to and from the flat string hashes kept in the pattern store.
 */
public final class ServiceRecordCodec {

    static final String FIELD_ID = "id";
    static final String FIELD_NAME = "name";
    static final String FIELD_DESCRIPTION = "description";
    static final String FIELD_TYPE = "type";
    static final String FIELD_APP_ID = "app_id";
    static final String FIELD_CONFIG = "config";
    static final String FIELD_REMOTE_TARGET = "remote_target";

    private ServiceRecordCodec() {
    }

    public static Map<String, String> encode(ServiceRecord record) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_ID, record.id());
        putIfPresent(fields, FIELD_NAME, record.name());
        putIfPresent(fields, FIELD_DESCRIPTION, record.description());
        putIfPresent(fields, FIELD_TYPE, record.type());
        putIfPresent(fields, FIELD_APP_ID, record.appId());
        fields.put(FIELD_CONFIG, Json.write(record.config().toMap()));
        if (record.implementation() instanceof ServiceImplementation.Remote) {
            fields.put(FIELD_REMOTE_TARGET, ((ServiceImplementation.Remote) record.implementation()).target());
        }
        return fields;
    }

    /**
     * Rebuilds a record from a stored hash. The implementation is always a remote reference: whoever
     * reads the store reaches the service through the transport.
     */
    public static ServiceRecord decode(String storageKey, Map<String, String> fields) throws InvalidIdentifierException {
        ServiceIdentifier key = ServiceIdentifier.fromStorageKey(storageKey);
        String id = fields.getOrDefault(FIELD_ID, key.fullId());
        String appId = fields.getOrDefault(FIELD_APP_ID, key.appId());
        ServiceConfig config = ServiceConfig.empty().withVisibility(key.visibility()).withWorkspace(key.workspace());
        Object rawConfig = Json.parseIfStructured(fields.get(FIELD_CONFIG));
        if (rawConfig instanceof Map) {
            Map<String, Object> values = new LinkedHashMap<>();
            ((Map<?, ?>) rawConfig).forEach((k, v) -> values.put(String.valueOf(k), v));
            config = ServiceConfig.fromMap(values);
        }
        String target = fields.getOrDefault(FIELD_REMOTE_TARGET, id);
        return new ServiceRecord(
            id,
            fields.get(FIELD_NAME),
            fields.get(FIELD_DESCRIPTION),
            fields.get(FIELD_TYPE),
            appId,
            config,
            ServiceImplementation.remote(target)
        );
    }

    private static void putIfPresent(Map<String, String> fields, String field, String value) {
        if (value != null) {
            fields.put(field, value);
        }
    }
}
