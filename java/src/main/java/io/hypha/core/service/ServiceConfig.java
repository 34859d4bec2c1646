package io.hypha.core.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service configuration as stored in the registry. Keys other than {@code visibility},
 * {@code workspace} and {@code require_context} are carried in {@link #extras()}.
 */
public record ServiceConfig(
    String visibility,
    String workspace,
    boolean requireContext,
    Map<String, Object> extras
) {

    public ServiceConfig {
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static ServiceConfig empty() {
        return new ServiceConfig(null, null, false, Map.of());
    }

    public ServiceConfig withVisibility(String value) {
        return new ServiceConfig(value, workspace, requireContext, extras);
    }

    public ServiceConfig withWorkspace(String value) {
        return new ServiceConfig(visibility, value, requireContext, extras);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(extras);
        if (visibility != null) {
            map.put("visibility", visibility);
        }
        if (workspace != null) {
            map.put("workspace", workspace);
        }
        map.put("require_context", requireContext);
        return map;
    }

    public static ServiceConfig fromMap(Map<String, ?> map) {
        if (map == null) {
            return empty();
        }
        Map<String, Object> extras = new LinkedHashMap<>(map);
        Object visibility = extras.remove("visibility");
        Object workspace = extras.remove("workspace");
        Object requireContext = extras.remove("require_context");
        return new ServiceConfig(
            visibility == null ? null : visibility.toString(),
            workspace == null ? null : workspace.toString(),
            Boolean.TRUE.equals(requireContext) || "true".equals(String.valueOf(requireContext)),
            extras
        );
    }
}
