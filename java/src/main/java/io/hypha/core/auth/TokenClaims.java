package io.hypha.core.auth;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Claims carried by tokens minted for a workspace. {@code iat} and {@code exp} are seconds since the
 * epoch and are nullable; a token without {@code exp} never expires.
 */
public record TokenClaims(
    String sub,
    String workspace,
    String clientId,
    String email,
    List<String> roles,
    String scope,
    Long iat,
    Long exp,
    String iss,
    String aud
) {

    public TokenClaims {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    /**
     * @return the scope split on whitespace.
     */
    public List<String> scopes() {
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        return List.of(scope.trim().split("\\s+"));
    }

    Map<String, Object> toJsonMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "sub", sub);
        putIfPresent(map, "workspace", workspace);
        putIfPresent(map, "client_id", clientId);
        putIfPresent(map, "email", email);
        map.put("roles", roles);
        putIfPresent(map, "scope", scope);
        putIfPresent(map, "iat", iat);
        putIfPresent(map, "exp", exp);
        putIfPresent(map, "iss", iss);
        putIfPresent(map, "aud", aud);
        return map;
    }

    static TokenClaims fromJson(JsonNode node) {
        return new TokenClaims(
            text(node, "sub"),
            text(node, "workspace"),
            text(node, "client_id"),
            text(node, "email"),
            readArray(node, "roles"),
            text(node, "scope"),
            number(node, "iat"),
            number(node, "exp"),
            text(node, "iss"),
            text(node, "aud")
        );
    }

    private static void putIfPresent(Map<String, Object> map, String field, Object value) {
        if (value != null) {
            map.put(field, value);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            List<String> parts = readArray(node, field);
            return parts.isEmpty() ? null : String.join(" ", parts);
        }
        return value.asText();
    }

    private static Long number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asLong() : null;
    }

    private static List<String> readArray(JsonNode node, String field) {
        JsonNode arr = node.path(field);
        if (!arr.isArray()) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>();
        arr.forEach(item -> {
            if (item.isTextual()) {
                String value = item.asText();
                if (!value.isBlank()) {
                    values.add(value);
                }
            }
        });
        return Collections.unmodifiableList(values);
    }
}
