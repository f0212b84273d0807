package com.taxprep.fdg.scenario;

import com.fasterxml.jackson.databind.JsonNode;
import com.taxprep.fdg.io.Json;

import java.util.UUID;

/**
 * One edit applied to the base input when a scenario is calculated.
 *
 * @param fieldPath dotted property path with optional list indices, for
 *                  example {@code w2s[0].income} or {@code taxPayer.filingStatus}
 * @param value     JSON value: the replacement for SET, a number for ADJUST,
 *                  the new element for APPEND
 */
public record Modification(String id, ModificationType type, String label, String fieldPath, JsonNode value) {

    public Modification {
        if (id == null || id.isBlank())
            id = UUID.randomUUID().toString();
        if (type == null)
            throw new IllegalArgumentException("Modification type is required");
        if (fieldPath == null || fieldPath.isBlank())
            throw new IllegalArgumentException("Modification path is required");
    }

    public static Modification set(String label, String fieldPath, Object value) {
        return new Modification(null, ModificationType.SET, label, fieldPath, Json.mapper().valueToTree(value));
    }

    public static Modification adjust(String label, String fieldPath, double delta) {
        return new Modification(null, ModificationType.ADJUST, label, fieldPath, Json.mapper().valueToTree(delta));
    }

    public static Modification append(String label, String fieldPath, Object element) {
        return new Modification(null, ModificationType.APPEND, label, fieldPath, Json.mapper().valueToTree(element));
    }

    /** Same edit under another id. */
    public Modification withId(String newId) {
        return new Modification(newId, type, label, fieldPath, value);
    }
}
