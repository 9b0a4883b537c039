package de.bsommerfeld.homedash.db.migration.payload;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The stored widget layout variants.
 */
public enum PayloadShape {

    /** {@code [ {widget}, ... ]}, used by template and backup columns. */
    WIDGET_ARRAY_V1,

    /** {@code { "widgets": [ {widget}, ... ], ... }}, used by dashboard configs. */
    DASHBOARD_CONFIG_V1,

    UNRECOGNIZED;

    public static PayloadShape of(JsonNode root) {
        if (root == null) {
            return UNRECOGNIZED;
        }
        if (root.isArray()) {
            return WIDGET_ARRAY_V1;
        }
        if (root.isObject() && root.path("widgets").isArray()) {
            return DASHBOARD_CONFIG_V1;
        }
        return UNRECOGNIZED;
    }
}
