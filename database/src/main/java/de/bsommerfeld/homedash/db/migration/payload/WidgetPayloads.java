package de.bsommerfeld.homedash.db.migration.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Transforms for stored widget layout JSON.
 *
 * <p>
 * Every method is stateless and never throws on bad input: malformed JSON
 * comes back as a {@link TransformOutcome.Status#SKIPPED} outcome carrying
 * the original string.
 */
public final class WidgetPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WidgetPayloads() {
    }

    /**
     * Multiplies every numeric widget height by {@code factor}. Heights are
     * read at {@code h}, {@code layouts.lg.h}, {@code layouts.sm.h} and
     * {@code layout.h} of each widget, independently of each other.
     *
     * <p>
     * Accepts {@link PayloadShape#WIDGET_ARRAY_V1} and
     * {@link PayloadShape#DASHBOARD_CONFIG_V1}; any other valid JSON is
     * returned unchanged. Whole-number heights stay whole numbers when the
     * scaled value is whole.
     */
    public static TransformOutcome scaleWidgetHeights(String rawJson, double factor) {
        Preconditions.checkArgument(Double.isFinite(factor), "factor must be finite: %s", factor);
        if (rawJson == null || rawJson.isBlank()) {
            return TransformOutcome.unchanged(rawJson);
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(rawJson);
        } catch (JsonProcessingException e) {
            return TransformOutcome.skipped(rawJson, "invalid JSON: " + e.getOriginalMessage());
        }

        ArrayNode widgets;
        switch (PayloadShape.of(root)) {
            case WIDGET_ARRAY_V1:
                widgets = (ArrayNode) root;
                break;
            case DASHBOARD_CONFIG_V1:
                widgets = (ArrayNode) root.get("widgets");
                break;
            default:
                return TransformOutcome.unchanged(rawJson);
        }

        int scaled = 0;
        for (JsonNode widget : widgets) {
            if (!widget.isObject()) {
                continue;
            }
            scaled += scale((ObjectNode) widget, factor);
            scaled += scale(widget.path("layouts").path("lg"), factor);
            scaled += scale(widget.path("layouts").path("sm"), factor);
            scaled += scale(widget.path("layout"), factor);
        }

        if (scaled == 0) {
            return TransformOutcome.unchanged(rawJson);
        }
        try {
            return TransformOutcome.transformed(MAPPER.writeValueAsString(root));
        } catch (JsonProcessingException e) {
            return TransformOutcome.skipped(rawJson, "failed to serialize: " + e.getOriginalMessage());
        }
    }

    /** @return 1 if {@code holder.h} was numeric and got scaled */
    private static int scale(JsonNode holder, double factor) {
        if (!holder.isObject()) {
            return 0;
        }
        JsonNode h = holder.get("h");
        if (h == null || !h.isNumber()) {
            return 0;
        }
        ObjectNode target = (ObjectNode) holder;
        if (h.isIntegralNumber()) {
            BigDecimal exact = new BigDecimal(h.bigIntegerValue()).multiply(BigDecimal.valueOf(factor));
            putScaled(target, exact);
            return 1;
        }
        double value = h.asDouble() * factor;
        if (Double.isInfinite(value)) {
            target.put("h", h.decimalValue().multiply(BigDecimal.valueOf(factor)));
        } else {
            target.put("h", value);
        }
        return 1;
    }

    /**
     * Whole results stay integers, as a long where they fit. Fractional
     * results become doubles unless the double would overflow.
     */
    private static void putScaled(ObjectNode target, BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.signum() == 0 || stripped.scale() <= 0) {
            BigInteger whole = stripped.toBigIntegerExact();
            if (whole.bitLength() < Long.SIZE) {
                target.put("h", whole.longValue());
            } else {
                target.put("h", whole);
            }
            return;
        }
        double asDouble = value.doubleValue();
        if (Double.isInfinite(asDouble)) {
            target.put("h", value);
        } else {
            target.put("h", asDouble);
        }
    }
}
