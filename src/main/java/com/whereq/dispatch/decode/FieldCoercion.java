package com.whereq.dispatch.decode;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient readers for advisory status fields. None of them throws: absent, null,
 * non-numeric, non-finite and negative values fall back to the supplied default.
 */
public final class FieldCoercion {

    private FieldCoercion() {
    }

    /**
     * Read a non-negative integer. Numbers are truncated, integer text is parsed.
     */
    public static long safeLong(JsonNode node, long fallback) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return fallback;
        }
        long value;
        if (node.isNumber()) {
            double raw = node.asDouble();
            if (!Double.isFinite(raw)) {
                return fallback;
            }
            value = node.isIntegralNumber() ? node.asLong() : (long) raw;
        } else if (node.isTextual()) {
            try {
                value = Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        } else {
            return fallback;
        }
        return value < 0 ? fallback : value;
    }

    /**
     * Read a non-negative, finite decimal. Numbers and numeric text are accepted.
     */
    public static double safeDouble(JsonNode node, double fallback) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return fallback;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        } else {
            return fallback;
        }
        if (!Double.isFinite(value) || value < 0) {
            return fallback;
        }
        return value;
    }

    /**
     * Read a flag. Accepts JSON booleans, numbers (non-zero is true) and the text
     * values "true"/"1" in any case.
     */
    public static boolean safeBoolean(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.asDouble() != 0.0;
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            return "true".equalsIgnoreCase(text) || "1".equals(text);
        }
        return false;
    }

    /**
     * Read a text field, null when absent or not a scalar.
     */
    public static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
}
