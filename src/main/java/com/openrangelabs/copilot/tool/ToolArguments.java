package com.openrangelabs.copilot.tool;

import java.util.Map;

/**
 * Typed access to loosely typed tool arguments.
 * Every accessor throws {@link IllegalArgumentException} naming the offending parameter.
 */
final class ToolArguments {

    private final Map<String, Object> values;

    ToolArguments(Map<String, Object> values) {
        this.values = values != null ? values : Map.of();
    }

    String requireText(String name) {
        Object value = values.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        return value.toString().trim();
    }

    int requireInt(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return Math.toIntExact(((Number) value).longValue());
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument " + name + " must be an integer, got: " + value);
        }
    }
}
