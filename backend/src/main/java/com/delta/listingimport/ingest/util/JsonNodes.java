package com.delta.listingimport.ingest.util;

import com.fasterxml.jackson.databind.JsonNode;

public final class JsonNodes {
    private JsonNodes() {
    }

    public static JsonNode path(JsonNode root, String dottedPath) {
        JsonNode current = root;
        if (current == null) {
            return null;
        }
        for (String segment : dottedPath.split("\\.")) {
            current = current.get(segment);
            if (current == null || current.isNull()) {
                return null;
            }
        }
        return current;
    }

    public static boolean has(JsonNode root, String dottedPath) {
        JsonNode value = path(root, dottedPath);
        if (value == null) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isBlank();
        }
        return !value.isMissingNode();
    }

    public static String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText();
            return text.isBlank() ? null : text.trim();
        }
        return null;
    }

    public static Double number(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            return parseNumber(value.asText());
        }
        return null;
    }

    public static Integer integer(JsonNode node, String field) {
        Double value = number(node, field);
        return value == null ? null : (int) Math.round(value);
    }

    public static Double firstNumber(JsonNode node, String... fields) {
        for (String field : fields) {
            Double value = number(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static Double parseNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String digits = raw.replaceAll("[^0-9.]", "");
        if (digits.isEmpty() || digits.equals(".")) {
            return null;
        }
        try {
            return Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
