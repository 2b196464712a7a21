package com.sunya.nutrition.acquisition.mapper;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient number handling shared by the provider mappers.
 */
final class NutrientNumbers {

    private static final Pattern P_NUM = Pattern.compile("[-+]?\\d+(?:\\.\\d+)?");

    private static final List<String> DRIED_KEYWORDS = List.of("dried", "dehydrated", "freeze-dried", "sun-dried");

    private NutrientNumbers() {}

    static Double numberOrNull(JsonNode node, String key) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        return numberOrNull(node.path(key));
    }

    /** Accepts JSON numbers and strings like "12.3 g" or "0,5". */
    static Double numberOrNull(JsonNode v) {
        if (v == null || v.isMissingNode() || v.isNull()) return null;

        if (v.isNumber()) return finiteOrNull(v.asDouble());

        String raw = v.asText(null);
        if (raw == null) return null;

        String s = raw.trim().replace(',', '.');
        Matcher m = P_NUM.matcher(s);
        if (!m.find()) return null;

        try {
            return finiteOrNull(Double.parseDouble(m.group()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Core values: missing -> 0, negative -> 0. */
    static double core(Double v) {
        return v == null ? 0 : Math.max(0, v);
    }

    /** Optional values stay null when missing; negatives are clamped. */
    static Double optional(Double v) {
        return v == null ? null : Math.max(0, v);
    }

    static boolean isDried(String name) {
        if (name == null) return false;
        String lower = name.toLowerCase(Locale.ROOT);
        return DRIED_KEYWORDS.stream().anyMatch(lower::contains);
    }

    static String textOrNull(JsonNode node, String key) {
        JsonNode v = node.path(key);
        if (v.isMissingNode() || v.isNull()) return null;
        String s = v.asText("").trim();
        return s.isEmpty() ? null : s;
    }

    private static Double finiteOrNull(double d) {
        return Double.isFinite(d) ? d : null;
    }
}
