package io.cdlengine.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.regex.Pattern;

/**
 * Dot-path access and value coercions over JSON records.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class RecordPaths {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private RecordPaths() {}

    /**
     * Resolves a dot-path such as {@code "payment.amount"} against a record. Only object members
     * are traversed; array elements are not addressable.
     *
     * @return the value, or {@code null} when any segment is missing or the value is JSON null
     */
    public static JsonNode resolve(JsonNode record, String path) {
        if (record == null || path == null) {
            return null;
        }
        JsonNode current = record;
        for (String part : path.split("\\.", -1)) {
            if (current == null || !current.isObject() || !current.has(part)) {
                return null;
            }
            current = current.get(part);
        }
        return current == null || current.isNull() ? null : current;
    }

    /**
     * Truthiness used for group keys: absent, {@code null}, {@code false}, numeric zero, the empty
     * string and empty arrays/objects are falsy; everything else is truthy.
     */
    public static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }

    /** Text form of a value: the raw string for text nodes, compact JSON otherwise, "null" when absent. */
    public static String text(JsonNode node) {
        if (node == null) {
            return "null";
        }
        return node.isTextual() ? node.textValue() : node.toString();
    }

    /**
     * Numeric view of a value: numbers as-is, strings parsed as decimals.
     *
     * @return the number, or {@code null} when the value is absent or not numeric
     */
    public static Double number(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            String text = node.textValue().strip();
            return DECIMAL.matcher(text).matches() ? Double.valueOf(text) : null;
        }
        return null;
    }
}
