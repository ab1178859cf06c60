package io.cdlengine.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.cdlengine.core.model.Operator;
import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Implementation of the comparison-family operators over JSON values.
 *
 * <p>
 * A field value of {@code null} means the path was absent (or held JSON null). Operands of
 * unsupported types raise {@link IllegalArgumentException}; an invalid regex raises
 * {@link java.util.regex.PatternSyntaxException}. The evaluator turns both into failing results.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
final class ComparisonOperators {

    /** Numbers compare by value ({@code 1 == 1.0}); everything else structurally. */
    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private ComparisonOperators() {}

    static boolean apply(Operator operator, JsonNode field, JsonNode value) {
        return switch (operator) {
            case EQ -> equal(field, value);
            case NE -> !equal(field, value);
            case LT -> order(field, value, "<") < 0;
            case GT -> order(field, value, ">") > 0;
            case LE -> order(field, value, "<=") <= 0;
            case GE -> order(field, value, ">=") >= 0;
            case CONTAINS -> RecordPaths.text(field).contains(requireText(value, operator));
            case MATCHES -> Pattern.compile(requireText(value, operator))
                    .matcher(RecordPaths.text(field))
                    .find();
            case IN -> member(field, value);
            case NOT_IN -> !member(field, value);
            case EXISTS -> field != null;
            case EMPTY -> isEmpty(field);
            default -> throw new IllegalArgumentException(
                    "'" + operator.wireName() + "' is not a comparison operator");
        };
    }

    static boolean equal(JsonNode a, JsonNode b) {
        boolean aNull = a == null || a.isNull();
        boolean bNull = b == null || b.isNull();
        if (aNull || bNull) {
            return aNull && bNull;
        }
        return a.equals(NUMERIC_AWARE, b);
    }

    private static int order(JsonNode a, JsonNode b, String symbol) {
        if (a != null && b != null) {
            if (a.isNumber() && b.isNumber()) {
                return a.decimalValue().compareTo(b.decimalValue());
            }
            if (a.isTextual() && b.isTextual()) {
                return a.textValue().compareTo(b.textValue());
            }
        }
        throw new IllegalArgumentException(
                "'" + symbol + "' not supported between " + typeName(a) + " and " + typeName(b));
    }

    private static boolean member(JsonNode field, JsonNode container) {
        if (container != null && container.isArray()) {
            for (JsonNode element : container) {
                if (equal(field, element)) {
                    return true;
                }
            }
            return false;
        }
        if (container != null && (container.isTextual() || container.isObject())) {
            if (field == null || !field.isTextual()) {
                throw new IllegalArgumentException("'in <" + typeName(container) + ">' requires a string field, got "
                        + typeName(field));
            }
            return container.isTextual()
                    ? container.textValue().contains(field.textValue())
                    : container.has(field.textValue());
        }
        throw new IllegalArgumentException("argument of type " + typeName(container) + " is not iterable");
    }

    private static boolean isEmpty(JsonNode field) {
        if (field == null) {
            return true;
        }
        if (field.isTextual()) {
            return field.textValue().isEmpty();
        }
        return field.isContainerNode() && field.size() == 0;
    }

    private static String requireText(JsonNode value, Operator operator) {
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException(
                    "'" + operator.wireName() + "' requires a string value, got " + typeName(value));
        }
        return value.textValue();
    }

    private static String typeName(JsonNode node) {
        return node == null ? "null" : node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
