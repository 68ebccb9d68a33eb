package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared JSON value helpers for the validation pipeline.
 *
 * <p>
 * Stateless, safe to call from any thread.
 */
public final class JsonValues {

    /**
     * Treats numbers of different node classes as equal when they denote the same value
     * ({@code IntNode(1)} and {@code LongNode(1)}), but keeps integers and floating point numbers
     * apart ({@code 1} is not {@code 1.0}). Infinities and NaN have no decimal form and compare
     * as doubles. Every other pair falls back to node equality.
     */
    private static final Comparator<JsonNode> VALUE_COMPARATOR = (a, b) -> {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isNumber() && b.isNumber() && a.isIntegralNumber() == b.isIntegralNumber()) {
            if (a.isIntegralNumber()) {
                return a.bigIntegerValue().compareTo(b.bigIntegerValue());
            }
            if (isNonFinite(a) || isNonFinite(b)) {
                return Double.compare(a.doubleValue(), b.doubleValue());
            }
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return 1;
    };

    private JsonValues() {}

    /**
     * Determines if a value counts as absent.
     *
     * <ul>
     * <li>{@code null}, {@code NullNode}, {@code MissingNode} → absent</li>
     * <li>Any other node → present</li>
     * </ul>
     */
    public static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    /**
     * Returns {@code true} for floating point numbers without a decimal form: infinities (JSON
     * literals beyond the double range such as {@code 1e400}, YAML {@code .inf}) and NaN.
     */
    public static boolean isNonFinite(JsonNode value) {
        return value != null && value.isFloatingPointNumber() && !value.isBigDecimal()
                && !Double.isFinite(value.doubleValue());
    }

    /** Deep value equality with numeric normalization, see {@link #VALUE_COMPARATOR}. */
    public static boolean sameValue(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.equals(VALUE_COMPARATOR, b);
    }

    /** Returns {@code true} if {@code values} holds an element with the same value. */
    public static boolean contains(List<JsonNode> values, JsonNode value) {
        for (JsonNode candidate : values) {
            if (sameValue(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    /** Renders values as a literal array, e.g. {@code [1, "foo", true]}. */
    public static String render(List<JsonNode> values) {
        return values.stream().map(JsonNode::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
