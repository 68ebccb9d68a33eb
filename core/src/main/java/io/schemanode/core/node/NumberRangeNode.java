package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemanode.core.error.InvalidNodeException;
import io.schemanode.core.result.ValidationResult;
import java.math.BigDecimal;

/**
 * Shared range checks of {@link IntegerTypeNode} and {@link NumberTypeNode}. Bounds are compared
 * as {@link BigDecimal}, so long and floating point values are checked without loss.
 */
public abstract class NumberRangeNode extends SchemaNode {

    private final BigDecimal minimum;
    private final BigDecimal maximum;
    private final BigDecimal exclusiveMinimum;
    private final BigDecimal exclusiveMaximum;
    private final BigDecimal multipleOf;

    protected NumberRangeNode(Builder<?, ?> builder) {
        super(builder);
        this.minimum = builder.minimum;
        this.maximum = builder.maximum;
        this.exclusiveMinimum = builder.exclusiveMinimum;
        this.exclusiveMaximum = builder.exclusiveMaximum;
        this.multipleOf = builder.multipleOf;
    }

    @Override
    protected JsonNode validateInto(JsonNode data, ValidationResult result) {
        JsonNode value = super.validateInto(data, result);
        if (value == null) {
            return null;
        }

        if (JsonValues.isNonFinite(value)) {
            checkNonFinite(value.doubleValue(), result);
            return value;
        }

        BigDecimal number = value.decimalValue();
        if (minimum != null && number.compareTo(minimum) < 0) {
            result.error("Value must have a minimum of " + minimum.toPlainString() + ".");
        }
        if (exclusiveMinimum != null && number.compareTo(exclusiveMinimum) <= 0) {
            result.error("Value must have an exclusive minimum of " + exclusiveMinimum.toPlainString() + ".");
        }
        if (maximum != null && number.compareTo(maximum) > 0) {
            result.error("Value must have a maximum of " + maximum.toPlainString() + ".");
        }
        if (exclusiveMaximum != null && number.compareTo(exclusiveMaximum) >= 0) {
            result.error("Value must have an exclusive maximum of " + exclusiveMaximum.toPlainString() + ".");
        }
        if (multipleOf != null && number.remainder(multipleOf).signum() != 0) {
            result.error("Value must be a multiple of " + multipleOf.toPlainString() + ".");
        }
        return value;
    }

    /**
     * Range checks for infinities and NaN, compared as doubles. NaN fails every configured bound;
     * neither is a multiple of anything.
     */
    private void checkNonFinite(double number, ValidationResult result) {
        boolean nan = Double.isNaN(number);
        if (minimum != null && (nan || number < minimum.doubleValue())) {
            result.error("Value must have a minimum of " + minimum.toPlainString() + ".");
        }
        if (exclusiveMinimum != null && (nan || number <= exclusiveMinimum.doubleValue())) {
            result.error("Value must have an exclusive minimum of " + exclusiveMinimum.toPlainString() + ".");
        }
        if (maximum != null && (nan || number > maximum.doubleValue())) {
            result.error("Value must have a maximum of " + maximum.toPlainString() + ".");
        }
        if (exclusiveMaximum != null && (nan || number >= exclusiveMaximum.doubleValue())) {
            result.error("Value must have an exclusive maximum of " + exclusiveMaximum.toPlainString() + ".");
        }
        if (multipleOf != null) {
            result.error("Value must be a multiple of " + multipleOf.toPlainString() + ".");
        }
    }

    @Override
    protected void validateSelf() {
        if (minimum != null && maximum != null && minimum.compareTo(maximum) > 0) {
            throw new InvalidNodeException("Option \"minimum\" must not exceed \"maximum\".");
        }
        if (multipleOf != null && multipleOf.signum() <= 0) {
            throw new InvalidNodeException("Option \"multiple_of\" must be greater than 0.");
        }
    }

    /** Builder collecting the range options. */
    public abstract static class Builder<N extends NumberRangeNode, B extends Builder<N, B>>
            extends SchemaNode.Builder<N, B> {

        private BigDecimal minimum;
        private BigDecimal maximum;
        private BigDecimal exclusiveMinimum;
        private BigDecimal exclusiveMaximum;
        private BigDecimal multipleOf;

        protected Builder() {}

        public B minimum(BigDecimal minimum) {
            this.minimum = minimum;
            return self();
        }

        public B minimum(long minimum) {
            return minimum(BigDecimal.valueOf(minimum));
        }

        public B maximum(BigDecimal maximum) {
            this.maximum = maximum;
            return self();
        }

        public B maximum(long maximum) {
            return maximum(BigDecimal.valueOf(maximum));
        }

        public B exclusiveMinimum(BigDecimal exclusiveMinimum) {
            this.exclusiveMinimum = exclusiveMinimum;
            return self();
        }

        public B exclusiveMaximum(BigDecimal exclusiveMaximum) {
            this.exclusiveMaximum = exclusiveMaximum;
            return self();
        }

        public B multipleOf(BigDecimal multipleOf) {
            this.multipleOf = multipleOf;
            return self();
        }

        public B multipleOf(long multipleOf) {
            return multipleOf(BigDecimal.valueOf(multipleOf));
        }
    }
}
