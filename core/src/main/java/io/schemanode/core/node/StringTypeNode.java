package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemanode.core.error.InvalidNodeException;
import io.schemanode.core.result.ValidationResult;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Accepts strings, optionally bounded in length (counted in code points) and constrained by a
 * regular expression. The pattern is searched for, not anchored: use {@code ^...$} to match the
 * whole string.
 */
public final class StringTypeNode extends SchemaNode {

    private final Integer minLength;
    private final Integer maxLength;
    private final Pattern pattern;

    private StringTypeNode(Builder builder) {
        super(builder);
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        this.pattern = builder.pattern;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String type() {
        return "string";
    }

    @Override
    protected Set<NodeShape> allowedShapes() {
        return Set.of(NodeShape.STRING);
    }

    @Override
    protected JsonNode validateInto(JsonNode data, ValidationResult result) {
        JsonNode value = super.validateInto(data, result);
        if (value == null) {
            return null;
        }

        String text = value.textValue();
        int length = text.codePointCount(0, text.length());
        if (minLength != null && length < minLength) {
            result.error("String is " + length + " characters long but must be at least " + minLength + ".");
        }
        if (maxLength != null && length > maxLength) {
            result.error("String is " + length + " characters long but must be at most " + maxLength + ".");
        }
        if (pattern != null && !pattern.matcher(text).find()) {
            result.error("String does not match pattern \"" + pattern.pattern() + "\".");
        }
        return value;
    }

    @Override
    protected void validateSelf() {
        if (minLength != null && minLength < 0) {
            throw new InvalidNodeException("Option \"min_length\" must not be negative.");
        }
        if (maxLength != null && maxLength < 0) {
            throw new InvalidNodeException("Option \"max_length\" must not be negative.");
        }
        if (minLength != null && maxLength != null && minLength > maxLength) {
            throw new InvalidNodeException("Option \"min_length\" must not exceed \"max_length\".");
        }
    }

    /** Builder for {@link StringTypeNode}. */
    public static final class Builder extends SchemaNode.Builder<StringTypeNode, Builder> {

        private Integer minLength;
        private Integer maxLength;
        private Pattern pattern;

        Builder() {}

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        /**
         * Sets the pattern the string must contain a match for.
         *
         * @throws InvalidNodeException if the expression does not compile
         */
        public Builder pattern(String regex) {
            try {
                this.pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new InvalidNodeException("Invalid pattern \"" + regex + "\": " + e.getDescription() + ".");
            }
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected StringTypeNode create() {
            return new StringTypeNode(this);
        }
    }
}
