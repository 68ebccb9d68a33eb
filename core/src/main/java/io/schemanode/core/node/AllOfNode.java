package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemanode.core.result.ValidationResult;

/**
 * Matches if the data conforms to every item. Each item validates straight into the real result,
 * without probing or short-circuit, so the errors of all failing items add up.
 */
public final class AllOfNode extends CombinationNode {

    private AllOfNode(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String type() {
        return "all_of";
    }

    @Override
    protected JsonNode validateInto(JsonNode data, ValidationResult result) {
        JsonNode value = super.validateInto(data, result);
        if (value == null) {
            return null;
        }
        for (SchemaNode item : items()) {
            item.validateInto(value, result);
        }
        return value;
    }

    /** Builder for {@link AllOfNode}. */
    public static final class Builder extends CombinationNode.Builder<AllOfNode, Builder> {

        Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected AllOfNode create() {
            return new AllOfNode(this);
        }
    }
}
