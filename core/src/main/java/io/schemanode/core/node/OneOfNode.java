package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemanode.core.result.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches if the data conforms to exactly one item. Every item is probed; a single match is
 * validated again against the real result. No match and more than one match are both errors,
 * and in either case item errors are dropped.
 */
public final class OneOfNode extends CombinationNode {

    private static final Logger LOG = LoggerFactory.getLogger(OneOfNode.class);

    static final String NO_MATCH = "Does not match any oneOf condition.";
    static final String AMBIGUOUS = "Matches more than one oneOf condition.";

    private OneOfNode(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String type() {
        return "one_of";
    }

    @Override
    protected JsonNode validateInto(JsonNode data, ValidationResult result) {
        JsonNode value = super.validateInto(data, result);
        if (value == null) {
            return null;
        }

        List<SchemaNode> matched = new ArrayList<>();
        for (SchemaNode item : items()) {
            if (matches(item, value)) {
                matched.add(item);
            }
        }
        LOG.debug("oneOf matched {} of {} items", matched.size(), items().size());

        if (matched.isEmpty()) {
            result.error(NO_MATCH);
            return null;
        }
        if (matched.size() > 1) {
            result.error(AMBIGUOUS);
            return null;
        }
        return matched.get(0).validateInto(value, result);
    }

    /** Builder for {@link OneOfNode}. */
    public static final class Builder extends CombinationNode.Builder<OneOfNode, Builder> {

        Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected OneOfNode create() {
            return new OneOfNode(this);
        }
    }
}
