package io.schemanode.core.error;

/**
 * Thrown when a built node violates a structural invariant, e.g. a combinator without items or an
 * object property without a name.
 */
public final class InvalidNodeException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public InvalidNodeException(String message) {
        super(message, null);
    }
}
