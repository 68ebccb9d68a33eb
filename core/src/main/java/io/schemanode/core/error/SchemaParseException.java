package io.schemanode.core.error;

/**
 * Thrown when a schema definition document has invalid syntax, fails the definition structure
 * check, or describes a node that cannot be constructed. In the last case the cause is the
 * original {@link SchemaDefinitionException}.
 */
public final class SchemaParseException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String source) {
        super(message, source);
    }

    public SchemaParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
