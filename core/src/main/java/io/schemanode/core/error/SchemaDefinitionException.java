package io.schemanode.core.error;

/**
 * Abstract parent for definition-time errors. Thrown while a schema tree is being built, by a
 * node builder, the {@code NodeTypeRegistry} or the {@code SchemaParser}. These are programmer
 * errors: they are never collected into a validation result. Carries an additional {@code source}
 * field identifying the definition file, or {@code null} for trees built in code.
 */
public abstract class SchemaDefinitionException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaDefinitionException(String message, String source) {
        super(message, Phase.DEFINITION);
        this.source = source;
    }

    protected SchemaDefinitionException(String message, Throwable cause, String source) {
        super(message, cause, Phase.DEFINITION);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}
