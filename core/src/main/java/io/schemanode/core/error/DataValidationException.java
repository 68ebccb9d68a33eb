package io.schemanode.core.error;

import io.schemanode.core.result.ValidationError;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@code SchemaNode.validateOrFail} when the data does not conform. Carries the full,
 * ordered error list of the underlying validation result.
 */
public final class DataValidationException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final List<ValidationError> errors;

    public DataValidationException(List<ValidationError> errors) {
        super(render(errors), Phase.VALIDATION);
        this.errors = List.copyOf(errors);
    }

    /** The validation errors, in the order they were recorded. */
    public List<ValidationError> errors() {
        return errors;
    }

    private static String render(List<ValidationError> errors) {
        return errors.stream().map(ValidationError::toString).collect(Collectors.joining("; "));
    }
}
