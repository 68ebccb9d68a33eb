package io.schemanode.standalone.check;

import io.schemanode.core.result.ValidationError;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of checking one data file.
 *
 * @param file   the file name, relative to the data directory
 * @param errors validation errors, empty when the file conforms
 */
public record FileResult(String file, List<ValidationError> errors) {

    public FileResult {
        Objects.requireNonNull(file, "file must not be null");
        errors = List.copyOf(errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
