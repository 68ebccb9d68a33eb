package io.schemanode.standalone.check;

import java.util.List;

/**
 * Results of one checker run, in the order the files were checked. With fail-fast enabled the
 * list ends at the first invalid file.
 *
 * @param schema the schema definition the data was checked against
 * @param files  per-file results
 */
public record CheckReport(String schema, List<FileResult> files) {

    public CheckReport {
        files = List.copyOf(files);
    }

    public long validCount() {
        return files.stream().filter(FileResult::valid).count();
    }

    public long invalidCount() {
        return files.size() - validCount();
    }

    /** Returns {@code true} if every checked file conforms. */
    public boolean allValid() {
        return invalidCount() == 0;
    }
}
