package io.schemanode.standalone.check;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemanode.core.result.ValidationError;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Renders a {@link CheckReport} as human-readable text or as a JSON document.
 *
 * <p>
 * Text mode prints one line per file followed by its indented errors and a summary line:
 *
 * <pre>
 * ada.json: VALID
 * bob.yaml: INVALID
 *   /id: Value must have a minimum of 1.
 * Checked 2 files: 1 valid, 1 invalid
 * </pre>
 */
public final class ReportWriter {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final boolean json;

    /**
     * @param format "json" for a JSON document, anything else for text
     */
    public ReportWriter(String format) {
        this.json = "json".equalsIgnoreCase(format);
    }

    public void write(CheckReport report, PrintStream out) {
        out.print(json ? renderJson(report) : renderText(report));
        out.flush();
    }

    String renderText(CheckReport report) {
        StringBuilder text = new StringBuilder();
        for (FileResult file : report.files()) {
            text.append(file.file()).append(": ").append(file.valid() ? "VALID" : "INVALID").append('\n');
            for (ValidationError error : file.errors()) {
                text.append("  ").append(error).append('\n');
            }
        }
        text.append("Checked ")
                .append(report.files().size())
                .append(" files: ")
                .append(report.validCount())
                .append(" valid, ")
                .append(report.invalidCount())
                .append(" invalid\n");
        return text.toString();
    }

    String renderJson(CheckReport report) {
        ObjectNode root = JSON_MAPPER.createObjectNode();
        root.put("schema", report.schema());
        root.put("valid", report.validCount());
        root.put("invalid", report.invalidCount());
        ArrayNode files = root.putArray("files");
        for (FileResult file : report.files()) {
            ObjectNode entry = files.addObject();
            entry.put("file", file.file());
            entry.put("valid", file.valid());
            ArrayNode errors = entry.putArray("errors");
            for (ValidationError error : file.errors()) {
                errors.addObject().put("path", error.path()).put("message", error.message());
            }
        }
        try {
            return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render JSON report", e);
        }
    }
}
