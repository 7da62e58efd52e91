package com.commandlab.engine.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders captured results for offline review.
 */
@Component
public class ResultExporter {

    private static final List<String> CSV_HEADERS = List.of(
            "ID", "Command ID", "Success", "Duration (ms)", "Risk Level",
            "Side Effects", "Timestamp", "Tags", "Notes");

    private final ObjectMapper objectMapper;

    public ResultExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String export(List<TestResult> results, ExportFormat format) {
        return switch (format) {
            case JSON -> toJson(results);
            case CSV -> toCsv(results);
            case MARKDOWN -> toMarkdown(results);
        };
    }

    private String toJson(List<TestResult> results) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise results to JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String toCsv(List<TestResult> results) {
        StringBuilder sb = new StringBuilder(String.join(",", CSV_HEADERS));
        for (TestResult r : results) {
            sb.append('\n').append(String.join(",",
                    csv(r.id()),
                    csv(r.commandId()),
                    String.valueOf(r.executionResult().success()),
                    String.valueOf(r.executionResult().durationMs()),
                    r.overallRisk().label(),
                    String.valueOf(r.analysis().sideEffectAnalysis().totalEffects()),
                    r.timestamp().toString(),
                    csv(String.join(";", r.tags())),
                    csv(r.notes())));
        }
        return sb.toString();
    }

    /** RFC 4180 quoting: wrap in quotes when needed, double embedded quotes. */
    static String csv(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static String toMarkdown(List<TestResult> results) {
        StringBuilder md = new StringBuilder("# Command Test Results\n\n");
        for (TestResult r : results) {
            md.append("## ").append(r.commandId()).append("\n\n");
            md.append("- **Result ID**: ").append(r.id()).append('\n');
            md.append("- **Success**: ").append(r.executionResult().success() ? "yes" : "no").append('\n');
            md.append("- **Duration**: ").append(r.executionResult().durationMs()).append("ms\n");
            md.append("- **Risk Level**: ").append(r.overallRisk().label()).append('\n');
            md.append("- **Side Effects**: ").append(r.analysis().sideEffectAnalysis().totalEffects()).append('\n');
            md.append("- **Timestamp**: ").append(r.timestamp()).append('\n');
            if (r.executionResult().error() != null) {
                md.append("- **Error**: ").append(r.executionResult().error().message()).append('\n');
            }
            if (r.hasNotes()) {
                md.append("- **Notes**: ").append(r.notes()).append('\n');
            }
            md.append('\n');
        }
        return md.toString();
    }
}
