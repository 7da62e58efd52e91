package com.commandlab.engine.command;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Declared type of a command parameter.
 *
 * Closed set of {@link ParameterKind}s; {@code UNION} carries its
 * alternatives in declaration order. {@code name} keeps the text the type
 * was parsed from and is what appears in JSON and in messages.
 */
public record ParameterType(
        ParameterKind       kind,
        String              name,
        List<ParameterType> alternatives) {

    public static final ParameterType STRING    = of(ParameterKind.STRING, "string");
    public static final ParameterType NUMBER    = of(ParameterKind.NUMBER, "number");
    public static final ParameterType BOOLEAN   = of(ParameterKind.BOOLEAN, "boolean");
    public static final ParameterType OBJECT    = of(ParameterKind.OBJECT, "object");
    public static final ParameterType ARRAY     = of(ParameterKind.ARRAY, "array");
    public static final ParameterType URI       = of(ParameterKind.URI, "uri");
    public static final ParameterType URI_ARRAY = of(ParameterKind.URI_ARRAY, "uri[]");

    public ParameterType {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    private static ParameterType of(ParameterKind kind, String name) {
        return new ParameterType(kind, name, List.of());
    }

    /**
     * Resolve a free-form type name such as {@code "string"},
     * {@code "vscode.Uri[]"} or {@code "string|number"}.
     * Names outside the known set resolve to {@link ParameterKind#UNKNOWN}.
     */
    public static ParameterType parse(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.contains("|")) {
            List<ParameterType> alternatives = Arrays.stream(text.split("\\|"))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(ParameterType::parse)
                    .toList();
            return new ParameterType(ParameterKind.UNION, text, alternatives);
        }
        ParameterKind kind = switch (text.toLowerCase(Locale.ROOT)) {
            case "string" -> ParameterKind.STRING;
            case "number" -> ParameterKind.NUMBER;
            case "boolean" -> ParameterKind.BOOLEAN;
            case "object" -> ParameterKind.OBJECT;
            case "array", "any[]" -> ParameterKind.ARRAY;
            case "uri", "vscode.uri", "resource" -> ParameterKind.URI;
            case "uri[]", "vscode.uri[]" -> ParameterKind.URI_ARRAY;
            default -> ParameterKind.UNKNOWN;
        };
        return new ParameterType(kind, text, List.of());
    }

    public static ParameterType union(ParameterType... alternatives) {
        String name = String.join("|", Arrays.stream(alternatives).map(ParameterType::name).toList());
        return new ParameterType(ParameterKind.UNION, name, List.of(alternatives));
    }

    @JsonValue
    @Override
    public String toString() {
        return name;
    }
}
