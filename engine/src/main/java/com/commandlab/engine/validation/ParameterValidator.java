package com.commandlab.engine.validation;

import com.commandlab.engine.command.ParameterKind;
import com.commandlab.engine.command.ParameterSpec;
import com.commandlab.engine.command.ParameterType;
import com.commandlab.engine.host.WorkspaceFileSystem;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks caller-supplied values against a command signature and coerces
 * them to the declared types.
 *
 * <p>Per parameter: presence, then type check/coercion, then (only if the
 * type check passed) the value rules. Parameters are independent of each
 * other, so issue order follows signature order. The only I/O is the
 * advisory existence probe behind {@code FILE_NOT_FOUND}.
 */
@Component
public class ParameterValidator {

    static final int VERY_LONG_STRING_LENGTH = 10_000;

    // Two or more scheme characters, so "C:\dir" stays a path.
    private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]+:.*");

    private final WorkspaceFileSystem fileSystem;

    public ParameterValidator(WorkspaceFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    public ValidationOutcome validate(List<ParameterSpec> signature, Map<String, Object> values) {
        Map<String, Object> input = values == null ? Map.of() : values;
        List<ValidationIssue> errors   = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        Map<String, Object>   coerced  = new LinkedHashMap<>();

        for (ParameterSpec spec : signature) {
            Object value = input.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    errors.add(new ValidationIssue(spec.name(), ValidationCode.REQUIRED_PARAMETER_MISSING,
                            "Required parameter '" + spec.name() + "' is missing",
                            "Provide a value of type '" + spec.type() + "'"));
                }
                continue;
            }

            Check check = checkType(spec.name(), spec.type(), value);
            warnings.addAll(check.warnings());
            if (!check.ok()) {
                errors.addAll(check.errors());
                continue;
            }

            int errorsBefore = errors.size();
            applyRules(spec, check.value(), errors, warnings);
            if (errors.size() == errorsBefore) {
                coerced.put(spec.name(), check.value());
            }
        }

        for (String name : input.keySet()) {
            boolean declared = signature.stream().anyMatch(p -> p.name().equals(name));
            if (!declared) {
                warnings.add(ValidationIssue.of(name, ValidationCode.UNEXPECTED_PARAMETER,
                        "Parameter '" + name + "' is not part of the command signature"));
            }
        }

        return ValidationOutcome.of(errors, warnings, coerced);
    }

    // ------------------------------------------------------------------
    // Formatting
    // ------------------------------------------------------------------

    public static String formatErrors(List<ValidationIssue> errors) {
        if (errors.isEmpty()) {
            return "No validation errors";
        }
        return errors.stream()
                .map(e -> "- " + e.parameterName() + ": " + e.message()
                        + (e.suggestion() != null ? " (Suggestion: " + e.suggestion() + ")" : ""))
                .collect(Collectors.joining("\n", "Validation errors:\n", ""));
    }

    public static String formatWarnings(List<ValidationIssue> warnings) {
        if (warnings.isEmpty()) {
            return "No validation warnings";
        }
        return warnings.stream()
                .map(w -> "- " + w.parameterName() + ": " + w.message())
                .collect(Collectors.joining("\n", "Validation warnings:\n", ""));
    }

    // ------------------------------------------------------------------
    // Type check and coercion
    // ------------------------------------------------------------------

    private Check checkType(String name, ParameterType type, Object value) {
        return switch (type.kind()) {
            case STRING -> value instanceof String
                    ? Check.pass(value)
                    : Check.pass(String.valueOf(value), conversion(name, value, "string"));
            case NUMBER -> checkNumber(name, value);
            case BOOLEAN -> checkBoolean(name, value);
            case OBJECT -> isScalar(value)
                    ? Check.fail(mismatch(name, "object", value))
                    : Check.pass(value);
            case ARRAY -> value instanceof Collection<?> || value.getClass().isArray()
                    ? Check.pass(value)
                    : Check.fail(mismatch(name, "array", value));
            case URI -> checkUri(name, value);
            case URI_ARRAY -> checkUriArray(name, value);
            case UNION -> checkUnion(name, type, value);
            case UNKNOWN -> Check.pass(value, ValidationIssue.of(name, ValidationCode.UNKNOWN_TYPE,
                    "Unknown parameter type '" + type + "', value passed through unchecked"));
        };
    }

    private Check checkNumber(String name, Object value) {
        if (value instanceof Number) {
            return Check.pass(value);
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                BigDecimal parsed = new BigDecimal(s.trim());
                return Check.pass(toNumber(parsed), conversion(name, value, "number"));
            } catch (NumberFormatException e) {
                return Check.fail(mismatch(name, "number", value));
            }
        }
        return Check.fail(mismatch(name, "number", value));
    }

    private static Number toNumber(BigDecimal parsed) {
        try {
            if (parsed.stripTrailingZeros().scale() <= 0) {
                return parsed.longValueExact();
            }
            return parsed.doubleValue();
        } catch (ArithmeticException e) {
            return parsed.doubleValue();
        }
    }

    private Check checkBoolean(String name, Object value) {
        if (value instanceof Boolean) {
            return Check.pass(value);
        }
        Boolean parsed = null;
        if (value instanceof String s) {
            parsed = switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "true", "1" -> Boolean.TRUE;
                case "false", "0" -> Boolean.FALSE;
                default -> null;
            };
        } else if (value instanceof Number n) {
            double d = n.doubleValue();
            parsed = d == 1 ? Boolean.TRUE : d == 0 ? Boolean.FALSE : null;
        }
        return parsed == null
                ? Check.fail(mismatch(name, "boolean", value))
                : Check.pass(parsed, conversion(name, value, "boolean"));
    }

    private Check checkUri(String name, Object value) {
        if (value instanceof URI) {
            return Check.pass(value);
        }
        if (value instanceof Path path) {
            return Check.pass(path.toUri(), ValidationIssue.of(name, ValidationCode.PATH_TO_URI_CONVERSION,
                    "Converted path '" + path + "' to a file URI"));
        }
        if (!(value instanceof String s)) {
            return Check.fail(new ValidationIssue(name, ValidationCode.INVALID_URI_TYPE,
                    "Parameter '" + name + "' must be a URI or a path string, got " + typeName(value),
                    "Pass a file path or a URI string"));
        }
        if (s.isBlank()) {
            return Check.fail(invalidUri(name, s));
        }
        try {
            if (URI_SCHEME.matcher(s).matches()) {
                return Check.pass(URI.create(s), ValidationIssue.of(name, ValidationCode.STRING_TO_URI_CONVERSION,
                        "Converted string '" + s + "' to a URI"));
            }
            return Check.pass(resolvePath(s).toUri(), ValidationIssue.of(name, ValidationCode.PATH_TO_URI_CONVERSION,
                    "Converted path '" + s + "' to a file URI"));
        } catch (IllegalArgumentException e) {
            return Check.fail(invalidUri(name, s));
        }
    }

    // Relative paths are relative to the workspace, not the process.
    private Path resolvePath(String s) {
        Path path = Path.of(s);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        List<Path> roots = fileSystem.listWorkspaceRoots();
        return roots.isEmpty() ? path.toAbsolutePath().normalize() : roots.get(0).resolve(path).normalize();
    }

    private Check checkUriArray(String name, Object value) {
        if (!(value instanceof Collection<?> items)) {
            return Check.fail(mismatch(name, "uri[]", value));
        }
        List<URI> uris = new ArrayList<>(items.size());
        List<ValidationIssue> warnings = new ArrayList<>();
        int index = 0;
        for (Object item : items) {
            Check element = item == null
                    ? Check.fail(invalidUri(name, null))
                    : checkUri(name, item);
            if (!element.ok()) {
                String cause = element.errors().isEmpty() ? "" : ": " + element.errors().get(0).message();
                return Check.fail(new ValidationIssue(name, ValidationCode.INVALID_URI_ARRAY_ELEMENT,
                        "Element at index " + index + " of '" + name + "' is not a valid URI" + cause,
                        "Make every element a file path or URI"));
            }
            warnings.addAll(element.warnings());
            uris.add((URI) element.value());
            index++;
        }
        return new Check(true, uris, List.of(), warnings);
    }

    private Check checkUnion(String name, ParameterType type, Object value) {
        for (ParameterType alternative : type.alternatives()) {
            Check attempt = checkType(name, alternative, value);
            if (attempt.ok()) {
                return attempt;
            }
        }
        String candidates = type.alternatives().stream()
                .map(ParameterType::name)
                .collect(Collectors.joining(", "));
        return Check.fail(new ValidationIssue(name, ValidationCode.UNION_TYPE_MISMATCH,
                "Parameter '" + name + "' does not match any of: " + candidates,
                "Provide a value of one of: " + candidates));
    }

    // ------------------------------------------------------------------
    // Value rules
    // ------------------------------------------------------------------

    private void applyRules(ParameterSpec spec, Object value,
                            List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        ParameterKind kind = spec.type().kind();
        if (kind == ParameterKind.STRING && value instanceof String s) {
            if (s.isEmpty() && spec.required()) {
                errors.add(new ValidationIssue(spec.name(), ValidationCode.EMPTY_REQUIRED_STRING,
                        "Required string parameter '" + spec.name() + "' cannot be empty",
                        "Provide a non-empty string value"));
            }
            if (s.length() > VERY_LONG_STRING_LENGTH) {
                warnings.add(ValidationIssue.of(spec.name(), ValidationCode.VERY_LONG_STRING,
                        "String parameter '" + spec.name() + "' is very long (" + s.length() + " characters)"));
            }
        }
        if (kind == ParameterKind.URI && value instanceof URI uri && "file".equalsIgnoreCase(uri.getScheme())) {
            Path path;
            try {
                path = Path.of(uri);
            } catch (IllegalArgumentException e) {
                return;
            }
            if (!fileSystem.exists(path)) {
                warnings.add(ValidationIssue.of(spec.name(), ValidationCode.FILE_NOT_FOUND,
                        "File '" + path + "' does not exist"));
            }
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number
                || value instanceof Boolean || value instanceof Character;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static ValidationIssue conversion(String name, Object value, String target) {
        return ValidationIssue.of(name, ValidationCode.TYPE_CONVERSION,
                "Converted " + typeName(value) + " value '" + value + "' to " + target);
    }

    private static ValidationIssue mismatch(String name, String expected, Object value) {
        return new ValidationIssue(name, ValidationCode.TYPE_MISMATCH,
                "Parameter '" + name + "' must be " + expected + ", got " + typeName(value),
                "Provide a value of type '" + expected + "'");
    }

    private static ValidationIssue invalidUri(String name, String value) {
        return new ValidationIssue(name, ValidationCode.INVALID_URI_FORMAT,
                "Parameter '" + name + "' is not a valid URI or path: '" + value + "'",
                "Use an absolute path, a workspace-relative path, or a URI such as file:///path");
    }

    private record Check(boolean ok, Object value, List<ValidationIssue> errors, List<ValidationIssue> warnings) {

        static Check pass(Object value) {
            return new Check(true, value, List.of(), List.of());
        }

        static Check pass(Object value, ValidationIssue warning) {
            return new Check(true, value, List.of(), List.of(warning));
        }

        static Check fail(ValidationIssue error) {
            return new Check(false, null, List.of(error), List.of());
        }
    }
}
