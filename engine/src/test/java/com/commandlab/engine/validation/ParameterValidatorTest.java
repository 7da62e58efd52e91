package com.commandlab.engine.validation;

import com.commandlab.engine.command.ParameterSpec;
import com.commandlab.engine.command.ParameterType;
import com.commandlab.engine.host.local.LocalWorkspaceFileSystem;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ParameterValidator.
 * Backed by a real workspace in a temp directory so the existence probe is exercised.
 */
class ParameterValidatorTest {

    @TempDir Path workspace;

    ParameterValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ParameterValidator(new LocalWorkspaceFileSystem(List.of(workspace)));
    }

    // ------------------------------------------------------------------
    // Presence
    // ------------------------------------------------------------------

    @Test
    void missingRequiredParameter_isError() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("name", ParameterType.STRING)), Map.of());

        assertThat(outcome.valid()).isFalse();
        assertThat(outcome.errors()).singleElement()
                .satisfies(e -> {
                    assertThat(e.code()).isEqualTo(ValidationCode.REQUIRED_PARAMETER_MISSING);
                    assertThat(e.parameterName()).isEqualTo("name");
                    assertThat(e.suggestion()).isNotNull();
                });
        assertThat(outcome.coercedValues()).isEmpty();
    }

    @Test
    void explicitNullForRequiredParameter_isTreatedAsMissing() {
        Map<String, Object> values = new HashMap<>();
        values.put("name", null);

        var outcome = validator.validate(List.of(ParameterSpec.required("name", ParameterType.STRING)), values);

        assertThat(outcome.errors()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.REQUIRED_PARAMETER_MISSING);
    }

    @Test
    void missingOptionalParameter_isSilentlySkipped() {
        var outcome = validator.validate(
                List.of(ParameterSpec.optional("flag", ParameterType.BOOLEAN)), Map.of());

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.errors()).isEmpty();
        assertThat(outcome.warnings()).isEmpty();
        assertThat(outcome.coercedValues()).doesNotContainKey("flag");
    }

    @Test
    void undeclaredParameter_isWarningOnly() {
        var outcome = validator.validate(
                List.of(ParameterSpec.optional("a", ParameterType.STRING)), Map.of("extra", 1));

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.warnings()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.UNEXPECTED_PARAMETER);
    }

    // ------------------------------------------------------------------
    // Coercion
    // ------------------------------------------------------------------

    @Test
    void numericString_isCoercedToNumberWithConversionWarning() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("n", ParameterType.NUMBER)), Map.of("n", "42"));

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.coercedValues().get("n")).isEqualTo(42L);
        assertThat(outcome.warnings()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.TYPE_CONVERSION);
    }

    @Test
    void fractionalString_isCoercedToDouble() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("n", ParameterType.NUMBER)), Map.of("n", "2.5"));

        assertThat(outcome.coercedValues().get("n")).isEqualTo(2.5d);
    }

    @Test
    void nonNumericString_isTypeMismatch() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("n", ParameterType.NUMBER)), Map.of("n", "abc"));

        assertThat(outcome.valid()).isFalse();
        assertThat(outcome.errors()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.TYPE_MISMATCH);
    }

    @Test
    void booleanAcceptsTextAndDigits() {
        List<ParameterSpec> sig = List.of(
                ParameterSpec.required("a", ParameterType.BOOLEAN),
                ParameterSpec.required("b", ParameterType.BOOLEAN),
                ParameterSpec.required("c", ParameterType.BOOLEAN));

        var outcome = validator.validate(sig, Map.of("a", "TRUE", "b", "0", "c", 1));

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.coercedValues())
                .containsEntry("a", true).containsEntry("b", false).containsEntry("c", true);
    }

    @Test
    void booleanRejectsOtherStrings() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("a", ParameterType.BOOLEAN)), Map.of("a", "yes"));

        assertThat(outcome.errors()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.TYPE_MISMATCH);
    }

    @Test
    void nonStringForStringParameter_isConvertedWithWarning() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("s", ParameterType.STRING)), Map.of("s", 12));

        assertThat(outcome.coercedValues().get("s")).isEqualTo("12");
        assertThat(outcome.warnings()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.TYPE_CONVERSION);
    }

    @Test
    void scalarForObjectParameter_isTypeMismatch() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("o", ParameterType.OBJECT)), Map.of("o", "text"));

        assertThat(outcome.errors()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.TYPE_MISMATCH);
    }

    // ------------------------------------------------------------------
    // String rules
    // ------------------------------------------------------------------

    @Test
    void emptyRequiredString_isError() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("s", ParameterType.STRING)), Map.of("s", ""));

        assertThat(outcome.errors()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.EMPTY_REQUIRED_STRING);
        assertThat(outcome.coercedValues()).doesNotContainKey("s");
    }

    @Test
    void emptyOptionalString_isAccepted() {
        var outcome = validator.validate(
                List.of(ParameterSpec.optional("s", ParameterType.STRING)), Map.of("s", ""));

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.coercedValues()).containsEntry("s", "");
    }

    @Test
    void veryLongString_isWarningOnly() {
        String text = "x".repeat(ParameterValidator.VERY_LONG_STRING_LENGTH + 1);

        var outcome = validator.validate(
                List.of(ParameterSpec.required("s", ParameterType.STRING)), Map.of("s", text));

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.warnings()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.VERY_LONG_STRING);
    }

    // ------------------------------------------------------------------
    // URIs
    // ------------------------------------------------------------------

    @Test
    void relativePath_resolvesAgainstWorkspaceRoot() throws Exception {
        Files.writeString(workspace.resolve("a.txt"), "hello");

        var outcome = validator.validate(
                List.of(ParameterSpec.required("path", ParameterType.URI)), Map.of("path", "a.txt"));

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.coercedValues().get("path")).isEqualTo(workspace.resolve("a.txt").toUri());
        assertThat(outcome.warnings()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.PATH_TO_URI_CONVERSION);
    }

    @Test
    void missingFile_addsFileNotFoundWarning() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("path", ParameterType.URI)), Map.of("path", "missing.txt"));

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.warnings()).extracting(ValidationIssue::code)
                .contains(ValidationCode.FILE_NOT_FOUND);
    }

    @Test
    void schemeString_isParsedAsUri() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("target", ParameterType.URI)),
                Map.of("target", "https://example.com/doc"));

        assertThat(outcome.coercedValues().get("target")).isEqualTo(URI.create("https://example.com/doc"));
        assertThat(outcome.warnings()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.STRING_TO_URI_CONVERSION);
    }

    @Test
    void numberForUri_isInvalidUriType() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("path", ParameterType.URI)), Map.of("path", 7));

        assertThat(outcome.errors()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.INVALID_URI_TYPE);
    }

    @Test
    void blankStringForUri_isInvalidUriFormat() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("path", ParameterType.URI)), Map.of("path", "  "));

        assertThat(outcome.errors()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.INVALID_URI_FORMAT);
    }

    @Test
    void uriArray_badElementReportsIndex() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("paths", ParameterType.URI_ARRAY)),
                Map.of("paths", List.of("a.txt", 5)));

        assertThat(outcome.errors()).singleElement().satisfies(e -> {
            assertThat(e.code()).isEqualTo(ValidationCode.INVALID_URI_ARRAY_ELEMENT);
            assertThat(e.message()).contains("index 1");
        });
    }

    @Test
    void integralStringBeyondDoublePrecision_staysExactLong() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("n", ParameterType.NUMBER)), Map.of("n", "9007199254740993"));

        assertThat(outcome.coercedValues().get("n")).isInstanceOf(Long.class).isEqualTo(9007199254740993L);
    }

    @Test
    void uriArray_convertsEveryElement() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("paths", ParameterType.URI_ARRAY)),
                Map.of("paths", List.of("a.txt", "b/c.txt")));

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.coercedValues().get("paths")).asInstanceOf(InstanceOfAssertFactories.LIST).containsExactly(
                workspace.resolve("a.txt").toUri(), workspace.resolve("b/c.txt").toUri());
    }

    // ------------------------------------------------------------------
    // Unions and unknown types
    // ------------------------------------------------------------------

    @Test
    void union_firstMatchingAlternativeWins() {
        ParameterType type = ParameterType.parse("number|string");

        var outcome = validator.validate(List.of(ParameterSpec.required("v", type)), Map.of("v", "12"));

        assertThat(outcome.coercedValues().get("v")).isEqualTo(12L);
    }

    @Test
    void union_noMatchingAlternative_listsCandidates() {
        ParameterType type = ParameterType.parse("number|boolean");

        var outcome = validator.validate(List.of(ParameterSpec.required("v", type)), Map.of("v", "maybe"));

        assertThat(outcome.errors()).singleElement().satisfies(e -> {
            assertThat(e.code()).isEqualTo(ValidationCode.UNION_TYPE_MISMATCH);
            assertThat(e.message()).contains("number").contains("boolean");
        });
    }

    @Test
    void unknownType_passesValueThroughWithWarning() {
        Object value = new Object();

        var outcome = validator.validate(
                List.of(ParameterSpec.required("x", ParameterType.parse("vscode.Position"))), Map.of("x", value));

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.coercedValues().get("x")).isSameAs(value);
        assertThat(outcome.warnings()).extracting(ValidationIssue::code)
                .containsExactly(ValidationCode.UNKNOWN_TYPE);
    }

    // ------------------------------------------------------------------
    // Independence and formatting
    // ------------------------------------------------------------------

    @Test
    void errorsFollowSignatureOrder_andValidParametersStillCoerced() {
        List<ParameterSpec> sig = List.of(
                ParameterSpec.required("first", ParameterType.NUMBER),
                ParameterSpec.required("second", ParameterType.STRING),
                ParameterSpec.required("third", ParameterType.BOOLEAN));
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("third", "nope");
        values.put("second", "ok");
        values.put("first", "x");

        var outcome = validator.validate(sig, values);

        assertThat(outcome.errors()).extracting(ValidationIssue::parameterName)
                .containsExactly("first", "third");
        assertThat(outcome.coercedValues()).containsOnlyKeys("second");
    }

    @Test
    void formatErrors_includesSuggestions() {
        var outcome = validator.validate(
                List.of(ParameterSpec.required("name", ParameterType.STRING)), Map.of());

        String text = ParameterValidator.formatErrors(outcome.errors());

        assertThat(text).startsWith("Validation errors:\n- name: ");
        assertThat(text).contains("(Suggestion: ");
        assertThat(ParameterValidator.formatErrors(List.of())).isEqualTo("No validation errors");
        assertThat(ParameterValidator.formatWarnings(List.of())).isEqualTo("No validation warnings");
    }
}
