package com.commandlab.engine.validation;

/**
 * Machine-readable issue codes. {@link #isError()} tells which ones fail
 * validation; the others are advisory warnings.
 */
public enum ValidationCode {

    REQUIRED_PARAMETER_MISSING(true),
    TYPE_MISMATCH(true),
    EMPTY_REQUIRED_STRING(true),
    INVALID_URI_FORMAT(true),
    INVALID_URI_TYPE(true),
    INVALID_URI_ARRAY_ELEMENT(true),
    UNION_TYPE_MISMATCH(true),

    TYPE_CONVERSION(false),
    PATH_TO_URI_CONVERSION(false),
    STRING_TO_URI_CONVERSION(false),
    VERY_LONG_STRING(false),
    UNKNOWN_TYPE(false),
    FILE_NOT_FOUND(false),
    UNEXPECTED_PARAMETER(false);

    private final boolean error;

    ValidationCode(boolean error) {
        this.error = error;
    }

    public boolean isError() {
        return error;
    }
}
