package org.webmev.structures.error;

/**
 * Categories of validation failure raised by the data structures.
 */
public enum ErrorKind {
    NULL_VALUE("null_value"),
    INVALID_VALUE("invalid_value"),
    MISSING_PARAMETER("missing_parameter"),
    INVALID_PARAMETER("invalid_parameter"),
    UNKNOWN_TYPE("unknown_type"),
    MISSING_VALUE("missing_value"),
    UNKNOWN_EXTRA_PARAMETER("unknown_extra_parameter"),
    STRUCTURE("structure"),
    CONFLICT("conflict"),
    INVALID_RESOURCE_TYPE("invalid_resource_type");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
