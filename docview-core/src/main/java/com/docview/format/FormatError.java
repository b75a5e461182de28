package com.docview.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Where and why input could not be parsed. Line and column are 1-based; 0 means unknown.
 */
@JsonPropertyOrder({"message", "line", "column"})
public record FormatError(
    @JsonProperty("message") String message,
    @JsonProperty("line") int line,
    @JsonProperty("column") int column) {

    static final String EMPTY_INPUT = "Empty input";

    static FormatError emptyInput() {
        return new FormatError(EMPTY_INPUT, 0, 0);
    }

    /**
     * {@code message at line L, column C}, or just the message when the position is unknown.
     */
    public String describe() {
        if (line <= 0) {
            return message;
        }
        return message + " at line " + line + ", column " + column;
    }
}
