package com.docview.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of a validation request. A valid document carries statistics and no error;
 * an invalid one carries the error and {@link JsonStats#EMPTY}.
 */
@JsonPropertyOrder({"isValid", "stats", "error"})
public record ValidationResult(
    @JsonProperty("isValid") boolean isValid,
    @JsonProperty("stats") JsonStats stats,
    @JsonProperty("error") FormatError error) {

    public static ValidationResult valid(JsonStats stats) {
        return new ValidationResult(true, stats, null);
    }

    public static ValidationResult invalid(FormatError error) {
        return new ValidationResult(false, JsonStats.EMPTY, error);
    }
}
