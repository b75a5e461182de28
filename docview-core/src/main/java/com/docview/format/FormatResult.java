package com.docview.format;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of a format or minify request: {@code {success, result}} or {@code {success, error}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "result", "error"})
public record FormatResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("result") String result,
    @JsonProperty("error") String error) {

    public static FormatResult success(String result) {
        return new FormatResult(true, result, null);
    }

    public static FormatResult failure(String error) {
        return new FormatResult(false, null, error);
    }

    static FormatResult failure(FormatError error) {
        return failure(error.describe());
    }
}
