package com.docview.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Value counts of a JSON document. The document value sits at depth 1.
 */
@JsonPropertyOrder({
    "object_count", "array_count", "string_count", "number_count",
    "boolean_count", "null_count", "total_keys", "max_depth"})
public record JsonStats(
    @JsonProperty("object_count") int objectCount,
    @JsonProperty("array_count") int arrayCount,
    @JsonProperty("string_count") int stringCount,
    @JsonProperty("number_count") int numberCount,
    @JsonProperty("boolean_count") int booleanCount,
    @JsonProperty("null_count") int nullCount,
    @JsonProperty("total_keys") int totalKeys,
    @JsonProperty("max_depth") int maxDepth) {

    public static final JsonStats EMPTY = new JsonStats(0, 0, 0, 0, 0, 0, 0, 0);
}
