package com.docview.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;

/**
 * Factory for properly configured ObjectMapper instances.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = DocviewJackson.createObjectMapper();
 * JsonTreeItem root = new JsonTreeBuilder(mapper, TreeModel.MAX_NODE_COUNT).build(json);
 * String compact = mapper.writeValueAsString(root);
 * </pre>
 */
public final class DocviewJackson {

    private DocviewJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper for reading documents into trees and writing results.
     *
     * The returned mapper:
     * - Rejects trailing content after the first JSON value
     * - Serializes JsonTreeItem subtrees as plain JSON (see {@link TreeItemModule})
     * - Leaves null members out of result records
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.registerModule(new TreeItemModule());
        return mapper;
    }

    /**
     * Creates a mapper that keeps numbers exactly as written, for reformatting text.
     *
     * Floating point literals are read as BigDecimal without stripping trailing zeros,
     * so {@code 1.50} comes back out as {@code 1.50} and large integers are never rounded.
     */
    public static ObjectMapper createExactObjectMapper() {
        ObjectMapper mapper = createObjectMapper();
        mapper.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
        mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
        return mapper;
    }
}
