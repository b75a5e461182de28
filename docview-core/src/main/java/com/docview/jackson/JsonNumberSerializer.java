package com.docview.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Writes the number values a JSON tree holds: {@link Long} for safe integers,
 * {@link Double} for other finite numbers and {@link BigDecimal} for numbers
 * outside double range.
 */
public class JsonNumberSerializer extends JsonSerializer<Object> {

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Double d) {
            gen.writeNumber(d);
        } else if (value instanceof BigDecimal bd) {
            gen.writeNumber(bd);
        } else {
            throw new IllegalArgumentException("Not a tree number: " + value);
        }
    }
}
