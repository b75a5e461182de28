package com.docview.jackson;

import com.docview.tree.json.JsonTreeItem;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;

/**
 * Jackson module that writes a {@link JsonTreeItem} and its descendants as the
 * JSON value they were parsed from.
 *
 * This module handles:
 * - Member order of objects (source order, as stored in the tree)
 * - Integer versus floating point numbers via {@link JsonNumberSerializer}
 */
public class TreeItemModule extends SimpleModule {

    public TreeItemModule() {
        super("TreeItemModule", new Version(1, 0, 0, null, "com.docview", "docview-core"));
        addSerializer(JsonTreeItem.class, new JsonTreeItemSerializer());
    }

    private static class JsonTreeItemSerializer extends JsonSerializer<JsonTreeItem> {
        private final JsonNumberSerializer numbers = new JsonNumberSerializer();

        @Override
        public void serialize(JsonTreeItem item, JsonGenerator gen, SerializerProvider provider) throws IOException {
            switch (item.kind()) {
                case OBJECT -> {
                    gen.writeStartObject();
                    for (JsonTreeItem child : item.children()) {
                        gen.writeFieldName(child.key());
                        serialize(child, gen, provider);
                    }
                    gen.writeEndObject();
                }
                case ARRAY -> {
                    gen.writeStartArray();
                    for (JsonTreeItem child : item.children()) {
                        serialize(child, gen, provider);
                    }
                    gen.writeEndArray();
                }
                case STRING -> gen.writeString((String) item.value());
                case NUMBER -> numbers.serialize(item.value(), gen, provider);
                case BOOLEAN -> gen.writeBoolean(Boolean.TRUE.equals(item.value()));
                case NULL -> gen.writeNull();
            }
        }
    }
}
