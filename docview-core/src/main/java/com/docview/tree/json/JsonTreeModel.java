package com.docview.tree.json;

import com.docview.jackson.DocviewJackson;
import com.docview.tree.ItemRole;
import com.docview.tree.TreeIndex;
import com.docview.tree.TreeModel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.EnumSet;
import java.util.Set;

/**
 * Tree model over a JSON document. The document value itself is the hidden root;
 * its members or elements are the top-level rows.
 */
public class JsonTreeModel extends TreeModel<JsonTreeItem> {

    private static final Set<ItemRole> ROLES = EnumSet.of(
        ItemRole.DISPLAY,
        ItemRole.KEY,
        ItemRole.VALUE,
        ItemRole.VALUE_TYPE,
        ItemRole.PATH,
        ItemRole.CHILD_COUNT,
        ItemRole.IS_EXPANDABLE);

    private final JsonTreeBuilder builder;
    private final ObjectMapper mapper;

    public JsonTreeModel() {
        this(new JsonTreeBuilder(), DocviewJackson.createObjectMapper());
    }

    public JsonTreeModel(JsonTreeBuilder builder, ObjectMapper mapper) {
        this.builder = builder;
        this.mapper = mapper;
    }

    /**
     * Replaces the tree with one built from {@code json}.
     *
     * @return {@code false} on malformed input or when the node limit is hit
     */
    public boolean loadJson(String json) {
        return load(json, builder::build);
    }

    /**
     * Single-line JSON for the item at {@code index}, or an empty string for an invalid index.
     */
    public String serializeNodeCompact(TreeIndex index) {
        JsonTreeItem item = item(index);
        if (item == null) {
            return "";
        }
        try {
            return mapper.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + item, e);
        }
    }

    @Override
    protected Set<ItemRole> supportedRoles() {
        return ROLES;
    }

    @Override
    protected String displayText(JsonTreeItem item) {
        if (item.kind().isContainer()) {
            return item.key();
        }
        return item.key() + ": " + item.serialize();
    }
}
