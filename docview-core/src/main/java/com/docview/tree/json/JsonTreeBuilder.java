package com.docview.tree.json;

import com.docview.jackson.DocviewJackson;
import com.docview.tree.ItemArena;
import com.docview.tree.NodeLimitExceededException;
import com.docview.tree.TreeItem;
import com.docview.tree.TreeLoadException;
import com.docview.tree.TreeModel;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link JsonTreeItem} tree from JSON text.
 *
 * <p>Numbers that are integral and within the IEEE-754 safe integer range
 * (&plusmn;2<sup>53</sup>) are stored as {@link Long} so they print back without a
 * fractional part; every other number is stored as {@link Double}. A number that
 * a double cannot hold (it overflows, or underflows to zero) is kept as the
 * {@link java.math.BigDecimal} it was read as.</p>
 */
public final class JsonTreeBuilder {

    static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    private final ObjectReader reader;
    private final int maxNodes;

    public JsonTreeBuilder() {
        this(DocviewJackson.createObjectMapper(), TreeModel.MAX_NODE_COUNT);
    }

    public JsonTreeBuilder(ObjectMapper mapper, int maxNodes) {
        this.reader = Objects.requireNonNull(mapper, "mapper").reader()
            .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.maxNodes = maxNodes;
    }

    /**
     * Parses {@code json} and returns the root item of a complete tree.
     *
     * @throws TreeLoadException if the text is not a single well-formed JSON value
     * @throws NodeLimitExceededException if the document needs more than the configured node count
     */
    public JsonTreeItem build(String json) {
        JsonNode document;
        try {
            document = reader.readTree(json);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            throw new TreeLoadException(
                e.getOriginalMessage(),
                location == null ? 0 : location.getLineNr(),
                location == null ? 0 : location.getColumnNr(),
                e);
        }
        if (document == null || document.isMissingNode()) {
            throw new TreeLoadException("No JSON content to parse", 1, 1);
        }
        ItemArena<JsonTreeItem> arena = new ItemArena<>(maxNodes);
        return load(arena, document, TreeItem.NO_PARENT, "");
    }

    private JsonTreeItem load(ItemArena<JsonTreeItem> arena, JsonNode value, int parentId, String key) {
        if (arena.isFull()) {
            throw new NodeLimitExceededException(arena.capacity(), 0, 0);
        }
        if (value.isObject()) {
            JsonTreeItem item = create(arena, parentId, JsonKind.OBJECT, key, null);
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                item.append(load(arena, field.getValue(), item.id(), field.getKey()));
            }
            return item;
        }
        if (value.isArray()) {
            JsonTreeItem item = create(arena, parentId, JsonKind.ARRAY, key, null);
            for (int i = 0; i < value.size(); i++) {
                item.append(load(arena, value.get(i), item.id(), Integer.toString(i)));
            }
            return item;
        }
        if (value.isTextual()) {
            return create(arena, parentId, JsonKind.STRING, key, value.textValue());
        }
        if (value.isNumber()) {
            return create(arena, parentId, JsonKind.NUMBER, key, numberValue(value));
        }
        if (value.isBoolean()) {
            return create(arena, parentId, JsonKind.BOOLEAN, key, value.booleanValue());
        }
        return create(arena, parentId, JsonKind.NULL, key, null);
    }

    private static JsonTreeItem create(ItemArena<JsonTreeItem> arena, int parentId, JsonKind kind, String key, Object value) {
        return arena.allocate(id -> new JsonTreeItem(arena, id, parentId, kind, key, value));
    }

    /**
     * Integral values inside the safe integer range become {@link Long}, values a double
     * cannot represent stay {@link java.math.BigDecimal}, the rest {@link Double}.
     */
    static Object numberValue(JsonNode number) {
        if (number.isIntegralNumber() && number.canConvertToLong()) {
            long l = number.longValue();
            if (Math.abs((double) l) <= MAX_SAFE_INTEGER) {
                return l;
            }
        }
        double d = number.doubleValue();
        if (Double.isInfinite(d) || (d == 0 && number.decimalValue().signum() != 0)) {
            return number.decimalValue();
        }
        if (d == Math.rint(d) && Math.abs(d) <= MAX_SAFE_INTEGER) {
            return (long) d;
        }
        return d;
    }
}
