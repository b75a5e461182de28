package com.docview.tree.json;

import com.docview.format.IndentStyle;
import com.docview.tree.ItemArena;
import com.docview.tree.TreeItem;

import java.util.List;

/**
 * One JSON value in a parsed document. Objects and arrays own their members in
 * source order; scalars carry a {@link String}, {@link Long}, {@link Double},
 * {@link java.math.BigDecimal} (numbers out of double range), {@link Boolean} or
 * {@code null} value and never have children.
 */
public final class JsonTreeItem extends TreeItem<JsonTreeItem> {

    private final JsonKind kind;
    private final String key;
    private final Object value;

    JsonTreeItem(ItemArena<JsonTreeItem> arena, int id, int parentId, JsonKind kind, String key, Object value) {
        super(arena, id, parentId);
        this.kind = kind;
        this.key = key;
        this.value = kind.isContainer() ? null : value;
    }

    void append(JsonTreeItem child) {
        if (!kind.isContainer()) {
            throw new IllegalStateException(kind + " items cannot have children");
        }
        appendChild(child);
    }

    public JsonKind kind() {
        return kind;
    }

    /**
     * Member name under an object, the array index under an array, empty for the document root.
     */
    @Override
    public String key() {
        return key;
    }

    @Override
    public Object value() {
        return value;
    }

    @Override
    public String typeName() {
        return switch (kind) {
            case OBJECT -> "object";
            case ARRAY -> "array";
            case STRING -> "string";
            case NUMBER -> "number";
            case BOOLEAN -> "boolean";
            case NULL -> "null";
        };
    }

    @Override
    public boolean isExpandable() {
        return kind.isContainer() && childCount() > 0;
    }

    @Override
    public String path() {
        return jsonPath();
    }

    /**
     * JSONPath-style address: {@code $}, {@code $.a}, {@code $.list[0]}, {@code $["a.b"]}.
     * Bracketed keys are written as JSON strings, so quotes and backslashes are escaped.
     */
    public String jsonPath() {
        JsonTreeItem parent = parent();
        if (parent == null) {
            return "$";
        }
        String parentPath = parent.jsonPath();
        if (key.isEmpty()) {
            return parentPath;
        }
        if (parent.kind() == JsonKind.ARRAY) {
            return parentPath + "[" + key + "]";
        }
        if (needsBracket(key)) {
            return parentPath + "[" + quote(key) + "]";
        }
        return parentPath + "." + key;
    }

    private static boolean needsBracket(String key) {
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '.' || c == ' ' || c == '[' || c == ']' || c == '"' || c == '\\' || c < 0x20) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String serialize() {
        return toJsonString(0);
    }

    /**
     * Pretty-prints this value with two spaces per level, starting at {@code indentLevel}.
     */
    public String toJsonString(int indentLevel) {
        return toJsonString(IndentStyle.TWO_SPACES, indentLevel);
    }

    public String toJsonString(IndentStyle style, int indentLevel) {
        StringBuilder out = new StringBuilder();
        write(out, style, indentLevel);
        return out.toString();
    }

    private void write(StringBuilder out, IndentStyle style, int indentLevel) {
        switch (kind) {
            case OBJECT, ARRAY -> writeContainer(out, style, indentLevel);
            case STRING -> out.append(quote((String) value));
            case NUMBER -> out.append(value);
            case BOOLEAN -> out.append(Boolean.TRUE.equals(value) ? "true" : "false");
            case NULL -> out.append("null");
        }
    }

    private void writeContainer(StringBuilder out, IndentStyle style, int indentLevel) {
        boolean object = kind == JsonKind.OBJECT;
        List<JsonTreeItem> children = children();
        if (children.isEmpty()) {
            out.append(object ? "{}" : "[]");
            return;
        }
        String childIndent = style.indent(indentLevel + 1);
        out.append(object ? '{' : '[').append('\n');
        for (int i = 0; i < children.size(); i++) {
            JsonTreeItem child = children.get(i);
            if (i > 0) {
                out.append(",\n");
            }
            out.append(childIndent);
            if (object) {
                out.append(quote(child.key())).append(": ");
            }
            child.write(out, style, indentLevel + 1);
        }
        out.append('\n').append(style.indent(indentLevel)).append(object ? '}' : ']');
    }

    static String quote(String text) {
        StringBuilder out = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }

    @Override
    public String toString() {
        return "JsonTreeItem[" + kind + " " + jsonPath() + "]";
    }
}
