package com.docview.tree.xml;

import com.docview.tree.ItemArena;
import com.docview.tree.TreeItem;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of a parsed XML document.
 *
 * <p>Attributes are children of their element with keys of the form {@code @name}
 * or {@code @prefix:name}; they never have children of their own and are folded
 * back into the opening tag when the element is serialized.</p>
 */
public final class XmlTreeItem extends TreeItem<XmlTreeItem> {

    static final String COMMENT_KEY = "<!-- -->";

    private final XmlKind kind;
    private final String key;
    private final String value;
    private final String namespacePrefix;

    XmlTreeItem(ItemArena<XmlTreeItem> arena, int id, int parentId,
                XmlKind kind, String key, String value, String namespacePrefix) {
        super(arena, id, parentId);
        this.kind = kind;
        this.key = key == null ? "" : key;
        this.value = value == null ? "" : value;
        this.namespacePrefix = namespacePrefix == null ? "" : namespacePrefix;
    }

    void append(XmlTreeItem child) {
        if (kind != XmlKind.ROOT && kind != XmlKind.ELEMENT) {
            throw new IllegalStateException(kind + " items cannot have children");
        }
        if (child.kind() == XmlKind.ATTRIBUTE && kind != XmlKind.ELEMENT) {
            throw new IllegalStateException("Attributes belong to elements, not " + kind);
        }
        appendChild(child);
    }

    public XmlKind kind() {
        return kind;
    }

    /**
     * Local tag name for elements, {@code @name} for attributes, empty otherwise.
     */
    @Override
    public String key() {
        return key;
    }

    @Override
    public String value() {
        return value;
    }

    public String namespacePrefix() {
        return namespacePrefix;
    }

    /**
     * {@code prefix:name} when the element has a namespace prefix, otherwise the bare name.
     */
    public String qualifiedName() {
        return namespacePrefix.isEmpty() ? key : namespacePrefix + ":" + key;
    }

    @Override
    public String typeName() {
        return switch (kind) {
            case ROOT -> "root";
            case ELEMENT -> "element";
            case ATTRIBUTE -> "attribute";
            case TEXT -> "text";
            case COMMENT -> "comment";
            case CDATA -> "cdata";
        };
    }

    @Override
    public String path() {
        return xmlPath();
    }

    /**
     * XPath-like address such as {@code /root/item[1]/@id}. Same-named sibling
     * elements get a 0-based {@code [i]} suffix; a lone element gets none.
     */
    public String xmlPath() {
        XmlTreeItem parent = parent();
        if (parent == null) {
            return "";
        }
        String parentPath = parent.xmlPath();
        return switch (kind) {
            case ROOT -> "";
            case ELEMENT -> parentPath + "/" + qualifiedName() + siblingIndexSuffix(parent);
            case ATTRIBUTE -> parentPath + "/@" + key.substring(1);
            case TEXT, CDATA -> parentPath + "/text()";
            case COMMENT -> parentPath + "/comment()";
        };
    }

    private String siblingIndexSuffix(XmlTreeItem parent) {
        String name = qualifiedName();
        int sameNameIndex = 0;
        int sameNameCount = 0;
        for (XmlTreeItem sibling : parent.children()) {
            if (sibling.kind() == XmlKind.ELEMENT && sibling.qualifiedName().equals(name)) {
                if (sibling == this) {
                    sameNameIndex = sameNameCount;
                }
                sameNameCount++;
            }
        }
        return sameNameCount > 1 ? "[" + sameNameIndex + "]" : "";
    }

    @Override
    public String serialize() {
        return toXmlString(0);
    }

    /**
     * Serializes this node with two spaces of indentation per level.
     */
    public String toXmlString(int indentLevel) {
        String indent = "  ".repeat(indentLevel);
        return switch (kind) {
            case ROOT -> {
                List<String> parts = new ArrayList<>();
                for (XmlTreeItem child : children()) {
                    parts.add(child.toXmlString(indentLevel));
                }
                yield String.join("\n", parts);
            }
            case ELEMENT -> elementString(indent, indentLevel);
            case ATTRIBUTE -> "";
            case TEXT -> indent + XmlStreams.escapeText(value);
            case COMMENT -> indent + "<!--" + value + "-->";
            case CDATA -> indent + "<![CDATA[" + value + "]]>";
        };
    }

    private String elementString(String indent, int indentLevel) {
        String name = qualifiedName();
        StringBuilder out = new StringBuilder(indent).append('<').append(name);
        List<XmlTreeItem> content = new ArrayList<>();
        for (XmlTreeItem child : children()) {
            if (child.kind() == XmlKind.ATTRIBUTE) {
                out.append(' ')
                    .append(child.key().substring(1))
                    .append("=\"")
                    .append(XmlStreams.escapeAttribute(child.value()))
                    .append('"');
            } else {
                content.add(child);
            }
        }

        if (content.isEmpty()) {
            return out.append("/>").toString();
        }
        if (content.size() == 1 && isCharacterData(content.get(0))) {
            XmlTreeItem only = content.get(0);
            out.append('>');
            if (only.kind() == XmlKind.CDATA) {
                out.append("<![CDATA[").append(only.value()).append("]]>");
            } else {
                out.append(XmlStreams.escapeText(only.value()));
            }
            return out.append("</").append(name).append('>').toString();
        }
        out.append(">\n");
        for (XmlTreeItem child : content) {
            out.append(child.toXmlString(indentLevel + 1)).append('\n');
        }
        return out.append(indent).append("</").append(name).append('>').toString();
    }

    private static boolean isCharacterData(XmlTreeItem item) {
        return item.kind() == XmlKind.TEXT || item.kind() == XmlKind.CDATA;
    }

    @Override
    public String toString() {
        return "XmlTreeItem[" + kind + " " + xmlPath() + "]";
    }
}
