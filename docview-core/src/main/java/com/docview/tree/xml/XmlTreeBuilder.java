package com.docview.tree.xml;

import com.docview.tree.ItemArena;
import com.docview.tree.NodeLimitExceededException;
import com.docview.tree.TreeItem;
import com.docview.tree.TreeLoadException;
import com.docview.tree.TreeModel;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Builds an {@link XmlTreeItem} tree from XML text in one forward pass over a
 * Woodstox stream reader.
 *
 * <p>Declarations, processing instructions and the DTD produce no items.
 * Adjacent character events are merged before the whitespace check, so a text
 * node never ends up split at an entity reference.</p>
 */
public final class XmlTreeBuilder {

    private final XMLInputFactory2 factory;
    private final int maxNodes;

    public XmlTreeBuilder() {
        this(TreeModel.MAX_NODE_COUNT);
    }

    public XmlTreeBuilder(int maxNodes) {
        this.factory = XmlStreams.newInputFactory();
        this.maxNodes = maxNodes;
    }

    /**
     * Parses {@code xml} and returns the ROOT item of a complete tree.
     *
     * @throws TreeLoadException on malformed input
     * @throws NodeLimitExceededException if the document needs more than the configured node count
     */
    public XmlTreeItem build(String xml) {
        XMLStreamReader2 reader;
        try {
            reader = (XMLStreamReader2) factory.createXMLStreamReader(new StringReader(XmlStreams.stripByteOrderMark(xml)));
        } catch (XMLStreamException e) {
            throw loadException(e);
        }
        try {
            return scan(reader);
        } catch (XMLStreamException e) {
            throw loadException(e);
        } finally {
            try {
                reader.closeCompletely();
            } catch (XMLStreamException e) {
                LOGGER.debug("Failed to close XML reader", e);
            }
        }
    }

    private XmlTreeItem scan(XMLStreamReader2 reader) throws XMLStreamException {
        ItemArena<XmlTreeItem> arena = new ItemArena<>(maxNodes);
        XmlTreeItem root = arena.allocate(id -> new XmlTreeItem(arena, id, TreeItem.NO_PARENT, XmlKind.ROOT, "", "", ""));
        Deque<XmlTreeItem> stack = new ArrayDeque<>();
        stack.push(root);
        StringBuilder text = new StringBuilder();

        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.SPACE) {
                text.append(reader.getText());
                continue;
            }
            flushText(reader, arena, stack.peek(), text);
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> stack.push(startElement(reader, arena, stack.peek()));
                case XMLStreamConstants.END_ELEMENT -> {
                    if (stack.peek() != root) {
                        stack.pop();
                    }
                }
                case XMLStreamConstants.CDATA -> add(reader, arena, stack.peek(), XmlKind.CDATA, "", reader.getText(), "");
                case XMLStreamConstants.COMMENT ->
                    add(reader, arena, stack.peek(), XmlKind.COMMENT, XmlTreeItem.COMMENT_KEY, reader.getText(), "");
                default -> {
                    // declarations, processing instructions, DTD and entity tokens carry no item
                }
            }
        }
        return root;
    }

    private XmlTreeItem startElement(XMLStreamReader2 reader, ItemArena<XmlTreeItem> arena, XmlTreeItem parent) {
        XmlTreeItem element = add(reader, arena, parent, XmlKind.ELEMENT, reader.getLocalName(), "", nullToEmpty(reader.getPrefix()));
        for (int i = 0; i < reader.getNamespaceCount(); i++) {
            String prefix = nullToEmpty(reader.getNamespacePrefix(i));
            String name = prefix.isEmpty() ? "@xmlns" : "@xmlns:" + prefix;
            add(reader, arena, element, XmlKind.ATTRIBUTE, name, nullToEmpty(reader.getNamespaceURI(i)), "");
        }
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            String prefix = nullToEmpty(reader.getAttributePrefix(i));
            String localName = reader.getAttributeLocalName(i);
            String name = prefix.isEmpty() ? "@" + localName : "@" + prefix + ":" + localName;
            add(reader, arena, element, XmlKind.ATTRIBUTE, name, reader.getAttributeValue(i), "");
        }
        return element;
    }

    private void flushText(XMLStreamReader2 reader, ItemArena<XmlTreeItem> arena, XmlTreeItem parent, StringBuilder text) {
        if (text.length() == 0) {
            return;
        }
        if (!XmlStreams.isWhitespace(text)) {
            add(reader, arena, parent, XmlKind.TEXT, "", text.toString(), "");
        }
        text.setLength(0);
    }

    private XmlTreeItem add(XMLStreamReader2 reader, ItemArena<XmlTreeItem> arena, XmlTreeItem parent,
                            XmlKind kind, String key, String value, String prefix) {
        if (arena.isFull()) {
            throw new NodeLimitExceededException(
                arena.capacity(),
                XmlStreams.line(reader.getLocation()),
                XmlStreams.column(reader.getLocation()));
        }
        XmlTreeItem item = arena.allocate(id -> new XmlTreeItem(arena, id, parent.id(), kind, key, value, prefix));
        parent.append(item);
        return item;
    }

    private static TreeLoadException loadException(XMLStreamException e) {
        return new TreeLoadException(
            XmlStreams.message(e),
            XmlStreams.line(e.getLocation()),
            XmlStreams.column(e.getLocation()),
            e);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(XmlTreeBuilder.class);
}
