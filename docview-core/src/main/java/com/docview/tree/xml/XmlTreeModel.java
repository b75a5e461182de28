package com.docview.tree.xml;

import com.docview.tree.ItemRole;
import com.docview.tree.TreeIndex;
import com.docview.tree.TreeModel;

import java.util.EnumSet;
import java.util.Set;

/**
 * Tree model over an XML document. The ROOT item is hidden; the document
 * element, together with any top-level comments, forms the top-level rows.
 */
public class XmlTreeModel extends TreeModel<XmlTreeItem> {

    private static final Set<ItemRole> ROLES = EnumSet.allOf(ItemRole.class);

    private final XmlTreeBuilder builder;

    public XmlTreeModel() {
        this(new XmlTreeBuilder());
    }

    public XmlTreeModel(XmlTreeBuilder builder) {
        this.builder = builder;
    }

    /**
     * Replaces the tree with one built from {@code xml}.
     *
     * @return {@code false} on malformed input or when the node limit is hit
     */
    public boolean loadXml(String xml) {
        return load(xml, builder::build);
    }

    public String getXmlPath(TreeIndex index) {
        return pathOf(index);
    }

    @Override
    protected Set<ItemRole> supportedRoles() {
        return ROLES;
    }

    @Override
    protected String displayKey(XmlTreeItem item) {
        return item.kind() == XmlKind.ELEMENT ? item.qualifiedName() : item.key();
    }

    @Override
    protected String namespacePrefix(XmlTreeItem item) {
        return item.namespacePrefix();
    }
}
