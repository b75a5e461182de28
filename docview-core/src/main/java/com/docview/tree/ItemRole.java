package com.docview.tree;

/**
 * Field selectors understood by {@link TreeModel#data(TreeIndex, ItemRole)}.
 */
public enum ItemRole {
    DISPLAY("display"),
    KEY("key"),
    VALUE("value"),
    VALUE_TYPE("valueType"),
    PATH("path"),
    CHILD_COUNT("childCount"),
    IS_EXPANDABLE("isExpandable"),
    IS_LAST_CHILD("isLastChild"),
    NAMESPACE_PREFIX("namespacePrefix");

    private final String roleName;

    ItemRole(String roleName) {
        this.roleName = roleName;
    }

    /**
     * Name under which views bind this role.
     */
    public String roleName() {
        return roleName;
    }
}
