package com.docview.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a parsed document tree.
 *
 * <p>Children are owned through the shared {@link ItemArena}; the parent link is a
 * plain id used for navigation only. Items are built once by a tree builder and
 * are not modified afterwards.</p>
 *
 * @param <I> the concrete item type
 */
public abstract class TreeItem<I extends TreeItem<I>> {

    public static final int NO_PARENT = -1;

    private final ItemArena<I> arena;
    private final int id;
    private final int parentId;
    private final List<Integer> childIds = new ArrayList<>();
    private int row;

    protected TreeItem(ItemArena<I> arena, int id, int parentId) {
        this.arena = arena;
        this.id = id;
        this.parentId = parentId;
    }

    /**
     * Appends {@code child} as the last child of this item. Only builders call this.
     */
    protected void appendChild(I child) {
        if (child.parentId() != id) {
            throw new IllegalArgumentException("Item " + child.id() + " is not a child of " + id);
        }
        TreeItem<I> node = child;
        node.row = childIds.size();
        childIds.add(child.id());
    }

    public final int id() {
        return id;
    }

    public final int parentId() {
        return parentId;
    }

    public final ItemArena<I> arena() {
        return arena;
    }

    public final I parent() {
        return parentId == NO_PARENT ? null : arena.get(parentId);
    }

    public final I child(int row) {
        if (row < 0 || row >= childIds.size()) {
            return null;
        }
        return arena.get(childIds.get(row));
    }

    public final int childCount() {
        return childIds.size();
    }

    public final List<I> children() {
        if (childIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<I> result = new ArrayList<>(childIds.size());
        for (int childId : childIds) {
            result.add(arena.get(childId));
        }
        return result;
    }

    /**
     * Position among the parent's children; {@code 0} for the root.
     */
    public final int row() {
        return row;
    }

    public boolean isLastChild() {
        I parent = parent();
        if (parent == null) {
            return true;
        }
        return parent.childCount() > 0 && row == parent.childCount() - 1;
    }

    public boolean isExpandable() {
        return !childIds.isEmpty();
    }

    public abstract String key();

    public abstract Object value();

    /**
     * Lower-case kind name shown to views, e.g. {@code "object"} or {@code "element"}.
     */
    public abstract String typeName();

    /**
     * Address of this item from the document root.
     */
    public abstract String path();

    /**
     * Serializes this item and its descendants back to document text.
     */
    public abstract String serialize();
}
