package com.docview.tree;

/**
 * Row/column address of an item handed out by a {@link TreeModel}.
 *
 * <p>An index is only meaningful for the model generation that created it; after a
 * reload or clear the model treats older indexes as invalid.</p>
 */
public record TreeIndex(int row, int column, int itemId, long generation) {

    public static final TreeIndex INVALID = new TreeIndex(-1, -1, -1, -1L);

    public boolean isValid() {
        return row >= 0 && column >= 0 && itemId >= 0;
    }
}
