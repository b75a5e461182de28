package com.docview.tree;

/**
 * The document needs more nodes than the tree may hold.
 */
public class NodeLimitExceededException extends TreeLoadException {

    private final int limit;

    public NodeLimitExceededException(int limit, int line, int column) {
        super("Document exceeds maximum node limit of " + limit, line, column);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
