package com.docview.tree;

/**
 * Thrown by tree builders when input cannot be turned into a complete tree.
 * Tree models catch it and report a {@link LoadError} instead.
 */
public class TreeLoadException extends RuntimeException {

    private final int line;
    private final int column;

    public TreeLoadException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public TreeLoadException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
