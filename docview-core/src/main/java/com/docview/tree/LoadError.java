package com.docview.tree;

/**
 * Why the last load failed. Line and column are 1-based, or 0 when unknown.
 */
public record LoadError(String message, int line, int column) {

    public static LoadError of(TreeLoadException e) {
        return new LoadError(e.getMessage(), e.line(), e.column());
    }
}
