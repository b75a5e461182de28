package com.docview.tree;

@FunctionalInterface
public interface LoadErrorListener {

    void loadError(String message, int line, int column);
}
