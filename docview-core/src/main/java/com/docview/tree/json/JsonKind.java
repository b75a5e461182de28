package com.docview.tree.json;

public enum JsonKind {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL;

    public boolean isContainer() {
        return this == OBJECT || this == ARRAY;
    }
}
