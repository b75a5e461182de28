package com.docview.tree.xml;

public enum XmlKind {
    ROOT,
    ELEMENT,
    ATTRIBUTE,
    TEXT,
    COMMENT,
    CDATA
}
