package com.docview.cli;

/**
 * Document kinds the tool can process.
 */
public enum DocumentType {
    JSON,
    XML
}
