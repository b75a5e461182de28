package com.docview.bridge;

import com.docview.format.FormatResult;
import com.docview.format.ValidationResult;

/**
 * Receives the results of bridge requests. Callbacks run on the gate thread, before the
 * request's future completes.
 */
public interface BridgeListener {

    default void formatCompleted(FormatResult result) {
    }

    default void minifyCompleted(FormatResult result) {
    }

    default void validateCompleted(ValidationResult result) {
    }

    default void xmlFormatCompleted(FormatResult result) {
    }

    default void xmlMinifyCompleted(FormatResult result) {
    }

    /**
     * @param nodeCount items in the new tree, the hidden root included; 0 on failure
     */
    default void jsonTreeLoaded(boolean success, int nodeCount) {
    }

    default void xmlTreeLoaded(boolean success, int nodeCount) {
    }

    /**
     * A tree load failed; the position is 1-based, or 0 when unknown.
     */
    default void loadError(String message, int line, int column) {
    }

    /**
     * The bridge went from idle to busy or back.
     */
    default void busyChanged(boolean busy) {
    }
}
