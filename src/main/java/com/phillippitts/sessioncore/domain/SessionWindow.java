package com.phillippitts.sessioncore.domain;

/**
 * Opaque handle to a window owned by the presentation layer.
 *
 * <p>The window registry only holds references to these handles and compares them by identity;
 * it never creates or closes windows.
 */
public interface SessionWindow {

    /**
     * Human-readable title, used only for logging.
     */
    String title();

    /**
     * Brings this window to the front and gives it focus.
     */
    void bringToFront();
}
