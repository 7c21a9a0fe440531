package com.jsanalyzer.console;

import java.io.IOException;

/**
 * A text sink that can switch its current style.
 */
public interface WriteColor {

    /**
     * Switches the style used for subsequent writes.
     */
    void setColor(ColorSpec spec) throws IOException;

    /**
     * Restores the default style.
     */
    void reset() throws IOException;

    void write(String text) throws IOException;

    boolean supportsColor();
}
