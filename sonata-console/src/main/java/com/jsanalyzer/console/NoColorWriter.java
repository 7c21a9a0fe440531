package com.jsanalyzer.console;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes text only, discarding all style changes.
 */
public class NoColorWriter implements WriteColor {
    private final Writer out;

    public NoColorWriter(Writer out) {
        this.out = out;
    }

    @Override
    public void setColor(ColorSpec spec) {
    }

    @Override
    public void reset() throws IOException {
        out.flush();
    }

    @Override
    public void write(String text) throws IOException {
        out.write(text);
    }

    @Override
    public boolean supportsColor() {
        return false;
    }
}
