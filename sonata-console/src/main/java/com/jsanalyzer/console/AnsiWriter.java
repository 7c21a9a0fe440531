package com.jsanalyzer.console;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes styled text using ANSI SGR escape sequences.
 */
public class AnsiWriter implements WriteColor {
    static final String ESCAPE = "\u001B[";
    static final String RESET = ESCAPE + "0m";

    private final Writer out;

    public AnsiWriter(Writer out) {
        this.out = out;
    }

    @Override
    public void setColor(ColorSpec spec) throws IOException {
        // Each span starts from the default style so attributes never leak between spans
        out.write(RESET);
        if (spec.isNone()) {
            return;
        }
        StringBuilder codes = new StringBuilder();
        if (spec.bold()) {
            codes.append("1;");
        }
        if (spec.dimmed()) {
            codes.append("2;");
        }
        if (spec.italic()) {
            codes.append("3;");
        }
        if (spec.underline()) {
            codes.append("4;");
        }
        if (spec.foreground() != null) {
            codes.append(spec.foreground().foregroundCode()).append(';');
        }
        codes.setLength(codes.length() - 1);
        out.write(ESCAPE + codes + "m");
    }

    @Override
    public void reset() throws IOException {
        out.write(RESET);
        out.flush();
    }

    @Override
    public void write(String text) throws IOException {
        out.write(text);
    }

    @Override
    public boolean supportsColor() {
        return true;
    }
}
