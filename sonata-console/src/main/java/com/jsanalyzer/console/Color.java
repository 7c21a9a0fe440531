package com.jsanalyzer.console;

/**
 * The eight basic terminal colors.
 */
public enum Color {
    BLACK(30),
    RED(31),
    GREEN(32),
    YELLOW(33),
    BLUE(34),
    MAGENTA(35),
    CYAN(36),
    WHITE(37);

    private final int foregroundCode;

    Color(int foregroundCode) {
        this.foregroundCode = foregroundCode;
    }

    public int foregroundCode() {
        return foregroundCode;
    }
}
