package com.jsanalyzer.console;

/**
 * Enumeration of all the supported markup elements.
 */
public enum MarkupElement {
    EMPHASIS,
    DIM,
    ITALIC,
    UNDERLINE,
    ERROR,
    SUCCESS,
    WARN,
    INFO;

    /**
     * Applies this element's style to the given spec in place.
     */
    void updateColor(ColorSpec color) {
        switch (this) {
            // Text styles
            case EMPHASIS -> color.setBold(true);
            case DIM -> color.setDimmed(true);
            case ITALIC -> color.setItalic(true);
            case UNDERLINE -> color.setUnderline(true);

            // Text colors
            case ERROR -> color.setForeground(Color.RED);
            case SUCCESS -> color.setForeground(Color.GREEN);
            case WARN -> color.setForeground(Color.YELLOW);
            case INFO -> color.setForeground(Color.BLUE);
        }
    }
}
