package com.jsanalyzer.console;

import java.util.Objects;

/**
 * A mutable style record: an optional foreground color plus text attributes.
 * Markup elements are applied to one spec in turn, so their effects accumulate.
 */
public final class ColorSpec {
    private Color foreground;
    private boolean bold;
    private boolean dimmed;
    private boolean italic;
    private boolean underline;

    public Color foreground() {
        return foreground;
    }

    public ColorSpec setForeground(Color foreground) {
        this.foreground = foreground;
        return this;
    }

    public boolean bold() {
        return bold;
    }

    public ColorSpec setBold(boolean bold) {
        this.bold = bold;
        return this;
    }

    public boolean dimmed() {
        return dimmed;
    }

    public ColorSpec setDimmed(boolean dimmed) {
        this.dimmed = dimmed;
        return this;
    }

    public boolean italic() {
        return italic;
    }

    public ColorSpec setItalic(boolean italic) {
        this.italic = italic;
        return this;
    }

    public boolean underline() {
        return underline;
    }

    public ColorSpec setUnderline(boolean underline) {
        this.underline = underline;
        return this;
    }

    /**
     * @return true if this spec applies no style at all
     */
    public boolean isNone() {
        return foreground == null && !bold && !dimmed && !italic && !underline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColorSpec other)) return false;
        return bold == other.bold && dimmed == other.dimmed && italic == other.italic
            && underline == other.underline && foreground == other.foreground;
    }

    @Override
    public int hashCode() {
        return Objects.hash(foreground, bold, dimmed, italic, underline);
    }

    @Override
    public String toString() {
        return "ColorSpec[foreground=" + foreground + ", bold=" + bold + ", dimmed=" + dimmed
            + ", italic=" + italic + ", underline=" + underline + "]";
    }
}
