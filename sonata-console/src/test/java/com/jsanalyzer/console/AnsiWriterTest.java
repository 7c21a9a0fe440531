package com.jsanalyzer.console;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class AnsiWriterTest {

    @Test
    void emptySpecOnlyResets() throws IOException {
        StringWriter out = new StringWriter();
        new AnsiWriter(out).setColor(new ColorSpec());
        assertEquals("\u001B[0m", out.toString());
    }

    @Test
    void allAttributes() throws IOException {
        StringWriter out = new StringWriter();
        ColorSpec spec = new ColorSpec().setBold(true).setDimmed(true).setItalic(true).setUnderline(true)
            .setForeground(Color.BLUE);
        new AnsiWriter(out).setColor(spec);
        assertEquals("\u001B[0m\u001B[1;2;3;4;34m", out.toString());
    }

    @Test
    void noColorWriterIgnoresStyles() throws IOException {
        StringWriter out = new StringWriter();
        NoColorWriter writer = new NoColorWriter(out);
        writer.setColor(new ColorSpec().setForeground(Color.RED));
        writer.write("plain");
        writer.reset();
        assertEquals("plain", out.toString());
        assertFalse(writer.supportsColor());
    }

    @Test
    void colorSpecEquality() {
        assertEquals(new ColorSpec().setBold(true), new ColorSpec().setBold(true));
        assertNotEquals(new ColorSpec().setBold(true), new ColorSpec().setItalic(true));
        assertTrue(new ColorSpec().isNone());
    }
}
