package com.jsanalyzer.console;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MarkupTest {

    @Test
    void elementsAccumulateOntoOneSpec() {
        MarkupNode node = new MarkupNode(EnumSet.of(MarkupElement.EMPHASIS, MarkupElement.UNDERLINE,
            MarkupElement.ERROR), "x");
        ColorSpec spec = node.colorSpec();
        assertTrue(spec.bold());
        assertTrue(spec.underline());
        assertFalse(spec.italic());
        assertEquals(Color.RED, spec.foreground());
    }

    @Test
    void semanticColors() {
        assertEquals(Color.GREEN, new MarkupNode(Set.of(MarkupElement.SUCCESS), "").colorSpec().foreground());
        assertEquals(Color.YELLOW, new MarkupNode(Set.of(MarkupElement.WARN), "").colorSpec().foreground());
        assertEquals(Color.BLUE, new MarkupNode(Set.of(MarkupElement.INFO), "").colorSpec().foreground());
        assertTrue(new MarkupNode(Set.of(MarkupElement.DIM), "").colorSpec().dimmed());
    }

    @Test
    void printsAnsiSequencesAndResets() throws IOException {
        Markup markup = Markup.builder()
            .text("Use ")
            .emphasis("**")
            .append("!", MarkupElement.EMPHASIS, MarkupElement.ERROR)
            .build();
        StringWriter out = new StringWriter();
        markup.print(new AnsiWriter(out));
        assertEquals("\u001B[0mUse \u001B[0m\u001B[1m**\u001B[0m\u001B[1;31m!\u001B[0m", out.toString());
    }

    @Test
    void plainTextDropsStyles() {
        Markup markup = Markup.builder().text("Use the '").emphasis("**").text("' operator.").build();
        assertEquals("Use the '**' operator.", markup.toPlainText());
        assertEquals("Use the '**' operator.", markup.toString());
    }

    @Test
    void contentIsFormattedLazily() {
        List<String> calls = new ArrayList<>();
        Markup markup = Markup.builder().append(Set.of(), () -> {
            calls.add("formatted");
            return "late";
        }).build();
        assertTrue(calls.isEmpty());
        assertEquals("late", markup.toPlainText());
        assertEquals(List.of("formatted"), calls);
    }

    @Test
    @DisplayName("A failing write still resets the stream and propagates the failure")
    void resetsOnWriteFailure() {
        RecordingWriter out = new RecordingWriter(1);
        Markup markup = Markup.builder().append("first", MarkupElement.ERROR).append("second", MarkupElement.WARN).build();

        IOException e = assertThrows(IOException.class, () -> markup.print(out));
        assertEquals("broken pipe", e.getMessage());
        assertEquals(List.of("color", "write:first", "color", "reset"), out.events);
    }

    @Test
    void resetFailureIsAttachedAsSuppressed() {
        RecordingWriter out = new RecordingWriter(0);
        out.failReset = true;
        Markup markup = Markup.text("x");

        IOException e = assertThrows(IOException.class, () -> markup.print(out));
        assertEquals("broken pipe", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("reset failed", e.getSuppressed()[0].getMessage());
    }

    @Test
    void failingContentSupplierStillResets() {
        RecordingWriter out = new RecordingWriter(Integer.MAX_VALUE);
        Markup markup = Markup.builder().append(Set.of(MarkupElement.INFO), () -> {
            throw new IllegalStateException("boom");
        }).build();

        assertThrows(IllegalStateException.class, () -> markup.print(out));
        assertEquals(List.of("color", "reset"), out.events);
    }

    private static final class RecordingWriter implements WriteColor {
        private final List<String> events = new ArrayList<>();
        private final int failAfterWrites;
        private boolean failReset;
        private int writes;

        RecordingWriter(int failAfterWrites) {
            this.failAfterWrites = failAfterWrites;
        }

        @Override
        public void setColor(ColorSpec spec) {
            events.add("color");
        }

        @Override
        public void reset() throws IOException {
            events.add("reset");
            if (failReset) {
                throw new IOException("reset failed");
            }
        }

        @Override
        public void write(String text) throws IOException {
            if (writes++ >= failAfterWrites) {
                throw new IOException("broken pipe");
            }
            events.add("write:" + text);
        }

        @Override
        public boolean supportsColor() {
            return true;
        }
    }
}
