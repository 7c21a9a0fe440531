package com.jsanalyzer.console;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * An ordered list of {@link MarkupNode}s making up one styled message.
 */
public final class Markup {
    private final List<MarkupNode> nodes;

    private Markup(List<MarkupNode> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public static Markup of(MarkupNode... nodes) {
        return new Markup(List.of(nodes));
    }

    public static Markup text(String text) {
        return builder().text(text).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<MarkupNode> nodes() {
        return nodes;
    }

    /**
     * Prints every node with its accumulated style, then resets the writer.
     *
     * <p>The writer is reset even when a write fails; the failure is rethrown afterwards
     * and a failure of the reset itself is attached to it as suppressed.</p>
     */
    public void print(WriteColor out) throws IOException {
        try {
            for (MarkupNode node : nodes) {
                out.setColor(node.colorSpec());
                out.write(node.content().get());
            }
        } catch (IOException | RuntimeException e) {
            try {
                out.reset();
            } catch (IOException resetFailure) {
                e.addSuppressed(resetFailure);
            }
            throw e;
        }
        out.reset();
    }

    /**
     * @return the message text with all styling dropped
     */
    public String toPlainText() {
        StringWriter buffer = new StringWriter();
        try {
            print(new NoColorWriter(buffer));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toString();
    }

    @Override
    public String toString() {
        return toPlainText();
    }

    public static final class Builder {
        private final List<MarkupNode> nodes = new ArrayList<>();

        private Builder() {
        }

        public Builder text(String text) {
            return append(Set.of(), () -> text);
        }

        public Builder emphasis(String text) {
            return append(EnumSet.of(MarkupElement.EMPHASIS), () -> text);
        }

        public Builder append(String text, MarkupElement first, MarkupElement... rest) {
            return append(EnumSet.of(first, rest), () -> text);
        }

        public Builder append(Set<MarkupElement> elements, Supplier<String> content) {
            nodes.add(new MarkupNode(elements, content));
            return this;
        }

        public Markup build() {
            return new Markup(nodes);
        }
    }
}
