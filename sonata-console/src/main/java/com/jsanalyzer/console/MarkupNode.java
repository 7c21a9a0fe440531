package com.jsanalyzer.console;

import java.util.Set;
import java.util.function.Supplier;

/**
 * A piece of text with a set of styles applied to it.
 *
 * <p>The content is formatted lazily, when the markup is printed. A supplier may capture
 * data that is only valid during the call that produced the markup, so a node must not be
 * printed after that call has returned.</p>
 */
public record MarkupNode(Set<MarkupElement> elements, Supplier<String> content) {
    public MarkupNode {
        elements = Set.copyOf(elements);
    }

    public MarkupNode(Set<MarkupElement> elements, String text) {
        this(elements, () -> text);
    }

    ColorSpec colorSpec() {
        ColorSpec spec = new ColorSpec();
        for (MarkupElement element : elements) {
            element.updateColor(spec);
        }
        return spec;
    }
}
