package com.jsanalyzer.analyze.semantic;

import com.jsanalyzer.ast.Identifier;
import com.jsanalyzer.ast.Node;

/**
 * A declaration a reference resolves to.
 *
 * @param declaration the declaring identifier
 * @param kind how the name was declared
 * @param scope the node whose scope holds the declaration
 */
public record Binding(Identifier declaration, BindingKind kind, Node scope) {
    public String name() {
        return declaration.name();
    }
}
