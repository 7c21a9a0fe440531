package com.jsanalyzer.ast;

/**
 * Base interface for all ESTree AST nodes.
 *
 * <p>Nodes are immutable records and hold no reference to their parent. Positions are
 * zero for nodes synthesized by a rewrite rather than produced by the parser.</p>
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    Pattern,
    TemplateElement,
    Property,
    ClassBody,
    MethodDefinition,
    VariableDeclarator {

    String type();
    int start();
    int end();
    int startLine();
    int startCol();
    int endLine();
    int endCol();

    default SourceLocation loc() {
        return new SourceLocation(
            new SourceLocation.Position(startLine(), startCol()),
            new SourceLocation.Position(endLine(), endCol())
        );
    }
}
