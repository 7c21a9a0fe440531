package com.jsanalyzer.analyze.syntax;

import com.jsanalyzer.analyze.AstShapes;
import com.jsanalyzer.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxTreeTest {

    @Test
    void parentsFollowTheTree() {
        SyntaxTree tree = SyntaxTree.parse("x = f(a, b);");
        CallExpression call = (CallExpression) AstShapes.firstCall(tree, "f");
        AssignmentExpression assignment = tree.parent(call, AssignmentExpression.class).orElseThrow();
        assertSame(call, assignment.right());
        assertSame(call, tree.parent(call.arguments().get(1)).orElseThrow());
        assertTrue(tree.parent(tree.root()).isEmpty());
        assertTrue(tree.parent(call, ExpressionStatement.class).isEmpty());
    }

    @Test
    void ancestorsAreNearestFirst() {
        SyntaxTree tree = SyntaxTree.parse("function f() { return g(); }");
        Expression call = AstShapes.firstCall(tree, "g");
        List<String> types = tree.ancestors(call).map(Node::type).collect(Collectors.toList());
        assertEquals(List.of("ReturnStatement", "BlockStatement", "FunctionDeclaration", "Program"), types);
    }

    @Test
    void descendantsArePreorder() {
        SyntaxTree tree = SyntaxTree.parse("a + b;");
        List<String> types = tree.descendants().map(Node::type).collect(Collectors.toList());
        assertEquals(List.of("Program", "ExpressionStatement", "BinaryExpression", "Identifier", "Identifier"), types);
    }

    @Test
    @DisplayName("Lookups are by identity, not by structure")
    void lookupsAreByIdentity() {
        SyntaxTree tree = SyntaxTree.parse("a;");
        Identifier lookalike = new Identifier("a");
        assertFalse(tree.contains(lookalike));
        assertThrows(IllegalArgumentException.class, () -> tree.parent(lookalike));
        assertThrows(IllegalArgumentException.class, () -> tree.ancestors(lookalike));
    }

    @Test
    void sharedNodeIsRejected() {
        Identifier shared = new Identifier("a");
        Program program = new Program(List.of(
            new ExpressionStatement(new BinaryExpression("+", shared, shared))), "script");
        assertThrows(IllegalStateException.class, () -> new SyntaxTree(program));
    }

    @Test
    void textIsGenerated() {
        assertEquals("let x = (1 + 2) * 3;", SyntaxTree.parse("let x = (1+2)*3").text());
    }

    @Test
    void rangeOfNode() {
        SyntaxTree tree = SyntaxTree.parse("let x = f(y);");
        TextRange range = TextRange.of(AstShapes.firstCall(tree, "f"));
        assertEquals(new TextRange(8, 12), range);
        assertEquals(4, range.length());
        assertEquals("8..12", range.toString());
        assertTrue(new TextRange(0, 13).contains(range));
        assertFalse(range.contains(new TextRange(0, 13)));
        assertThrows(IllegalArgumentException.class, () -> new TextRange(5, 4));
    }
}
