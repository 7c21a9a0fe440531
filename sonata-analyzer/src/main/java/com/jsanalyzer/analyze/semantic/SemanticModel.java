package com.jsanalyzer.analyze.semantic;

import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.ast.*;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves identifier references to their declarations for one {@link SyntaxTree} snapshot.
 *
 * <p>Scopes are the program, functions, arrow functions, blocks and class expressions.
 * {@code var} and function declarations belong to the nearest function scope, while
 * {@code let}, {@code const} and class declarations belong to the nearest block. Declarations
 * are hoisted: a name is bound throughout its scope. A reference that resolves to nothing is
 * a global.</p>
 */
public final class SemanticModel {
    private final SyntaxTree tree;
    private final Map<Node, Map<String, Binding>> scopes = new IdentityHashMap<>();

    private SemanticModel(SyntaxTree tree) {
        this.tree = tree;
    }

    public static SemanticModel build(SyntaxTree tree) {
        SemanticModel model = new SemanticModel(tree);
        tree.descendants().forEach(model::collect);
        return model;
    }

    public SyntaxTree tree() {
        return tree;
    }

    /**
     * @return the declaration {@code reference} resolves to, or empty for an unresolved global
     * @throws IllegalArgumentException if {@code reference} is not part of this model's tree
     */
    public Optional<Binding> binding(Identifier reference) {
        String name = reference.name();
        return tree.ancestors(reference)
            .map(scope -> lookup(scope, name))
            .flatMap(Optional::stream)
            .findFirst();
    }

    public boolean isGlobal(Identifier reference) {
        return binding(reference).isEmpty();
    }

    private Optional<Binding> lookup(Node scope, String name) {
        Map<String, Binding> bindings = scopes.get(scope);
        return bindings == null ? Optional.empty() : Optional.ofNullable(bindings.get(name));
    }

    private void collect(Node node) {
        if (node instanceof VariableDeclaration declaration) {
            BindingKind kind = BindingKind.ofDeclarationKind(declaration.kind());
            Node scope = kind.isBlockScoped() ? blockScope(declaration) : functionScope(declaration);
            for (VariableDeclarator declarator : declaration.declarations()) {
                if (declarator.id() instanceof Identifier id) {
                    declare(scope, id, kind);
                }
            }
        } else if (node instanceof FunctionDeclaration function) {
            declare(functionScope(function), function.id(), BindingKind.FUNCTION);
            declareParameters(function, function.params());
        } else if (node instanceof FunctionExpression function) {
            if (function.id() != null) {
                declare(function, function.id(), BindingKind.FUNCTION);
            }
            declareParameters(function, function.params());
        } else if (node instanceof ArrowFunctionExpression arrow) {
            declareParameters(arrow, arrow.params());
        } else if (node instanceof ClassDeclaration declaration) {
            declare(blockScope(declaration), declaration.id(), BindingKind.CLASS);
        } else if (node instanceof ClassExpression expression && expression.id() != null) {
            declare(expression, expression.id(), BindingKind.CLASS);
        }
    }

    private void declareParameters(Node function, List<Pattern> params) {
        for (Pattern param : params) {
            if (param instanceof Identifier id) {
                declare(function, id, BindingKind.PARAMETER);
            }
        }
    }

    private void declare(Node scope, Identifier id, BindingKind kind) {
        // The first declaration of a name in a scope wins, as with repeated 'var'
        scopes.computeIfAbsent(scope, s -> new HashMap<>())
            .putIfAbsent(id.name(), new Binding(id, kind, scope));
    }

    private Node functionScope(Node node) {
        return tree.ancestors(node)
            .filter(SemanticModel::isFunctionScope)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(node.type() + " has no enclosing program"));
    }

    private Node blockScope(Node node) {
        return tree.ancestors(node)
            .filter(ancestor -> ancestor instanceof BlockStatement || isFunctionScope(ancestor))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(node.type() + " has no enclosing program"));
    }

    private static boolean isFunctionScope(Node node) {
        return node instanceof Program
            || node instanceof FunctionDeclaration
            || node instanceof FunctionExpression
            || node instanceof ArrowFunctionExpression;
    }
}
