package com.jsanalyzer.analyze.semantic;

import com.jsanalyzer.analyze.precedence.Precedences;
import com.jsanalyzer.ast.Expression;
import com.jsanalyzer.ast.Identifier;
import com.jsanalyzer.ast.Literal;
import com.jsanalyzer.ast.MemberExpression;
import com.jsanalyzer.ast.TemplateLiteral;

import java.util.Optional;
import java.util.Set;

/**
 * Recognizes expressions that denote a global by name.
 */
public final class GlobalIdentifiers {
    private static final Set<String> GLOBAL_OBJECTS = Set.of("globalThis", "window");

    private GlobalIdentifiers() {
    }

    /**
     * Extracts the global named by {@code expression}: a bare identifier such as {@code Math},
     * or a member of a global object such as {@code globalThis.Math} or {@code window["Math"]}.
     * For the latter the reference is the global object identifier.
     */
    public static Optional<GlobalReference> globalIdentifier(Expression expression) {
        Expression stripped = Precedences.omitParentheses(expression);
        if (stripped instanceof Identifier identifier) {
            return Optional.of(new GlobalReference(identifier, identifier.name()));
        }
        if (stripped instanceof MemberExpression member
                && Precedences.omitParentheses(member.object()) instanceof Identifier object
                && GLOBAL_OBJECTS.contains(object.name())) {
            return memberName(member).map(name -> new GlobalReference(object, name));
        }
        return Optional.empty();
    }

    /**
     * Returns the statically known name of a member access: {@code a.name}, {@code a["name"]}
     * or {@code a[`name`]}.
     */
    public static Optional<String> memberName(MemberExpression member) {
        if (!member.computed()) {
            return member.property() instanceof Identifier identifier
                ? Optional.of(identifier.name())
                : Optional.empty();
        }
        Expression key = Precedences.omitParentheses(member.property());
        if (key instanceof Literal literal && literal.value() instanceof String name) {
            return Optional.of(name);
        }
        if (key instanceof TemplateLiteral template && template.expressions().isEmpty()) {
            return Optional.ofNullable(template.quasis().get(0).value().cooked());
        }
        return Optional.empty();
    }
}
