package com.jsanalyzer.analyze;

import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.ast.*;

import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Test helper that renders the grouping structure of a tree as an S-expression, with all
 * parentheses stripped, so two trees can be compared by structure alone.
 */
public final class AstShapes {
    private static final Set<String> IGNORED = Set.of("start", "end", "startLine", "startCol", "endLine", "endCol", "raw");

    private AstShapes() {
    }

    public static String shape(SyntaxTree tree) {
        return shape(tree.root(), false);
    }

    /**
     * Renders {@code Math.pow(x, y)} as if it were written {@code x ** y}.
     */
    public static String shapeWithPowAsOperator(SyntaxTree tree) {
        return shape(tree.root(), true);
    }

    public static Expression firstCall(SyntaxTree tree, String calleeName) {
        return tree.descendants()
            .filter(node -> node instanceof CallExpression call
                && call.callee() instanceof Identifier id && id.name().equals(calleeName))
            .map(Expression.class::cast)
            .findFirst()
            .orElseThrow(() -> new AssertionError("No call to " + calleeName));
    }

    public static Expression expression(SyntaxTree tree) {
        ExpressionStatement statement = (ExpressionStatement) tree.root().body().get(0);
        return statement.expression();
    }

    private static String shape(Object value, boolean powAsOperator) {
        if (value instanceof ParenthesizedExpression parenthesized) {
            return shape(parenthesized.expression(), powAsOperator);
        }
        if (powAsOperator && value instanceof CallExpression call && isMathPow(call)) {
            return "(BinaryExpression ** " + shape(call.arguments().get(0), true) + " "
                + shape(call.arguments().get(1), true) + ")";
        }
        if (value instanceof List<?> list) {
            return list.stream().map(element -> shape(element, powAsOperator))
                .collect(Collectors.joining(" ", "[", "]"));
        }
        if (!(value instanceof Node node)) {
            return String.valueOf(value);
        }
        StringBuilder sb = new StringBuilder("(").append(node.type());
        for (RecordComponent component : node.getClass().getRecordComponents()) {
            if (IGNORED.contains(component.getName())) {
                continue;
            }
            try {
                sb.append(' ').append(shape(component.getAccessor().invoke(node), powAsOperator));
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException(e);
            }
        }
        return sb.append(')').toString();
    }

    private static boolean isMathPow(CallExpression call) {
        return call.arguments().size() == 2
            && call.callee() instanceof MemberExpression member
            && member.object() instanceof Identifier object && object.name().equals("Math")
            && member.property() instanceof Identifier property && property.name().equals("pow");
    }
}
