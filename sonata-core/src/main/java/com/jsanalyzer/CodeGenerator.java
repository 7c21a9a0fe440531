package com.jsanalyzer;

import com.jsanalyzer.ast.*;

import java.util.List;

/**
 * Prints an AST back to JavaScript source.
 *
 * <p>Grouping parentheses are emitted only where the tree holds a {@link ParenthesizedExpression},
 * so the printed text is faithful to the tree's shape and never adds grouping of its own. Blocks
 * are printed one statement per line with two-space indentation.</p>
 */
public class CodeGenerator {
    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    public static String generate(Node node) {
        CodeGenerator generator = new CodeGenerator();
        generator.emit(node);
        return generator.out.toString();
    }

    private void emit(Node node) {
        if (node instanceof Program program) {
            emitStatements(program.body(), false);
        } else if (node instanceof Statement statement) {
            emitStatement(statement);
        } else if (node instanceof Expression expression) {
            emitExpression(expression);
        } else if (node instanceof VariableDeclarator declarator) {
            emitDeclarator(declarator);
        } else if (node instanceof Property property) {
            emitProperty(property);
        } else if (node instanceof MethodDefinition method) {
            emitMethod(method);
        } else if (node instanceof ClassBody body) {
            emitClassBody(body);
        } else if (node instanceof TemplateElement element) {
            out.append(element.value().raw());
        } else {
            throw new IllegalArgumentException("Cannot print node of type " + node.type());
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private void emitStatements(List<Statement> statements, boolean indented) {
        for (int i = 0; i < statements.size(); i++) {
            if (i > 0 || indented) {
                newline();
            }
            emitStatement(statements.get(i));
        }
    }

    private void emitStatement(Statement statement) {
        if (statement instanceof ExpressionStatement s) {
            emitExpression(s.expression());
            out.append(';');
        } else if (statement instanceof VariableDeclaration s) {
            emitVariableDeclaration(s);
            out.append(';');
        } else if (statement instanceof FunctionDeclaration s) {
            emitFunction(s.async(), s.generator(), s.id(), s.params(), s.body());
        } else if (statement instanceof ClassDeclaration s) {
            emitClass(s.id(), s.superClass(), s.body());
        } else if (statement instanceof ReturnStatement s) {
            out.append("return");
            if (s.argument() != null) {
                out.append(' ');
                emitExpression(s.argument());
            }
            out.append(';');
        } else if (statement instanceof IfStatement s) {
            out.append("if (");
            emitExpression(s.test());
            out.append(") ");
            emitStatement(s.consequent());
            if (s.alternate() != null) {
                out.append(" else ");
                emitStatement(s.alternate());
            }
        } else if (statement instanceof BlockStatement s) {
            emitBlock(s);
        } else if (statement instanceof EmptyStatement) {
            out.append(';');
        }
    }

    private void emitVariableDeclaration(VariableDeclaration declaration) {
        out.append(declaration.kind()).append(' ');
        List<VariableDeclarator> declarators = declaration.declarations();
        for (int i = 0; i < declarators.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            emitDeclarator(declarators.get(i));
        }
    }

    private void emitDeclarator(VariableDeclarator declarator) {
        emitPattern(declarator.id());
        if (declarator.init() != null) {
            out.append(" = ");
            emitExpression(declarator.init());
        }
    }

    private void emitBlock(BlockStatement block) {
        if (block.body().isEmpty()) {
            out.append("{}");
            return;
        }
        out.append('{');
        depth++;
        emitStatements(block.body(), true);
        depth--;
        newline();
        out.append('}');
    }

    private void emitFunction(boolean async, boolean generator, Identifier id, List<Pattern> params,
                              BlockStatement body) {
        if (async) {
            out.append("async ");
        }
        out.append("function");
        if (generator) {
            out.append('*');
        }
        if (id != null) {
            out.append(' ').append(id.name());
        }
        emitParams(params);
        out.append(' ');
        emitBlock(body);
    }

    private void emitParams(List<Pattern> params) {
        out.append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            emitPattern(params.get(i));
        }
        out.append(')');
    }

    private void emitPattern(Pattern pattern) {
        if (pattern instanceof Identifier id) {
            out.append(id.name());
        } else if (pattern instanceof MemberExpression member) {
            emitExpression(member);
        }
    }

    private void emitClass(Identifier id, Expression superClass, ClassBody body) {
        out.append("class");
        if (id != null) {
            out.append(' ').append(id.name());
        }
        if (superClass != null) {
            out.append(" extends ");
            emitExpression(superClass);
        }
        out.append(' ');
        emitClassBody(body);
    }

    private void emitClassBody(ClassBody body) {
        if (body.body().isEmpty()) {
            out.append("{}");
            return;
        }
        out.append('{');
        depth++;
        for (MethodDefinition method : body.body()) {
            newline();
            emitMethod(method);
        }
        depth--;
        newline();
        out.append('}');
    }

    private void emitMethod(MethodDefinition method) {
        if (method.isStatic()) {
            out.append("static ");
        }
        FunctionExpression value = method.value();
        if (value.async()) {
            out.append("async ");
        }
        if (value.generator()) {
            out.append('*');
        }
        emitPropertyKey(method.key(), method.computed());
        emitParams(value.params());
        out.append(' ');
        emitBlock(value.body());
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private void emitExpression(Expression expression) {
        if (expression instanceof Identifier e) {
            out.append(e.name());
        } else if (expression instanceof Literal e) {
            out.append(e.raw() != null ? e.raw() : literalText(e.value()));
        } else if (expression instanceof ThisExpression) {
            out.append("this");
        } else if (expression instanceof Super) {
            out.append("super");
        } else if (expression instanceof ParenthesizedExpression e) {
            out.append('(');
            emitExpression(e.expression());
            out.append(')');
        } else if (expression instanceof BinaryExpression e) {
            emitInfix(e.left(), e.operator(), e.right());
        } else if (expression instanceof LogicalExpression e) {
            emitInfix(e.left(), e.operator(), e.right());
        } else if (expression instanceof AssignmentExpression e) {
            emitInfix(e.left(), e.operator(), e.right());
        } else if (expression instanceof ConditionalExpression e) {
            emitExpression(e.test());
            out.append(" ? ");
            emitExpression(e.consequent());
            out.append(" : ");
            emitExpression(e.alternate());
        } else if (expression instanceof SequenceExpression e) {
            emitList(e.expressions());
        } else if (expression instanceof UnaryExpression e) {
            emitUnary(e);
        } else if (expression instanceof UpdateExpression e) {
            if (e.prefix()) {
                out.append(e.operator());
                emitExpression(e.argument());
            } else {
                emitExpression(e.argument());
                out.append(e.operator());
            }
        } else if (expression instanceof AwaitExpression e) {
            out.append("await ");
            emitExpression(e.argument());
        } else if (expression instanceof YieldExpression e) {
            out.append(e.delegate() ? "yield*" : "yield");
            if (e.argument() != null) {
                out.append(' ');
                emitExpression(e.argument());
            }
        } else if (expression instanceof MemberExpression e) {
            emitExpression(e.object());
            if (e.computed()) {
                out.append(e.optional() ? "?.[" : "[");
                emitExpression(e.property());
                out.append(']');
            } else {
                out.append(e.optional() ? "?." : ".");
                emitExpression(e.property());
            }
        } else if (expression instanceof CallExpression e) {
            emitExpression(e.callee());
            out.append(e.optional() ? "?.(" : "(");
            emitList(e.arguments());
            out.append(')');
        } else if (expression instanceof NewExpression e) {
            out.append("new ");
            emitExpression(e.callee());
            out.append('(');
            emitList(e.arguments());
            out.append(')');
        } else if (expression instanceof MetaProperty e) {
            out.append(e.meta().name()).append('.').append(e.property().name());
        } else if (expression instanceof SpreadElement e) {
            out.append("...");
            emitExpression(e.argument());
        } else if (expression instanceof ArrayExpression e) {
            out.append('[');
            emitList(e.elements());
            out.append(']');
        } else if (expression instanceof ObjectExpression e) {
            emitObject(e);
        } else if (expression instanceof FunctionExpression e) {
            emitFunction(e.async(), e.generator(), e.id(), e.params(), e.body());
        } else if (expression instanceof ArrowFunctionExpression e) {
            emitArrow(e);
        } else if (expression instanceof ClassExpression e) {
            emitClass(e.id(), e.superClass(), e.body());
        } else if (expression instanceof TemplateLiteral e) {
            emitTemplate(e);
        } else if (expression instanceof TaggedTemplateExpression e) {
            emitExpression(e.tag());
            emitTemplate(e.quasi());
        }
    }

    private void emitInfix(Expression left, String operator, Expression right) {
        emitExpression(left);
        out.append(' ').append(operator).append(' ');
        emitExpression(right);
    }

    private void emitUnary(UnaryExpression unary) {
        String operator = unary.operator();
        out.append(operator);
        if (Character.isLetter(operator.charAt(0))) {
            out.append(' ');
        } else if (startsWithSign(unary.argument(), operator.charAt(0))) {
            // Keep "- -x" and "+ ++x" from fusing into a different token
            out.append(' ');
        }
        emitExpression(unary.argument());
    }

    private static boolean startsWithSign(Expression argument, char sign) {
        if (sign != '-' && sign != '+') {
            return false;
        }
        if (argument instanceof UnaryExpression nested) {
            return nested.operator().charAt(0) == sign;
        }
        if (argument instanceof UpdateExpression nested) {
            return nested.prefix() && nested.operator().charAt(0) == sign;
        }
        if (argument instanceof Literal literal && literal.raw() == null && literal.value() instanceof Double d) {
            return d < 0 && sign == '-';
        }
        return false;
    }

    private void emitArrow(ArrowFunctionExpression arrow) {
        if (arrow.async()) {
            out.append("async ");
        }
        if (arrow.params().size() == 1 && arrow.params().get(0) instanceof Identifier id) {
            out.append(id.name());
        } else {
            emitParams(arrow.params());
        }
        out.append(" => ");
        if (arrow.body() instanceof BlockStatement block) {
            emitBlock(block);
        } else {
            emitExpression((Expression) arrow.body());
        }
    }

    private void emitObject(ObjectExpression object) {
        if (object.properties().isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{ ");
        for (int i = 0; i < object.properties().size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            emitProperty(object.properties().get(i));
        }
        out.append(" }");
    }

    private void emitProperty(Property property) {
        emitPropertyKey(property.key(), property.computed());
        if (!property.shorthand()) {
            out.append(": ");
            emitExpression(property.value());
        }
    }

    private void emitPropertyKey(Expression key, boolean computed) {
        if (computed) {
            out.append('[');
            emitExpression(key);
            out.append(']');
        } else {
            emitExpression(key);
        }
    }

    private void emitTemplate(TemplateLiteral template) {
        out.append('`');
        List<TemplateElement> quasis = template.quasis();
        for (int i = 0; i < quasis.size(); i++) {
            out.append(quasis.get(i).value().raw());
            if (i < template.expressions().size()) {
                out.append("${");
                emitExpression(template.expressions().get(i));
                out.append('}');
            }
        }
        out.append('`');
    }

    private void emitList(List<Expression> expressions) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            emitExpression(expressions.get(i));
        }
    }

    private void newline() {
        out.append('\n');
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
    }

    /**
     * Formats a literal value that has no source text, as for nodes built by a rewrite.
     * Integral numbers in the safe integer range print without a fraction.
     */
    static String literalText(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double d) {
            if (d.isNaN()) {
                return "NaN";
            }
            if (d.isInfinite()) {
                return d > 0 ? "Infinity" : "-Infinity";
            }
            if (d == Math.floor(d) && Math.abs(d) <= 9007199254740992.0) {
                return Long.toString(d.longValue());
            }
            return d.toString();
        }
        if (value instanceof String s) {
            return quote(s);
        }
        return value.toString();
    }

    private static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\u2028' -> sb.append("\\u2028");
                case '\u2029' -> sb.append("\\u2029");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
