package com.jsanalyzer.analyze.rewrite;

import com.jsanalyzer.analyze.precedence.ExpressionKind;
import com.jsanalyzer.analyze.precedence.OperatorPrecedence;
import com.jsanalyzer.analyze.precedence.Precedences;
import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.ast.*;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a new operator expression, substituted for an existing node, still forms
 * one unit in its parent.
 */
public final class SubstitutionSiteAnalyzer {

    /**
     * @param node the node being replaced
     * @param operator the operator of the replacement expression
     * @return the decision, or empty when {@code node} cannot be located in {@code tree}
     */
    public Optional<SubstitutionDecision> analyze(SyntaxTree tree, Expression node, String operator) {
        if (!tree.contains(node)) {
            return Optional.empty();
        }
        OperatorPrecedence level = OperatorPrecedence.ofBinaryOperator(operator);
        Optional<Node> maybeParent = tree.parent(node);
        if (maybeParent.isEmpty()) {
            return Optional.empty();
        }
        Node parent = maybeParent.get();

        if (parent instanceof Expression expression) {
            return Optional.of(needsParentheses(tree, node, expression, operator, level)
                ? SubstitutionDecision.wrap()
                : SubstitutionDecision.none());
        }

        // A class heritage accepts only left-hand-side expressions
        if (parent instanceof ClassDeclaration declaration && declaration.superClass() == node) {
            return Optional.of(SubstitutionDecision.wrap());
        }
        if (parent instanceof ClassExpression classExpression && classExpression.superClass() == node) {
            boolean ownerNeedsWrap = needsParentheses(tree, node, classExpression, operator, level)
                && tree.parent(classExpression, ParenthesizedExpression.class).isEmpty();
            return Optional.of(ownerNeedsWrap
                ? SubstitutionDecision.wrapWithParent(classExpression)
                : SubstitutionDecision.wrap());
        }

        return Optional.of(SubstitutionDecision.none());
    }

    private boolean needsParentheses(SyntaxTree tree, Expression node, Expression parent, String operator,
                                     OperatorPrecedence level) {
        boolean needed = switch (ExpressionKind.of(parent)) {
            case PARENTHESIZED -> false;
            case IN -> true;
            case BINARY -> {
                if (isOperandOfIn(tree, parent)) {
                    yield true;
                }
                BinaryExpression binary = (BinaryExpression) parent;
                Expression associativeOperand = level.isRightAssociative() ? binary.right() : binary.left();
                yield !(binary.operator().equals(operator) && associativeOperand == node);
            }
            case LOGICAL -> {
                LogicalExpression logical = (LogicalExpression) parent;
                if (OperandParenthesizer.mixesCoalescing(logical.operator(), operator)) {
                    yield true;
                }
                Expression associativeOperand = level.isRightAssociative() ? logical.right() : logical.left();
                yield !(logical.operator().equals(operator) && associativeOperand == node);
            }
            case CALL -> !containsIdentity(((CallExpression) parent).arguments(), node);
            case NEW -> !containsIdentity(((NewExpression) parent).arguments(), node);
            case COMPUTED_MEMBER -> ((MemberExpression) parent).property() != node;
            case CLASS, STATIC_MEMBER, UNARY, AWAIT, TEMPLATE, TAGGED_TEMPLATE -> true;
            case IDENTIFIER, LITERAL, THIS, SUPER, ARRAY, OBJECT, FUNCTION, ARROW_FUNCTION, META_PROPERTY,
                 PRE_UPDATE, POST_UPDATE, CONDITIONAL, ASSIGNMENT, SEQUENCE, YIELD, SPREAD -> false;
        };
        if (!needed) {
            return false;
        }
        // Ambiguity with the 'in' keyword needs parentheses at any precedence
        if (ExpressionKind.of(parent) == ExpressionKind.IN || isOperandOfIn(tree, parent)) {
            return true;
        }
        // '??' cannot be mixed with '&&' or '||' without parentheses
        if (parent instanceof LogicalExpression logical
                && OperandParenthesizer.mixesCoalescing(logical.operator(), operator)) {
            return true;
        }
        return Precedences.of(parent).isAtLeast(level);
    }

    /**
     * Checks whether {@code replacement}, put in place of {@code node}, would begin an expression
     * statement or a concise arrow body with a token that is read as something else there: an
     * opening brace, {@code function} or {@code class} at the start of a statement, or an opening
     * brace after {@code =>}.
     */
    public boolean needsLeadingParentheses(SyntaxTree tree, Expression node, Expression replacement) {
        ExpressionKind first = ExpressionKind.of(leftmostOperand(replacement));
        if (first != ExpressionKind.OBJECT && first != ExpressionKind.FUNCTION && first != ExpressionKind.CLASS) {
            return false;
        }
        Optional<Node> owner = leadingPositionOwner(tree, node);
        if (owner.isEmpty()) {
            return false;
        }
        if (owner.get() instanceof ExpressionStatement) {
            return true;
        }
        return first == ExpressionKind.OBJECT;
    }

    /**
     * Walks up while {@code node} is the first operand of its parent and returns the statement
     * or concise arrow whose text starts with it.
     */
    private static Optional<Node> leadingPositionOwner(SyntaxTree tree, Expression node) {
        Expression current = node;
        while (true) {
            Optional<Node> parent = tree.parent(current);
            if (parent.isEmpty()) {
                return Optional.empty();
            }
            Node owner = parent.get();
            if (owner instanceof ExpressionStatement) {
                return parent;
            }
            if (owner instanceof ArrowFunctionExpression arrow && arrow.expression() && arrow.body() == current) {
                return parent;
            }
            if (!(owner instanceof Expression expression)) {
                return Optional.empty();
            }
            Optional<Expression> first = leftOperand(expression);
            if (first.isEmpty() || first.get() != current) {
                return Optional.empty();
            }
            current = expression;
        }
    }

    private static Expression leftmostOperand(Expression expression) {
        Expression current = expression;
        Optional<Expression> next = leftOperand(current);
        while (next.isPresent()) {
            current = next.get();
            next = leftOperand(current);
        }
        return current;
    }

    /**
     * @return the operand written first in {@code expression}'s text, if the expression does not
     * start with a token of its own
     */
    private static Optional<Expression> leftOperand(Expression expression) {
        return switch (ExpressionKind.of(expression)) {
            case BINARY, IN -> Optional.of(((BinaryExpression) expression).left());
            case LOGICAL -> Optional.of(((LogicalExpression) expression).left());
            case STATIC_MEMBER, COMPUTED_MEMBER -> Optional.of(((MemberExpression) expression).object());
            case CALL -> Optional.of(((CallExpression) expression).callee());
            case TAGGED_TEMPLATE -> Optional.of(((TaggedTemplateExpression) expression).tag());
            case POST_UPDATE -> Optional.of(((UpdateExpression) expression).argument());
            case CONDITIONAL -> Optional.of(((ConditionalExpression) expression).test());
            case ASSIGNMENT -> Optional.of(((AssignmentExpression) expression).left());
            case SEQUENCE -> Optional.of(((SequenceExpression) expression).expressions().get(0));
            case IDENTIFIER, LITERAL, THIS, SUPER, ARRAY, OBJECT, FUNCTION, ARROW_FUNCTION, CLASS, TEMPLATE,
                 META_PROPERTY, NEW, PRE_UPDATE, UNARY, AWAIT, YIELD, SPREAD, PARENTHESIZED -> Optional.empty();
        };
    }

    private static boolean isOperandOfIn(SyntaxTree tree, Expression expression) {
        return ExpressionKind.of(expression) == ExpressionKind.BINARY
            && tree.parent(expression, BinaryExpression.class)
                .map(grandparent -> ExpressionKind.of(grandparent) == ExpressionKind.IN)
                .orElse(false);
    }

    private static boolean containsIdentity(List<Expression> expressions, Expression node) {
        for (Expression expression : expressions) {
            if (expression == node) {
                return true;
            }
        }
        return false;
    }
}
