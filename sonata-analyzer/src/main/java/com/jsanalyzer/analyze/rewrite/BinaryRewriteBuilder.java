package com.jsanalyzer.analyze.rewrite;

import com.jsanalyzer.analyze.syntax.BatchMutation;
import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.ast.CallExpression;
import com.jsanalyzer.ast.Expression;
import com.jsanalyzer.ast.SpreadElement;

import java.util.List;
import java.util.Optional;

/**
 * Builds the mutation that replaces a node with a binary operator expression, adding the
 * parentheses needed for the result to parse back with the intended grouping.
 */
public final class BinaryRewriteBuilder {
    private final OperandParenthesizer operands;
    private final SubstitutionSiteAnalyzer sites;

    public BinaryRewriteBuilder() {
        this(new OperandParenthesizer(), new SubstitutionSiteAnalyzer());
    }

    public BinaryRewriteBuilder(OperandParenthesizer operands, SubstitutionSiteAnalyzer sites) {
        this.operands = operands;
        this.sites = sites;
    }

    /**
     * Replaces a two-argument call such as {@code f(a, b)} with {@code a <operator> b}.
     *
     * @return the mutation, or empty if the call does not have exactly two plain arguments
     */
    public Optional<BatchMutation> replaceCall(SyntaxTree tree, CallExpression call, String operator) {
        List<Expression> arguments = call.arguments();
        if (arguments.size() != 2) {
            return Optional.empty();
        }
        Expression left = arguments.get(0);
        Expression right = arguments.get(1);
        if (left instanceof SpreadElement || right instanceof SpreadElement) {
            return Optional.empty();
        }
        return replace(tree, call, left, operator, right);
    }

    public Optional<BatchMutation> replace(SyntaxTree tree, Expression node, Expression left, String operator,
                                           Expression right) {
        // Every decision is taken against the unmodified tree before any edit is recorded
        boolean wrapLeft = operands.needsParentheses(left, OperandSide.LEFT, operator);
        boolean wrapRight = operands.needsParentheses(right, OperandSide.RIGHT, operator);
        Optional<SubstitutionDecision> site = sites.analyze(tree, node, operator);
        if (site.isEmpty()) {
            return Optional.empty();
        }
        SubstitutionDecision decision = site.get();

        Expression replacement = AstFactory.binary(
            wrapLeft ? AstFactory.parenthesized(left) : left,
            operator,
            wrapRight ? AstFactory.parenthesized(right) : right);
        if (decision.wrapReplacement() || sites.needsLeadingParentheses(tree, node, replacement)) {
            replacement = AstFactory.parenthesized(replacement);
        }

        BatchMutation mutation = tree.begin();
        decision.parentToWrap().ifPresent(parent -> mutation.replaceNode(parent, AstFactory.parenthesized(parent)));
        mutation.replaceNode(node, replacement);
        return Optional.of(mutation);
    }
}
