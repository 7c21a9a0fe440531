package com.jsanalyzer.analyze.rules.style;

import com.jsanalyzer.analyze.precedence.Precedences;
import com.jsanalyzer.analyze.rewrite.BinaryRewriteBuilder;
import com.jsanalyzer.analyze.rule.ActionCategory;
import com.jsanalyzer.analyze.rule.Applicability;
import com.jsanalyzer.analyze.rule.Rule;
import com.jsanalyzer.analyze.rule.RuleAction;
import com.jsanalyzer.analyze.rule.RuleContext;
import com.jsanalyzer.analyze.rule.RuleDiagnostic;
import com.jsanalyzer.analyze.rule.RuleMetadata;
import com.jsanalyzer.analyze.rule.RuleState;
import com.jsanalyzer.analyze.semantic.GlobalIdentifiers;
import com.jsanalyzer.analyze.semantic.GlobalReference;
import com.jsanalyzer.analyze.syntax.TextRange;
import com.jsanalyzer.ast.CallExpression;
import com.jsanalyzer.ast.Expression;
import com.jsanalyzer.ast.MemberExpression;
import com.jsanalyzer.console.Markup;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Disallow the use of {@code Math.pow} in favor of the {@code **} operator.
 *
 * <p>Introduced in ES2016, the infix exponentiation operator {@code **} is an alternative for
 * the standard {@code Math.pow} function. Infix notation is considered more readable.</p>
 *
 * <h2>Invalid</h2>
 * <pre>{@code
 * const foo = Math.pow(2, 8);
 * let baz = Math.pow(a + b, c + d);
 * let quux = Math.pow(-1, n);
 * }</pre>
 *
 * <h2>Valid</h2>
 * <pre>{@code
 * const foo = 2 ** 8;
 * let baz = (a + b) ** (c + d);
 * let quux = (-1) ** n;
 * }</pre>
 *
 * <p>The fix is marked {@link Applicability#MAYBE_INCORRECT}: a {@code Math.pow} call with
 * side effects in its arguments, or one that relies on argument coercion of a bigint, may not
 * behave identically.</p>
 */
public final class UseExponentiationOperator implements Rule<CallExpression, RuleState> {
    private static final RuleMetadata METADATA = new RuleMetadata(
        "useExponentiationOperator",
        "1.0.0",
        "style",
        true,
        "Disallow the use of Math.pow in favor of the ** operator.");

    private static final String OPERATOR = "**";

    private final BinaryRewriteBuilder rewriter;

    public UseExponentiationOperator() {
        this(new BinaryRewriteBuilder());
    }

    public UseExponentiationOperator(BinaryRewriteBuilder rewriter) {
        this.rewriter = rewriter;
    }

    @Override
    public RuleMetadata metadata() {
        return METADATA;
    }

    @Override
    public Class<CallExpression> query() {
        return CallExpression.class;
    }

    @Override
    public Stream<RuleState> run(RuleContext<CallExpression> ctx) {
        Expression callee = Precedences.omitParentheses(ctx.query().callee());
        if (!(callee instanceof MemberExpression member)) {
            return Stream.empty();
        }
        if (!GlobalIdentifiers.memberName(member).filter("pow"::equals).isPresent()) {
            return Stream.empty();
        }
        Optional<GlobalReference> global = GlobalIdentifiers.globalIdentifier(member.object());
        if (global.isEmpty() || !global.get().name().equals("Math")) {
            return Stream.empty();
        }
        if (ctx.model().binding(global.get().reference()).isPresent()) {
            return Stream.empty();
        }
        return Stream.of(RuleState.MATCHED);
    }

    @Override
    public Optional<RuleDiagnostic> diagnostic(RuleContext<CallExpression> ctx, RuleState state) {
        return Optional.of(new RuleDiagnostic(ctx.category(), TextRange.of(ctx.query()), message()));
    }

    @Override
    public Optional<RuleAction> action(RuleContext<CallExpression> ctx, RuleState state) {
        return rewriter.replaceCall(ctx.tree(), ctx.query(), OPERATOR)
            .map(mutation -> new RuleAction(ActionCategory.QUICK_FIX, Applicability.MAYBE_INCORRECT, message(),
                mutation));
    }

    private static Markup message() {
        return Markup.builder()
            .text("Use the '")
            .emphasis("**")
            .text("' operator instead of '")
            .emphasis("Math.pow")
            .text("'.")
            .build();
    }
}
