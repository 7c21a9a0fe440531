package com.jsanalyzer.analyze.rule;

import com.jsanalyzer.ast.Node;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * A lint rule.
 *
 * <p>The engine visits every node of type {@link #query()} and calls {@link #run} on it. Each
 * signal the rule emits is turned into a diagnostic by {@link #diagnostic} and, optionally,
 * into a code action by {@link #action}. None of these methods may mutate shared state: a
 * rule may be evaluated concurrently with other rules over the same snapshot.</p>
 *
 * @param <N> the node type the rule inspects
 * @param <S> the signal produced by a match
 */
public interface Rule<N extends Node, S> {

    RuleMetadata metadata();

    Class<N> query();

    /**
     * Inspects one node. A rule with nothing to report returns an empty stream.
     */
    Stream<S> run(RuleContext<N> ctx);

    Optional<RuleDiagnostic> diagnostic(RuleContext<N> ctx, S state);

    /**
     * Proposes a fix for a signal. Failure to build one is not an error: the diagnostic is
     * then reported without an action.
     */
    default Optional<RuleAction> action(RuleContext<N> ctx, S state) {
        return Optional.empty();
    }
}
