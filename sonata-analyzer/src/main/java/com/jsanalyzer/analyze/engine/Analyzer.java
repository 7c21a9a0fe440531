package com.jsanalyzer.analyze.engine;

import com.jsanalyzer.analyze.config.AnalyzerConfiguration;
import com.jsanalyzer.analyze.rule.Applicability;
import com.jsanalyzer.analyze.rule.Rule;
import com.jsanalyzer.analyze.rule.RuleAction;
import com.jsanalyzer.analyze.rule.RuleContext;
import com.jsanalyzer.analyze.rule.RuleDiagnostic;
import com.jsanalyzer.analyze.rule.RuleRegistry;
import com.jsanalyzer.analyze.semantic.SemanticModel;
import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.ast.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Runs the enabled rules of a registry over syntax trees.
 *
 * <p>A pass never modifies the tree it analyzes. Actions are returned as uncommitted
 * mutations; {@link #fixAll} commits them one at a time and analyzes the new tree again after
 * each commit, since a committed fix invalidates every other pending mutation.</p>
 */
public class Analyzer {
    private static final Logger logger = LoggerFactory.getLogger(Analyzer.class);

    private final RuleRegistry registry;
    private final AnalyzerConfiguration configuration;
    private final List<Rule<?, ?>> enabledRules;

    public Analyzer(RuleRegistry registry, AnalyzerConfiguration configuration) {
        this.registry = registry;
        this.configuration = configuration;
        this.enabledRules = registry.rules().stream()
            .filter(rule -> configuration.isEnabled(rule.metadata()))
            .toList();
    }

    public Analyzer() {
        this(RuleRegistry.defaults(), AnalyzerConfiguration.defaults());
    }

    public RuleRegistry registry() {
        return registry;
    }

    public AnalyzerConfiguration configuration() {
        return configuration;
    }

    public List<Rule<?, ?>> enabledRules() {
        return enabledRules;
    }

    public AnalysisResult analyze(SyntaxTree tree) {
        return analyze(tree, DiagnosticSink.discarding());
    }

    /**
     * Analyzes {@code tree}, reporting each diagnostic to {@code sink} in result order.
     */
    public AnalysisResult analyze(SyntaxTree tree, DiagnosticSink sink) {
        SemanticModel model = SemanticModel.build(tree);
        Stream<Rule<?, ?>> rules = configuration.parallel()
            ? enabledRules.parallelStream()
            : enabledRules.stream();
        // Ordered collection keeps registry order even when rules run in parallel
        List<AnalyzerSignal> signals = rules
            .map(rule -> evaluate(rule, tree, model))
            .flatMap(List::stream)
            .toList();
        for (AnalyzerSignal signal : signals) {
            sink.report(signal.diagnostic());
        }
        return new AnalysisResult(signals);
    }

    private <N extends Node, S> List<AnalyzerSignal> evaluate(Rule<N, S> rule, SyntaxTree tree, SemanticModel model) {
        Class<N> query = rule.query();
        List<AnalyzerSignal> signals = new ArrayList<>();
        tree.descendants()
            .filter(query::isInstance)
            .map(query::cast)
            .forEach(node -> {
                RuleContext<N> ctx = new RuleContext<>(node, tree, model, rule.metadata());
                rule.run(ctx).forEach(state -> {
                    Optional<RuleDiagnostic> diagnostic = rule.diagnostic(ctx, state);
                    if (diagnostic.isEmpty()) {
                        return;
                    }
                    Optional<RuleAction> action = rule.action(ctx, state);
                    logger.debug("{} matched {} at {} (fix available: {})", rule.metadata().name(), node.type(),
                        diagnostic.get().range(), action.isPresent());
                    signals.add(new AnalyzerSignal(rule.metadata(), diagnostic.get(), action));
                });
            });
        return signals;
    }

    /**
     * Applies fixes until none is left, analyzing the tree again after every commit. Fixes
     * marked {@link Applicability#MAYBE_INCORRECT} are applied only when unsafe fixes are enabled.
     */
    public FixAllResult fixAll(SyntaxTree tree) {
        SyntaxTree current = tree;
        AnalysisResult result = analyze(current);
        int applied = 0;
        while (true) {
            Optional<AnalyzerSignal> next = result.signals().stream()
                .filter(signal -> signal.action().filter(this::isApplicable).isPresent())
                .findFirst();
            if (next.isEmpty()) {
                break;
            }
            if (applied == configuration.maxFixIterations()) {
                logger.warn("Stopped applying fixes after {} iterations; {} diagnostics remain",
                    applied, result.size());
                break;
            }
            AnalyzerSignal signal = next.get();
            current = signal.action().orElseThrow().mutation().commit();
            applied++;
            logger.debug("Applied fix from {} at {}", signal.rule().name(), signal.diagnostic().range());
            result = analyze(current);
        }
        logger.info("Applied {} fixes, {} diagnostics remain", applied, result.size());
        return new FixAllResult(current, applied, result);
    }

    private boolean isApplicable(RuleAction action) {
        return action.applicability() == Applicability.ALWAYS || configuration.unsafeFixes();
    }
}
