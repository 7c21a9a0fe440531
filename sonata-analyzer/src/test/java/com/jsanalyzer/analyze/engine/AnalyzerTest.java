package com.jsanalyzer.analyze.engine;

import com.jsanalyzer.analyze.config.AnalyzerConfiguration;
import com.jsanalyzer.analyze.config.RuleSetting;
import com.jsanalyzer.analyze.rule.RuleDiagnostic;
import com.jsanalyzer.analyze.rule.RuleRegistry;
import com.jsanalyzer.analyze.rules.style.UseExponentiationOperator;
import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.analyze.syntax.TextRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerTest {
    private static final String SOURCE = "foo = Math.pow(foo, 2); x = Math.pow(a, b);";

    private static RuleRegistry registry() {
        return RuleRegistry.builder()
            .register(new UseExponentiationOperator())
            .register(new RenameFooRule())
            .build();
    }

    private static List<String> summary(AnalysisResult result) {
        return result.diagnostics().stream()
            .map(diagnostic -> diagnostic.category() + "@" + diagnostic.range())
            .collect(Collectors.toList());
    }

    @Test
    void defaultAnalyzerRunsRecommendedRules() {
        Analyzer analyzer = new Analyzer();
        assertEquals(1, analyzer.registry().size());
        assertEquals(1, analyzer.enabledRules().size());
        assertEquals(AnalyzerConfiguration.defaults(), analyzer.configuration());
    }

    @Test
    void resultsFollowRegistryThenSourceOrder() {
        Analyzer analyzer = new Analyzer(registry(), AnalyzerConfiguration.defaults());
        AnalysisResult result = analyzer.analyze(SyntaxTree.parse(SOURCE));
        assertEquals(List.of(
            "lint/style/useExponentiationOperator@6..22",
            "lint/style/useExponentiationOperator@28..42",
            "lint/nursery/noFoo@0..3",
            "lint/nursery/noFoo@15..18"), summary(result));
        assertEquals(4, result.actions().size());
    }

    @Test
    void parallelEvaluationGivesSameResult() {
        SyntaxTree tree = SyntaxTree.parse(SOURCE);
        AnalysisResult sequential = new Analyzer(registry(), AnalyzerConfiguration.defaults()).analyze(tree);
        AnalysisResult parallel = new Analyzer(registry(), AnalyzerConfiguration.defaults().withParallel(true))
            .analyze(tree);
        assertEquals(summary(sequential), summary(parallel));
    }

    @Test
    void sinkReceivesEveryDiagnosticInOrder() {
        List<RuleDiagnostic> reported = new ArrayList<>();
        AnalysisResult result = new Analyzer(registry(), AnalyzerConfiguration.defaults())
            .analyze(SyntaxTree.parse(SOURCE), reported::add);
        assertEquals(result.diagnostics(), reported);
    }

    @Test
    void analysisDoesNotModifyTree() {
        SyntaxTree tree = SyntaxTree.parse(SOURCE);
        String before = tree.text();
        new Analyzer(registry(), AnalyzerConfiguration.defaults()).analyze(tree);
        assertEquals(before, tree.text());
    }

    @Test
    void configurationSelectsRules() {
        SyntaxTree tree = SyntaxTree.parse(SOURCE);
        AnalyzerConfiguration defaults = AnalyzerConfiguration.defaults();

        assertTrue(new Analyzer(registry(), defaults.withLinterEnabled(false)).analyze(tree).isEmpty());
        assertTrue(new Analyzer(registry(), defaults.withRecommended(false)).analyze(tree).isEmpty());

        AnalysisResult onlyFoo = new Analyzer(registry(),
            defaults.withRule("useExponentiationOperator", RuleSetting.OFF)).analyze(tree);
        assertEquals(List.of("lint/nursery/noFoo@0..3", "lint/nursery/noFoo@15..18"), summary(onlyFoo));

        AnalysisResult explicit = new Analyzer(registry(),
            defaults.withRecommended(false).withRule("noFoo", RuleSetting.ON)).analyze(tree);
        assertEquals(2, explicit.size());
    }

    @Test
    void fixAllAppliesOnlySafeFixesByDefault() {
        Analyzer analyzer = new Analyzer(registry(), AnalyzerConfiguration.defaults());
        FixAllResult result = analyzer.fixAll(SyntaxTree.parse(SOURCE));
        assertEquals(2, result.fixesApplied());
        assertEquals("bar = Math.pow(bar, 2);\nx = Math.pow(a, b);", result.tree().text());
        assertEquals(2, result.remaining().size());
    }

    @Test
    void fixAllWithUnsafeFixes() {
        Analyzer analyzer = new Analyzer(registry(), AnalyzerConfiguration.defaults().withUnsafeFixes(true));
        FixAllResult result = analyzer.fixAll(SyntaxTree.parse(SOURCE));
        assertEquals(4, result.fixesApplied());
        assertEquals("bar = bar ** 2;\nx = a ** b;", result.tree().text());
        assertTrue(result.remaining().isEmpty());
    }

    @Test
    void fixAllStopsAtIterationBound() {
        Analyzer analyzer = new Analyzer(registry(), AnalyzerConfiguration.defaults().withMaxFixIterations(1));
        FixAllResult result = analyzer.fixAll(SyntaxTree.parse("foo; foo; foo;"));
        assertEquals(1, result.fixesApplied());
        assertEquals("bar;\nfoo;\nfoo;", result.tree().text());
        assertEquals(2, result.remaining().size());
    }

    @Test
    void fixAllWithoutDiagnostics() {
        SyntaxTree tree = SyntaxTree.parse("a ** b;");
        FixAllResult result = new Analyzer().fixAll(tree);
        assertEquals(0, result.fixesApplied());
        assertSame(tree, result.tree());
    }

    @Test
    void diagnosticRangeOfMatchedIdentifier() {
        AnalysisResult result = new Analyzer(RuleRegistry.builder().register(new RenameFooRule()).build(),
            AnalyzerConfiguration.defaults()).analyze(SyntaxTree.parse("  foo;"));
        assertEquals(new TextRange(2, 5), result.diagnostics().get(0).range());
    }
}
