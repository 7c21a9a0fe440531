package com.jsanalyzer.analyze.engine;

import com.jsanalyzer.analyze.rule.RuleAction;
import com.jsanalyzer.analyze.rule.RuleDiagnostic;

import java.util.List;
import java.util.Optional;

/**
 * The signals of one analysis pass, in rule registration order and, per rule, in source order.
 */
public record AnalysisResult(List<AnalyzerSignal> signals) {
    public AnalysisResult {
        signals = List.copyOf(signals);
    }

    public List<RuleDiagnostic> diagnostics() {
        return signals.stream().map(AnalyzerSignal::diagnostic).toList();
    }

    public List<RuleAction> actions() {
        return signals.stream().map(AnalyzerSignal::action).flatMap(Optional::stream).toList();
    }

    public boolean isEmpty() {
        return signals.isEmpty();
    }

    public int size() {
        return signals.size();
    }
}
