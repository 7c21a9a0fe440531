package com.jsanalyzer.analyze.engine;

import com.jsanalyzer.analyze.rule.RuleAction;
import com.jsanalyzer.analyze.rule.RuleDiagnostic;
import com.jsanalyzer.analyze.rule.RuleMetadata;

import java.util.Optional;

/**
 * One rule signal: the diagnostic it produced and the fix, if the rule could build one.
 */
public record AnalyzerSignal(RuleMetadata rule, RuleDiagnostic diagnostic, Optional<RuleAction> action) {
}
