package com.jsanalyzer.analyze.rule;

import com.jsanalyzer.analyze.syntax.TextRange;
import com.jsanalyzer.console.Markup;

/**
 * A problem reported by a rule.
 */
public record RuleDiagnostic(String category, TextRange range, Markup message) {
}
