package com.jsanalyzer.analyze.rule;

import com.jsanalyzer.analyze.syntax.BatchMutation;
import com.jsanalyzer.console.Markup;

/**
 * A proposed code change. The mutation is not applied until it is committed.
 */
public record RuleAction(ActionCategory category, Applicability applicability, Markup message,
                         BatchMutation mutation) {
}
