package com.jsanalyzer.analyze.rule;

/**
 * Signal for rules whose match carries no data.
 */
public enum RuleState {
    MATCHED
}
