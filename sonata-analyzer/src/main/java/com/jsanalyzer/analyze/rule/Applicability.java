package com.jsanalyzer.analyze.rule;

/**
 * How confident a rule is that its action preserves the program's behavior.
 */
public enum Applicability {
    /** The action can be applied automatically. */
    ALWAYS,
    /** The action may change behavior and is only applied on explicit request. */
    MAYBE_INCORRECT
}
