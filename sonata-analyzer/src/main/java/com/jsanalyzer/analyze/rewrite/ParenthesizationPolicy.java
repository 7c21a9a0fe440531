package com.jsanalyzer.analyze.rewrite;

/**
 * How eagerly operands are parenthesized beyond what the grammar requires.
 */
public enum ParenthesizationPolicy {
    /**
     * Also wraps increment and decrement operands of {@code **}, as in {@code (a++) ** b},
     * which parses the same without parentheses but reads ambiguously.
     */
    READABLE,

    /**
     * Wraps only where the result would otherwise parse differently or not at all.
     */
    MINIMAL
}
