package com.jsanalyzer.analyze.engine;

import com.jsanalyzer.analyze.rule.RuleDiagnostic;

/**
 * Receives diagnostics as an analysis pass produces them.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(RuleDiagnostic diagnostic);

    static DiagnosticSink discarding() {
        return diagnostic -> { };
    }
}
