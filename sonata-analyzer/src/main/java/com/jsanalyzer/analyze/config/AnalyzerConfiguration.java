package com.jsanalyzer.analyze.config;

import com.jsanalyzer.analyze.rule.RuleMetadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Selects which rules run and how fixes are applied.
 *
 * @param linterEnabled master switch; when false no rule runs
 * @param recommended whether rules marked recommended run without an explicit setting
 * @param rules explicit settings by rule name
 * @param unsafeFixes whether fixes marked {@code MAYBE_INCORRECT} are applied by {@code fixAll}
 * @param parallel whether rules are evaluated concurrently
 * @param maxFixIterations upper bound on fix-and-reanalyze rounds in {@code fixAll}
 */
public record AnalyzerConfiguration(
    boolean linterEnabled,
    boolean recommended,
    Map<String, RuleSetting> rules,
    boolean unsafeFixes,
    boolean parallel,
    int maxFixIterations
) {
    public static final int DEFAULT_MAX_FIX_ITERATIONS = 50;

    public AnalyzerConfiguration {
        rules = Map.copyOf(rules);
        if (maxFixIterations < 1) {
            throw new IllegalArgumentException("maxFixIterations must be positive, got " + maxFixIterations);
        }
    }

    public static AnalyzerConfiguration defaults() {
        return new AnalyzerConfiguration(true, true, Map.of(), false, false, DEFAULT_MAX_FIX_ITERATIONS);
    }

    public boolean isEnabled(RuleMetadata rule) {
        if (!linterEnabled) {
            return false;
        }
        RuleSetting setting = rules.get(rule.name());
        if (setting != null) {
            return setting == RuleSetting.ON;
        }
        return recommended && rule.recommended();
    }

    public AnalyzerConfiguration withRule(String name, RuleSetting setting) {
        Map<String, RuleSetting> updated = new LinkedHashMap<>(rules);
        updated.put(name, setting);
        return new AnalyzerConfiguration(linterEnabled, recommended, updated, unsafeFixes, parallel, maxFixIterations);
    }

    public AnalyzerConfiguration withLinterEnabled(boolean enabled) {
        return new AnalyzerConfiguration(enabled, recommended, rules, unsafeFixes, parallel, maxFixIterations);
    }

    public AnalyzerConfiguration withRecommended(boolean enabled) {
        return new AnalyzerConfiguration(linterEnabled, enabled, rules, unsafeFixes, parallel, maxFixIterations);
    }

    public AnalyzerConfiguration withUnsafeFixes(boolean enabled) {
        return new AnalyzerConfiguration(linterEnabled, recommended, rules, enabled, parallel, maxFixIterations);
    }

    public AnalyzerConfiguration withParallel(boolean enabled) {
        return new AnalyzerConfiguration(linterEnabled, recommended, rules, unsafeFixes, enabled, maxFixIterations);
    }

    public AnalyzerConfiguration withMaxFixIterations(int iterations) {
        return new AnalyzerConfiguration(linterEnabled, recommended, rules, unsafeFixes, parallel, iterations);
    }
}
