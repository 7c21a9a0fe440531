package com.jsanalyzer.analyze.rule;

import com.jsanalyzer.analyze.rules.style.UseExponentiationOperator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable, ordered table of rules keyed by name.
 */
public final class RuleRegistry {
    private final Map<String, Rule<?, ?>> rules;

    private RuleRegistry(Map<String, Rule<?, ?>> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /**
     * @return a registry holding every rule that ships with the analyzer
     */
    public static RuleRegistry defaults() {
        return builder()
            .register(new UseExponentiationOperator())
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Rule<?, ?>> rules() {
        return new ArrayList<>(rules.values());
    }

    public List<RuleMetadata> metadata() {
        return rules.values().stream().map(Rule::metadata).toList();
    }

    public Optional<Rule<?, ?>> get(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public int size() {
        return rules.size();
    }

    public static final class Builder {
        private final Map<String, Rule<?, ?>> rules = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(Rule<?, ?> rule) {
            String name = rule.metadata().name();
            if (rules.putIfAbsent(name, rule) != null) {
                throw new IllegalArgumentException("Rule already registered: " + name);
            }
            return this;
        }

        public RuleRegistry build() {
            return new RuleRegistry(rules);
        }
    }
}
