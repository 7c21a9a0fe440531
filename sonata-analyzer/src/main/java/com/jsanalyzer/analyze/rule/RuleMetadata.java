package com.jsanalyzer.analyze.rule;

import java.util.Objects;

/**
 * Registration data of a rule.
 *
 * @param name the rule name, unique within a registry
 * @param version the release that introduced the rule
 * @param group the rule group, such as {@code style}
 * @param recommended whether the rule is enabled by the recommended preset
 * @param description one line describing what the rule reports
 */
public record RuleMetadata(String name, String version, String group, boolean recommended, String description) {
    public RuleMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(group, "group");
    }

    /**
     * @return the diagnostic category, e.g. {@code lint/style/useExponentiationOperator}
     */
    public String category() {
        return "lint/" + group + "/" + name;
    }
}
