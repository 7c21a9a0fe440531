package com.jsanalyzer.json;

import com.jsanalyzer.analyze.config.AnalyzerConfiguration;

/**
 * Reads analyzer configuration files.
 */
public interface ConfigurationJsonDeserializer {

    /**
     * Reads a configuration such as
     * <pre>{@code
     * { "linter": { "enabled": true, "rules": { "recommended": true, "useExponentiationOperator": "off" } },
     *   "unsafeFixes": false }
     * }</pre>
     * Missing settings keep their {@link AnalyzerConfiguration#defaults() default} values.
     *
     * @param json the configuration document
     * @return the configuration
     * @throws AnalysisJsonException if the document is malformed or holds an invalid setting
     */
    AnalyzerConfiguration deserializeConfiguration(String json) throws AnalysisJsonException;
}
