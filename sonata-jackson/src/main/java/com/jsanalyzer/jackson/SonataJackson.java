package com.jsanalyzer.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read and write analyzer reports and configuration.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = SonataJackson.createObjectMapper();
 * String report = mapper.writeValueAsString(analysisResult);
 * AnalyzerConfiguration config = mapper.readValue(json, AnalyzerConfiguration.class);
 * </pre>
 */
public final class SonataJackson {

    private SonataJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper with {@link AnalysisModule} registered.
     *
     * The returned mapper:
     * - Writes diagnostics with plain-text messages and {start, end} ranges
     * - Writes enum constants in lower camel case ("quickFix", "maybeIncorrect")
     * - Reads configuration documents, keeping defaults for missing settings
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Configuration files may carry keys for tools other than the analyzer
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AnalysisModule());

        return mapper;
    }
}
