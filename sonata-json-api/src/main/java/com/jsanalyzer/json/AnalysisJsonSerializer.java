package com.jsanalyzer.json;

import com.jsanalyzer.analyze.config.AnalyzerConfiguration;
import com.jsanalyzer.analyze.engine.AnalysisResult;

/**
 * Writes analysis reports and configurations as JSON.
 */
public interface AnalysisJsonSerializer {

    /**
     * Serializes the diagnostics of an analysis pass, with their proposed actions.
     *
     * @param result the result to serialize
     * @return the JSON report
     * @throws AnalysisJsonException if serialization fails
     */
    String serialize(AnalysisResult result) throws AnalysisJsonException;

    /**
     * Same as {@link #serialize(AnalysisResult)}, pretty-printed.
     */
    String serializePretty(AnalysisResult result) throws AnalysisJsonException;

    /**
     * Serializes a configuration in the form read by
     * {@link ConfigurationJsonDeserializer#deserializeConfiguration(String)}.
     */
    String serialize(AnalyzerConfiguration configuration) throws AnalysisJsonException;
}
