package com.jsanalyzer.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsanalyzer.analyze.config.AnalyzerConfiguration;
import com.jsanalyzer.analyze.engine.AnalysisResult;
import com.jsanalyzer.json.AnalysisJsonException;
import com.jsanalyzer.json.AnalysisJsonProvider;
import com.jsanalyzer.json.AnalysisJsonSerializer;
import com.jsanalyzer.json.ConfigurationJsonDeserializer;

/**
 * Jackson-based implementation of AnalysisJsonProvider.
 */
public class JacksonAnalysisJsonProvider implements AnalysisJsonProvider {

    private final ObjectMapper mapper;
    private final AnalysisJsonSerializer serializer;
    private final ConfigurationJsonDeserializer deserializer;

    public JacksonAnalysisJsonProvider() {
        this.mapper = SonataJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AnalysisJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public ConfigurationJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AnalysisJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(AnalysisResult result) throws AnalysisJsonException {
            try {
                return mapper.writeValueAsString(result);
            } catch (JsonProcessingException e) {
                throw new AnalysisJsonException("Failed to serialize analysis result", e);
            }
        }

        @Override
        public String serializePretty(AnalysisResult result) throws AnalysisJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
            } catch (JsonProcessingException e) {
                throw new AnalysisJsonException("Failed to serialize analysis result", e);
            }
        }

        @Override
        public String serialize(AnalyzerConfiguration configuration) throws AnalysisJsonException {
            try {
                return mapper.writeValueAsString(configuration);
            } catch (JsonProcessingException e) {
                throw new AnalysisJsonException("Failed to serialize configuration", e);
            }
        }
    }

    private static class JacksonDeserializer implements ConfigurationJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public AnalyzerConfiguration deserializeConfiguration(String json) throws AnalysisJsonException {
            AnalyzerConfiguration configuration;
            try {
                configuration = mapper.readValue(json, AnalyzerConfiguration.class);
            } catch (JsonProcessingException e) {
                throw new AnalysisJsonException("Failed to deserialize configuration", e);
            }
            if (configuration == null) {
                throw new AnalysisJsonException("Configuration document is null");
            }
            return configuration;
        }
    }
}
