package com.jsanalyzer.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsanalyzer.analyze.config.AnalyzerConfiguration;
import com.jsanalyzer.analyze.config.RuleSetting;
import com.jsanalyzer.analyze.engine.AnalysisResult;
import com.jsanalyzer.analyze.engine.Analyzer;
import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.json.AnalysisJsonException;
import com.jsanalyzer.json.AnalysisJsonProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAnalysisJsonProviderTest {
    private final AnalysisJsonProvider provider = AnalysisJsonProvider.getProvider();
    private final ObjectMapper mapper = SonataJackson.createObjectMapper();

    @Test
    @DisplayName("Provider is discovered through ServiceLoader")
    void discovery() {
        assertTrue(AnalysisJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonAnalysisJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonAnalysisJsonProvider.class, AnalysisJsonProvider.getProvider());
    }

    @Test
    void reportsDiagnosticWithAction() throws Exception {
        AnalysisResult result = new Analyzer().analyze(SyntaxTree.parse("const foo = Math.pow(2, 8);"));
        JsonNode report = mapper.readTree(provider.getSerializer().serialize(result));

        JsonNode diagnostic = report.path("diagnostics").get(0);
        assertEquals(1, report.path("diagnostics").size());
        assertEquals("useExponentiationOperator", diagnostic.path("rule").asText());
        assertEquals("lint/style/useExponentiationOperator", diagnostic.path("category").asText());
        assertEquals(12, diagnostic.path("range").path("start").asInt());
        assertEquals(26, diagnostic.path("range").path("end").asInt());
        assertEquals("Use the '**' operator instead of 'Math.pow'.", diagnostic.path("message").asText());

        JsonNode action = diagnostic.path("action");
        assertEquals("quickFix", action.path("category").asText());
        assertEquals("maybeIncorrect", action.path("applicability").asText());
        assertEquals("const foo = 2 ** 8;", action.path("output").asText());
    }

    @Test
    void diagnosticWithoutFixHasNoAction() throws Exception {
        AnalysisResult result = new Analyzer().analyze(SyntaxTree.parse("Math.pow(a, b, c);"));
        JsonNode diagnostic = mapper.readTree(provider.getSerializer().serialize(result)).path("diagnostics").get(0);
        assertFalse(diagnostic.has("action"));
    }

    @Test
    void emptyReport() {
        AnalysisResult result = new Analyzer().analyze(SyntaxTree.parse("a ** b;"));
        assertEquals("{\"diagnostics\":[]}", provider.getSerializer().serialize(result));
        assertTrue(provider.getSerializer().serializePretty(result).contains("\"diagnostics\""));
    }

    @Test
    void readsConfiguration() {
        String json = """
            {
              "$schema": "./schema.json",
              "linter": {
                "enabled": true,
                "rules": { "recommended": false, "useExponentiationOperator": "On" }
              },
              "unsafeFixes": true,
              "maxFixIterations": 10
            }
            """;
        AnalyzerConfiguration config = provider.getDeserializer().deserializeConfiguration(json);
        assertTrue(config.linterEnabled());
        assertFalse(config.recommended());
        assertEquals(RuleSetting.ON, config.rules().get("useExponentiationOperator"));
        assertTrue(config.unsafeFixes());
        assertFalse(config.parallel());
        assertEquals(10, config.maxFixIterations());
    }

    @Test
    void emptyConfigurationKeepsDefaults() {
        assertEquals(AnalyzerConfiguration.defaults(), provider.getDeserializer().deserializeConfiguration("{}"));
    }

    @Test
    void writesConfigurationInReadableForm() throws Exception {
        AnalyzerConfiguration config = AnalyzerConfiguration.defaults()
            .withRule("useExponentiationOperator", RuleSetting.OFF)
            .withParallel(true);
        String json = provider.getSerializer().serialize(config);
        JsonNode tree = mapper.readTree(json);
        assertEquals("off", tree.path("linter").path("rules").path("useExponentiationOperator").asText());
        assertTrue(tree.path("linter").path("rules").path("recommended").asBoolean());
        assertTrue(tree.path("parallel").asBoolean());
        assertEquals(config, provider.getDeserializer().deserializeConfiguration(json));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "[]",
        "null",
        "{\"linter\": []}",
        "{\"linter\": {\"enabled\": \"yes\"}}",
        "{\"linter\": {\"rules\": {\"useExponentiationOperator\": \"warn\"}}}",
        "{\"linter\": {\"rules\": {\"useExponentiationOperator\": 1}}}",
        "{\"maxFixIterations\": 0}",
        "{\"maxFixIterations\": 1.5}",
        "{\"unsafeFixes\": "
    })
    void rejectsInvalidConfiguration(String json) {
        assertThrows(AnalysisJsonException.class, () -> provider.getDeserializer().deserializeConfiguration(json));
    }
}
