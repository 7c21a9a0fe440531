package com.jsanalyzer.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.jsanalyzer.analyze.config.AnalyzerConfiguration;
import com.jsanalyzer.analyze.config.RuleSetting;
import com.jsanalyzer.analyze.engine.AnalysisResult;
import com.jsanalyzer.analyze.engine.AnalyzerSignal;
import com.jsanalyzer.analyze.rule.ActionCategory;
import com.jsanalyzer.analyze.rule.Applicability;
import com.jsanalyzer.analyze.rule.RuleAction;
import com.jsanalyzer.analyze.rule.RuleDiagnostic;
import com.jsanalyzer.analyze.syntax.MutationException;
import com.jsanalyzer.analyze.syntax.TextRange;
import com.jsanalyzer.console.Markup;

import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Jackson module for the analyzer's report and configuration types.
 *
 * <p>A report has the form
 * <pre>{@code
 * {"diagnostics":[{"rule":"useExponentiationOperator","category":"lint/style/useExponentiationOperator",
 *   "range":{"start":12,"end":26},"message":"Use the '**' operator instead of 'Math.pow'.",
 *   "action":{"category":"quickFix","applicability":"maybeIncorrect","message":"...","output":"..."}}]}
 * }</pre>
 * where {@code output} is the program text after committing the action.</p>
 */
public class AnalysisModule extends SimpleModule {

    public AnalysisModule() {
        super("AnalysisModule", new Version(0, 1, 0, "SNAPSHOT", "com.jsanalyzer", "sonata-jackson"));

        addSerializer(Markup.class, new MarkupSerializer());
        addSerializer(TextRange.class, new TextRangeSerializer());
        addSerializer(ActionCategory.class, new LowerCamelEnumSerializer<>(ActionCategory.class));
        addSerializer(Applicability.class, new LowerCamelEnumSerializer<>(Applicability.class));
        addSerializer(RuleSetting.class, new RuleSettingSerializer());
        addSerializer(RuleAction.class, new RuleActionSerializer());
        addSerializer(AnalysisResult.class, new AnalysisResultSerializer());
        addSerializer(AnalyzerConfiguration.class, new ConfigurationSerializer());
        addDeserializer(AnalyzerConfiguration.class, new ConfigurationDeserializer());
    }

    static String lowerCamel(Enum<?> value) {
        String[] words = value.name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder sb = new StringBuilder(words[0]);
        for (int i = 1; i < words.length; i++) {
            sb.append(Character.toUpperCase(words[i].charAt(0))).append(words[i], 1, words[i].length());
        }
        return sb.toString();
    }

    // ==================== Serializers ====================

    private static class MarkupSerializer extends StdSerializer<Markup> {
        MarkupSerializer() {
            super(Markup.class);
        }

        @Override
        public void serialize(Markup value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toPlainText());
        }
    }

    private static class TextRangeSerializer extends StdSerializer<TextRange> {
        TextRangeSerializer() {
            super(TextRange.class);
        }

        @Override
        public void serialize(TextRange value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField("start", value.start());
            gen.writeNumberField("end", value.end());
            gen.writeEndObject();
        }
    }

    private static class LowerCamelEnumSerializer<E extends Enum<E>> extends StdSerializer<E> {
        LowerCamelEnumSerializer(Class<E> type) {
            super(type);
        }

        @Override
        public void serialize(E value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(lowerCamel(value));
        }
    }

    private static class RuleSettingSerializer extends StdSerializer<RuleSetting> {
        RuleSettingSerializer() {
            super(RuleSetting.class);
        }

        @Override
        public void serialize(RuleSetting value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.configValue());
        }
    }

    private static class RuleActionSerializer extends StdSerializer<RuleAction> {
        RuleActionSerializer() {
            super(RuleAction.class);
        }

        @Override
        public void serialize(RuleAction value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            String output;
            try {
                output = value.mutation().commit().text();
            } catch (MutationException e) {
                throw JsonMappingException.from(gen,
                    "Cannot commit action '" + value.message().toPlainText() + "'", e);
            }
            gen.writeStartObject();
            provider.defaultSerializeField("category", value.category(), gen);
            provider.defaultSerializeField("applicability", value.applicability(), gen);
            provider.defaultSerializeField("message", value.message(), gen);
            gen.writeStringField("output", output);
            gen.writeEndObject();
        }
    }

    private static class AnalysisResultSerializer extends StdSerializer<AnalysisResult> {
        AnalysisResultSerializer() {
            super(AnalysisResult.class);
        }

        @Override
        public void serialize(AnalysisResult value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeArrayFieldStart("diagnostics");
            for (AnalyzerSignal signal : value.signals()) {
                RuleDiagnostic diagnostic = signal.diagnostic();
                gen.writeStartObject();
                gen.writeStringField("rule", signal.rule().name());
                gen.writeStringField("category", diagnostic.category());
                provider.defaultSerializeField("range", diagnostic.range(), gen);
                provider.defaultSerializeField("message", diagnostic.message(), gen);
                if (signal.action().isPresent()) {
                    provider.defaultSerializeField("action", signal.action().get(), gen);
                }
                gen.writeEndObject();
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
    }

    private static class ConfigurationSerializer extends StdSerializer<AnalyzerConfiguration> {
        ConfigurationSerializer() {
            super(AnalyzerConfiguration.class);
        }

        @Override
        public void serialize(AnalyzerConfiguration value, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            gen.writeStartObject();
            gen.writeObjectFieldStart("linter");
            gen.writeBooleanField("enabled", value.linterEnabled());
            gen.writeObjectFieldStart("rules");
            gen.writeBooleanField("recommended", value.recommended());
            // Sorted so the same configuration always prints the same way
            for (Map.Entry<String, RuleSetting> rule : new TreeMap<>(value.rules()).entrySet()) {
                provider.defaultSerializeField(rule.getKey(), rule.getValue(), gen);
            }
            gen.writeEndObject();
            gen.writeEndObject();
            gen.writeBooleanField("unsafeFixes", value.unsafeFixes());
            gen.writeBooleanField("parallel", value.parallel());
            gen.writeNumberField("maxFixIterations", value.maxFixIterations());
            gen.writeEndObject();
        }
    }

    // ==================== Deserializers ====================

    private static class ConfigurationDeserializer extends StdDeserializer<AnalyzerConfiguration> {
        ConfigurationDeserializer() {
            super(AnalyzerConfiguration.class);
        }

        @Override
        public AnalyzerConfiguration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode root = p.getCodec().readTree(p);
            if (!root.isObject()) {
                return ctxt.reportInputMismatch(this, "Configuration must be a JSON object");
            }
            AnalyzerConfiguration config = AnalyzerConfiguration.defaults();

            JsonNode linter = root.path("linter");
            if (!linter.isMissingNode()) {
                if (!linter.isObject()) {
                    return ctxt.reportInputMismatch(this, "'linter' must be an object");
                }
                config = config.withLinterEnabled(booleanField(linter, "enabled", config.linterEnabled(), ctxt));
                JsonNode rules = linter.path("rules");
                if (!rules.isMissingNode()) {
                    config = readRules(rules, config, ctxt);
                }
            }

            config = config.withUnsafeFixes(booleanField(root, "unsafeFixes", config.unsafeFixes(), ctxt));
            config = config.withParallel(booleanField(root, "parallel", config.parallel(), ctxt));
            JsonNode iterations = root.path("maxFixIterations");
            if (!iterations.isMissingNode()) {
                if (!iterations.canConvertToInt() || !iterations.isIntegralNumber() || iterations.intValue() < 1) {
                    return ctxt.reportInputMismatch(this,
                        "'maxFixIterations' must be a positive integer, got %s", iterations);
                }
                config = config.withMaxFixIterations(iterations.intValue());
            }
            return config;
        }

        private AnalyzerConfiguration readRules(JsonNode rules, AnalyzerConfiguration config,
                                                DeserializationContext ctxt) throws IOException {
            if (!rules.isObject()) {
                return ctxt.reportInputMismatch(this, "'linter.rules' must be an object");
            }
            AnalyzerConfiguration result = config;
            Iterator<Map.Entry<String, JsonNode>> fields = rules.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String name = field.getKey();
                JsonNode value = field.getValue();
                if (name.equals("recommended")) {
                    result = result.withRecommended(booleanField(rules, name, result.recommended(), ctxt));
                } else if (!value.isTextual()) {
                    return ctxt.reportInputMismatch(this, "Setting of rule '%s' must be \"on\" or \"off\"", name);
                } else {
                    try {
                        result = result.withRule(name, RuleSetting.parse(value.textValue()));
                    } catch (IllegalArgumentException e) {
                        return ctxt.reportInputMismatch(this, "Rule '%s': %s", name, e.getMessage());
                    }
                }
            }
            return result;
        }

        private boolean booleanField(JsonNode object, String name, boolean fallback, DeserializationContext ctxt)
                throws IOException {
            JsonNode value = object.path(name);
            if (value.isMissingNode()) {
                return fallback;
            }
            if (!value.isBoolean()) {
                return ctxt.reportInputMismatch(this, "'%s' must be true or false, got %s", name, value);
            }
            return value.booleanValue();
        }
    }
}
