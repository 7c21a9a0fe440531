package com.jsanalyzer.json;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Reads analyzer configuration and writes analysis reports as JSON.
 *
 * <p>Implementations register themselves under {@code META-INF/services}; adding
 * sonata-jackson to the classpath is enough.</p>
 *
 * <pre>{@code
 * AnalysisJsonProvider provider = AnalysisJsonProvider.getProvider();
 * AnalyzerConfiguration config = provider.getDeserializer().deserializeConfiguration(json);
 * AnalysisResult result = new Analyzer(RuleRegistry.defaults(), config).analyze(tree);
 * String report = provider.getSerializer().serialize(result);
 * }</pre>
 */
public interface AnalysisJsonProvider {

    AnalysisJsonSerializer getSerializer();

    ConfigurationJsonDeserializer getDeserializer();

    /** Short display name, e.g. "Jackson". */
    String getName();

    /**
     * @throws IllegalStateException if no implementation is registered
     */
    static AnalysisJsonProvider getProvider() {
        return discover().orElseThrow(() -> new IllegalStateException(
            "No AnalysisJsonProvider registered; add sonata-jackson to the classpath"));
    }

    static boolean isProviderAvailable() {
        return discover().isPresent();
    }

    private static Optional<AnalysisJsonProvider> discover() {
        return ServiceLoader.load(AnalysisJsonProvider.class).findFirst();
    }
}
