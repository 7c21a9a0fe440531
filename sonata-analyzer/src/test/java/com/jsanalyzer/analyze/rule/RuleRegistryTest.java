package com.jsanalyzer.analyze.rule;

import com.jsanalyzer.analyze.rules.style.UseExponentiationOperator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RuleRegistryTest {

    @Test
    void defaultsContainShippedRules() {
        RuleRegistry registry = RuleRegistry.defaults();
        assertEquals(1, registry.size());
        assertInstanceOf(UseExponentiationOperator.class, registry.get("useExponentiationOperator").orElseThrow());
        assertEquals(List.of("useExponentiationOperator"),
            registry.metadata().stream().map(RuleMetadata::name).toList());
        assertTrue(registry.get("noVar").isEmpty());
    }

    @Test
    void rejectsDuplicateNames() {
        RuleRegistry.Builder builder = RuleRegistry.builder().register(new UseExponentiationOperator());
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> builder.register(new UseExponentiationOperator()));
        assertEquals("Rule already registered: useExponentiationOperator", error.getMessage());
    }

    @Test
    void registryIsReadOnly() {
        RuleRegistry registry = RuleRegistry.defaults();
        registry.rules().clear();
        assertEquals(1, registry.size());
    }

    @Test
    void metadataRequiresName() {
        assertThrows(NullPointerException.class, () -> new RuleMetadata(null, "1.0.0", "style", true, ""));
        assertEquals("lint/correctness/noFoo",
            new RuleMetadata("noFoo", "1.0.0", "correctness", false, "").category());
    }
}
