package com.jsanalyzer.analyze.config;

import com.jsanalyzer.analyze.rule.RuleMetadata;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerConfigurationTest {
    private static final RuleMetadata RECOMMENDED = new RuleMetadata("a", "1.0.0", "style", true, "");
    private static final RuleMetadata OPTIONAL = new RuleMetadata("b", "1.0.0", "style", false, "");

    @Test
    void defaults() {
        AnalyzerConfiguration config = AnalyzerConfiguration.defaults();
        assertTrue(config.linterEnabled());
        assertTrue(config.recommended());
        assertFalse(config.unsafeFixes());
        assertFalse(config.parallel());
        assertEquals(AnalyzerConfiguration.DEFAULT_MAX_FIX_ITERATIONS, config.maxFixIterations());
        assertTrue(config.isEnabled(RECOMMENDED));
        assertFalse(config.isEnabled(OPTIONAL));
    }

    @Test
    void explicitSettingWins() {
        AnalyzerConfiguration config = AnalyzerConfiguration.defaults()
            .withRule("a", RuleSetting.OFF)
            .withRule("b", RuleSetting.ON);
        assertFalse(config.isEnabled(RECOMMENDED));
        assertTrue(config.isEnabled(OPTIONAL));
        assertFalse(config.withLinterEnabled(false).isEnabled(OPTIONAL));
    }

    @Test
    void rulesAreCopied() {
        Map<String, RuleSetting> rules = new HashMap<>();
        AnalyzerConfiguration config = new AnalyzerConfiguration(true, true, rules, false, false, 1);
        rules.put("a", RuleSetting.OFF);
        assertTrue(config.rules().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> config.rules().put("a", RuleSetting.ON));
    }

    @Test
    void rejectsNonPositiveIterationBound() {
        assertThrows(IllegalArgumentException.class,
            () -> AnalyzerConfiguration.defaults().withMaxFixIterations(0));
    }

    @Test
    void parsesSettings() {
        assertEquals(RuleSetting.ON, RuleSetting.parse("on"));
        assertEquals(RuleSetting.OFF, RuleSetting.parse("OFF"));
        assertEquals("off", RuleSetting.OFF.configValue());
        assertThrows(IllegalArgumentException.class, () -> RuleSetting.parse("warn"));
    }
}
