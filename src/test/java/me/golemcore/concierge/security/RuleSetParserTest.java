package me.golemcore.concierge.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleSetParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldReturnDefaultsForMissingRules() {
        assertEquals(RuleSet.defaults(), RuleSetParser.parse(null));
        assertEquals(RuleSet.defaults(), RuleSetParser.parse(objectMapper.createArrayNode()));
    }

    @Test
    void shouldParseAllFields() throws Exception {
        RuleSet rules = RuleSetParser.parse(objectMapper.readTree("""
                {"neverSayAI": false, "handoffOnLowConfidence": false, "confidenceThreshold": 0.8,
                 "maxTurns": 12, "style": {"tone": "warm", "persona": "Sam"}}
                """));

        assertFalse(rules.neverSayAI());
        assertFalse(rules.handoffOnLowConfidence());
        assertEquals(0.8, rules.confidenceThreshold());
        assertEquals(12, rules.maxTurns());
        assertEquals("warm", rules.tone());
        assertEquals("Sam", rules.persona());
    }

    @Test
    void shouldFallBackOnInvalidValues() throws Exception {
        RuleSet rules = RuleSetParser.parse(objectMapper.readTree("""
                {"neverSayAI": "no", "confidenceThreshold": 1.5, "maxTurns": -1, "style": {"tone": " "}}
                """));

        assertTrue(rules.neverSayAI());
        assertEquals(RuleSet.DEFAULT_CONFIDENCE_THRESHOLD, rules.confidenceThreshold());
        assertEquals(RuleSet.DEFAULT_MAX_TURNS, rules.maxTurns());
        assertNull(rules.tone());
    }
}
