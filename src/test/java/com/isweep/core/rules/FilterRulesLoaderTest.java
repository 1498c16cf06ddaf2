package com.isweep.core.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.isweep.core.model.Action;
import com.isweep.core.model.Category;
import com.isweep.core.model.Sensitivity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FilterRulesLoaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ObjectNode document;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(FilterRulesLoader.DEFAULT_RESOURCE)) {
            document = (ObjectNode) objectMapper.readTree(in);
        }
    }

    private ObjectNode category(String name) {
        return (ObjectNode) document.get("categories").get(name);
    }

    private ObjectNode action(String category, String sensitivity) {
        return (ObjectNode) category(category).get("actions").get(sensitivity);
    }

    private InvalidConfigurationException rejected() {
        return assertThrows(InvalidConfigurationException.class,
                () -> FilterRulesLoader.fromJson(document, "test"));
    }

    @Nested
    @DisplayName("Bundled rules")
    class BundledRules {

        @Test
        @DisplayName("load with the documented thresholds")
        void thresholds() {
            FilterRules rules = FilterRulesLoader.loadDefault();
            assertEquals(2, rules.threshold(Sensitivity.LOW));
            assertEquals(1, rules.threshold(Sensitivity.MEDIUM));
            assertEquals(1, rules.threshold(Sensitivity.HIGH));
            assertEquals("classpath:isweep-rules.json", rules.source());
        }

        @Test
        @DisplayName("load the documented action table")
        void actionTable() {
            FilterRules rules = FilterRulesLoader.loadDefault();
            assertEquals(new ActionRule(Action.MUTE, 3), rules.rulesFor(Category.LANGUAGE).actionFor(Sensitivity.LOW));
            assertEquals(new ActionRule(Action.MUTE, 4), rules.rulesFor(Category.LANGUAGE).actionFor(Sensitivity.MEDIUM));
            assertEquals(new ActionRule(Action.MUTE, 6), rules.rulesFor(Category.LANGUAGE).actionFor(Sensitivity.HIGH));
            assertEquals(new ActionRule(Action.MUTE, 10), rules.rulesFor(Category.SEXUAL).actionFor(Sensitivity.MEDIUM));
            assertEquals(new ActionRule(Action.SKIP, 30), rules.rulesFor(Category.SEXUAL).actionFor(Sensitivity.HIGH));
            assertEquals(new ActionRule(Action.FAST_FORWARD, 5), rules.rulesFor(Category.VIOLENCE).actionFor(Sensitivity.LOW));
            assertEquals(new ActionRule(Action.FAST_FORWARD, 10), rules.rulesFor(Category.VIOLENCE).actionFor(Sensitivity.MEDIUM));
            assertEquals(new ActionRule(Action.SKIP, 20), rules.rulesFor(Category.VIOLENCE).actionFor(Sensitivity.HIGH));
        }

        @Test
        @DisplayName("every category has signals")
        void signals() {
            FilterRules rules = FilterRulesLoader.loadDefault();
            for (Category category : Category.values()) {
                assertFalse(rules.rulesFor(category).signals().isEmpty(), category.wireName());
            }
            assertTrue(rules.rulesFor(Category.VIOLENCE).signals().contains("shot her"));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("rejects text that is not JSON")
        void notJson() {
            InputStream in = new ByteArrayInputStream("{not json".getBytes(StandardCharsets.UTF_8));
            assertThrows(InvalidConfigurationException.class, () -> FilterRulesLoader.load(in, "broken"));
        }

        @Test
        @DisplayName("rejects a missing category")
        void missingCategory() {
            ((ObjectNode) document.get("categories")).remove("sexual");
            assertTrue(rejected().getMessage().contains("sexual"));
        }

        @Test
        @DisplayName("rejects an unknown category")
        void unknownCategory() {
            ((ObjectNode) document.get("categories")).set("gore", category("violence").deepCopy());
            assertTrue(rejected().getMessage().contains("gore"));
        }

        @Test
        @DisplayName("rejects an empty signal list")
        void emptySignals() {
            category("language").set("signals", objectMapper.createArrayNode());
            rejected();
        }

        @Test
        @DisplayName("rejects a blank signal")
        void blankSignal() {
            ((ArrayNode) category("language").get("signals")).add("   ");
            rejected();
        }

        @Test
        @DisplayName("rejects a threshold below 1")
        void thresholdBelowOne() {
            ((ObjectNode) document.get("thresholds")).put("high", 0);
            rejected();
        }

        @Test
        @DisplayName("rejects a stricter level needing more matches")
        void increasingThresholds() {
            ((ObjectNode) document.get("thresholds")).put("high", 3);
            rejected();
        }

        @Test
        @DisplayName("rejects a missing action entry")
        void missingAction() {
            ((ObjectNode) category("violence").get("actions")).remove("medium");
            assertTrue(rejected().getMessage().contains("medium"));
        }

        @Test
        @DisplayName("rejects none as a configured action")
        void noneAction() {
            action("language", "low").put("action", "none");
            rejected();
        }

        @Test
        @DisplayName("rejects a non-positive duration")
        void zeroDuration() {
            action("sexual", "high").put("duration_seconds", 0);
            rejected();
        }

        @Test
        @DisplayName("rejects a higher sensitivity demanding a weaker action")
        void weakerAtHigherSensitivity() {
            action("violence", "high").put("action", "mute");
            rejected();
        }

        @Test
        @DisplayName("rejects an unknown action name")
        void unknownAction() {
            action("violence", "high").put("action", "rewind");
            rejected();
        }
    }

    @Test
    @DisplayName("normalizeSignal trims, collapses whitespace and lower-cases")
    void normalizeSignal() {
        assertEquals("son of a bitch", FilterRulesLoader.normalizeSignal("  Son  of\ta   BITCH "));
    }

    @Test
    @DisplayName("duplicate signals are kept once")
    void duplicateSignals() {
        var signals = (ArrayNode) category("language").get("signals");
        int before = FilterRulesLoader.fromJson(document.deepCopy(), "test").rulesFor(Category.LANGUAGE).signals().size();
        signals.add("DAMN");
        FilterRules rules = FilterRulesLoader.fromJson(document, "test");
        assertEquals(before, rules.rulesFor(Category.LANGUAGE).signals().size());
    }
}
