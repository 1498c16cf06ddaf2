package com.isweep.core.engine;

import com.isweep.core.model.Category;
import com.isweep.core.rules.FilterRulesLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CategoryMatcher} against the bundled rules.
 */
class CategoryMatcherTest {

    private static CategoryMatcher matcher;

    @BeforeAll
    static void loadRules() {
        matcher = new CategoryMatcher(FilterRulesLoader.loadDefault());
    }

    private static int severity(String text, Category category) {
        return matcher.match(text).get(category);
    }

    @Test
    @DisplayName("every category is present, with zero for clean text")
    void cleanText() {
        Map<Category, Integer> result = matcher.match("What a lovely afternoon for a picnic");
        assertEquals(3, result.size());
        result.values().forEach(severity -> assertEquals(0, severity));
    }

    @Test
    @DisplayName("null and empty text score zero everywhere")
    void nullAndEmpty() {
        for (Category category : Category.values()) {
            assertEquals(0, matcher.match(null).get(category));
            assertEquals(0, matcher.match("").get(category));
        }
    }

    @Nested
    @DisplayName("Word boundaries")
    class WordBoundaries {

        @Test
        @DisplayName("kill does not match skill or skilled")
        void killInsideSkill() {
            assertEquals(0, severity("She is a skilled player with great skill", Category.VIOLENCE));
        }

        @Test
        @DisplayName("killed counts once, not also as kill")
        void killedIsNotKill() {
            assertEquals(1, severity("The villain was killed", Category.VIOLENCE));
        }

        @Test
        @DisplayName("ass does not match class, pass or assume")
        void assInsideWords() {
            assertEquals(0, severity("I assume the class will pass", Category.LANGUAGE));
        }

        @Test
        @DisplayName("punctuation around a signal still counts as a boundary")
        void punctuation() {
            assertEquals(1, severity("\"Damn!\"", Category.LANGUAGE));
            assertEquals(1, severity("(blood)", Category.VIOLENCE));
        }

        @Test
        @DisplayName("underscores and digits are part of a word")
        void underscoreAndDigits() {
            assertEquals(0, severity("damn_it damn2", Category.LANGUAGE));
        }
    }

    @Nested
    @DisplayName("Severity")
    class Severity {

        @Test
        @DisplayName("matching ignores case")
        void caseInsensitive() {
            assertEquals(3, severity("DAMN Damn damn", Category.LANGUAGE));
        }

        @Test
        @DisplayName("repeated signals all count")
        void repeats() {
            assertEquals(2, severity("blood, more blood", Category.VIOLENCE));
        }

        @Test
        @DisplayName("a phrase counts alongside its head word")
        void phraseIntensifies() {
            assertEquals(2, severity("he shot her twice", Category.VIOLENCE));
            assertEquals(1, severity("he shot the target", Category.VIOLENCE));
        }

        @Test
        @DisplayName("phrase words match across any run of whitespace")
        void phraseWhitespace() {
            assertEquals(2, severity("he shot \n  her", Category.VIOLENCE));
        }

        @Test
        @DisplayName("categories are scored independently")
        void independentCategories() {
            Map<Category, Integer> result = matcher.match("damn, that sex scene ended in a murder");
            assertEquals(1, result.get(Category.LANGUAGE));
            assertEquals(2, result.get(Category.SEXUAL));
            assertEquals(1, result.get(Category.VIOLENCE));
        }

        @Test
        @DisplayName("the sample caption scores one language signal")
        void sampleCaption() {
            Map<Category, Integer> result = matcher.match("this is a damn good scene");
            assertEquals(1, result.get(Category.LANGUAGE));
            assertEquals(0, result.get(Category.SEXUAL));
            assertEquals(0, result.get(Category.VIOLENCE));
        }
    }

    @Test
    @DisplayName("compile escapes regex metacharacters in signals")
    void compileEscapes() {
        var pattern = CategoryMatcher.compile("a.b");
        assertTrue(pattern.matcher("x a.b y").find());
        assertFalse(pattern.matcher("x axb y").find());
    }
}
