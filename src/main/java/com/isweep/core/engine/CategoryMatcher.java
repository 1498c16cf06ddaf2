package com.isweep.core.engine;

import com.isweep.core.model.Category;
import com.isweep.core.rules.CategoryRules;
import com.isweep.core.rules.FilterRules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scans caption or transcript text for the signals of every category and
 * reports a severity (matched-signal count) per category.
 * <p>
 * Matching is case-insensitive and word-boundary aware: a signal never
 * matches inside a longer word, so {@code kill} does not match
 * {@code skill} or {@code killed}. Each signal's non-overlapping occurrences
 * are counted and the counts of all signals of a category are summed, so a
 * phrase signal such as {@code shot her} adds to the count of its head word.
 * <p>
 * Patterns are compiled once; instances are immutable and thread-safe.
 */
public class CategoryMatcher {

    // letters, digits and underscore make up a word
    private static final String WORD_START = "(?<![\\p{L}\\p{N}_])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}_])";

    private final Map<Category, List<Pattern>> patterns;

    public CategoryMatcher(FilterRules rules) {
        var compiled = new EnumMap<Category, List<Pattern>>(Category.class);
        for (Category category : Category.values()) {
            CategoryRules categoryRules = rules.rulesFor(category);
            var list = new ArrayList<Pattern>(categoryRules.signals().size());
            for (String signal : categoryRules.signals()) {
                list.add(compile(signal));
            }
            compiled.put(category, List.copyOf(list));
        }
        this.patterns = Collections.unmodifiableMap(compiled);
    }

    /**
     * Returns the severity of every category for the given text. All
     * categories are present; null or empty text yields zero everywhere.
     */
    public Map<Category, Integer> match(String text) {
        var severities = new EnumMap<Category, Integer>(Category.class);
        for (Category category : Category.values()) {
            severities.put(category, text == null || text.isEmpty() ? 0 : count(category, text));
        }
        return severities;
    }

    private int count(Category category, String text) {
        int severity = 0;
        for (Pattern pattern : patterns.get(category)) {
            var matcher = pattern.matcher(text);
            while (matcher.find()) {
                severity++;
            }
        }
        return severity;
    }

    static Pattern compile(String signal) {
        String[] words = signal.trim().split("\\s+");
        var body = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                body.append("\\s+");
            }
            body.append(Pattern.quote(words[i]));
        }
        return Pattern.compile(WORD_START + body + WORD_END,
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
