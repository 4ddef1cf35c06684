package com.casefile.common.narration;

import com.casefile.common.model.InsightCandidate;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts integer and decimal tokens from free text. Comparison is textual: {@code "9.0"}
 * and {@code "9"} are different tokens.
 */
public final class NumeralExtractor {

    private static final Pattern NUMERAL = Pattern.compile("\\d+(?:\\.\\d+)?");

    private NumeralExtractor() {}

    public static Set<String> extract(String text) {
        Set<String> numerals = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return numerals;
        Matcher m = NUMERAL.matcher(text);
        while (m.find()) {
            numerals.add(m.group());
        }
        return numerals;
    }

    /** Union of the numerals in every candidate's evidence. */
    public static Set<String> legitimateNumbers(Collection<InsightCandidate> insights) {
        Set<String> numbers = new LinkedHashSet<>();
        for (InsightCandidate insight : insights) {
            numbers.addAll(extract(insight.evidence()));
        }
        return numbers;
    }

    /** True if {@code text} holds at least one numeral from {@code legitimate}. */
    public static boolean isGrounded(String text, Set<String> legitimate) {
        for (String numeral : extract(text)) {
            if (legitimate.contains(numeral)) return true;
        }
        return false;
    }
}
