package com.jreinhal.askdocs.retrieval;

import com.jreinhal.askdocs.constant.StopWords;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-cases and splits text into index terms, dropping stop words and single characters.
 */
public final class TermAnalyzer {
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TermAnalyzer() {
    }

    public static List<String> terms(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] raw = NON_WORD.split(text.toLowerCase(Locale.ROOT));
        List<String> terms = new ArrayList<>(raw.length);
        for (String term : raw) {
            if (term.length() > 1 && !StopWords.LEXICAL.contains(term)) {
                terms.add(term);
            }
        }
        return terms;
    }
}
