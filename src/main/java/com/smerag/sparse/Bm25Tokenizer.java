package com.smerag.sparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token indices come from {@link String#hashCode()}, which is stable across JVMs, so a
 * refit never renumbers terms that are already in the vector store.
 */
public final class Bm25Tokenizer {
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}]+");
    private static final int MAX_TOKEN_LENGTH = 50;

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "am", "an", "and", "any", "are",
            "as", "at", "be", "because", "been", "before", "being", "below", "between", "both", "but",
            "by", "can", "could", "did", "do", "does", "doing", "don", "down", "during", "each", "few",
            "for", "from", "further", "had", "has", "have", "having", "he", "her", "here", "hers",
            "herself", "him", "himself", "his", "how", "i", "if", "in", "into", "is", "it", "its",
            "itself", "just", "me", "more", "most", "my", "myself", "no", "nor", "not", "now", "of",
            "off", "on", "once", "only", "or", "other", "our", "ours", "ourselves", "out", "over",
            "own", "s", "same", "she", "should", "so", "some", "such", "t", "than", "that", "the",
            "their", "theirs", "them", "themselves", "then", "there", "these", "they", "this",
            "those", "through", "to", "too", "under", "until", "up", "very", "was", "we", "were",
            "what", "when", "where", "which", "while", "who", "whom", "why", "will", "with", "would",
            "you", "your", "yours", "yourself", "yourselves");

    private Bm25Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty() || token.length() > MAX_TOKEN_LENGTH || STOP_WORDS.contains(token)) {
                continue;
            }
            tokens.add(token);
        }
        return tokens;
    }

    public static int indexOf(String token) {
        return token.hashCode() & 0x7fffffff;
    }

    public static List<Integer> indices(String text) {
        return tokenize(text).stream().map(Bm25Tokenizer::indexOf).toList();
    }
}
