package com.onalog.discovery.lead.dedupe;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class NameSimilarity {
    private static final Set<String> LEGAL_FORMS = Set.of(
        "corp", "corporation", "inc", "incorporated", "ltd", "limited", "llc", "llp", "co", "company",
        "plc", "gmbh", "ag", "sa", "sarl", "srl", "spa", "lda", "bv", "nv", "pty", "pvt"
    );

    private NameSimilarity() {
    }

    /**
     * {@code (maxLen - editDistance) / maxLen} over lower-cased names with punctuation and trailing legal-form
     * words ("Corp", "Ltd", ...) removed. Two blank names score 0.
     */
    public static double ratio(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        int maxLen = Math.max(a.length(), b.length());
        if (maxLen == 0) {
            return 0.0;
        }
        return (maxLen - levenshtein(a, b)) / (double) maxLen;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(current[j - 1] + 1, previous[j] + 1),
                    previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = value.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}\\s]", " ").trim();
        if (cleaned.isEmpty()) {
            return "";
        }
        List<String> words = new ArrayList<>(Arrays.asList(cleaned.split("\\s+")));
        while (words.size() > 1 && LEGAL_FORMS.contains(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        return String.join(" ", words);
    }
}
