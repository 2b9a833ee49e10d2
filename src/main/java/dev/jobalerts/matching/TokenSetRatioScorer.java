package dev.jobalerts.matching;

import org.springframework.stereotype.Component;

import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Token-set ratio: compares the shared and the differing whitespace tokens of
 * both inputs, so word order and repeated words do not lower the score.
 * <p>
 * Pairwise string similarity is the normalized indel similarity
 * {@code 2 * LCS / (len(a) + len(b))}, scaled to 0-100.
 */
@Component
public class TokenSetRatioScorer implements SimilarityScorer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double score(String keyword, String text) {
        SortedSet<String> left = tokens(keyword);
        SortedSet<String> right = tokens(text);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        SortedSet<String> intersection = new TreeSet<>(left);
        intersection.retainAll(right);
        SortedSet<String> leftOnly = new TreeSet<>(left);
        leftOnly.removeAll(right);
        SortedSet<String> rightOnly = new TreeSet<>(right);
        rightOnly.removeAll(left);

        // One side is fully contained in the other
        if (!intersection.isEmpty() && (leftOnly.isEmpty() || rightOnly.isEmpty())) {
            return 100.0;
        }

        String common = String.join(" ", intersection);
        String combinedLeft = join(common, String.join(" ", leftOnly));
        String combinedRight = join(common, String.join(" ", rightOnly));

        double best = ratio(combinedLeft, combinedRight);
        if (!common.isEmpty()) {
            best = Math.max(best, ratio(common, combinedLeft));
            best = Math.max(best, ratio(common, combinedRight));
        }
        return best;
    }

    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 100.0;
        }
        return 100.0 * 2 * longestCommonSubsequence(a, b) / total;
    }

    private static int longestCommonSubsequence(String a, String b) {
        if (a.length() < b.length()) {
            String swap = a;
            a = b;
            b = swap;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ch = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ch == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static SortedSet<String> tokens(String text) {
        SortedSet<String> tokens = new TreeSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : WHITESPACE.split(text.strip())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String join(String common, String rest) {
        if (common.isEmpty()) {
            return rest;
        }
        return rest.isEmpty() ? common : common + " " + rest;
    }
}
