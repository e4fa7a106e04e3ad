package io.github.reugn.cmdargs4j.processor;

import java.util.List;
import java.util.Locale;

/**
 * Hints for {@code @ArgumentGroup} names that the action enum does not declare.
 *
 * <p>Group names are short and typos are mostly swapped or dropped letters, so names are
 * compared by optimal string alignment distance, where swapping two adjacent letters
 * costs one edit. Case is ignored, like everywhere else group names are compared.
 */
final class Suggestions {

    private static final int MIN_EDITS = 2;

    private Suggestions() {
    }

    /**
     * Builds the hint appended to {@link Rule#UndeclaredArgumentGroup}.
     *
     * @param group    the undeclared group name
     * @param declared the group names of the action enum, in declaration order
     * @return {@code ". Did you mean 'X'?"}, the list of declared groups, or an empty
     * string when the action declares none
     */
    static String hint(String group, List<String> declared) {
        if (declared.isEmpty()) {
            return "";
        }
        String closest = closestGroup(group, declared);
        return closest != null
                ? ". Did you mean '" + closest + "'?"
                : ". Declared groups: " + String.join(", ", declared);
    }

    /**
     * Returns the declared group closest to {@code group}, or {@code null} when every one
     * is more than {@code max(2, group.length() / 3)} edits away. Ties go to the group
     * declared first.
     */
    static String closestGroup(String group, List<String> declared) {
        String target = group.toLowerCase(Locale.ROOT);
        int budget = Math.max(MIN_EDITS, target.length() / 3);
        String closest = null;

        for (String candidate : declared) {
            int edits = editDistance(target, candidate.toLowerCase(Locale.ROOT));
            if (edits <= budget) {
                closest = candidate;
                budget = edits - 1;
            }
        }
        return closest;
    }

    /**
     * Optimal string alignment distance: insertions, deletions, substitutions and
     * adjacent transpositions each count as one edit.
     */
    static int editDistance(String a, String b) {
        int[][] d = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= b.length(); j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int substitution = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + substitution);
                if (i > 1 && j > 1 && a.charAt(i - 1) == b.charAt(j - 2) && a.charAt(i - 2) == b.charAt(j - 1)) {
                    d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + 1);
                }
            }
        }
        return d[a.length()][b.length()];
    }
}
