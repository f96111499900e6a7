package me.bechberger.phidetect.fuzzy;

/**
 * Damerau-Levenshtein distance in its optimal string alignment form: insertion, deletion,
 * substitution and transposition of adjacent characters each cost one, no substring is edited twice.
 */
final class EditDistance {

    private EditDistance() {
    }

    /**
     * Full distance, except that a length difference above {@code maxEdit} short-circuits to
     * {@code maxEdit + 1}.
     */
    static int damerauLevenshtein(String a, String b, int maxEdit) {
        int lenA = a.length();
        int lenB = b.length();
        if (lenA == 0) return lenB;
        if (lenB == 0) return lenA;
        if (Math.abs(lenA - lenB) > maxEdit) {
            return maxEdit + 1;
        }
        int[] prevPrev = new int[lenB + 1];
        int[] prev = new int[lenB + 1];
        int[] curr = new int[lenB + 1];
        for (int j = 0; j <= lenB; j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= lenA; i++) {
            curr[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= lenB; j++) {
                char cb = b.charAt(j - 1);
                int cost = ca == cb ? 0 : 1;
                int value = Math.min(Math.min(prev[j] + 1, curr[j - 1] + 1), prev[j - 1] + cost);
                if (i > 1 && j > 1 && ca == b.charAt(j - 2) && a.charAt(i - 2) == cb) {
                    value = Math.min(value, prevPrev[j - 2] + cost);
                }
                curr[j] = value;
            }
            int[] tmp = prevPrev;
            prevPrev = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[lenB];
    }

    /**
     * Same result as {@link #damerauLevenshtein(String, String, int)} whenever that result is at most
     * {@code bound}; otherwise some value above {@code bound}, at most {@code bound + 1}
     * (or {@code maxEdit + 1} from the length short-circuit).
     * <p>
     * Only cells within {@code bound} of the diagonal are computed, and the computation stops once two
     * consecutive rows lie entirely above the bound: with transpositions a cell depends on the two
     * rows above it, so no later row can get back under the bound.
     *
     * @param rows scratch buffer of three rows, each at least {@code b.length() + 1} long
     */
    static int bounded(String a, String b, int maxEdit, int bound, int[][] rows) {
        int lenA = a.length();
        int lenB = b.length();
        int over = bound + 1;
        if (lenA == 0) return Math.min(lenB, over);
        if (lenB == 0) return Math.min(lenA, over);
        if (Math.abs(lenA - lenB) > maxEdit) {
            return maxEdit + 1;
        }
        int[] prevPrev = rows[0];
        int[] prev = rows[1];
        int[] curr = rows[2];
        for (int j = 0; j <= lenB; j++) {
            prev[j] = Math.min(j, over);
            prevPrev[j] = over;
        }
        int prevMin = 0;
        for (int i = 1; i <= lenA; i++) {
            int from = Math.max(1, i - bound);
            int to = Math.min(lenB, i + bound);
            for (int j = 0; j <= lenB; j++) {
                curr[j] = over;
            }
            curr[0] = Math.min(i, over);
            int rowMin = curr[0];
            char ca = a.charAt(i - 1);
            for (int j = from; j <= to; j++) {
                char cb = b.charAt(j - 1);
                int cost = ca == cb ? 0 : 1;
                int value = Math.min(Math.min(prev[j] + 1, curr[j - 1] + 1), prev[j - 1] + cost);
                if (i > 1 && j > 1 && ca == b.charAt(j - 2) && a.charAt(i - 2) == cb) {
                    value = Math.min(value, prevPrev[j - 2] + cost);
                }
                value = Math.min(value, over);
                curr[j] = value;
                if (value < rowMin) {
                    rowMin = value;
                }
            }
            if (rowMin > bound && prevMin > bound) {
                return over;
            }
            prevMin = rowMin;
            int[] tmp = prevPrev;
            prevPrev = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[lenB];
    }
}
