package org.calista.archives.lore.text;

/**
 * Edit-distance based string similarity on a 0..100 scale.
 *
 * <ul>
 *   <li>{@link #ratio(String, String)}: whole-string similarity, {@code 100 * 2*LCS / (|a| + |b|)}
 *       (one minus the normalized insert/delete distance)</li>
 *   <li>{@link #partialRatio(String, String)}: best {@code ratio} of the shorter string against every
 *       window of the longer one with the same length</li>
 * </ul>
 *
 * Both are rounded to whole points. An empty input scores 0.
 */
public final class FuzzyRatio {

    private FuzzyRatio() {}

    public static int ratio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) return 0;
        if (a.equals(b)) return 100;
        int lcs = lcsLength(a, 0, a.length(), b);
        return (int) Math.round(200.0 * lcs / (a.length() + b.length()));
    }

    public static int partialRatio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) return 0;

        String shorter = a.length() <= b.length() ? a : b;
        String longer = a.length() <= b.length() ? b : a;
        int m = shorter.length();
        if (m == longer.length()) return ratio(shorter, longer);
        if (longer.contains(shorter)) return 100;

        int best = 0;
        for (int start = 0; start + m <= longer.length(); start++) {
            int lcs = lcsLength(longer, start, start + m, shorter);
            int r = (int) Math.round(100.0 * lcs / m);
            if (r > best) {
                best = r;
                if (best == 100) break;
            }
        }
        return best;
    }

    /**
     * Longest common subsequence of {@code x[from, to)} and {@code y}, two-row DP.
     */
    private static int lcsLength(String x, int from, int to, String y) {
        int n = y.length();
        int[] prev = new int[n + 1];
        int[] cur = new int[n + 1];
        for (int i = from; i < to; i++) {
            char cx = x.charAt(i);
            for (int j = 1; j <= n; j++) {
                if (cx == y.charAt(j - 1)) cur[j] = prev[j - 1] + 1;
                else cur[j] = Math.max(prev[j], cur[j - 1]);
            }
            int[] t = prev;
            prev = cur;
            cur = t;
        }
        return prev[n];
    }
}
