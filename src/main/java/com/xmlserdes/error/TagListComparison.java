package com.xmlserdes.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented diff between the child tags a schema expects and the tags an element has.
 * Common tags are aligned by longest common subsequence; everything else is reported as
 * {@code missing: tag} or {@code unexpected: tag} in document order.
 */
public final class TagListComparison {

    private final List<String> expected;
    private final List<String> actual;
    private final List<String> lines;

    public TagListComparison(List<String> expected, List<String> actual) {
        this.expected = List.copyOf(expected);
        this.actual = List.copyOf(actual);
        this.lines = List.copyOf(diff(this.expected, this.actual));
    }

    private static List<String> diff(List<String> exp, List<String> got) {
        int n = exp.size();
        int m = got.size();
        // lcs[i][j] = length of the longest common subsequence of exp[i..] and got[j..]
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = exp.get(i).equals(got.get(j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }

        List<String> out = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (exp.get(i).equals(got.get(j))) {
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                out.add("missing: " + exp.get(i++));
            } else {
                out.add("unexpected: " + got.get(j++));
            }
        }
        while (i < n) {
            out.add("missing: " + exp.get(i++));
        }
        while (j < m) {
            out.add("unexpected: " + got.get(j++));
        }
        return out;
    }

    public List<String> getExpected() {
        return expected;
    }

    public List<String> getActual() {
        return actual;
    }

    public List<String> getLines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    @Override
    public String toString() {
        return "[" + String.join(", ", lines) + "]";
    }
}
