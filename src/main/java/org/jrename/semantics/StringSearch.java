package org.jrename.semantics;

import java.util.Arrays;

/**
 * Boyer-Moore-Horspool search for a fixed pattern. Used as a cheap "does this document probably mention X" filter
 * before anything is parsed.
 */
public class StringSearch {
    private final String pattern;
    private final int[] skip = new int[256];

    public StringSearch(String pattern) {
        this.pattern = pattern;
        Arrays.fill(skip, Math.max(pattern.length(), 1));
        // Later characters overwrite earlier ones with smaller shifts, so colliding buckets keep the safe minimum
        for (var i = 0; i < pattern.length() - 1; i++) {
            skip[pattern.charAt(i) & 0xFF] = pattern.length() - 1 - i;
        }
    }

    public static boolean containsWord(CharSequence text, String word) {
        return new StringSearch(word).nextWord(text) != -1;
    }

    public int next(CharSequence text) {
        return next(text, 0);
    }

    public int next(CharSequence text, int from) {
        var m = pattern.length();
        if (m == 0) return from <= text.length() ? from : -1;
        var i = from;
        while (i + m <= text.length()) {
            var j = m - 1;
            while (j >= 0 && text.charAt(i + j) == pattern.charAt(j)) j--;
            if (j < 0) return i;
            i += skip[text.charAt(i + m - 1) & 0xFF];
        }
        return -1;
    }

    public int nextWord(CharSequence text) {
        return nextWord(text, 0);
    }

    /** Next occurrence of the pattern that is neither preceded nor followed by an identifier character. */
    public int nextWord(CharSequence text, int from) {
        while (true) {
            var i = next(text, from);
            if (i == -1) return -1;
            var end = i + pattern.length();
            var startsWord = i == 0 || !Character.isJavaIdentifierPart(text.charAt(i - 1));
            var endsWord = end == text.length() || !Character.isJavaIdentifierPart(text.charAt(end));
            if (startsWord && endsWord) return i;
            from = i + 1;
        }
    }
}
