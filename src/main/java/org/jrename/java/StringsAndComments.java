package org.jrename.java;

import java.util.ArrayList;
import java.util.List;
import org.jrename.workspace.TextSpan;

/** Finds string literals and comments in Java source without parsing it. */
class StringsAndComments {
    enum Kind {
        STRING,
        COMMENT
    }

    static class Region {
        final Kind kind;
        /** The whole literal or comment, delimiters included. */
        final TextSpan span;

        Region(Kind kind, TextSpan span) {
            this.kind = kind;
            this.span = span;
        }

        @Override
        public String toString() {
            return kind + " " + span;
        }
    }

    static List<Region> scan(CharSequence text) {
        var regions = new ArrayList<Region>();
        var n = text.length();
        var i = 0;
        while (i < n) {
            var c = text.charAt(i);
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                var end = i + 2;
                while (end < n && text.charAt(end) != '\n' && text.charAt(end) != '\r') end++;
                regions.add(new Region(Kind.COMMENT, TextSpan.fromBounds(i, end)));
                i = end;
            } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                var end = indexOf(text, "*/", i + 2);
                end = end == -1 ? n : end + 2;
                regions.add(new Region(Kind.COMMENT, TextSpan.fromBounds(i, end)));
                i = end;
            } else if (startsWith(text, i, "\"\"\"")) {
                var end = skipQuoted(text, i + 3, "\"\"\"");
                regions.add(new Region(Kind.STRING, TextSpan.fromBounds(i, end)));
                i = end;
            } else if (c == '"') {
                var end = skipQuoted(text, i + 1, "\"");
                regions.add(new Region(Kind.STRING, TextSpan.fromBounds(i, end)));
                i = end;
            } else if (c == '\'') {
                i = skipQuoted(text, i + 1, "'");
            } else {
                i++;
            }
        }
        return regions;
    }

    /** Position after the closing delimiter, honoring backslash escapes. Unterminated literals end at the line. */
    private static int skipQuoted(CharSequence text, int from, String close) {
        var n = text.length();
        var i = from;
        var multiline = close.length() > 1;
        while (i < n) {
            var c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (!multiline && (c == '\n' || c == '\r')) return i;
            if (startsWith(text, i, close)) return i + close.length();
            i++;
        }
        return n;
    }

    private static boolean startsWith(CharSequence text, int at, String prefix) {
        if (at + prefix.length() > text.length()) return false;
        for (var k = 0; k < prefix.length(); k++) {
            if (text.charAt(at + k) != prefix.charAt(k)) return false;
        }
        return true;
    }

    private static int indexOf(CharSequence text, String find, int from) {
        for (var i = from; i + find.length() <= text.length(); i++) {
            if (startsWith(text, i, find)) return i;
        }
        return -1;
    }
}
