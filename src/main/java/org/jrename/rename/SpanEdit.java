package org.jrename.rename;

import java.util.List;
import java.util.Objects;
import org.jrename.workspace.TextSpan;

/** Replacement of one span of a document's original text. Insertions have an empty span. */
public final class SpanEdit implements Comparable<SpanEdit> {
    public enum Kind {
        RENAME,
        EXPANSION,
        STRING_OR_COMMENT
    }

    public final TextSpan oldSpan;
    public final String newText;
    public final Kind kind;

    public SpanEdit(TextSpan oldSpan, String newText, Kind kind) {
        this.oldSpan = Objects.requireNonNull(oldSpan);
        this.newText = Objects.requireNonNull(newText);
        this.kind = Objects.requireNonNull(kind);
    }

    public static SpanEdit insert(int position, String text) {
        return new SpanEdit(new TextSpan(position, 0), text, Kind.EXPANSION);
    }

    public int delta() {
        return newText.length() - oldSpan.length;
    }

    /** Insertions sort before a replacement that starts at the same offset. */
    @Override
    public int compareTo(SpanEdit other) {
        return oldSpan.compareTo(other.oldSpan);
    }

    /** Applies edits, which must be sorted and must not overlap, to {@code text}. */
    public static String apply(String text, List<SpanEdit> edits) {
        var result = new StringBuilder(text.length() + 16);
        var copied = 0;
        for (var edit : edits) {
            if (edit.oldSpan.start < copied) {
                throw new IllegalArgumentException(String.format("Edit %s overlaps an earlier edit", edit));
            }
            if (edit.oldSpan.end() > text.length()) {
                throw new IllegalArgumentException(String.format("Edit %s is past the end of the text", edit));
            }
            result.append(text, copied, edit.oldSpan.start);
            result.append(edit.newText);
            copied = edit.oldSpan.end();
        }
        result.append(text, copied, text.length());
        return result.toString();
    }

    /**
     * Maps a position in the original text to the edited text. An insertion exactly at {@code position} shifts it
     * only if {@code afterInsertions} is set; a position inside a replaced span maps into the replacement.
     */
    public static int adjust(List<SpanEdit> edits, int position, boolean afterInsertions) {
        var delta = 0;
        for (var edit : edits) {
            var old = edit.oldSpan;
            if (old.isEmpty()) {
                if (old.start < position || (afterInsertions && old.start == position)) {
                    delta += edit.newText.length();
                    continue;
                }
                if (old.start > position) break;
                continue;
            }
            if (old.end() <= position) {
                delta += edit.delta();
            } else if (old.start < position) {
                return old.start + delta + Math.min(position - old.start, edit.newText.length());
            } else {
                break;
            }
        }
        return position + delta;
    }

    /** Maps a position in the edited text back to the original text. */
    public static int unadjust(List<SpanEdit> edits, int position) {
        var delta = 0;
        for (var edit : edits) {
            var newStart = edit.oldSpan.start + delta;
            var newEnd = newStart + edit.newText.length();
            if (position < newStart) break;
            if (position < newEnd) {
                return edit.oldSpan.start + Math.min(position - newStart, edit.oldSpan.length);
            }
            delta += edit.delta();
        }
        return position - delta;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SpanEdit)) return false;
        var that = (SpanEdit) other;
        return this.oldSpan.equals(that.oldSpan) && this.newText.equals(that.newText) && this.kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(oldSpan, newText, kind);
    }

    @Override
    public String toString() {
        return String.format("%s %s -> `%s`", kind, oldSpan, newText);
    }
}
