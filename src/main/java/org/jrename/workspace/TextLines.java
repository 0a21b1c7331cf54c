package org.jrename.workspace;

import java.util.Arrays;
import org.eclipse.lsp4j.Position;

/** Converts between character offsets and zero-based line/column positions. */
public class TextLines {
    private final int[] lineStarts;
    private final int length;

    public TextLines(CharSequence text) {
        var starts = new int[16];
        var count = 0;
        starts[count++] = 0;
        for (var i = 0; i < text.length(); i++) {
            var c = text.charAt(i);
            var newline = c == '\n' || (c == '\r' && (i + 1 == text.length() || text.charAt(i + 1) != '\n'));
            if (!newline) continue;
            if (count == starts.length) starts = Arrays.copyOf(starts, count * 2);
            starts[count++] = i + 1;
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.length = text.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public Position position(int offset) {
        if (offset < 0 || offset > length) {
            throw new IllegalArgumentException(String.format("Offset %d is outside 0..%d", offset, length));
        }
        var line = Arrays.binarySearch(lineStarts, offset);
        if (line < 0) line = -line - 2;
        return new Position(line, offset - lineStarts[line]);
    }

    public int offset(int line, int column) {
        if (line < 0 || line >= lineStarts.length) {
            throw new IllegalArgumentException(String.format("Line %d is outside 0..%d", line, lineStarts.length - 1));
        }
        var end = line + 1 < lineStarts.length ? lineStarts[line + 1] : length;
        return Math.min(lineStarts[line] + column, end);
    }

    public int offset(Position position) {
        return offset(position.getLine(), position.getCharacter());
    }
}
