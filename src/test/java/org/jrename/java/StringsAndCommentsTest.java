package org.jrename.java;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import org.jrename.workspace.TextSpan;
import org.junit.Test;

public class StringsAndCommentsTest {
    private static String text(String source, StringsAndComments.Region region) {
        return source.substring(region.span.start, region.span.end());
    }

    @Test
    public void lineAndBlockComments() {
        var source = "int a; // count\n/* total */ int b;";
        var regions = StringsAndComments.scan(source);
        assertThat(regions, hasSize(2));
        assertThat(regions.get(0).kind, equalTo(StringsAndComments.Kind.COMMENT));
        assertThat(text(source, regions.get(0)), equalTo("// count"));
        assertThat(text(source, regions.get(1)), equalTo("/* total */"));
    }

    @Test
    public void stringsWithEscapes() {
        var source = "var s = \"say \\\"count\\\"\" + x;";
        var regions = StringsAndComments.scan(source);
        assertThat(regions, hasSize(1));
        assertThat(regions.get(0).kind, equalTo(StringsAndComments.Kind.STRING));
        assertThat(text(source, regions.get(0)), equalTo("\"say \\\"count\\\"\""));
    }

    @Test
    public void commentMarkersInsideStringsAreText() {
        var source = "var url = \"http://example.com\"; // done";
        var regions = StringsAndComments.scan(source);
        assertThat(regions, hasSize(2));
        assertThat(text(source, regions.get(0)), equalTo("\"http://example.com\""));
        assertThat(text(source, regions.get(1)), equalTo("// done"));
    }

    @Test
    public void charLiteralsAreSkipped() {
        var source = "char q = '\"'; String s = \"count\";";
        var regions = StringsAndComments.scan(source);
        assertThat(regions, hasSize(1));
        assertThat(text(source, regions.get(0)), equalTo("\"count\""));
    }

    @Test
    public void textBlock() {
        var source = "var s = \"\"\"\n  count \"quoted\"\n  \"\"\";";
        var regions = StringsAndComments.scan(source);
        assertThat(regions, hasSize(1));
        assertThat(regions.get(0).span, equalTo(new TextSpan(8, source.length() - 9)));
    }

    @Test
    public void unterminatedCommentRunsToEnd() {
        var source = "int a; /* count";
        var regions = StringsAndComments.scan(source);
        assertThat(regions.get(0).span.end(), equalTo(source.length()));
    }
}
