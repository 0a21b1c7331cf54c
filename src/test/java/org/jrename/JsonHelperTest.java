package org.jrename;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import org.jrename.rename.RenameOptions;
import org.jrename.semantics.SymbolKey;
import org.junit.Test;

public class JsonHelperTest {
    @Test
    public void symbolKeyIsAString() {
        var json = JsonHelper.GSON.toJson(new SymbolKey("lib/Shape#area()"));
        assertThat(json, equalTo("\"lib/Shape#area()\""));
        assertThat(JsonHelper.GSON.fromJson(json, SymbolKey.class), equalTo(new SymbolKey("lib/Shape#area()")));
    }

    @Test
    public void parseOptions() {
        var options =
                JsonHelper.GSON.fromJson(
                        "{\"renameInComments\": true, \"nonConflictSymbols\": [\"demo/Loop#j\"]}", RenameOptions.class);
        assertTrue(options.renameInComments);
        assertFalse(options.renameInStrings);
        assertThat(options.nonConflictSymbols, contains(new SymbolKey("demo/Loop#j")));
    }

    @Test
    public void requestDefaults() {
        var request =
                JsonHelper.GSON.fromJson(
                        "{\"projects\": [{\"name\": \"main\", \"sourceRoots\": [\"src\"]}], \"file\": \"src/A.java\","
                                + " \"line\": 3, \"column\": 5, \"newName\": \"b\"}",
                        RenameRequest.class);
        assertThat(request.projects, hasSize(1));
        assertThat(request.projects.get(0).language, equalTo("java"));
        assertThat(request.projects.get(0).references, empty());
        assertThat(request.line, equalTo(3));
        assertFalse(request.options.renameFile);
    }

    @Test
    public void failedResponse() {
        var json = JsonHelper.GSON.toJson(RenameResponse.failed("Nothing to rename"));
        assertThat(json, containsString("\"success\": false"));
        assertThat(json, containsString("\"error\": \"Nothing to rename\""));
    }
}
