package org.jrename;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {
    private static final Path FIXTURE = Paths.get("./src/test/test-project/rename");

    @Rule public TemporaryFolder temp = new TemporaryFolder();

    private Path workspace;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @Before
    public void copyFixture() throws IOException {
        workspace = temp.getRoot().toPath();
        try (var files = Files.walk(FIXTURE)) {
            for (var file : files.collect(Collectors.toList())) {
                var target = workspace.resolve(FIXTURE.relativize(file).toString());
                if (Files.isDirectory(file)) Files.createDirectories(target);
                else Files.copy(file, target);
            }
        }
    }

    private int run(InputStream stdin, String... args) {
        return Main.run(args, stdin, new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        return run(new ByteArrayInputStream(new byte[0]), args);
    }

    private JsonObject response() {
        return JsonParser.parseString(output.toString(StandardCharsets.UTF_8)).getAsJsonObject();
    }

    private String read(String file) throws IOException {
        return Files.readString(workspace.resolve(file));
    }

    @Test
    public void printsResolvedRename() throws IOException {
        var code = run(workspace.resolve("request.json").toString());
        assertThat(code, equalTo(Main.OK));
        var response = response();
        assertTrue(response.get("success").getAsBoolean());
        assertThat(response.get("unresolvedConflicts").getAsInt(), equalTo(0));
        assertThat(response.getAsJsonArray("relatedLocations").size(), greaterThan(0));
        assertThat(response.getAsJsonObject("workspaceEdit").getAsJsonArray("documentChanges").size(), equalTo(2));
        // Nothing is written without --apply
        assertThat(read("app/src/app/Derived.java"), containsString("return value * scale;"));
    }

    @Test
    public void appliesResolvedRename() throws IOException {
        var code = run("--apply", workspace.resolve("request.json").toString());
        assertThat(code, equalTo(Main.OK));
        assertThat(read("lib/src/lib/Base.java"), containsString("protected int scale = 2;"));
        assertThat(read("app/src/app/Derived.java"), containsString("return super.scale * scale;"));
    }

    @Test
    public void readsRequestFromStdin() throws IOException {
        var prefix = "\"" + workspace.toAbsolutePath() + "/";
        var request =
                read("request.json").replace("\"lib/src", prefix + "lib/src").replace("\"app/src", prefix + "app/src");
        var stdin = new ByteArrayInputStream(request.getBytes(StandardCharsets.UTF_8));
        assertThat(run(stdin), equalTo(Main.OK));
        assertTrue(response().get("success").getAsBoolean());
    }

    @Test
    public void unresolvedConflictsAreNotApplied() throws IOException {
        // Derived already declares a field named offset
        var request =
                read("request.json")
                        .replace("lib/src/lib/Base.java", "app/src/app/Derived.java")
                        .replace("\"line\": 4", "\"line\": 6")
                        .replace("\"column\": 19", "\"column\": 9")
                        .replace("\"scale\"", "\"offset\"");
        Files.writeString(workspace.resolve("clash.json"), request);
        var before = read("app/src/app/Derived.java");
        var code = run("--apply", workspace.resolve("clash.json").toString());
        assertThat(code, equalTo(Main.UNRESOLVED_CONFLICTS));
        assertThat(response().get("unresolvedConflicts").getAsInt(), greaterThan(0));
        assertThat(read("app/src/app/Derived.java"), equalTo(before));
    }

    @Test
    public void nothingToRename() throws IOException {
        var request = read("request.json").replace("\"column\": 19", "\"column\": 1");
        Files.writeString(workspace.resolve("blank.json"), request);
        var code = run(workspace.resolve("blank.json").toString());
        assertThat(code, equalTo(Main.FAILED));
        assertFalse(response().get("success").getAsBoolean());
        assertThat(response().get("error").getAsString(), containsString("Nothing to rename"));
    }

    @Test
    public void missingRequestFile() {
        var code = run(workspace.resolve("missing.json").toString());
        assertThat(code, equalTo(Main.FAILED));
        assertFalse(response().get("success").getAsBoolean());
    }

    @Test
    public void tooManyArguments() {
        assertThat(run("a.json", "b.json"), equalTo(Main.FAILED));
    }
}
