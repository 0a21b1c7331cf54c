package org.jrename;

import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jrename.conflicts.ConflictResolution;
import org.jrename.java.JavaLanguage;
import org.jrename.rename.CancellationToken;
import org.jrename.rename.LanguageServicesRegistry;
import org.jrename.workspace.TextLines;

/**
 * {@code java org.jrename.Main [--apply] [request.json]}. Reads the request from stdin when no file is given, and
 * prints a {@link RenameResponse}.
 *
 * <p>Exits with 0 when the rename is clean, 2 when conflicts remain unresolved and 1 when it failed.
 */
public class Main {
    private static final Logger LOG = Logger.getLogger("main");

    static final int OK = 0, FAILED = 1, UNRESOLVED_CONFLICTS = 2;

    public static void setRootFormat() {
        var root = Logger.getLogger("");

        for (var h : root.getHandlers()) h.setFormatter(new LogFormat());
    }

    public static void main(String[] args) {
        setRootFormat();
        System.exit(run(args, System.in, System.out));
    }

    static int run(String[] args, InputStream stdin, PrintStream out) {
        var apply = false;
        var files = new ArrayList<String>();
        for (var arg : args) {
            if (arg.equals("--apply")) apply = true;
            else files.add(arg);
        }
        try {
            if (files.size() > 1) {
                throw new IllegalArgumentException("Expected at most one request file, got " + files);
            }
            RenameRequest request;
            Path base;
            if (files.isEmpty()) {
                request = read(new InputStreamReader(stdin, StandardCharsets.UTF_8));
                base = Paths.get("").toAbsolutePath();
            } else {
                var file = Paths.get(files.get(0)).toAbsolutePath();
                try (var reader = Files.newBufferedReader(file)) {
                    request = read(reader);
                }
                base = file.getParent();
            }
            var resolution = rename(request, base);
            out.println(JsonHelper.GSON.toJson(RenameResponse.of(resolution)));
            if (!resolution.isSuccessful()) return FAILED;
            var unresolved = resolution.unresolvedConflictCount();
            if (unresolved > 0) {
                if (apply) LOG.warning(String.format("Not applying a rename with %d unresolved conflicts", unresolved));
                return UNRESOLVED_CONFLICTS;
            }
            if (apply) apply(resolution);
            return OK;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, e.getMessage(), e);
            out.println(JsonHelper.GSON.toJson(RenameResponse.failed(e.toString())));
            return FAILED;
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e.getMessage(), e);
            out.println(JsonHelper.GSON.toJson(RenameResponse.failed(String.valueOf(e.getMessage()))));
            return FAILED;
        }
    }

    private static RenameRequest read(Reader reader) {
        var request = JsonHelper.GSON.fromJson(reader, RenameRequest.class);
        if (request == null) throw new JsonParseException("Empty request");
        if (request.file == null || request.newName == null) {
            throw new IllegalArgumentException("Request needs `file`, `line`, `column` and `newName`");
        }
        return request;
    }

    static ConflictResolution rename(RenameRequest request, Path base) {
        var solution = new WorkspaceLoader(base).load(request.projects);
        var path = base.resolve(request.file).toAbsolutePath().normalize();
        var document = solution.findDocumentByPath(path);
        if (document.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s is not in any project", path));
        }
        var text = document.get().text;
        var offset = new TextLines(text).offset(request.line - 1, request.column - 1);
        var provider = new RenameProvider(new LanguageServicesRegistry(JavaLanguage.create()));
        return provider.rename(
                solution, document.get().id, offset, request.newName, request.options, CancellationToken.NONE);
    }

    /** Writes the new texts, then moves renamed files. */
    static void apply(ConflictResolution resolution) throws IOException {
        var oldSolution = resolution.oldSolution();
        var newSolution = resolution.newSolution();
        for (var id : resolution.documentIds()) {
            var old = oldSolution.document(id);
            var changed = newSolution.document(id);
            if (old.filePath.isEmpty()) {
                LOG.warning(String.format("%s has no file, skipping it", old.name));
                continue;
            }
            var file = old.filePath.get();
            if (!old.text.equals(changed.text)) {
                Files.writeString(file, changed.text);
            }
            if (!old.name.equals(changed.name)) {
                Files.move(file, changed.filePath.get());
            }
            LOG.info(String.format("Wrote %s", changed.filePath.get()));
        }
    }
}
