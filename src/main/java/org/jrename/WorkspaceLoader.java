package org.jrename;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import org.jrename.workspace.ProjectId;
import org.jrename.workspace.Solution;

/** Reads the projects of a {@link RenameRequest} from disk. */
public class WorkspaceLoader {
    private static final Logger LOG = Logger.getLogger("main");

    private final Path base;

    public WorkspaceLoader(Path base) {
        this.base = base;
    }

    /**
     * Projects may be listed in any order. Documents are named by their path below the source root, so {@code
     * org/example/Shape.java} for {@code src/org/example/Shape.java}.
     */
    public Solution load(List<RenameRequest.ProjectConfig> projects) {
        var started = System.nanoTime();
        var builder = Solution.builder();
        var ids = new HashMap<String, ProjectId>();
        for (var project : projects) {
            var references = new ArrayList<ProjectId>();
            for (var name : project.references) {
                references.add(new ProjectId(name));
            }
            var id = builder.addProject(project.name, project.language, references.toArray(new ProjectId[0]));
            ids.put(project.name, id);
        }
        var count = 0;
        for (var project : projects) {
            for (var root : project.sourceRoots) {
                var rootPath = base.resolve(root).normalize();
                for (var file : javaFiles(rootPath)) {
                    var name = rootPath.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
                    builder.addDocument(ids.get(project.name), name, read(file), Optional.of(file.toAbsolutePath()));
                    count++;
                }
            }
        }
        var solution = builder.build();
        var elapsed = (System.nanoTime() - started) / 1_000_000;
        LOG.info(String.format("Loaded %d files in %d projects in %dms", count, projects.size(), elapsed));
        return solution;
    }

    private static List<Path> javaFiles(Path root) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException(String.format("Source root %s is not a directory", root));
        }
        try (var stream = Files.walk(root)) {
            return stream.filter(f -> f.getFileName().toString().endsWith(".java") && Files.isRegularFile(f))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }
}
