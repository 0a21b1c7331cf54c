package org.jrename.java;

import com.google.common.base.Splitter;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.util.JavacTask;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import javax.tools.Diagnostic;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.ToolProvider;
import org.jrename.semantics.Compilation;
import org.jrename.semantics.SemanticService;
import org.jrename.workspace.ProjectId;
import org.jrename.workspace.Solution;

/**
 * Compiles one project of a snapshot, together with the sources of every project it references. The last few
 * compilations are cached, since a rename session asks for the same snapshot many times.
 */
public class JavaCompilerService implements SemanticService {
    private static final Logger LOG = Logger.getLogger("main");
    private static final int CACHE_SIZE = 8;

    private final JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    private final List<String> extraOptions;
    private final Map<CompileKey, JavaCompilation> cache =
            new LinkedHashMap<>(CACHE_SIZE, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<CompileKey, JavaCompilation> eldest) {
                    return size() > CACHE_SIZE;
                }
            };

    public JavaCompilerService() {
        this(javacOptionsFromSystemProperty());
    }

    public JavaCompilerService(List<String> extraOptions) {
        if (compiler == null) {
            throw new IllegalStateException("No system Java compiler, run on a JDK");
        }
        this.extraOptions = List.copyOf(extraOptions);
    }

    /** Options from {@code -Djrename.javacOptions="..."}, split on whitespace. */
    static List<String> javacOptionsFromSystemProperty() {
        var property = System.getProperty("jrename.javacOptions", "");
        return Splitter.onPattern("\\s+").omitEmptyStrings().splitToList(property);
    }

    @Override
    public synchronized Compilation compile(Solution solution, ProjectId projectId) {
        return compilation(solution, projectId);
    }

    synchronized JavaCompilation compilation(Solution solution, ProjectId projectId) {
        var key = new CompileKey(solution, projectId);
        var found = cache.get(key);
        if (found != null) return found;
        var compiled = doCompile(solution, projectId);
        cache.put(key, compiled);
        return compiled;
    }

    private JavaCompilation doCompile(Solution solution, ProjectId projectId) {
        var started = System.nanoTime();
        var sources = new ArrayList<DocumentFileObject>();
        for (var id : solution.dependencyGraph().projectAndTransitiveDependencies(projectId)) {
            for (var document : solution.documents(id)) {
                sources.add(new DocumentFileObject(document));
            }
        }
        var diagnostics = new ArrayList<Diagnostic<? extends JavaFileObject>>();
        var task = (JavacTask) compiler.getTask(null, null, diagnostics::add, options(), List.of(), sources);
        var roots = new ArrayList<CompilationUnitTree>();
        try {
            for (var root : task.parse()) {
                roots.add(root);
            }
            // Errors are expected in the middle of a rename, Trees still has the elements
            task.analyze();
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        var elapsed = (System.nanoTime() - started) / 1_000_000;
        LOG.fine(
                String.format(
                        "Compiled %s (%d files, %d diagnostics) in %dms",
                        projectId, sources.size(), diagnostics.size(), elapsed));
        return new JavaCompilation(solution, projectId, task, sources, roots, diagnostics);
    }

    private List<String> options() {
        var list = new ArrayList<String>();
        Collections.addAll(list, "-proc:none");
        Collections.addAll(list, "-XDshould-stop.ifError=FLOW");
        Collections.addAll(list, "-Xmaxerrs", "10000");
        list.addAll(extraOptions);
        return list;
    }

    /** Snapshots are compared by identity, projects by id. */
    private static final class CompileKey {
        final Solution solution;
        final ProjectId projectId;

        CompileKey(Solution solution, ProjectId projectId) {
            this.solution = solution;
            this.projectId = projectId;
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof CompileKey)) return false;
            var that = (CompileKey) other;
            return this.solution == that.solution && this.projectId.equals(that.projectId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(solution), projectId);
        }
    }
}
