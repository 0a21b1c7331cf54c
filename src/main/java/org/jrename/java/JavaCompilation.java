package org.jrename.java;

import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.Tree;
import com.sun.source.util.JavacTask;
import com.sun.source.util.Trees;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import javax.lang.model.element.Element;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import javax.tools.JavaFileObject;
import org.jrename.semantics.Compilation;
import org.jrename.semantics.SymbolKey;
import org.jrename.semantics.SymbolLocation;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.ProjectId;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextSpan;

/** The result of compiling one project of a snapshot. Not thread-safe; javac trees are resolved lazily. */
class JavaCompilation implements Compilation {
    private static final Logger LOG = Logger.getLogger("main");

    final Solution solution;
    final ProjectId projectId;
    final JavacTask task;
    final Trees trees;
    final Elements elements;
    final Types types;
    final JavaSymbols symbols;

    private final Map<DocumentId, CompilationUnitTree> roots = new LinkedHashMap<>();
    private final Map<DocumentId, List<Diagnostic<? extends JavaFileObject>>> diagnostics = new HashMap<>();
    private final Map<DocumentId, List<NameToken>> tokens = new HashMap<>();
    private final Map<DocumentId, JavaSemanticModel> models = new HashMap<>();
    private Map<Element, SymbolLocation> declarations;
    private Map<Element, Integer> localOrdinals;

    JavaCompilation(
            Solution solution,
            ProjectId projectId,
            JavacTask task,
            List<DocumentFileObject> sources,
            List<CompilationUnitTree> parsed,
            List<Diagnostic<? extends JavaFileObject>> diagnostics) {
        this.solution = solution;
        this.projectId = projectId;
        this.task = task;
        this.trees = Trees.instance(task);
        this.elements = task.getElements();
        this.types = task.getTypes();
        this.symbols = new JavaSymbols(this);
        var byUri = new HashMap<URI, DocumentId>();
        for (var source : sources) {
            byUri.put(source.toUri(), source.document.id);
        }
        // javac may wrap our file objects, so match them by uri
        for (var root : parsed) {
            var id = byUri.get(root.getSourceFile().toUri());
            if (id != null) roots.put(id, root);
        }
        for (var d : diagnostics) {
            if (d.getSource() == null) continue;
            var id = byUri.get(d.getSource().toUri());
            if (id == null) continue;
            this.diagnostics.computeIfAbsent(id, k -> new ArrayList<>()).add(d);
        }
    }

    @Override
    public Solution solution() {
        return solution;
    }

    @Override
    public ProjectId projectId() {
        return projectId;
    }

    @Override
    public JavaSemanticModel semanticModel(DocumentId documentId) {
        var model = models.get(documentId);
        if (model == null) {
            model = new JavaSemanticModel(this, documentId, root(documentId), tokens(documentId));
            models.put(documentId, model);
        }
        return model;
    }

    Iterable<DocumentId> documentIds() {
        return roots.keySet();
    }

    CompilationUnitTree root(DocumentId documentId) {
        var root = roots.get(documentId);
        if (root == null) {
            throw new IllegalArgumentException(
                    String.format("%s is not part of the compilation of %s", documentId, projectId));
        }
        return root;
    }

    List<Diagnostic<? extends JavaFileObject>> diagnostics(DocumentId documentId) {
        return diagnostics.getOrDefault(documentId, List.of());
    }

    /** Every identifier of a document, sorted by position, at most one per span. */
    List<NameToken> tokens(DocumentId documentId) {
        var found = tokens.get(documentId);
        if (found != null) return found;
        var root = root(documentId);
        var all = new ArrayList<NameToken>();
        var text = solution.document(documentId).text;
        new NameTokenScanner(trees.getSourcePositions(), text).scan(root, all);
        Collections.sort(all);
        var unique = new ArrayList<NameToken>();
        for (var token : all) {
            if (!unique.isEmpty() && unique.get(unique.size() - 1).span.equals(token.span)) continue;
            unique.add(token);
        }
        tokens.put(documentId, unique);
        return unique;
    }

    /** Where an element is declared, if it is declared in the sources of this compilation. */
    Optional<SymbolLocation> declaration(Element element) {
        indexDeclarations();
        return Optional.ofNullable(declarations.get(element));
    }

    /** Which local of the same name and owner {@code element} is, counting in source order. */
    int localOrdinal(Element element) {
        indexDeclarations();
        return localOrdinals.getOrDefault(element, 0);
    }

    /** The element declared in source under {@code key}. */
    Optional<Element> findDeclared(SymbolKey key) {
        indexDeclarations();
        for (var element : declarations.keySet()) {
            if (symbols.key(element).equals(key)) return Optional.of(element);
        }
        return Optional.empty();
    }

    Map<Element, SymbolLocation> declarations() {
        indexDeclarations();
        return Collections.unmodifiableMap(declarations);
    }

    private void indexDeclarations() {
        if (declarations != null) return;
        var started = System.nanoTime();
        declarations = new HashMap<>();
        localOrdinals = new HashMap<>();
        var counts = new HashMap<String, Integer>();
        for (var documentId : roots.keySet()) {
            for (var token : tokens(documentId)) {
                if (!token.declaration) continue;
                var element = trees.getElement(token.path);
                if (element == null || declarations.containsKey(element)) continue;
                declarations.put(element, SymbolLocation.source(documentId, token.span));
                if (isLocalVariable(element)) {
                    var owner = symbols.key(element.getEnclosingElement()) + "/" + element.getSimpleName();
                    var ordinal = counts.getOrDefault(owner, 0);
                    counts.put(owner, ordinal + 1);
                    localOrdinals.put(element, ordinal);
                }
            }
        }
        var elapsed = (System.nanoTime() - started) / 1_000_000;
        LOG.fine(String.format("Indexed %d declarations of %s in %dms", declarations.size(), projectId, elapsed));
    }

    /** Locals and local classes, which are told apart by their order of declaration. */
    static boolean isLocalVariable(Element element) {
        switch (element.getKind()) {
            case LOCAL_VARIABLE:
            case EXCEPTION_PARAMETER:
            case RESOURCE_VARIABLE:
            case BINDING_VARIABLE:
                return true;
            default:
                return element instanceof TypeElement && ((TypeElement) element).getNestingKind() == NestingKind.LOCAL;
        }
    }

    /** The span of a whole tree of a document, or an empty span for generated trees. */
    TextSpan span(DocumentId documentId, Tree tree) {
        var pos = trees.getSourcePositions();
        var root = root(documentId);
        var start = (int) pos.getStartPosition(root, tree);
        var end = (int) pos.getEndPosition(root, tree);
        if (start == -1 || end == -1) return TextSpan.EMPTY;
        return TextSpan.fromBounds(start, end);
    }
}
