package org.jrename.java;

import com.google.common.collect.ImmutableSet;
import com.sun.source.tree.EnhancedForLoopTree;
import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.TryTree;
import com.sun.source.util.TreePath;
import com.sun.source.util.TreePathScanner;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.ExecutableType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import org.jrename.rename.CancellationToken;
import org.jrename.rename.RenameLocation;
import org.jrename.rename.RenameLocationFinder;
import org.jrename.rename.RenameOptions;
import org.jrename.rename.SymbolicRenameLocations;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.StringSearch;
import org.jrename.semantics.SymbolKey;
import org.jrename.semantics.SymbolKind;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.ProjectId;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextSpan;

/**
 * Finds the occurrences of a symbol by compiling every project that can see it and comparing the symbol each
 * identifier binds to. Renaming a method also renames the source methods it overrides or is overridden by; renaming
 * a type also renames its constructors.
 */
public class JavaRenameLocationFinder implements RenameLocationFinder {
    private static final Logger LOG = Logger.getLogger("main");
    static final Set<String> IMPLICITLY_CALLED = ImmutableSet.of("iterator", "close", "hasNext", "next");

    private final JavaCompilerService compiler;

    public JavaRenameLocationFinder(JavaCompilerService compiler) {
        this.compiler = compiler;
    }

    @Override
    public SymbolicRenameLocations findRenameLocations(
            Solution solution, RenameSymbol symbol, RenameOptions options, CancellationToken cancellationToken) {
        var started = System.nanoTime();
        var projects = projectsInScope(solution, symbol);
        var keys = new LinkedHashSet<SymbolKey>();
        keys.add(symbol.key);
        var referencedSymbols = new LinkedHashMap<SymbolKey, RenameSymbol>();
        referencedSymbols.put(symbol.key, symbol);
        var locations = new LinkedHashSet<RenameLocation>();
        var implicitLocations = new LinkedHashSet<RenameLocation>();
        for (var projectId : projects) {
            cancellationToken.throwIfCancellationRequested();
            var compilation = compiler.compilation(solution, projectId);
            if (symbol.kind == SymbolKind.METHOD) {
                cascadeOverrides(compilation, keys, referencedSymbols);
            }
            for (var document : solution.documents(projectId)) {
                var model = compilation.semanticModel(document.id);
                for (var token : model.tokens) {
                    if (!token.name.equals(symbol.name)) continue;
                    var bound = model.symbols(token);
                    if (bound.size() != 1) continue;
                    if (!isReferenceTo(symbol, keys, bound.get(0))) continue;
                    if (token.declaration) {
                        locations.add(RenameLocation.declaration(document.id, token.span));
                    } else {
                        locations.add(RenameLocation.reference(document.id, token.span));
                    }
                }
                if (symbol.kind == SymbolKind.METHOD && IMPLICITLY_CALLED.contains(symbol.name)) {
                    implicitLocations.addAll(findImplicitCalls(compilation, document.id, keys));
                }
            }
        }
        var result =
                new SymbolicRenameLocations(
                        solution,
                        symbol,
                        options,
                        sorted(locations),
                        sorted(implicitLocations),
                        new ArrayList<>(referencedSymbols.values()));
        if (options.renameInStrings || options.renameInComments) {
            var inText = new ArrayList<>(result.locations);
            for (var documentId : documentsAffectedByRename(solution, result)) {
                cancellationToken.throwIfCancellationRequested();
                inText.addAll(findInStringsAndComments(solution, documentId, symbol.name, options));
            }
            result =
                    new SymbolicRenameLocations(
                            solution,
                            symbol,
                            options,
                            sorted(inText),
                            result.implicitLocations,
                            result.referencedSymbols);
        }
        var elapsed = (System.nanoTime() - started) / 1_000_000;
        LOG.info(
                String.format(
                        "Found %d locations of %s in %d projects in %dms",
                        result.locations.size(), symbol, projects.size(), elapsed));
        return result;
    }

    @Override
    public Set<DocumentId> documentsAffectedByRename(Solution solution, SymbolicRenameLocations locations) {
        var symbol = locations.symbol;
        var result = new LinkedHashSet<DocumentId>();
        if (symbol.kind.isLocal() || symbol.isPrivate) {
            for (var location : symbol.locations) {
                if (location.isInSource()) result.add(location.documentId.get());
            }
            for (var location : locations.locations) {
                result.add(location.documentId);
            }
            return result;
        }
        for (var projectId : projectsInScope(solution, symbol)) {
            for (var document : solution.documents(projectId)) {
                result.add(document.id);
            }
        }
        return result;
    }

    private List<ProjectId> projectsInScope(Solution solution, RenameSymbol symbol) {
        var declaringProject = symbol.firstSourceLocation().get().documentId.get().projectId;
        if (symbol.kind.isLocal() || symbol.isPrivate) return List.of(declaringProject);
        var graph = solution.dependencyGraph();
        var dependents = graph.projectAndTransitiveDependents(declaringProject);
        var result = new ArrayList<ProjectId>();
        for (var projectId : graph.topologicallySortedProjects()) {
            if (dependents.contains(projectId)) result.add(projectId);
        }
        return result;
    }

    private boolean isReferenceTo(RenameSymbol symbol, Set<SymbolKey> keys, RenameSymbol bound) {
        if (keys.contains(bound.key)) return true;
        // Constructors are named after their type
        return symbol.kind == SymbolKind.TYPE
                && bound.kind == SymbolKind.CONSTRUCTOR
                && bound.containingSymbol.isPresent()
                && bound.containingSymbol.get().equals(symbol.key);
    }

    /** Adds source methods that override, or are overridden by, any method in {@code keys}, until none is left. */
    private void cascadeOverrides(
            JavaCompilation compilation, Set<SymbolKey> keys, Map<SymbolKey, RenameSymbol> referencedSymbols) {
        var methods = new ArrayList<ExecutableElement>();
        for (var element : compilation.declarations().keySet()) {
            if (element.getKind() == ElementKind.METHOD) methods.add((ExecutableElement) element);
        }
        var changed = true;
        while (changed) {
            changed = false;
            for (var candidate : methods) {
                var candidateKey = compilation.symbols.key(candidate);
                if (keys.contains(candidateKey)) continue;
                for (var other : methods) {
                    if (!keys.contains(compilation.symbols.key(other))) continue;
                    if (overrides(compilation, candidate, other) || overrides(compilation, other, candidate)) {
                        keys.add(candidateKey);
                        referencedSymbols.put(candidateKey, compilation.symbols.symbol(candidate));
                        LOG.fine(String.format("...%s is renamed along with %s", candidateKey, other));
                        changed = true;
                        break;
                    }
                }
            }
        }
    }

    private static boolean overrides(JavaCompilation compilation, ExecutableElement method, ExecutableElement base) {
        if (!method.getSimpleName().contentEquals(base.getSimpleName())) return false;
        if (!(method.getEnclosingElement() instanceof TypeElement)) return false;
        return compilation.elements.overrides(method, base, (TypeElement) method.getEnclosingElement());
    }

    /** Enhanced {@code for} statements and {@code try} resources that call one of {@code keys} without naming it. */
    private List<RenameLocation> findImplicitCalls(
            JavaCompilation compilation, DocumentId documentId, Set<SymbolKey> keys) {
        var found = new ArrayList<RenameLocation>();
        new TreePathScanner<Void, Void>() {
            @Override
            public Void visitEnhancedForLoop(EnhancedForLoopTree t, Void nothing) {
                var expression = new TreePath(getCurrentPath(), t.getExpression());
                var type = compilation.trees.getTypeMirror(expression);
                var iterator = member(compilation, type, "iterator");
                if (iterator != null) {
                    var iteratorType = ((ExecutableType) compilation.types.asMemberOf((DeclaredType) type, iterator))
                            .getReturnType();
                    if (calls(compilation, keys, iterator)
                            || calls(compilation, keys, member(compilation, iteratorType, "hasNext"))
                            || calls(compilation, keys, member(compilation, iteratorType, "next"))) {
                        add(t.getExpression());
                    }
                }
                return super.visitEnhancedForLoop(t, nothing);
            }

            @Override
            public Void visitTry(TryTree t, Void nothing) {
                for (var resource : t.getResources()) {
                    var type = compilation.trees.getTypeMirror(new TreePath(getCurrentPath(), resource));
                    if (calls(compilation, keys, member(compilation, type, "close"))) {
                        add(resource);
                    }
                }
                return super.visitTry(t, nothing);
            }

            private void add(Tree tree) {
                var span = compilation.span(documentId, tree);
                if (!span.isEmpty()) found.add(RenameLocation.reference(documentId, span));
            }
        }.scan(compilation.root(documentId), null);
        return found;
    }

    private static boolean calls(JavaCompilation compilation, Set<SymbolKey> keys, ExecutableElement method) {
        return method != null && keys.contains(compilation.symbols.key(method));
    }

    /** The zero-parameter method {@code name} of {@code type}, inherited or declared. */
    private static ExecutableElement member(JavaCompilation compilation, TypeMirror type, String name) {
        if (type == null || type.getKind() != TypeKind.DECLARED) return null;
        var element = (TypeElement) ((DeclaredType) type).asElement();
        for (var method : ElementFilter.methodsIn(compilation.elements.getAllMembers(element))) {
            if (method.getSimpleName().contentEquals(name) && method.getParameters().isEmpty()) return method;
        }
        return null;
    }

    private List<RenameLocation> findInStringsAndComments(
            Solution solution, DocumentId documentId, String name, RenameOptions options) {
        var text = solution.document(documentId).text;
        var result = new ArrayList<RenameLocation>();
        if (!StringSearch.containsWord(text, name)) return result;
        var search = new StringSearch(name);
        for (var region : StringsAndComments.scan(text)) {
            if (region.kind == StringsAndComments.Kind.STRING && !options.renameInStrings) continue;
            if (region.kind == StringsAndComments.Kind.COMMENT && !options.renameInComments) continue;
            var content = text.subSequence(0, region.span.end());
            var at = search.nextWord(content, region.span.start);
            while (at != -1) {
                var span = new TextSpan(at, name.length());
                result.add(RenameLocation.stringOrComment(documentId, span, region.span));
                at = search.nextWord(content, at + name.length());
            }
        }
        return result;
    }

    /** Distinct locations, by document and then position. */
    private static List<RenameLocation> sorted(Collection<RenameLocation> locations) {
        var list = new ArrayList<>(new LinkedHashSet<>(locations));
        list.sort(LOCATION_ORDER);
        return list;
    }

    private static final Comparator<RenameLocation> LOCATION_ORDER =
            Comparator.<RenameLocation, String>comparing(l -> l.documentId.projectId.name)
                    .thenComparing(l -> l.documentId.key)
                    .thenComparing(l -> l.span);
}
