package org.jrename.java;

import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.MethodInvocationTree;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeKind;
import javax.lang.model.util.ElementFilter;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SemanticModel;
import org.jrename.workspace.DocumentId;

/** Symbol lookups in one document of a {@link JavaCompilation}. */
class JavaSemanticModel implements SemanticModel {
    private static final String AMBIGUOUS = "compiler.err.ref.ambiguous";
    private static final String CANT_RESOLVE = "compiler.err.cant.resolve";

    final JavaCompilation compilation;
    final DocumentId documentId;
    final CompilationUnitTree root;
    final List<NameToken> tokens;

    JavaSemanticModel(
            JavaCompilation compilation, DocumentId documentId, CompilationUnitTree root, List<NameToken> tokens) {
        this.compilation = compilation;
        this.documentId = documentId;
        this.root = root;
        this.tokens = tokens;
    }

    @Override
    public DocumentId documentId() {
        return documentId;
    }

    @Override
    public List<RenameSymbol> symbolsTouching(int position) {
        var token = tokenAt(position);
        if (token.isEmpty()) return List.of();
        return symbols(token.get());
    }

    /** The method name of an invocation is bound to the overload the invocation selected. */
    @Override
    public List<RenameSymbol> symbolsForEnclosingInvocation(int position) {
        return symbolsTouching(position);
    }

    @Override
    public Optional<RenameSymbol> symbolAt(int position) {
        var token = tokenAt(position);
        if (token.isEmpty()) return Optional.empty();
        var element = element(token.get());
        if (element.isEmpty()) return Optional.empty();
        // A constructor is renamed by renaming its class
        if (element.get().getKind() == ElementKind.CONSTRUCTOR) {
            return Optional.of(compilation.symbols.symbol(element.get().getEnclosingElement()));
        }
        return Optional.of(compilation.symbols.symbol(element.get()));
    }

    /** The token that contains {@code position}, or else the one that ends there. */
    Optional<NameToken> tokenAt(int position) {
        NameToken endsAt = null;
        for (var token : tokens) {
            if (token.span.start > position) break;
            if (token.span.contains(position)) return Optional.of(token);
            if (token.span.end() == position) endsAt = token;
        }
        return Optional.ofNullable(endsAt);
    }

    /** The element a token names, unless it did not resolve. */
    Optional<Element> element(NameToken token) {
        var element = compilation.trees.getElement(token.path);
        if (element == null || isUnresolved(token, element)) return Optional.empty();
        return Optional.of(element);
    }

    /** Everything a token may be bound to: nothing if unresolved, several candidates if ambiguous. */
    List<RenameSymbol> symbols(NameToken token) {
        var element = compilation.trees.getElement(token.path);
        if (element == null) return List.of();
        if (isAmbiguous(token)) {
            var arguments = -1;
            if (token.invocation) {
                var invocation = (MethodInvocationTree) token.path.getParentPath().getLeaf();
                arguments = invocation.getArguments().size();
            }
            return toSymbols(ambiguousCandidates(element, arguments));
        }
        if (isUnresolved(token, element)) return List.of();
        return List.of(compilation.symbols.symbol(element));
    }

    private List<RenameSymbol> toSymbols(List<? extends Element> elements) {
        var result = new ArrayList<RenameSymbol>();
        for (var e : elements) {
            result.add(compilation.symbols.symbol(e));
        }
        result.sort(Comparator.comparing(s -> s.key.toString()));
        return result;
    }

    /** Same-named methods of the type javac picked the first candidate from. */
    private List<Element> ambiguousCandidates(Element element, int arguments) {
        if (!(element instanceof ExecutableElement) || !(element.getEnclosingElement() instanceof TypeElement)) {
            return List.of(element);
        }
        var owner = (TypeElement) element.getEnclosingElement();
        var result = new ArrayList<Element>();
        for (var method : ElementFilter.methodsIn(compilation.elements.getAllMembers(owner))) {
            if (!method.getSimpleName().contentEquals(element.getSimpleName())) continue;
            if (arguments != -1 && method.getParameters().size() != arguments && !method.isVarArgs()) continue;
            result.add(method);
        }
        return result;
    }

    private boolean isAmbiguous(NameToken token) {
        return hasDiagnosticAt(token, AMBIGUOUS);
    }

    private boolean isUnresolved(NameToken token, Element element) {
        if (element instanceof TypeElement && element.asType().getKind() == TypeKind.ERROR) return true;
        return hasDiagnosticAt(token, CANT_RESOLVE);
    }

    private boolean hasDiagnosticAt(NameToken token, String codePrefix) {
        for (var d : compilation.diagnostics(documentId)) {
            if (!d.getCode().startsWith(codePrefix)) continue;
            if (d.getEndPosition() == token.span.end() && d.getStartPosition() <= token.span.start) return true;
        }
        return false;
    }
}
