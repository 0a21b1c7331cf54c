package org.jrename.java;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Parameterizable;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.ExecutableType;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SymbolLocation;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/** Declarations that clash with a renamed symbol in the renamed snapshot. */
class JavaDeclarationConflicts {
    private static final String ALREADY_DEFINED = "compiler.err.already.defined";

    private final JavaCompilation compilation;
    private final JavaCompilation original;

    /**
     * @param compilation the project compiled after the rename
     * @param original the same project compiled before the rename
     */
    JavaDeclarationConflicts(JavaCompilation compilation, JavaCompilation original) {
        this.compilation = compilation;
        this.original = original;
    }

    /**
     * The declarations named {@code replacementText} that collide with {@code renamed}, followed by the declaration
     * of {@code renamed} itself. Empty if nothing collides.
     */
    List<SymbolLocation> find(RenameSymbol renamed, String replacementText) {
        var declaration = renamed.firstSourceLocation();
        if (declaration.isEmpty()) return List.of();
        var found = elementAt(declaration.get());
        if (found.isEmpty()) return List.of();
        var element = found.get();
        var clashes = new LinkedHashSet<SymbolLocation>();
        var changesDispatch = false;
        switch (renamed.kind) {
            case FIELD:
                fields(element, replacementText, clashes);
                break;
            case METHOD:
                methods((ExecutableElement) element, replacementText, clashes);
                changesDispatch = newOverrides((ExecutableElement) element, replacementText, clashes);
                break;
            case TYPE:
                types((TypeElement) element, replacementText, clashes);
                break;
            case TYPE_PARAMETER:
                typeParameters(element, replacementText, clashes);
                break;
            default:
                break;
        }
        alreadyDefined(element, replacementText, clashes);
        if (clashes.isEmpty() && !changesDispatch) return List.of();
        clashes.add(declaration.get());
        return new ArrayList<>(clashes);
    }

    // Duplicates share a key, so the declaration is found by position
    private Optional<Element> elementAt(SymbolLocation location) {
        var documentId = location.documentId.get();
        var token = compilation.semanticModel(documentId).tokenAt(location.span.start);
        if (token.isEmpty() || !token.get().declaration) return Optional.empty();
        return Optional.ofNullable(compilation.trees.getElement(token.get().path));
    }

    private void fields(Element field, String name, Set<SymbolLocation> clashes) {
        for (var member : field.getEnclosingElement().getEnclosedElements()) {
            if (member.equals(field) || !member.getSimpleName().contentEquals(name)) continue;
            var kind = member.getKind();
            if (kind == ElementKind.FIELD || kind == ElementKind.ENUM_CONSTANT) addDeclaration(member, clashes);
        }
    }

    /** Methods of the same class whose signature is override-equivalent. */
    private void methods(ExecutableElement method, String name, Set<SymbolLocation> clashes) {
        var types = compilation.types;
        for (var other : ElementFilter.methodsIn(method.getEnclosingElement().getEnclosedElements())) {
            if (other.equals(method) || !other.getSimpleName().contentEquals(name)) continue;
            var a = (ExecutableType) method.asType();
            var b = (ExecutableType) other.asType();
            if (types.isSubsignature(a, b) || types.isSubsignature(b, a)) addDeclaration(other, clashes);
        }
    }

    /**
     * Methods that override {@code method}, or that {@code method} overrides, only because of the new name. Java
     * overrides by name and signature, so such a rename changes which method a call runs. Returns whether there is
     * one, even if it is declared outside the sources.
     */
    private boolean newOverrides(ExecutableElement method, String name, Set<SymbolLocation> clashes) {
        var owner = (TypeElement) method.getEnclosingElement();
        var found = false;
        for (var supertype : supertypes(compilation, owner)) {
            for (var other : ElementFilter.methodsIn(supertype.getEnclosedElements())) {
                if (!other.getSimpleName().contentEquals(name) || !existedBefore(other)) continue;
                if (!compilation.elements.overrides(method, other, owner)) continue;
                addDeclaration(other, clashes);
                found = true;
            }
        }
        for (var element : compilation.declarations().keySet()) {
            if (!(element instanceof ExecutableElement) || !element.getSimpleName().contentEquals(name)) continue;
            if (!(element.getEnclosingElement() instanceof TypeElement)) continue;
            var subtype = (TypeElement) element.getEnclosingElement();
            if (subtype.equals(owner) || !existedBefore(element)) continue;
            if (!compilation.elements.overrides((ExecutableElement) element, method, subtype)) continue;
            addDeclaration(element, clashes);
            found = true;
        }
        return found;
    }

    /** Every class and interface {@code type} extends or implements, directly or not. */
    static Set<TypeElement> supertypes(JavaCompilation compilation, TypeElement type) {
        var result = new LinkedHashSet<TypeElement>();
        var pending = new ArrayList<TypeMirror>(compilation.types.directSupertypes(type.asType()));
        while (!pending.isEmpty()) {
            var next = compilation.types.asElement(pending.remove(pending.size() - 1));
            if (!(next instanceof TypeElement) || !result.add((TypeElement) next)) continue;
            pending.addAll(compilation.types.directSupertypes(next.asType()));
        }
        return result;
    }

    /** Whether a method had its current name before the rename. Methods outside the sources are never renamed. */
    private boolean existedBefore(Element method) {
        if (compilation.declaration(method).isEmpty()) return true;
        return original.findDeclared(compilation.symbols.key(method)).isPresent();
    }

    /** Types of the same package or enclosing type, and enclosing types, with the new name. */
    private void types(TypeElement type, String name, Set<SymbolLocation> clashes) {
        Element container = type.getEnclosingElement();
        switch (type.getNestingKind()) {
            case TOP_LEVEL:
                container = compilation.elements.getPackageOf(type);
                break;
            case LOCAL:
                for (var e = type.getEnclosingElement(); e != null; e = e.getEnclosingElement()) {
                    if (e instanceof TypeElement && e.getSimpleName().contentEquals(name)) addDeclaration(e, clashes);
                }
                return;
            case ANONYMOUS:
                return;
            default:
                break;
        }
        for (var sibling : ElementFilter.typesIn(container.getEnclosedElements())) {
            if (!sibling.equals(type) && sibling.getSimpleName().contentEquals(name)) addDeclaration(sibling, clashes);
        }
        for (var e = type.getEnclosingElement(); e instanceof TypeElement; e = e.getEnclosingElement()) {
            if (e.getSimpleName().contentEquals(name)) addDeclaration(e, clashes);
        }
    }

    private void typeParameters(Element parameter, String name, Set<SymbolLocation> clashes) {
        var owner = parameter.getEnclosingElement();
        if (!(owner instanceof Parameterizable)) return;
        for (var other : ((Parameterizable) owner).getTypeParameters()) {
            if (!other.equals(parameter) && other.getSimpleName().contentEquals(name)) addDeclaration(other, clashes);
        }
    }

    /**
     * Declarations named {@code name} that javac reports as already defined, in the method around {@code element} or,
     * for members, anywhere in its document.
     */
    private void alreadyDefined(Element element, String name, Set<SymbolLocation> clashes) {
        var location = compilation.declaration(element);
        if (location.isEmpty()) return;
        var documentId = location.get().documentId.get();
        var scope = enclosingMethodSpan(documentId, element);
        for (var d : compilation.diagnostics(documentId)) {
            if (!d.getCode().equals(ALREADY_DEFINED)) continue;
            if (scope.isPresent() && !scope.get().contains((int) d.getPosition())) continue;
            for (var token : compilation.tokens(documentId)) {
                if (!token.declaration || !token.name.equals(name)) continue;
                if (token.span.start < d.getStartPosition() || token.span.end() > d.getEndPosition()) continue;
                clashes.add(SymbolLocation.source(documentId, token.span));
            }
        }
    }

    private Optional<TextSpan> enclosingMethodSpan(DocumentId documentId, Element element) {
        for (var e = element.getEnclosingElement(); e != null; e = e.getEnclosingElement()) {
            if (!(e instanceof ExecutableElement)) continue;
            var path = compilation.trees.getPath(e);
            if (path == null) return Optional.empty();
            return Optional.of(compilation.span(documentId, path.getLeaf()));
        }
        return Optional.empty();
    }

    private void addDeclaration(Element element, Set<SymbolLocation> clashes) {
        var location = compilation.declaration(element);
        if (location.isPresent()) clashes.add(location.get());
    }
}
