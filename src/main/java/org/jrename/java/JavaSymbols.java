package org.jrename.java;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.TypeParameterElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.util.ElementFilter;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SymbolKey;
import org.jrename.semantics.SymbolKind;
import org.jrename.semantics.SymbolLocation;

/**
 * Turns javac elements into {@link RenameSymbol}s.
 *
 * <p>Keys follow the {@code package/Outer.Inner#member(erased,parameter,types)} shape. Members of local and anonymous
 * classes, parameters and locals are keyed relative to their owner.
 */
class JavaSymbols {
    private final JavaCompilation compilation;

    JavaSymbols(JavaCompilation compilation) {
        this.compilation = compilation;
    }

    RenameSymbol symbol(Element element) {
        var location = compilation.declaration(element);
        List<SymbolLocation> locations;
        if (location.isPresent()) {
            locations = List.of(location.get());
        } else {
            locations = List.of(SymbolLocation.metadata(key(element).toString()));
        }
        var containing = Optional.<SymbolKey>empty();
        if (element.getEnclosingElement() != null && !(element instanceof PackageElement)) {
            containing = Optional.of(key(element.getEnclosingElement()));
        }
        var overridden = overriddenMethod(element);
        var overriddenKey = overridden.map(this::key);
        var overriddenInMetadata = overridden.isPresent() && compilation.declaration(overridden.get()).isEmpty();
        return new RenameSymbol(
                key(element),
                name(element),
                kind(element),
                locations,
                isPrivate(element),
                containing,
                overriddenKey,
                overriddenInMetadata);
    }

    static String name(Element element) {
        if (element.getKind() == ElementKind.CONSTRUCTOR) {
            return element.getEnclosingElement().getSimpleName().toString();
        }
        return element.getSimpleName().toString();
    }

    static SymbolKind kind(Element element) {
        switch (element.getKind()) {
            case PACKAGE:
                return SymbolKind.NAMESPACE;
            case CLASS:
            case INTERFACE:
            case ENUM:
            case ANNOTATION_TYPE:
            case RECORD:
                return SymbolKind.TYPE;
            case TYPE_PARAMETER:
                return SymbolKind.TYPE_PARAMETER;
            case CONSTRUCTOR:
                return SymbolKind.CONSTRUCTOR;
            case METHOD:
                return SymbolKind.METHOD;
            case FIELD:
            case ENUM_CONSTANT:
            case RECORD_COMPONENT:
                return SymbolKind.FIELD;
            case PARAMETER:
                return SymbolKind.PARAMETER;
            case LOCAL_VARIABLE:
            case EXCEPTION_PARAMETER:
            case RESOURCE_VARIABLE:
            case BINDING_VARIABLE:
                return SymbolKind.LOCAL;
            default:
                return SymbolKind.OTHER;
        }
    }

    /** Private, or not visible outside the body of a method. */
    private static boolean isPrivate(Element element) {
        if (kind(element).isLocal()) return true;
        for (var e = element; e != null && !(e instanceof PackageElement); e = e.getEnclosingElement()) {
            if (e.getModifiers().contains(Modifier.PRIVATE)) return true;
            if (e instanceof TypeElement) {
                var nesting = ((TypeElement) e).getNestingKind();
                if (nesting == NestingKind.LOCAL || nesting == NestingKind.ANONYMOUS) return true;
            }
        }
        return false;
    }

    SymbolKey key(Element element) {
        return new SymbolKey(path(element));
    }

    private String path(Element element) {
        if (element instanceof PackageElement) {
            return ((PackageElement) element).getQualifiedName().toString();
        }
        if (element instanceof TypeElement) {
            return typePath((TypeElement) element);
        }
        if (element instanceof TypeParameterElement) {
            var owner = ((TypeParameterElement) element).getGenericElement();
            return path(owner) + "<" + element.getSimpleName() + ">";
        }
        var owner = element.getEnclosingElement();
        switch (element.getKind()) {
            case PARAMETER:
                {
                    var index = 0;
                    if (owner instanceof ExecutableElement) {
                        index = ((ExecutableElement) owner).getParameters().indexOf(element);
                    }
                    return path(owner) + "/param:" + index;
                }
            case LOCAL_VARIABLE:
            case EXCEPTION_PARAMETER:
            case RESOURCE_VARIABLE:
            case BINDING_VARIABLE:
                return path(owner) + "/local:" + element.getSimpleName() + "@" + compilation.localOrdinal(element);
            default:
                break;
        }
        if (element instanceof ExecutableElement) {
            var method = (ExecutableElement) element;
            var params = new StringJoiner(",");
            for (var p : method.getParameters()) {
                params.add(compilation.types.erasure(p.asType()).toString());
            }
            return path(owner) + "#" + method.getSimpleName() + "(" + params + ")";
        }
        if (owner == null) return element.getSimpleName().toString();
        return path(owner) + "#" + element.getSimpleName();
    }

    private String typePath(TypeElement type) {
        switch (type.getNestingKind()) {
            case LOCAL:
                return path(type.getEnclosingElement())
                        + "/local:"
                        + type.getSimpleName()
                        + "@"
                        + compilation.localOrdinal(type);
            case ANONYMOUS:
                {
                    var tree = compilation.trees.getPath(type);
                    var position = -1L;
                    if (tree != null) {
                        position =
                                compilation
                                        .trees
                                        .getSourcePositions()
                                        .getStartPosition(tree.getCompilationUnit(), tree.getLeaf());
                    }
                    return path(type.getEnclosingElement()) + "/anonymous@" + position;
                }
            default:
                break;
        }
        var packageName = compilation.elements.getPackageOf(type).getQualifiedName().toString();
        var reversed = new ArrayList<CharSequence>();
        for (Element e = type; e instanceof TypeElement; e = e.getEnclosingElement()) {
            reversed.add(e.getSimpleName());
        }
        var className = new StringJoiner(".");
        for (var i = reversed.size() - 1; i >= 0; i--) {
            className.add(reversed.get(i));
        }
        if (packageName.isEmpty()) return className.toString();
        return packageName + "/" + className;
    }

    /** The method of a supertype that {@code element} overrides, nearest supertype first. */
    Optional<ExecutableElement> overriddenMethod(Element element) {
        if (element.getKind() != ElementKind.METHOD) return Optional.empty();
        var method = (ExecutableElement) element;
        if (method.getModifiers().contains(Modifier.STATIC)) return Optional.empty();
        if (!(method.getEnclosingElement() instanceof TypeElement)) return Optional.empty();
        var type = (TypeElement) method.getEnclosingElement();
        var queue = new ArrayList<TypeElement>();
        addSupertypes(type, queue);
        for (var i = 0; i < queue.size(); i++) {
            var superType = queue.get(i);
            for (var candidate : ElementFilter.methodsIn(superType.getEnclosedElements())) {
                if (!candidate.getSimpleName().contentEquals(method.getSimpleName())) continue;
                if (compilation.elements.overrides(method, candidate, type)) return Optional.of(candidate);
            }
            addSupertypes(superType, queue);
        }
        return Optional.empty();
    }

    private void addSupertypes(TypeElement type, List<TypeElement> queue) {
        for (var superType : compilation.types.directSupertypes(type.asType())) {
            if (superType.getKind() != TypeKind.DECLARED) continue;
            var element = (TypeElement) ((DeclaredType) superType).asElement();
            if (!queue.contains(element)) queue.add(element);
        }
    }
}
