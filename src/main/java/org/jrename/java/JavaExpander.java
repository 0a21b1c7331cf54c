package org.jrename.java;

import com.sun.source.tree.AnnotationTree;
import com.sun.source.tree.CaseTree;
import com.sun.source.tree.ClassTree;
import com.sun.source.tree.IdentifierTree;
import com.sun.source.tree.NewClassTree;
import com.sun.source.tree.Tree;
import com.sun.source.util.TreePath;
import java.util.Optional;
import javax.lang.model.element.Element;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.TypeElement;

/**
 * Finds the qualifier that keeps a simple name bound to what it names now, once other names around it change:
 * {@code this.} or {@code super.} for members, {@code Outer.this.} for members of an enclosing class, and the
 * canonical name of the owner for static members and nested types.
 */
class JavaExpander {
    private final JavaCompilation compilation;

    JavaExpander(JavaCompilation compilation) {
        this.compilation = compilation;
    }

    /** The text to insert before {@code token}, if the token is a simple name that can be qualified. */
    Optional<String> qualifier(NameToken token) {
        if (token.declaration || token.packageName || token.memberReference) return Optional.empty();
        if (!(token.path.getLeaf() instanceof IdentifierTree)) return Optional.empty();
        if (!canQualify(token.path)) return Optional.empty();
        var element = compilation.trees.getElement(token.path);
        if (element == null) return Optional.empty();
        switch (element.getKind()) {
            case FIELD:
            case ENUM_CONSTANT:
                return memberQualifier(token.path, element, true);
            case METHOD:
                if (!token.invocation) return Optional.empty();
                return memberQualifier(token.path, element, false);
            case CLASS:
            case INTERFACE:
            case ENUM:
            case ANNOTATION_TYPE:
            case RECORD:
                return typeQualifier((TypeElement) element).map(name -> name + ".");
            default:
                return Optional.empty();
        }
    }

    private static boolean canQualify(TreePath path) {
        var parent = path.getParentPath();
        if (parent == null) return false;
        var leaf = parent.getLeaf();
        // case labels and annotation names must stay simple
        if (leaf instanceof CaseTree || leaf instanceof AnnotationTree) return false;
        if (leaf instanceof NewClassTree && ((NewClassTree) leaf).getEnclosingExpression() != null) return false;
        for (var p = parent; p != null; p = p.getParentPath()) {
            var kind = p.getLeaf().getKind();
            if (kind == Tree.Kind.IMPORT || kind == Tree.Kind.PACKAGE) return false;
        }
        return true;
    }

    private Optional<String> memberQualifier(TreePath path, Element member, boolean isField) {
        if (!(member.getEnclosingElement() instanceof TypeElement)) return Optional.empty();
        var owner = (TypeElement) member.getEnclosingElement();
        if (member.getModifiers().contains(Modifier.STATIC)) {
            return typeName(owner).map(name -> name + ".");
        }
        var innermost = true;
        for (var p = path; p != null; p = p.getParentPath()) {
            if (!(p.getLeaf() instanceof ClassTree)) continue;
            var element = compilation.trees.getElement(p);
            if (!(element instanceof TypeElement)) continue;
            var type = (TypeElement) element;
            if (inherits(type, owner)) {
                // super. skips overriding, so inherited methods go through this.
                var keyword = type.equals(owner) || !isField ? "this." : "super.";
                if (innermost) return Optional.of(keyword);
                if (type.getNestingKind() == NestingKind.ANONYMOUS) return Optional.empty();
                return Optional.of(type.getSimpleName() + "." + keyword);
            }
            innermost = false;
        }
        return Optional.empty();
    }

    private boolean inherits(TypeElement type, TypeElement owner) {
        if (type.equals(owner)) return true;
        var types = compilation.types;
        return types.isSubtype(types.erasure(type.asType()), types.erasure(owner.asType()));
    }

    /** The name a type can be referenced by from anywhere it is visible. */
    private Optional<String> typeName(TypeElement type) {
        switch (type.getNestingKind()) {
            case LOCAL:
                return Optional.of(type.getSimpleName().toString());
            case ANONYMOUS:
                return Optional.empty();
            default:
                return Optional.of(type.getQualifiedName().toString());
        }
    }

    /** What goes before the simple name of a type: its package or its enclosing type. */
    private Optional<String> typeQualifier(TypeElement type) {
        switch (type.getNestingKind()) {
            case TOP_LEVEL:
                {
                    var packageName = compilation.elements.getPackageOf(type).getQualifiedName().toString();
                    if (packageName.isEmpty()) return Optional.empty();
                    return Optional.of(packageName);
                }
            case MEMBER:
                return typeName((TypeElement) type.getEnclosingElement());
            default:
                return Optional.empty();
        }
    }
}
