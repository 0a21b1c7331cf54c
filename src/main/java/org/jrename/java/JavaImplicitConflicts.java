package org.jrename.java;

import java.util.ArrayList;
import java.util.List;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.ElementFilter;
import org.jrename.rename.RenameLocation;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SymbolKind;
import org.jrename.semantics.SymbolLocation;

/**
 * The enhanced {@code for} statement calls {@code iterator()}, {@code hasNext()} and {@code next()}, and {@code try}
 * with resources calls {@code close()}, without naming them. Renaming such a method, or renaming another method to
 * one of these names, changes what those statements do.
 */
class JavaImplicitConflicts {
    private JavaImplicitConflicts() {}

    /** Statements that called {@code original} implicitly, and no longer will under the new name. */
    static List<SymbolLocation> lostImplicitCalls(
            RenameSymbol original, RenameSymbol renamed, List<RenameLocation> implicitLocations) {
        var result = new ArrayList<SymbolLocation>();
        if (original.name.equals(renamed.name)) return result;
        for (var location : implicitLocations) {
            result.add(SymbolLocation.source(location.documentId, location.span));
        }
        return result;
    }

    /**
     * Whether {@code renamed}, as declared in {@code compilation}, now overrides a supertype method that statements
     * call implicitly.
     */
    static boolean gainsImplicitCalls(JavaCompilation compilation, RenameSymbol renamed) {
        if (renamed.kind != SymbolKind.METHOD) return false;
        if (!JavaRenameLocationFinder.IMPLICITLY_CALLED.contains(renamed.name)) return false;
        var element = compilation.findDeclared(renamed.key);
        if (element.isEmpty() || !(element.get() instanceof ExecutableElement)) return false;
        var method = (ExecutableElement) element.get();
        if (!method.getParameters().isEmpty()) return false;
        var owner = (TypeElement) method.getEnclosingElement();
        for (var supertype : JavaDeclarationConflicts.supertypes(compilation, owner)) {
            for (var other : ElementFilter.methodsIn(supertype.getEnclosedElements())) {
                if (!other.getSimpleName().contentEquals(renamed.name)) continue;
                if (compilation.elements.overrides(method, other, owner)) return true;
            }
        }
        return false;
    }
}
