package org.jrename.java;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jrename.rename.CancellationToken;
import org.jrename.rename.SpanEdit;
import org.jrename.semantics.RenameSymbol;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextSpan;

/**
 * Takes back the qualifiers {@link JavaExpander} added, wherever the simple name still binds to the same thing.
 * All removable qualifiers are dropped at once; the ones whose name then binds elsewhere are put back, and the rest
 * are checked again.
 */
class JavaSimplifier {
    private static final Logger LOG = Logger.getLogger("main");
    private static final int MAX_ROUNDS = 3;

    private final JavaCompilerService compiler;

    JavaSimplifier(JavaCompilerService compiler) {
        this.compiler = compiler;
    }

    List<SpanEdit> simplify(
            Solution currentSolution,
            DocumentId documentId,
            String originalText,
            List<SpanEdit> edits,
            Collection<TextSpan> complexifiedSpans,
            CancellationToken cancellationToken) {
        var candidates = new ArrayList<SpanEdit>();
        for (var edit : edits) {
            if (edit.kind != SpanEdit.Kind.EXPANSION) continue;
            for (var span : complexifiedSpans) {
                if (span.start == edit.oldSpan.start) {
                    candidates.add(edit);
                    break;
                }
            }
        }
        if (candidates.isEmpty()) return edits;
        var expected = bindings(currentSolution, documentId, edits, candidates);
        var removed = new LinkedHashSet<SpanEdit>();
        for (var candidate : candidates) {
            if (!expected.get(candidate).isEmpty()) removed.add(candidate);
        }
        for (var round = 0; round < MAX_ROUNDS && !removed.isEmpty(); round++) {
            cancellationToken.throwIfCancellationRequested();
            var kept = without(edits, removed);
            var solution = currentSolution.withDocumentText(documentId, SpanEdit.apply(originalText, kept));
            var actual = bindings(solution, documentId, kept, removed);
            var changed = new ArrayList<SpanEdit>();
            for (var edit : removed) {
                if (!expected.get(edit).equals(actual.get(edit))) changed.add(edit);
            }
            if (changed.isEmpty()) {
                LOG.fine(String.format("Removed %d of %d qualifiers in %s", removed.size(), candidates.size(), documentId));
                return kept;
            }
            removed.removeAll(changed);
        }
        if (!removed.isEmpty()) {
            LOG.warning(String.format("Qualifiers in %s did not settle, keeping all of them", documentId));
        }
        return edits;
    }

    private static List<SpanEdit> without(List<SpanEdit> edits, Set<SpanEdit> removed) {
        var kept = new ArrayList<SpanEdit>();
        for (var edit : edits) {
            if (!removed.contains(edit)) kept.add(edit);
        }
        return kept;
    }

    /** What the name at each expansion binds to, as a declaration position in the original text. */
    private Map<SpanEdit, String> bindings(
            Solution solution, DocumentId documentId, List<SpanEdit> applied, Collection<SpanEdit> expansions) {
        var model = compiler.compilation(solution, documentId.projectId).semanticModel(documentId);
        var result = new HashMap<SpanEdit, String>();
        for (var expansion : expansions) {
            var position = SpanEdit.adjust(applied, expansion.oldSpan.start, true);
            result.put(expansion, identity(model.symbolsTouching(position), documentId, applied));
        }
        return result;
    }

    // Keys of anonymous classes contain positions, so source symbols are compared by where they are declared
    private static String identity(List<RenameSymbol> symbols, DocumentId documentId, List<SpanEdit> applied) {
        if (symbols.size() != 1) return "";
        var symbol = symbols.get(0);
        var location = symbol.firstLocation();
        if (location.isEmpty() || !location.get().isInSource()) return symbol.key.toString();
        var declaredIn = location.get().documentId.get();
        var start = location.get().span.start;
        if (declaredIn.equals(documentId)) start = SpanEdit.unadjust(applied, start);
        return declaredIn + "@" + start;
    }
}
