package org.jrename.java;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jrename.conflicts.annotations.AnnotatedSpan;
import org.jrename.conflicts.annotations.RenameActionAnnotation;
import org.jrename.conflicts.annotations.RenameAnnotation;
import org.jrename.conflicts.annotations.RenameDeclarationLocationReference;
import org.jrename.conflicts.annotations.RenameInvalidIdentifierAnnotation;
import org.jrename.conflicts.annotations.RenameNodeSimplificationAnnotation;
import org.jrename.rename.AbstractRenameRewriterLanguageService;
import org.jrename.rename.LocationRenameContext;
import org.jrename.rename.RenameRewriterParameters;
import org.jrename.rename.RewriteResult;
import org.jrename.rename.SpanEdit;
import org.jrename.workspace.TextSpan;

/**
 * Rewrites one document, always starting from its original text. Renames every rename location, qualifies the names
 * inside conflict spans, and annotates every name whose binding has to be checked afterwards.
 */
class JavaRenameRewriter {
    private final JavaCompilation compilation;
    private final RenameRewriterParameters parameters;
    private final List<SpanEdit> edits = new ArrayList<>();
    private final List<Pending> pending = new ArrayList<>();

    JavaRenameRewriter(JavaCompilation compilation, RenameRewriterParameters parameters) {
        this.compilation = compilation;
        this.parameters = parameters;
    }

    RewriteResult rewrite() {
        var document = parameters.document;
        var info = parameters.renameInfo;
        var names = info.namesOfInterest();
        var model = compilation.semanticModel(document.id);
        var expander = new JavaExpander(compilation);
        var contexts =
                AbstractRenameRewriterLanguageService.createTextSpanToLocationContextMap(
                        parameters.tokenTextSpanRenameContexts);
        for (var token : model.tokens) {
            var context = contexts.get(token.span);
            if (context == null && !names.contains(token.name)) continue;
            if (insideConflictSpan(token.span)) {
                var qualifier = expander.qualifier(token);
                if (qualifier.isPresent()) {
                    edits.add(SpanEdit.insert(token.span.start, qualifier.get()));
                    pending.add(new Pending(token.span, false, new RenameNodeSimplificationAnnotation(token.span)));
                }
            }
            pending.add(new Pending(token.span, true, action(model, token, context)));
            if (context != null && !context.replacementTextValid) {
                pending.add(new Pending(token.span, true, RenameInvalidIdentifierAnnotation.INSTANCE));
            }
        }
        for (var context : contexts.values()) {
            var span = context.renameLocation.span;
            if (document.text.substring(span.start, span.end()).equals(context.replacementText)) continue;
            edits.add(new SpanEdit(span, context.replacementText, SpanEdit.Kind.RENAME));
        }
        renameStringsAndComments();
        Collections.sort(edits);
        var newText = SpanEdit.apply(document.text, edits);
        var annotations = new ArrayList<AnnotatedSpan>();
        for (var p : pending) {
            var start = SpanEdit.adjust(edits, p.originalSpan.start, p.afterInsertions);
            var end = SpanEdit.adjust(edits, p.originalSpan.end(), true);
            annotations.add(new AnnotatedSpan(TextSpan.fromBounds(start, end), p.annotation));
        }
        return new RewriteResult(newText, edits, annotations);
    }

    private boolean insideConflictSpan(TextSpan span) {
        for (var conflict : parameters.conflictLocationSpans) {
            if (conflict.contains(span)) return true;
        }
        return false;
    }

    private RenameActionAnnotation action(JavaSemanticModel model, NameToken token, LocationRenameContext context) {
        var info = parameters.renameInfo;
        var references = new ArrayList<RenameDeclarationLocationReference>();
        for (var symbol : model.symbols(token)) {
            references.add(RenameDeclarationLocationReference.of(symbol));
        }
        var isRenameLocation = context != null;
        var isOriginalTextLocation = !isRenameLocation && info.allOriginalText.contains(token.name);
        var replacementText = isRenameLocation ? context.replacementText : token.name;
        if (isOriginalTextLocation) {
            for (var symbolContext : info.renamedSymbolContexts.values()) {
                if (symbolContext.originalText.equals(token.name)) replacementText = symbolContext.replacementText;
            }
        }
        return new RenameActionAnnotation(
                token.span,
                token.name,
                replacementText,
                isRenameLocation,
                isOriginalTextLocation,
                token.invocation,
                token.packageName,
                token.memberReference,
                references);
    }

    private void renameStringsAndComments() {
        var contexts = parameters.stringAndCommentsTextSpanRenameContexts;
        if (contexts.isEmpty()) return;
        var groups = AbstractRenameRewriterLanguageService.groupStringAndCommentsTextSpanRenameContexts(contexts);
        for (var group : groups.entrySet()) {
            var containing = group.getKey();
            var replacements =
                    AbstractRenameRewriterLanguageService.createSubSpanToReplacementTextMap(
                            parameters.document.id, containing, group.getValue());
            for (var replacement : replacements.entrySet()) {
                var sub = replacement.getKey();
                var span = new TextSpan(containing.start + sub.start, sub.length);
                edits.add(new SpanEdit(span, replacement.getValue(), SpanEdit.Kind.STRING_OR_COMMENT));
            }
        }
    }

    /** An annotation on a span of the original text, placed once every edit is known. */
    private static class Pending {
        final TextSpan originalSpan;
        /** Whether an insertion right at the start of the span goes before the annotated text. */
        final boolean afterInsertions;

        final RenameAnnotation annotation;

        Pending(TextSpan originalSpan, boolean afterInsertions, RenameAnnotation annotation) {
            this.originalSpan = originalSpan;
            this.afterInsertions = afterInsertions;
            this.annotation = annotation;
        }
    }
}
