package org.jrename.rename;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/** Helpers every language's rewriter uses to turn rename contexts into per-span replacements. */
public abstract class AbstractRenameRewriterLanguageService implements RenameRewriterLanguageService {

    /** Token renames keyed by span. Two different renames of the same span are an error. */
    public static Map<TextSpan, LocationRenameContext> createTextSpanToLocationContextMap(
            Collection<LocationRenameContext> contexts) {
        var map = new TreeMap<TextSpan, LocationRenameContext>();
        for (var context : contexts) {
            var span = context.renameLocation.span;
            var existing = map.get(span);
            if (existing == null) {
                map.put(span, context);
            } else if (!existing.equals(context)) {
                throw new LocationRenameContextOverlappingException(existing, context);
            }
        }
        return map;
    }

    /** String and comment renames grouped by the literal or comment that contains them. */
    public static Map<TextSpan, Set<LocationRenameContext>> groupStringAndCommentsTextSpanRenameContexts(
            Collection<LocationRenameContext> contexts) {
        var groups = new TreeMap<TextSpan, Set<LocationRenameContext>>();
        for (var context : contexts) {
            var containing = context.renameLocation.containingStringOrCommentSpan;
            if (containing.isEmpty()) {
                throw new IllegalArgumentException(
                        String.format("%s is not a string or comment location", context.renameLocation));
            }
            groups.computeIfAbsent(containing.get(), k -> new LinkedHashSet<>()).add(context);
        }
        return groups;
    }

    /**
     * Replacements inside one literal or comment, keyed by span relative to its start. Two contexts that replace the
     * same sub-span with different text are an error.
     */
    public static Map<TextSpan, String> createSubSpanToReplacementTextMap(
            DocumentId documentId, TextSpan containing, Collection<LocationRenameContext> contexts) {
        var map = new TreeMap<TextSpan, String>();
        for (var context : contexts) {
            var span = context.renameLocation.span;
            if (!containing.contains(span)) {
                throw new IllegalArgumentException(String.format("%s is not inside %s", span, containing));
            }
            var subSpan = new TextSpan(span.start - containing.start, span.length);
            var existing = map.get(subSpan);
            if (existing == null) {
                map.put(subSpan, context.replacementText);
            } else if (!existing.equals(context.replacementText)) {
                throw new StringOrCommentReplacementTextConflictException(
                        documentId, span, existing, context.replacementText);
            }
        }
        return map;
    }
}
