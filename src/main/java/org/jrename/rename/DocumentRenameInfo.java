package org.jrename.rename;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.LinkedHashMap;
import org.jrename.semantics.SymbolKey;
import org.jrename.workspace.TextSpan;

/**
 * Everything one document needs to know about a rename of possibly several symbols. Immutable; every {@code with}
 * method returns a new instance.
 */
public final class DocumentRenameInfo {
    public final ImmutableMap<TextSpan, LocationRenameContext> textSpanToLocationContexts;
    public final ImmutableMap<SymbolKey, RenamedSymbolContext> renamedSymbolContexts;
    public final ImmutableSetMultimap<TextSpan, LocationRenameContext> textSpanToStringAndCommentRenameContexts;
    public final ImmutableSet<String> allReplacementTexts;
    public final ImmutableSet<String> allOriginalText;
    public final ImmutableSet<String> allPossibleConflictNames;

    public static final DocumentRenameInfo EMPTY =
            new DocumentRenameInfo(
                    ImmutableMap.of(),
                    ImmutableMap.of(),
                    ImmutableSetMultimap.of(),
                    ImmutableSet.of(),
                    ImmutableSet.of(),
                    ImmutableSet.of());

    private DocumentRenameInfo(
            ImmutableMap<TextSpan, LocationRenameContext> textSpanToLocationContexts,
            ImmutableMap<SymbolKey, RenamedSymbolContext> renamedSymbolContexts,
            ImmutableSetMultimap<TextSpan, LocationRenameContext> textSpanToStringAndCommentRenameContexts,
            ImmutableSet<String> allReplacementTexts,
            ImmutableSet<String> allOriginalText,
            ImmutableSet<String> allPossibleConflictNames) {
        this.textSpanToLocationContexts = textSpanToLocationContexts;
        this.renamedSymbolContexts = renamedSymbolContexts;
        this.textSpanToStringAndCommentRenameContexts = textSpanToStringAndCommentRenameContexts;
        this.allReplacementTexts = allReplacementTexts;
        this.allOriginalText = allOriginalText;
        this.allPossibleConflictNames = allPossibleConflictNames;
    }

    /**
     * Adds a token rename. Adding an equal context twice is harmless; a different context for a span that already
     * has one throws {@link LocationRenameContextOverlappingException}.
     */
    public DocumentRenameInfo withLocationRenameContext(LocationRenameContext context) {
        var span = context.renameLocation.span;
        var existing = textSpanToLocationContexts.get(span);
        if (existing != null) {
            if (existing.equals(context)) return this;
            throw new LocationRenameContextOverlappingException(existing, context);
        }
        var contexts = new LinkedHashMap<>(textSpanToLocationContexts);
        contexts.put(span, context);
        return new DocumentRenameInfo(
                ImmutableMap.copyOf(contexts),
                renamedSymbolContexts,
                textSpanToStringAndCommentRenameContexts,
                allReplacementTexts,
                allOriginalText,
                allPossibleConflictNames);
    }

    /** Adds a string or comment rename. Disagreements are detected later, per literal or comment. */
    public DocumentRenameInfo withStringAndCommentRenameContext(LocationRenameContext context) {
        var contexts =
                ImmutableSetMultimap.<TextSpan, LocationRenameContext>builder()
                        .putAll(textSpanToStringAndCommentRenameContexts)
                        .put(context.renameLocation.span, context)
                        .build();
        return new DocumentRenameInfo(
                textSpanToLocationContexts,
                renamedSymbolContexts,
                contexts,
                allReplacementTexts,
                allOriginalText,
                allPossibleConflictNames);
    }

    public DocumentRenameInfo withRenamedSymbolContext(RenamedSymbolContext context) {
        var key = context.renamedSymbol.key;
        if (renamedSymbolContexts.containsKey(key)) return this;
        var contexts = new LinkedHashMap<>(renamedSymbolContexts);
        contexts.put(key, context);
        return new DocumentRenameInfo(
                textSpanToLocationContexts,
                ImmutableMap.copyOf(contexts),
                textSpanToStringAndCommentRenameContexts,
                ImmutableSet.<String>builder().addAll(allReplacementTexts).add(context.replacementText).build(),
                ImmutableSet.<String>builder().addAll(allOriginalText).add(context.originalText).build(),
                ImmutableSet.<String>builder()
                        .addAll(allPossibleConflictNames)
                        .addAll(context.possibleNameConflicts)
                        .build());
    }

    /** Every name whose occurrences in this document must be re-checked after the rename. */
    public ImmutableSet<String> namesOfInterest() {
        return ImmutableSet.<String>builder()
                .addAll(allOriginalText)
                .addAll(allReplacementTexts)
                .addAll(allPossibleConflictNames)
                .build();
    }
}
