package org.jrename.rename;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import org.jrename.workspace.Document;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextSpan;

/** Input of one per-document rewrite. The document is always rewritten starting from its original text. */
public class RenameRewriterParameters {
    /** Spans of nodes in the original text that must be expanded before renaming. */
    public final ImmutableSet<TextSpan> conflictLocationSpans;

    public final Solution originalSolution;
    public final Document document;
    public final ImmutableList<LocationRenameContext> tokenTextSpanRenameContexts;
    public final ImmutableList<LocationRenameContext> stringAndCommentsTextSpanRenameContexts;
    public final DocumentRenameInfo renameInfo;
    public final CancellationToken cancellationToken;

    public RenameRewriterParameters(
            Collection<TextSpan> conflictLocationSpans,
            Solution originalSolution,
            Document document,
            DocumentRenameInfo renameInfo,
            CancellationToken cancellationToken) {
        this.conflictLocationSpans = ImmutableSet.copyOf(conflictLocationSpans);
        this.originalSolution = originalSolution;
        this.document = document;
        this.tokenTextSpanRenameContexts = ImmutableList.copyOf(renameInfo.textSpanToLocationContexts.values());
        this.stringAndCommentsTextSpanRenameContexts =
                ImmutableList.copyOf(renameInfo.textSpanToStringAndCommentRenameContexts.values());
        this.renameInfo = renameInfo;
        this.cancellationToken = cancellationToken;
    }
}
