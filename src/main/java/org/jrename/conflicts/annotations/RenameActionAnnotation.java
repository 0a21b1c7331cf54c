package org.jrename.conflicts.annotations;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jrename.workspace.TextSpan;

/**
 * Attached to every name token whose binding must be checked after the rename. Captures the token's original span
 * and text and what it referred to before anything was rewritten.
 */
public final class RenameActionAnnotation extends RenameAnnotation {
    public final TextSpan originalSpan;
    public final String originalText;
    public final String replacementText;
    public final boolean isRenameLocation;
    /** The token's text is the original name of a renamed symbol, but the token is not being renamed. */
    public final boolean isOriginalTextLocation;

    public final boolean isInvocationExpression;
    public final boolean isNamespaceDeclarationReference;
    public final boolean isMemberGroupReference;
    public final ImmutableList<RenameDeclarationLocationReference> renameDeclarationLocationReferences;

    public RenameActionAnnotation(
            TextSpan originalSpan,
            String originalText,
            String replacementText,
            boolean isRenameLocation,
            boolean isOriginalTextLocation,
            boolean isInvocationExpression,
            boolean isNamespaceDeclarationReference,
            boolean isMemberGroupReference,
            List<RenameDeclarationLocationReference> renameDeclarationLocationReferences) {
        this.originalSpan = originalSpan;
        this.originalText = originalText;
        this.replacementText = replacementText;
        this.isRenameLocation = isRenameLocation;
        this.isOriginalTextLocation = isOriginalTextLocation;
        this.isInvocationExpression = isInvocationExpression;
        this.isNamespaceDeclarationReference = isNamespaceDeclarationReference;
        this.isMemberGroupReference = isMemberGroupReference;
        this.renameDeclarationLocationReferences = ImmutableList.copyOf(renameDeclarationLocationReferences);
    }

    @Override
    public String toString() {
        return String.format(
                "%s `%s`%s -> %s",
                originalSpan,
                originalText,
                isRenameLocation ? " (rename)" : "",
                renameDeclarationLocationReferences);
    }
}
