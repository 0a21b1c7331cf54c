package org.jrename.workspace;

import java.util.Objects;

/**
 * Stable identity of a document. The key is the path the document was created with, so it survives a later file
 * rename of the document.
 */
public final class DocumentId {
    public final ProjectId projectId;
    public final String key;

    public DocumentId(ProjectId projectId, String key) {
        this.projectId = Objects.requireNonNull(projectId);
        this.key = Objects.requireNonNull(key);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof DocumentId)) return false;
        var that = (DocumentId) other;
        return this.projectId.equals(that.projectId) && this.key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, key);
    }

    @Override
    public String toString() {
        return projectId + ":" + key;
    }
}
