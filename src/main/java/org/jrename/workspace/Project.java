package org.jrename.workspace;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

public final class Project {
    public final ProjectId id;
    public final String language;
    public final ImmutableList<DocumentId> documentIds;
    public final ImmutableList<ProjectId> projectReferences;

    public Project(ProjectId id, String language, List<DocumentId> documentIds, List<ProjectId> projectReferences) {
        this.id = Objects.requireNonNull(id);
        this.language = Objects.requireNonNull(language);
        this.documentIds = ImmutableList.copyOf(documentIds);
        this.projectReferences = ImmutableList.copyOf(projectReferences);
    }

    Project withDocument(DocumentId documentId) {
        var documents = ImmutableList.<DocumentId>builder().addAll(documentIds).add(documentId).build();
        return new Project(id, language, documents, projectReferences);
    }

    @Override
    public String toString() {
        return String.format("%s (%s, %d documents)", id, language, documentIds.size());
    }
}
