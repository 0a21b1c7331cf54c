package org.jrename.semantics;

import org.jrename.workspace.DocumentId;
import org.jrename.workspace.ProjectId;
import org.jrename.workspace.Solution;

/** One project of one snapshot, analyzed together with the projects it references. */
public interface Compilation {
    Solution solution();

    ProjectId projectId();

    SemanticModel semanticModel(DocumentId documentId);
}
