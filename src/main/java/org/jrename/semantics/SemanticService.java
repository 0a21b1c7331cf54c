package org.jrename.semantics;

import org.jrename.workspace.ProjectId;
import org.jrename.workspace.Solution;

public interface SemanticService {
    /** Analyzes {@code projectId} as it exists in {@code solution}. Implementations may cache per snapshot. */
    Compilation compile(Solution solution, ProjectId projectId);
}
