package org.jrename.workspace;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Project reference graph. Dependencies always come before their dependents in the topological order. */
public class ProjectDependencyGraph {
    private final Map<ProjectId, Project> projects;
    private final ImmutableList<ProjectId> sorted;

    ProjectDependencyGraph(Map<ProjectId, Project> projects) {
        this.projects = projects;
        this.sorted = sort(projects);
    }

    private static ImmutableList<ProjectId> sort(Map<ProjectId, Project> projects) {
        var order = new ArrayList<ProjectId>();
        var state = new HashMap<ProjectId, Boolean>();
        for (var id : projects.keySet()) {
            visit(id, projects, state, order, new ArrayList<>());
        }
        return ImmutableList.copyOf(order);
    }

    // state: false while on the stack, true once emitted
    private static void visit(
            ProjectId id,
            Map<ProjectId, Project> projects,
            Map<ProjectId, Boolean> state,
            List<ProjectId> order,
            List<ProjectId> stack) {
        var seen = state.get(id);
        if (seen != null) {
            if (!seen) {
                stack.add(id);
                throw new IllegalStateException("Project references form a cycle: " + stack);
            }
            return;
        }
        state.put(id, false);
        stack.add(id);
        for (var reference : projects.get(id).projectReferences) {
            visit(reference, projects, state, order, stack);
        }
        stack.remove(stack.size() - 1);
        state.put(id, true);
        order.add(id);
    }

    public List<ProjectId> topologicallySortedProjects() {
        return sorted;
    }

    public int topologicalIndex(ProjectId id) {
        var index = sorted.indexOf(id);
        if (index == -1) {
            throw new IllegalArgumentException(String.format("No project `%s`", id));
        }
        return index;
    }

    /** The project itself and everything it references, directly or not. */
    public Set<ProjectId> projectAndTransitiveDependencies(ProjectId id) {
        var result = new LinkedHashSet<ProjectId>();
        collectDependencies(id, result);
        return ImmutableSet.copyOf(result);
    }

    private void collectDependencies(ProjectId id, Set<ProjectId> result) {
        if (!result.add(id)) return;
        for (var reference : projects.get(id).projectReferences) {
            collectDependencies(reference, result);
        }
    }

    /** The project itself and every project that references it, directly or not. */
    public Set<ProjectId> projectAndTransitiveDependents(ProjectId id) {
        var result = new LinkedHashSet<ProjectId>();
        result.add(id);
        var changed = true;
        while (changed) {
            changed = false;
            for (var project : projects.values()) {
                if (result.contains(project.id)) continue;
                for (var reference : project.projectReferences) {
                    if (result.contains(reference)) {
                        result.add(project.id);
                        changed = true;
                        break;
                    }
                }
            }
        }
        return ImmutableSet.copyOf(result);
    }
}
