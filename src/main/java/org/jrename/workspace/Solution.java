package org.jrename.workspace;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable snapshot of a set of projects and their documents. Every change returns a new snapshot that shares
 * unchanged documents with this one. Snapshots compare by identity, which is what compilation caches key on.
 */
public final class Solution {
    private final ImmutableMap<ProjectId, Project> projects;
    private final ImmutableMap<DocumentId, Document> documents;
    private ProjectDependencyGraph dependencyGraph;

    private Solution(ImmutableMap<ProjectId, Project> projects, ImmutableMap<DocumentId, Document> documents) {
        this.projects = projects;
        this.documents = documents;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<Project> projects() {
        return projects.values();
    }

    public Project project(ProjectId id) {
        var project = projects.get(id);
        if (project == null) {
            throw new IllegalArgumentException(String.format("No project `%s`", id));
        }
        return project;
    }

    public Collection<Document> documents() {
        return documents.values();
    }

    public Document document(DocumentId id) {
        var document = documents.get(id);
        if (document == null) {
            throw new IllegalArgumentException(String.format("No document `%s`", id));
        }
        return document;
    }

    public boolean containsDocument(DocumentId id) {
        return documents.containsKey(id);
    }

    public List<Document> documents(ProjectId projectId) {
        var list = ImmutableList.<Document>builder();
        for (var id : project(projectId).documentIds) {
            list.add(documents.get(id));
        }
        return list.build();
    }

    public Optional<Document> findDocumentByName(ProjectId projectId, String name) {
        for (var document : documents(projectId)) {
            if (document.name.equals(name)) return Optional.of(document);
        }
        return Optional.empty();
    }

    public Optional<Document> findDocumentByPath(Path file) {
        var absolute = file.toAbsolutePath().normalize();
        for (var document : documents.values()) {
            if (document.filePath.isEmpty()) continue;
            if (document.filePath.get().toAbsolutePath().normalize().equals(absolute)) return Optional.of(document);
        }
        return Optional.empty();
    }

    public synchronized ProjectDependencyGraph dependencyGraph() {
        if (dependencyGraph == null) {
            dependencyGraph = new ProjectDependencyGraph(projects);
        }
        return dependencyGraph;
    }

    public Solution withDocumentText(DocumentId id, String text) {
        var document = document(id);
        var changed = document.withText(text);
        if (changed == document) return this;
        return withDocument(changed);
    }

    public Solution withDocumentTexts(Map<DocumentId, String> texts) {
        var solution = this;
        for (var entry : texts.entrySet()) {
            solution = solution.withDocumentText(entry.getKey(), entry.getValue());
        }
        return solution;
    }

    public Solution withDocumentFileName(DocumentId id, String newFileName) {
        return withDocument(document(id).withFileName(newFileName));
    }

    private Solution withDocument(Document changed) {
        var copy = new LinkedHashMap<DocumentId, Document>(documents);
        copy.put(changed.id, changed);
        var solution = new Solution(projects, ImmutableMap.copyOf(copy));
        solution.dependencyGraph = dependencyGraph;
        return solution;
    }

    public static class Builder {
        private final Map<ProjectId, Project> projects = new LinkedHashMap<>();
        private final Map<DocumentId, Document> documents = new LinkedHashMap<>();

        public ProjectId addProject(String name, String language, ProjectId... references) {
            var id = new ProjectId(name);
            if (projects.containsKey(id)) {
                throw new IllegalArgumentException(String.format("Project `%s` is already defined", name));
            }
            projects.put(id, new Project(id, language, List.of(), List.of(references)));
            return id;
        }

        public DocumentId addDocument(ProjectId projectId, String name, String text) {
            return addDocument(projectId, name, text, Optional.empty());
        }

        public DocumentId addDocument(ProjectId projectId, String name, String text, Optional<Path> filePath) {
            var project = projects.get(projectId);
            if (project == null) {
                throw new IllegalArgumentException(String.format("No project `%s`", projectId));
            }
            var id = new DocumentId(projectId, name);
            if (documents.containsKey(id)) {
                throw new IllegalArgumentException(String.format("Document `%s` is already defined", id));
            }
            documents.put(id, new Document(id, name, text, filePath));
            projects.put(projectId, project.withDocument(id));
            return id;
        }

        public Solution build() {
            for (var project : projects.values()) {
                for (var reference : project.projectReferences) {
                    if (!projects.containsKey(reference)) {
                        throw new IllegalArgumentException(
                                String.format("Project `%s` references unknown project `%s`", project.id, reference));
                    }
                }
            }
            return new Solution(ImmutableMap.copyOf(projects), ImmutableMap.copyOf(documents));
        }
    }
}
