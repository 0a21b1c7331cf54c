package org.jrename.rename;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.ProjectId;
import org.jrename.workspace.Solution;

/** Looks up a language's services by the language id of a project. */
public class LanguageServicesRegistry {
    private final Map<String, LanguageServices> services = new LinkedHashMap<>();

    public LanguageServicesRegistry(LanguageServices... languages) {
        for (var language : languages) {
            register(language);
        }
    }

    public void register(LanguageServices language) {
        if (services.containsKey(language.language)) {
            throw new IllegalArgumentException(String.format("Language `%s` is already registered", language.language));
        }
        services.put(language.language, language);
    }

    public Set<String> languages() {
        return services.keySet();
    }

    public LanguageServices forLanguage(String language) {
        var found = services.get(language);
        if (found == null) {
            throw new IllegalArgumentException(String.format("No rename support for language `%s`", language));
        }
        return found;
    }

    public LanguageServices forProject(Solution solution, ProjectId projectId) {
        return forLanguage(solution.project(projectId).language);
    }

    public LanguageServices forDocument(Solution solution, DocumentId documentId) {
        return forProject(solution, documentId.projectId);
    }
}
