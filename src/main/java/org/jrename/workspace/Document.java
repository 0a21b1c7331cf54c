package org.jrename.workspace;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** An immutable source document. Changing its text or name produces a new instance with the same id. */
public final class Document {
    public final DocumentId id;
    /** Project-relative path using '/' separators, for example {@code src/lib/Base.java}. */
    public final String name;

    public final String text;
    public final Optional<Path> filePath;

    public Document(DocumentId id, String name, String text, Optional<Path> filePath) {
        this.id = Objects.requireNonNull(id);
        this.name = Objects.requireNonNull(name);
        this.text = Objects.requireNonNull(text);
        this.filePath = Objects.requireNonNull(filePath);
    }

    public ProjectId projectId() {
        return id.projectId;
    }

    public String fileName() {
        var slash = name.lastIndexOf('/');
        return name.substring(slash + 1);
    }

    public String folder() {
        var slash = name.lastIndexOf('/');
        return slash == -1 ? "" : name.substring(0, slash + 1);
    }

    public Document withText(String newText) {
        if (newText.equals(text)) return this;
        return new Document(id, name, newText, filePath);
    }

    /** Renames the file, keeping it in the same folder. */
    public Document withFileName(String newFileName) {
        var newPath = filePath.map(p -> p.resolveSibling(newFileName));
        return new Document(id, folder() + newFileName, text, newPath);
    }

    public String uri() {
        if (filePath.isPresent()) {
            return filePath.get().toUri().toString();
        }
        return name;
    }

    @Override
    public String toString() {
        return String.format("%s (%d chars)", name, text.length());
    }
}
