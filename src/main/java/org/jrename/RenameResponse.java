package org.jrename;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.jrename.conflicts.ConflictResolution;
import org.jrename.conflicts.RelatedLocation;
import org.jrename.workspace.Document;
import org.jrename.workspace.TextLines;

/** What the command line prints. */
public class RenameResponse {
    public boolean success;
    public String error;
    public boolean replacementTextValid;
    public int unresolvedConflicts;
    public List<Location> relatedLocations = new ArrayList<>();
    /** New file name, by old document name. */
    public Map<String, String> renamedFiles;
    public WorkspaceEdit workspaceEdit;

    public static class Location {
        public String file;
        /** Starts at 1. */
        public int line, column;

        public String type;
        public boolean reference;
    }

    static RenameResponse failed(String error) {
        var response = new RenameResponse();
        response.error = error;
        return response;
    }

    static RenameResponse of(ConflictResolution resolution) {
        if (!resolution.isSuccessful()) {
            return failed(resolution.failure().get().message);
        }
        var response = new RenameResponse();
        response.success = true;
        response.replacementTextValid = resolution.replacementTextValid();
        response.unresolvedConflicts = resolution.unresolvedConflictCount();
        var old = resolution.oldSolution();
        for (var related : resolution.relatedLocations()) {
            response.relatedLocations.add(location(old.document(related.documentId), related));
        }
        response.renamedFiles = new LinkedHashMap<>();
        for (var entry : resolution.renamedDocuments().entrySet()) {
            response.renamedFiles.put(old.document(entry.getKey()).name, entry.getValue());
        }
        response.workspaceEdit = resolution.toWorkspaceEdit();
        return response;
    }

    private static Location location(Document document, RelatedLocation related) {
        var position = new TextLines(document.text).position(related.conflictCheckSpan.start);
        var location = new Location();
        location.file = document.uri();
        location.line = position.getLine() + 1;
        location.column = position.getCharacter() + 1;
        location.type = related.type.name();
        location.reference = related.isReference;
        return location;
    }
}
