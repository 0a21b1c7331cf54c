package org.jrename.rename;

import java.util.HashSet;
import java.util.Set;
import org.jrename.semantics.SymbolKey;

/** Options of one rename session. Read from JSON by the command line, so the fields are public and mutable. */
public class RenameOptions {
    public boolean renameInStrings;
    public boolean renameInComments;
    /** Also rename the file that declares a renamed type, when the file is named after it. */
    public boolean renameFile;
    /** References that bind to these symbols after the rename are never reported as conflicts. */
    public Set<SymbolKey> nonConflictSymbols = new HashSet<>();

    public RenameOptions() {}

    public RenameOptions(boolean renameInStrings, boolean renameInComments, boolean renameFile) {
        this.renameInStrings = renameInStrings;
        this.renameInComments = renameInComments;
        this.renameFile = renameFile;
    }

    @Override
    public String toString() {
        return String.format(
                "strings=%s comments=%s file=%s nonConflict=%s",
                renameInStrings, renameInComments, renameFile, nonConflictSymbols);
    }
}
