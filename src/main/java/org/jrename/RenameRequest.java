package org.jrename;

import java.util.ArrayList;
import java.util.List;
import org.jrename.rename.RenameOptions;

/**
 * What the command line renames, read from JSON. Paths are relative to the directory of the request file. Lines and
 * columns start at 1.
 */
public class RenameRequest {
    public List<ProjectConfig> projects = new ArrayList<>();
    public String file;
    public int line, column;
    public String newName;
    public RenameOptions options = new RenameOptions();

    public static class ProjectConfig {
        public String name;
        public String language = "java";
        /** Source roots; every {@code .java} file below them belongs to the project. */
        public List<String> sourceRoots = new ArrayList<>();
        /** Names of referenced projects. */
        public List<String> references = new ArrayList<>();
    }
}
