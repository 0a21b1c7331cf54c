package org.jrename.java;

import org.jrename.rename.LanguageServices;

/** Wires the Java services together around one shared compiler. */
public class JavaLanguage {
    public static final String LANGUAGE = "java";

    private JavaLanguage() {}

    public static LanguageServices create() {
        return create(new JavaCompilerService());
    }

    public static LanguageServices create(JavaCompilerService compiler) {
        return new LanguageServices(
                LANGUAGE,
                compiler,
                new JavaRenameLocationFinder(compiler),
                new JavaRenameRewriterLanguageService(compiler));
    }
}
