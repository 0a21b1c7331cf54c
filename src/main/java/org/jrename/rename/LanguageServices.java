package org.jrename.rename;

import java.util.Objects;
import org.jrename.semantics.SemanticService;

/** The implementations one language contributes to the rename engine. */
public final class LanguageServices {
    public final String language;
    public final SemanticService semantics;
    public final RenameLocationFinder finder;
    public final RenameRewriterLanguageService rewriter;

    public LanguageServices(
            String language,
            SemanticService semantics,
            RenameLocationFinder finder,
            RenameRewriterLanguageService rewriter) {
        this.language = Objects.requireNonNull(language);
        this.semantics = Objects.requireNonNull(semantics);
        this.finder = Objects.requireNonNull(finder);
        this.rewriter = Objects.requireNonNull(rewriter);
    }
}
