package org.jrename.conflicts;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jrename.conflicts.annotations.RenameActionAnnotation;
import org.jrename.conflicts.annotations.RenameDeclarationLocationReference;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SymbolKey;
import org.jrename.semantics.SymbolKind;
import org.jrename.semantics.SymbolLocation;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.ProjectId;
import org.jrename.workspace.TextSpan;
import org.junit.Test;

public class ConflictCheckerTest {
    private static final DocumentId DOCUMENT = new DocumentId(new ProjectId("main"), "demo/Loop.java");
    // Every position moves 3 characters to the right
    private static final ConflictChecker.PositionAdjuster SHIFT = (documentId, start) -> start + 3;

    private static RenameSymbol field(String name, int start) {
        return new RenameSymbol(
                new SymbolKey("demo/Loop#" + name),
                name,
                SymbolKind.FIELD,
                List.of(SymbolLocation.source(DOCUMENT, new TextSpan(start, name.length()))),
                false,
                Optional.of(new SymbolKey("demo/Loop")),
                Optional.empty(),
                false);
    }

    private static RenameSymbol compiled(String key) {
        return new RenameSymbol(
                new SymbolKey(key),
                key,
                SymbolKind.METHOD,
                List.of(SymbolLocation.metadata(key)),
                false,
                Optional.empty(),
                Optional.empty(),
                false);
    }

    private static RenameActionAnnotation reference(
            boolean isRenameLocation, boolean isOriginalTextLocation, RenameDeclarationLocationReference... refs) {
        return new RenameActionAnnotation(
                new TextSpan(40, 1),
                "i",
                "j",
                isRenameLocation,
                isOriginalTextLocation,
                false,
                false,
                false,
                List.of(refs));
    }

    private static RenameDeclarationLocationReference at(int start) {
        return RenameDeclarationLocationReference.source(DOCUMENT, new TextSpan(start, 1), 1, false);
    }

    private static boolean check(RenameActionAnnotation annotation, RenameSymbol... newSymbols) {
        return ConflictChecker.checkForConflict(annotation, List.of(newSymbols), Set.of(), SHIFT);
    }

    @Test
    public void sameDeclarationAfterShift() {
        assertFalse(check(reference(true, false, at(20)), field("j", 23)));
    }

    @Test
    public void differentDeclaration() {
        assertTrue(check(reference(true, false, at(20)), field("j", 20)));
    }

    @Test
    public void differentDocument() {
        var other = new DocumentId(new ProjectId("main"), "demo/Other.java");
        var symbol =
                new RenameSymbol(
                        new SymbolKey("demo/Other#j"),
                        "j",
                        SymbolKind.FIELD,
                        List.of(SymbolLocation.source(other, new TextSpan(23, 1))),
                        false,
                        Optional.empty(),
                        Optional.empty(),
                        false);
        assertTrue(check(reference(true, false, at(20)), symbol));
    }

    @Test
    public void bindsToNothingNow() {
        assertTrue(check(reference(true, false, at(20))));
    }

    @Test
    public void didNotCompileBeforeAndBindsNow() {
        assertFalse(check(reference(true, false), field("j", 23)));
    }

    @Test
    public void ambiguityPickedByRename() {
        assertFalse(check(reference(false, true, at(20), at(30)), field("j", 50)));
    }

    @Test
    public void ambiguityAtRenameLocationIsAConflict() {
        assertTrue(check(reference(true, false, at(20), at(30)), field("j", 50)));
    }

    @Test
    public void namespaceReferencesNeverConflict() {
        var annotation =
                new RenameActionAnnotation(
                        new TextSpan(0, 4), "demo", "demo", false, true, false, true, false, List.of(at(20)));
        assertFalse(check(annotation));
    }

    @Test
    public void memberGroupMatchesAnyOverload() {
        var annotation =
                new RenameActionAnnotation(
                        new TextSpan(0, 1), "i", "j", true, false, false, false, true, List.of(at(20), at(30)));
        assertFalse(check(annotation, field("j", 33)));
        assertTrue(check(annotation, field("j", 40)));
    }

    @Test
    public void metadataSymbolKeepsItsName() {
        var annotation =
                reference(false, true, RenameDeclarationLocationReference.metadata("java/util/List#size()", 1));
        assertFalse(check(annotation, compiled("java/util/List#size()")));
        assertTrue(check(annotation, compiled("java/util/Collection#size()")));
    }

    @Test
    public void sourceSymbolNowMetadata() {
        assertTrue(check(reference(true, false, at(20)), compiled("java/lang/Object#hashCode()")));
    }

    @Test
    public void sameMetadataSymbol() {
        assertTrue(ConflictChecker.sameMetadataSymbol("a/B#m()", "a/B#m()", "x", "y"));
        assertTrue(ConflictChecker.sameMetadataSymbol("a/B#m(a.Old)", "a/B#m(a.New)", "Old", "New"));
        assertFalse(ConflictChecker.sameMetadataSymbol("a/B#m()", "a/B#n()", "", "n"));
        assertFalse(ConflictChecker.sameMetadataSymbol("a/B#m()", "a/C#m()", "x", "y"));
    }
}
