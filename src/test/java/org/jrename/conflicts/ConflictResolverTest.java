package org.jrename.conflicts;

import static org.hamcrest.Matchers.*;
import static org.jrename.RenameFixture.count;
import static org.jrename.TestSolutions.lines;
import static org.junit.Assert.*;

import java.util.Map;
import java.util.concurrent.CancellationException;
import org.eclipse.lsp4j.RenameFile;
import org.jrename.RenameFixture;
import org.jrename.TestSolutions;
import org.jrename.rename.CancellationToken;
import org.jrename.rename.RenameOptions;
import org.jrename.semantics.SymbolKey;
import org.jrename.workspace.Solution;
import org.junit.Test;

public class ConflictResolverTest {
    private static final String COUNTER =
            lines(
                    "package demo;",
                    "",
                    "public class Counter {",
                    "    int count;",
                    "",
                    "    void increment() {",
                    "        count++;",
                    "    }",
                    "}");
    private static final String USE =
            lines(
                    "package demo;",
                    "",
                    "class Use {",
                    "    int twice(Counter c) {",
                    "        return c.count * 2;",
                    "    }",
                    "}");

    @Test
    public void renameFieldEverywhere() {
        var fixture = new RenameFixture(TestSolutions.single("demo/Counter.java", COUNTER, "demo/Use.java", USE));
        var resolution = fixture.rename("demo/Counter.java", "count;", "total");
        assertTrue(resolution.isSuccessful());
        assertThat(resolution.unresolvedConflictCount(), equalTo(0));
        assertThat(fixture.newText(resolution, "demo/Counter.java"), containsString("int total;"));
        assertThat(fixture.newText(resolution, "demo/Counter.java"), containsString("total++;"));
        assertThat(fixture.newText(resolution, "demo/Use.java"), containsString("return c.total * 2;"));
        assertThat(resolution.documentIds(), hasSize(2));
    }

    @Test
    public void renameToSameNameChangesNothing() {
        var fixture = new RenameFixture(TestSolutions.single("demo/Counter.java", COUNTER, "demo/Use.java", USE));
        var resolution = fixture.rename("demo/Counter.java", "count;", "count");
        assertTrue(resolution.isSuccessful());
        assertThat(resolution.unresolvedConflictCount(), equalTo(0));
        assertThat(resolution.documentIds(), empty());
        assertThat(fixture.newText(resolution, "demo/Counter.java"), equalTo(COUNTER));
    }

    @Test
    public void qualifyFieldCapturedByRenamedLocal() {
        var loop =
                lines(
                        "package demo;",
                        "",
                        "class Loop {",
                        "    int j;",
                        "",
                        "    int sum() {",
                        "        int s = 0;",
                        "        for (int i = 0; i < 3; i++) {",
                        "            s += i + j;",
                        "        }",
                        "        return s;",
                        "    }",
                        "}");
        var fixture = new RenameFixture(TestSolutions.single("demo/Loop.java", loop));
        var resolution = fixture.rename("demo/Loop.java", "i = 0", "j");
        assertThat(resolution.unresolvedConflictCount(), equalTo(0));
        var text = fixture.newText(resolution, "demo/Loop.java");
        assertThat(text, containsString("for (int j = 0; j < 3; j++) {"));
        assertThat(text, containsString("s += j + this.j;"));
        var qualified = fixture.relatedLocation(resolution, "demo/Loop.java", "j;", 1);
        assertThat(qualified.type, equalTo(RelatedLocationType.RESOLVED_NON_REFERENCE_CONFLICT));
        assertFalse(qualified.isReference);
    }

    @Test
    public void capturedLocalCannotBeQualified() {
        var capture =
                lines(
                        "package demo;",
                        "",
                        "class Capture {",
                        "    int compute() {",
                        "        int j = 10;",
                        "        Runnable r = new Runnable() {",
                        "            public void run() {",
                        "                int total = 0;",
                        "                for (int i = 0; i < 3; i++) {",
                        "                    total += i * j;",
                        "                }",
                        "                System.out.println(total);",
                        "            }",
                        "        };",
                        "        r.run();",
                        "        return j;",
                        "    }",
                        "}");
        var fixture = new RenameFixture(TestSolutions.single("demo/Capture.java", capture));
        var resolution = fixture.rename("demo/Capture.java", "i = 0", "j");
        assertTrue(resolution.isSuccessful());
        assertThat(resolution.unresolvedConflictCount(), equalTo(1));
        var captured = fixture.relatedLocation(resolution, "demo/Capture.java", "j;", 0);
        assertThat(captured.type, equalTo(RelatedLocationType.UNRESOLVED_CONFLICT));
        assertThat(fixture.newText(resolution, "demo/Capture.java"), containsString("total += j * j;"));
    }

    @Test
    public void superQualifiesInheritedFieldAcrossProjects() {
        var builder = Solution.builder();
        var lib = builder.addProject("lib", "java");
        var app = builder.addProject("app", "java", lib);
        TestSolutions.addAll(
                builder,
                lib,
                "lib/Base.java",
                lines("package lib;", "", "public class Base {", "    protected int value = 2;", "}"));
        TestSolutions.addAll(
                builder,
                app,
                "app/Derived.java",
                lines(
                        "package app;",
                        "",
                        "import lib.Base;",
                        "",
                        "public class Derived extends Base {",
                        "    int scale = 3;",
                        "",
                        "    int product() {",
                        "        return value * scale;",
                        "    }",
                        "}"));
        var fixture = new RenameFixture(builder.build());
        var resolution = fixture.rename("lib/Base.java", "value", "scale");
        assertThat(resolution.unresolvedConflictCount(), equalTo(0));
        assertThat(fixture.newText(resolution, "lib/Base.java"), containsString("protected int scale = 2;"));
        assertThat(fixture.newText(resolution, "app/Derived.java"), containsString("return super.scale * scale;"));
        var reference = fixture.relatedLocation(resolution, "app/Derived.java", "value", 0);
        assertThat(reference.type, equalTo(RelatedLocationType.RESOLVED_REFERENCE_CONFLICT));
        assertTrue(reference.isReference);
    }

    @Test
    public void overridingMethodsAreRenamedTogether() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single(
                                "demo/Shape.java",
                                lines("package demo;", "", "interface Shape {", "    double area();", "}"),
                                "demo/Circle.java",
                                lines(
                                        "package demo;",
                                        "",
                                        "class Circle implements Shape {",
                                        "    double r = 1;",
                                        "",
                                        "    public double area() {",
                                        "        return 3 * r * r;",
                                        "    }",
                                        "}"),
                                "demo/Total.java",
                                lines(
                                        "package demo;",
                                        "",
                                        "class Total {",
                                        "    double sum(Shape s, Circle c) {",
                                        "        return s.area() + c.area();",
                                        "    }",
                                        "}")));
        var resolution = fixture.rename("demo/Shape.java", "area", "surface");
        assertThat(resolution.unresolvedConflictCount(), equalTo(0));
        assertThat(fixture.newText(resolution, "demo/Shape.java"), containsString("double surface();"));
        assertThat(fixture.newText(resolution, "demo/Circle.java"), containsString("public double surface() {"));
        assertThat(
                fixture.newText(resolution, "demo/Total.java"), containsString("return s.surface() + c.surface();"));
    }

    private static RenameFixture dispatch() {
        return new RenameFixture(
                TestSolutions.single(
                        "demo/Base.java",
                        lines(
                                "package demo;",
                                "",
                                "class Base {",
                                "    String foo() {",
                                "        return \"base\";",
                                "    }",
                                "}"),
                        "demo/Derived.java",
                        lines(
                                "package demo;",
                                "",
                                "class Derived extends Base {",
                                "    String bar() {",
                                "        return \"derived\";",
                                "    }",
                                "}"),
                        "demo/Call.java",
                        lines(
                                "package demo;",
                                "",
                                "class Call {",
                                "    String run() {",
                                "        Base b = new Derived();",
                                "        return b.foo();",
                                "    }",
                                "}")));
    }

    @Test
    public void renameThatGainsAnOverride() {
        var fixture = dispatch();
        var resolution = fixture.rename("demo/Base.java", "foo", "bar");
        assertTrue(resolution.isSuccessful());
        assertThat(resolution.unresolvedConflictCount(), greaterThan(0));
        var overriding = fixture.relatedLocation(resolution, "demo/Derived.java", "bar", 0);
        assertThat(overriding.type, equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));
        var renamed = fixture.relatedLocation(resolution, "demo/Base.java", "foo", 0);
        assertThat(renamed.type, equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));
    }

    @Test
    public void renameThatNowOverridesSupertypeMethod() {
        var fixture = dispatch();
        var resolution = fixture.rename("demo/Derived.java", "bar", "foo");
        assertTrue(resolution.isSuccessful());
        assertThat(resolution.unresolvedConflictCount(), greaterThan(0));
        var overridden = fixture.relatedLocation(resolution, "demo/Base.java", "foo", 0);
        assertThat(overridden.type, equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));
        assertThat(fixture.newText(resolution, "demo/Call.java"), containsString("return b.foo();"));
    }

    @Test
    public void renameToObjectMethodChangesDispatch() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single(
                                "demo/Label.java",
                                lines(
                                        "package demo;",
                                        "",
                                        "class Label {",
                                        "    public String text() {",
                                        "        return \"label\";",
                                        "    }",
                                        "}")));
        var resolution = fixture.rename("demo/Label.java", "text", "toString");
        assertThat(resolution.unresolvedConflictCount(), greaterThan(0));
        var renamed = fixture.relatedLocation(resolution, "demo/Label.java", "text", 0);
        assertThat(renamed.type, equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));
    }

    @Test
    public void conflictThatExpansionCannotFixEndsUnresolved() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single(
                                "demo/Base.java",
                                lines("package demo;", "", "class Base {", "    protected int value = 2;", "}"),
                                "demo/Phases.java",
                                lines(
                                        "package demo;",
                                        "",
                                        "class Phases {",
                                        "    int run() {",
                                        "        int scale = 3;",
                                        "        Base b = new Base() {",
                                        "            int times(int scale) {",
                                        "                return value * scale;",
                                        "            }",
                                        "",
                                        "            int product() {",
                                        "                return value + scale;",
                                        "            }",
                                        "        };",
                                        "        return scale;",
                                        "    }",
                                        "}")));
        // The reference in times() is fixed by expanding references; the captured local in product() is still
        // wrong after every later phase
        var resolution = fixture.rename("demo/Base.java", "value", "scale");
        assertTrue(resolution.isSuccessful());
        assertThat(resolution.unresolvedConflictCount(), equalTo(1));
        var text = fixture.newText(resolution, "demo/Phases.java");
        assertThat(text, containsString("return super.scale * scale;"));
        var reference = fixture.relatedLocation(resolution, "demo/Phases.java", "value *", 0);
        assertThat(reference.type, equalTo(RelatedLocationType.RESOLVED_REFERENCE_CONFLICT));
        var captured = fixture.relatedLocation(resolution, "demo/Phases.java", "scale;", 1);
        assertThat(captured.type, equalTo(RelatedLocationType.UNRESOLVED_CONFLICT));
        assertFalse(captured.isReference);
        assertThat(count(resolution, RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT), equalTo(0L));
    }

    @Test
    public void renamingIteratorBreaksEnhancedFor() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single(
                                "demo/Bag.java",
                                lines(
                                        "package demo;",
                                        "",
                                        "import java.util.Iterator;",
                                        "import java.util.List;",
                                        "",
                                        "class Bag implements Iterable<String> {",
                                        "    public Iterator<String> iterator() {",
                                        "        return List.of(\"a\").iterator();",
                                        "    }",
                                        "",
                                        "    void each() {",
                                        "        for (var s : this) {",
                                        "            System.out.println(s);",
                                        "        }",
                                        "    }",
                                        "}")));
        var resolution = fixture.rename("demo/Bag.java", "iterator() {", "items");
        assertTrue(resolution.isSuccessful());
        var loop = fixture.relatedLocation(resolution, "demo/Bag.java", "this) {", 0);
        assertThat(loop.type, equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));
    }

    @Test
    public void renamingToIteratorOfIterable() {
        var source =
                lines(
                        "package demo;",
                        "",
                        "import java.util.Iterator;",
                        "import java.util.List;",
                        "",
                        "abstract class Source implements Iterable<String> {",
                        "    public Iterator<String> items() {",
                        "        return List.of(\"a\").iterator();",
                        "    }",
                        "}");
        var fixture = new RenameFixture(TestSolutions.single("demo/Source.java", source));
        var resolution = fixture.rename("demo/Source.java", "items", "iterator");
        var declaration = fixture.relatedLocation(resolution, "demo/Source.java", "items", 0);
        assertThat(declaration.type, equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));

        var notIterable = source.replace(" implements Iterable<String>", "");
        var plain = new RenameFixture(TestSolutions.single("demo/Source.java", notIterable));
        var unrelated = plain.rename("demo/Source.java", "items", "iterator");
        assertThat(unrelated.unresolvedConflictCount(), equalTo(0));
    }

    @Test
    public void sameSpanRenamedTwoWaysFails() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single(
                                "demo/Shape.java",
                                lines("package demo;", "", "interface Shape {", "    double area();", "}"),
                                "demo/Circle.java",
                                lines(
                                        "package demo;",
                                        "",
                                        "class Circle implements Shape {",
                                        "    public double area() {",
                                        "        return 3;",
                                        "    }",
                                        "}")));
        // Renaming either method renames both declarations
        var resolution =
                new ConflictResolver(RenameFixture.LANGUAGES)
                        .resolveConflicts(
                                fixture.solution,
                                Map.of(
                                        fixture.symbol("demo/Shape.java", "area"), "x",
                                        fixture.symbol("demo/Circle.java", "area"), "y"),
                                new RenameOptions(),
                                CancellationToken.NONE);
        assertFalse(resolution.isSuccessful());
        assertThat(resolution.failure().get().message, containsString("renamed twice"));
        assertThat(resolution.relatedLocations(), empty());
        try {
            resolution.newSolution();
            fail("A failed rename has no new solution");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("renamed twice"));
        }
    }

    @Test
    public void renameTypeRenamesConstructorsAndFile() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single(
                                "demo/Point.java",
                                lines(
                                        "package demo;",
                                        "",
                                        "public class Point {",
                                        "    Point() {}",
                                        "",
                                        "    static Point origin() {",
                                        "        return new Point();",
                                        "    }",
                                        "}")));
        var options = new RenameOptions(false, false, true);
        var resolution = fixture.rename("demo/Point.java", "Point {", "Spot", options);
        assertThat(resolution.unresolvedConflictCount(), equalTo(0));
        var documentId = fixture.document("demo/Point.java");
        var text = RenameFixture.newText(resolution, documentId);
        assertThat(text, containsString("public class Spot {"));
        assertThat(text, containsString("    Spot() {}"));
        assertThat(text, containsString("static Spot origin() {"));
        assertThat(text, containsString("return new Spot();"));
        assertThat(resolution.renamedDocuments(), hasEntry(documentId, "Spot.java"));
        assertThat(resolution.newSolution().document(documentId).name, equalTo("demo/Spot.java"));
    }

    @Test
    public void workspaceEditEndsWithFileRename() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single("demo/Point.java", lines("package demo;", "", "public class Point {}")));
        var resolution = fixture.rename("demo/Point.java", "Point {", "Spot", new RenameOptions(false, false, true));
        var changes = resolution.toWorkspaceEdit().getDocumentChanges();
        assertThat(changes, hasSize(2));
        var textEdit = changes.get(0).getLeft();
        assertThat(textEdit.getEdits(), hasSize(1));
        assertThat(textEdit.getEdits().get(0).getNewText(), equalTo("Spot"));
        assertThat(textEdit.getEdits().get(0).getRange().getStart().getLine(), equalTo(2));
        assertThat(textEdit.getEdits().get(0).getRange().getStart().getCharacter(), equalTo(13));
        var renameFile = (RenameFile) changes.get(1).getRight();
        assertThat(renameFile.getOldUri(), endsWith("demo/Point.java"));
        assertThat(renameFile.getNewUri(), endsWith("demo/Spot.java"));
    }

    @Test
    public void fileKeepsNameWithoutRenameFileOption() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single("demo/Point.java", lines("package demo;", "", "public class Point {}")));
        var resolution = fixture.rename("demo/Point.java", "Point {", "Spot");
        assertThat(resolution.renamedDocuments().entrySet(), empty());
        assertThat(resolution.newSolution().document(fixture.document("demo/Point.java")).name, equalTo("demo/Point.java"));
    }

    @Test
    public void stringsAndCommentsOnlyWhenAsked() {
        var source =
                lines(
                        "package demo;",
                        "",
                        "class Label {",
                        "    // count of items",
                        "    int count;",
                        "    String describe() {",
                        "        return \"count=\" + count;",
                        "    }",
                        "}");
        var fixture = new RenameFixture(TestSolutions.single("demo/Label.java", source));
        var plain = fixture.newText(fixture.rename("demo/Label.java", "count;", "size"), "demo/Label.java");
        assertThat(plain, containsString("// count of items"));
        assertThat(plain, containsString("return \"count=\" + size;"));

        var strings = fixture.rename("demo/Label.java", "count;", "size", new RenameOptions(true, false, false));
        var withStrings = fixture.newText(strings, "demo/Label.java");
        assertThat(withStrings, containsString("// count of items"));
        assertThat(withStrings, containsString("return \"size=\" + size;"));

        var comments = fixture.rename("demo/Label.java", "count;", "size", new RenameOptions(true, true, false));
        var withComments = fixture.newText(comments, "demo/Label.java");
        assertThat(withComments, containsString("// size of items"));
        assertThat(withComments, containsString("return \"size=\" + size;"));
    }

    @Test
    public void clashingFieldIsUnresolvable() {
        var source =
                lines(
                        "package demo;",
                        "",
                        "class Pair {",
                        "    int left;",
                        "    int right;",
                        "}");
        var fixture = new RenameFixture(TestSolutions.single("demo/Pair.java", source));
        var resolution = fixture.rename("demo/Pair.java", "left", "right");
        assertTrue(resolution.isSuccessful());
        assertThat(resolution.unresolvedConflictCount(), greaterThan(0));
        var other = fixture.relatedLocation(resolution, "demo/Pair.java", "right", 0);
        assertThat(other.type, equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));
    }

    @Test
    public void clashingLocalIsUnresolvable() {
        var source =
                lines(
                        "package demo;",
                        "",
                        "class Locals {",
                        "    int add() {",
                        "        int a = 1;",
                        "        int b = 2;",
                        "        return a + b;",
                        "    }",
                        "}");
        var fixture = new RenameFixture(TestSolutions.single("demo/Locals.java", source));
        var resolution = fixture.rename("demo/Locals.java", "b = 2", "a");
        assertThat(resolution.unresolvedConflictCount(), greaterThan(0));
        var renamed = fixture.relatedLocation(resolution, "demo/Locals.java", "b = 2", 0);
        assertThat(renamed.type, equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));
    }

    @Test
    public void invalidIdentifierMarksEveryLocationUnresolved() {
        var fixture = new RenameFixture(TestSolutions.single("demo/Counter.java", COUNTER, "demo/Use.java", USE));
        var resolution = fixture.rename("demo/Counter.java", "count;", "class");
        assertTrue(resolution.isSuccessful());
        assertFalse(resolution.replacementTextValid());
        assertThat(resolution.unresolvedConflictCount(), equalTo(3));
        assertThat(fixture.newText(resolution, "demo/Use.java"), containsString("return c.class * 2;"));
    }

    @Test
    public void nonConflictSymbolsAreNeverReported() {
        var loop =
                lines(
                        "package demo;",
                        "",
                        "class Capture {",
                        "    void go() {",
                        "        int j = 10;",
                        "        new Thread() {",
                        "            public void run() {",
                        "                for (int i = 0; i < j; i++) {}",
                        "            }",
                        "        };",
                        "    }",
                        "}");
        var fixture = new RenameFixture(TestSolutions.single("demo/Capture.java", loop));
        var loopVariable = fixture.symbol("demo/Capture.java", "i = 0");
        var options = new RenameOptions();
        // after the rename, `j` binds to the loop variable
        options.nonConflictSymbols.add(
                new SymbolKey(loopVariable.key.toString().replace("local:i@", "local:j@")));
        var plain = fixture.rename("demo/Capture.java", "i = 0", "j");
        assertThat(plain.unresolvedConflictCount(), equalTo(1));
        var allowed = fixture.rename("demo/Capture.java", "i = 0", "j", options);
        assertThat(allowed.unresolvedConflictCount(), equalTo(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void blankReplacementIsRejected() {
        var fixture = new RenameFixture(TestSolutions.single("demo/Counter.java", COUNTER));
        new ConflictResolver(RenameFixture.LANGUAGES)
                .resolveConflicts(
                        fixture.solution,
                        Map.of(fixture.symbol("demo/Counter.java", "count;"), " "),
                        new RenameOptions(),
                        CancellationToken.NONE);
    }

    @Test(expected = CancellationException.class)
    public void cancellationIsNotAFailure() {
        var fixture = new RenameFixture(TestSolutions.single("demo/Counter.java", COUNTER));
        var token = new CancellationToken();
        token.cancel();
        new ConflictResolver(RenameFixture.LANGUAGES)
                .resolveConflicts(
                        fixture.solution,
                        Map.of(fixture.symbol("demo/Counter.java", "count;"), "total"),
                        new RenameOptions(),
                        token);
    }
}
