package org.jrename.java;

import static org.hamcrest.Matchers.*;
import static org.jrename.TestSolutions.lines;
import static org.junit.Assert.*;

import org.jrename.RenameFixture;
import org.jrename.TestSolutions;
import org.jrename.rename.CancellationToken;
import org.jrename.rename.RenameLocation;
import org.jrename.rename.RenameOptions;
import org.jrename.rename.SymbolicRenameLocations;
import org.jrename.semantics.SymbolKind;
import org.jrename.workspace.Solution;
import org.junit.Test;

public class JavaRenameLocationFinderTest {
    private static final JavaRenameLocationFinder FINDER = new JavaRenameLocationFinder(RenameFixture.COMPILER);

    private static SymbolicRenameLocations find(RenameFixture fixture, String name, String at, RenameOptions options) {
        return FINDER.findRenameLocations(
                fixture.solution, fixture.symbol(name, at), options, CancellationToken.NONE);
    }

    private static long count(SymbolicRenameLocations found, RenameLocation.Kind kind) {
        return found.locations.stream().filter(l -> l.kind == kind).count();
    }

    @Test
    public void overridesAreCascaded() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single(
                                "demo/Shape.java",
                                lines("package demo;", "interface Shape {", "    double area();", "}"),
                                "demo/Square.java",
                                lines(
                                        "package demo;",
                                        "class Square implements Shape {",
                                        "    public double area() { return 1; }",
                                        "    double twice() { return 2 * area(); }",
                                        "}")));
        var found = find(fixture, "demo/Shape.java", "area", new RenameOptions());
        assertThat(found.symbol.kind, equalTo(SymbolKind.METHOD));
        assertThat(count(found, RenameLocation.Kind.DECLARATION), equalTo(2L));
        assertThat(count(found, RenameLocation.Kind.REFERENCE), equalTo(1L));
        assertThat(found.referencedSymbols, hasSize(2));
    }

    @Test
    public void localStaysInItsDocument() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single(
                                "demo/A.java",
                                lines("package demo;", "class A {", "    int f() { int n = 1; return n; }", "}"),
                                "demo/B.java",
                                lines("package demo;", "class B {", "    int n;", "}")));
        var found = find(fixture, "demo/A.java", "n = 1", new RenameOptions());
        assertThat(found.locations, hasSize(2));
        assertThat(FINDER.documentsAffectedByRename(fixture.solution, found), contains(fixture.document("demo/A.java")));
    }

    @Test
    public void publicMemberReachesDependentProjects() {
        var builder = Solution.builder();
        var lib = builder.addProject("lib", "java");
        var app = builder.addProject("app", "java", lib);
        var tool = builder.addProject("tool", "java");
        TestSolutions.addAll(builder, lib, "lib/Base.java", lines("package lib;", "public class Base {", "    public int value;", "}"));
        TestSolutions.addAll(
                builder,
                app,
                "app/Use.java",
                lines("package app;", "class Use {", "    int get(lib.Base b) { return b.value; }", "}"));
        TestSolutions.addAll(builder, tool, "tool/Other.java", lines("package tool;", "class Other { int value; }"));
        var fixture = new RenameFixture(builder.build());
        var found = find(fixture, "lib/Base.java", "value", new RenameOptions());
        assertThat(found.locations, hasSize(2));
        var affected = FINDER.documentsAffectedByRename(fixture.solution, found);
        assertThat(affected, hasItem(fixture.document("app/Use.java")));
        assertThat(affected, not(hasItem(fixture.document("tool/Other.java"))));
    }

    @Test
    public void stringsAndCommentsOnRequest() {
        var source =
                lines(
                        "package demo;",
                        "class Label {",
                        "    // the count",
                        "    int count;",
                        "    String s = \"count and recount\";",
                        "}");
        var fixture = new RenameFixture(TestSolutions.single("demo/Label.java", source));
        var plain = find(fixture, "demo/Label.java", "count;", new RenameOptions());
        assertThat(count(plain, RenameLocation.Kind.STRING_OR_COMMENT), equalTo(0L));

        var strings = find(fixture, "demo/Label.java", "count;", new RenameOptions(true, false, false));
        assertThat(count(strings, RenameLocation.Kind.STRING_OR_COMMENT), equalTo(1L));

        var both = find(fixture, "demo/Label.java", "count;", new RenameOptions(true, true, false));
        assertThat(count(both, RenameLocation.Kind.STRING_OR_COMMENT), equalTo(2L));
        for (var location : both.locations) {
            if (!location.isStringOrComment()) continue;
            assertTrue(location.containingStringOrCommentSpan.get().contains(location.span));
        }
    }

    @Test
    public void implicitIteratorCalls() {
        var source =
                lines(
                        "package demo;",
                        "import java.util.Iterator;",
                        "class Bag implements Iterable<String> {",
                        "    public Iterator<String> iterator() { return java.util.List.of(\"a\").iterator(); }",
                        "    void each() { for (var s : this) { System.out.println(s); } }",
                        "}");
        var fixture = new RenameFixture(TestSolutions.single("demo/Bag.java", source));
        var found = find(fixture, "demo/Bag.java", "iterator()", new RenameOptions());
        assertThat(found.implicitLocations, hasSize(1));
    }

    @Test
    public void locationsAreSorted() {
        var fixture =
                new RenameFixture(
                        TestSolutions.single(
                                "demo/Counter.java",
                                lines(
                                        "package demo;",
                                        "class Counter {",
                                        "    int count;",
                                        "    void inc() { count++; count++; }",
                                        "}")));
        var found = find(fixture, "demo/Counter.java", "count;", new RenameOptions());
        assertThat(found.locations, hasSize(3));
        for (var i = 1; i < found.locations.size(); i++) {
            assertThat(found.locations.get(i - 1).span.start, lessThan(found.locations.get(i).span.start));
        }
    }
}
