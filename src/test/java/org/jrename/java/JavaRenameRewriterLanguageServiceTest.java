package org.jrename.java;

import static org.hamcrest.Matchers.*;
import static org.jrename.TestSolutions.lines;
import static org.junit.Assert.*;

import java.util.List;
import org.jrename.RenameFixture;
import org.jrename.TestSolutions;
import org.jrename.workspace.TextSpan;
import org.junit.Test;

public class JavaRenameRewriterLanguageServiceTest {
    private static final JavaRenameRewriterLanguageService SERVICE =
            new JavaRenameRewriterLanguageService(RenameFixture.COMPILER);

    private static final String LAMBDAS =
            lines(
                    "package demo;",
                    "",
                    "import java.util.function.IntSupplier;",
                    "",
                    "class Lambdas {",
                    "    int k = 1;",
                    "",
                    "    void go(int p) {",
                    "        IntSupplier a = () -> k + 1;",
                    "        IntSupplier b = () -> {",
                    "            int n = k;",
                    "            return n;",
                    "        };",
                    "    }",
                    "}");

    private static final String DUPLICATE =
            lines(
                    "package demo;",
                    "",
                    "class Duplicate {",
                    "    void twice() {",
                    "        int n = 1;",
                    "        int n = 2;",
                    "        System.out.println(n);",
                    "    }",
                    "}");

    private final RenameFixture fixture =
            new RenameFixture(
                    TestSolutions.single("demo/Lambdas.java", LAMBDAS, "demo/Duplicate.java", DUPLICATE));

    private TextSpan target(String find) {
        var found =
                SERVICE.expansionTargetForLocation(
                        fixture.solution,
                        fixture.document("demo/Lambdas.java"),
                        fixture.offset("demo/Lambdas.java", find));
        assertTrue(String.format("No expansion target at `%s`", find), found.isPresent());
        return found.get();
    }

    @Test
    public void expressionLambdaEscapesToItsStatement() {
        var span = target("k + 1");
        assertTrue(span.contains(fixture.offset("demo/Lambdas.java", "IntSupplier a")));
        assertFalse(span.contains(fixture.offset("demo/Lambdas.java", "IntSupplier b")));
    }

    @Test
    public void blockLambdaTargetsStatementOfItsBody() {
        var span = target("k;");
        assertTrue(span.contains(fixture.offset("demo/Lambdas.java", "int n")));
        assertFalse(span.contains(fixture.offset("demo/Lambdas.java", "return n")));
        assertFalse(span.contains(fixture.offset("demo/Lambdas.java", "IntSupplier b")));
    }

    @Test
    public void fieldInitializerIsItsOwnTarget() {
        var span = target("k = 1");
        assertTrue(span.contains(fixture.offset("demo/Lambdas.java", "1;")));
    }

    @Test
    public void methodParameterHasNoTarget() {
        var found =
                SERVICE.expansionTargetForLocation(
                        fixture.solution,
                        fixture.document("demo/Lambdas.java"),
                        fixture.offset("demo/Lambdas.java", "p)"));
        assertThat(found.isPresent(), equalTo(false));
    }

    @Test
    public void fieldBindingIsNeverALocalConflict() {
        var field = fixture.symbol("demo/Lambdas.java", "k = 1");
        var at = fixture.offset("demo/Lambdas.java", "k + 1");
        assertFalse(
                SERVICE.localVariableConflict(
                        fixture.solution, fixture.document("demo/Lambdas.java"), new TextSpan(at, 1), List.of(field)));
    }

    @Test
    public void redeclaredLocalIsALocalConflict() {
        var local = fixture.symbol("demo/Duplicate.java", "n = 1");
        var at = fixture.offset("demo/Duplicate.java", "n);");
        assertTrue(
                SERVICE.localVariableConflict(
                        fixture.solution,
                        fixture.document("demo/Duplicate.java"),
                        new TextSpan(at, 1),
                        List.of(local)));
    }
}
