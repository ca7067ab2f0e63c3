package typesafeschwalbe.algolc.compiler.scope;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.Compiler;
import typesafeschwalbe.algolc.compiler.Programs;

public class ScopeCheckerTest {

    private static Compiler.Compilation compile(String text) {
        return Programs.compile(text);
    }

    @Test
    public void localNamesMustNotLeaveTheirRoutine() {
        Compiler.Compilation compilation = ScopeCheckerTest.compile(
            "BEGIN PROC f = REF INT: (LOC INT x; x); SKIP END"
        );
        assertFalse(compilation.succeeded());
        assertTrue(
            Programs.mentions(Programs.errors(compilation), "escapes its scope"),
            Programs.describe(compilation.diagnostics())
        );
    }

    @Test
    public void heapNamesMayLeaveTheirRoutine() {
        Compiler.Compilation compilation = ScopeCheckerTest.compile(
            "BEGIN PROC f = REF INT: (HEAP INT x; x); SKIP END"
        );
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
    }

    @Test
    public void namesMustNotBeAssignedToOlderNames() {
        Compiler.Compilation compilation = ScopeCheckerTest.compile(
            "BEGIN REF INT outer; (INT local; outer := local); SKIP END"
        );
        assertTrue(
            Programs.mentions(Programs.errors(compilation), "escapes its scope"),
            Programs.describe(compilation.diagnostics())
        );
    }

    @Test
    public void namesOfTheSameRangeMayBeAssigned() {
        Compiler.Compilation compilation = ScopeCheckerTest.compile(
            "BEGIN INT a; REF INT r; r := a; SKIP END"
        );
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
    }

    @Test
    public void routinesCapturingInnerRangesAreWarnedAbout() {
        Compiler.Compilation compilation = ScopeCheckerTest.compile(
            "BEGIN PROC VOID p := VOID: SKIP;\n"
                + "  (INT x = 1; p := VOID: print (x));\n"
                + "  SKIP\n"
                + "END"
        );
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
        assertTrue(Programs.mentions(
            Programs.warnings(compilation), "may outlive the ranges it refers to"
        ));
    }

    @Test
    public void selfReferentialIdentitiesAreWarnedAbout() {
        Compiler.Compilation compilation = ScopeCheckerTest.compile(
            "BEGIN INT x = x + 1; SKIP END"
        );
        assertTrue(Programs.mentions(
            Programs.warnings(compilation),
            "'x' may be used before it is initialised"
        ));
    }

}
