package typesafeschwalbe.algolc.compiler.modes;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.Compiler;
import typesafeschwalbe.algolc.compiler.Diagnostic;
import typesafeschwalbe.algolc.compiler.Programs;
import typesafeschwalbe.algolc.compiler.frontend.Attribute;
import typesafeschwalbe.algolc.compiler.frontend.Node;

public class ModeCheckerTest {

    private static Compiler.Compilation valid(String text) {
        Compiler.Compilation compilation = Programs.compile(text);
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
        return compilation;
    }

    private static void rejected(String text, String fragment) {
        Compiler.Compilation compilation = Programs.compile(text);
        List<Diagnostic> errors = Programs.errors(compilation);
        assertFalse(compilation.succeeded());
        assertTrue(
            Programs.mentions(errors, fragment),
            Programs.describe(errors)
        );
    }

    @Test
    public void acceptsWellTypedPrograms() {
        ModeCheckerTest.valid(
            "BEGIN INT i := 1; REAL r := i; [3] INT a;\n"
                + "  a[1] := i + 1; r := r * 2;\n"
                + "  STRING s := \"abc\"; CHAR c = s[2];\n"
                + "  BOOL b = i < 2 AND r > 1.0;\n"
                + "  print ((i, r, a[1], s, c, b))\n"
                + "END"
        );
    }

    @Test
    public void rejectsIncoercibleSources() {
        ModeCheckerTest.rejected(
            "BEGIN INT i = TRUE; SKIP END",
            "BOOL cannot be coerced to INT in a strong position"
        );
    }

    @Test
    public void rejectsUnknownOperators() {
        ModeCheckerTest.rejected(
            "BEGIN INT i = 1 + TRUE; SKIP END", "no operator + found for"
        );
    }

    @Test
    public void widensMixedOperands() {
        Compiler.Compilation compilation = ModeCheckerTest.valid(
            "BEGIN REAL r = 1 + 2.0; SKIP END"
        );
        ModeTable modes = compilation.session().modes;
        Node formula = compilation.program().findFirst(Attribute.FORMULA);
        assertTrue(modes.equal(formula.mode, modes.REAL));
    }

    @Test
    public void briefChoiceOnAnIntegerIsACaseClause() {
        Node program = ModeCheckerTest.valid(
            "BEGIN INT n = 2; print ((n | 10 | 30)) END"
        ).program();
        assertNotNull(program.findFirst(Attribute.CASE_CLAUSE));
        assertNull(program.findFirst(Attribute.CONDITIONAL_CLAUSE));
    }

    @Test
    public void conditionsMustBeBoolean() {
        ModeCheckerTest.rejected(
            "BEGIN IF 1 THEN SKIP FI END", "cannot be coerced to BOOL"
        );
    }

    @Test
    public void balancesBranches() {
        Compiler.Compilation compilation = ModeCheckerTest.valid(
            "BEGIN BOOL b = TRUE; print ((b | 1 | 2.5) + 1) END"
        );
        ModeTable modes = compilation.session().modes;
        Node clause = compilation.program().findFirst(
            Attribute.CONDITIONAL_CLAUSE
        );
        assertTrue(modes.equal(clause.mode, modes.REAL));
        ModeCheckerTest.rejected(
            "BEGIN BOOL b = TRUE; print ((b | 1 | TRUE) + 1) END",
            "have no common mode"
        );
    }

    @Test
    public void rejectsAssigningToAValue() {
        ModeCheckerTest.rejected(
            "BEGIN 1 := 2 END",
            "the destination of an assignation must be a name, not INT"
        );
    }

    @Test
    public void rejectsOversizedDenotations() {
        ModeCheckerTest.rejected(
            "BEGIN INT i = 2147483648; SKIP END",
            "integral denotation 2147483648 is too large for INT"
        );
        ModeCheckerTest.valid(
            "BEGIN LONG INT i = LONG 2147483648; SKIP END"
        );
    }

    @Test
    public void checksCalls() {
        ModeCheckerTest.rejected(
            "BEGIN PROC f = (INT x) INT: x; print (f (1, 2)) END",
            "takes 1 arguments, but 2 are given"
        );
        ModeCheckerTest.rejected(
            "BEGIN INT i = 1; print (i (1)) END",
            "INT can neither be sliced nor called"
        );
    }

    @Test
    public void checksSlices() {
        ModeCheckerTest.rejected(
            "BEGIN [2, 2] INT m; m[1] := 1 END",
            "has 2 dimensions, but 1 subscripts are given"
        );
    }

    @Test
    public void checksSelections() {
        ModeCheckerTest.valid(
            "BEGIN STRUCT (INT a, REAL b) s = (1, 2.0); print (b OF s) END"
        );
        ModeCheckerTest.rejected(
            "BEGIN STRUCT (INT a, REAL b) s = (1, 2.0); print (c OF s) END",
            "has no field 'c'"
        );
        ModeCheckerTest.rejected(
            "BEGIN STRUCT (INT a, REAL b) s = (1, 2.0, 3); SKIP END",
            "has 2 fields, 3 values given"
        );
    }

    @Test
    public void nilNeedsAName() {
        ModeCheckerTest.valid("BEGIN REF INT r = NIL; SKIP END");
        ModeCheckerTest.rejected(
            "BEGIN INT i = NIL; SKIP END",
            "NIL cannot stand where INT is expected"
        );
    }

    @Test
    public void checksConformityClauses() {
        ModeCheckerTest.valid(
            "BEGIN UNION (INT, REAL) u = 1;\n"
                + "  CASE u IN (INT i): print (i), (REAL r): print (r) ESAC\n"
                + "END"
        );
        ModeCheckerTest.rejected(
            "BEGIN UNION (INT, REAL) u = 1;\n"
                + "  CASE u IN (BOOL b): print (b) ESAC\n"
                + "END",
            "is not a member of"
        );
    }

    @Test
    public void userOperatorsAreIdentified() {
        ModeCheckerTest.valid(
            "BEGIN OP MAX = (INT a, b) INT: (a > b | a | b);\n"
                + "  PRIO MAX = 9;\n"
                + "  print (3 MAX 4)\n"
                + "END"
        );
    }

    @Test
    public void printsRowsAndStructures() {
        ModeCheckerTest.valid("BEGIN []INT a = 5; print (a) END");
        ModeCheckerTest.valid(
            "BEGIN [1:3] INT a; a[1] := 2; print (a) END"
        );
        ModeCheckerTest.valid(
            "BEGIN STRUCT(INT a, REAL b) s = (1, 2.0); print (s) END"
        );
        ModeCheckerTest.valid("BEGIN [3] INT a; read (a); print (a) END");
        ModeCheckerTest.rejected(
            "BEGIN PROC VOID p = SKIP; print (p) END",
            "cannot be coerced to"
        );
    }

}
