package typesafeschwalbe.algolc.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.frontend.Attribute;

public class CompilerTest {

    @Test
    public void compilesAValidProgram() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN INT i = 1, j = 2; print (i+j) END"
        );
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
        assertEquals(PhaseResult.OK, compilation.result());
        assertNotNull(compilation.program());
        assertEquals(
            compilation.session().modes.VOID, compilation.program().mode
        );
    }

    @Test
    public void scanErrorsLeaveNoProgram() {
        Compiler.Compilation compilation = Programs.compile("BEGIN ` END");
        assertFalse(compilation.succeeded());
        assertEquals(PhaseResult.FATAL, compilation.result());
        assertNull(compilation.program());
        assertTrue(Programs.mentions(
            Programs.errors(compilation), "unworthy character"
        ));
    }

    @Test
    public void emptyProgramIsRejected() {
        Compiler.Compilation compilation = Programs.compile("# nothing #");
        assertFalse(compilation.succeeded());
        assertTrue(Programs.mentions(
            Programs.errors(compilation), "program is empty"
        ));
    }

    @Test
    public void syntaxErrorsStopBeforeModeChecking() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN INT i = 1; print ((i + TRUE) END"
        );
        assertFalse(compilation.succeeded());
        List<Diagnostic> errors = Programs.errors(compilation);
        assertEquals(1, errors.size(), Programs.describe(errors));
        assertEquals(Severity.SYNTAX_ERROR, errors.get(0).severity());
        assertFalse(Programs.mentions(errors, "no operator"));
    }

    @Test
    public void undeclaredIdentifiersAreReported() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN INT i = 1; print (k) END"
        );
        assertFalse(compilation.succeeded());
        assertTrue(Programs.mentions(
            Programs.errors(compilation),
            "identifier 'k' has not been declared"
        ));
    }

    @Test
    public void warningsDoNotFailTheCompilation() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN INT i = 1; i; SKIP END"
        );
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
        assertTrue(Programs.mentions(
            Programs.warnings(compilation), "is discarded"
        ));
    }

    @Test
    public void pragmatsSwitchOptionsOff() {
        Compiler.Compilation compilation = Programs.compile(
            "PR nowarnings PR BEGIN INT i = 1; i; SKIP END"
        );
        assertTrue(compilation.succeeded());
        assertFalse(compilation.session().options().warnings());
        assertTrue(Programs.warnings(compilation).isEmpty());
    }

    @Test
    public void reductionsAreTracedOnRequest() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN SKIP END", Options.defaults().withReductions(true)
        );
        assertTrue(compilation.succeeded());
        assertFalse(compilation.session().reductionTrace().isEmpty());
    }

    @Test
    public void checkReportsFailureAsErrors() {
        Result<Compiler.Compilation> result = Compiler.check(
            LineLoader.load("test.a68", "BEGIN INT i = TRUE; SKIP END"),
            Options.defaults()
        );
        assertTrue(result.isError());
        assertTrue(result.getError().get(0).message().contains(
            "cannot be coerced"
        ));
    }

    @Test
    public void treeShowsModes() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN INT i = 1; print (i) END"
        );
        String tree = compilation.program().toTreeString(
            compilation.session()::modeName
        );
        assertTrue(tree.contains(Attribute.IDENTITY_DECLARATION.name()), tree);
        assertTrue(tree.contains("INT"), tree);
    }

    @Test
    public void haltsOnceTooManyErrorsWereReported() {
        StringBuilder text = new StringBuilder("BEGIN ");
        for(int idx = 0; idx < 40; idx += 1) {
            text.append("print (u").append(idx).append(");\n");
        }
        text.append("SKIP END");
        Compiler.Compilation compilation = Programs.compile(text.toString());
        assertEquals(PhaseResult.FATAL, compilation.result());
        assertEquals(
            Diagnostics.MAX_ERRORS + 1,
            Programs.errors(compilation).size()
        );
    }

    @Test
    public void deepNestingIsReportedInsteadOfOverflowing() {
        for(int depth: new int[] { 500, 5000 }) {
            Compiler.Compilation compilation = Programs.compile(
                "BEGIN INT x = " + "(".repeat(depth) + "1"
                    + ")".repeat(depth) + "; print (x) END"
            );
            assertEquals(PhaseResult.FATAL, compilation.result());
            assertTrue(Programs.mentions(
                Programs.errors(compilation), "program too deeply nested"
            ), Programs.describe(compilation.diagnostics()));
        }
        Compiler.Compilation shallow = Programs.compile(
            "BEGIN INT x = " + "(".repeat(20) + "1"
                + ")".repeat(20) + "; print (x) END"
        );
        assertTrue(
            shallow.succeeded(), Programs.describe(shallow.diagnostics())
        );
    }

}
