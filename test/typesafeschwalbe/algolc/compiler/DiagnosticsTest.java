package typesafeschwalbe.algolc.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class DiagnosticsTest {

    private static final Source AT = new Source("a.a68", 1, 0, 5);

    @Test
    public void identicalReportsAreKeptOnce() {
        Diagnostics diagnostics = new Diagnostics();
        Diagnostic first = diagnostics.report(
            Severity.ERROR, AT, "'%s' is wrong", "x"
        );
        Diagnostic second = diagnostics.report(
            Severity.ERROR, AT, "'%s' is wrong", "x"
        );
        assertSame(first, second);
        assertEquals(1, diagnostics.errorCount());
        assertEquals(1, diagnostics.all().size());
        diagnostics.report(Severity.ERROR, AT, "'%s' is wrong", "y");
        assertEquals(2, diagnostics.errorCount());
    }

    @Test
    public void warningsDoNotCountAsErrors() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.report(Severity.WARNING, AT, "careful");
        diagnostics.report(Severity.SYNTAX_ERROR, AT, "broken");
        assertEquals(1, diagnostics.errorCount());
        assertEquals(1, diagnostics.warnings().size());
        assertEquals(1, diagnostics.errors().size());
        assertEquals("broken", diagnostics.errors().get(0).message());
    }

    @Test
    public void droppedWarningsAreNotKept() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.setKeepWarnings(false);
        diagnostics.report(Severity.WARNING, AT, "careful");
        assertTrue(diagnostics.all().isEmpty());
    }

    @Test
    public void tooManyErrorsAreDetected() {
        Diagnostics diagnostics = new Diagnostics();
        for(int idx = 0; idx < Diagnostics.MAX_ERRORS; idx += 1) {
            diagnostics.report(Severity.ERROR, AT, "error %d", idx);
        }
        assertFalse(diagnostics.exceeded());
        diagnostics.report(Severity.ERROR, AT, "one more");
        assertTrue(diagnostics.exceeded());
    }

    @Test
    public void abortCarriesTheReportedDiagnostic() {
        Diagnostics diagnostics = new Diagnostics();
        ErrorException e = diagnostics.abort(
            Severity.SYNTAX_ERROR, AT, "missing %s", "END"
        );
        assertEquals("missing END", e.diagnostic.message());
        assertEquals(1, diagnostics.errorCount());
    }

    @Test
    public void errorsRenderWithTheirSourceLine() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.report(Severity.ERROR, AT, "bad begin");
        Error error = diagnostics.toErrors().get(0);
        String rendered = error.render(
            java.util.Map.of("a.a68", "BEGIN SKIP END"), false
        );
        assertTrue(rendered.startsWith("error: bad begin\n"));
        assertTrue(rendered.contains("a.a68:1:1"));
        assertTrue(rendered.contains("BEGIN SKIP END"));
    }

    @Test
    public void nothingIsKeptPastTheCap() {
        Diagnostics diagnostics = new Diagnostics();
        for(int idx = 0; idx < 3 * Diagnostics.MAX_ERRORS; idx += 1) {
            diagnostics.report(Severity.ERROR, AT, "error %d", idx);
        }
        diagnostics.report(Severity.WARNING, AT, "late");
        assertTrue(diagnostics.exceeded());
        assertEquals(Diagnostics.MAX_ERRORS + 1, diagnostics.errorCount());
        assertEquals(Diagnostics.MAX_ERRORS + 1, diagnostics.all().size());
        assertTrue(diagnostics.warnings().isEmpty());
    }

    @Test
    public void errorsWithoutASourceRenderTheirMessageOnly() {
        Error warning = new Error(Severity.WARNING, "careful");
        assertEquals(0, warning.markings().length);
        assertEquals(
            "warning: careful\n", warning.render(java.util.Map.of(), false)
        );
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.report(Severity.ERROR, null, "no place");
        assertEquals(
            "error: no place\n",
            diagnostics.toErrors().get(0).render(java.util.Map.of(), false)
        );
    }

}
