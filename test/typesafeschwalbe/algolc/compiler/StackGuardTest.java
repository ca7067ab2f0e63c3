package typesafeschwalbe.algolc.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class StackGuardTest {

    @Test
    public void abortsBeyondTheLimit() throws ErrorException {
        Diagnostics diagnostics = new Diagnostics();
        StackGuard guard = new StackGuard(diagnostics, 3);
        guard.enter(null);
        guard.enter(null);
        guard.enter(null);
        assertEquals(3, guard.depth());
        ErrorException e = assertThrows(
            ErrorException.class, () -> guard.enter(null)
        );
        assertEquals("program too deeply nested", e.diagnostic.message());
        assertEquals(0, guard.depth());
    }

    @Test
    public void exitNeverGoesNegative() {
        StackGuard guard = new StackGuard(new Diagnostics(), 3);
        guard.exit();
        assertEquals(0, guard.depth());
    }

    @Test
    public void abortsOnceTooManyErrorsWereReported() {
        Diagnostics diagnostics = new Diagnostics();
        StackGuard guard = new StackGuard(diagnostics, 3);
        for(int idx = 0; idx <= Diagnostics.MAX_ERRORS; idx += 1) {
            diagnostics.report(Severity.ERROR, null, "error %d", idx);
        }
        ErrorException e = assertThrows(
            ErrorException.class, () -> guard.enter(null)
        );
        assertEquals(
            "too many errors, giving up on this program",
            e.diagnostic.message()
        );
    }

}
