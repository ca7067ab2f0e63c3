package typesafeschwalbe.algolc.compiler.frontend;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Programs;
import typesafeschwalbe.algolc.compiler.Severity;

public class BracketCheckerTest {

    private static String failure(String text) throws ErrorException {
        CompilationSession session = Programs.session();
        Node program = Programs.scan(session, text);
        ErrorException e = assertThrows(
            ErrorException.class,
            () -> new BracketChecker(session.diagnostics).check(program)
        );
        assertEquals(Severity.SYNTAX_ERROR, e.diagnostic.severity());
        assertEquals(1, session.diagnostics.errorCount());
        return e.diagnostic.message();
    }

    @Test
    public void acceptsNestedBrackets() throws ErrorException {
        CompilationSession session = Programs.session();
        Node program = Programs.scan(
            session,
            "BEGIN IF a THEN (b) ELSE CASE c IN d ESAC FI; "
                + "FOR i TO 2 DO x[i] := i OD END"
        );
        assertDoesNotThrow(
            () -> new BracketChecker(session.diagnostics).check(program)
        );
    }

    @Test
    public void reportsAMissingCloser() throws ErrorException {
        assertEquals(
            "missing FI to match IF", BracketCheckerTest.failure("IF a THEN b")
        );
    }

    @Test
    public void reportsAStrayCloser() throws ErrorException {
        assertEquals(
            "END without a matching BEGIN",
            BracketCheckerTest.failure("SKIP END")
        );
    }

    @Test
    public void reportsInterleavedBrackets() throws ErrorException {
        assertEquals(
            "missing ) to match ( before END",
            BracketCheckerTest.failure("BEGIN (SKIP END )")
        );
    }

}
