package typesafeschwalbe.algolc.compiler.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.Compiler;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Programs;

public class RefinementsTest {

    private static String symbols(Node program) {
        StringBuilder out = new StringBuilder();
        for(Node token: program.children()) {
            if(out.length() > 0) { out.append(' '); }
            out.append(token.symbol);
        }
        return out.toString();
    }

    @Test
    public void splicesRefinementBodies() throws ErrorException {
        CompilationSession session = Programs.session();
        Node program = Programs.scan(
            session, "BEGIN step; done END. step: x := 1. done: SKIP."
        );
        new Refinements(session.diagnostics).apply(program);
        assertEquals(
            "BEGIN x := 1 ; SKIP END", RefinementsTest.symbols(program)
        );
        assertEquals(0, session.diagnostics.errorCount());
    }

    @Test
    public void programsWithoutRefinementsAreUntouched() throws ErrorException {
        CompilationSession session = Programs.session();
        Node program = Programs.scan(session, "BEGIN SKIP END");
        new Refinements(session.diagnostics).apply(program);
        assertEquals("BEGIN SKIP END", RefinementsTest.symbols(program));
    }

    @Test
    public void refinementsCompile() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN INT x := 1; increase; print (x) END.\n"
                + "increase: x := x + 1."
        );
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
    }

    @Test
    public void unusedRefinementsAreReported() throws ErrorException {
        CompilationSession session = Programs.session();
        Node program = Programs.scan(session, "BEGIN SKIP END. unused: SKIP.");
        new Refinements(session.diagnostics).apply(program);
        assertTrue(Programs.mentions(
            session.diagnostics.errors(), "refinement 'unused' is not applied"
        ));
    }

    @Test
    public void repeatedApplicationIsFatal() throws ErrorException {
        CompilationSession session = Programs.session();
        Node program = Programs.scan(
            session, "BEGIN twice; twice END. twice: SKIP."
        );
        ErrorException e = assertThrows(
            ErrorException.class,
            () -> new Refinements(session.diagnostics).apply(program)
        );
        assertEquals(
            "refinement 'twice' is applied more than once",
            e.diagnostic.message()
        );
    }

    @Test
    public void duplicateDefinitionsAreReported() throws ErrorException {
        CompilationSession session = Programs.session();
        Node program = Programs.scan(
            session, "BEGIN a END. a: SKIP. a: SKIP."
        );
        new Refinements(session.diagnostics).apply(program);
        assertTrue(Programs.mentions(
            session.diagnostics.errors(),
            "refinement 'a' is defined more than once"
        ));
    }

}
