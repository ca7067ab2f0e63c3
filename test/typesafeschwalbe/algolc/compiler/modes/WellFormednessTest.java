package typesafeschwalbe.algolc.compiler.modes;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.Compiler;
import typesafeschwalbe.algolc.compiler.Programs;

public class WellFormednessTest {

    private static boolean wellFormed(String declaration) {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN " + declaration + "; SKIP END"
        );
        return !Programs.mentions(
            Programs.errors(compilation), "is not well formed"
        );
    }

    @Test
    public void acceptsModesShieldedByANameAndAStructure() {
        assertTrue(WellFormednessTest.wellFormed(
            "MODE LIST = STRUCT (REF LIST next, INT value)"
        ));
        assertTrue(WellFormednessTest.wellFormed(
            "MODE TREE = STRUCT (INT key, [] TREE children)"
        ));
        assertTrue(WellFormednessTest.wellFormed(
            "MODE F = PROC (F) INT"
        ));
    }

    @Test
    public void rejectsANameOfItself() {
        assertFalse(WellFormednessTest.wellFormed("MODE A = REF A"));
    }

    @Test
    public void rejectsAStructureContainingItself() {
        assertFalse(WellFormednessTest.wellFormed(
            "MODE BAD = STRUCT (BAD next, INT value)"
        ));
    }

    @Test
    public void rejectsCyclesOfIndicants() {
        assertFalse(WellFormednessTest.wellFormed("MODE A = B, B = A"));
    }

    @Test
    public void rejectsAUnionContainingItself() {
        assertFalse(WellFormednessTest.wellFormed(
            "MODE U = UNION (INT, U)"
        ));
    }

}
