package typesafeschwalbe.algolc.compiler.modes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.frontend.Node;

public class ModeTableTest {

    @Test
    public void internsStructurallyIdenticalModes() {
        ModeTable modes = new ModeTable();
        assertEquals(modes.ref(modes.INT), modes.ref(modes.INT));
        assertEquals(
            modes.proc(List.of(modes.INT), modes.REAL),
            modes.proc(List.of(modes.INT), modes.REAL)
        );
        assertNotEquals(modes.row(1, modes.INT), modes.row(2, modes.INT));
    }

    @Test
    public void knowsTheStandardModes() {
        ModeTable modes = new ModeTable();
        assertNotEquals(Node.NONE, modes.standard("LONG LONG REAL"));
        assertNotEquals(Node.NONE, modes.standard("LONG COMPL"));
        assertEquals(Node.NONE, modes.standard("SHORT INT"));
        assertEquals(Mode.Kind.FLEX, modes.kindOf(modes.STRING));
        assertEquals(Mode.Kind.STRUCT, modes.kindOf(modes.COMPL));
        assertTrue(modes.isStandard(modes.flex(modes.ROW_CHAR), "STRING"));
    }

    @Test
    public void printsModes() {
        ModeTable modes = new ModeTable();
        assertEquals("REF INT", modes.toString(modes.ref(modes.INT)));
        assertEquals("[] REAL", modes.toString(modes.row(1, modes.REAL)));
        assertEquals("[,] BOOL", modes.toString(modes.row(2, modes.BOOL)));
        assertEquals("STRING", modes.toString(modes.STRING));
        assertEquals("REF STRING", modes.toString(modes.ref(modes.STRING)));
        assertEquals("no mode", modes.toString(Node.NONE));
    }

    @Test
    public void indicantsResolveToTheirDefinition() {
        ModeTable modes = new ModeTable();
        int list = modes.indicant("LIST", 100);
        int struct = modes.struct(List.of(
            new Mode.Field("next", modes.ref(list)),
            new Mode.Field("value", modes.INT)
        ));
        modes.exact(list).definition = struct;
        assertEquals(Mode.Kind.STRUCT, modes.kindOf(list));
        assertEquals("LIST", modes.toString(list));
        assertTrue(modes.equal(list, struct));
    }

    @Test
    public void deflexingKeepsNamesFlexible() {
        ModeTable modes = new ModeTable();
        assertEquals(modes.ROW_CHAR, modes.deflex(modes.STRING));
        int refString = modes.ref(modes.STRING);
        assertTrue(modes.equal(refString, modes.deflex(refString)));
        assertFalse(modes.equal(modes.STRING, modes.ROW_CHAR));
    }

}
