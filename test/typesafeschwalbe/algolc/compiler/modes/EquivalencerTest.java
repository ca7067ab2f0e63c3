package typesafeschwalbe.algolc.compiler.modes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.Compiler;
import typesafeschwalbe.algolc.compiler.Programs;

public class EquivalencerTest {

    private static int recursive(ModeTable modes, String name, int tag, int value) {
        int indicant = modes.indicant(name, tag);
        modes.exact(indicant).definition = modes.struct(List.of(
            new Mode.Field("next", modes.ref(indicant)),
            new Mode.Field("value", value)
        ));
        return indicant;
    }

    @Test
    public void recursiveModesWithTheSameShapeAreEqual() {
        ModeTable modes = new ModeTable();
        int a = EquivalencerTest.recursive(modes, "A", 100, modes.INT);
        int b = EquivalencerTest.recursive(modes, "B", 101, modes.INT);
        int c = EquivalencerTest.recursive(modes, "C", 102, modes.REAL);
        assertTrue(modes.equivalencer().equivalent(a, b));
        assertFalse(modes.equivalencer().equivalent(a, c));
        assertTrue(modes.equal(modes.ref(a), modes.ref(b)));
    }

    @Test
    public void fieldNamesMatter() {
        ModeTable modes = new ModeTable();
        int point = modes.struct(List.of(
            new Mode.Field("x", modes.REAL), new Mode.Field("y", modes.REAL)
        ));
        assertFalse(modes.equal(point, modes.COMPL));
    }

    @Test
    public void unionsAreFlattenedAndUnordered() {
        ModeTable modes = new ModeTable();
        int inner = modes.union(List.of(modes.INT, modes.REAL));
        int outer = modes.union(List.of(inner, modes.BOOL));
        assertEquals(3, modes.equivalencer().flatMembers(outer).size());
        assertTrue(modes.equal(
            modes.union(List.of(modes.INT, modes.REAL)),
            modes.union(List.of(modes.REAL, modes.INT))
        ));
    }

    @Test
    public void declaredRecursiveModesAreIdentified() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN MODE A = STRUCT (REF A next, INT value),\n"
                + "      B = STRUCT (REF B next, INT value);\n"
                + "  A a := (NIL, 1); B b := a; SKIP\n"
                + "END"
        );
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
    }

    @Test
    public void equivalenceIsSymmetric() {
        ModeTable modes = new ModeTable();
        int a = EquivalencerTest.recursive(modes, "A", 100, modes.INT);
        int b = EquivalencerTest.recursive(modes, "B", 101, modes.INT);
        int c = EquivalencerTest.recursive(modes, "C", 102, modes.REAL);
        int[] all = {
            a, b, c, modes.ref(a), modes.ref(b),
            modes.union(List.of(a, modes.INT)),
            modes.union(List.of(modes.INT, b))
        };
        Equivalencer equivalencer = modes.equivalencer();
        for(int x: all) {
            for(int y: all) {
                assertEquals(
                    equivalencer.equivalent(x, y),
                    equivalencer.equivalent(y, x),
                    modes.toString(x) + " and " + modes.toString(y)
                );
            }
        }
    }

    @Test
    public void equivalencingReachesAFixedPoint() {
        ModeTable modes = new ModeTable();
        int a = EquivalencerTest.recursive(modes, "A", 100, modes.INT);
        EquivalencerTest.recursive(modes, "B", 101, modes.INT);
        EquivalencerTest.recursive(modes, "C", 102, modes.REAL);
        modes.union(List.of(modes.union(List.of(a, modes.INT)), modes.BOOL));
        modes.equivalencer().run();
        int classes = modes.classes().roots();
        assertEquals(1, modes.equivalencer().run());
        assertEquals(classes, modes.classes().roots());
    }

}
