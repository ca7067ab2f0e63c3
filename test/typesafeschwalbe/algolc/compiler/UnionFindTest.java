package typesafeschwalbe.algolc.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class UnionFindTest {

    @Test
    public void oldestHandleStaysRepresentative() {
        UnionFind<String> sets = new UnionFind<>();
        int a = sets.add("a");
        int b = sets.add("b");
        int c = sets.add("c");
        assertEquals(3, sets.roots());
        assertTrue(sets.union(c, b));
        assertTrue(sets.union(b, a));
        assertFalse(sets.union(a, c));
        assertEquals(a, sets.find(c));
        assertEquals("a", sets.get(c));
        assertEquals("c", sets.getExact(c));
        assertEquals(1, sets.roots());
    }

}
