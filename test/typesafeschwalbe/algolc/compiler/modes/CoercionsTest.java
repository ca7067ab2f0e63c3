package typesafeschwalbe.algolc.compiler.modes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.frontend.Attribute;
import typesafeschwalbe.algolc.compiler.frontend.Node;

public class CoercionsTest {

    private final ModeTable modes = new ModeTable();
    private final Coercions coercions = new Coercions(this.modes);

    private List<Attribute> steps(int from, int to, Sort sort) {
        List<Coercions.Step> plan = this.coercions.plan(from, to, sort);
        assertTrue(plan != null, "no plan");
        return plan.stream().map(Coercions.Step::coercion).toList();
    }

    @Test
    public void strongerSortsAllowEverythingWeakerOnesDo() {
        int refInt = this.modes.ref(this.modes.INT);
        int[][] pairs = {
            { refInt, this.modes.INT },
            { this.modes.ref(refInt), refInt },
            { this.modes.INT, this.modes.REAL },
            { this.modes.INT, this.modes.union(List.of(
                this.modes.INT, this.modes.BOOL
            )) },
            { this.modes.proc(List.of(), this.modes.INT), this.modes.INT }
        };
        Sort[] sorts = Sort.values();
        for(int[] pair: pairs) {
            for(int idx = 0; idx + 1 < sorts.length; idx += 1) {
                if(this.coercions.coercible(pair[0], pair[1], sorts[idx])) {
                    assertTrue(this.coercions.coercible(
                        pair[0], pair[1], sorts[idx + 1]
                    ));
                }
            }
        }
    }

    @Test
    public void dereferencingNeedsAMeekPosition() {
        int refInt = this.modes.ref(this.modes.INT);
        assertFalse(this.coercions.coercible(refInt, this.modes.INT, Sort.SOFT));
        assertFalse(this.coercions.coercible(refInt, this.modes.INT, Sort.WEAK));
        assertEquals(
            List.of(Attribute.DEREFERENCING),
            this.steps(refInt, this.modes.INT, Sort.MEEK)
        );
    }

    @Test
    public void weakDereferencingKeepsAName() {
        int refInt = this.modes.ref(this.modes.INT);
        assertEquals(
            List.of(Attribute.DEREFERENCING),
            this.steps(this.modes.ref(refInt), refInt, Sort.WEAK)
        );
    }

    @Test
    public void wideningNeedsAStrongPosition() {
        assertFalse(this.coercions.coercible(
            this.modes.INT, this.modes.REAL, Sort.FIRM
        ));
        assertEquals(
            List.of(Attribute.WIDENING),
            this.steps(this.modes.INT, this.modes.REAL, Sort.STRONG)
        );
        assertEquals(
            List.of(Attribute.WIDENING, Attribute.WIDENING),
            this.steps(this.modes.INT, this.modes.COMPL, Sort.STRONG)
        );
    }

    @Test
    public void unitingNeedsAFirmPosition() {
        int union = this.modes.union(List.of(this.modes.INT, this.modes.BOOL));
        assertFalse(this.coercions.coercible(this.modes.INT, union, Sort.MEEK));
        assertEquals(
            List.of(Attribute.UNITING),
            this.steps(this.modes.INT, union, Sort.FIRM)
        );
        assertFalse(this.coercions.coercible(
            this.modes.CHAR, union, Sort.STRONG
        ));
    }

    @Test
    public void anythingIsVoidedInAStrongPosition() {
        assertEquals(
            List.of(Attribute.VOIDING),
            this.steps(this.modes.INT, this.modes.VOID, Sort.STRONG)
        );
        assertNull(this.coercions.plan(
            this.modes.INT, this.modes.VOID, Sort.FIRM
        ));
        int proc = this.modes.proc(List.of(), this.modes.INT);
        assertEquals(
            List.of(Attribute.DEPROCEDURING, Attribute.VOIDING),
            this.steps(proc, this.modes.VOID, Sort.STRONG)
        );
    }

    @Test
    public void rowsAnElement() {
        int row = this.modes.row(1, this.modes.REAL);
        assertEquals(
            List.of(Attribute.WIDENING, Attribute.ROWING),
            this.steps(this.modes.INT, row, Sort.STRONG)
        );
    }

    @Test
    public void hipAndVacuumFitAnywhere() {
        assertEquals(
            List.of(),
            this.steps(this.modes.HIP, this.modes.REAL, Sort.SOFT)
        );
        assertEquals(
            List.of(),
            this.steps(this.modes.VACUUM, this.modes.STRING, Sort.STRONG)
        );
    }

    @Test
    public void balancesToTheStrongestBranch() {
        assertEquals(
            this.modes.REAL,
            this.coercions.balance(List.of(this.modes.INT, this.modes.REAL))
        );
        assertEquals(
            this.modes.STRING,
            this.coercions.balance(List.of(this.modes.ROW_CHAR, this.modes.STRING))
        );
        assertEquals(
            this.modes.INT,
            this.coercions.balance(List.of(this.modes.HIP, this.modes.INT))
        );
        assertEquals(
            Node.NONE,
            this.coercions.balance(List.of(this.modes.BOOL, this.modes.INT))
        );
    }

    @Test
    public void transputTakesRowsAndStructures() {
        int simplout = this.modes.union(List.of(
            this.modes.INT, this.modes.REAL, this.modes.ROW_CHAR
        ));
        int simplin = this.modes.union(List.of(
            this.modes.ref(this.modes.INT), this.modes.ref(this.modes.STRING)
        ));
        this.modes.setTransput(simplout, simplin);
        int rowInt = this.modes.row(1, this.modes.INT);
        int rowSimplout = this.modes.row(1, simplout);
        assertEquals(
            List.of(Attribute.UNITING, Attribute.ROWING),
            this.steps(rowInt, rowSimplout, Sort.STRONG)
        );
        assertEquals(
            List.of(
                Attribute.DEREFERENCING, Attribute.UNITING, Attribute.ROWING
            ),
            this.steps(this.modes.ref(rowInt), rowSimplout, Sort.STRONG)
        );
        int pair = this.modes.struct(List.of(
            new Mode.Field("a", this.modes.INT),
            new Mode.Field("b", this.modes.REAL)
        ));
        assertEquals(
            List.of(Attribute.UNITING),
            this.steps(pair, simplout, Sort.STRONG)
        );
        assertNull(this.coercions.plan(pair, simplout, Sort.FIRM));
        int pointer = this.modes.struct(List.of(
            new Mode.Field("p", this.modes.ref(this.modes.INT))
        ));
        assertNull(this.coercions.plan(pointer, simplout, Sort.STRONG));
        assertEquals(
            List.of(Attribute.UNITING),
            this.steps(this.modes.ref(rowInt), simplin, Sort.STRONG)
        );
        assertNull(this.coercions.plan(rowInt, simplin, Sort.STRONG));
    }


}
