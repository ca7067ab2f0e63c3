package typesafeschwalbe.algolc.compiler.modes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.Compiler;
import typesafeschwalbe.algolc.compiler.Programs;
import typesafeschwalbe.algolc.compiler.frontend.Attribute;
import typesafeschwalbe.algolc.compiler.frontend.Node;

public class CoercionInserterTest {

    private static Compiler.Compilation valid(String text) {
        Compiler.Compilation compilation = Programs.compile(text);
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
        return compilation;
    }

    @Test
    public void dereferencesVariablesInFormulas() {
        Compiler.Compilation compilation = CoercionInserterTest.valid(
            "BEGIN INT i := 1; INT j = i + 1; SKIP END"
        );
        ModeTable modes = compilation.session().modes;
        Node formula = compilation.program().findFirst(Attribute.FORMULA);
        Node dereferenced = formula.findFirst(Attribute.DEREFERENCING);
        assertNotNull(dereferenced);
        assertTrue(modes.equal(dereferenced.mode, modes.INT));
        assertEquals(
            Mode.Kind.REF, modes.kindOf(dereferenced.sub().mode)
        );
    }

    @Test
    public void widensIdentitySources() {
        Compiler.Compilation compilation = CoercionInserterTest.valid(
            "BEGIN REAL r = 1; SKIP END"
        );
        ModeTable modes = compilation.session().modes;
        Node widened = compilation.program().findFirst(Attribute.WIDENING);
        assertNotNull(widened);
        assertTrue(modes.equal(widened.mode, modes.REAL));
        assertTrue(widened.sub().unwrap().is(Attribute.DENOTATION));
    }

    @Test
    public void voidsNonFinalUnits() {
        Compiler.Compilation compilation = CoercionInserterTest.valid(
            "BEGIN INT i := 1; i := 2; SKIP END"
        );
        List<Node> voided = compilation.program().findAll(Attribute.VOIDING);
        assertEquals(1, voided.size());
        assertTrue(voided.get(0).sub().unwrap().is(Attribute.ASSIGNATION));
        assertTrue(Programs.warnings(compilation).isEmpty());
    }

    @Test
    public void warnsWhenAValueIsDiscarded() {
        Compiler.Compilation compilation = CoercionInserterTest.valid(
            "BEGIN INT i = 1; i + 1; SKIP END"
        );
        assertTrue(Programs.mentions(
            Programs.warnings(compilation), "the value of a formula is discarded"
        ));
    }

    @Test
    public void jumpsToParameterlessProceduresAreProcedured() {
        Compiler.Compilation compilation = CoercionInserterTest.valid(
            "BEGIN PROC VOID p = GOTO done; p; done: SKIP END"
        );
        assertNotNull(compilation.program().findFirst(Attribute.PROCEDURING));
    }

}
