package typesafeschwalbe.algolc.compiler.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.Compiler;
import typesafeschwalbe.algolc.compiler.Programs;
import typesafeschwalbe.algolc.compiler.modes.Mode;
import typesafeschwalbe.algolc.compiler.modes.ModeTable;

public class ParserTest {

    private static Compiler.Compilation valid(String text) {
        Compiler.Compilation compilation = Programs.compile(text);
        assertTrue(
            compilation.succeeded(),
            Programs.describe(compilation.diagnostics())
        );
        return compilation;
    }

    private static int count(Node node, Attribute attribute) {
        int count = 0;
        for(Node child: node.children()) {
            if(child.is(attribute)) { count += 1; }
        }
        return count;
    }

    @Test
    public void parsesThePrintProgram() {
        Compiler.Compilation compilation = ParserTest.valid(
            "BEGIN INT i = 1, j = 2; print (i+j) END"
        );
        Node program = compilation.program();
        ModeTable modes = compilation.session().modes;
        List<Node> declarations = program.findAll(
            Attribute.IDENTITY_DECLARATION
        );
        assertEquals(1, declarations.size());
        assertEquals(2, ParserTest.count(
            declarations.get(0), Attribute.DEFINING_IDENTIFIER
        ));
        Node formula = program.findFirst(Attribute.FORMULA);
        assertNotNull(formula);
        assertTrue(modes.equal(formula.mode, modes.INT));
        assertNotNull(program.findFirst(Attribute.CALL));
        Node rowing = program.findFirst(Attribute.ROWING);
        assertNotNull(rowing);
        assertEquals(Mode.Kind.ROW, modes.kindOf(rowing.mode));
        assertTrue(rowing.sub().is(Attribute.UNITING));
        assertEquals(Mode.Kind.UNION, modes.kindOf(rowing.sub().mode));
    }

    @Test
    public void respectsPriorities() {
        Node program = ParserTest.valid(
            "BEGIN INT a = 1 + 2 * 3; SKIP END"
        ).program();
        Node outer = program.findFirst(Attribute.FORMULA);
        assertEquals("+", outer.child(Attribute.OPERATOR).symbol);
        Node right = outer.sub().last().unwrap();
        assertTrue(right.is(Attribute.FORMULA), right.toString());
        assertEquals("*", right.child(Attribute.OPERATOR).symbol);
    }

    @Test
    public void parsesBriefChoices() {
        Node program = ParserTest.valid(
            "BEGIN BOOL b = TRUE;\n"
                + "  INT x = (b | 1 | 2);\n"
                + "  (b | print (x));\n"
                + "  INT y = (b | 1 |: NOT b | 2 | 3);\n"
                + "  print (y)\n"
                + "END"
        ).program();
        List<Node> clauses = program.findAll(Attribute.CONDITIONAL_CLAUSE);
        assertEquals(4, clauses.size());
        Node full = clauses.get(0);
        assertEquals(1, ParserTest.count(full, Attribute.THEN_PART));
        assertEquals(1, ParserTest.count(full, Attribute.ELSE_PART));
        Node bare = clauses.get(1);
        assertEquals(1, ParserTest.count(bare, Attribute.THEN_PART));
        assertEquals(0, ParserTest.count(bare, Attribute.ELSE_PART));
        Node chained = clauses.get(2);
        assertEquals(
            1, ParserTest.count(chained, Attribute.CONDITIONAL_CLAUSE)
        );
    }

    @Test
    public void parsesBriefCaseClauses() {
        Node program = ParserTest.valid(
            "BEGIN INT n = 2; print ((n | 10, 20 | 30)) END"
        ).program();
        Node clause = program.findFirst(Attribute.CASE_CLAUSE);
        assertNotNull(clause);
        assertEquals(1, ParserTest.count(clause, Attribute.IN_PART));
        assertEquals(1, ParserTest.count(clause, Attribute.OUT_PART));
    }

    @Test
    public void parsesClauses() {
        Node program = ParserTest.valid(
            "BEGIN INT n = 3;\n"
                + "  IF n > 2 THEN print (1) ELSE print (2) FI;\n"
                + "  FOR i TO n DO print (i) OD;\n"
                + "  CASE n IN print (1), print (2) OUT SKIP ESAC\n"
                + "END"
        ).program();
        assertNotNull(program.findFirst(Attribute.CONDITIONAL_CLAUSE));
        assertNotNull(program.findFirst(Attribute.LOOP_CLAUSE));
        assertNotNull(program.findFirst(Attribute.CASE_CLAUSE));
    }

    @Test
    public void joinsDifferentDeclarationsIntoAList() {
        Node program = ParserTest.valid(
            "BEGIN INT i = 1, REAL r = 2.0; INT a, b := 2; a := i; SKIP END"
        ).program();
        Node list = program.findFirst(Attribute.DECLARATION_LIST);
        assertNotNull(list);
        assertNotNull(list.child(Attribute.IDENTITY_DECLARATION));
        assertEquals(2, ParserTest.count(list, Attribute.IDENTITY_DECLARATION));
        Node variables = program.findFirst(Attribute.VARIABLE_DECLARATION);
        assertEquals(2, ParserTest.count(
            variables, Attribute.DEFINING_IDENTIFIER
        ));
    }

    @Test
    public void parsesProcedures() {
        Compiler.Compilation compilation = ParserTest.valid(
            "BEGIN PROC twice = (INT x) INT: x * 2; print (twice (21)) END"
        );
        Node program = compilation.program();
        assertNotNull(program.findFirst(Attribute.PROCEDURE_DECLARATION));
        Node routine = program.findFirst(Attribute.ROUTINE_TEXT);
        assertNotNull(routine);
        ModeTable modes = compilation.session().modes;
        assertEquals(Mode.Kind.PROC, modes.kindOf(routine.mode));
        assertEquals(2, program.findAll(Attribute.CALL).size());
    }

    @Test
    public void reportsDuplicateDeclarations() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN INT x = 1; INT x = 2; SKIP END"
        );
        assertFalse(compilation.succeeded());
        assertTrue(Programs.mentions(
            Programs.errors(compilation),
            "'x' is declared more than once in this range"
        ));
    }

    @Test
    public void innerRangesMayRedeclare() {
        ParserTest.valid("BEGIN INT x = 1; (INT x = 2; print (x)); print (x) END");
    }

    @Test
    public void rejectsPrioritiesOutOfRange() {
        Compiler.Compilation compilation = Programs.compile(
            "BEGIN PRIO MAX = 10; SKIP END"
        );
        assertFalse(compilation.succeeded());
        assertTrue(Programs.mentions(
            Programs.errors(compilation),
            "priority must lie between 1 and 9, not 10"
        ));
    }

}
