package typesafeschwalbe.algolc.compiler.modes;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.frontend.Node;
import typesafeschwalbe.algolc.compiler.symbols.Symbols;
import typesafeschwalbe.algolc.compiler.symbols.Tag;

public class StandardEnvironment {

    private static final Logger LOGGER
        = Logger.getLogger(StandardEnvironment.class.getName());

    private static final String[][] PRIORITIES = {
        {},
        {
            "+:=", "-:=", "*:=", "/:=", "%:=", "%*:=", "+=:",
            "PLUSAB", "MINUSAB", "TIMESAB", "DIVAB", "OVERAB", "MODAB",
            "PLUSTO"
        },
        { "OR" },
        { "AND", "&", "XOR" },
        { "=", "/=", "EQ", "NE" },
        { "<", "<=", ">", ">=", "LT", "LE", "GT", "GE" },
        { "+", "-" },
        { "*", "/", "%", "%*", "OVER", "MOD", "ELEM" },
        { "**", "UP", "DOWN", "SHL", "SHR", "LWB", "UPB", "ELEMS" },
        { "+*", "I" }
    };

    private static final String[] ORDERINGS = {
        "<", "<=", ">", ">=", "LT", "LE", "GT", "GE"
    };
    private static final String[] EQUALITIES = { "=", "/=", "EQ", "NE" };

    private final CompilationSession session;
    private final Symbols symbols;
    private final ModeTable modes;
    private int table;
    private int declared;

    public StandardEnvironment(CompilationSession session) {
        this.session = session;
        this.symbols = session.symbols;
        this.modes = session.modes;
    }

    public void declare() {
        this.table = this.symbols.newTable(Node.NONE);
        this.session.standardTable = this.table;
        this.declared = 0;
        this.declareIndicants();
        this.declarePriorities();
        for(int length = 0; length < ModeTable.LENGTHS.length; length += 1) {
            this.declareArithmetic(length);
        }
        this.declareBooleans();
        this.declareCharacters();
        this.declareRows();
        this.declareIdentifiers();
        LOGGER.fine(
            "declared " + this.declared + " standard tags, "
                + this.modes.count() + " modes"
        );
    }

    private int mode(String name) {
        int mode = this.modes.standard(name);
        if(mode == Node.NONE) {
            throw new IllegalStateException("no standard mode " + name + "!");
        }
        return mode;
    }

    private Tag tag(Tag.Kind kind, String name, int mode) {
        Tag tag = this.symbols.declare(
            this.table, kind, name, null, Tag.Origin.STANDARD
        );
        tag.mode = mode;
        this.declared += 1;
        return tag;
    }

    private void operator(String name, int result, int... operands) {
        List<Integer> parameters = new ArrayList<>();
        for(int operand: operands) { parameters.add(operand); }
        this.tag(Tag.Kind.OPERATOR, name, this.modes.proc(parameters, result));
    }

    private void operators(String[] names, int result, int... operands) {
        for(String name: names) {
            this.operator(name, result, operands);
        }
    }

    private void identifier(String name, int mode) {
        this.tag(Tag.Kind.IDENTIFIER, name, mode);
    }

    private int routine(int result, int... parameters) {
        List<Integer> pack = new ArrayList<>();
        for(int parameter: parameters) { pack.add(parameter); }
        return this.modes.proc(pack, result);
    }

    // modes

    private void declareIndicants() {
        for(String name: List.of(
            "INT", "REAL", "BITS", "BYTES", "COMPL", "BOOL", "CHAR", "STRING",
            "FORMAT", "FILE", "SEMA"
        )) {
            this.tag(Tag.Kind.INDICANT, name, this.mode(name));
        }
        this.tag(Tag.Kind.INDICANT, "SIMPLOUT", this.simplout());
        this.tag(Tag.Kind.INDICANT, "SIMPLIN", this.simplin());
        this.modes.setTransput(this.simplout(), this.simplin());
    }

    private int layout() {
        return this.routine(this.modes.VOID, this.modes.ref(this.modes.FILE));
    }

    private int simplout() {
        List<Integer> members = new ArrayList<>();
        for(String length: ModeTable.LENGTHS) {
            members.add(this.mode(length + "INT"));
            members.add(this.mode(length + "REAL"));
            members.add(this.mode(length + "COMPL"));
            members.add(this.mode(length + "BITS"));
        }
        members.add(this.modes.BOOL);
        members.add(this.modes.CHAR);
        members.add(this.modes.ROW_CHAR);
        members.add(this.layout());
        return this.modes.union(members);
    }

    private int simplin() {
        List<Integer> members = new ArrayList<>();
        for(String length: ModeTable.LENGTHS) {
            members.add(this.modes.ref(this.mode(length + "INT")));
            members.add(this.modes.ref(this.mode(length + "REAL")));
            members.add(this.modes.ref(this.mode(length + "COMPL")));
            members.add(this.modes.ref(this.mode(length + "BITS")));
        }
        members.add(this.modes.ref(this.modes.BOOL));
        members.add(this.modes.ref(this.modes.CHAR));
        members.add(this.modes.ref(this.modes.STRING));
        members.add(this.layout());
        return this.modes.union(members);
    }

    // operators

    private void declarePriorities() {
        for(int priority = 1; priority < PRIORITIES.length; priority += 1) {
            for(String name: PRIORITIES[priority]) {
                Tag tag = this.tag(Tag.Kind.PRIORITY, name, Node.NONE);
                tag.priority = priority;
            }
        }
    }

    private void declareArithmetic(int length) {
        String prefix = ModeTable.LENGTHS[length];
        int integer = this.mode(prefix + "INT");
        int real = this.mode(prefix + "REAL");
        int compl = this.mode(prefix + "COMPL");
        int bits = this.mode(prefix + "BITS");
        int bool = this.modes.BOOL;
        int plainInt = this.modes.INT;
        for(int number: new int[] { integer, real }) {
            int name = this.modes.ref(number);
            this.operators(new String[] { "+", "-", "*" }, number, number, number);
            this.operators(new String[] { "**", "UP" }, number, number, plainInt);
            this.operators(ORDERINGS, bool, number, number);
            this.operators(EQUALITIES, bool, number, number);
            this.operators(new String[] { "+", "-", "ABS" }, number, number);
            this.operator("SIGN", plainInt, number);
            this.operators(
                new String[] {
                    "+:=", "PLUSAB", "-:=", "MINUSAB", "*:=", "TIMESAB"
                },
                name, name, number
            );
        }
        this.operator("/", real, integer, integer);
        this.operator("/", real, real, real);
        this.operators(
            new String[] { "%", "OVER", "%*", "MOD" }, integer, integer, integer
        );
        this.operator("ODD", bool, integer);
        this.operators(new String[] { "ENTIER", "ROUND" }, integer, real);
        this.operators(
            new String[] { "/:=", "DIVAB" },
            this.modes.ref(real), this.modes.ref(real), real
        );
        this.operators(
            new String[] { "%:=", "OVERAB", "%*:=", "MODAB" },
            this.modes.ref(integer), this.modes.ref(integer), integer
        );
        // complex numbers
        this.operators(new String[] { "+", "-", "*", "/" }, compl, compl, compl);
        this.operators(EQUALITIES, bool, compl, compl);
        this.operators(new String[] { "RE", "IM", "ABS", "ARG" }, real, compl);
        this.operators(new String[] { "CONJ", "-", "+" }, compl, compl);
        this.operators(new String[] { "I", "+*" }, compl, real, real);
        this.operators(new String[] { "**", "UP" }, compl, compl, plainInt);
        this.operators(
            new String[] {
                "+:=", "PLUSAB", "-:=", "MINUSAB", "*:=", "TIMESAB",
                "/:=", "DIVAB"
            },
            this.modes.ref(compl), this.modes.ref(compl), compl
        );
        // bits
        this.operators(new String[] { "AND", "&", "OR" }, bits, bits, bits);
        this.operator("NOT", bits, bits);
        this.operators(EQUALITIES, bool, bits, bits);
        this.operators(
            new String[] { "SHL", "UP", "SHR", "DOWN" }, bits, bits, plainInt
        );
        this.operator("ABS", integer, bits);
        this.operator("BIN", bits, integer);
        this.operator("ELEM", bool, plainInt, bits);
        // changing lengths
        if(length + 1 < ModeTable.LENGTHS.length) {
            String longer = ModeTable.LENGTHS[length + 1];
            this.operator("LENG", this.mode(longer + "INT"), integer);
            this.operator("LENG", this.mode(longer + "REAL"), real);
            this.operator("LENG", this.mode(longer + "COMPL"), compl);
            this.operator("LENG", this.mode(longer + "BITS"), bits);
            this.operator("SHORTEN", integer, this.mode(longer + "INT"));
            this.operator("SHORTEN", real, this.mode(longer + "REAL"));
            this.operator("SHORTEN", compl, this.mode(longer + "COMPL"));
            this.operator("SHORTEN", bits, this.mode(longer + "BITS"));
        }
    }

    private void declareBooleans() {
        int bool = this.modes.BOOL;
        this.operators(
            new String[] { "AND", "&", "OR", "XOR" }, bool, bool, bool
        );
        this.operators(new String[] { "NOT", "~" }, bool, bool);
        this.operators(EQUALITIES, bool, bool, bool);
        this.operator("ABS", this.modes.INT, bool);
        this.operator("LEVEL", this.modes.SEMA, this.modes.INT);
        this.operator("LEVEL", this.modes.INT, this.modes.SEMA);
        this.operators(
            new String[] { "UP", "DOWN" }, this.modes.VOID, this.modes.SEMA
        );
    }

    private void declareCharacters() {
        int bool = this.modes.BOOL;
        int character = this.modes.CHAR;
        int string = this.modes.STRING;
        int integer = this.modes.INT;
        this.operators(ORDERINGS, bool, character, character);
        this.operators(EQUALITIES, bool, character, character);
        this.operator("ABS", integer, character);
        this.operator("REPR", character, integer);
        this.operator("+", string, character, character);
        this.operator("+", string, string, string);
        this.operator("+", string, string, character);
        this.operator("+", string, character, string);
        this.operator("*", string, integer, string);
        this.operator("*", string, string, integer);
        this.operator("*", string, integer, character);
        this.operator("*", string, character, integer);
        this.operators(ORDERINGS, bool, string, string);
        this.operators(EQUALITIES, bool, string, string);
        this.operators(EQUALITIES, bool, this.modes.BYTES, this.modes.BYTES);
        int name = this.modes.ref(string);
        this.operators(new String[] { "+:=", "PLUSAB" }, name, name, string);
        this.operators(new String[] { "+:=", "PLUSAB" }, name, name, character);
        this.operators(new String[] { "*:=", "TIMESAB" }, name, name, integer);
        this.operators(new String[] { "+=:", "PLUSTO" }, name, string, name);
        this.operators(new String[] { "+=:", "PLUSTO" }, name, character, name);
    }

    private void declareRows() {
        int integer = this.modes.INT;
        int rows = this.modes.ROWS;
        this.operators(new String[] { "UPB", "LWB", "ELEMS" }, integer, rows);
        this.operators(
            new String[] { "UPB", "LWB", "ELEMS" }, integer, integer, rows
        );
    }

    // identifiers

    private void declareIdentifiers() {
        int real = this.modes.REAL;
        int integer = this.modes.INT;
        int string = this.modes.STRING;
        int file = this.modes.ref(this.modes.FILE);
        this.identifier(
            "print", this.routine(this.modes.VOID, this.modes.row(1, this.simplout()))
        );
        this.identifier(
            "write", this.routine(this.modes.VOID, this.modes.row(1, this.simplout()))
        );
        this.identifier(
            "read", this.routine(this.modes.VOID, this.modes.row(1, this.simplin()))
        );
        for(String name: List.of("newline", "newpage", "space", "backspace")) {
            this.identifier(name, this.layout());
        }
        for(String name: List.of("standout", "standin", "standback")) {
            this.identifier(name, file);
        }
        this.identifier("pi", real);
        this.identifier("maxint", integer);
        this.identifier("maxreal", real);
        this.identifier("smallreal", real);
        this.identifier("blank", this.modes.CHAR);
        this.identifier("errorchar", this.modes.CHAR);
        for(String name: List.of(
            "sqrt", "exp", "ln", "sin", "cos", "tan", "arcsin", "arccos",
            "arctan"
        )) {
            this.identifier(name, this.routine(real, real));
        }
        this.identifier("random", this.routine(real));
        List<Integer> numbers = new ArrayList<>();
        for(String length: ModeTable.LENGTHS) {
            numbers.add(this.mode(length + "INT"));
            numbers.add(this.mode(length + "REAL"));
        }
        int number = this.modes.union(numbers);
        this.identifier("whole", this.routine(string, number, integer));
        this.identifier("fixed", this.routine(string, number, integer, integer));
        this.identifier(
            "float", this.routine(string, number, integer, integer, integer)
        );
    }

}
