package typesafeschwalbe.algolc.compiler.modes;

import java.util.List;

import typesafeschwalbe.algolc.compiler.frontend.Node;

public class Mode {

    public enum Kind {
        STANDARD,  // name
        INDICANT,  // name, tag, definition
        REF,       // sub
        PROC,      // pack (parameters), sub (result)
        ROW,       // dimensions, sub
        FLEX,      // sub
        STRUCT,    // pack (fields)
        UNION,     // pack (members)
        SERIES,    // pack, the modes of a balanced clause before unification
        STOWED,    // pack, the modes of a collateral display
        VOID,
        HIP,       // SKIP, NIL and jumps
        VACUUM,    // an empty collateral clause
        ROWS,      // any row, the operand of UPB and LWB
        ERROR;

        @Override
        public String toString() {
            switch(this) {
                case STANDARD: return "a standard mode";
                case INDICANT: return "a mode indicant";
                case REF: return "a name";
                case PROC: return "a procedure";
                case ROW: return "a row";
                case FLEX: return "a flexible row";
                case STRUCT: return "a structure";
                case UNION: return "a united mode";
                case SERIES: return "a series of modes";
                case STOWED: return "a stowed display";
                case VOID: return "VOID";
                case HIP: return "a mode that coerces to any other";
                case VACUUM: return "an empty display";
                case ROWS: return "any row";
                case ERROR: return "an erroneous mode";
                default:
                    throw new RuntimeException("unhandled mode kind!");
            }
        }
    }

    public static record Field(String name, int mode) {}

    public final Kind kind;
    public final String name;
    public final int tag;
    public final int sub;
    public final int dimensions;
    public final List<Field> pack;

    // the declared mode of an indicant, filled in by the mode collector
    public int definition = Node.NONE;

    private Mode(
        Kind kind, String name, int tag, int sub, int dimensions,
        List<Field> pack
    ) {
        this.kind = kind;
        this.name = name;
        this.tag = tag;
        this.sub = sub;
        this.dimensions = dimensions;
        this.pack = pack;
    }

    public static Mode of(Kind kind) {
        return new Mode(kind, "", Node.NONE, Node.NONE, 0, List.of());
    }

    public static Mode standard(String name) {
        return new Mode(Kind.STANDARD, name, Node.NONE, Node.NONE, 0, List.of());
    }

    public static Mode indicant(String name, int tag) {
        return new Mode(Kind.INDICANT, name, tag, Node.NONE, 0, List.of());
    }

    public static Mode ref(int sub) {
        return new Mode(Kind.REF, "", Node.NONE, sub, 0, List.of());
    }

    public static Mode flex(int sub) {
        return new Mode(Kind.FLEX, "", Node.NONE, sub, 0, List.of());
    }

    public static Mode row(int dimensions, int sub) {
        return new Mode(Kind.ROW, "", Node.NONE, sub, dimensions, List.of());
    }

    public static Mode proc(List<Integer> parameters, int result) {
        return new Mode(
            Kind.PROC, "", Node.NONE, result, 0, Mode.unnamed(parameters)
        );
    }

    public static Mode struct(List<Field> fields) {
        return new Mode(
            Kind.STRUCT, "", Node.NONE, Node.NONE, 0, List.copyOf(fields)
        );
    }

    public static Mode union(List<Integer> members) {
        return new Mode(
            Kind.UNION, "", Node.NONE, Node.NONE, 0, Mode.unnamed(members)
        );
    }

    public static Mode series(Kind kind, List<Integer> members) {
        if(kind != Kind.SERIES && kind != Kind.STOWED) {
            throw new IllegalArgumentException("not a series kind!");
        }
        return new Mode(kind, "", Node.NONE, Node.NONE, 0, Mode.unnamed(members));
    }

    private static List<Field> unnamed(List<Integer> modes) {
        return modes.stream().map(m -> new Field(null, m)).toList();
    }

    public List<Integer> packModes() {
        return this.pack.stream().map(Field::mode).toList();
    }

    public boolean isRowLike() {
        return this.kind == Kind.ROW || this.kind == Kind.FLEX;
    }

    public boolean is(Kind kind) {
        return this.kind == kind;
    }

    @Override
    public String toString() {
        switch(this.kind) {
            case STANDARD:
            case INDICANT:
                return this.name;
            default:
                return this.kind.toString();
        }
    }

}
