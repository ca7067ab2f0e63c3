package typesafeschwalbe.algolc.compiler.symbols;

import typesafeschwalbe.algolc.compiler.frontend.Node;

public class Tag {

    public enum Kind {
        IDENTIFIER,
        OPERATOR,
        INDICANT,
        LABEL,
        PRIORITY,
        ANONYMOUS
    }

    public enum Qualifier {
        NONE,
        LOC,
        HEAP
    }

    public enum Origin {
        IDENTITY,
        VARIABLE,
        PROCEDURE,
        PROCEDURE_VARIABLE,
        PARAMETER,
        LOOP,
        SPECIFIER,
        ROUTINE_TEXT,
        FORMAT_TEXT,
        DECLARED,
        STANDARD
    }

    public final int handle;
    public final Kind kind;
    public final String name;
    public final int table;
    public final Node node;
    public final Origin origin;

    public int mode = Node.NONE;
    public int priority = 0;
    public Qualifier qualifier = Qualifier.NONE;

    // filled in by the scope checker
    public int scope = Node.NONE;
    public boolean scopeAssigned = false;
    public boolean transient_ = false;
    public int youngestEnviron = Node.NONE;

    public Tag(
        int handle, Kind kind, String name, int table, Node node,
        Origin origin
    ) {
        this.handle = handle;
        this.kind = kind;
        this.name = name;
        this.table = table;
        this.node = node;
        this.origin = origin;
    }

    public boolean isStandard() {
        return this.origin == Origin.STANDARD;
    }

    @Override
    public String toString() {
        return this.kind.toString().toLowerCase() + " '" + this.name + "'";
    }

}
