package typesafeschwalbe.algolc.compiler.symbols;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.algolc.compiler.frontend.Node;

public class SymbolTable {

    public final int handle;
    public int parent;
    public int level;

    private final List<Integer> identifiers;
    private final List<Integer> operators;
    private final List<Integer> indicants;
    private final List<Integer> labels;
    private final List<Integer> priorities;
    private final List<Integer> anonymous;

    // nearest enclosing level that owns storage, see Symbols.finalise
    public int storageLevel = Node.NONE;
    public boolean routineBoundary = false;

    public SymbolTable(int handle, int parent, int level) {
        this.handle = handle;
        this.parent = parent;
        this.level = level;
        this.identifiers = new ArrayList<>();
        this.operators = new ArrayList<>();
        this.indicants = new ArrayList<>();
        this.labels = new ArrayList<>();
        this.priorities = new ArrayList<>();
        this.anonymous = new ArrayList<>();
    }

    public List<Integer> chain(Tag.Kind kind) {
        switch(kind) {
            case IDENTIFIER: return this.identifiers;
            case OPERATOR: return this.operators;
            case INDICANT: return this.indicants;
            case LABEL: return this.labels;
            case PRIORITY: return this.priorities;
            case ANONYMOUS: return this.anonymous;
            default: throw new IllegalArgumentException("unhandled kind!");
        }
    }

    public boolean hasDeclarations() {
        return !this.identifiers.isEmpty()
            || !this.operators.isEmpty()
            || !this.anonymous.isEmpty();
    }

    @Override
    public String toString() {
        return "range " + this.handle + " (level " + this.level + ")";
    }

}
