package typesafeschwalbe.algolc.compiler.frontend;

import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.symbols.SymbolTable;
import typesafeschwalbe.algolc.compiler.symbols.Symbols;
import typesafeschwalbe.algolc.compiler.symbols.Tag;

public class Taxes {

    private static final Logger LOGGER
        = Logger.getLogger(Taxes.class.getName());

    private final CompilationSession session;
    private final Symbols symbols;
    private int declared;
    private int bound;

    public Taxes(CompilationSession session) {
        this.session = session;
        this.symbols = session.symbols;
        this.declared = 0;
        this.bound = 0;
    }

    public void collect(Node program) throws ErrorException {
        this.openRanges(program);
        this.declareAll(program);
        this.bindAll(program);
        this.symbols.finalise();
        LOGGER.fine(
            "declared " + this.declared + " tags, bound "
                + this.bound + " applications"
        );
    }

    // ranges

    private void openRanges(Node node) throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            if(node.is(Attribute.ROUTINE_TEXT)) {
                this.openRoutineRange(node);
            } else if(node.is(Attribute.SPECIFIED_UNIT)) {
                this.openSpecifierRange(node);
            }
            for(Node child = node.sub(); child != null;
                    child = child.next()) {
                this.openRanges(child);
            }
        } finally {
            this.session.guard.exit();
        }
    }

    private void openRoutineRange(Node routine) {
        Node pack = routine.sub();
        int outer = routine.table;
        int range;
        if(pack.is(Attribute.PARAMETER_PACK)) {
            range = TopDownParser.tableOf(pack);
        } else {
            range = this.symbols.newTable(outer);
        }
        this.symbols.table(range).routineBoundary = true;
        this.retable(routine.sub().last(), outer, range);
    }

    private void openSpecifierRange(Node specified) {
        Node specifier = specified.sub();
        int range = TopDownParser.tableOf(specifier);
        this.retable(specified.sub().last(), specified.table, range);
    }

    // Moves a subtree that was parsed in range outer into
    // range, including the ranges nested directly inside it.
    private void retable(Node node, int outer, int range) {
        if(node.table == outer) {
            node.table = range;
        } else if(node.table != Node.NONE && node.table != range) {
            SymbolTable table = this.symbols.table(node.table);
            if(table.parent == outer) {
                this.symbols.reparent(node.table, range);
            }
        }
        for(Node child = node.sub(); child != null; child = child.next()) {
            this.retable(child, outer, range);
        }
    }

    // declarations

    private static Tag.Origin originOf(Node declaration) {
        switch(declaration.attribute()) {
            case IDENTITY_DECLARATION: return Tag.Origin.IDENTITY;
            case VARIABLE_DECLARATION: return Tag.Origin.VARIABLE;
            case PROCEDURE_DECLARATION: return Tag.Origin.PROCEDURE;
            case PROCEDURE_VARIABLE_DECLARATION:
                return Tag.Origin.PROCEDURE_VARIABLE;
            case PARAMETER: return Tag.Origin.PARAMETER;
            case SPECIFIER: return Tag.Origin.SPECIFIER;
            case FOR_PART: return Tag.Origin.LOOP;
            default: return null;
        }
    }

    private static Tag.Qualifier qualifierOf(Node declaration) {
        Node first = declaration.sub();
        if(first.is(Attribute.HEAP_SYMBOL)) { return Tag.Qualifier.HEAP; }
        if(first.is(Attribute.LOC_SYMBOL)) { return Tag.Qualifier.LOC; }
        return Tag.Qualifier.NONE;
    }

    private void declareAll(Node node) throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            for(Node child = node.sub(); child != null;
                    child = child.next()) {
                if(child.is(Attribute.DEFINING_IDENTIFIER)) {
                    this.declare(child, node);
                } else {
                    this.declareAll(child);
                }
            }
        } finally {
            this.session.guard.exit();
        }
    }

    private Tag existing(int table, String name) {
        Tag found = this.symbols.findLocal(table, Tag.Kind.IDENTIFIER, name);
        if(found == null) {
            found = this.symbols.findLocal(table, Tag.Kind.LABEL, name);
        }
        return found;
    }

    private void declare(Node name, Node owner) {
        boolean label = owner.is(Attribute.LABEL);
        Tag.Origin origin = label? Tag.Origin.DECLARED : Taxes.originOf(owner);
        if(origin == null) {
            throw new IllegalStateException(
                "defining identifier inside " + owner.attribute() + "!"
            );
        }
        Tag previous = this.existing(name.table, name.symbol);
        if(previous != null) {
            this.session.diagnostics.report(
                Severity.ERROR, name.source,
                "'%s' is declared more than once in this range",
                name.symbol
            );
            name.tag = previous.handle;
            return;
        }
        Tag tag = this.symbols.declare(
            name.table, label? Tag.Kind.LABEL : Tag.Kind.IDENTIFIER,
            name.symbol, name, origin
        );
        if(origin == Tag.Origin.VARIABLE
                || origin == Tag.Origin.PROCEDURE_VARIABLE) {
            tag.qualifier = Taxes.qualifierOf(owner);
        }
        name.tag = tag.handle;
        this.declared += 1;
    }

    // applications

    private void bindAll(Node node) throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            Node child = node.sub();
            while(child != null) {
                Node next = child.next();
                if(child.is(Attribute.IDENTIFIER)) {
                    this.bind(child, node);
                } else {
                    this.bindAll(child);
                }
                child = next;
            }
        } finally {
            this.session.guard.exit();
        }
    }

    private void bind(Node identifier, Node owner) {
        if(owner.isOneOf(Attribute.FIELD_SELECTOR, Attribute.FIELD)) {
            return;
        }
        boolean jump = owner.is(Attribute.JUMP);
        Tag found = jump
            ? this.symbols.lookUp(
                identifier.table, Tag.Kind.LABEL, identifier.symbol
            )
            : this.symbols.lookUp(
                identifier.table, Tag.Kind.IDENTIFIER, identifier.symbol
            );
        if(found == null && !jump) {
            Tag label = this.symbols.lookUp(
                identifier.table, Tag.Kind.LABEL, identifier.symbol
            );
            if(label != null) {
                identifier.tag = label.handle;
                identifier.wrap(Attribute.JUMP);
                this.bound += 1;
                return;
            }
        }
        if(found == null) {
            this.session.diagnostics.report(
                Severity.ERROR, identifier.source,
                jump
                    ? "label '%s' has not been declared"
                    : "identifier '%s' has not been declared",
                identifier.symbol
            );
            return;
        }
        identifier.tag = found.handle;
        this.bound += 1;
    }

}
