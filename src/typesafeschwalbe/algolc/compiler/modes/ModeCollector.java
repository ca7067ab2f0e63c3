package typesafeschwalbe.algolc.compiler.modes;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.frontend.Attribute;
import typesafeschwalbe.algolc.compiler.frontend.Node;
import typesafeschwalbe.algolc.compiler.symbols.Symbols;
import typesafeschwalbe.algolc.compiler.symbols.Tag;

// Turns every declarer into a mode, gives every declared tag its mode,
// proves equivalent modes equal and rejects mode declarations that are
// not well formed.
public class ModeCollector {

    private static final Logger LOGGER
        = Logger.getLogger(ModeCollector.class.getName());

    private final CompilationSession session;
    private final ModeTable modes;
    private final Symbols symbols;

    public ModeCollector(CompilationSession session) {
        this.session = session;
        this.modes = session.modes;
        this.symbols = session.symbols;
    }

    public void collect(Node program) throws ErrorException {
        this.defineIndicants(program);
        this.assign(program);
        int rounds = this.modes.equivalencer().run();
        LOGGER.fine(
            "collected " + this.modes.count() + " modes, equivalenced in "
                + rounds + " rounds"
        );
        this.checkWellFormed();
    }

    // declarers

    private int indicantOf(Tag tag) {
        if(tag.isStandard()) { return tag.mode; }
        if(tag.mode == Node.NONE) {
            tag.mode = this.modes.indicant(tag.name, tag.handle);
        }
        return tag.mode;
    }

    private int resultMode(Node node) {
        if(node == null) { return this.modes.ERROR; }
        if(node.is(Attribute.VOID_SYMBOL)) { return this.modes.VOID; }
        if(node.is(Attribute.DECLARER)) { return this.declarerMode(node); }
        return this.modes.ERROR;
    }

    public int declarerMode(Node declarer) {
        if(declarer.mode != Node.NONE) { return declarer.mode; }
        int mode = this.computeDeclarer(declarer);
        declarer.mode = mode;
        return mode;
    }

    private int computeDeclarer(Node declarer) {
        Node first = declarer.sub();
        switch(first.attribute()) {
            case LONG_SYMBOL:
            case SHORT_SYMBOL:
            case INDICANT:
                return this.sizedIndicant(first);
            case REF_SYMBOL:
                return this.modes.ref(this.resultMode(first.next()));
            case FLEX_SYMBOL:
                return this.modes.flex(this.resultMode(first.next()));
            case BOUNDS:
                return this.modes.row(
                    ModeCollector.dimensionsOf(first),
                    this.resultMode(first.next())
                );
            case STRUCT_SYMBOL:
                return this.structMode(first.next());
            case UNION_SYMBOL:
                return this.unionMode(first.next());
            case PROC_SYMBOL: {
                Node next = first.next();
                if(next.is(Attribute.PACK)) {
                    return this.modes.proc(
                        this.formals(next), this.resultMode(next.next())
                    );
                }
                return this.modes.proc(List.of(), this.resultMode(next));
            }
            case PACK:
                return this.modes.proc(
                    this.formals(first), this.resultMode(first.next())
                );
            default:
                return this.modes.ERROR;
        }
    }

    private static int dimensionsOf(Node bounds) {
        int dimensions = 0;
        for(Node child = bounds.sub(); child != null; child = child.next()) {
            if(child.is(Attribute.BOUND)) { dimensions += 1; }
        }
        return Math.max(1, dimensions);
    }

    private int sizedIndicant(Node first) {
        int length = 0;
        Node node = first;
        while(node.isOneOf(Attribute.LONG_SYMBOL, Attribute.SHORT_SYMBOL)) {
            length += node.is(Attribute.LONG_SYMBOL)? 1 : -1;
            node = node.next();
        }
        if(node.tag == Node.NONE) { return this.modes.ERROR; }
        Tag tag = this.symbols.tag(node.tag);
        if(node == first) { return this.indicantOf(tag); }
        if(!tag.isStandard()) {
            this.session.diagnostics.report(
                Severity.ERROR, first.source,
                "LONG and SHORT only apply to standard modes, not '%s'",
                node.symbol
            );
            return this.modes.ERROR;
        }
        if(length < 0) {
            this.session.diagnostics.report(
                Severity.WARNING, first.source,
                "SHORT %s is the same as %s", node.symbol, node.symbol
            );
            length = 0;
        }
        length = Math.min(length, ModeTable.LENGTHS.length - 1);
        int sized = this.modes.standard(
            ModeTable.LENGTHS[length] + node.symbol
        );
        if(sized == Node.NONE) {
            this.session.diagnostics.report(
                Severity.ERROR, first.source, "there is no mode %s%s",
                ModeTable.LENGTHS[length], node.symbol
            );
            return this.modes.ERROR;
        }
        return sized;
    }

    private int structMode(Node pack) {
        List<Mode.Field> fields = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int current = this.modes.ERROR;
        for(Node item = pack.sub(); item != null; item = item.next()) {
            if(!item.is(Attribute.FIELD)) { continue; }
            Node name = item.sub();
            if(name.is(Attribute.DECLARER)) {
                current = this.declarerMode(name);
                name = name.next();
            }
            if(!names.add(name.symbol)) {
                this.session.diagnostics.report(
                    Severity.ERROR, name.source,
                    "field '%s' appears more than once", name.symbol
                );
            }
            fields.add(new Mode.Field(name.symbol, current));
        }
        return this.modes.struct(fields);
    }

    private int unionMode(Node pack) {
        List<Integer> members = new ArrayList<>();
        for(Node item = pack.sub(); item != null; item = item.next()) {
            if(item.isOneOf(Attribute.DECLARER, Attribute.VOID_SYMBOL)) {
                members.add(this.resultMode(item));
            }
        }
        if(members.size() < 2) {
            this.session.diagnostics.report(
                Severity.WARNING, pack.source,
                "a united mode with fewer than two members"
            );
        }
        return this.modes.union(members);
    }

    private List<Integer> formals(Node pack) {
        List<Integer> parameters = new ArrayList<>();
        for(Node item = pack.sub(); item != null; item = item.next()) {
            if(item.is(Attribute.DECLARER)) {
                parameters.add(this.declarerMode(item));
            }
        }
        return parameters;
    }

    // mode declarations

    private void defineIndicants(Node node) throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            if(node.is(Attribute.MODE_DECLARATION)) {
                this.defineIndicant(node);
            }
            for(Node child = node.sub(); child != null;
                    child = child.next()) {
                this.defineIndicants(child);
            }
        } finally {
            this.session.guard.exit();
        }
    }

    private void defineIndicant(Node declaration) {
        for(Node child = declaration.sub(); child != null;
                child = child.next()) {
            if(!child.is(Attribute.DEFINING_INDICANT)
                    || child.tag == Node.NONE) {
                continue;
            }
            Tag tag = this.symbols.tag(child.tag);
            int indicant = this.indicantOf(tag);
            Node declarer = child.next() == null? null : child.next().next();
            this.modes.exact(indicant).definition = this.resultMode(declarer);
            child.mode = indicant;
        }
    }

    // tags and phrases with a declared mode

    private void assign(Node node) throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            switch(node.attribute()) {
                case DECLARER:
                    this.declarerMode(node);
                    break;
                case IDENTITY_DECLARATION:
                case VARIABLE_DECLARATION:
                    this.assignDeclared(node);
                    break;
                case PROCEDURE_DECLARATION:
                case PROCEDURE_VARIABLE_DECLARATION:
                    this.assignProcedures(node);
                    break;
                case OPERATOR_DECLARATION:
                    this.assignOperators(node);
                    break;
                case PARAMETER_PACK:
                    this.parameterModes(node);
                    break;
                case SPECIFIER:
                    this.assignSpecifier(node);
                    break;
                case FOR_PART: {
                    Node name = node.child(Attribute.DEFINING_IDENTIFIER);
                    this.setTagMode(name, this.modes.INT);
                    break;
                }
                case ROUTINE_TEXT:
                    node.mode = this.routineMode(node);
                    break;
                case GENERATOR:
                    node.mode = this.modes.ref(
                        this.resultMode(node.sub().next())
                    );
                    break;
                case CAST:
                    node.mode = this.resultMode(node.sub());
                    break;
                default:
                    break;
            }
            for(Node child = node.sub(); child != null;
                    child = child.next()) {
                this.assign(child);
            }
        } finally {
            this.session.guard.exit();
        }
    }

    private void setTagMode(Node name, int mode) {
        if(name == null) { return; }
        name.mode = mode;
        if(name.tag == Node.NONE) { return; }
        Tag tag = this.symbols.tag(name.tag);
        if(tag.node == name) { tag.mode = mode; }
    }

    private void assignDeclared(Node declaration) {
        Node declarer = declaration.child(Attribute.DECLARER);
        int mode = declarer == null
            ? this.modes.ERROR
            : this.declarerMode(declarer);
        if(declaration.is(Attribute.VARIABLE_DECLARATION)) {
            mode = this.modes.ref(mode);
        }
        for(Node child = declaration.sub(); child != null;
                child = child.next()) {
            if(child.is(Attribute.DEFINING_IDENTIFIER)) {
                this.setTagMode(child, mode);
            }
        }
    }

    private static Node routineOf(Node name) {
        Node sign = name.next();
        Node value = sign == null? null : sign.next();
        if(value == null || !value.is(Attribute.UNIT)) { return null; }
        Node routine = value.unwrap();
        return routine.is(Attribute.ROUTINE_TEXT)? routine : null;
    }

    private void assignProcedures(Node declaration) {
        boolean variable = declaration.is(
            Attribute.PROCEDURE_VARIABLE_DECLARATION
        );
        for(Node child = declaration.sub(); child != null;
                child = child.next()) {
            if(!child.is(Attribute.DEFINING_IDENTIFIER)) { continue; }
            Node routine = ModeCollector.routineOf(child);
            int mode;
            if(routine == null) {
                this.session.diagnostics.report(
                    Severity.ERROR, child.source,
                    "'%s' must be given a routine text", child.symbol
                );
                mode = this.modes.ERROR;
            } else {
                mode = this.routineMode(routine);
            }
            this.setTagMode(child, variable? this.modes.ref(mode) : mode);
        }
    }

    private void assignOperators(Node declaration) {
        Node plan = declaration.sub().next();
        int planned = Node.is(plan, Attribute.DECLARER)
            ? this.declarerMode(plan)
            : Node.NONE;
        for(Node child = declaration.sub(); child != null;
                child = child.next()) {
            if(!child.is(Attribute.DEFINING_OPERATOR)) { continue; }
            int mode = planned;
            if(mode == Node.NONE) {
                Node routine = ModeCollector.routineOf(child);
                mode = routine == null
                    ? this.modes.ERROR
                    : this.routineMode(routine);
            }
            Mode resolved = this.modes.get(mode);
            boolean operands = resolved.is(Mode.Kind.PROC)
                && resolved.pack.size() >= 1 && resolved.pack.size() <= 2;
            if(!operands && !resolved.is(Mode.Kind.ERROR)) {
                this.session.diagnostics.report(
                    Severity.ERROR, child.source,
                    "operator '%s' must take one or two operands",
                    child.symbol
                );
                mode = this.modes.ERROR;
            }
            child.mode = mode;
            if(child.tag != Node.NONE) {
                this.symbols.tag(child.tag).mode = mode;
            }
        }
    }

    private List<Integer> parameterModes(Node pack) {
        List<Integer> parameters = new ArrayList<>();
        int current = this.modes.ERROR;
        for(Node item = pack.sub(); item != null; item = item.next()) {
            if(!item.is(Attribute.PARAMETER)) { continue; }
            Node name = item.sub();
            if(name.is(Attribute.DECLARER)) {
                current = this.declarerMode(name);
                name = name.next();
            }
            this.setTagMode(name, current);
            parameters.add(current);
        }
        return parameters;
    }

    private void assignSpecifier(Node specifier) {
        Node declarer = specifier.sub().next();
        int mode = this.resultMode(declarer);
        specifier.mode = mode;
        this.setTagMode(
            specifier.child(Attribute.DEFINING_IDENTIFIER), mode
        );
    }

    public int routineMode(Node routine) {
        if(routine.mode != Node.NONE) { return routine.mode; }
        Node first = routine.sub();
        List<Integer> parameters = List.of();
        Node result = first;
        if(first.is(Attribute.PARAMETER_PACK)) {
            parameters = this.parameterModes(first);
            result = first.next();
        }
        routine.mode = this.modes.proc(parameters, this.resultMode(result));
        return routine.mode;
    }

    // well-formedness

    private void checkWellFormed() {
        for(Tag tag: this.symbols.allTags()) {
            if(tag.kind != Tag.Kind.INDICANT || tag.isStandard()
                    || tag.mode == Node.NONE) {
                continue;
            }
            Mode indicant = this.modes.exact(tag.mode);
            if(indicant.definition == Node.NONE) { continue; }
            boolean wellFormed = this.wellFormed(
                tag.mode, indicant.definition, false, false, true,
                new HashSet<>()
            );
            if(!wellFormed) {
                this.session.diagnostics.report(
                    Severity.ERROR, tag.node == null? null : tag.node.source,
                    "mode %s is not well formed", tag.name
                );
            }
        }
    }

    // Whether mode reaches its own declaration only through both
    // a name, routine or row (yin) and a structure or routine
    // (yang), and shows VOID only where video allows it.
    private boolean wellFormed(
        int declared, int mode, boolean yin, boolean yang, boolean video,
        Set<Integer> inUse
    ) {
        Mode m = this.modes.exact(mode);
        if(yin && yang) {
            return m.is(Mode.Kind.VOID)? video : true;
        }
        switch(m.kind) {
            case VOID:
                return video;
            case INDICANT: {
                if(mode == declared || inUse.contains(mode)) {
                    return false;
                }
                if(m.definition == Node.NONE) { return true; }
                inUse.add(mode);
                boolean result = this.wellFormed(
                    declared, m.definition, yin, yang, video, inUse
                );
                inUse.remove(mode);
                return result;
            }
            case REF:
                return this.wellFormed(
                    declared, m.sub, true, yang, false, inUse
                );
            case PROC:
                if(!m.pack.isEmpty()) { return true; }
                return this.wellFormed(
                    declared, m.sub, true, yang, true, inUse
                );
            case ROW:
            case FLEX:
                return this.wellFormed(
                    declared, m.sub, true, yang, false, inUse
                );
            case STRUCT:
                for(Mode.Field field: m.pack) {
                    if(!this.wellFormed(
                        declared, field.mode(), yin, true, false, inUse
                    )) {
                        return false;
                    }
                }
                return true;
            case UNION:
                for(Mode.Field member: m.pack) {
                    if(!this.wellFormed(
                        declared, member.mode(), yin, yang, true, inUse
                    )) {
                        return false;
                    }
                }
                return true;
            case ERROR:
                return true;
            default:
                return true;
        }
    }

}
