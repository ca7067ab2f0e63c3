package typesafeschwalbe.algolc.compiler.scope;

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
import typesafeschwalbe.algolc.compiler.modes.Mode;
import typesafeschwalbe.algolc.compiler.modes.ModeTable;
import typesafeschwalbe.algolc.compiler.symbols.Symbols;
import typesafeschwalbe.algolc.compiler.symbols.Tag;

// Static escape analysis. Every phrase that may yield a name or a routine
// gets the level of the youngest range its value depends on, and storing
// such a value somewhere older than that level is reported.
public class ScopeChecker {

    private static final Logger LOGGER
        = Logger.getLogger(ScopeChecker.class.getName());

    private static final int PRIMAL = 0;

    // The level a value depends on. Names that are only valid while a
    // row keeps its bounds are transient and may not be stored at all.
    public static record Tuple(
        Node where, int level, boolean transient_, boolean environ
    ) {}

    private final CompilationSession session;
    private final Symbols symbols;
    private final ModeTable modes;
    private final Set<Node> reported;
    private int checks;

    public ScopeChecker(CompilationSession session) {
        this.session = session;
        this.symbols = session.symbols;
        this.modes = session.modes;
        this.reported = new HashSet<>();
        this.checks = 0;
    }

    public void check(Node program) throws ErrorException {
        this.environs(program);
        this.bindRoutineScopes(program);
        this.serial(program.sub(), null);
        LOGGER.fine("performed " + this.checks + " scope checks");
    }

    // levels

    private int levelOf(Node node) {
        if(node.table == Node.NONE) { return ScopeChecker.PRIMAL; }
        return this.symbols.table(node.table).level;
    }

    private int levelOf(Tag tag) {
        return this.symbols.table(tag.table).level;
    }

    private static void add(List<Tuple> tuples, Tuple tuple) {
        if(tuples != null) { tuples.add(tuple); }
    }

    private static Tuple youngest(List<Tuple> tuples, int threshold) {
        Tuple youngest = new Tuple(null, ScopeChecker.PRIMAL, false, false);
        for(Tuple tuple: tuples) {
            if(tuple.level() > youngest.level()
                    && tuple.level() <= threshold) {
                youngest = tuple;
            }
        }
        return youngest;
    }

    private static Tuple youngest(List<Tuple> tuples) {
        return ScopeChecker.youngest(tuples, Integer.MAX_VALUE);
    }

    private void check(List<Tuple> tuples, boolean storing, int destination) {
        this.checks += 1;
        for(Tuple tuple: tuples) {
            if(this.reported.contains(tuple.where())) { continue; }
            if(storing && tuple.transient_()) {
                this.reported.add(tuple.where());
                this.session.diagnostics.report(
                    Severity.ERROR, tuple.where().source,
                    "a transient name cannot be stored"
                );
                continue;
            }
            if(destination >= tuple.level()) { continue; }
            this.reported.add(tuple.where());
            String what = tuple.where().attribute().description;
            String mode = tuple.where().mode == Node.NONE
                ? "a value"
                : this.modes.toString(tuple.where().mode);
            if(tuple.environ()) {
                this.session.diagnostics.report(
                    Severity.WARNING, tuple.where().source,
                    "%s yielding %s may outlive the ranges it refers to",
                    what, mode
                );
            } else {
                this.session.diagnostics.report(
                    Severity.ERROR, tuple.where().source,
                    "%s yielding %s escapes its scope", what, mode
                );
            }
        }
    }

    private static boolean isUnit(Node node) {
        return node.is(Attribute.UNIT) || node.attribute().isCoercion();
    }

    private boolean isName(int mode) {
        return mode != Node.NONE
            && this.modes.kindOf(mode) == Mode.Kind.REF;
    }

    private boolean refersToFlex(int mode) {
        Mode current = this.modes.get(mode);
        while(current.is(Mode.Kind.REF)) {
            current = this.modes.get(current.sub);
        }
        return current.is(Mode.Kind.FLEX);
    }

    // routine and format texts

    private Tag environTag(Node text) {
        if(text.tag == Node.NONE) {
            Tag tag = this.symbols.declare(
                text.table, Tag.Kind.ANONYMOUS, "", text,
                text.is(Attribute.ROUTINE_TEXT)
                    ? Tag.Origin.ROUTINE_TEXT
                    : Tag.Origin.FORMAT_TEXT
            );
            text.tag = tag.handle;
        }
        return this.symbols.tag(text.tag);
    }

    // Finds for every routine and format text the youngest range outside
    // of it that it refers to.
    private void environs(Node node) throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            for(Node child = node.sub(); child != null; child = child.next()) {
                if(child.isOneOf(
                    Attribute.ROUTINE_TEXT, Attribute.FORMAT_TEXT
                )) {
                    this.environOf(child, new ArrayList<>());
                } else {
                    this.environs(child);
                }
            }
        } finally {
            this.session.guard.exit();
        }
    }

    private void environOf(Node text, List<Tuple> outer)
            throws ErrorException {
        Tag tag = this.environTag(text);
        List<Tuple> inner = new ArrayList<>();
        this.gather(text, inner);
        tag.youngestEnviron = ScopeChecker.youngest(
            inner, this.levelOf(text)
        ).level();
        outer.addAll(inner);
    }

    private void gather(Node node, List<Tuple> tuples) throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            for(Node child = node.sub(); child != null; child = child.next()) {
                if(child.isOneOf(
                    Attribute.ROUTINE_TEXT, Attribute.FORMAT_TEXT
                )) {
                    this.environOf(child, tuples);
                } else if(child.isOneOf(
                    Attribute.IDENTIFIER, Attribute.OPERATOR
                )) {
                    if(child.tag == Node.NONE) { continue; }
                    Tag tag = this.symbols.tag(child.tag);
                    int level = this.levelOf(tag);
                    if(level != ScopeChecker.PRIMAL) {
                        tuples.add(new Tuple(child, level, false, true));
                    }
                } else {
                    this.gather(child, tuples);
                }
            }
        } finally {
            this.session.guard.exit();
        }
    }

    private static Node unwrapped(Node node) {
        Node current = node;
        while(current.sub() != null && current.sub().next() == null
                && (current.attribute().isWrapper()
                    || current.attribute().isCoercion())) {
            current = current.sub();
        }
        return current;
    }

    // Procedure identities take the scope of the routine text they are
    // bound to, so calls through them can be checked before the
    // declaration itself is reached.
    private void bindRoutineScopes(Node node) {
        for(Node child = node.sub(); child != null; child = child.next()) {
            if(!child.isOneOf(
                Attribute.PROCEDURE_DECLARATION,
                Attribute.IDENTITY_DECLARATION
            )) {
                this.bindRoutineScopes(child);
                continue;
            }
            for(Node name = child.sub(); name != null; name = name.next()) {
                if(!name.is(Attribute.DEFINING_IDENTIFIER)) { continue; }
                if(name.tag == Node.NONE) { continue; }
                Node sign = name.next();
                if(sign == null || sign.next() == null) { continue; }
                Node source = ScopeChecker.unwrapped(sign.next());
                if(source.isOneOf(
                    Attribute.ROUTINE_TEXT, Attribute.FORMAT_TEXT
                ) && source.tag != Node.NONE) {
                    Tag tag = this.symbols.tag(name.tag);
                    tag.scope = this.symbols.tag(source.tag).youngestEnviron;
                    tag.scopeAssigned = true;
                }
            }
            this.bindRoutineScopes(child);
        }
    }

    // phrases

    private void units(Node node) throws ErrorException {
        for(Node child = node.sub(); child != null; child = child.next()) {
            if(ScopeChecker.isUnit(child)) {
                this.statement(child, null);
            } else {
                this.units(child);
            }
        }
    }

    private void unitList(Node node, List<Tuple> tuples)
            throws ErrorException {
        for(Node child = node.sub(); child != null; child = child.next()) {
            if(ScopeChecker.isUnit(child)) {
                this.statement(child, tuples);
            } else if(child.is(Attribute.SPECIFIED_UNIT)) {
                this.statement(child.sub().last(), tuples);
            } else if(child.isOneOf(
                Attribute.UNIT_LIST, Attribute.SPECIFIED_UNIT_LIST
            )) {
                this.unitList(child, tuples);
            }
        }
    }

    private void coercion(Node node, List<Tuple> tuples)
            throws ErrorException {
        switch(node.attribute()) {
            case VOIDING:
            case DEREFERENCING:
            case DEPROCEDURING:
                this.statement(node.sub(), null);
                return;
            case ROWING:
                this.statement(node.sub(), tuples);
                if(this.isName(node.sub().mode)
                        && this.refersToFlex(node.sub().mode)) {
                    ScopeChecker.add(tuples, new Tuple(
                        node, this.levelOf(node), true, false
                    ));
                }
                return;
            case PROCEDURING: {
                Node label = ScopeChecker.unwrapped(node.sub());
                Node name = label.is(Attribute.IDENTIFIER)
                    ? label
                    : label.child(Attribute.IDENTIFIER);
                if(name != null && name.tag != Node.NONE) {
                    ScopeChecker.add(tuples, new Tuple(
                        name, this.levelOf(this.symbols.tag(name.tag)),
                        false, false
                    ));
                }
                return;
            }
            default:
                this.statement(node.sub(), tuples);
                return;
        }
    }

    private void identifier(Node node, List<Tuple> tuples) {
        if(node.tag == Node.NONE || node.mode == Node.NONE) { return; }
        Tag tag = this.symbols.tag(node.tag);
        if(tag.isStandard()) { return; }
        Mode.Kind kind = this.modes.kindOf(node.mode);
        int level;
        boolean environ = false;
        if(kind == Mode.Kind.REF) {
            if(tag.origin == Tag.Origin.PARAMETER) {
                level = this.levelOf(tag) - 1;
            } else if(tag.qualifier == Tag.Qualifier.HEAP) {
                level = ScopeChecker.PRIMAL;
            } else if(tag.scopeAssigned) {
                level = tag.scope;
            } else {
                level = this.levelOf(tag);
            }
        } else if(tag.scopeAssigned && (kind == Mode.Kind.PROC
                || node.mode == this.modes.FORMAT)) {
            level = tag.scope;
            environ = true;
        } else {
            return;
        }
        ScopeChecker.add(tuples, new Tuple(node, level, false, environ));
    }

    private void statement(Node node, List<Tuple> tuples)
            throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            this.statementUnguarded(node, tuples);
        } finally {
            this.session.guard.exit();
        }
    }

    private void statementUnguarded(Node node, List<Tuple> tuples)
            throws ErrorException {
        if(node.attribute().isCoercion()) {
            this.coercion(node, tuples);
            return;
        }
        if(node.attribute().isEnclosedClause()) {
            this.enclosed(node, tuples);
            return;
        }
        switch(node.attribute()) {
            case PRIMARY:
            case SECONDARY:
            case TERTIARY:
            case UNIT:
                this.statement(node.sub(), tuples);
                return;
            case DENOTATION:
            case NIHIL:
                ScopeChecker.add(tuples, new Tuple(
                    node, ScopeChecker.PRIMAL, false, false
                ));
                return;
            case IDENTIFIER:
                this.identifier(node, tuples);
                return;
            case CALL: {
                List<Tuple> procedure = new ArrayList<>();
                this.statement(node.sub(), procedure);
                this.check(procedure, false, this.levelOf(node));
                for(Node argument = node.sub().next().sub();
                        argument != null; argument = argument.next()) {
                    if(!ScopeChecker.isUnit(argument)) { continue; }
                    List<Tuple> value = new ArrayList<>();
                    this.statement(argument, value);
                    this.check(value, true, this.levelOf(argument));
                }
                return;
            }
            case SLICE: {
                Node primary = node.sub();
                List<Tuple> row = new ArrayList<>();
                if(this.isName(primary.mode)) {
                    this.statement(primary, row);
                    this.check(row, false, this.levelOf(node));
                    if(this.refersToFlex(primary.mode)) {
                        ScopeChecker.add(tuples, new Tuple(
                            primary, this.levelOf(node), true, false
                        ));
                    }
                } else {
                    this.statement(primary, null);
                }
                this.units(primary.next());
                if(this.isName(node.mode)) {
                    Tuple youngest = ScopeChecker.youngest(row);
                    ScopeChecker.add(tuples, new Tuple(
                        node, youngest.level(), false, youngest.environ()
                    ));
                }
                return;
            }
            case FORMAT_TEXT: {
                List<Tuple> inner = new ArrayList<>();
                for(Node child = node.sub(); child != null;
                        child = child.next()) {
                    if(child.attribute().isEnclosedClause()) {
                        this.enclosed(child, inner);
                    }
                }
                ScopeChecker.add(tuples, new Tuple(
                    node, ScopeChecker.youngest(inner).level(), false, true
                ));
                return;
            }
            case CAST: {
                List<Tuple> inner = new ArrayList<>();
                this.statement(node.sub().next(), inner);
                this.check(inner, false, this.levelOf(node));
                Tuple youngest = ScopeChecker.youngest(inner);
                ScopeChecker.add(tuples, new Tuple(
                    node, youngest.level(), false, youngest.environ()
                ));
                return;
            }
            case SELECTION: {
                Node secondary = node.sub().next();
                List<Tuple> inner = new ArrayList<>();
                this.statement(secondary, inner);
                this.check(inner, false, this.levelOf(node));
                if(this.isName(secondary.mode)
                        && this.refersToFlex(secondary.mode)) {
                    ScopeChecker.add(tuples, new Tuple(
                        node, this.levelOf(node), true, false
                    ));
                }
                Tuple youngest = ScopeChecker.youngest(inner);
                ScopeChecker.add(tuples, new Tuple(
                    node, youngest.level(), false, youngest.environ()
                ));
                return;
            }
            case GENERATOR: {
                int level = node.sub().is(Attribute.LOC_SYMBOL)
                    ? this.symbols.table(node.table).storageLevel
                    : ScopeChecker.PRIMAL;
                ScopeChecker.add(tuples, new Tuple(node, level, false, false));
                this.units(node.sub().next());
                return;
            }
            case MONADIC_FORMULA:
            case FORMULA:
                for(Node operand = node.sub(); operand != null;
                        operand = operand.next()) {
                    if(operand.is(Attribute.OPERATOR)) { continue; }
                    List<Tuple> value = new ArrayList<>();
                    this.statement(operand, value);
                    this.check(value, true, this.levelOf(node));
                }
                return;
            case ASSIGNATION: {
                Node destination = node.sub();
                Node source = destination.next().next();
                List<Tuple> names = new ArrayList<>();
                List<Tuple> values = new ArrayList<>();
                this.statement(destination, names);
                this.statement(source, values);
                for(Tuple name: names) {
                    this.check(values, true, name.level());
                }
                ScopeChecker.add(tuples, new Tuple(
                    node, ScopeChecker.youngest(names).level(), false, false
                ));
                return;
            }
            case ROUTINE_TEXT: {
                List<Tuple> body = new ArrayList<>();
                this.statement(node.sub().last(), body);
                this.check(body, true, this.levelOf(node));
                ScopeChecker.add(tuples, new Tuple(
                    node, this.environTag(node).youngestEnviron, false, true
                ));
                return;
            }
            case IDENTITY_RELATION:
            case AND_FUNCTION:
            case OR_FUNCTION: {
                List<Tuple> operands = new ArrayList<>();
                this.statement(node.sub(), operands);
                this.statement(node.sub().next().next(), operands);
                this.check(operands, false, this.levelOf(node));
                return;
            }
            case ASSERTION: {
                List<Tuple> condition = new ArrayList<>();
                this.statement(node.sub().next(), condition);
                this.check(condition, false, this.levelOf(node));
                return;
            }
            default:
                return;
        }
    }

    // clauses

    private void enclosed(Node clause, List<Tuple> tuples)
            throws ErrorException {
        switch(clause.attribute()) {
            case CLOSED_CLAUSE:
                this.serial(clause.child(Attribute.SERIAL_CLAUSE), tuples);
                return;
            case COLLATERAL_CLAUSE: {
                Node list = clause.child(Attribute.UNIT_LIST);
                if(list != null) { this.unitList(list, tuples); }
                return;
            }
            case PARALLEL_CLAUSE:
                this.enclosed(clause.sub().next(), tuples);
                return;
            case CONDITIONAL_CLAUSE:
            case CASE_CLAUSE:
            case CONFORMITY_CLAUSE:
                this.choice(clause, tuples);
                return;
            case LOOP_CLAUSE:
                this.loop(clause);
                return;
            default:
                return;
        }
    }

    private static Node content(Node part) {
        for(Node child = part.sub(); child != null; child = child.next()) {
            if(child.isOneOf(
                Attribute.SERIAL_CLAUSE, Attribute.UNIT_LIST,
                Attribute.SPECIFIED_UNIT_LIST
            ) || ScopeChecker.isUnit(child)) {
                return child;
            }
        }
        return null;
    }

    private void serial(Node serial, List<Tuple> tuples)
            throws ErrorException {
        if(serial == null) { return; }
        if(!serial.is(Attribute.SERIAL_CLAUSE)) {
            if(ScopeChecker.isUnit(serial)) { this.statement(serial, tuples); }
            return;
        }
        for(Node phrase = serial.sub(); phrase != null;
                phrase = phrase.next()) {
            if(phrase.isOneOf(
                Attribute.SEMICOLON_SYMBOL, Attribute.EXIT_SYMBOL
            )) {
                continue;
            }
            if(phrase.is(Attribute.DECLARATION_LIST)
                    || phrase.attribute().isDeclaration()) {
                this.declaration(phrase);
                continue;
            }
            Node unit = phrase;
            while(unit.is(Attribute.LABELED_UNIT)) {
                unit = unit.sub().next();
            }
            Node separator = phrase.next();
            boolean yields = separator == null
                || separator.is(Attribute.EXIT_SYMBOL);
            this.statement(unit, yields? tuples : null);
        }
    }

    private void choice(Node clause, List<Tuple> tuples)
            throws ErrorException {
        Node enquiry = clause.sub();
        List<Tuple> condition = new ArrayList<>();
        this.serial(ScopeChecker.content(enquiry), condition);
        if(!clause.is(Attribute.CONDITIONAL_CLAUSE)) {
            this.check(condition, false, this.levelOf(clause));
        }
        for(Node part = enquiry.next(); part != null; part = part.next()) {
            switch(part.attribute()) {
                case CONDITIONAL_CLAUSE:
                case CASE_CLAUSE:
                case CONFORMITY_CLAUSE:
                    this.choice(part, tuples);
                    break;
                case IN_PART: {
                    Node content = ScopeChecker.content(part);
                    if(content == null) { break; }
                    if(content.is(Attribute.SERIAL_CLAUSE)) {
                        this.serial(content, tuples);
                    } else if(ScopeChecker.isUnit(content)) {
                        this.statement(content, tuples);
                    } else {
                        this.unitList(content, tuples);
                    }
                    break;
                }
                case THEN_PART:
                case ELSE_PART:
                case OUT_PART:
                    this.serial(ScopeChecker.content(part), tuples);
                    break;
                default:
                    break;
            }
        }
    }

    private void loop(Node clause) throws ErrorException {
        for(Node part = clause.sub(); part != null; part = part.next()) {
            switch(part.attribute()) {
                case FROM_PART:
                case BY_PART:
                case TO_PART:
                case WHILE_PART:
                    this.serial(ScopeChecker.content(part), null);
                    break;
                case DO_PART: {
                    this.serial(ScopeChecker.content(part), null);
                    Node until = part.child(Attribute.UNTIL_PART);
                    if(until != null) {
                        this.serial(ScopeChecker.content(until), null);
                    }
                    break;
                }
                default:
                    break;
            }
        }
    }

    // declarations

    private void declaration(Node declaration) throws ErrorException {
        switch(declaration.attribute()) {
            case DECLARATION_LIST:
                for(Node child = declaration.sub(); child != null;
                        child = child.next()) {
                    if(child.attribute().isDeclaration()) {
                        this.declaration(child);
                    }
                }
                return;
            case MODE_DECLARATION:
                this.units(declaration);
                return;
            case PRIORITY_DECLARATION:
                return;
            case IDENTITY_DECLARATION:
                this.identityDeclaration(declaration);
                return;
            case VARIABLE_DECLARATION: {
                Node declarer = declaration.child(Attribute.DECLARER);
                if(declarer != null) { this.units(declarer); }
                for(Node name = declaration.sub(); name != null;
                        name = name.next()) {
                    if(!name.is(Attribute.DEFINING_IDENTIFIER)) { continue; }
                    Node sign = name.next();
                    if(!Node.is(sign, Attribute.BECOMES_SYMBOL)) { continue; }
                    this.warnUninitialised(name, sign.next());
                    List<Tuple> value = new ArrayList<>();
                    this.statement(sign.next(), value);
                    this.check(value, true, this.levelOf(name));
                }
                return;
            }
            default:
                for(Node name = declaration.sub(); name != null;
                        name = name.next()) {
                    if(!name.isOneOf(
                        Attribute.DEFINING_IDENTIFIER,
                        Attribute.DEFINING_OPERATOR
                    )) {
                        continue;
                    }
                    Node sign = name.next();
                    if(sign == null || sign.next() == null) { continue; }
                    List<Tuple> value = new ArrayList<>();
                    this.statement(sign.next(), value);
                    this.check(value, false, this.levelOf(name));
                }
                return;
        }
    }

    private void identityDeclaration(Node declaration)
            throws ErrorException {
        for(Node name = declaration.sub(); name != null; name = name.next()) {
            if(!name.is(Attribute.DEFINING_IDENTIFIER)) { continue; }
            Node sign = name.next();
            if(sign == null || sign.next() == null) { continue; }
            Node source = sign.next();
            boolean procedure = name.mode != Node.NONE
                && this.modes.kindOf(name.mode) == Mode.Kind.PROC;
            if(!procedure) { this.warnUninitialised(name, source); }
            List<Tuple> value = new ArrayList<>();
            this.statement(source, value);
            int level = this.levelOf(name);
            this.check(value, true, level);
            int youngest = ScopeChecker.youngest(value).level();
            if(youngest < level && name.tag != Node.NONE) {
                Tag tag = this.symbols.tag(name.tag);
                tag.scope = youngest;
                tag.scopeAssigned = true;
            }
        }
    }

    private void warnUninitialised(Node name, Node source) {
        if(name.tag == Node.NONE) { return; }
        if(name.mode != Node.NONE
                && this.modes.kindOf(name.mode) == Mode.Kind.PROC) {
            return;
        }
        for(Node use: source.findAll(Attribute.IDENTIFIER)) {
            if(use.tag == name.tag) {
                this.session.diagnostics.report(
                    Severity.WARNING, use.source,
                    "'%s' may be used before it is initialised", use.symbol
                );
            }
        }
    }

}
