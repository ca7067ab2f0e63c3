package typesafeschwalbe.algolc.compiler.modes;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.Diagnostics;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.frontend.Attribute;
import typesafeschwalbe.algolc.compiler.frontend.Node;
import typesafeschwalbe.algolc.compiler.symbols.Symbols;
import typesafeschwalbe.algolc.compiler.symbols.Tag;

// Computes the mode every phrase yields and checks it against the sort and
// mode its position demands. Demands are recorded on the nodes, the
// coercions themselves are inserted later by CoercionInserter.
public class ModeChecker {

    private static final Logger LOGGER
        = Logger.getLogger(ModeChecker.class.getName());

    private final CompilationSession session;
    private final ModeTable modes;
    private final Symbols symbols;
    private final Diagnostics diagnostics;
    private final Coercions coercions;
    private final Soid.Pool soids;
    private int demands;

    public ModeChecker(CompilationSession session) {
        this.session = session;
        this.modes = session.modes;
        this.symbols = session.symbols;
        this.diagnostics = session.diagnostics;
        this.coercions = new Coercions(session.modes);
        this.soids = new Soid.Pool();
        this.demands = 0;
    }

    public void check(Node program) throws ErrorException {
        this.enquire(program.sub(), Sort.STRONG, this.modes.VOID);
        program.mode = this.modes.VOID;
        LOGGER.fine(
            "checked " + this.demands + " demands using "
                + this.soids.created() + " soids"
        );
    }

    private String name(int mode) {
        return this.modes.toString(mode);
    }

    private void error(Node at, String template, Object... args)
            throws ErrorException {
        this.diagnostics.report(Severity.ERROR, at.source, template, args);
        if(this.diagnostics.exceeded()) {
            throw this.diagnostics.abort(
                Severity.ERROR, at.source,
                "too many errors, giving up on this program"
            );
        }
    }

    // demands

    // Records that node, whose yield is already known, must be
    // coerced to target in a position of the given sort.
    private void expect(Node node, Sort sort, int target)
            throws ErrorException {
        this.demands += 1;
        node.expectedMode = target;
        node.expectedSort = sort;
        if(node.mode == Node.NONE) { node.mode = this.modes.ERROR; }
        Node nil = node.unwrap();
        if(nil.is(Attribute.NIHIL)
                && this.modes.kindOf(target) != Mode.Kind.REF
                && this.modes.kindOf(target) != Mode.Kind.ERROR) {
            this.error(node, "NIL cannot stand where %s is expected",
                this.name(target));
            return;
        }
        if(!this.coercions.coercible(node.mode, target, sort)) {
            this.error(
                node, "%s cannot be coerced to %s in a %s position",
                this.name(node.mode), this.name(target), sort
            );
        }
    }

    private int demand(Node node, Sort sort, int target)
            throws ErrorException {
        this.yield(node, sort, target);
        this.expect(node, sort, target);
        return target;
    }

    // Follows deproceduring, and dereferencing as far as the sort allows,
    // until a mode accepted by wanted turns up.
    private int strip(int mode, Sort sort, Predicate<Mode> wanted) {
        int current = mode;
        for(int step = 0; step < 64; step += 1) {
            Mode m = this.modes.get(current);
            if(m.is(Mode.Kind.ERROR)) { return this.modes.ERROR; }
            if(wanted.test(m)) { return current; }
            if(m.is(Mode.Kind.PROC) && m.pack.isEmpty()) {
                current = m.sub;
                continue;
            }
            boolean dereferences = m.is(Mode.Kind.REF) && (
                sort.includes(Sort.MEEK) || (sort == Sort.WEAK
                    && this.modes.kindOf(m.sub) == Mode.Kind.REF)
            );
            if(dereferences) {
                current = m.sub;
                continue;
            }
            return Node.NONE;
        }
        return Node.NONE;
    }

    // yields

    private int yield(Node node, Sort sort, int target)
            throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            int mode = this.yieldUnguarded(node, sort, target);
            node.mode = mode;
            return mode;
        } finally {
            this.session.guard.exit();
        }
    }

    private int yieldUnguarded(Node node, Sort sort, int target)
            throws ErrorException {
        switch(node.attribute()) {
            case PRIMARY:
            case SECONDARY:
            case TERTIARY:
            case UNIT:
                return this.yield(node.sub(), sort, target);
            case IDENTIFIER:
                return this.identifier(node);
            case DENOTATION:
                return this.denotation(node);
            case NIHIL:
            case SKIP:
            case JUMP:
                return this.modes.HIP;
            case CAST: {
                int mode = node.sub().is(Attribute.DECLARER)
                    ? node.sub().mode
                    : this.modes.VOID;
                this.demand(node.sub().next(), Sort.STRONG, mode);
                return mode;
            }
            case ASSERTION:
                this.demand(node.sub().next(), Sort.MEEK, this.modes.BOOL);
                return this.modes.VOID;
            case FORMAT_TEXT:
                this.format(node);
                return this.modes.FORMAT;
            case GENERATOR:
                this.bounds(node.sub().next());
                return node.mode;
            case SLICE:
                return this.slice(node);
            case SELECTION:
                return this.selection(node);
            case MONADIC_FORMULA:
            case FORMULA:
                return this.formula(node);
            case AND_FUNCTION:
            case OR_FUNCTION:
                this.demand(node.sub(), Sort.MEEK, this.modes.BOOL);
                this.demand(
                    node.sub().next().next(), Sort.MEEK, this.modes.BOOL
                );
                return this.modes.BOOL;
            case IDENTITY_RELATION:
                return this.identityRelation(node);
            case ASSIGNATION:
                return this.assignation(node);
            case ROUTINE_TEXT:
                return this.routineText(node);
            case CLOSED_CLAUSE:
                return this.balanced(
                    node, this.yields(ModeChecker.content(node)), sort, target
                );
            case COLLATERAL_CLAUSE:
                return this.collateral(node, sort, target);
            case PARALLEL_CLAUSE:
                this.parallel(node.sub().next());
                return this.modes.VOID;
            case CONDITIONAL_CLAUSE:
            case CASE_CLAUSE:
            case CONFORMITY_CLAUSE: {
                List<Node> branches = new ArrayList<>();
                this.choice(node, branches);
                return this.balanced(node, branches, sort, target);
            }
            case LOOP_CLAUSE:
                this.loop(node);
                return this.modes.VOID;
            case CODE_CLAUSE:
                return this.modes.VOID;
            default:
                return this.modes.ERROR;
        }
    }

    private int identifier(Node node) {
        if(node.tag == Node.NONE) { return this.modes.ERROR; }
        Tag tag = this.symbols.tag(node.tag);
        return tag.mode == Node.NONE? this.modes.ERROR : tag.mode;
    }

    // denotations

    private int denotation(Node node) throws ErrorException {
        int length = 0;
        Node current = node;
        while(current.sub().isOneOf(
            Attribute.LONG_SYMBOL, Attribute.SHORT_SYMBOL
        )) {
            length += current.sub().is(Attribute.LONG_SYMBOL)? 1 : -1;
            current = current.sub().next();
        }
        Node token = current.sub();
        switch(token.attribute()) {
            case INT_DENOTATION:
                return this.integral(token, length);
            case REAL_DENOTATION:
                return this.real(token, length);
            case BITS_DENOTATION:
                return this.bits(token, length);
            default:
                break;
        }
        if(length != 0) {
            this.error(node, "LONG and SHORT do not apply to %s",
                token.attribute().description);
        }
        switch(token.attribute()) {
            case ROW_CHAR_DENOTATION:
                return token.symbol.length() == 1
                    ? this.modes.CHAR
                    : this.modes.ROW_CHAR;
            case TRUE_SYMBOL:
            case FALSE_SYMBOL:
                return this.modes.BOOL;
            case EMPTY_SYMBOL:
                return this.modes.VOID;
            default:
                return this.modes.ERROR;
        }
    }

    private String sized(Node token, int length, String base) {
        if(length < 0 || length >= ModeTable.LENGTHS.length) {
            this.diagnostics.report(
                Severity.WARNING, token.source,
                "no %s has that length, using the nearest", base
            );
            length = Math.max(0, Math.min(length, ModeTable.LENGTHS.length - 1));
        }
        return ModeTable.LENGTHS[length] + base;
    }

    private int integral(Node token, int length) throws ErrorException {
        String name = this.sized(token, length, "INT");
        BigInteger value = new BigInteger(token.symbol);
        BigInteger max;
        if(name.equals("INT")) {
            max = BigInteger.valueOf(Integer.MAX_VALUE);
        } else if(name.equals("LONG INT")) {
            max = BigInteger.valueOf(Long.MAX_VALUE);
        } else {
            max = BigInteger.TEN.pow(this.session.precision.digits(name))
                .subtract(BigInteger.ONE);
        }
        if(value.compareTo(max) > 0) {
            this.error(token, "integral denotation %s is too large for %s",
                token.symbol, name);
        }
        return this.modes.standard(name);
    }

    private int real(Node token, int length) {
        String name = this.sized(token, length, "REAL");
        String mantissa = token.symbol.split("[eE\\\\]")[0].replace(".", "");
        String significant = mantissa.replaceFirst("^0+", "");
        if(significant.length() > this.session.precision.digits(name)) {
            this.diagnostics.report(
                Severity.WARNING, token.source,
                "real denotation %s has more digits than %s holds",
                token.symbol, name
            );
        }
        return this.modes.standard(name);
    }

    private int bits(Node token, int length) throws ErrorException {
        String name = this.sized(token, length, "BITS");
        int r = token.symbol.indexOf('r');
        BigInteger value;
        try {
            int radix = Integer.parseInt(token.symbol.substring(0, r));
            value = new BigInteger(token.symbol.substring(r + 1), radix);
        } catch(NumberFormatException e) {
            this.error(token, "'%s' is not a valid bits denotation",
                token.symbol);
            return this.modes.standard(name);
        }
        if(value.bitLength() > this.session.precision.digits(name)) {
            this.error(token, "bits denotation %s does not fit in %s",
                token.symbol, name);
        }
        return this.modes.standard(name);
    }

    // serial clauses and balancing

    private static Node content(Node part) {
        for(Node child = part.sub(); child != null; child = child.next()) {
            if(child.isOneOf(
                Attribute.SERIAL_CLAUSE, Attribute.UNIT_LIST,
                Attribute.SPECIFIED_UNIT_LIST, Attribute.UNIT,
                Attribute.ERROR
            )) {
                return child;
            }
        }
        return null;
    }

    private static Node unitOf(Node phrase) {
        Node unit = phrase;
        while(unit.is(Attribute.LABELED_UNIT)) {
            unit = unit.sub().next();
        }
        return unit;
    }

    // Checks the phrases of a serial clause that yield nothing and returns
    // the units whose value the clause may yield, i.e. the last one and
    // every unit completed by EXIT.
    private List<Node> yields(Node serial) throws ErrorException {
        List<Node> yields = new ArrayList<>();
        if(serial == null || serial.is(Attribute.ERROR)) { return yields; }
        if(serial.is(Attribute.UNIT)) {
            yields.add(serial);
            return yields;
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
            Node unit = ModeChecker.unitOf(phrase);
            Node separator = phrase.next();
            if(separator == null || separator.is(Attribute.EXIT_SYMBOL)) {
                yields.add(unit);
            } else {
                this.demand(unit, Sort.STRONG, this.modes.VOID);
            }
        }
        return yields;
    }

    private void enquire(Node serial, Sort sort, int target)
            throws ErrorException {
        for(Node unit: this.yields(serial)) {
            this.demand(unit, sort, target);
        }
    }

    // The mode of a clause whose value comes from any of units.
    // In a strong position every unit is coerced to the demanded mode,
    // otherwise to the one mode all of them strongly coerce to.
    private int balanced(Node clause, List<Node> units, Sort sort, int target)
            throws ErrorException {
        if(units.isEmpty()) { return this.modes.ERROR; }
        if(sort == Sort.STRONG && target != Node.NONE) {
            for(Node unit: units) {
                this.demand(unit, Sort.STRONG, target);
            }
            return target;
        }
        List<Soid> branches = new ArrayList<>();
        List<Integer> yielded = new ArrayList<>();
        for(Node unit: units) {
            int mode = this.yield(unit, sort, Node.NONE);
            branches.add(this.soids.obtain(sort, mode, unit));
            yielded.add(mode);
        }
        try {
            if(branches.size() == 1) { return branches.get(0).mode; }
            int common = this.coercions.balance(yielded);
            if(common == Node.NONE) {
                this.error(clause, "the branches of %s have no common mode",
                    clause.attribute().description);
                return this.modes.ERROR;
            }
            for(Soid branch: branches) {
                this.expect(branch.producer, Sort.STRONG, common);
            }
            return common;
        } finally {
            for(Soid branch: branches) {
                this.soids.release(branch);
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
                for(Node child = declaration.sub(); child != null;
                        child = child.next()) {
                    if(child.is(Attribute.DECLARER)) { this.bounds(child); }
                }
                return;
            case PRIORITY_DECLARATION:
                return;
            case VARIABLE_DECLARATION:
            case PROCEDURE_VARIABLE_DECLARATION: {
                Node declarer = declaration.child(Attribute.DECLARER);
                if(declarer != null) { this.bounds(declarer); }
                for(Node child = declaration.sub(); child != null;
                        child = child.next()) {
                    if(!child.is(Attribute.DEFINING_IDENTIFIER)) { continue; }
                    Node sign = child.next();
                    if(!Node.is(sign, Attribute.BECOMES_SYMBOL)) { continue; }
                    Mode name = this.modes.get(child.mode);
                    int value = name.is(Mode.Kind.REF)
                        ? name.sub
                        : this.modes.ERROR;
                    this.demand(sign.next(), Sort.STRONG, value);
                }
                return;
            }
            default:
                for(Node child = declaration.sub(); child != null;
                        child = child.next()) {
                    boolean defining = child.isOneOf(
                        Attribute.DEFINING_IDENTIFIER,
                        Attribute.DEFINING_OPERATOR
                    );
                    if(!defining) { continue; }
                    Node sign = child.next();
                    if(sign == null || sign.next() == null) { continue; }
                    int mode = child.mode == Node.NONE
                        ? this.modes.ERROR
                        : child.mode;
                    this.demand(sign.next(), Sort.STRONG, mode);
                }
                return;
        }
    }

    // Checks the bound units of an actual declarer, without descending
    // into the clauses those units contain.
    private void bounds(Node declarer) throws ErrorException {
        for(Node child = declarer.sub(); child != null; child = child.next()) {
            if(child.is(Attribute.BOUND)) {
                for(Node unit = child.sub(); unit != null;
                        unit = unit.next()) {
                    if(unit.is(Attribute.UNIT)) {
                        this.demand(unit, Sort.MEEK, this.modes.INT);
                    }
                }
            } else if(child.isOneOf(
                Attribute.DECLARER, Attribute.BOUNDS, Attribute.PACK,
                Attribute.FIELD
            )) {
                this.bounds(child);
            }
        }
    }

    // enclosed clauses

    private int collateral(Node clause, Sort sort, int target)
            throws ErrorException {
        Node list = ModeChecker.content(clause);
        List<Node> units = new ArrayList<>();
        if(list != null && list.is(Attribute.UNIT_LIST)) {
            for(Node unit = list.sub(); unit != null; unit = unit.next()) {
                if(unit.is(Attribute.UNIT)) { units.add(unit); }
            }
        }
        if(units.isEmpty()) { return this.modes.VACUUM; }
        if(sort != Sort.STRONG || target == Node.NONE) {
            for(Node unit: units) {
                this.yield(unit, Sort.STRONG, Node.NONE);
            }
            this.error(clause, "%s can only stand in a strong position",
                clause.attribute().description);
            return this.modes.ERROR;
        }
        Mode wanted = this.modes.get(this.modes.deflex(target));
        switch(wanted.kind) {
            case VOID:
                for(Node unit: units) {
                    this.demand(unit, Sort.STRONG, this.modes.VOID);
                }
                return this.modes.VOID;
            case ROW: {
                int element = wanted.dimensions > 1
                    ? this.modes.row(wanted.dimensions - 1, wanted.sub)
                    : wanted.sub;
                for(Node unit: units) {
                    this.demand(unit, Sort.STRONG, element);
                }
                return target;
            }
            case STRUCT: {
                if(units.size() != wanted.pack.size()) {
                    this.error(clause, "%s has %d fields, %d values given",
                        this.name(target), wanted.pack.size(), units.size());
                }
                int count = Math.min(units.size(), wanted.pack.size());
                for(int idx = 0; idx < count; idx += 1) {
                    this.demand(
                        units.get(idx), Sort.STRONG,
                        wanted.pack.get(idx).mode()
                    );
                }
                return target;
            }
            case UNION:
                for(int member: this.modes.equivalencer().flatMembers(target)) {
                    Mode.Kind kind = this.modes.kindOf(member);
                    if(kind == Mode.Kind.ROW || kind == Mode.Kind.FLEX
                            || kind == Mode.Kind.STRUCT) {
                        return this.collateral(clause, sort, member);
                    }
                }
                break;
            case ERROR:
                for(Node unit: units) {
                    this.yield(unit, Sort.STRONG, Node.NONE);
                }
                return this.modes.ERROR;
            default:
                break;
        }
        List<Integer> members = new ArrayList<>();
        for(Node unit: units) {
            members.add(this.yield(unit, Sort.STRONG, Node.NONE));
        }
        return this.modes.add(Mode.series(Mode.Kind.STOWED, members));
    }

    private void parallel(Node clause) throws ErrorException {
        Node list = ModeChecker.content(clause);
        if(list == null) { return; }
        if(list.is(Attribute.UNIT_LIST)) {
            for(Node unit = list.sub(); unit != null; unit = unit.next()) {
                if(unit.is(Attribute.UNIT)) {
                    this.demand(unit, Sort.STRONG, this.modes.VOID);
                }
            }
            return;
        }
        this.enquire(list, Sort.STRONG, this.modes.VOID);
    }

    private static boolean isBrief(Node part) {
        return part.sub().isOneOf(
            Attribute.THEN_BAR_SYMBOL, Attribute.ELSE_BAR_SYMBOL
        );
    }

    // Turns a brief conditional clause with an integral enquiry, such as
    // (i | a | b), into the case clause it really is.
    private void becomeCase(Node clause) {
        clause.become(Attribute.CASE_CLAUSE);
        for(Node part = clause.sub(); part != null; part = part.next()) {
            switch(part.attribute()) {
                case IF_PART: part.become(Attribute.CASE_PART); break;
                case ELIF_PART: part.become(Attribute.OUSE_PART); break;
                case THEN_PART: part.become(Attribute.IN_PART); break;
                case ELSE_PART: part.become(Attribute.OUT_PART); break;
                default: break;
            }
        }
    }

    private void choice(Node clause, List<Node> branches)
            throws ErrorException {
        Node enquiry = clause.sub();
        List<Node> conditions = this.yields(ModeChecker.content(enquiry));
        List<Integer> yielded = new ArrayList<>();
        for(Node condition: conditions) {
            yielded.add(this.yield(condition, Sort.MEEK, Node.NONE));
        }
        int union = Node.NONE;
        if(clause.is(Attribute.CONDITIONAL_CLAUSE)) {
            Node then = enquiry.next();
            if(conditions.size() == 1 && then != null
                    && ModeChecker.isBrief(then)) {
                int mode = yielded.get(0);
                boolean bool = this.strip(
                    mode, Sort.MEEK, m -> m.is(Mode.Kind.STANDARD)
                        && m.name.equals("BOOL")
                ) != Node.NONE;
                boolean integral = this.strip(
                    mode, Sort.MEEK, m -> m.is(Mode.Kind.STANDARD)
                        && m.name.equals("INT")
                ) != Node.NONE;
                if(!bool && integral) { this.becomeCase(clause); }
            }
        }
        switch(clause.attribute()) {
            case CONDITIONAL_CLAUSE:
                for(Node condition: conditions) {
                    this.expect(condition, Sort.MEEK, this.modes.BOOL);
                }
                break;
            case CASE_CLAUSE:
                for(Node condition: conditions) {
                    this.expect(condition, Sort.MEEK, this.modes.INT);
                }
                break;
            default:
                union = this.conformityEnquiry(conditions, yielded);
                break;
        }
        for(Node part = enquiry.next(); part != null; part = part.next()) {
            switch(part.attribute()) {
                case CONDITIONAL_CLAUSE:
                case CASE_CLAUSE:
                case CONFORMITY_CLAUSE:
                    this.choice(part, branches);
                    break;
                case IN_PART:
                    this.alternatives(ModeChecker.content(part), union, branches);
                    break;
                case THEN_PART:
                case ELSE_PART:
                case OUT_PART:
                    branches.addAll(this.yields(ModeChecker.content(part)));
                    break;
                default:
                    break;
            }
        }
    }

    private int conformityEnquiry(List<Node> conditions, List<Integer> yielded)
            throws ErrorException {
        int union = Node.NONE;
        for(int idx = 0; idx < conditions.size(); idx += 1) {
            Node condition = conditions.get(idx);
            int mode = yielded.get(idx);
            int found = this.strip(
                mode, Sort.MEEK, m -> m.is(Mode.Kind.UNION)
            );
            if(found == Node.NONE) {
                this.error(condition,
                    "the enquiry of a conformity clause must yield a united mode, not %s",
                    this.name(mode));
                found = this.modes.ERROR;
            }
            this.expect(condition, Sort.MEEK, found);
            if(union == Node.NONE) { union = found; }
        }
        return union == Node.NONE? this.modes.ERROR : union;
    }

    private void alternatives(Node content, int union, List<Node> branches)
            throws ErrorException {
        if(content == null) { return; }
        if(content.is(Attribute.SERIAL_CLAUSE)) {
            branches.addAll(this.yields(content));
            return;
        }
        for(Node item = content.sub(); item != null; item = item.next()) {
            if(item.is(Attribute.UNIT)) {
                branches.add(item);
            } else if(item.is(Attribute.SPECIFIED_UNIT)) {
                Node specifier = item.sub();
                int mode = specifier.mode == Node.NONE
                    ? this.modes.ERROR
                    : specifier.mode;
                boolean member = union == Node.NONE
                    || this.modes.kindOf(union) == Mode.Kind.ERROR
                    || this.modes.kindOf(mode) == Mode.Kind.ERROR
                    || this.coercions.unitable(mode, union);
                if(!member) {
                    this.error(specifier, "mode %s is not a member of %s",
                        this.name(mode), this.name(union));
                }
                item.mode = mode;
                branches.add(item.sub().last());
            }
        }
    }

    private void loop(Node clause) throws ErrorException {
        for(Node part = clause.sub(); part != null; part = part.next()) {
            switch(part.attribute()) {
                case FROM_PART:
                case BY_PART:
                case TO_PART:
                    this.enquire(
                        ModeChecker.content(part), Sort.MEEK, this.modes.INT
                    );
                    break;
                case WHILE_PART:
                    this.enquire(
                        ModeChecker.content(part), Sort.MEEK, this.modes.BOOL
                    );
                    break;
                case DO_PART: {
                    this.enquire(
                        ModeChecker.content(part), Sort.STRONG, this.modes.VOID
                    );
                    Node until = part.child(Attribute.UNTIL_PART);
                    if(until != null) {
                        this.enquire(
                            ModeChecker.content(until), Sort.MEEK,
                            this.modes.BOOL
                        );
                    }
                    break;
                }
                default:
                    break;
            }
        }
    }

    private void format(Node format) throws ErrorException {
        for(Node child = format.sub(); child != null; child = child.next()) {
            if(child.attribute().isEnclosedClause()) {
                this.demand(child, Sort.MEEK, this.modes.INT);
            }
        }
    }

    // primaries and secondaries

    private List<Node> arguments(Node pack) {
        List<Node> items = new ArrayList<>();
        for(Node item = pack.sub(); item != null; item = item.next()) {
            if(item.isOneOf(Attribute.UNIT, Attribute.TRIMMER)) {
                items.add(item);
            }
        }
        return items;
    }

    private int slice(Node slice) throws ErrorException {
        Node primary = slice.sub();
        Node pack = primary.next();
        List<Node> items = this.arguments(pack);
        int mode = this.yield(primary, Sort.WEAK, Node.NONE);
        int procedure = this.strip(
            mode, Sort.MEEK, m -> m.is(Mode.Kind.PROC) && !m.pack.isEmpty()
        );
        if(procedure != Node.NONE
                && this.modes.kindOf(procedure) == Mode.Kind.PROC) {
            slice.become(Attribute.CALL);
            return this.call(slice, primary, procedure, items);
        }
        int row = this.strip(
            mode, Sort.WEAK, m -> m.isRowLike() || (m.is(Mode.Kind.REF)
                && this.modes.get(m.sub).isRowLike())
        );
        if(row == Node.NONE) {
            this.error(primary, "%s can neither be sliced nor called",
                this.name(mode));
            row = this.modes.ERROR;
        }
        this.expect(primary, Sort.WEAK, row);
        int trimmers = 0;
        for(Node item: items) {
            if(item.is(Attribute.TRIMMER)) {
                trimmers += 1;
                for(Node unit = item.sub(); unit != null; unit = unit.next()) {
                    if(unit.is(Attribute.UNIT)) {
                        this.demand(unit, Sort.MEEK, this.modes.INT);
                    }
                }
            } else {
                this.demand(item, Sort.MEEK, this.modes.INT);
            }
        }
        if(this.modes.kindOf(row) == Mode.Kind.ERROR) {
            return this.modes.ERROR;
        }
        boolean name = this.modes.kindOf(row) == Mode.Kind.REF;
        int rowed = name? this.modes.get(row).sub : row;
        Mode deflexed = this.modes.get(this.modes.deflex(rowed));
        if(items.size() != deflexed.dimensions) {
            this.error(pack, "%s has %d dimensions, but %d subscripts are given",
                this.name(rowed), deflexed.dimensions, items.size());
            return this.modes.ERROR;
        }
        int element = trimmers == 0
            ? deflexed.sub
            : this.modes.row(trimmers, deflexed.sub);
        return name? this.modes.ref(element) : element;
    }

    private int call(Node call, Node primary, int procedure, List<Node> items)
            throws ErrorException {
        this.expect(primary, Sort.MEEK, procedure);
        Mode proc = this.modes.get(procedure);
        List<Integer> parameters = proc.packModes();
        List<Node> arguments = new ArrayList<>();
        for(Node item: items) {
            if(item.is(Attribute.TRIMMER)) {
                this.error(item, "a call takes no trimmers");
            } else {
                arguments.add(item);
            }
        }
        if(items.size() != parameters.size()) {
            this.error(call, "%s takes %d arguments, but %d are given",
                this.name(procedure), parameters.size(), items.size());
        }
        for(int idx = 0; idx < arguments.size(); idx += 1) {
            int parameter = idx < parameters.size()
                ? parameters.get(idx)
                : this.modes.ERROR;
            this.demand(arguments.get(idx), Sort.STRONG, parameter);
        }
        return proc.sub;
    }

    private boolean isStructured(Mode mode) {
        if(mode.is(Mode.Kind.STRUCT)) { return true; }
        if(mode.is(Mode.Kind.FLEX)) {
            return this.isStructured(this.modes.get(mode.sub));
        }
        return mode.is(Mode.Kind.ROW)
            && this.modes.kindOf(mode.sub) == Mode.Kind.STRUCT;
    }

    private int selection(Node selection) throws ErrorException {
        Node selector = selection.sub();
        String field = selector.sub().symbol;
        Node secondary = selector.next();
        int mode = this.yield(secondary, Sort.WEAK, Node.NONE);
        int found = this.strip(
            mode, Sort.WEAK, m -> this.isStructured(m) || (
                m.is(Mode.Kind.REF)
                    && this.isStructured(this.modes.get(m.sub))
            )
        );
        if(found == Node.NONE) {
            this.error(secondary, "mode %s has no fields", this.name(mode));
            found = this.modes.ERROR;
        }
        this.expect(secondary, Sort.WEAK, found);
        if(this.modes.kindOf(found) == Mode.Kind.ERROR) {
            return this.modes.ERROR;
        }
        boolean name = this.modes.kindOf(found) == Mode.Kind.REF;
        int base = name? this.modes.get(found).sub : found;
        Mode structure = this.modes.get(base);
        int dimensions = 0;
        if(structure.isRowLike()) {
            Mode row = this.modes.get(this.modes.deflex(base));
            dimensions = row.dimensions;
            structure = this.modes.get(row.sub);
        }
        int selected = Node.NONE;
        for(Mode.Field candidate: structure.pack) {
            if(candidate.name().equals(field)) {
                selected = candidate.mode();
                break;
            }
        }
        if(selected == Node.NONE) {
            this.error(selector, "mode %s has no field '%s'",
                this.name(base), field);
            return this.modes.ERROR;
        }
        if(dimensions > 0) {
            selected = this.modes.row(dimensions, selected);
        }
        return name? this.modes.ref(selected) : selected;
    }

    // formulas

    private int formula(Node formula) throws ErrorException {
        List<Node> operands = new ArrayList<>();
        Node operator;
        if(formula.is(Attribute.MONADIC_FORMULA)) {
            operator = formula.sub();
            operands.add(operator.next());
        } else {
            operands.add(formula.sub());
            operator = formula.sub().next();
            operands.add(operator.next());
        }
        List<Soid> yields = new ArrayList<>();
        for(Node operand: operands) {
            int mode = this.yield(operand, Sort.FIRM, Node.NONE);
            yields.add(this.soids.obtain(Sort.FIRM, mode, operand));
        }
        try {
            return this.identify(operator, yields);
        } finally {
            for(Soid soid: yields) {
                this.soids.release(soid);
            }
        }
    }

    private boolean accepts(Tag operator, List<Soid> operands, Sort sort) {
        if(operator.mode == Node.NONE) { return false; }
        Mode plan = this.modes.get(operator.mode);
        if(!plan.is(Mode.Kind.PROC) || plan.pack.size() != operands.size()) {
            return false;
        }
        for(int idx = 0; idx < operands.size(); idx += 1) {
            int parameter = plan.pack.get(idx).mode();
            if(!this.coercions.coercible(
                operands.get(idx).mode, parameter, sort
            )) {
                return false;
            }
        }
        return true;
    }

    private boolean unites(Tag operator, List<Soid> operands) {
        Mode plan = this.modes.get(operator.mode);
        for(int idx = 0; idx < operands.size(); idx += 1) {
            List<Coercions.Step> steps = this.coercions.plan(
                operands.get(idx).mode, plan.pack.get(idx).mode(), Sort.FIRM
            );
            if(steps == null) { continue; }
            for(Coercions.Step step: steps) {
                if(step.coercion() == Attribute.UNITING) { return true; }
            }
        }
        return false;
    }

    // Finds the operator of the innermost range that accepts the operands
    // firmly, preferring one that needs no uniting.
    private Tag lookUpOperator(Node operator, List<Soid> operands)
            throws ErrorException {
        for(List<Tag> range: this.symbols.operatorsVisible(
            operator.table, operator.symbol
        )) {
            List<Tag> matches = new ArrayList<>();
            for(Tag candidate: range) {
                if(this.accepts(candidate, operands, Sort.FIRM)) {
                    matches.add(candidate);
                }
            }
            if(matches.size() > 1) {
                List<Tag> exact = new ArrayList<>();
                for(Tag match: matches) {
                    if(!this.unites(match, operands)) { exact.add(match); }
                }
                if(exact.size() == 1) { return exact.get(0); }
                this.error(operator, "operator '%s' is ambiguous for %s",
                    operator.symbol, this.describe(operands));
                return matches.get(0);
            }
            if(matches.size() == 1) { return matches.get(0); }
        }
        return null;
    }

    private String describe(List<Soid> operands) {
        StringBuilder output = new StringBuilder();
        for(int idx = 0; idx < operands.size(); idx += 1) {
            if(idx > 0) { output.append(" and "); }
            output.append(this.name(operands.get(idx).mode));
        }
        return output.toString();
    }

    // The operand modes after firm coercion, each widened steps
    // times where possible.
    private int widen(int mode, int steps) {
        int current = this.strip(
            mode, Sort.MEEK, m -> !m.is(Mode.Kind.REF)
                && !(m.is(Mode.Kind.PROC) && m.pack.isEmpty())
        );
        if(current == Node.NONE) { return Node.NONE; }
        for(int step = 0; step < steps; step += 1) {
            current = this.coercions.widened(current);
            if(current == Node.NONE) { return Node.NONE; }
        }
        return current;
    }

    // Tries the operator again with operands widened along INT, REAL and
    // COMPL of their length, the fewest widenings first.
    private Tag crossTerm(Node operator, List<Soid> operands)
            throws ErrorException {
        int total = 2 * operands.size();
        for(int sum = 1; sum <= total; sum += 1) {
            for(int left = 0; left <= Math.min(2, sum); left += 1) {
                int right = sum - left;
                if(operands.size() == 1 && right != 0) { continue; }
                if(right > 2) { continue; }
                int[] widths = { left, right };
                List<Soid> widened = new ArrayList<>();
                boolean possible = true;
                for(int idx = 0; idx < operands.size(); idx += 1) {
                    int mode = this.widen(operands.get(idx).mode, widths[idx]);
                    if(mode == Node.NONE) {
                        possible = false;
                        break;
                    }
                    widened.add(this.soids.obtain(
                        Sort.STRONG, mode, operands.get(idx).producer
                    ));
                }
                try {
                    if(!possible) { continue; }
                    Tag found = this.lookUpOperator(operator, widened);
                    if(found != null) { return found; }
                } finally {
                    for(Soid soid: widened) {
                        this.soids.release(soid);
                    }
                }
            }
        }
        return null;
    }

    private int identify(Node operator, List<Soid> operands)
            throws ErrorException {
        for(Soid operand: operands) {
            if(this.modes.kindOf(operand.mode) == Mode.Kind.ERROR) {
                return this.modes.ERROR;
            }
        }
        Tag found = this.lookUpOperator(operator, operands);
        Sort sort = Sort.FIRM;
        if(found == null) {
            found = this.crossTerm(operator, operands);
            sort = Sort.STRONG;
        }
        if(found == null) {
            this.error(operator, "no operator %s found for %s",
                operator.symbol, this.describe(operands));
            return this.modes.ERROR;
        }
        operator.tag = found.handle;
        operator.mode = found.mode;
        Mode plan = this.modes.get(found.mode);
        for(int idx = 0; idx < operands.size(); idx += 1) {
            this.expect(
                operands.get(idx).producer, sort, plan.pack.get(idx).mode()
            );
        }
        return plan.sub;
    }

    // tertiaries and units

    private static Predicate<Mode> isName() {
        return m -> m.is(Mode.Kind.REF);
    }

    private int identityRelation(Node relation) throws ErrorException {
        Node left = relation.sub();
        Node right = left.next().next();
        int leftMode = this.yield(left, Sort.SOFT, Node.NONE);
        int rightMode = this.yield(right, Sort.SOFT, Node.NONE);
        int leftName = this.strip(leftMode, Sort.SOFT, ModeChecker.isName());
        int rightName = this.strip(rightMode, Sort.SOFT, ModeChecker.isName());
        boolean leftNil = this.modes.kindOf(leftMode) == Mode.Kind.HIP;
        boolean rightNil = this.modes.kindOf(rightMode) == Mode.Kind.HIP;
        if(leftName != Node.NONE && rightNil) {
            this.expect(left, Sort.SOFT, leftName);
            this.expect(right, Sort.STRONG, leftName);
        } else if(rightName != Node.NONE && leftNil) {
            this.expect(left, Sort.STRONG, rightName);
            this.expect(right, Sort.SOFT, rightName);
        } else if(leftName != Node.NONE && rightName != Node.NONE) {
            if(this.coercions.coercible(rightMode, leftName, Sort.STRONG)) {
                this.expect(left, Sort.SOFT, leftName);
                this.expect(right, Sort.STRONG, leftName);
            } else if(this.coercions.coercible(
                leftMode, rightName, Sort.STRONG
            )) {
                this.expect(left, Sort.STRONG, rightName);
                this.expect(right, Sort.SOFT, rightName);
            } else {
                this.error(relation,
                    "an identity relation cannot compare %s with %s",
                    this.name(leftMode), this.name(rightMode));
            }
        } else if(this.modes.kindOf(leftMode) != Mode.Kind.ERROR
                && this.modes.kindOf(rightMode) != Mode.Kind.ERROR) {
            this.error(relation,
                "an identity relation needs a name, not %s and %s",
                this.name(leftMode), this.name(rightMode));
        }
        return this.modes.BOOL;
    }

    private int assignation(Node assignation) throws ErrorException {
        Node destination = assignation.sub();
        Node source = destination.next().next();
        int mode = this.yield(destination, Sort.SOFT, Node.NONE);
        int name = this.strip(mode, Sort.SOFT, ModeChecker.isName());
        if(name == Node.NONE) {
            this.error(destination,
                "the destination of an assignation must be a name, not %s",
                this.name(mode));
            this.yield(source, Sort.STRONG, Node.NONE);
            return this.modes.ERROR;
        }
        this.expect(destination, Sort.SOFT, name);
        Mode ref = this.modes.get(name);
        int value = ref.is(Mode.Kind.REF)? ref.sub : this.modes.ERROR;
        this.demand(source, Sort.STRONG, value);
        return name;
    }

    private int routineText(Node routine) throws ErrorException {
        int mode = routine.mode;
        if(mode == Node.NONE) { return this.modes.ERROR; }
        Mode procedure = this.modes.get(mode);
        int result = procedure.is(Mode.Kind.PROC)
            ? procedure.sub
            : this.modes.ERROR;
        this.demand(routine.sub().last(), Sort.STRONG, result);
        return mode;
    }

}
