package typesafeschwalbe.algolc.compiler.frontend;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.symbols.Tag;

// Reduces the content of every part left by the top-down parser into
// phrases and clauses. Each span is reduced in a fixed order: declarers,
// declaration marks, nested clauses, primaries, secondaries, formulas,
// tertiaries, units, declarations and finally the clause it belongs to.
public class BottomUpParser {

    private static final Logger LOGGER
        = Logger.getLogger(BottomUpParser.class.getName());

    private enum Expect {
        SERIAL("a serial clause"),
        ENCLOSED("an enclosed clause"),
        CHOICE_IN("the alternatives of a case clause"),
        BRIEF_IN("a choice"),
        UNIT("a unit"),
        ARGUMENTS("an argument or indexer list"),
        BOUNDS("bounds");

        private final String description;

        private Expect(String description) {
            this.description = description;
        }
    }

    private enum Pack {
        FIELDS("a structure field pack"),
        MEMBERS("a united mode pack"),
        FORMALS("a procedure parameter pack"),
        PARAMETERS("a routine parameter pack"),
        SPECIFIER("a specifier");

        private final String description;

        private Pack(String description) {
            this.description = description;
        }
    }

    private static class Span {
        private final Node owner;
        private final Node anchor;

        private Span(Node owner, Node anchor) {
            this.owner = owner;
            this.anchor = anchor;
        }

        private Node first() {
            return this.anchor == null? this.owner.sub() : this.anchor.next();
        }

        private Node last() {
            Node first = this.first();
            return first == null? null : first.last();
        }

        private Node previous(Node node) {
            Node previous = node.previous();
            return previous == this.anchor? null : previous;
        }

        private boolean isEmpty() {
            return this.first() == null;
        }
    }

    private static final Set<Attribute> CLOSERS = EnumSet.of(
        Attribute.END_SYMBOL, Attribute.CLOSE_SYMBOL, Attribute.BUS_SYMBOL,
        Attribute.OCCA_SYMBOL, Attribute.FI_SYMBOL, Attribute.ESAC_SYMBOL,
        Attribute.OD_SYMBOL, Attribute.EDOC_SYMBOL
    );

    private static final Set<Attribute> LOOP_PARTS = EnumSet.of(
        Attribute.FOR_SYMBOL, Attribute.FROM_SYMBOL, Attribute.BY_SYMBOL,
        Attribute.TO_SYMBOL, Attribute.DOWNTO_SYMBOL, Attribute.WHILE_SYMBOL,
        Attribute.DO_SYMBOL
    );

    private static final List<Rule> PRIMARIES = List.of(
        Rule.of(Attribute.JUMP, Attribute.GOTO_SYMBOL, Attribute.IDENTIFIER),
        Rule.of(Attribute.DENOTATION, Attribute.INT_DENOTATION),
        Rule.of(Attribute.DENOTATION, Attribute.REAL_DENOTATION),
        Rule.of(Attribute.DENOTATION, Attribute.BITS_DENOTATION),
        Rule.of(Attribute.DENOTATION, Attribute.ROW_CHAR_DENOTATION),
        Rule.of(Attribute.DENOTATION, Attribute.TRUE_SYMBOL),
        Rule.of(Attribute.DENOTATION, Attribute.FALSE_SYMBOL),
        Rule.of(Attribute.DENOTATION, Attribute.EMPTY_SYMBOL),
        Rule.of(Attribute.DENOTATION, Attribute.LONG_SYMBOL,
            Attribute.DENOTATION),
        Rule.of(Attribute.DENOTATION, Attribute.SHORT_SYMBOL,
            Attribute.DENOTATION),
        Rule.of(Attribute.NIHIL, Attribute.NIL_SYMBOL),
        Rule.of(Attribute.SKIP, Attribute.SKIP_SYMBOL),
        Rule.of(Attribute.CAST, Attribute.DECLARER,
            Attribute.ENCLOSED_CLAUSE),
        Rule.of(Attribute.CAST, Attribute.VOID_SYMBOL,
            Attribute.ENCLOSED_CLAUSE),
        Rule.of(Attribute.ASSERTION, Attribute.ASSERT_SYMBOL,
            Attribute.ENCLOSED_CLAUSE),
        Rule.of(Attribute.PRIMARY, Attribute.IDENTIFIER)
            .unlessFollowedBy(Attribute.OF_SYMBOL),
        Rule.of(Attribute.PRIMARY, Attribute.DENOTATION)
            .unlessPrecededBy(Attribute.LONG_SYMBOL, Attribute.SHORT_SYMBOL),
        Rule.of(Attribute.PRIMARY, Attribute.CAST),
        Rule.of(Attribute.PRIMARY, Attribute.FORMAT_TEXT),
        Rule.of(Attribute.PRIMARY, Attribute.ENCLOSED_CLAUSE)
            .unlessPrecededBy(
                Attribute.DECLARER, Attribute.VOID_SYMBOL,
                Attribute.ASSERT_SYMBOL
            ),
        Rule.of(Attribute.SLICE, Attribute.PRIMARY,
            Attribute.GENERIC_ARGUMENT),
        Rule.of(Attribute.PRIMARY, Attribute.SLICE)
    );

    private static final List<Rule> SECONDARIES = List.of(
        Rule.of(Attribute.FIELD_SELECTOR, Attribute.IDENTIFIER,
            Attribute.OF_SYMBOL),
        Rule.of(Attribute.GENERATOR, Attribute.LOC_SYMBOL, Attribute.DECLARER)
            .unlessFollowedBy(Attribute.DEFINING_IDENTIFIER),
        Rule.of(Attribute.GENERATOR, Attribute.HEAP_SYMBOL,
            Attribute.DECLARER)
            .unlessFollowedBy(Attribute.DEFINING_IDENTIFIER),
        Rule.of(Attribute.SECONDARY, Attribute.PRIMARY),
        Rule.of(Attribute.SECONDARY, Attribute.GENERATOR),
        Rule.of(Attribute.SELECTION, Attribute.FIELD_SELECTOR,
            Attribute.SECONDARY),
        Rule.of(Attribute.SECONDARY, Attribute.SELECTION)
    );

    private static final List<Rule> TERTIARIES = List.of(
        Rule.of(Attribute.TERTIARY, Attribute.SECONDARY),
        Rule.of(Attribute.TERTIARY, Attribute.MONADIC_FORMULA),
        Rule.of(Attribute.TERTIARY, Attribute.FORMULA),
        Rule.of(Attribute.TERTIARY, Attribute.NIHIL),
        Rule.of(Attribute.AND_FUNCTION, Attribute.TERTIARY,
            Attribute.ANDF_SYMBOL, Attribute.TERTIARY),
        Rule.of(Attribute.OR_FUNCTION, Attribute.TERTIARY,
            Attribute.ORF_SYMBOL, Attribute.TERTIARY),
        Rule.of(Attribute.TERTIARY, Attribute.AND_FUNCTION),
        Rule.of(Attribute.TERTIARY, Attribute.OR_FUNCTION),
        Rule.of(Attribute.IDENTITY_RELATION, Attribute.TERTIARY,
            Attribute.IS_SYMBOL, Attribute.TERTIARY),
        Rule.of(Attribute.IDENTITY_RELATION, Attribute.TERTIARY,
            Attribute.ISNT_SYMBOL, Attribute.TERTIARY)
    );

    private final CompilationSession session;
    private final List<Rule> units;
    private final boolean tracing;

    public BottomUpParser(CompilationSession session) {
        this.session = session;
        this.tracing = session.options().reductions();
        this.units = List.of(
            Rule.of(Attribute.ASSIGNATION, Attribute.TERTIARY,
                Attribute.BECOMES_SYMBOL, Attribute.UNIT),
            Rule.of(Attribute.ROUTINE_TEXT, Attribute.PARAMETER_PACK,
                Attribute.DECLARER, Attribute.COLON_SYMBOL, Attribute.UNIT),
            Rule.of(Attribute.ROUTINE_TEXT, Attribute.PARAMETER_PACK,
                Attribute.VOID_SYMBOL, Attribute.COLON_SYMBOL, Attribute.UNIT),
            Rule.of(Attribute.ROUTINE_TEXT, Attribute.DECLARER,
                Attribute.COLON_SYMBOL, Attribute.UNIT)
                .unlessPrecededBy(Attribute.PARAMETER_PACK),
            Rule.of(Attribute.ROUTINE_TEXT, Attribute.VOID_SYMBOL,
                Attribute.COLON_SYMBOL, Attribute.UNIT)
                .unlessPrecededBy(Attribute.PARAMETER_PACK),
            Rule.of(Attribute.SPECIFIED_UNIT, Attribute.SPECIFIER,
                Attribute.COLON_SYMBOL, Attribute.UNIT),
            Rule.of(Attribute.SKIP, Attribute.OPERATOR)
                .when(node -> node.symbol.equals("~")
                    && !BottomUpParser.isOperand(node.next()))
                .then(this::warnTildeSkip),
            Rule.of(Attribute.UNIT, Attribute.TERTIARY)
                .unlessFollowedBy(Attribute.BECOMES_SYMBOL),
            Rule.of(Attribute.UNIT, Attribute.ASSIGNATION),
            Rule.of(Attribute.UNIT, Attribute.ROUTINE_TEXT),
            Rule.of(Attribute.UNIT, Attribute.IDENTITY_RELATION),
            Rule.of(Attribute.UNIT, Attribute.SKIP),
            Rule.of(Attribute.UNIT, Attribute.JUMP),
            Rule.of(Attribute.UNIT, Attribute.ASSERTION)
        );
    }

    public void parse(Node program) throws ErrorException {
        Node serial = this.reduceSpan(
            program, null, null, Expect.SERIAL
        );
        if(serial == null) {
            throw this.session.diagnostics.abort(
                Severity.SYNTAX_ERROR, program.source, "%s is empty",
                Expect.SERIAL.description
            );
        }
        LOGGER.fine("reduced the particular program");
    }

    private void warnTildeSkip(Node skip) {
        if(this.session.options().portability()) {
            this.session.diagnostics.report(
                Severity.WARNING, skip.source,
                "'~' used for SKIP is not portable"
            );
        }
    }

    private Node fold(Node first, Node last, Attribute attribute) {
        Node folded = Node.fold(first, last, attribute);
        if(this.tracing) {
            StringBuilder line = new StringBuilder(attribute.toString());
            line.append(" <-");
            for(Node child = folded.sub(); child != null;
                    child = child.next()) {
                line.append(' ').append(child.attribute());
            }
            String traced = line.toString();
            this.session.traceReduction(traced);
            LOGGER.info(traced);
        }
        return folded;
    }

    private static boolean isOperand(Node node) {
        return node != null && node.isOneOf(
            Attribute.SECONDARY, Attribute.MONADIC_FORMULA, Attribute.FORMULA
        );
    }

    private static boolean isResult(Node node) {
        return node != null
            && node.isOneOf(Attribute.DECLARER, Attribute.VOID_SYMBOL);
    }

    private static boolean isPart(Node node, Attribute attribute) {
        return TopDownParser.isPart(node) && node.is(attribute);
    }

    private static Node closerOf(Node part) {
        Node last = part.sub().last();
        if(last == part.sub() || last.sub() != null) { return null; }
        return BottomUpParser.CLOSERS.contains(last.attribute())? last : null;
    }

    private Node reducePart(Node part, Expect expect) throws ErrorException {
        return this.reduceSpan(
            part, part.sub(), BottomUpParser.closerOf(part), expect
        );
    }

    // Reduces the siblings after anchor up to stop, which
    // is cut off for the duration, and returns the single resulting node.
    private Node reduceSpan(Node owner, Node anchor, Node stop, Expect expect)
            throws ErrorException {
        this.session.guard.enter(owner.source);
        if(stop != null) {
            Node.link(stop.previous(), null);
        }
        Span span = new Span(owner, anchor);
        try {
            this.reduceDeclarers(span, expect);
            this.markDeclarations(span, expect);
            this.reduceClauses(span);
            this.applyGroup(span, BottomUpParser.PRIMARIES, false);
            this.applyGroup(span, BottomUpParser.SECONDARIES, false);
            this.reduceMonadicFormulas(span);
            this.reduceDyadicFormulas(span);
            this.applyGroup(span, BottomUpParser.TERTIARIES, false);
            this.applyGroup(span, this.units, true);
            this.reduceDeclarations(span);
            return this.assemble(span, expect);
        } finally {
            if(stop != null) {
                Node last = span.isEmpty()? anchor : span.last();
                Node.link(last, stop);
            }
            this.session.guard.exit();
        }
    }

    // declarers

    private void reduceDeclarers(Span span, Expect expect)
            throws ErrorException {
        boolean changed = true;
        while(changed) {
            changed = false;
            for(Node node = span.first(); node != null; node = node.next()) {
                Node reduced = this.reduceDeclarerAt(span, node, expect);
                if(reduced != null) {
                    changed = true;
                    node = reduced;
                }
            }
        }
    }

    private Node reduceDeclarerAt(Span span, Node node, Expect expect)
            throws ErrorException {
        switch(node.attribute()) {
            case LONG_SYMBOL:
            case SHORT_SYMBOL:
            case INDICANT: {
                Node previous = span.previous(node);
                if(previous != null && previous.isOneOf(
                    Attribute.LONG_SYMBOL, Attribute.SHORT_SYMBOL
                )) {
                    return null;
                }
                Node last = node;
                while(last.isOneOf(
                    Attribute.LONG_SYMBOL, Attribute.SHORT_SYMBOL
                )) {
                    last = last.next();
                    if(last == null) { return null; }
                }
                if(!last.is(Attribute.INDICANT)) { return null; }
                return this.fold(node, last, Attribute.DECLARER);
            }
            case REF_SYMBOL:
            case FLEX_SYMBOL: {
                if(!Node.is(node.next(), Attribute.DECLARER)) { return null; }
                return this.fold(node, node.next(), Attribute.DECLARER);
            }
            case SUB_SYMBOL: {
                if(!TopDownParser.isPart(node)
                        || !Node.is(node.next(), Attribute.DECLARER)) {
                    return null;
                }
                this.reduceSpan(
                    node, node.sub(), BottomUpParser.closerOf(node),
                    Expect.BOUNDS
                );
                node.become(Attribute.BOUNDS);
                return this.fold(node, node.next(), Attribute.DECLARER);
            }
            case STRUCT_SYMBOL:
            case UNION_SYMBOL: {
                Node pack = node.next();
                if(!BottomUpParser.isPart(pack, Attribute.OPEN_SYMBOL)) {
                    return null;
                }
                this.reducePack(
                    pack, node.is(Attribute.STRUCT_SYMBOL)
                        ? Pack.FIELDS
                        : Pack.MEMBERS
                );
                return this.fold(node, pack, Attribute.DECLARER);
            }
            case PROC_SYMBOL: {
                Node next = node.next();
                if(BottomUpParser.isResult(next)) {
                    return this.fold(node, next, Attribute.DECLARER);
                }
                if(BottomUpParser.isPart(next, Attribute.OPEN_SYMBOL)
                        && BottomUpParser.isResult(next.next())) {
                    this.reducePack(next, Pack.FORMALS);
                    return this.fold(node, next.next(), Attribute.DECLARER);
                }
                return null;
            }
            case OPEN_SYMBOL: {
                if(!TopDownParser.isPart(node)) { return null; }
                Node next = node.next();
                Node previous = span.previous(node);
                if(Node.is(previous, Attribute.OP_SYMBOL)
                        && BottomUpParser.isResult(next)) {
                    // the plan of an operator declaration
                    this.reducePack(node, Pack.FORMALS);
                    return this.fold(node, next, Attribute.DECLARER);
                }
                if(BottomUpParser.isResult(next)
                        && Node.is(next.next(), Attribute.COLON_SYMBOL)
                        && !Node.is(previous, Attribute.PROC_SYMBOL)) {
                    this.reducePack(node, Pack.PARAMETERS);
                    return node;
                }
                boolean specifier = Node.is(next, Attribute.COLON_SYMBOL)
                    && expect != Expect.ARGUMENTS && expect != Expect.BOUNDS;
                if(specifier) {
                    this.reducePack(node, Pack.SPECIFIER);
                    return node;
                }
                return null;
            }
            default:
                return null;
        }
    }

    private void reducePack(Node part, Pack kind) throws ErrorException {
        Node closer = BottomUpParser.closerOf(part);
        Node.link(closer.previous(), null);
        Span span = new Span(part, part.sub());
        try {
            this.reduceDeclarers(span, Expect.UNIT);
            this.shapePack(span, kind);
        } finally {
            Node last = span.isEmpty()? part.sub() : span.last();
            Node.link(last, closer);
        }
        switch(kind) {
            case PARAMETERS: part.become(Attribute.PARAMETER_PACK); break;
            case SPECIFIER: part.become(Attribute.SPECIFIER); break;
            default: part.become(Attribute.PACK); break;
        }
    }

    private void shapePack(Span span, Pack kind) {
        Node node = span.first();
        if(node == null) {
            this.session.diagnostics.report(
                Severity.SYNTAX_ERROR, span.owner.source, "%s is empty",
                kind.description
            );
            return;
        }
        boolean sawDeclarer = false;
        while(node != null) {
            Node item = this.shapePackItem(node, kind, sawDeclarer);
            if(item == null) {
                this.session.diagnostics.report(
                    Severity.SYNTAX_ERROR, node.source,
                    "%s does not belong in %s", node.attribute().description,
                    kind.description
                );
                return;
            }
            sawDeclarer = true;
            Node after = item.next();
            if(after == null) { return; }
            if(!after.is(Attribute.COMMA_SYMBOL) || kind == Pack.SPECIFIER
                    || after.next() == null) {
                this.session.diagnostics.report(
                    Severity.SYNTAX_ERROR, after.source,
                    "%s does not belong in %s",
                    after.attribute().description, kind.description
                );
                return;
            }
            node = after.next();
        }
    }

    private Node shapePackItem(Node node, Pack kind, boolean sawDeclarer) {
        switch(kind) {
            case FIELDS:
            case PARAMETERS: {
                Attribute item = kind == Pack.FIELDS
                    ? Attribute.FIELD
                    : Attribute.PARAMETER;
                if(node.is(Attribute.DECLARER)
                        && Node.is(node.next(), Attribute.IDENTIFIER)) {
                    Node name = node.next();
                    if(kind == Pack.PARAMETERS) {
                        name.become(Attribute.DEFINING_IDENTIFIER);
                    }
                    return this.fold(node, name, item);
                }
                if(node.is(Attribute.IDENTIFIER) && sawDeclarer) {
                    if(kind == Pack.PARAMETERS) {
                        node.become(Attribute.DEFINING_IDENTIFIER);
                    }
                    return this.fold(node, node, item);
                }
                return null;
            }
            case MEMBERS:
                return BottomUpParser.isResult(node)? node : null;
            case FORMALS:
                return node.is(Attribute.DECLARER)? node : null;
            case SPECIFIER: {
                if(node.is(Attribute.VOID_SYMBOL)) { return node; }
                if(!node.is(Attribute.DECLARER)) { return null; }
                if(Node.is(node.next(), Attribute.IDENTIFIER)) {
                    node.next().become(Attribute.DEFINING_IDENTIFIER);
                    return node.next();
                }
                return node;
            }
            default:
                throw new IllegalArgumentException("unhandled pack kind!");
        }
    }

    // declaration marks

    private static boolean endsDeclaration(Node node) {
        return node == null || node.isOneOf(
            Attribute.SEMICOLON_SYMBOL, Attribute.EXIT_SYMBOL
        );
    }

    private void markDeclarations(Span span, Expect expect) {
        boolean labels = expect == Expect.SERIAL
            || expect == Expect.ENCLOSED || expect == Expect.BRIEF_IN;
        for(Node node = span.first(); node != null; node = node.next()) {
            Node previous = span.previous(node);
            boolean phraseStart = previous == null || previous.isOneOf(
                Attribute.SEMICOLON_SYMBOL, Attribute.EXIT_SYMBOL,
                Attribute.LABEL
            );
            if(labels && phraseStart && node.is(Attribute.IDENTIFIER)
                    && Node.is(node.next(), Attribute.COLON_SYMBOL)) {
                node.become(Attribute.DEFINING_IDENTIFIER);
                node = this.fold(node, node.next(), Attribute.LABEL);
                continue;
            }
            boolean declares = node.isOneOf(
                    Attribute.DECLARER, Attribute.PROC_SYMBOL
                )
                && Node.is(node.next(), Attribute.IDENTIFIER);
            if(node.is(Attribute.PROC_SYMBOL) && declares) {
                declares = node.next().next() != null
                    && node.next().next().isOneOf(
                        Attribute.EQUALS_SYMBOL, Attribute.BECOMES_SYMBOL
                    );
            }
            if(declares) {
                this.markDefining(node.next());
                this.markContinuations(node.next().next());
            }
        }
        for(Node node = span.first(); node != null; node = node.next()) {
            if(node.is(Attribute.EQUALS_SYMBOL)) {
                node.become(Attribute.OPERATOR);
            } else if(node.is(Attribute.ALT_EQUALS_SYMBOL)) {
                node.become(Attribute.EQUALS_SYMBOL);
            }
        }
    }

    private void markDefining(Node name) {
        name.become(Attribute.DEFINING_IDENTIFIER);
        if(Node.is(name.next(), Attribute.EQUALS_SYMBOL)) {
            name.next().become(Attribute.ALT_EQUALS_SYMBOL);
        }
    }

    private void markContinuations(Node from) {
        for(Node node = from; !BottomUpParser.endsDeclaration(node);
                node = node.next()) {
            if(!node.is(Attribute.COMMA_SYMBOL)) { continue; }
            Node name = node.next();
            if(!Node.is(name, Attribute.IDENTIFIER)) { return; }
            Node after = name.next();
            boolean continues = BottomUpParser.endsDeclaration(after)
                || after.isOneOf(
                    Attribute.EQUALS_SYMBOL, Attribute.BECOMES_SYMBOL,
                    Attribute.COMMA_SYMBOL
                );
            if(!continues) { return; }
            this.markDefining(name);
        }
    }

    // nested clauses

    private static boolean isPrimaryLead(Node node) {
        if(node == null) { return false; }
        return node.isOneOf(
                Attribute.IDENTIFIER, Attribute.GENERIC_ARGUMENT,
                Attribute.FORMAT_TEXT, Attribute.ROW_CHAR_DENOTATION
            )
            || node.attribute().isEnclosedClause();
    }

    private static boolean followedByThenBar(Node part) {
        return BottomUpParser.isPart(
            part.next(), Attribute.THEN_BAR_SYMBOL
        );
    }

    private void reduceClauses(Span span) throws ErrorException {
        for(Node node = span.first(); node != null; node = node.next()) {
            if(node.is(Attribute.FORMAT_TEXT)) {
                this.reduceFormat(node);
                continue;
            }
            if(!TopDownParser.isPart(node)) { continue; }
            boolean argument = node.isOneOf(
                    Attribute.OPEN_SYMBOL, Attribute.SUB_SYMBOL
                )
                && BottomUpParser.isPrimaryLead(span.previous(node))
                && !BottomUpParser.followedByThenBar(node);
            if(argument) {
                this.reducePart(node, Expect.ARGUMENTS);
                node.become(Attribute.GENERIC_ARGUMENT);
                continue;
            }
            node = this.assembleClause(node);
        }
    }

    private void reduceFormat(Node format) throws ErrorException {
        for(Node child = format.sub(); child != null; child = child.next()) {
            if(BottomUpParser.isPart(child, Attribute.OPEN_SYMBOL)) {
                child = this.assembleClause(child);
            }
        }
    }

    private Node assembleClause(Node part) throws ErrorException {
        switch(part.attribute()) {
            case BEGIN_SYMBOL:
                return this.closedOrCollateral(part);
            case SUB_SYMBOL:
                if(!this.session.options().brackets()) {
                    this.session.diagnostics.report(
                        Severity.SYNTAX_ERROR, part.source,
                        "'[' opens a clause only with the brackets option"
                    );
                }
                if(BottomUpParser.followedByThenBar(part)) {
                    return this.briefChoice(part);
                }
                return this.closedOrCollateral(part);
            case OPEN_SYMBOL:
            case ACCO_SYMBOL:
                if(BottomUpParser.followedByThenBar(part)) {
                    return this.briefChoice(part);
                }
                return this.closedOrCollateral(part);
            case IF_SYMBOL:
                return this.conditional(part);
            case CASE_SYMBOL:
                return this.caseClause(part);
            case CODE_SYMBOL:
                if(this.session.options().portability()) {
                    this.session.diagnostics.report(
                        Severity.WARNING, part.source,
                        "code clauses are not portable"
                    );
                }
                part.become(Attribute.CODE_CLAUSE);
                return part;
            default:
                if(BottomUpParser.LOOP_PARTS.contains(part.attribute())) {
                    return this.loop(part);
                }
                throw new IllegalStateException(
                    "part " + part.attribute() + " cannot start a clause!"
                );
        }
    }

    private Node closedOrCollateral(Node part) throws ErrorException {
        Node content = this.reducePart(part, Expect.ENCLOSED);
        if(content == null || content.is(Attribute.UNIT_LIST)) {
            part.become(Attribute.COLLATERAL_CLAUSE);
        } else {
            part.become(Attribute.CLOSED_CLAUSE);
        }
        Node previous = part.previous();
        if(Node.is(previous, Attribute.PAR_SYMBOL)) {
            return this.fold(previous, part, Attribute.PARALLEL_CLAUSE);
        }
        return part;
    }

    private static List<Node> collectParts(Node first, Attribute closer) {
        List<Node> parts = new ArrayList<>();
        Node part = first;
        while(true) {
            parts.add(part);
            Node last = part.sub().last();
            if(last != part.sub() && last.is(closer) && last.sub() == null) {
                return parts;
            }
            part = part.next();
            if(!TopDownParser.isPart(part)) {
                throw new IllegalStateException(
                    "construct ended without its " + closer + "!"
                );
            }
        }
    }

    private Node conditional(Node first) throws ErrorException {
        List<Node> parts = BottomUpParser.collectParts(
            first, Attribute.FI_SYMBOL
        );
        List<Node> starts = new ArrayList<>();
        for(Node part: parts) {
            switch(part.attribute()) {
                case IF_SYMBOL:
                case ELIF_SYMBOL:
                    starts.add(part);
                    this.reducePart(part, Expect.SERIAL);
                    part.become(part.is(Attribute.IF_SYMBOL)
                        ? Attribute.IF_PART
                        : Attribute.ELIF_PART);
                    break;
                case THEN_SYMBOL:
                    this.reducePart(part, Expect.SERIAL);
                    part.become(Attribute.THEN_PART);
                    break;
                default:
                    this.reducePart(part, Expect.SERIAL);
                    part.become(Attribute.ELSE_PART);
                    break;
            }
        }
        return this.foldChain(starts, parts, null);
    }

    // Folds a chain of choice parts from the innermost ELIF or OUSE
    // outwards, each level into its own clause.
    private Node foldChain(
        List<Node> starts, List<Node> parts, List<Attribute> kinds
    ) {
        Node last = parts.get(parts.size() - 1);
        for(int idx = starts.size() - 1; idx >= 0; idx -= 1) {
            Attribute kind = kinds == null
                ? Attribute.CONDITIONAL_CLAUSE
                : kinds.get(idx);
            last = this.fold(starts.get(idx), last, kind);
        }
        return last;
    }

    private Node caseClause(Node first) throws ErrorException {
        List<Node> parts = BottomUpParser.collectParts(
            first, Attribute.ESAC_SYMBOL
        );
        List<Node> starts = new ArrayList<>();
        List<Attribute> kinds = new ArrayList<>();
        for(Node part: parts) {
            switch(part.attribute()) {
                case CASE_SYMBOL:
                case OUSE_SYMBOL:
                    starts.add(part);
                    this.reducePart(part, Expect.SERIAL);
                    part.become(part.is(Attribute.CASE_SYMBOL)
                        ? Attribute.CASE_PART
                        : Attribute.OUSE_PART);
                    break;
                case IN_SYMBOL: {
                    Node alternatives = this.reducePart(
                        part, Expect.CHOICE_IN
                    );
                    part.become(Attribute.IN_PART);
                    kinds.add(
                        Node.is(alternatives, Attribute.SPECIFIED_UNIT_LIST)
                            ? Attribute.CONFORMITY_CLAUSE
                            : Attribute.CASE_CLAUSE
                    );
                    break;
                }
                default:
                    this.reducePart(part, Expect.SERIAL);
                    part.become(Attribute.OUT_PART);
                    break;
            }
        }
        return this.foldChain(starts, parts, kinds);
    }

    private static Attribute briefCloser(Node opener) {
        switch(opener.attribute()) {
            case OPEN_SYMBOL: return Attribute.CLOSE_SYMBOL;
            case ACCO_SYMBOL: return Attribute.OCCA_SYMBOL;
            default: return Attribute.BUS_SYMBOL;
        }
    }

    private Node briefChoice(Node first) throws ErrorException {
        List<Node> parts = BottomUpParser.collectParts(
            first, BottomUpParser.briefCloser(first)
        );
        List<Node> starts = new ArrayList<>();
        List<Attribute> kinds = new ArrayList<>();
        int idx = 0;
        while(idx < parts.size()) {
            Node part = parts.get(idx);
            starts.add(part);
            Node bar = parts.get(idx + 1);
            Node content = this.reducePart(bar, Expect.BRIEF_IN);
            Attribute kind = Attribute.CONDITIONAL_CLAUSE;
            if(Node.is(content, Attribute.UNIT_LIST)) {
                kind = Attribute.CASE_CLAUSE;
            } else if(Node.is(content, Attribute.SPECIFIED_UNIT_LIST)) {
                kind = Attribute.CONFORMITY_CLAUSE;
            }
            kinds.add(kind);
            boolean conditional = kind == Attribute.CONDITIONAL_CLAUSE;
            boolean elif = part.is(Attribute.BRIEF_ELIF_SYMBOL);
            this.reducePart(part, Expect.SERIAL);
            if(conditional) {
                part.become(elif? Attribute.ELIF_PART : Attribute.IF_PART);
                bar.become(Attribute.THEN_PART);
            } else {
                part.become(elif? Attribute.OUSE_PART : Attribute.CASE_PART);
                bar.become(Attribute.IN_PART);
            }
            boolean hasElse = idx + 2 < parts.size()
                && parts.get(idx + 2).is(Attribute.ELSE_BAR_SYMBOL);
            if(hasElse) {
                Node otherwise = parts.get(idx + 2);
                this.reducePart(otherwise, Expect.SERIAL);
                otherwise.become(
                    conditional? Attribute.ELSE_PART : Attribute.OUT_PART
                );
            }
            // the bar and else parts are renamed above, so step over them
            idx += hasElse? 3 : 2;
        }
        return this.foldChain(starts, parts, kinds);
    }

    private Node loop(Node first) throws ErrorException {
        List<Node> parts = BottomUpParser.collectParts(
            first, Attribute.OD_SYMBOL
        );
        for(Node part: parts) {
            switch(part.attribute()) {
                case FOR_SYMBOL: {
                    Node name = part.sub().next();
                    if(!Node.is(name, Attribute.IDENTIFIER)
                            || name.next() != null) {
                        this.session.diagnostics.report(
                            Severity.SYNTAX_ERROR, part.source,
                            "FOR must be followed by one identifier"
                        );
                    } else {
                        name.become(Attribute.DEFINING_IDENTIFIER);
                    }
                    part.become(Attribute.FOR_PART);
                    break;
                }
                case FROM_SYMBOL:
                    this.reducePart(part, Expect.UNIT);
                    part.become(Attribute.FROM_PART);
                    break;
                case BY_SYMBOL:
                    this.reducePart(part, Expect.UNIT);
                    part.become(Attribute.BY_PART);
                    break;
                case TO_SYMBOL:
                case DOWNTO_SYMBOL:
                    this.reducePart(part, Expect.UNIT);
                    part.become(Attribute.TO_PART);
                    break;
                case WHILE_SYMBOL:
                    this.reducePart(part, Expect.SERIAL);
                    part.become(Attribute.WHILE_PART);
                    break;
                default:
                    this.reduceDoPart(part);
                    break;
            }
        }
        return this.fold(
            parts.get(0), parts.get(parts.size() - 1), Attribute.LOOP_CLAUSE
        );
    }

    private void reduceDoPart(Node part) throws ErrorException {
        Node closer = BottomUpParser.closerOf(part);
        Node until = closer.previous();
        if(BottomUpParser.isPart(until, Attribute.UNTIL_SYMBOL)) {
            this.reducePart(until, Expect.SERIAL);
            until.become(Attribute.UNTIL_PART);
            this.reduceSpan(part, part.sub(), until, Expect.SERIAL);
        } else {
            this.reduceSpan(part, part.sub(), closer, Expect.SERIAL);
        }
        part.become(Attribute.DO_PART);
    }

    // units

    private void applyGroup(Span span, List<Rule> rules, boolean rightToLeft) {
        boolean changed = true;
        while(changed) {
            changed = false;
            Node node = rightToLeft? span.last() : span.first();
            while(node != null && node != span.anchor) {
                Node folded = this.applyAt(node, rules);
                if(folded != null) {
                    changed = true;
                    node = folded;
                    continue;
                }
                node = rightToLeft? node.previous() : node.next();
            }
        }
    }

    private Node applyAt(Node node, List<Rule> rules) {
        for(Rule rule: rules) {
            Node last = rule.match(node);
            if(last == null) { continue; }
            Node folded = this.fold(node, last, rule.result);
            rule.performAction(folded);
            return folded;
        }
        return null;
    }

    private void reduceMonadicFormulas(Span span) {
        Node node = span.last();
        while(node != null && node != span.anchor) {
            Node operand = node.next();
            boolean monadic = node.is(Attribute.OPERATOR)
                && operand != null
                && operand.isOneOf(
                    Attribute.SECONDARY, Attribute.MONADIC_FORMULA
                )
                && !BottomUpParser.isOperand(span.previous(node));
            if(monadic) {
                node = this.fold(node, node.next(), Attribute.MONADIC_FORMULA);
            }
            node = node.previous();
        }
    }

    private void reduceDyadicFormulas(Span span) {
        for(int priority = 9; priority >= 1; priority -= 1) {
            Node node = span.first();
            while(node != null) {
                Node operator = node.next();
                boolean dyadic = BottomUpParser.isOperand(node)
                    && Node.is(operator, Attribute.OPERATOR)
                    && BottomUpParser.isOperand(operator.next())
                    && this.priorityOf(operator) == priority;
                if(dyadic) {
                    node = this.fold(
                        node, operator.next(), Attribute.FORMULA
                    );
                    continue;
                }
                node = node.next();
            }
        }
    }

    private int priorityOf(Node operator) {
        Tag priority = this.session.symbols.lookUp(
            operator.table, Tag.Kind.PRIORITY, operator.symbol
        );
        if(priority == null) {
            this.session.diagnostics.report(
                Severity.ERROR, operator.source,
                "no priority is declared for dyadic operator '%s'",
                operator.symbol
            );
            return 1;
        }
        return priority.priority;
    }

    // declarations

    private void reduceDeclarations(Span span) {
        for(Node node = span.first(); node != null; node = node.next()) {
            Node declaration = this.reduceDeclarationAt(node);
            if(declaration != null) { node = declaration; }
        }
        for(Node node = span.first(); node != null; node = node.next()) {
            if(!node.attribute().isDeclaration()) { continue; }
            Node last = node;
            while(Node.is(last.next(), Attribute.COMMA_SYMBOL)
                    && last.next().next() != null
                    && last.next().next().attribute().isDeclaration()) {
                last = last.next().next();
            }
            if(last != node) {
                node = this.fold(node, last, Attribute.DECLARATION_LIST);
            }
        }
    }

    private Node reduceDeclarationAt(Node node) {
        switch(node.attribute()) {
            case MODE_SYMBOL:
                return this.declaration(
                    node, node.next(), Attribute.DEFINING_INDICANT,
                    Attribute.DECLARER, false, Attribute.MODE_DECLARATION
                );
            case PRIO_SYMBOL:
                return this.declaration(
                    node, node.next(), Attribute.DEFINING_OPERATOR,
                    Attribute.PRIORITY, false, Attribute.PRIORITY_DECLARATION
                );
            case OP_SYMBOL: {
                Node name = node.next();
                if(Node.is(name, Attribute.DECLARER)) { name = name.next(); }
                return this.declaration(
                    node, name, Attribute.DEFINING_OPERATOR, Attribute.UNIT,
                    false, Attribute.OPERATOR_DECLARATION
                );
            }
            case PROC_SYMBOL:
                return this.procedureDeclaration(node, node);
            case LOC_SYMBOL:
            case HEAP_SYMBOL: {
                Node next = node.next();
                if(Node.is(next, Attribute.PROC_SYMBOL)) {
                    return this.procedureDeclaration(node, next);
                }
                if(Node.is(next, Attribute.DECLARER) && Node.is(
                    next.next(), Attribute.DEFINING_IDENTIFIER
                )) {
                    return this.declaration(
                        node, next.next(), Attribute.DEFINING_IDENTIFIER,
                        Attribute.UNIT, true, Attribute.VARIABLE_DECLARATION
                    );
                }
                return null;
            }
            case DECLARER: {
                Node name = node.next();
                if(!Node.is(name, Attribute.DEFINING_IDENTIFIER)) {
                    return null;
                }
                boolean identity = Node.is(
                    name.next(), Attribute.EQUALS_SYMBOL
                );
                return this.declaration(
                    node, name, Attribute.DEFINING_IDENTIFIER, Attribute.UNIT,
                    !identity,
                    identity
                        ? Attribute.IDENTITY_DECLARATION
                        : Attribute.VARIABLE_DECLARATION
                );
            }
            default:
                return null;
        }
    }

    private Node procedureDeclaration(Node start, Node proc) {
        Node name = proc.next();
        if(!Node.is(name, Attribute.DEFINING_IDENTIFIER)) { return null; }
        boolean variable = Node.is(name.next(), Attribute.BECOMES_SYMBOL);
        if(!variable && start != proc) {
            this.session.diagnostics.report(
                Severity.SYNTAX_ERROR, start.source,
                "a procedure identity declaration takes no LOC or HEAP"
            );
            return null;
        }
        return this.declaration(
            start, name, Attribute.DEFINING_IDENTIFIER, Attribute.UNIT,
            variable,
            variable
                ? Attribute.PROCEDURE_VARIABLE_DECLARATION
                : Attribute.PROCEDURE_DECLARATION
        );
    }

    // Folds start up to the last of a comma separated list of
    // name = value (or name := value and a bare
    // name for variables) into one declaration.
    private Node declaration(
        Node start, Node name, Attribute nameAttribute, Attribute value,
        boolean variable, Attribute result
    ) {
        Node last = null;
        Node current = name;
        while(true) {
            if(!Node.is(current, nameAttribute)) {
                this.session.diagnostics.report(
                    Severity.SYNTAX_ERROR,
                    current == null? start.source : current.source,
                    "%s expected in %s", nameAttribute.description,
                    result.description
                );
                return null;
            }
            Node sign = current.next();
            Attribute expectedSign = variable
                ? Attribute.BECOMES_SYMBOL
                : Attribute.EQUALS_SYMBOL;
            if(Node.is(sign, expectedSign)) {
                Node source = sign.next();
                if(!Node.is(source, value)) {
                    this.session.diagnostics.report(
                        Severity.SYNTAX_ERROR,
                        source == null? sign.source : source.source,
                        "%s expected after %s in %s", value.description,
                        expectedSign.description, result.description
                    );
                    return null;
                }
                last = source;
            } else if(variable) {
                last = current;
            } else {
                this.session.diagnostics.report(
                    Severity.SYNTAX_ERROR, current.source,
                    "'=' expected after %s in %s",
                    current.attribute().description, result.description
                );
                return null;
            }
            Node comma = last.next();
            if(Node.is(comma, Attribute.COMMA_SYMBOL)
                    && Node.is(comma.next(), nameAttribute)) {
                current = comma.next();
                continue;
            }
            return this.fold(start, last, result);
        }
    }

    // clause assembly

    private static boolean isPhrase(Node node) {
        return node.isOneOf(
                Attribute.UNIT, Attribute.LABELED_UNIT,
                Attribute.DECLARATION_LIST
            )
            || node.attribute().isDeclaration();
    }

    private ErrorException tooManyErrors(Node at) {
        return this.session.diagnostics.abort(
            Severity.SYNTAX_ERROR, at.source,
            "too many errors, giving up on this program"
        );
    }

    // Records one diagnostic for a span that does not reduce and replaces
    // its content by an error node.
    private Node recover(Span span, Node at, Expect expect)
            throws ErrorException {
        StringBuilder found = new StringBuilder();
        int shown = 0;
        Node node = at;
        while(node != null && shown < 3) {
            if(shown > 0) { found.append(", "); }
            found.append(node.attribute().description);
            shown += 1;
            node = node.next();
        }
        if(node != null) {
            found.append(", ...");
        }
        this.session.diagnostics.report(
            Severity.SYNTAX_ERROR, at.source,
            "invalid sequence in %s: %s", expect.description, found
        );
        if(this.session.diagnostics.exceeded()) {
            throw this.tooManyErrors(at);
        }
        return this.fold(span.first(), span.last(), Attribute.ERROR);
    }

    private void removeSuperfluousSemicolons(Span span) {
        Node node = span.first();
        while(node != null) {
            Node next = node.next();
            boolean superfluous = node.is(Attribute.SEMICOLON_SYMBOL) && (
                span.previous(node) == null || next == null
                    || next.is(Attribute.SEMICOLON_SYMBOL)
            );
            if(superfluous) {
                this.session.diagnostics.report(
                    Severity.WARNING, node.source, "superfluous semicolon"
                );
                node.remove();
            }
            node = next;
        }
    }

    private void reduceLabeledUnits(Span span) {
        Node node = span.last();
        while(node != null && node != span.anchor) {
            if(node.is(Attribute.LABEL) && node.next() != null
                    && node.next().isOneOf(
                        Attribute.UNIT, Attribute.LABELED_UNIT
                    )) {
                node = this.fold(node, node.next(), Attribute.LABELED_UNIT);
            }
            node = node.previous();
        }
    }

    private Node assemble(Span span, Expect expect) throws ErrorException {
        switch(expect) {
            case SERIAL:
            case ENCLOSED:
            case BRIEF_IN:
                this.removeSuperfluousSemicolons(span);
                this.reduceLabeledUnits(span);
                break;
            default:
                break;
        }
        Node first = span.first();
        if(first == null) {
            switch(expect) {
                case ENCLOSED:
                    return null;
                case BOUNDS: {
                    Node anchor = span.anchor;
                    Node bound = new Node(Attribute.BOUND, "", anchor.source);
                    bound.table = anchor.table;
                    anchor.insertAfter(bound);
                    return null;
                }
                default:
                    this.session.diagnostics.report(
                        Severity.SYNTAX_ERROR, span.owner.source,
                        "%s is empty", expect.description
                    );
                    if(this.session.diagnostics.exceeded()) {
                        throw this.tooManyErrors(span.owner);
                    }
                    return null;
            }
        }
        switch(expect) {
            case UNIT:
                if(first.is(Attribute.UNIT) && first.next() == null) {
                    return first;
                }
                return this.recover(span, first, expect);
            case ARGUMENTS:
                return this.assembleArguments(span);
            case BOUNDS:
                return this.assembleBounds(span);
            case CHOICE_IN:
                return this.assembleAlternatives(span, expect, false);
            case BRIEF_IN:
                if(BottomUpParser.hasTopLevel(span, Attribute.COMMA_SYMBOL)
                        || first.is(Attribute.SPECIFIED_UNIT)) {
                    return this.assembleAlternatives(span, expect, true);
                }
                return this.assembleSerial(span, expect);
            case ENCLOSED:
                if(BottomUpParser.hasTopLevel(span, Attribute.COMMA_SYMBOL)
                        && !BottomUpParser.hasTopLevel(
                            span, Attribute.SEMICOLON_SYMBOL
                        )) {
                    return this.assembleAlternatives(span, expect, true);
                }
                return this.assembleSerial(span, expect);
            default:
                return this.assembleSerial(span, expect);
        }
    }

    private static boolean hasTopLevel(Span span, Attribute attribute) {
        for(Node node = span.first(); node != null; node = node.next()) {
            if(node.is(attribute)) { return true; }
        }
        return false;
    }

    private Node assembleSerial(Span span, Expect expect)
            throws ErrorException {
        boolean labelled = false;
        Node node = span.first();
        while(true) {
            if(!BottomUpParser.isPhrase(node)) {
                return this.recover(span, node, expect);
            }
            boolean declaration = node.is(Attribute.DECLARATION_LIST)
                || node.attribute().isDeclaration();
            if(declaration && labelled) {
                this.session.diagnostics.report(
                    Severity.SYNTAX_ERROR, node.source,
                    "labels cannot precede declarations"
                );
            }
            if(node.is(Attribute.LABELED_UNIT)) { labelled = true; }
            Node separator = node.next();
            if(separator == null) {
                if(declaration) {
                    this.session.diagnostics.report(
                        Severity.SYNTAX_ERROR, node.source,
                        "%s cannot end a serial clause",
                        node.attribute().description
                    );
                }
                break;
            }
            if(separator.is(Attribute.EXIT_SYMBOL)) {
                Node after = separator.next();
                if(!Node.is(after, Attribute.LABELED_UNIT)) {
                    this.session.diagnostics.report(
                        Severity.SYNTAX_ERROR, separator.source,
                        "EXIT must be followed by a labelled unit"
                    );
                }
            } else if(!separator.is(Attribute.SEMICOLON_SYMBOL)) {
                return this.recover(span, separator, expect);
            }
            node = separator.next();
            if(node == null) {
                return this.recover(span, separator, expect);
            }
        }
        return this.fold(span.first(), span.last(), Attribute.SERIAL_CLAUSE);
    }

    private Node assembleAlternatives(
        Span span, Expect expect, boolean needsList
    ) throws ErrorException {
        Node first = span.first();
        boolean specified = first.is(Attribute.SPECIFIED_UNIT);
        Attribute item = specified? Attribute.SPECIFIED_UNIT : Attribute.UNIT;
        int count = 0;
        Node node = first;
        while(true) {
            if(!node.is(item)) {
                return this.recover(span, node, expect);
            }
            count += 1;
            Node separator = node.next();
            if(separator == null) { break; }
            if(!separator.is(Attribute.COMMA_SYMBOL)
                    || separator.next() == null) {
                return this.recover(span, separator, expect);
            }
            node = separator.next();
        }
        if(needsList && count < 2 && !specified) {
            return this.assembleSerial(span, expect);
        }
        return this.fold(
            first, span.last(),
            specified? Attribute.SPECIFIED_UNIT_LIST : Attribute.UNIT_LIST
        );
    }

    // Splits the span at top-level commas and hands each item, possibly
    // empty, to the shaper.
    private List<Node[]> items(Span span) {
        List<Node[]> items = new ArrayList<>();
        Node start = span.first();
        Node node = start;
        Node previous = null;
        while(true) {
            if(node == null || node.is(Attribute.COMMA_SYMBOL)) {
                items.add(start == node
                    ? new Node[] { null, null, node }
                    : new Node[] { start, previous, node });
                if(node == null) { return items; }
                start = node.next();
                previous = node;
                node = node.next();
                continue;
            }
            previous = node;
            node = node.next();
        }
    }

    private Node assembleArguments(Span span) throws ErrorException {
        for(Node[] item: this.items(span)) {
            Node first = item[0];
            Node last = item[1];
            if(first == null) {
                Node at = item[2] != null? item[2] : span.last();
                return this.recover(span, at, Expect.ARGUMENTS);
            }
            if(first == last && first.is(Attribute.UNIT)) { continue; }
            if(!this.isTrimmer(first, last)) {
                return this.recover(span, first, Expect.ARGUMENTS);
            }
            this.fold(first, last, Attribute.TRIMMER);
        }
        return null;
    }

    // Whether the item has the shape [u] : [u] [@ u] or
    // @ u.
    private boolean isTrimmer(Node first, Node last) {
        Node node = first;
        boolean colon = false;
        if(node.is(Attribute.UNIT)) {
            if(node == last) { return false; }
            node = node.next();
        }
        if(node.is(Attribute.COLON_SYMBOL)) {
            colon = true;
            if(node == last) { return true; }
            node = node.next();
            if(node.is(Attribute.UNIT)) {
                if(node == last) { return true; }
                node = node.next();
            }
        }
        if(!node.is(Attribute.AT_SYMBOL) || node == last) { return false; }
        if(!colon && first != node) { return false; }
        node = node.next();
        return node.is(Attribute.UNIT) && node == last;
    }

    private Node assembleBounds(Span span) throws ErrorException {
        for(Node[] item: this.items(span)) {
            Node first = item[0];
            Node last = item[1];
            if(first == null) {
                Node before = item[2] == null
                    ? span.last()
                    : item[2].previous();
                if(before == null) { before = span.anchor; }
                Node bound = new Node(Attribute.BOUND, "", before.source);
                bound.table = before.table;
                before.insertAfter(bound);
                continue;
            }
            boolean upper = first == last && first.is(Attribute.UNIT);
            boolean both = first.is(Attribute.UNIT)
                && Node.is(first.next(), Attribute.COLON_SYMBOL)
                && Node.is(first.next().next(), Attribute.UNIT)
                && first.next().next() == last;
            boolean formal = first == last
                && first.is(Attribute.COLON_SYMBOL);
            if(!upper && !both && !formal) {
                return this.recover(span, first, Expect.BOUNDS);
            }
            this.fold(first, last, Attribute.BOUND);
        }
        return null;
    }

}
