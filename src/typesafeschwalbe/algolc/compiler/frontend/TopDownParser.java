package typesafeschwalbe.algolc.compiler.frontend;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.symbols.Symbols;

// Folds every bracketed construct of the token list into part nodes and
// gives each range its own symbol table. A part node carries the attribute
// of its delimiter, which is also its first child; the closer of a
// construct is the last child of its last part.
public class TopDownParser {

    private static final Logger LOGGER
        = Logger.getLogger(TopDownParser.class.getName());

    private static final Set<Attribute> TERMINATORS = EnumSet.of(
        Attribute.END_SYMBOL, Attribute.CLOSE_SYMBOL, Attribute.BUS_SYMBOL,
        Attribute.OCCA_SYMBOL, Attribute.FI_SYMBOL, Attribute.ESAC_SYMBOL,
        Attribute.OD_SYMBOL, Attribute.EDOC_SYMBOL, Attribute.THEN_SYMBOL,
        Attribute.ELSE_SYMBOL, Attribute.ELIF_SYMBOL, Attribute.IN_SYMBOL,
        Attribute.OUT_SYMBOL, Attribute.OUSE_SYMBOL, Attribute.UNTIL_SYMBOL,
        Attribute.BAR_SYMBOL, Attribute.BRIEF_ELIF_SYMBOL
    );

    private static final Set<Attribute> LOOP_OPENERS = EnumSet.of(
        Attribute.FOR_SYMBOL, Attribute.FROM_SYMBOL, Attribute.BY_SYMBOL,
        Attribute.TO_SYMBOL, Attribute.DOWNTO_SYMBOL, Attribute.WHILE_SYMBOL,
        Attribute.DO_SYMBOL
    );

    private final CompilationSession session;
    private final Symbols symbols;

    public TopDownParser(CompilationSession session) {
        this.session = session;
        this.symbols = session.symbols;
    }

    public static boolean isPart(Node node) {
        return node != null && node.sub() != null
            && node.sub().attribute() == node.attribute();
    }

    public static int tableOf(Node part) {
        return part.sub().table;
    }

    public void parse(Node program) throws ErrorException {
        int table = this.symbols.newTable(this.session.standardTable);
        this.session.programTable = table;
        program.table = table;
        if(program.sub() == null) {
            throw this.session.diagnostics.abort(
                Severity.SYNTAX_ERROR, program.source, "program is empty"
            );
        }
        Node stop = this.scanUntil(
            program.sub(), EnumSet.noneOf(Attribute.class), table
        );
        if(stop != null) {
            throw this.unexpected(stop, "the end of the program");
        }
        LOGGER.fine(
            "allocated " + this.symbols.tableCount() + " ranges"
        );
    }

    private ErrorException unexpected(Node found, String expected) {
        return this.session.diagnostics.abort(
            Severity.SYNTAX_ERROR, found.source,
            "%s expected, but found %s", expected, found.attribute().description
        );
    }

    private ErrorException missing(Node opener, String expected) {
        return this.session.diagnostics.abort(
            Severity.SYNTAX_ERROR, opener.source,
            "%s expected to finish the construct started by %s",
            expected, opener.attribute().description
        );
    }

    private static String describe(Set<Attribute> expected) {
        StringBuilder described = new StringBuilder();
        int idx = 0;
        for(Attribute attribute: expected) {
            if(idx > 0) {
                described.append(idx < expected.size() - 1? ", " : " or ");
            }
            described.append(attribute.description);
            idx += 1;
        }
        return described.toString();
    }

    // Walks the siblings starting at from, folding nested
    // constructs, until a token of stops or any other terminator
    // shows up. Returns that token, or null at the end of the list.
    private Node scanUntil(Node from, Set<Attribute> stops, int table)
            throws ErrorException {
        Node current = from;
        while(current != null) {
            if(stops.contains(current.attribute())) { return current; }
            if(TopDownParser.TERMINATORS.contains(current.attribute())) {
                return current;
            }
            if(this.isOpener(current)) {
                current = this.construct(current, table);
            }
            current.table = table;
            current = current.next();
        }
        return null;
    }

    private boolean isOpener(Node token) {
        if(TopDownParser.isPart(token)) { return false; }
        switch(token.attribute()) {
            case BEGIN_SYMBOL: case OPEN_SYMBOL: case SUB_SYMBOL:
            case ACCO_SYMBOL: case IF_SYMBOL: case CASE_SYMBOL:
            case FORMAT_DELIMITER_SYMBOL: case CODE_SYMBOL:
                return true;
            default:
                return TopDownParser.LOOP_OPENERS.contains(token.attribute());
        }
    }

    // Folds the construct opened by opener and returns its last
    // part node.
    private Node construct(Node opener, int outer) throws ErrorException {
        this.session.guard.enter(opener.source);
        try {
            switch(opener.attribute()) {
                case BEGIN_SYMBOL:
                    return this.closed(opener, Attribute.END_SYMBOL, outer);
                case OPEN_SYMBOL:
                    return this.brief(opener, Attribute.CLOSE_SYMBOL, outer);
                case ACCO_SYMBOL:
                    return this.brief(opener, Attribute.OCCA_SYMBOL, outer);
                case SUB_SYMBOL:
                    if(this.session.options().brackets()) {
                        return this.brief(opener, Attribute.BUS_SYMBOL, outer);
                    }
                    return this.closed(opener, Attribute.BUS_SYMBOL, outer);
                case CODE_SYMBOL:
                    return this.closed(opener, Attribute.EDOC_SYMBOL, outer);
                case IF_SYMBOL:
                case CASE_SYMBOL:
                    return this.choice(opener, outer);
                case FORMAT_DELIMITER_SYMBOL:
                    return this.format(opener, outer);
                default:
                    return this.loop(opener, outer);
            }
        } finally {
            this.session.guard.exit();
        }
    }

    private Node foldPart(Node first, Node last, int table, int outer) {
        Node part = Node.fold(first, last, first.attribute());
        for(Node child = part.sub(); child != null; child = child.next()) {
            child.table = table;
        }
        part.table = outer;
        return part;
    }

    private Node closed(Node opener, Attribute closer, int outer)
            throws ErrorException {
        int table = this.symbols.newTable(outer);
        Node stop = this.scanUntil(opener.next(), EnumSet.of(closer), table);
        if(stop == null) {
            throw this.missing(opener, closer.description);
        }
        if(!stop.is(closer)) {
            throw this.unexpected(stop, closer.description);
        }
        return this.foldPart(opener, stop, table, outer);
    }

    private Node brief(Node opener, Attribute closer, int outer)
            throws ErrorException {
        Set<Attribute> stops = EnumSet.of(
            closer, Attribute.BAR_SYMBOL, Attribute.BRIEF_ELIF_SYMBOL
        );
        int range = this.symbols.newTable(outer);
        int table = range;
        Node partStart = opener;
        boolean hadThen = false;
        boolean hadElse = false;
        while(true) {
            Node stop = this.scanUntil(partStart.next(), stops, table);
            if(stop == null) {
                throw this.missing(opener, closer.description);
            }
            if(stop.is(closer)) {
                return this.foldPart(partStart, stop, table, outer);
            }
            if(!stops.contains(stop.attribute())) {
                throw this.unexpected(stop, TopDownParser.describe(stops));
            }
            if(stop.previous() == partStart) {
                throw this.session.diagnostics.abort(
                    Severity.SYNTAX_ERROR, stop.source,
                    "%s is not preceded by a clause",
                    stop.attribute().description
                );
            }
            this.foldPart(partStart, stop.previous(), table, outer);
            if(stop.is(Attribute.BRIEF_ELIF_SYMBOL)) {
                if(!hadThen || hadElse) {
                    throw this.unexpected(stop, closer.description);
                }
                range = this.symbols.newTable(range);
                table = range;
                hadThen = false;
            } else if(!hadThen) {
                stop.become(Attribute.THEN_BAR_SYMBOL);
                table = this.symbols.newTable(range);
                hadThen = true;
            } else if(!hadElse) {
                stop.become(Attribute.ELSE_BAR_SYMBOL);
                table = this.symbols.newTable(range);
                hadElse = true;
            } else {
                throw this.unexpected(stop, closer.description);
            }
            partStart = stop;
        }
    }

    private static Set<Attribute> choiceStops(Attribute part) {
        switch(part) {
            case IF_SYMBOL: case ELIF_SYMBOL:
                return EnumSet.of(Attribute.THEN_SYMBOL);
            case THEN_SYMBOL:
                return EnumSet.of(
                    Attribute.ELSE_SYMBOL, Attribute.ELIF_SYMBOL,
                    Attribute.FI_SYMBOL
                );
            case ELSE_SYMBOL:
                return EnumSet.of(Attribute.FI_SYMBOL);
            case CASE_SYMBOL: case OUSE_SYMBOL:
                return EnumSet.of(Attribute.IN_SYMBOL);
            case IN_SYMBOL:
                return EnumSet.of(
                    Attribute.OUT_SYMBOL, Attribute.OUSE_SYMBOL,
                    Attribute.ESAC_SYMBOL
                );
            case OUT_SYMBOL:
                return EnumSet.of(Attribute.ESAC_SYMBOL);
            default:
                throw new IllegalArgumentException(
                    "not a choice clause part: " + part
                );
        }
    }

    private Node choice(Node opener, int outer) throws ErrorException {
        Attribute closer = opener.is(Attribute.IF_SYMBOL)
            ? Attribute.FI_SYMBOL
            : Attribute.ESAC_SYMBOL;
        int range = this.symbols.newTable(outer);
        int table = range;
        Node partStart = opener;
        while(true) {
            Set<Attribute> stops
                = TopDownParser.choiceStops(partStart.attribute());
            Node stop = this.scanUntil(partStart.next(), stops, table);
            if(stop == null) {
                throw this.missing(opener, TopDownParser.describe(stops));
            }
            if(!stops.contains(stop.attribute())) {
                throw this.unexpected(stop, TopDownParser.describe(stops));
            }
            if(stop.is(closer)) {
                return this.foldPart(partStart, stop, table, outer);
            }
            this.foldPart(partStart, stop.previous(), table, outer);
            if(stop.isOneOf(Attribute.ELIF_SYMBOL, Attribute.OUSE_SYMBOL)) {
                range = this.symbols.newTable(range);
                table = range;
            } else {
                table = this.symbols.newTable(range);
            }
            partStart = stop;
        }
    }

    // DOWNTO ranks with TO
    private static final List<Attribute> LOOP_ORDER = List.of(
        Attribute.FOR_SYMBOL, Attribute.FROM_SYMBOL, Attribute.BY_SYMBOL,
        Attribute.TO_SYMBOL, Attribute.WHILE_SYMBOL, Attribute.DO_SYMBOL
    );

    private static int loopRank(Attribute part) {
        if(part == Attribute.DOWNTO_SYMBOL) {
            return TopDownParser.LOOP_ORDER.indexOf(Attribute.TO_SYMBOL);
        }
        return TopDownParser.LOOP_ORDER.indexOf(part);
    }

    private static Set<Attribute> loopStops(Attribute part) {
        int rank = TopDownParser.loopRank(part);
        Set<Attribute> stops = EnumSet.noneOf(Attribute.class);
        for(Attribute later: TopDownParser.LOOP_OPENERS) {
            if(TopDownParser.loopRank(later) > rank) { stops.add(later); }
        }
        return stops;
    }

    private Node loop(Node opener, int outer) throws ErrorException {
        Node partStart = opener;
        Node forPart = null;
        int whileTable = Node.NONE;
        while(!partStart.is(Attribute.DO_SYMBOL)) {
            Attribute part = partStart.attribute();
            Set<Attribute> stops = TopDownParser.loopStops(part);
            int table = outer;
            if(part == Attribute.WHILE_SYMBOL) {
                whileTable = this.symbols.newTable(outer);
                table = whileTable;
            }
            Node stop = this.scanUntil(partStart.next(), stops, table);
            if(stop == null) {
                throw this.missing(opener, TopDownParser.describe(stops));
            }
            if(!stops.contains(stop.attribute())) {
                throw this.unexpected(stop, TopDownParser.describe(stops));
            }
            if(stop.previous() == partStart) {
                throw this.session.diagnostics.abort(
                    Severity.SYNTAX_ERROR, partStart.source,
                    "%s has no content", part.description
                );
            }
            Node folded = this.foldPart(
                partStart, stop.previous(), table, outer
            );
            if(part == Attribute.FOR_SYMBOL) { forPart = folded; }
            partStart = stop;
        }
        int doTable = this.symbols.newTable(
            whileTable != Node.NONE? whileTable : outer
        );
        Set<Attribute> stops = EnumSet.of(
            Attribute.OD_SYMBOL, Attribute.UNTIL_SYMBOL
        );
        Node stop = this.scanUntil(partStart.next(), stops, doTable);
        if(Node.is(stop, Attribute.UNTIL_SYMBOL)) {
            Node until = stop;
            stop = this.scanUntil(
                until.next(), EnumSet.of(Attribute.OD_SYMBOL), doTable
            );
            if(stop != null && stop.is(Attribute.OD_SYMBOL)) {
                if(stop.previous() == until) {
                    throw this.session.diagnostics.abort(
                        Severity.SYNTAX_ERROR, until.source,
                        "UNTIL has no content"
                    );
                }
                this.foldPart(until, stop.previous(), doTable, doTable);
            }
        }
        if(stop == null) {
            throw this.missing(opener, Attribute.OD_SYMBOL.description);
        }
        if(!stop.is(Attribute.OD_SYMBOL)) {
            throw this.unexpected(stop, Attribute.OD_SYMBOL.description);
        }
        if(forPart != null) {
            int forTable = whileTable != Node.NONE? whileTable : doTable;
            for(Node child = forPart.sub(); child != null;
                    child = child.next()) {
                child.table = forTable;
            }
        }
        return this.foldPart(partStart, stop, doTable, outer);
    }

    // Folds a format text. Only the enclosed clause of a dynamic
    // replicator n(...) is parsed, the other items stay flat.
    private Node format(Node opener, int outer) throws ErrorException {
        int table = this.symbols.newTable(outer);
        Node current = opener.next();
        while(current != null
                && !current.is(Attribute.FORMAT_DELIMITER_SYMBOL)) {
            boolean dynamic = current.is(Attribute.FORMAT_ITEM)
                && current.symbol.equalsIgnoreCase("n")
                && Node.is(current.next(), Attribute.OPEN_SYMBOL);
            if(dynamic) {
                current = this.construct(current.next(), table);
            }
            current.table = table;
            current = current.next();
        }
        if(current == null) {
            throw this.missing(opener, "'$'");
        }
        Node part = Node.fold(opener, current, Attribute.FORMAT_TEXT);
        for(Node child = part.sub(); child != null; child = child.next()) {
            child.table = table;
        }
        part.table = outer;
        return part;
    }

}
