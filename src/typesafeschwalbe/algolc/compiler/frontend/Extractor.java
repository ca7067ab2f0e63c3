package typesafeschwalbe.algolc.compiler.frontend;

import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.symbols.Symbols;
import typesafeschwalbe.algolc.compiler.symbols.Tag;

public class Extractor {

    private static final Logger LOGGER
        = Logger.getLogger(Extractor.class.getName());

    private final CompilationSession session;
    private final Symbols symbols;
    private int declared;

    public Extractor(CompilationSession session) {
        this.session = session;
        this.symbols = session.symbols;
        this.declared = 0;
    }

    public void extract(Node program) throws ErrorException {
        this.extractList(program.sub());
        this.resolveBoldTags(program);
        LOGGER.fine("extracted " + this.declared + " bold declarations");
    }

    private static boolean isOperatorToken(Node node) {
        return node != null && node.isOneOf(
            Attribute.OPERATOR, Attribute.BOLD_TAG, Attribute.EQUALS_SYMBOL
        );
    }

    private static boolean endsDeclaration(Node node) {
        return node == null || node.is(Attribute.SEMICOLON_SYMBOL)
            || node.is(Attribute.EXIT_SYMBOL);
    }

    private void extractList(Node first) throws ErrorException {
        for(Node node = first; node != null; node = node.next()) {
            if(node.sub() != null) {
                this.session.guard.enter(node.source);
                try {
                    this.extractList(node.sub());
                } finally {
                    this.session.guard.exit();
                }
                continue;
            }
            switch(node.attribute()) {
                case MODE_SYMBOL:
                    this.extractModes(node);
                    break;
                case PRIO_SYMBOL:
                    this.extractPriorities(node);
                    break;
                case OP_SYMBOL:
                    this.extractOperators(node);
                    break;
                default:
                    break;
            }
        }
    }

    // Returns the first node after from that is a comma followed by
    // the start of a continued declaration, or null once the declaration
    // ends.
    private static Node nextContinuation(Node from, boolean bold) {
        for(Node node = from; !Extractor.endsDeclaration(node);
                node = node.next()) {
            if(!node.is(Attribute.COMMA_SYMBOL)) { continue; }
            Node name = node.next();
            boolean starts = bold
                ? Node.is(name, Attribute.BOLD_TAG)
                : Extractor.isOperatorToken(name);
            if(starts && Node.is(name.next(), Attribute.EQUALS_SYMBOL)) {
                return name;
            }
            return null;
        }
        return null;
    }

    private void extractModes(Node mode) {
        Node name = mode.next();
        if(!Node.is(name, Attribute.BOLD_TAG)
                || !Node.is(name.next(), Attribute.EQUALS_SYMBOL)) {
            this.session.diagnostics.report(
                Severity.SYNTAX_ERROR, mode.source,
                "mode indicant and '=' expected after MODE"
            );
            return;
        }
        while(name != null) {
            Tag existing = this.symbols.findLocal(
                name.table, Tag.Kind.INDICANT, name.symbol
            );
            if(existing != null) {
                this.session.diagnostics.report(
                    Severity.ERROR, name.source,
                    "mode indicant '%s' is declared more than once in this range",
                    name.symbol
                );
            } else {
                Tag tag = this.symbols.declare(
                    name.table, Tag.Kind.INDICANT, name.symbol, name,
                    Tag.Origin.DECLARED
                );
                name.tag = tag.handle;
                this.declared += 1;
            }
            name.become(Attribute.DEFINING_INDICANT);
            name.next().become(Attribute.ALT_EQUALS_SYMBOL);
            name = Extractor.nextContinuation(name.next(), true);
        }
    }

    private void extractPriorities(Node prio) {
        Node name = prio.next();
        while(name != null) {
            Node equals = name.next();
            Node value = equals == null? null : equals.next();
            boolean shaped = Extractor.isOperatorToken(name)
                && Node.is(equals, Attribute.EQUALS_SYMBOL)
                && Node.is(value, Attribute.INT_DENOTATION);
            if(!shaped) {
                this.session.diagnostics.report(
                    Severity.SYNTAX_ERROR, name.source,
                    "operator, '=' and priority expected in PRIO declaration"
                );
                return;
            }
            int priority = Extractor.parsePriority(value.symbol);
            if(priority < 1 || priority > 9) {
                this.session.diagnostics.report(
                    Severity.ERROR, value.source,
                    "priority must lie between 1 and 9, not %s", value.symbol
                );
                priority = 1;
            }
            Tag existing = this.symbols.findLocal(
                name.table, Tag.Kind.PRIORITY, name.symbol
            );
            if(existing != null) {
                this.session.diagnostics.report(
                    Severity.ERROR, name.source,
                    "priority of '%s' is declared more than once in this range",
                    name.symbol
                );
            } else {
                Tag tag = this.symbols.declare(
                    name.table, Tag.Kind.PRIORITY, name.symbol, name,
                    Tag.Origin.DECLARED
                );
                tag.priority = priority;
                name.tag = tag.handle;
                this.declared += 1;
            }
            name.become(Attribute.DEFINING_OPERATOR);
            equals.become(Attribute.ALT_EQUALS_SYMBOL);
            value.become(Attribute.PRIORITY);
            name = Extractor.nextContinuation(value.next(), false);
        }
    }

    private static int parsePriority(String digits) {
        if(digits.length() > 2) { return -1; }
        return Integer.parseInt(digits);
    }

    private void extractOperators(Node op) {
        Node name = op.next();
        // skip the plan, e.g. 'OP (INT, INT) BOOL'
        while(name != null && !Extractor.endsDeclaration(name)) {
            boolean found = Extractor.isOperatorToken(name)
                && Node.is(name.next(), Attribute.EQUALS_SYMBOL);
            if(found && name.is(Attribute.BOLD_TAG)
                    && Node.is(name.next().next(), Attribute.EQUALS_SYMBOL)) {
                // 'OP (INT, INT) BOOL = = ...' declares '='
                name = name.next();
            }
            if(found) { break; }
            name = name.next();
        }
        if(name == null || Extractor.endsDeclaration(name)) {
            this.session.diagnostics.report(
                Severity.SYNTAX_ERROR, op.source,
                "operator and '=' expected after OP"
            );
            return;
        }
        while(name != null) {
            Tag tag = this.symbols.declare(
                name.table, Tag.Kind.OPERATOR, name.symbol, name,
                Tag.Origin.DECLARED
            );
            name.tag = tag.handle;
            this.declared += 1;
            name.become(Attribute.DEFINING_OPERATOR);
            name.next().become(Attribute.ALT_EQUALS_SYMBOL);
            name = Extractor.nextContinuation(name.next(), false);
        }
    }

    private void resolveBoldTags(Node node) throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            for(Node child = node.sub(); child != null;
                    child = child.next()) {
                if(child.is(Attribute.BOLD_TAG)) {
                    this.resolveBoldTag(child);
                } else if(child.sub() != null) {
                    this.resolveBoldTags(child);
                }
            }
        } finally {
            this.session.guard.exit();
        }
    }

    private void resolveBoldTag(Node bold) {
        Tag indicant = this.symbols.lookUp(
            bold.table, Tag.Kind.INDICANT, bold.symbol
        );
        if(indicant != null) {
            bold.become(Attribute.INDICANT);
            bold.tag = indicant.handle;
            return;
        }
        boolean operator = !this.symbols
            .operatorsVisible(bold.table, bold.symbol).isEmpty()
            || this.symbols.lookUp(
                bold.table, Tag.Kind.PRIORITY, bold.symbol
            ) != null;
        if(operator) {
            bold.become(Attribute.OPERATOR);
            return;
        }
        this.session.diagnostics.report(
            Severity.ERROR, bold.source,
            "'%s' is neither a declared mode indicant nor an operator",
            bold.symbol
        );
        bold.become(Attribute.INDICANT);
    }

}
