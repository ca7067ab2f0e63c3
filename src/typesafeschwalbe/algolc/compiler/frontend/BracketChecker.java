package typesafeschwalbe.algolc.compiler.frontend;

import java.util.ArrayDeque;
import java.util.Deque;

import typesafeschwalbe.algolc.compiler.Diagnostics;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Severity;

public class BracketChecker {

    private enum Family {
        BEGIN("BEGIN", "END"),
        PAREN("(", ")"),
        SUB("[", "]"),
        ACCO("{", "}"),
        IF("IF", "FI"),
        CASE("CASE", "ESAC"),
        DO("DO", "OD"),
        FORMAT("$", "$"),
        CODE("CODE", "EDOC");

        private final String opener;
        private final String closer;

        private Family(String opener, String closer) {
            this.opener = opener;
            this.closer = closer;
        }
    }

    private static record Open(Family family, Node token) {}

    private final Diagnostics diagnostics;

    public BracketChecker(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    private static Family opens(Attribute attribute) {
        switch(attribute) {
            case BEGIN_SYMBOL: return Family.BEGIN;
            case OPEN_SYMBOL: return Family.PAREN;
            case SUB_SYMBOL: return Family.SUB;
            case ACCO_SYMBOL: return Family.ACCO;
            case IF_SYMBOL: return Family.IF;
            case CASE_SYMBOL: return Family.CASE;
            case DO_SYMBOL: return Family.DO;
            case CODE_SYMBOL: return Family.CODE;
            default: return null;
        }
    }

    private static Family closes(Attribute attribute) {
        switch(attribute) {
            case END_SYMBOL: return Family.BEGIN;
            case CLOSE_SYMBOL: return Family.PAREN;
            case BUS_SYMBOL: return Family.SUB;
            case OCCA_SYMBOL: return Family.ACCO;
            case FI_SYMBOL: return Family.IF;
            case ESAC_SYMBOL: return Family.CASE;
            case OD_SYMBOL: return Family.DO;
            case EDOC_SYMBOL: return Family.CODE;
            default: return null;
        }
    }

    public void check(Node program) throws ErrorException {
        Deque<Open> open = new ArrayDeque<>();
        for(Node token = program.sub(); token != null; token = token.next()) {
            if(token.is(Attribute.FORMAT_DELIMITER_SYMBOL)) {
                boolean closing = !open.isEmpty()
                    && open.peek().family == Family.FORMAT;
                if(closing) {
                    this.close(open, Family.FORMAT, token);
                } else {
                    this.open(open, Family.FORMAT, token);
                }
                continue;
            }
            Family opened = BracketChecker.opens(token.attribute());
            if(opened != null) {
                this.open(open, opened, token);
                continue;
            }
            Family closed = BracketChecker.closes(token.attribute());
            if(closed != null) {
                this.close(open, closed, token);
            }
        }
        if(!open.isEmpty()) {
            Open unmatched = open.peek();
            throw this.diagnostics.abort(
                Severity.SYNTAX_ERROR, unmatched.token.source,
                "missing %s to match %s",
                unmatched.family.closer, unmatched.family.opener
            );
        }
    }

    private void open(Deque<Open> open, Family family, Node token) {
        open.push(new Open(family, token));
    }

    private void close(Deque<Open> open, Family family, Node token)
            throws ErrorException {
        if(open.isEmpty()) {
            throw this.diagnostics.abort(
                Severity.SYNTAX_ERROR, token.source,
                "%s without a matching %s", family.closer, family.opener
            );
        }
        Open top = open.peek();
        if(top.family != family) {
            throw this.diagnostics.abort(
                Severity.SYNTAX_ERROR, token.source,
                "missing %s to match %s before %s",
                top.family.closer, top.family.opener, family.closer
            );
        }
        open.pop();
    }

}
