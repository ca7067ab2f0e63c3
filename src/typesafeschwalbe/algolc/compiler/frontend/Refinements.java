package typesafeschwalbe.algolc.compiler.frontend;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.Diagnostics;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Severity;

// Splices named refinements, written after the program as
// name: units., into their single point of application.
public class Refinements {

    private static final Logger LOGGER
        = Logger.getLogger(Refinements.class.getName());

    private static class Refinement {
        private final Node name;
        private final Node body;
        private int applications;

        private Refinement(Node name, Node body) {
            this.name = name;
            this.body = body;
            this.applications = 0;
        }
    }

    private final Diagnostics diagnostics;

    public Refinements(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    private static int depthChange(Node token) {
        switch(token.attribute()) {
            case BEGIN_SYMBOL: case OPEN_SYMBOL: case SUB_SYMBOL:
            case ACCO_SYMBOL: case IF_SYMBOL: case CASE_SYMBOL:
            case DO_SYMBOL: case CODE_SYMBOL:
                return 1;
            case END_SYMBOL: case CLOSE_SYMBOL: case BUS_SYMBOL:
            case OCCA_SYMBOL: case FI_SYMBOL: case ESAC_SYMBOL:
            case OD_SYMBOL: case EDOC_SYMBOL:
                return -1;
            default:
                return 0;
        }
    }

    private static Node topLevelPoint(Node from) {
        int depth = 0;
        for(Node token = from; token != null; token = token.next()) {
            depth += Refinements.depthChange(token);
            if(depth == 0 && token.is(Attribute.POINT_SYMBOL)) {
                return token;
            }
        }
        return null;
    }

    public void apply(Node program) throws ErrorException {
        Node point = Refinements.topLevelPoint(program.sub());
        if(point == null) { return; }
        if(point.previous() == null) {
            throw this.diagnostics.abort(
                Severity.SYNTAX_ERROR, point.source,
                "program is empty before its refinements"
            );
        }
        Map<String, Refinement> refinements = new LinkedHashMap<>();
        Node cursor = point.next();
        while(cursor != null) {
            Node name = cursor;
            Node colon = name.next();
            if(!name.is(Attribute.IDENTIFIER)
                    || !Node.is(colon, Attribute.COLON_SYMBOL)) {
                throw this.diagnostics.abort(
                    Severity.SYNTAX_ERROR, name.source,
                    "refinement definition expected after '.'"
                );
            }
            Node end = Refinements.topLevelPoint(colon.next());
            if(end == null) {
                throw this.diagnostics.abort(
                    Severity.SYNTAX_ERROR, name.source,
                    "refinement '%s' is not terminated by '.'", name.symbol
                );
            }
            if(end == colon.next()) {
                throw this.diagnostics.abort(
                    Severity.SYNTAX_ERROR, name.source,
                    "refinement '%s' has an empty body", name.symbol
                );
            }
            Node body = colon.next();
            Node after = end.next();
            Node.link(end.previous(), null);
            Node.link(null, body);
            if(refinements.containsKey(name.symbol)) {
                this.diagnostics.report(
                    Severity.SYNTAX_ERROR, name.source,
                    "refinement '%s' is defined more than once", name.symbol
                );
            } else {
                refinements.put(name.symbol, new Refinement(name, body));
            }
            cursor = after;
        }
        Node.link(point.previous(), null);
        this.splice(program, refinements);
    }

    private void splice(Node program, Map<String, Refinement> refinements)
            throws ErrorException {
        Node token = program.sub();
        while(token != null) {
            Refinement refinement = token.is(Attribute.IDENTIFIER)
                ? refinements.get(token.symbol)
                : null;
            if(refinement == null
                    || Node.is(token.next(), Attribute.COLON_SYMBOL)) {
                token = token.next();
                continue;
            }
            refinement.applications += 1;
            if(refinement.applications > 1) {
                throw this.diagnostics.abort(
                    Severity.SYNTAX_ERROR, token.source,
                    "refinement '%s' is applied more than once",
                    token.symbol
                );
            }
            Node before = token.previous();
            Node after = token.next();
            Node.link(before, refinement.body);
            Node.link(refinement.body.last(), after);
            if(before == null) {
                program.setSub(refinement.body);
            }
            LOGGER.fine("applied refinement " + token.symbol);
            token = refinement.body;
        }
        program.setSub(program.sub());
        for(Refinement refinement: refinements.values()) {
            if(refinement.applications == 0) {
                this.diagnostics.report(
                    Severity.SYNTAX_ERROR, refinement.name.source,
                    "refinement '%s' is not applied", refinement.name.symbol
                );
            }
        }
    }

}
