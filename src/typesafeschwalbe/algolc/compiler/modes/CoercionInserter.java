package typesafeschwalbe.algolc.compiler.modes;

import java.util.List;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.frontend.Attribute;
import typesafeschwalbe.algolc.compiler.frontend.Node;

public class CoercionInserter {

    private static final Logger LOGGER
        = Logger.getLogger(CoercionInserter.class.getName());

    private final CompilationSession session;
    private final ModeTable modes;
    private final Coercions coercions;
    private int inserted;

    public CoercionInserter(CompilationSession session) {
        this.session = session;
        this.modes = session.modes;
        this.coercions = new Coercions(session.modes);
        this.inserted = 0;
    }

    public void insert(Node program) throws ErrorException {
        this.visit(program);
        LOGGER.fine("inserted " + this.inserted + " coercions");
    }

    private void visit(Node node) throws ErrorException {
        this.session.guard.enter(node.source);
        try {
            for(Node child: node.children()) {
                this.visit(child);
            }
        } finally {
            this.session.guard.exit();
        }
        if(node.expectedMode != Node.NONE) {
            this.coerce(node);
        }
    }

    private boolean isProceduring(Node node) {
        if(node.expectedSort != Sort.STRONG) { return false; }
        if(!node.unwrap().is(Attribute.JUMP)) { return false; }
        Mode target = this.modes.get(node.expectedMode);
        return target.is(Mode.Kind.PROC) && target.pack.isEmpty()
            && this.modes.kindOf(target.sub) == Mode.Kind.VOID;
    }

    private static boolean hasNoEffect(Node node) {
        return node.unwrap().isOneOf(
            Attribute.DENOTATION, Attribute.IDENTIFIER,
            Attribute.MONADIC_FORMULA, Attribute.FORMULA, Attribute.SLICE,
            Attribute.SELECTION, Attribute.IDENTITY_RELATION,
            Attribute.AND_FUNCTION, Attribute.OR_FUNCTION
        );
    }

    private void coerce(Node node) {
        if(this.isProceduring(node)) {
            this.wrap(node, Attribute.PROCEDURING, node.expectedMode);
            return;
        }
        List<Coercions.Step> steps = this.coercions.plan(
            node.mode, node.expectedMode, node.expectedSort
        );
        // not coercible, already reported
        if(steps == null) { return; }
        Node current = node;
        for(Coercions.Step step: steps) {
            if(step.coercion() == Attribute.VOIDING
                    && CoercionInserter.hasNoEffect(node)) {
                this.session.diagnostics.report(
                    Severity.WARNING, node.source,
                    "the value of %s is discarded",
                    node.unwrap().attribute().description
                );
            }
            current = this.wrap(current, step.coercion(), step.mode());
        }
    }

    private Node wrap(Node node, Attribute coercion, int mode) {
        Node wrapper = node.wrap(coercion);
        wrapper.mode = mode;
        this.inserted += 1;
        return wrapper;
    }

}
