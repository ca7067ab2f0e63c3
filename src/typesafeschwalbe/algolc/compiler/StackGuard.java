package typesafeschwalbe.algolc.compiler;

// Bounds the recursion depth of the tree walking phases, and stops them
// once too many errors have been reported.
public class StackGuard {

    public static final int DEFAULT_LIMIT = 512;

    private final Diagnostics diagnostics;
    private final int limit;
    private int depth;

    public StackGuard(Diagnostics diagnostics, int limit) {
        this.diagnostics = diagnostics;
        this.limit = limit;
        this.depth = 0;
    }

    public void enter(Source at) throws ErrorException {
        if(this.diagnostics.exceeded()) {
            throw this.diagnostics.abort(
                Severity.ERROR, at, "too many errors, giving up on this program"
            );
        }
        this.depth += 1;
        if(this.depth > this.limit) {
            this.depth = 0;
            throw this.diagnostics.abort(
                Severity.ERROR, at, "program too deeply nested"
            );
        }
    }

    public void exit() {
        if(this.depth > 0) {
            this.depth -= 1;
        }
    }

    public void reset() {
        this.depth = 0;
    }

    public int depth() {
        return this.depth;
    }

}
