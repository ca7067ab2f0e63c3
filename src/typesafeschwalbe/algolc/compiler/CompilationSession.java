package typesafeschwalbe.algolc.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import typesafeschwalbe.algolc.compiler.frontend.Node;
import typesafeschwalbe.algolc.compiler.modes.ModeTable;
import typesafeschwalbe.algolc.compiler.modes.MultiPrecision;
import typesafeschwalbe.algolc.compiler.symbols.Symbols;

public class CompilationSession {

    private Options options;
    private boolean optionsFrozen;
    public final Diagnostics diagnostics;
    public final StackGuard guard;
    public final Symbols symbols;
    public final ModeTable modes;
    public final MultiPrecision precision;
    private final List<String> reductionTrace;

    // the range of the standard environ and of the program proper
    public int standardTable = Node.NONE;
    public int programTable = Node.NONE;

    public CompilationSession(Options options, MultiPrecision precision) {
        this.options = options;
        this.optionsFrozen = false;
        this.diagnostics = new Diagnostics();
        this.diagnostics.setKeepWarnings(options.warnings());
        this.guard = new StackGuard(this.diagnostics, StackGuard.DEFAULT_LIMIT);
        this.symbols = new Symbols();
        this.modes = new ModeTable();
        this.precision = precision;
        this.reductionTrace = new ArrayList<>();
    }

    public Options options() {
        return this.options;
    }

    public void updateOptions(Options options) {
        if(this.optionsFrozen) {
            throw new IllegalStateException(
                "Options can no longer change once scanning has started!"
            );
        }
        this.options = options;
        this.diagnostics.setKeepWarnings(options.warnings());
    }

    public void freezeOptions() {
        this.optionsFrozen = true;
    }

    public void traceReduction(String line) {
        this.reductionTrace.add(line);
    }

    public List<String> reductionTrace() {
        return Collections.unmodifiableList(this.reductionTrace);
    }

    public String modeName(int mode) {
        return this.modes.toString(mode);
    }

}
