package typesafeschwalbe.algolc.compiler;

import java.util.List;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.frontend.BottomUpParser;
import typesafeschwalbe.algolc.compiler.frontend.BracketChecker;
import typesafeschwalbe.algolc.compiler.frontend.Extractor;
import typesafeschwalbe.algolc.compiler.frontend.Node;
import typesafeschwalbe.algolc.compiler.frontend.PragmatOptions;
import typesafeschwalbe.algolc.compiler.frontend.Refinements;
import typesafeschwalbe.algolc.compiler.frontend.Scanner;
import typesafeschwalbe.algolc.compiler.frontend.Taxes;
import typesafeschwalbe.algolc.compiler.frontend.TopDownParser;
import typesafeschwalbe.algolc.compiler.modes.CoercionInserter;
import typesafeschwalbe.algolc.compiler.modes.ModeChecker;
import typesafeschwalbe.algolc.compiler.modes.ModeCollector;
import typesafeschwalbe.algolc.compiler.modes.MultiPrecision;
import typesafeschwalbe.algolc.compiler.modes.StandardEnvironment;
import typesafeschwalbe.algolc.compiler.scope.ScopeChecker;

// Runs the phases of the front end in order. Each phase either finishes,
// possibly having recorded errors, or unwinds with an
// ErrorException that ends it.
public class Compiler {

    private static final Logger LOGGER
        = Logger.getLogger(Compiler.class.getName());

    public static record Compilation(
        Node program, CompilationSession session, PhaseResult result
    ) {
        public boolean succeeded() {
            return this.result != PhaseResult.FATAL
                && this.session.diagnostics.errorCount() == 0;
        }

        public List<Diagnostic> diagnostics() {
            return this.session.diagnostics.all();
        }
    }

    private interface Phase {
        void run() throws ErrorException;
    }

    private static PhaseResult run(
        CompilationSession session, String name, Phase phase
    ) {
        LOGGER.fine("entering " + name);
        int errorsBefore = session.diagnostics.errorCount();
        session.guard.reset();
        PhaseResult result;
        try {
            phase.run();
            result = PhaseResult.after(session.diagnostics, errorsBefore);
        } catch(ErrorException e) {
            LOGGER.fine(name + " aborted: " + e.diagnostic.message());
            result = PhaseResult.FATAL;
        } catch(StackOverflowError e) {
            // the guard counts levels, not frames, so it can come too late
            LOGGER.warning(name + " ran out of stack");
            session.diagnostics.report(
                Severity.ERROR, null, "program too deeply nested"
            );
            result = PhaseResult.FATAL;
        }
        if(session.diagnostics.exceeded()) {
            result = PhaseResult.FATAL;
        }
        LOGGER.fine("leaving " + name + " (" + result + ")");
        return result;
    }

    public static Compilation compile(String file, String content) {
        return Compiler.compile(
            LineLoader.load(file, content), Options.defaults()
        );
    }

    public static Compilation compile(
        List<SourceLine> lines, Options options
    ) {
        return Compiler.compile(lines, options, MultiPrecision.DEFAULT);
    }

    public static Compilation compile(
        List<SourceLine> lines, Options options, MultiPrecision precision
    ) {
        CompilationSession session = new CompilationSession(
            options, precision
        );
        session.updateOptions(
            new PragmatOptions(lines, session.diagnostics).apply(options)
        );
        session.freezeOptions();
        new StandardEnvironment(session).declare();
        Node[] program = new Node[1];
        PhaseResult result = Compiler.run(session, "scanner", () -> {
            program[0] = new Scanner(session, lines).scan();
        });
        if(program[0] == null) {
            return new Compilation(null, session, PhaseResult.FATAL);
        }
        Node root = program[0];
        Phase[] syntax = {
            () -> new Refinements(session.diagnostics).apply(root),
            () -> new BracketChecker(session.diagnostics).check(root),
            () -> new TopDownParser(session).parse(root),
            () -> new Extractor(session).extract(root),
            () -> new BottomUpParser(session).parse(root),
            () -> new Taxes(session).collect(root)
        };
        String[] names = {
            "refinements", "bracket checker", "top-down parser",
            "extractor", "bottom-up parser", "taxes"
        };
        for(int idx = 0; idx < syntax.length; idx += 1) {
            if(!result.proceed()) {
                return new Compilation(root, session, result);
            }
            result = result.worst(
                Compiler.run(session, names[idx], syntax[idx])
            );
        }
        if(!result.proceed()) {
            return new Compilation(root, session, result);
        }
        result = Compiler.run(
            session, "mode collector",
            () -> new ModeCollector(session).collect(root)
        );
        if(!result.proceed()) {
            return new Compilation(root, session, result);
        }
        result = Compiler.run(
            session, "mode checker",
            () -> new ModeChecker(session).check(root)
        );
        if(!result.proceed()) {
            return new Compilation(root, session, result);
        }
        result = Compiler.run(
            session, "coercion inserter",
            () -> new CoercionInserter(session).insert(root)
        );
        if(result == PhaseResult.FATAL) {
            return new Compilation(root, session, result);
        }
        result = result.worst(Compiler.run(
            session, "scope checker",
            () -> new ScopeChecker(session).check(root)
        ));
        return new Compilation(root, session, result);
    }

    public static Result<Compilation> check(
        List<SourceLine> lines, Options options
    ) {
        Compilation compilation = Compiler.compile(lines, options);
        if(!compilation.succeeded()) {
            return Result.ofError(compilation.session().diagnostics.toErrors());
        }
        return Result.ofValue(compilation);
    }

}
