package typesafeschwalbe.algolc.compiler;

import java.util.List;

import typesafeschwalbe.algolc.compiler.frontend.Node;

public class Programs {

    public static Compiler.Compilation compile(String text) {
        return Programs.compile(text, Options.defaults());
    }

    public static Compiler.Compilation compile(String text, Options options) {
        return Compiler.compile(LineLoader.load("test.a68", text), options);
    }

    public static List<Diagnostic> errors(Compiler.Compilation compilation) {
        return compilation.session().diagnostics.errors();
    }

    public static List<Diagnostic> warnings(
        Compiler.Compilation compilation
    ) {
        return compilation.session().diagnostics.warnings();
    }

    public static boolean mentions(
        List<Diagnostic> diagnostics, String fragment
    ) {
        for(Diagnostic diagnostic: diagnostics) {
            if(diagnostic.message().contains(fragment)) { return true; }
        }
        return false;
    }

    public static String describe(List<Diagnostic> diagnostics) {
        StringBuilder out = new StringBuilder();
        for(Diagnostic diagnostic: diagnostics) {
            out.append(diagnostic).append('\n');
        }
        return out.toString();
    }

    public static Node scan(CompilationSession session, String text)
            throws ErrorException {
        return new typesafeschwalbe.algolc.compiler.frontend.Scanner(
            session, LineLoader.load("test.a68", text)
        ).scan();
    }

    public static CompilationSession session() {
        return new CompilationSession(
            Options.defaults(),
            typesafeschwalbe.algolc.compiler.modes.MultiPrecision.DEFAULT
        );
    }

    private Programs() {}

}
