package typesafeschwalbe.algolc.compiler;

public class ErrorException extends Exception {

    public final Diagnostic diagnostic;

    public ErrorException(Diagnostic diagnostic) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
    }

}
