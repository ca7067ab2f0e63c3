package typesafeschwalbe.algolc.compiler;

import java.util.List;

public record Diagnostic(
    Severity severity,
    Source source,
    String template,
    List<Object> args
) {

    public String message() {
        return String.format(this.template, this.args.toArray());
    }

    public Error toError() {
        if(this.source == null) {
            return new Error(this.severity, this.message());
        }
        return new Error(
            this.severity, this.message(),
            Error.Marking.at(this.source, this.severity.word + " here")
        );
    }

    @Override
    public String toString() {
        String where = this.source == null? "" : " " + this.source;
        return this.severity.word + where + ": " + this.message();
    }

}
