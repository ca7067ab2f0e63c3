package typesafeschwalbe.algolc.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Diagnostics {

    private static final Logger LOGGER
        = Logger.getLogger(Diagnostics.class.getName());

    public static final int MAX_ERRORS = 16;

    private final List<Diagnostic> reported;
    private boolean keepWarnings;
    private int errorCount;

    public Diagnostics() {
        this.reported = new ArrayList<>();
        this.keepWarnings = true;
        this.errorCount = 0;
    }

    public void setKeepWarnings(boolean keepWarnings) {
        this.keepWarnings = keepWarnings;
    }

    public Diagnostic report(
        Severity severity, Source source, String template, Object... args
    ) {
        Diagnostic diagnostic = new Diagnostic(
            severity, source, template, List.of(args)
        );
        if(severity == Severity.WARNING && !this.keepWarnings) {
            return diagnostic;
        }
        // compilation has halted, the phase unwinds at its next step
        if(this.exceeded()) {
            return diagnostic;
        }
        for(Diagnostic existing: this.reported) {
            boolean same = existing.severity() == severity
                && existing.message().equals(diagnostic.message())
                && (existing.source() == null
                    ? source == null
                    : existing.source().equals(source));
            if(same) { return existing; }
        }
        this.reported.add(diagnostic);
        if(severity.isError()) {
            this.errorCount += 1;
        }
        if(LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("reported " + diagnostic);
        }
        return diagnostic;
    }

    public ErrorException abort(
        Severity severity, Source source, String template, Object... args
    ) {
        return new ErrorException(
            this.report(severity, source, template, args)
        );
    }

    public int errorCount() {
        return this.errorCount;
    }

    public boolean exceeded() {
        return this.errorCount > MAX_ERRORS;
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(this.reported);
    }

    public List<Diagnostic> errors() {
        return this.reported.stream()
            .filter(d -> d.severity().isError())
            .toList();
    }

    public List<Diagnostic> warnings() {
        return this.reported.stream()
            .filter(d -> d.severity() == Severity.WARNING)
            .toList();
    }

    public List<Error> toErrors() {
        return this.reported.stream()
            .map(Diagnostic::toError)
            .toList();
    }

}
