package typesafeschwalbe.algolc.compiler;

public enum PhaseResult {
    OK,
    RECOVERED,
    FATAL;

    public static PhaseResult after(Diagnostics diagnostics, int errorsBefore) {
        return diagnostics.errorCount() > errorsBefore
            ? PhaseResult.RECOVERED
            : PhaseResult.OK;
    }

    public PhaseResult worst(PhaseResult other) {
        return this.ordinal() >= other.ordinal()? this : other;
    }

    public boolean proceed() {
        return this == OK;
    }
}
