package typesafeschwalbe.algolc.compiler;

public record Options(
    Stropping stropping,
    boolean brackets,
    boolean portability,
    boolean reductions,
    boolean warnings
) {

    public enum Stropping {
        BOLD,
        QUOTE
    }

    public static Options defaults() {
        return new Options(Stropping.BOLD, false, false, false, true);
    }

    public Options withStropping(Stropping stropping) {
        return new Options(
            stropping, this.brackets, this.portability, this.reductions,
            this.warnings
        );
    }

    public Options withBrackets(boolean brackets) {
        return new Options(
            this.stropping, brackets, this.portability, this.reductions,
            this.warnings
        );
    }

    public Options withPortability(boolean portability) {
        return new Options(
            this.stropping, this.brackets, portability, this.reductions,
            this.warnings
        );
    }

    public Options withReductions(boolean reductions) {
        return new Options(
            this.stropping, this.brackets, this.portability, reductions,
            this.warnings
        );
    }

    public Options withWarnings(boolean warnings) {
        return new Options(
            this.stropping, this.brackets, this.portability, this.reductions,
            warnings
        );
    }

}
