package typesafeschwalbe.algolc.compiler;

public enum Severity {
    SYNTAX_ERROR("syntax error", Color.RED),
    ERROR("error", Color.RED),
    WARNING("warning", Color.YELLOW);

    public final String word;
    final String color;

    private Severity(String word, String color) {
        this.word = word;
        this.color = color;
    }

    public boolean isError() {
        return this != WARNING;
    }
}
