package typesafeschwalbe.algolc.compiler;

public record SourceLine(String text, String file, int number, int offset) {}
