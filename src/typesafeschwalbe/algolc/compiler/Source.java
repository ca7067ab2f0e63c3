package typesafeschwalbe.algolc.compiler;

public record Source(String file, int line, int startOffset, int endOffset) {

    public Source(Source start, Source end) {
        this(start.file, start.line, start.startOffset, end.endOffset);
        if(!start.file.equals(end.file)) {
            throw new IllegalArgumentException(
                "Provided source locations are not from the same file!"
            );
        }
    }

    public static Source span(Source start, Source end) {
        if(start == null) { return end; }
        if(end == null || !start.file.equals(end.file)) { return start; }
        if(end.endOffset < start.startOffset) { return start; }
        return new Source(start, end);
    }

    @Override
    public String toString() {
        return "@\"" + this.file + "\":" + this.line;
    }

}
