package typesafeschwalbe.algolc.compiler;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

public record Error(
    Severity severity,
    String message,
    Marking... markings
) {

    public static record Marking(Source location, String note) {

        private static final char MARKER = '^';

        public static Marking at(Source location, String note) {
            return new Marking(location, note);
        }

    }

    public Error(String message, Marking... markings) {
        this(Severity.ERROR, message, markings);
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.severity == other.severity
            && this.message.equals(other.message)
            && Arrays.equals(this.markings, other.markings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            this.severity, this.message, Arrays.hashCode(this.markings)
        );
    }

    private static String lineOf(String content, int line) {
        int lineIdx = 1;
        int start = 0;
        while(lineIdx < line) {
            int newline = content.indexOf('\n', start);
            if(newline == -1) { return ""; }
            start = newline + 1;
            lineIdx += 1;
        }
        int end = content.indexOf('\n', start);
        if(end == -1) { end = content.length(); }
        String text = content.substring(start, end);
        if(text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    private static int lineStart(String content, int offset) {
        int start = Math.min(offset, content.length());
        while(start > 0 && content.charAt(start - 1) != '\n') {
            start -= 1;
        }
        return start;
    }

    public String render(Map<String, String> files, boolean colored) {
        StringBuilder output = new StringBuilder();
        output.append(Color.paint(
            colored, this.severity.word + ": ",
            Color.BOLD, this.severity.color
        ));
        output.append(Color.paint(colored, this.message, this.severity.color));
        output.append("\n");
        for(Marking marked: this.markings) {
            Source location = marked.location;
            if(location == null) { continue; }
            String content = files.get(location.file());
            String lineNumber = String.valueOf(location.line());
            String padding = " ".repeat(lineNumber.length() + 2);
            int column = 1;
            String text = "";
            if(content != null) {
                int start = Error.lineStart(content, location.startOffset());
                column = location.startOffset() - start + 1;
                text = Error.lineOf(content, location.line());
            }
            output.append(padding);
            output.append(Color.paint(colored, "╭─ ", Color.GRAY));
            output.append(Color.paint(
                colored,
                location.file() + ":" + location.line() + ":" + column,
                Color.GRAY
            ));
            output.append("\n");
            if(content != null) {
                output.append(" ");
                output.append(lineNumber);
                output.append(Color.paint(colored, " │ ", Color.GRAY));
                output.append(text);
                output.append("\n");
                int width = Math.max(1, Math.min(
                    location.endOffset() - location.startOffset(),
                    text.length() - column + 1
                ));
                output.append(padding);
                output.append(Color.paint(colored, "┊ ", Color.GRAY));
                output.append(" ".repeat(Math.max(0, column - 1)));
                output.append(Color.paint(
                    colored,
                    String.valueOf(Marking.MARKER).repeat(width)
                        + " " + marked.note,
                    this.severity.color
                ));
                output.append("\n");
            } else {
                output.append(padding);
                output.append(Color.paint(colored, "┊ ", Color.GRAY));
                output.append(Color.paint(
                    colored, marked.note, this.severity.color
                ));
                output.append("\n");
            }
            output.append(" ".repeat(padding.length() - 1));
            output.append(Color.paint(colored, "─╯", Color.GRAY));
            output.append("\n");
        }
        return output.toString();
    }

}
