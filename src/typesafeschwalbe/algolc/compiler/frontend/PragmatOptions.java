package typesafeschwalbe.algolc.compiler.frontend;

import java.util.List;
import java.util.Locale;

import typesafeschwalbe.algolc.compiler.Diagnostics;
import typesafeschwalbe.algolc.compiler.Options;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.Source;
import typesafeschwalbe.algolc.compiler.SourceLine;

public class PragmatOptions {

    private final List<SourceLine> lines;
    private final Diagnostics diagnostics;

    public PragmatOptions(List<SourceLine> lines, Diagnostics diagnostics) {
        this.lines = lines;
        this.diagnostics = diagnostics;
    }

    public Options apply(Options options) {
        StringBuilder text = new StringBuilder();
        for(SourceLine line: this.lines) {
            text.append(line.text()).append('\n');
        }
        String program = text.toString();
        Options result = options;
        int idx = 0;
        while(idx < program.length()) {
            char c = program.charAt(idx);
            if(c == '"') {
                int end = program.indexOf('"', idx + 1);
                idx = end == -1? program.length() : end + 1;
                continue;
            }
            if(c == '#') {
                int end = program.indexOf('#', idx + 1);
                idx = end == -1? program.length() : end + 1;
                continue;
            }
            String word = PragmatOptions.wordAt(program, idx);
            if(word.isEmpty()) {
                idx += 1;
                continue;
            }
            int after = idx + word.length();
            String bold = word.replace("'", "").toUpperCase(Locale.ROOT);
            if(Keywords.COMMENT_WORDS.contains(bold)) {
                int end = program.indexOf(word, after);
                idx = end == -1? program.length() : end + word.length();
                continue;
            }
            if(Keywords.PRAGMAT_WORDS.contains(bold)) {
                int end = program.indexOf(word, after);
                if(end == -1) { end = program.length(); }
                result = this.directives(
                    result, program.substring(after, end)
                );
                idx = Math.min(program.length(), end + word.length());
                continue;
            }
            idx = after;
        }
        return result;
    }

    private static String wordAt(String program, int idx) {
        char c = program.charAt(idx);
        if(c == '\'') {
            int end = program.indexOf('\'', idx + 1);
            if(end == -1) { return ""; }
            return program.substring(idx, end + 1);
        }
        if(!Character.isUpperCase(c)) { return ""; }
        if(idx > 0 && Character.isLetterOrDigit(program.charAt(idx - 1))) {
            return "";
        }
        int end = idx;
        while(end < program.length()
                && (Character.isUpperCase(program.charAt(end))
                    || program.charAt(end) == '_')) {
            end += 1;
        }
        return program.substring(idx, end);
    }

    private Options directives(Options options, String content) {
        Options result = options;
        for(String raw: content.trim().split("\\s+")) {
            String word = raw.toLowerCase(Locale.ROOT);
            switch(word) {
                case "": break;
                case "quote":
                case "quotestropping":
                    result = result.withStropping(Options.Stropping.QUOTE);
                    break;
                case "bold":
                case "upper":
                case "upperstropping":
                    result = result.withStropping(Options.Stropping.BOLD);
                    break;
                case "brackets": result = result.withBrackets(true); break;
                case "nobrackets": result = result.withBrackets(false); break;
                case "portcheck": result = result.withPortability(true); break;
                case "noportcheck":
                    result = result.withPortability(false);
                    break;
                case "reductions": result = result.withReductions(true); break;
                case "noreductions":
                    result = result.withReductions(false);
                    break;
                case "warnings": result = result.withWarnings(true); break;
                case "nowarnings": result = result.withWarnings(false); break;
                default:
                    this.diagnostics.report(
                        Severity.WARNING, this.firstLine(),
                        "unrecognised option '%s' in pragmat", raw
                    );
            }
        }
        return result;
    }

    private Source firstLine() {
        if(this.lines.isEmpty()) { return null; }
        SourceLine line = this.lines.get(0);
        return new Source(
            line.file(), line.number(), line.offset(),
            line.offset() + line.text().length()
        );
    }

}
