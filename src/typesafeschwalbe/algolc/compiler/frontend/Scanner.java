package typesafeschwalbe.algolc.compiler.frontend;

import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Options;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.Source;
import typesafeschwalbe.algolc.compiler.SourceLine;

// Turns source lines into a flat, doubly linked list of token nodes owned
// by a particular-program node.
public class Scanner {

    private static final Logger LOGGER
        = Logger.getLogger(Scanner.class.getName());

    private static final char STOP = '\0';
    private static final String MONADS = "%^&+-~!?";
    private static final String NOMADS = "></=*";

    private final CompilationSession session;
    private final List<SourceLine> lines;
    private final boolean quoteStropping;

    private int lineIdx = 0;
    private int column = 0;

    private int startLine;
    private int startColumn;

    private boolean inFormat = false;
    private int formatNesting = 0;

    private Node first = null;
    private Node last = null;

    public Scanner(CompilationSession session, List<SourceLine> lines) {
        this.session = session;
        this.lines = lines;
        this.quoteStropping
            = session.options().stropping() == Options.Stropping.QUOTE;
    }

    public static boolean isLower(char c) {
        return 'a' <= c && c <= 'z';
    }

    public static boolean isUpper(char c) {
        return 'A' <= c && c <= 'Z';
    }

    public static boolean isDigit(char c) {
        return '0' <= c && c <= '9';
    }

    public static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private char current() {
        if(this.lineIdx >= this.lines.size()) { return STOP; }
        String text = this.lines.get(this.lineIdx).text();
        if(this.column >= text.length()) { return '\n'; }
        return text.charAt(this.column);
    }

    private char peek() {
        if(this.lineIdx >= this.lines.size()) { return STOP; }
        String text = this.lines.get(this.lineIdx).text();
        if(this.column + 1 < text.length()) {
            return text.charAt(this.column + 1);
        }
        if(this.column + 1 == text.length()) { return '\n'; }
        return this.lineIdx + 1 < this.lines.size()
            ? (this.lines.get(this.lineIdx + 1).text().isEmpty()
                ? '\n'
                : this.lines.get(this.lineIdx + 1).text().charAt(0))
            : STOP;
    }

    private void next() {
        if(this.lineIdx >= this.lines.size()) { return; }
        String text = this.lines.get(this.lineIdx).text();
        if(this.column >= text.length()) {
            this.lineIdx += 1;
            this.column = 0;
        } else {
            this.column += 1;
        }
    }

    private void markStart() {
        this.startLine = this.lineIdx;
        this.startColumn = this.column;
    }

    private Source sourceFromStart() {
        if(this.lines.isEmpty()) {
            return new Source("<empty>", 1, 0, 0);
        }
        int lineIdx = Math.min(this.startLine, this.lines.size() - 1);
        SourceLine line = this.lines.get(lineIdx);
        int start = line.offset() + this.startColumn;
        int end;
        if(this.lineIdx == this.startLine) {
            end = line.offset() + this.column;
        } else {
            end = line.offset() + line.text().length();
        }
        return new Source(
            line.file(), line.number(), start, Math.max(end, start + 1)
        );
    }

    private void emit(Attribute attribute, String symbol) {
        Node token = new Node(attribute, symbol, this.sourceFromStart());
        if(this.first == null) {
            this.first = token;
        } else {
            Node.link(this.last, token);
        }
        this.last = token;
    }

    private ErrorException scanError(String template, Object... args) {
        return this.session.diagnostics.abort(
            Severity.SYNTAX_ERROR, this.sourceFromStart(), template, args
        );
    }

    public Node scan() throws ErrorException {
        while(true) {
            while(Scanner.isWhitespace(this.current())) {
                this.next();
            }
            if(this.current() == STOP) { break; }
            this.markStart();
            this.scanToken();
        }
        this.mergeGoTo();
        Source whole = this.first == null
            ? this.sourceFromStart()
            : Source.span(this.first.source, this.last.source);
        Node program = new Node(Attribute.PARTICULAR_PROGRAM, "", whole);
        program.setSub(this.first);
        LOGGER.fine("scanned " + program.childCount() + " tokens");
        return program;
    }

    private void scanToken() throws ErrorException {
        char c = this.current();
        if(this.inFormat && this.formatNesting == 0) {
            if(this.scanFormatItem(c)) { return; }
        }
        if(Scanner.isUpper(c)) {
            if(this.quoteStropping) {
                this.emit(Attribute.IDENTIFIER, this.scanTag(true));
            } else {
                this.scanBoldWord();
            }
        } else if(c == '\'') {
            this.scanQuotedBoldWord();
        } else if(Scanner.isLower(c)) {
            this.emit(Attribute.IDENTIFIER, this.scanTag(this.quoteStropping));
        } else if(Scanner.isDigit(c)) {
            this.scanNumber();
        } else if(c == '.') {
            if(Scanner.isDigit(this.peek())) {
                this.scanNumber();
            } else {
                this.next();
                this.emit(Attribute.POINT_SYMBOL, ".");
            }
        } else if(c == '"') {
            this.scanString();
        } else if(c == '#') {
            this.skipPragment("#");
        } else if("()[]{},;@$".indexOf(c) != -1) {
            this.next();
            this.scanPunctuation(c);
        } else if(c == '|' || (c == '!' && this.quoteStropping)) {
            this.next();
            if(this.current() == ':') {
                this.next();
                this.emit(Attribute.BRIEF_ELIF_SYMBOL, "|:");
            } else {
                this.emit(Attribute.BAR_SYMBOL, "|");
            }
        } else if(c == ':') {
            this.scanColon();
        } else if(c == '=' || MONADS.indexOf(c) != -1
                || NOMADS.indexOf(c) != -1) {
            this.scanOperator();
        } else {
            this.next();
            throw this.scanError(
                "unworthy character '%s'",
                Character.isISOControl(c)
                    ? String.format("\\u%04x", (int) c)
                    : String.valueOf(c)
            );
        }
    }

    private String scanTag(boolean allowUpper) {
        StringBuilder tag = new StringBuilder();
        int tagLine = this.lineIdx;
        while(true) {
            char c = this.current();
            if(Scanner.isLower(c) || Scanner.isDigit(c) || c == '_'
                    || (allowUpper && Scanner.isUpper(c))) {
                tag.append(c);
                this.next();
                continue;
            }
            if(c == ' ' || c == '\t') {
                // blanks inside a tag are typographical only
                int savedColumn = this.column;
                while(this.current() == ' ' || this.current() == '\t') {
                    this.next();
                }
                char after = this.current();
                boolean continues = this.lineIdx == tagLine
                    && (Scanner.isLower(after) || Scanner.isDigit(after)
                        || (allowUpper && Scanner.isUpper(after)));
                if(continues) { continue; }
                this.column = savedColumn;
            }
            break;
        }
        return tag.toString();
    }

    private void scanBoldWord() throws ErrorException {
        StringBuilder word = new StringBuilder();
        while(Scanner.isUpper(this.current()) || this.current() == '_') {
            word.append(this.current());
            this.next();
        }
        this.boldWord(word.toString());
    }

    private void scanQuotedBoldWord() throws ErrorException {
        this.next();
        StringBuilder word = new StringBuilder();
        while(Scanner.isUpper(this.current()) || Scanner.isLower(this.current())
                || Scanner.isDigit(this.current()) || this.current() == '_') {
            word.append(this.current());
            this.next();
        }
        if(word.length() == 0 || this.current() != '\'') {
            throw this.scanError("incorrectly quoted bold word");
        }
        this.next();
        if(!this.quoteStropping && this.session.options().portability()) {
            this.session.diagnostics.report(
                Severity.WARNING, this.sourceFromStart(),
                "quoted bold word '%s' in bold stropping is not portable",
                word
            );
        }
        this.boldWord(word.toString().toUpperCase(Locale.ROOT));
    }

    private void boldWord(String word) throws ErrorException {
        if(Keywords.isPragment(word)) {
            this.skipPragment(word);
            return;
        }
        this.emit(Keywords.classify(word), word);
    }

    private void skipPragment(String terminator) throws ErrorException {
        Source start = this.sourceFromStart();
        while(true) {
            char c = this.current();
            if(c == STOP) {
                throw this.session.diagnostics.abort(
                    Severity.SYNTAX_ERROR, start,
                    "unterminated comment or pragmat, '%s' expected",
                    terminator
                );
            }
            if(terminator.equals("#")) {
                this.next();
                if(this.current() == '#') {
                    this.next();
                    return;
                }
                continue;
            }
            if(Scanner.isUpper(c) && !this.quoteStropping) {
                StringBuilder word = new StringBuilder();
                while(Scanner.isUpper(this.current())
                        || this.current() == '_') {
                    word.append(this.current());
                    this.next();
                }
                if(word.toString().equals(terminator)) { return; }
                continue;
            }
            if(c == '\'') {
                this.next();
                StringBuilder word = new StringBuilder();
                while(Character.isLetterOrDigit(this.current())) {
                    word.append(this.current());
                    this.next();
                }
                if(this.current() == '\'') {
                    this.next();
                    String bold = word.toString().toUpperCase(Locale.ROOT);
                    if(bold.equals(terminator)) { return; }
                }
                continue;
            }
            this.next();
        }
    }

    private void scanDigits(StringBuilder into) {
        while(Scanner.isDigit(this.current())) {
            into.append(this.current());
            this.next();
        }
    }

    private boolean isExponentChar(char c) {
        return c == 'e' || c == 'E' || c == '\\';
    }

    private void scanExponent(StringBuilder into) throws ErrorException {
        into.append('e');
        this.next();
        if(this.current() == '+' || this.current() == '-') {
            into.append(this.current());
            this.next();
        }
        if(!Scanner.isDigit(this.current())) {
            throw this.scanError("exponent of real denotation has no digits");
        }
        this.scanDigits(into);
    }

    private void scanNumber() throws ErrorException {
        StringBuilder number = new StringBuilder();
        if(this.inFormat && this.formatNesting == 0) {
            this.scanDigits(number);
            this.emit(Attribute.REPLICATOR, number.toString());
            return;
        }
        this.scanDigits(number);
        boolean real = false;
        if(this.current() == '.' && Scanner.isDigit(this.peek())) {
            real = true;
            if(number.length() == 0) { number.append('0'); }
            number.append('.');
            this.next();
            this.scanDigits(number);
        }
        if(this.isExponentChar(this.current())
                && (Scanner.isDigit(this.peek()) || this.peek() == '+'
                    || this.peek() == '-')) {
            real = true;
            this.scanExponent(number);
        }
        if(!real && this.current() == 'r' && number.length() > 0) {
            number.append('r');
            this.next();
            while(Scanner.isDigit(this.current())
                    || "abcdefABCDEF".indexOf(this.current()) != -1) {
                number.append(this.current());
                this.next();
            }
            this.checkRadix(number.toString());
            this.emit(Attribute.BITS_DENOTATION, number.toString());
            return;
        }
        this.emit(
            real? Attribute.REAL_DENOTATION : Attribute.INT_DENOTATION,
            number.toString()
        );
    }

    private void checkRadix(String denotation) throws ErrorException {
        int r = denotation.indexOf('r');
        int radix = Integer.parseInt(denotation.substring(0, r));
        if(radix != 2 && radix != 4 && radix != 8 && radix != 16) {
            throw this.scanError("radix %d is not 2, 4, 8 or 16", radix);
        }
        String digits = denotation.substring(r + 1);
        if(digits.isEmpty()) {
            throw this.scanError("bits denotation has no digits");
        }
        for(int idx = 0; idx < digits.length(); idx += 1) {
            if(Character.digit(digits.charAt(idx), radix) == -1) {
                throw this.scanError(
                    "digit '%s' is not valid in radix %d",
                    digits.charAt(idx), radix
                );
            }
        }
    }

    private void scanString() throws ErrorException {
        int line = this.lineIdx;
        StringBuilder text = new StringBuilder();
        this.next();
        while(true) {
            char c = this.current();
            if(c == STOP || this.lineIdx != line || c == '\n') {
                throw this.scanError("unterminated string denotation");
            }
            this.next();
            if(c == '"') {
                if(this.current() == '"') {
                    text.append('"');
                    this.next();
                    continue;
                }
                break;
            }
            text.append(c);
        }
        this.emit(
            this.inFormat && this.formatNesting == 0
                ? Attribute.LITERAL
                : Attribute.ROW_CHAR_DENOTATION,
            text.toString()
        );
    }

    private boolean scanFormatItem(char c) {
        String items = this.quoteStropping
            ? "/%\\+-.ABCDEFGHIJKLMNOPQRSTUVWXYZ"
            : "/%\\+-.abcdefghijklmnopqrstuvwxyz";
        if(items.indexOf(c) == -1) { return false; }
        this.next();
        this.emit(Attribute.FORMAT_ITEM, String.valueOf(c));
        return true;
    }

    private void scanPunctuation(char c) {
        switch(c) {
            case '(': {
                if(this.inFormat) { this.formatNesting += 1; }
                this.emit(Attribute.OPEN_SYMBOL, "(");
                break;
            }
            case ')': {
                if(this.inFormat && this.formatNesting > 0) {
                    this.formatNesting -= 1;
                }
                this.emit(Attribute.CLOSE_SYMBOL, ")");
                break;
            }
            case '[': this.emit(Attribute.SUB_SYMBOL, "["); break;
            case ']': this.emit(Attribute.BUS_SYMBOL, "]"); break;
            case '{': this.emit(Attribute.ACCO_SYMBOL, "{"); break;
            case '}': this.emit(Attribute.OCCA_SYMBOL, "}"); break;
            case ',': this.emit(Attribute.COMMA_SYMBOL, ","); break;
            case ';': this.emit(Attribute.SEMICOLON_SYMBOL, ";"); break;
            case '@': this.emit(Attribute.AT_SYMBOL, "@"); break;
            case '$': {
                this.inFormat = !this.inFormat;
                this.formatNesting = 0;
                this.emit(Attribute.FORMAT_DELIMITER_SYMBOL, "$");
                break;
            }
            default:
                throw new IllegalStateException("unhandled punctuation!");
        }
    }

    private void scanColon() throws ErrorException {
        this.next();
        if(this.current() == '=') {
            this.next();
            if(this.current() == ':') {
                this.next();
                this.emit(Attribute.IS_SYMBOL, ":=:");
            } else {
                this.emit(Attribute.BECOMES_SYMBOL, ":=");
            }
            return;
        }
        if(this.current() == '/' && this.peek() == '=') {
            this.next();
            this.next();
            if(this.current() != ':') {
                throw this.scanError("':/=:' is incomplete");
            }
            this.next();
            this.emit(Attribute.ISNT_SYMBOL, ":/=:");
            return;
        }
        this.emit(Attribute.COLON_SYMBOL, ":");
    }

    private void scanOperator() throws ErrorException {
        StringBuilder symbol = new StringBuilder();
        char c = this.current();
        symbol.append(c);
        this.next();
        if(NOMADS.indexOf(this.current()) != -1 && this.current() != '=') {
            symbol.append(this.current());
            this.next();
        } else if(this.current() == '=' && c != '=') {
            if(this.peek() == ':') {
                // an assigning operator like '+=:'
                symbol.append("=:");
                this.next();
                this.next();
                this.emit(Attribute.OPERATOR, symbol.toString());
                return;
            }
            symbol.append('=');
            this.next();
        }
        if(this.current() == ':' && this.peek() == '=') {
            symbol.append(":=");
            this.next();
            this.next();
        } else if(this.current() == '=' && this.peek() == ':') {
            symbol.append("=:");
            this.next();
            this.next();
        }
        String text = symbol.toString();
        if(text.equals("=")) {
            this.emit(Attribute.EQUALS_SYMBOL, text);
        } else {
            this.emit(Attribute.OPERATOR, text);
        }
    }

    private void mergeGoTo() {
        for(Node token = this.first; token != null; token = token.next()) {
            if(!token.is(Attribute.GO_SYMBOL)) { continue; }
            Node to = token.next();
            if(to == null || !to.is(Attribute.TO_SYMBOL)) { continue; }
            Node merged = new Node(
                Attribute.GOTO_SYMBOL, "GOTO",
                Source.span(token.source, to.source)
            );
            if(this.session.options().portability()) {
                this.session.diagnostics.report(
                    Severity.WARNING, merged.source,
                    "'GO TO' written as two words is not portable"
                );
            }
            Node before = token.previous();
            Node after = to.next();
            Node.link(before, merged);
            Node.link(merged, after);
            if(token == this.first) { this.first = merged; }
            if(to == this.last) { this.last = merged; }
            token = merged;
        }
    }

}
