package typesafeschwalbe.algolc.compiler.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.CompilationSession;
import typesafeschwalbe.algolc.compiler.ErrorException;
import typesafeschwalbe.algolc.compiler.Options;
import typesafeschwalbe.algolc.compiler.Programs;
import typesafeschwalbe.algolc.compiler.Severity;
import typesafeschwalbe.algolc.compiler.modes.MultiPrecision;

public class ScannerTest {

    private static List<Node> tokens(String text) throws ErrorException {
        Node program = Programs.scan(Programs.session(), text);
        return program.children();
    }

    private static List<Attribute> attributes(List<Node> tokens) {
        List<Attribute> attributes = new ArrayList<>();
        for(Node token: tokens) {
            attributes.add(token.attribute());
        }
        return attributes;
    }

    @Test
    public void classifiesWordsAndSymbols() throws ErrorException {
        List<Node> tokens = ScannerTest.tokens("BEGIN INT x := 1; x END");
        assertEquals(List.of(
            Attribute.BEGIN_SYMBOL, Attribute.BOLD_TAG, Attribute.IDENTIFIER,
            Attribute.BECOMES_SYMBOL, Attribute.INT_DENOTATION,
            Attribute.SEMICOLON_SYMBOL, Attribute.IDENTIFIER,
            Attribute.END_SYMBOL
        ), ScannerTest.attributes(tokens));
        assertEquals("INT", tokens.get(1).symbol);
    }

    @Test
    public void blanksInsideTagsAreIgnored() throws ErrorException {
        List<Node> tokens = ScannerTest.tokens("long name := 1");
        assertEquals("longname", tokens.get(0).symbol);
        assertEquals(3, tokens.size());
    }

    @Test
    public void scansDenotations() throws ErrorException {
        List<Node> tokens = ScannerTest.tokens("16rff 1.5E3 .5 2\\-1 42");
        assertEquals(Attribute.BITS_DENOTATION, tokens.get(0).attribute());
        assertEquals("16rff", tokens.get(0).symbol);
        assertEquals(Attribute.REAL_DENOTATION, tokens.get(1).attribute());
        assertEquals("1.5e3", tokens.get(1).symbol);
        assertEquals("0.5", tokens.get(2).symbol);
        assertEquals("2e-1", tokens.get(3).symbol);
        assertEquals(Attribute.INT_DENOTATION, tokens.get(4).attribute());
    }

    @Test
    public void doubledQuotesStandForOneQuote() throws ErrorException {
        List<Node> tokens = ScannerTest.tokens("\"say \"\"hi\"\"\"");
        assertEquals(1, tokens.size());
        assertEquals(Attribute.ROW_CHAR_DENOTATION, tokens.get(0).attribute());
        assertEquals("say \"hi\"", tokens.get(0).symbol);
    }

    @Test
    public void skipsCommentsAndPragmats() throws ErrorException {
        List<Node> tokens = ScannerTest.tokens(
            "# one # SKIP CO two CO COMMENT three COMMENT PR nowarnings PR"
        );
        assertEquals(List.of(Attribute.SKIP_SYMBOL), ScannerTest.attributes(tokens));
    }

    @Test
    public void quoteStroppingReadsQuotedBoldWords() throws ErrorException {
        CompilationSession session = new CompilationSession(
            Options.defaults().withStropping(Options.Stropping.QUOTE),
            MultiPrecision.DEFAULT
        );
        List<Node> tokens = Programs.scan(
            session, "'begin' 'int' Max Value = 1 'end'"
        ).children();
        assertEquals(Attribute.BEGIN_SYMBOL, tokens.get(0).attribute());
        assertEquals(Attribute.BOLD_TAG, tokens.get(1).attribute());
        assertEquals(Attribute.IDENTIFIER, tokens.get(2).attribute());
        assertEquals("MaxValue", tokens.get(2).symbol);
        assertEquals(Attribute.END_SYMBOL, tokens.get(5).attribute());
    }

    @Test
    public void rejectsUnworthyCharacters() {
        CompilationSession session = Programs.session();
        ErrorException e = assertThrows(
            ErrorException.class, () -> Programs.scan(session, "x := `")
        );
        assertEquals(Severity.SYNTAX_ERROR, e.diagnostic.severity());
        assertEquals("unworthy character '`'", e.diagnostic.message());
    }

    @Test
    public void rejectsBadRadix() {
        ErrorException e = assertThrows(
            ErrorException.class, () -> ScannerTest.tokens("3r12")
        );
        assertEquals("radix 3 is not 2, 4, 8 or 16", e.diagnostic.message());
    }

    @Test
    public void rejectsUnterminatedText() {
        ErrorException string = assertThrows(
            ErrorException.class, () -> ScannerTest.tokens("\"open\nSKIP")
        );
        assertEquals(
            "unterminated string denotation", string.diagnostic.message()
        );
        ErrorException comment = assertThrows(
            ErrorException.class, () -> ScannerTest.tokens("SKIP # open")
        );
        assertEquals(
            "unterminated comment or pragmat, '#' expected",
            comment.diagnostic.message()
        );
    }

}
