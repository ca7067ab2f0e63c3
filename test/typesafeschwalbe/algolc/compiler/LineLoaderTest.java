package typesafeschwalbe.algolc.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

public class LineLoaderTest {

    @Test
    public void splitsLinesAndKeepsOffsets() {
        List<SourceLine> lines = LineLoader.load("a.a68", "BEGIN\r\n  SKIP\nEND");
        assertEquals(3, lines.size());
        assertEquals("BEGIN", lines.get(0).text());
        assertEquals("  SKIP", lines.get(1).text());
        assertEquals(2, lines.get(1).number());
        assertEquals(7, lines.get(1).offset());
        assertEquals("a.a68", lines.get(2).file());
    }

    @Test
    public void joinsContinuedLines() {
        List<SourceLine> lines = LineLoader.load("a.a68", "print (1 +\\\n2)\nSKIP");
        assertEquals(2, lines.size());
        assertEquals("print (1 +2)", lines.get(0).text());
        assertEquals(1, lines.get(0).number());
        assertEquals(3, lines.get(1).number());
    }

    @Test
    public void emptyContentIsOneEmptyLine() {
        List<SourceLine> lines = LineLoader.load("a.a68", "");
        assertEquals(1, lines.size());
        assertEquals("", lines.get(0).text());
    }

}
