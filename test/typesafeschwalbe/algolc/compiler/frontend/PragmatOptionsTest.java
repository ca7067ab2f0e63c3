package typesafeschwalbe.algolc.compiler.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.Diagnostics;
import typesafeschwalbe.algolc.compiler.LineLoader;
import typesafeschwalbe.algolc.compiler.Options;
import typesafeschwalbe.algolc.compiler.Programs;

public class PragmatOptionsTest {

    private static Options apply(String text, Diagnostics diagnostics) {
        return new PragmatOptions(
            LineLoader.load("test.a68", text), diagnostics
        ).apply(Options.defaults());
    }

    @Test
    public void readsDirectives() {
        Diagnostics diagnostics = new Diagnostics();
        Options options = PragmatOptionsTest.apply(
            "PR quote portcheck brackets PR 'begin' 'skip' 'end'", diagnostics
        );
        assertEquals(Options.Stropping.QUOTE, options.stropping());
        assertTrue(options.portability());
        assertTrue(options.brackets());
        assertTrue(diagnostics.all().isEmpty());
    }

    @Test
    public void ignoresPragmatWordsInStringsAndComments() {
        Options options = PragmatOptionsTest.apply(
            "BEGIN print (\"PR nowarnings PR\") CO PR nowarnings PR CO END",
            new Diagnostics()
        );
        assertTrue(options.warnings());
    }

    @Test
    public void warnsAboutUnknownDirectives() {
        Diagnostics diagnostics = new Diagnostics();
        Options options = PragmatOptionsTest.apply(
            "PRAGMAT frobnicate nowarnings PRAGMAT SKIP", diagnostics
        );
        assertFalse(options.warnings());
        assertTrue(Programs.mentions(
            diagnostics.warnings(), "unrecognised option 'frobnicate'"
        ));
    }

}
