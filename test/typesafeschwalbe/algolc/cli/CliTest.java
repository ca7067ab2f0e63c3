package typesafeschwalbe.algolc.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.algolc.compiler.Result;

public class CliTest {

    private static final Cli.Flag VERBOSE = new Cli.Flag(
        'v', "verbose", "talks a lot"
    );
    private static final Cli.Option OUTPUT = new Cli.Option(
        'o', "output", "where to write", "file"
    );

    private static Cli cli() {
        return new Cli().add(VERBOSE).add(OUTPUT);
    }

    @Test
    public void parsesFlagsOptionsAndFreeArguments() {
        Result<Cli.Values> result = CliTest.cli().parse(
            new String[] { "-v", "--output", "out.txt", "main.a68" }
        );
        assertTrue(result.isValue());
        Cli.Values values = result.getValue();
        assertTrue(values.get(VERBOSE));
        assertEquals(Optional.of("out.txt"), values.get(OUTPUT));
        assertEquals(List.of("main.a68"), values.free());
        assertFalse(values.helpRequested());
    }

    @Test
    public void absentArgumentsHaveDefaults() {
        Cli.Values values = CliTest.cli().parse(new String[0]).getValue();
        assertFalse(values.get(VERBOSE));
        assertEquals(Optional.empty(), values.get(OUTPUT));
        assertTrue(values.free().isEmpty());
    }

    @Test
    public void recognisesHelp() {
        Cli cli = CliTest.cli();
        assertTrue(cli.parse(new String[] { "-h" }).getValue().helpRequested());
        String help = cli.help();
        assertTrue(help.startsWith("Usage: algolc [arguments] <file>\n"));
        assertTrue(help.contains("--output <file>"));
        assertTrue(help.contains("--verbose"));
    }

    @Test
    public void rejectsUnknownArguments() {
        Result<Cli.Values> result = CliTest.cli().parse(
            new String[] { "--frobnicate" }
        );
        assertTrue(result.isError());
        assertEquals(
            "'--frobnicate' is not a valid argument",
            result.getError().get(0).message()
        );
        assertTrue(CliTest.cli().parse(new String[] { "-vv" }).isError());
    }

    @Test
    public void rejectsOptionsWithoutValue() {
        Result<Cli.Values> result = CliTest.cli().parse(
            new String[] { "-o", "-v" }
        );
        assertTrue(result.isError());
        assertEquals(
            "'-o' does not have a value specified",
            result.getError().get(0).message()
        );
    }

    @Test
    public void rejectsDuplicateRegistrations() {
        assertThrows(
            IllegalArgumentException.class,
            () -> CliTest.cli().add(new Cli.Flag('x', "verbose", "again"))
        );
    }

    @Test
    public void unregisteredArgumentsCannotBeQueried() {
        Cli.Values values = CliTest.cli().parse(new String[0]).getValue();
        assertThrows(
            IllegalArgumentException.class,
            () -> values.get(new Cli.Flag('q', "quiet", "hush"))
        );
    }

}
