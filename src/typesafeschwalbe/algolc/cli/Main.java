package typesafeschwalbe.algolc.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import typesafeschwalbe.algolc.compiler.Compiler;
import typesafeschwalbe.algolc.compiler.Diagnostic;
import typesafeschwalbe.algolc.compiler.Error;
import typesafeschwalbe.algolc.compiler.LineLoader;
import typesafeschwalbe.algolc.compiler.Options;
import typesafeschwalbe.algolc.compiler.Result;

public class Main {

    private static final Cli.Flag QUOTE = new Cli.Flag(
        'q', "quote", "reads bold words in quote stropping ('begin')"
    );
    private static final Cli.Flag BRACKETS = new Cli.Flag(
        'b', "brackets", "accepts [ ] and { } as parentheses for clauses"
    );
    private static final Cli.Flag PORTCHECK = new Cli.Flag(
        'p', "portcheck", "warns about constructs that are not portable"
    );
    private static final Cli.Flag REDUCTIONS = new Cli.Flag(
        'r', "reductions", "prints every reduction of the bottom-up parser"
    );
    private static final Cli.Flag NO_WARNINGS = new Cli.Flag(
        'w', "nowarnings", "suppresses warnings"
    );
    private static final Cli.Flag NO_COLOR = new Cli.Flag(
        'c', "nocolor", "disables colored output"
    );
    private static final Cli.Flag VERBOSE = new Cli.Flag(
        'v', "verbose", "logs the progress of every compiler phase"
    );
    private static final Cli.Flag TREE = new Cli.Flag(
        't', "tree", "prints the annotated syntax tree"
    );

    public static void main(String[] args) {
        // color is always disabled if we think we are on Windows
        boolean onWindows = System.getProperty("os.name")
            .toLowerCase().contains("win");
        Cli cli = new Cli()
            .add(QUOTE).add(BRACKETS).add(PORTCHECK).add(REDUCTIONS)
            .add(NO_WARNINGS).add(NO_COLOR).add(VERBOSE).add(TREE);
        Result<Cli.Values> cliParseResult = cli.parse(args);
        if(cliParseResult.isError()) {
            Main.exitWithErrors(
                cliParseResult.getError(), new HashMap<>(), !onWindows
            );
            return;
        }
        Cli.Values cliValues = cliParseResult.getValue();
        if(cliValues.helpRequested()) {
            System.out.print(cli.help());
            System.exit(0);
            return;
        }
        boolean colored = !cliValues.get(NO_COLOR) && !onWindows;
        if(cliValues.get(VERBOSE)) {
            Main.enableLogging();
        }
        if(cliValues.free().size() != 1) {
            Main.exitWithErrors(
                List.of(new Error("exactly one source file must be given")),
                new HashMap<>(), colored
            );
            return;
        }
        String fileName = cliValues.free().get(0);
        Map<String, String> files = new HashMap<>();
        String content;
        try {
            content = new String(
                Files.readAllBytes(Paths.get(fileName)), StandardCharsets.UTF_8
            );
        } catch(IOException e) {
            Main.exitWithErrors(
                List.of(new Error(
                    "Unable to read file '" + fileName + "': "
                        + "'" + e.getMessage() + "'"
                )),
                files, colored
            );
            return;
        }
        files.put(fileName, content);
        Options options = Options.defaults()
            .withStropping(cliValues.get(QUOTE)
                ? Options.Stropping.QUOTE
                : Options.Stropping.BOLD)
            .withBrackets(cliValues.get(BRACKETS))
            .withPortability(cliValues.get(PORTCHECK))
            .withReductions(cliValues.get(REDUCTIONS))
            .withWarnings(!cliValues.get(NO_WARNINGS));
        Compiler.Compilation compilation = Compiler.compile(
            LineLoader.load(fileName, content), options
        );
        if(compilation.session().options().reductions()) {
            for(String line: compilation.session().reductionTrace()) {
                System.out.println(line);
            }
        }
        if(cliValues.get(TREE) && compilation.program() != null) {
            System.out.print(compilation.program().toTreeString(
                compilation.session()::modeName
            ));
        }
        for(Diagnostic diagnostic: compilation.diagnostics()) {
            System.err.print(diagnostic.toError().render(files, colored));
        }
        if(!compilation.succeeded()) {
            System.exit(1);
        }
    }

    private static void enableLogging() {
        Logger root = Logger.getLogger("typesafeschwalbe.algolc");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
        root.setLevel(Level.FINE);
        root.setUseParentHandlers(false);
    }

    private static void exitWithErrors(
        List<Error> errors, Map<String, String> files, boolean colored
    ) {
        for(Error error: errors) {
            System.err.print(error.render(files, colored));
        }
        System.exit(1);
    }

}
