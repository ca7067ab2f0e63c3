package typesafeschwalbe.algolc.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import typesafeschwalbe.algolc.compiler.Error;
import typesafeschwalbe.algolc.compiler.Result;

public class Cli {

    private interface Argument {
        char shortName();
        String longName();
        String description();
        String valueDescription();
        boolean hasValue();
    }

    public static record Option(
        char shortName, String longName, String description,
        String valueDescription
    ) implements Argument {
        @Override public boolean hasValue() { return true; }
    }

    public static record Flag(
        char shortName, String longName, String description
    ) implements Argument {
        @Override public boolean hasValue() { return false; }
        @Override public String valueDescription() { return null; }
    }


    public static class Values {

        private final Map<Option, Optional<String>> options;
        private final Map<Flag, Boolean> flags;
        private final List<String> free;
        private final boolean help;

        private Values(
            Map<Option, Optional<String>> options,
            Map<Flag, Boolean> flags,
            List<String> free,
            boolean help
        ) {
            this.options = options;
            this.flags = flags;
            this.free = free;
            this.help = help;
        }

        public Optional<String> get(Option option) {
            if(!this.options.containsKey(option)) {
                throw new IllegalArgumentException(
                    "The given option was not registered!"
                );
            }
            return this.options.get(option);
        }

        public boolean get(Flag flag) {
            if(!this.flags.containsKey(flag)) {
                throw new IllegalArgumentException(
                    "The given flag was not registered!"
                );
            }
            return this.flags.get(flag);
        }

        public List<String> free() {
            return this.free;
        }

        public boolean helpRequested() {
            return this.help;
        }

    }


    private static final Flag HELP = new Flag(
        'h', "help", "displays a list of all available arguments"
    );

    private final List<Option> options;
    private final List<Flag> flags;
    private final Set<String> registered;

    public Cli() {
        this.options = new ArrayList<>();
        this.flags = new ArrayList<>();
        this.registered = new HashSet<>();
        this.add(Cli.HELP);
    }

    private void register(Argument arg) {
        if(this.registered.contains(arg.longName())) {
            throw new IllegalArgumentException(
                "The argument '" + arg.longName() + "' was already registered!"
            );
        }
        this.registered.add(arg.longName());
    }

    public Cli add(Option option) {
        this.register(option);
        this.options.add(option);
        return this;
    }

    public Cli add(Flag flag) {
        this.register(flag);
        this.flags.add(flag);
        return this;
    }

    private static Result<Values> invalidArgument(String arg) {
        return Result.ofError(new Error(
            "'" + arg + "' is not a valid argument"
        ));
    }

    private static Result<Values> missingValue(String arg) {
        return Result.ofError(new Error(
            "'" + arg + "' does not have a value specified"
        ));
    }

    private Argument lookUpArgument(String longName) {
        for(Option arg: this.options) {
            if(arg.longName().equals(longName)) { return arg; }
        }
        for(Flag arg: this.flags) {
            if(arg.longName().equals(longName)) { return arg; }
        }
        return null;
    }

    private Argument lookUpArgument(char shortName) {
        for(Option arg: this.options) {
            if(arg.shortName() == shortName) { return arg; }
        }
        for(Flag arg: this.flags) {
            if(arg.shortName() == shortName) { return arg; }
        }
        return null;
    }

    private static void appendHelp(StringBuilder output, Argument arg) {
        String value = arg.hasValue()? " <" + arg.valueDescription() + ">" : "";
        output.append("    -").append(arg.shortName()).append(value);
        output.append("\n");
        output.append("    --").append(arg.longName()).append(value);
        output.append("\n");
        output.append("                ").append(arg.description());
        output.append("\n");
    }

    public String help() {
        StringBuilder output = new StringBuilder();
        output.append("Usage: algolc [arguments] <file>\n");
        output.append("List of available arguments:\n");
        for(Option arg: this.options) {
            Cli.appendHelp(output, arg);
        }
        for(Flag arg: this.flags) {
            Cli.appendHelp(output, arg);
        }
        return output.toString();
    }

    public Result<Values> parse(String[] args) {
        Map<Option, Optional<String>> options = new HashMap<>();
        Map<Flag, Boolean> flags = new HashMap<>();
        List<String> free = new ArrayList<>();
        for(int argIdx = 0; argIdx < args.length; argIdx += 1) {
            String arg = args[argIdx];
            Argument argObj;
            if(arg.startsWith("--")) {
                argObj = this.lookUpArgument(arg.substring(2));
            } else if(arg.startsWith("-") && arg.length() > 1) {
                if(arg.length() > 2) {
                    return Cli.invalidArgument(arg);
                }
                argObj = this.lookUpArgument(arg.charAt(1));
            } else {
                free.add(arg);
                continue;
            }
            if(argObj == null) {
                return Cli.invalidArgument(arg);
            }
            if(argObj.hasValue()) {
                if(argIdx + 1 >= args.length
                        || args[argIdx + 1].startsWith("-")) {
                    return Cli.missingValue(arg);
                }
                options.put((Option) argObj, Optional.of(args[argIdx + 1]));
                argIdx += 1;
            } else {
                flags.put((Flag) argObj, true);
            }
        }
        for(Option arg: this.options) {
            options.putIfAbsent(arg, Optional.empty());
        }
        for(Flag arg: this.flags) {
            flags.putIfAbsent(arg, false);
        }
        return Result.ofValue(new Values(
            options, flags, free, flags.get(Cli.HELP)
        ));
    }

}
