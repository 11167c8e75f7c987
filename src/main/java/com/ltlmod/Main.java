package com.ltlmod;

import static com.google.common.base.Preconditions.checkArgument;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.common.base.Stopwatch;
import com.google.gson.GsonBuilder;
import com.ltlmod.algorithm.BranchingInterpreter;
import com.ltlmod.algorithm.Ltl;
import com.ltlmod.algorithm.UnmodifiedRunner;
import com.ltlmod.example.Modification;
import com.ltlmod.example.TraceContext;
import com.ltlmod.example.TraceDomain;
import com.ltlmod.example.Traces;
import com.ltlmod.model.Formula;
import com.ltlmod.output.Formatter;
import com.ltlmod.program.Program;
import com.ltlmod.program.Result;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine;

@Command(
    name = "ltlmod",
    mixinStandardHelpOptions = true,
    version = "LTL Modification Engine 0.1",
    description = "Enumerates every placement of a temporally scheduled modification on an example trace")
public final class Main implements Callable<Void> {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    public enum Pattern {
        NONE, SOMEWHERE, EVERYWHERE
    }

    private static PrintStream open(String output) throws IOException {
        return "-".equals(output)
            ? System.out
            : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))));
    }

    @Option(
        names = {"-t", "--trace"},
        description = "Example trace to run, 1 to " + Traces.COUNT + ", default: ${DEFAULT-VALUE}")
    private int trace = 1;

    @Option(
        names = {"-m", "--modification"},
        description = "Modification to place. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private Modification modification = Modification.A;

    @Option(
        names = {"-p", "--pattern"},
        description = "Where to place the modification. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private Pattern pattern = Pattern.SOMEWHERE;

    @Option(
        names = {"--initial"},
        description = "Initial state, default: ${DEFAULT-VALUE}")
    private int initial = -1;

    @Option(
        names = {"--json"},
        description = "Write the branches as JSON")
    private boolean json = false;

    @Option(
        names = {"-O", "--output"},
        description = "Write the surviving branches")
    private String writeOutput = "-";

    @Option(
        names = {"-v", "--verbose"},
        description = "Log pruning of branches")
    private boolean verbose = false;

    private Main() {}

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args));
    }

    static Formula<Modification> formula(Pattern pattern, Modification modification) {
        return switch (pattern) {
            case NONE -> Formula.truth();
            case SOMEWHERE -> Ltl.somewhere(modification);
            case EVERYWHERE -> Ltl.everywhere(modification);
        };
    }

    private <A> List<Result<TraceContext<Integer>, A>> explore(Program<A> program) {
        TraceDomain<Integer> domain = new TraceDomain<>();
        TraceContext<Integer> start = TraceContext.initial(initial);
        if (pattern == Pattern.NONE) {
            return new UnmodifiedRunner<>(domain).run(program, start);
        }
        var interpreter =
            new BranchingInterpreter<TraceContext<Integer>, Modification>(Modification.class, domain, domain);
        return interpreter.runDefault(Ltl.modify(formula(pattern, modification), program), start);
    }

    static void configureLogging() {
        Logger root = Logger.getLogger("com.ltlmod");
        root.setLevel(Level.FINE);
        root.setUseParentHandlers(false);
        if (root.getHandlers().length == 0) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            root.addHandler(handler);
        }
    }

    @Override
    public Void call() throws Exception {
        checkArgument(1 <= trace && trace <= Traces.COUNT, "Invalid trace %s", trace);
        if (verbose) {
            configureLogging();
        }

        Stopwatch timer = Stopwatch.createStarted();
        List<? extends Result<TraceContext<Integer>, ?>> results = explore(Traces.trace(trace));
        log.log(Level.INFO, () -> "Found %d branches for %s in %s"
            .formatted(results.size(), formula(pattern, modification), timer));

        try (var stream = open(writeOutput)) {
            if (json) {
                stream.println(new GsonBuilder().setPrettyPrinting().create().toJson(Formatter.toJson(results)));
            } else {
                for (Result<TraceContext<Integer>, ?> result : results) {
                    stream.println(Formatter.format(result));
                }
            }
        }
        return null;
    }
}
