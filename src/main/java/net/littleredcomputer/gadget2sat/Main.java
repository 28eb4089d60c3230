package net.littleredcomputer.gadget2sat;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class Main {
    private static final Joiner spaceJoiner = Joiner.on(' ');

    private static Options options() {
        return new Options()
                .addOption("task", true, "one of transform, decide, solve")
                .addOption("problem", true, "filename of problem description, or - for stdin")
                .addOption("format", true, "format of problem file: cnf, simple or auto")
                .addOption("maxsubsets", true, "most candidate assignments the filter search may try")
                .addOption("maxduration", true, "longest the filter search may run, in ISO-8601 format")
                .addOption("threads", true, "worker threads for the filter search")
                .addOption("models", true, "number of distinct models to print")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format")
                .addOption("out", true, "file to receive a copy of the results");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(p), StandardCharsets.UTF_8));
    }

    private static Formula formula(CommandLine cmd, ClauseKind kind) throws IOException {
        String text;
        try (Reader r = problem(cmd)) {
            text = CharStreams.toString(r);
        }
        switch (cmd.getOptionValue("format", "auto")) {
            case "cnf": return Formula.parseFrom(text, kind);
            case "simple":
                if (kind != ClauseKind.THREE) throw new IllegalArgumentException("simple format holds 3-CNF only");
                return Formula.parseSimple(text);
            case "auto": return kind == ClauseKind.THREE ? Formula.parse3CNF(text) : Formula.parseFrom(text, kind);
            default: throw new IllegalArgumentException("unknown problem format");
        }
    }

    private static SearchBudget budget(CommandLine cmd) {
        SearchBudget b = SearchBudget.unlimited();
        if (cmd.hasOption("maxsubsets")) b = b.withMaxSubsets(Long.parseLong(cmd.getOptionValue("maxsubsets")));
        if (cmd.hasOption("maxduration")) b = b.withMaxDuration(Duration.parse(cmd.getOptionValue("maxduration")));
        return b;
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static String modelLine(Assignment a) {
        StringBuilder sb = new StringBuilder("v ");
        for (int i = 0; i < a.size(); ++i) sb.append(a.get(i) ? i + 1 : -i - 1).append(' ');
        return sb.append('0').toString();
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        List<String> out = new ArrayList<>();
        switch (task) {
            case "transform": {
                Transformation t = ClauseTransformer.transform(formula(cmd, ClauseKind.THREE));
                out.add(t.transformed().toDimacs(spaceJoiner.join(args),
                        "auxiliary variables by clause: " + t.auxiliaryMap()).trim());
                break;
            }
            case "decide": {
                Formula psi = formula(cmd, ClauseKind.TWO);
                Stopwatch sw = Stopwatch.createStarted();
                DecisionResult d = TwoSATDecider.decide(psi);
                out.add("c " + sw);
                if (d.isSatisfiable()) {
                    out.add("s SATISFIABLE");
                    out.add(modelLine(d.assignment().get()));
                } else {
                    out.add("c variable " + (d.conflictVariable().getAsInt() + 1) + " implies its negation and vice versa");
                    out.add("s UNSATISFIABLE");
                }
                break;
            }
            case "solve": {
                Formula phi = formula(cmd, ClauseKind.THREE);
                Pipeline p = new Pipeline(phi)
                        .setBudget(budget(cmd))
                        .setThreads(Integer.parseInt(cmd.getOptionValue("threads", "1")))
                        .setLogInterval(logInterval(cmd));
                Stopwatch sw = Stopwatch.createStarted();
                PipelineResult r = p.run();
                out.add("c " + sw);
                r.statistics().ifPresent(s -> out.add("c " + s));
                switch (r.outcome()) {
                    case SATISFIABLE: {
                        out.add("s SATISFIABLE");
                        int models = Integer.parseInt(cmd.getOptionValue("models", "1"));
                        List<Assignment> ms = models > 1 ? p.survivors(models) : List.of(r.assignment().get());
                        for (Assignment m : ms) out.add(modelLine(m));
                        break;
                    }
                    case UNSAT_EARLY:
                        out.add("c the 2-CNF relaxation is unsatisfiable");
                        out.add("s UNSATISFIABLE");
                        break;
                    case FILTER_EXHAUSTED:
                        out.add("c every model of the 2-CNF relaxation is spurious");
                        out.add("s UNSATISFIABLE");
                        break;
                    case BUDGET_EXCEEDED:
                        out.add("c filter search budget exceeded");
                        out.add("s UNKNOWN");
                        break;
                    default:
                        throw new IllegalStateException("unexpected outcome " + r.outcome());
                }
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
        out.forEach(System.out::println);
        if (cmd.hasOption("out")) {
            Files.asCharSink(new File(cmd.getOptionValue("out")), StandardCharsets.UTF_8).writeLines(out);
        }
    }
}
