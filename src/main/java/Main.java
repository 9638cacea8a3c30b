import automaton.AhoCorasick;
import automaton.AutomatonConfiguration;
import automaton.AutomatonStats;
import automaton.CompiledAutomaton;
import automaton.MatchCursor;
import datagenerators.Generator;
import search.EmptyPatternException;
import search.Match;
import search.PatternSet;
import utilities.AhoLogger;
import utilities.LineFileReader;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Command-line front end: reads patterns (one per line) and a text, prints every match as
 * {@code patternId<TAB>start<TAB>end<TAB>pattern}. With {@code --benchmark} it instead times the
 * automaton against the regex baseline on a generated or supplied workload.
 */
public final class Main {

    private static final int DEFAULT_TEXT_LENGTH = 1 << 20;
    private static final int DEFAULT_PATTERN_COUNT = 1_000;
    private static final int DEFAULT_MIN_PATTERN_LEN = 2;
    private static final int DEFAULT_MAX_PATTERN_LEN = 12;
    private static final long DEFAULT_SEED = 42L;

    public static void main(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CliOptions.USAGE);
            System.exit(2);
            return;
        }
        System.exit(run(options, System.out, System.err));
    }

    static int run(CliOptions options, PrintStream out) {
        return run(options, out, System.err);
    }

    // Exit codes: 0 ok, 1 unreadable input, failed build or benchmark disagreement, 2 usage error.
    static int run(CliOptions options, PrintStream out, PrintStream err) {
        try {
            if (options.benchmark) {
                return runBenchmark(options, out);
            }
            return runSearch(options, out, err);
        } catch (UncheckedIOException e) {
            AhoLogger.error("Cannot read input: " + e.getMessage());
            err.println(e.getMessage());
            return 1;
        }
    }

    private static int runSearch(CliOptions options, PrintStream out, PrintStream err) {
        if (options.patternsFile == null) {
            err.println("--patterns is required");
            err.println(CliOptions.USAGE);
            return 2;
        }
        String text = options.inlineText;
        if (options.textFile == null && text == null) {
            err.println("Either --text or --input is required");
            err.println(CliOptions.USAGE);
            return 2;
        }

        List<String> patterns = LineFileReader.readLines(options.patternsFile, true);
        if (options.textFile != null) {
            text = LineFileReader.readText(options.textFile);
        }

        AutomatonConfiguration configuration = AutomatonConfiguration.builder()
                .symbolKind(options.bytes ? AutomatonConfiguration.SymbolKind.BYTE : AutomatonConfiguration.SymbolKind.CHAR)
                .expectedPatterns(patterns.size())
                .collectStats(options.stats)
                .measureMemory(options.stats && options.memory)
                .build();

        AhoCorasick builder = AhoCorasick.builder(configuration).addPatterns(patterns);
        CompiledAutomaton automaton;
        try {
            automaton = builder.build();
        } catch (EmptyPatternException e) {
            AhoLogger.error("Cannot build automaton: " + e.getMessage());
            return 1;
        }

        if (options.stats) {
            AutomatonStats stats = builder.lastStats();
            out.printf(Locale.ROOT, "# patterns=%d states=%d columns=%d outputs=%d maxDepth=%d build=%.3fms bytes=%d%n",
                    stats.patternCount(), stats.stateCount(), stats.columns(), stats.outputEntries(),
                    stats.maxDepth(), stats.buildMillis(), stats.retainedBytes());
        }

        if (options.countOnly) {
            out.println(automaton.countMatches(text));
            return 0;
        }

        PatternSet set = automaton.patterns();
        MatchCursor cursor = automaton.scan(text);
        long printed = 0;
        while (printed < options.limit && cursor.hasNext()) {
            Match m = cursor.next();
            out.println(m.patternId() + "\t" + m.startPosition(set) + "\t" + m.endPosition() + "\t"
                    + set.get(m.patternId()).text());
            printed++;
        }
        return 0;
    }

    private static int runBenchmark(CliOptions options, PrintStream out) {
        String text = options.textFile != null
                ? LineFileReader.readText(options.textFile)
                : Generator.generateZipf(options.textLength, 'a', 'z' + 1, 1.1, options.seed);
        List<String> patterns = options.patternsFile != null
                ? LineFileReader.readLines(options.patternsFile, true)
                : Generator.samplePatterns(text, Generator.LOWER_LATIN, options.patternCount,
                DEFAULT_MIN_PATTERN_LEN, DEFAULT_MAX_PATTERN_LEN, 0.5, options.seed + 1);

        Experiment.Result result = Experiment.run(text, patterns, true, options.memory);
        out.printf(Locale.ROOT, "speedup vs regex: %.2fx%n",
                result.automatonScanMs() == 0 ? 0.0 : result.regexScanMs() / result.automatonScanMs());
        return result.agree() ? 0 : 1;
    }

    static final class CliOptions {
        static final String USAGE = String.join("\n",
                "Usage: Main --patterns <file> (--text <file> | --input <string>) [--bytes] [--limit <n>] [--count] [--stats [--memory]]",
                "       Main --benchmark [--patterns <file>] [--text <file>] [--text-length <n>] [--pattern-count <n>] [--seed <n>] [--memory]");

        final Path patternsFile;
        final Path textFile;
        final String inlineText;
        final boolean bytes;
        final long limit;
        final boolean countOnly;
        final boolean stats;
        final boolean memory;
        final boolean benchmark;
        final int textLength;
        final int patternCount;
        final long seed;

        private CliOptions(Path patternsFile,
                           Path textFile,
                           String inlineText,
                           boolean bytes,
                           long limit,
                           boolean countOnly,
                           boolean stats,
                           boolean memory,
                           boolean benchmark,
                           int textLength,
                           int patternCount,
                           long seed) {
            this.patternsFile = patternsFile;
            this.textFile = textFile;
            this.inlineText = inlineText;
            this.bytes = bytes;
            this.limit = limit;
            this.countOnly = countOnly;
            this.stats = stats;
            this.memory = memory;
            this.benchmark = benchmark;
            this.textLength = textLength;
            this.patternCount = patternCount;
            this.seed = seed;
        }

        static CliOptions parse(String[] args) {
            Path patterns = null;
            Path text = null;
            String input = null;
            boolean bytes = false;
            long limit = Long.MAX_VALUE;
            boolean count = false;
            boolean stats = false;
            boolean memory = false;
            boolean benchmark = false;
            int textLength = DEFAULT_TEXT_LENGTH;
            int patternCount = DEFAULT_PATTERN_COUNT;
            long seed = DEFAULT_SEED;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unexpected argument " + arg);
                }
                String key = arg.substring(2);
                String value = null;
                int eq = key.indexOf('=');
                if (eq >= 0) {
                    value = key.substring(eq + 1);
                    key = key.substring(0, eq);
                }
                switch (key) {
                    case "bytes" -> bytes = true;
                    case "count" -> count = true;
                    case "stats" -> stats = true;
                    case "memory" -> memory = true;
                    case "benchmark" -> benchmark = true;
                    default -> {
                        if (value == null) {
                            if (i + 1 >= args.length) {
                                throw new IllegalArgumentException("Missing value for option --" + key);
                            }
                            value = args[++i];
                        }
                        switch (key) {
                            case "patterns" -> patterns = Path.of(value);
                            case "text" -> text = Path.of(value);
                            case "input" -> input = value;
                            case "limit" -> limit = parsePositive(key, value);
                            case "text-length" -> textLength = (int) parsePositive(key, value);
                            case "pattern-count" -> patternCount = (int) parsePositive(key, value);
                            case "seed" -> seed = Long.parseLong(value);
                            default -> throw new IllegalArgumentException("Unknown option --" + key);
                        }
                    }
                }
            }
            if (text != null && input != null) {
                throw new IllegalArgumentException("--text and --input are mutually exclusive");
            }
            return new CliOptions(patterns, text, input, bytes, limit, count, stats, memory, benchmark,
                    textLength, patternCount, seed);
        }

        private static long parsePositive(String key, String value) {
            long parsed;
            try {
                parsed = Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + key + " expects a number, got " + value, e);
            }
            if (parsed <= 0) {
                throw new IllegalArgumentException("--" + key + " must be positive");
            }
            return parsed;
        }
    }
}
