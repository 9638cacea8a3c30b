import automaton.AhoCorasick;
import automaton.AutomatonConfiguration;
import automaton.AutomatonStats;
import automaton.CompiledAutomaton;
import search.Match;
import search.RegexMatcher;
import utilities.AhoLogger;
import utilities.MemUtil;
import utilities.MemoryUsageReport;

import java.util.List;
import java.util.Locale;

// Times the automaton against the per-pattern regex baseline on one workload and checks they agree.
public class Experiment {

    public record Result(int patterns,
                         int textLength,
                         double buildMs,
                         double automatonScanMs,
                         double regexScanMs,
                         long matches,
                         boolean agree,
                         double automatonMiB) {
    }

    public static Result run(String text, List<String> patterns, boolean verbose, boolean measureMemory) {
        AutomatonConfiguration configuration = AutomatonConfiguration.builder()
                .expectedPatterns(patterns.size())
                .collectStats(true)
                .measureMemory(measureMemory)
                .build();

        AhoCorasick builder = AhoCorasick.builder(configuration).addPatterns(patterns);
        CompiledAutomaton automaton = builder.build();
        AutomatonStats stats = builder.lastStats();

        long scanStart = System.nanoTime();
        List<Match> acMatches = automaton.findAll(text);
        double acMs = (System.nanoTime() - scanStart) / 1_000_000.0;

        RegexMatcher regex = new RegexMatcher(automaton.patterns());
        long regexStart = System.nanoTime();
        List<Match> regexMatches = regex.findAll(text);
        double regexMs = (System.nanoTime() - regexStart) / 1_000_000.0;

        boolean agree = acMatches.equals(regexMatches);
        if (!agree) {
            AhoLogger.error("Automaton and regex baseline disagree: " + acMatches.size()
                    + " vs " + regexMatches.size() + " matches");
        }

        double mib = -1.0;
        if (measureMemory) {
            MemoryUsageReport report = new MemUtil().jolMemoryReportWithTotal(false, automaton);
            mib = report.totalMiB();
            if (verbose) {
                System.out.println(report.report());
            }
        }

        Result result = new Result(patterns.size(), text.length(), stats.buildMillis(), acMs, regexMs,
                acMatches.size(), agree, mib);
        if (verbose) {
            System.out.printf(Locale.ROOT,
                    "Patterns: %d  Text: %d  States: %d  Columns: %d%n",
                    result.patterns(), result.textLength(), stats.stateCount(), stats.columns());
            System.out.printf(Locale.ROOT,
                    "Build: %.3f ms  Automaton scan: %.3f ms  Regex scan: %.3f ms  Matches: %d  Agree: %s%n",
                    result.buildMs(), result.automatonScanMs(), result.regexScanMs(), result.matches(), result.agree());
        }
        return result;
    }
}
