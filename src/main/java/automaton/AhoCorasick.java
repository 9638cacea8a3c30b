package automaton;

import search.EmptyPatternException;
import search.PatternSet;
import trie.Trie;
import trie.TrieBuilder;
import utilities.AhoLogger;
import utilities.MemUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Collects patterns and compiles them into a {@link CompiledAutomaton}.
 *
 * <pre>
 * CompiledAutomaton ac = AhoCorasick.builder()
 *         .addPattern("he").addPattern("she").addPattern("his").addPattern("hers")
 *         .build();
 * for (MatchCursor c = ac.scan("ahishers"); c.hasNext(); ) { ... }
 * </pre>
 *
 * A failed {@link #build()} leaves the collected patterns untouched and the status
 * {@link Status#NOT_BUILT}, so the caller can fix the input and try again.
 */
public final class AhoCorasick {

    public enum Status {
        NOT_BUILT,
        BUILT
    }

    private final AutomatonConfiguration configuration;
    // String or byte[], in insertion order
    private final List<Object> entries;
    private Status status = Status.NOT_BUILT;
    private AutomatonStats lastStats;

    private AhoCorasick(AutomatonConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.entries = new ArrayList<>(configuration.expectedPatterns());
    }

    public static AhoCorasick builder() {
        return new AhoCorasick(AutomatonConfiguration.defaults());
    }

    public static AhoCorasick builder(AutomatonConfiguration configuration) {
        return new AhoCorasick(configuration);
    }

    // One-shot convenience for the default configuration.
    public static CompiledAutomaton compile(Collection<String> patterns) {
        return builder().addPatterns(patterns).build();
    }

    public AhoCorasick addPattern(String pattern) {
        entries.add(Objects.requireNonNull(pattern, "pattern"));
        status = Status.NOT_BUILT;
        return this;
    }

    public AhoCorasick addPattern(byte[] pattern) {
        entries.add(Objects.requireNonNull(pattern, "pattern").clone());
        status = Status.NOT_BUILT;
        return this;
    }

    public AhoCorasick addPatterns(Collection<String> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        for (String p : patterns) {
            addPattern(p);
        }
        return this;
    }

    // Later patterns shift down by one id.
    public AhoCorasick removePattern(int id) {
        entries.remove(id);
        status = Status.NOT_BUILT;
        return this;
    }

    public AhoCorasick clear() {
        entries.clear();
        status = Status.NOT_BUILT;
        return this;
    }

    public int size() {
        return entries.size();
    }

    public Status status() {
        return status;
    }

    public AutomatonConfiguration configuration() {
        return configuration;
    }

    // Stats of the most recent successful build, or null if none were collected.
    public AutomatonStats lastStats() {
        return lastStats;
    }

    public PatternSet patternSet() {
        PatternSet.Builder b = PatternSet.builder();
        for (Object e : entries) {
            if (e instanceof byte[]) {
                b.add((byte[]) e);
            } else if (configuration.symbolKind() == AutomatonConfiguration.SymbolKind.BYTE) {
                b.addUtf8((String) e);
            } else {
                b.add((String) e);
            }
        }
        return b.build();
    }

    /**
     * @throws EmptyPatternException if any collected pattern is empty; nothing is built in that case
     */
    public CompiledAutomaton build() {
        PatternSet patterns = patternSet();

        long t0 = System.nanoTime();
        Trie trie;
        try {
            trie = TrieBuilder.build(patterns);
        } catch (EmptyPatternException e) {
            status = Status.NOT_BUILT;
            AhoLogger.warning("Rejected pattern set: " + e.getMessage());
            throw e;
        }
        long t1 = System.nanoTime();
        CompiledAutomaton automaton = AutomatonCompiler.compile(trie, patterns, configuration.symbolKind());
        long t2 = System.nanoTime();

        status = Status.BUILT;
        if (configuration.collectStats()) {
            long bytes = configuration.measureMemory() ? new MemUtil().retainedBytes(automaton) : -1L;
            lastStats = AutomatonStats.of(automaton, t1 - t0, t2 - t1, bytes);
            AhoLogger.info("Built " + automaton + " in " + String.format(Locale.ROOT, "%.3f ms", lastStats.buildMillis()));
        } else {
            AhoLogger.debug("Built " + automaton);
        }
        return automaton;
    }
}
