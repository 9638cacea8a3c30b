package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import search.Match;
import search.MultiPatternMatcher;
import search.PatternSet;
import search.SymbolSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * CompiledAutomaton
 *
 * Deterministic Aho–Corasick automaton produced by {@link AutomatonCompiler}.
 * Layout:
 *   transitions   dense goto table, row per state, one column per {@link Alphabet} column
 *   fail          fail link per state (root's is itself)
 *   depth         prefix length per state
 *   outputOffsets / outputIds   output sets in CSR form, ids ascending within a state
 *
 * Nothing here is mutated after construction, so any number of threads may scan the same
 * instance at once; every scan owns its own {@link MatchCursor}.
 */
public final class CompiledAutomaton implements MultiPatternMatcher {

    public static final int ROOT = 0;

    private final PatternSet patterns;
    private final Alphabet alphabet;
    private final AutomatonConfiguration.SymbolKind symbolKind;
    private final int columns;
    private final int[] transitions;
    private final int[] fail;
    private final int[] depth;
    private final int[] outputOffsets;
    private final int[] outputIds;

    CompiledAutomaton(PatternSet patterns,
                      Alphabet alphabet,
                      AutomatonConfiguration.SymbolKind symbolKind,
                      int[] transitions,
                      int[] fail,
                      int[] depth,
                      int[] outputOffsets,
                      int[] outputIds) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        this.symbolKind = Objects.requireNonNull(symbolKind, "symbolKind");
        this.columns = alphabet.columns();
        this.transitions = transitions;
        this.fail = fail;
        this.depth = depth;
        this.outputOffsets = outputOffsets;
        this.outputIds = outputIds;
        if (transitions.length != fail.length * columns) {
            throw new IllegalArgumentException("transition table does not match state count");
        }
    }

    @Override
    public PatternSet patterns() {
        return patterns;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    public AutomatonConfiguration.SymbolKind symbolKind() {
        return symbolKind;
    }

    public int stateCount() {
        return fail.length;
    }

    public int columns() {
        return columns;
    }

    // Total goto function: defined for every state and every non-negative symbol.
    public int next(int state, int symbol) {
        return transitions[state * columns + alphabet.column(symbol)];
    }

    int nextByColumn(int state, int column) {
        return transitions[state * columns + column];
    }

    public int failLink(int state) {
        return fail[state];
    }

    public int depth(int state) {
        return depth[state];
    }

    public IntList outputs(int state) {
        int from = outputOffsets[state];
        int to = outputOffsets[state + 1];
        if (from == to) {
            return IntLists.emptyList();
        }
        return IntLists.unmodifiable(IntArrayList.wrap(outputIds, to).subList(from, to));
    }

    public boolean isMatchState(int state) {
        return outputOffsets[state] != outputOffsets[state + 1];
    }

    int outputStart(int state) {
        return outputOffsets[state];
    }

    int outputEnd(int state) {
        return outputOffsets[state + 1];
    }

    int outputId(int index) {
        return outputIds[index];
    }

    public int outputEntries() {
        return outputIds.length;
    }

    // ---------------------------------------------------------------------
    // Scanning
    // ---------------------------------------------------------------------

    // Char text is UTF-8 encoded first when this automaton works on bytes; positions are then byte offsets.
    public SymbolSequence symbolsOf(CharSequence text) {
        return symbolKind == AutomatonConfiguration.SymbolKind.BYTE
                ? SymbolSequence.utf8(text)
                : SymbolSequence.of(text);
    }

    public MatchCursor scan(SymbolSequence text) {
        return new MatchCursor(this, text);
    }

    public MatchCursor scan(CharSequence text) {
        return scan(symbolsOf(text));
    }

    public MatchCursor scan(byte[] text) {
        return scan(SymbolSequence.of(text));
    }

    public MatchCursor scan(int[] text) {
        return scan(SymbolSequence.of(text));
    }

    public Stream<Match> stream(SymbolSequence text) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(scan(text), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public Stream<Match> stream(CharSequence text) {
        return stream(symbolsOf(text));
    }

    public List<Match> findAll(SymbolSequence text) {
        List<Match> out = new ArrayList<>();
        MatchCursor cursor = scan(text);
        while (cursor.hasNext()) {
            out.add(cursor.next());
        }
        return out;
    }

    @Override
    public List<Match> findAll(CharSequence text) {
        return findAll(symbolsOf(text));
    }

    public List<Match> findAll(byte[] text) {
        return findAll(SymbolSequence.of(text));
    }

    public Optional<Match> findFirst(SymbolSequence text) {
        MatchCursor cursor = scan(text);
        return cursor.hasNext() ? Optional.of(cursor.next()) : Optional.empty();
    }

    public Optional<Match> findFirst(CharSequence text) {
        return findFirst(symbolsOf(text));
    }

    public boolean containsAny(SymbolSequence text) {
        return scan(text).hasNext();
    }

    public boolean containsAny(CharSequence text) {
        return containsAny(symbolsOf(text));
    }

    public boolean containsAny(byte[] text) {
        return containsAny(SymbolSequence.of(text));
    }

    // Same walk as a cursor, but only sums output set sizes.
    public long countMatches(SymbolSequence text) {
        Objects.requireNonNull(text, "text");
        long count = 0;
        int state = ROOT;
        int n = text.length();
        for (int i = 0; i < n; i++) {
            state = transitions[state * columns + alphabet.column(text.symbolAt(i))];
            count += outputOffsets[state + 1] - outputOffsets[state];
        }
        return count;
    }

    @Override
    public long countMatches(CharSequence text) {
        return countMatches(symbolsOf(text));
    }

    @Override
    public String toString() {
        return "CompiledAutomaton{patterns=" + patterns.size()
                + ", states=" + stateCount()
                + ", columns=" + columns
                + ", symbolKind=" + symbolKind + '}';
    }
}
