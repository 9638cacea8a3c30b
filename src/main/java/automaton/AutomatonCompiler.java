package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import search.PatternSet;
import trie.Trie;
import utilities.AhoLogger;

import java.util.Objects;

/**
 * AutomatonCompiler
 *
 * Turns a {@link Trie} into a {@link CompiledAutomaton}:
 *   1. Dense alphabet over the symbols that occur in the trie (column 0 = any other symbol).
 *   2. Breadth-first pass from the root. Each state first inherits its fail link's goto row,
 *      then overwrites the columns of its explicit children. A child's fail link is the goto
 *      of the parent's fail link on the same symbol.
 *   3. Output sets in the same order: direct matches merged with the fail link's output set.
 *   4. Output sets flattened to CSR arrays.
 *
 * BFS order is what makes step 2 sound: a fail link is always strictly shallower than its
 * state, so its goto row and output set are final by the time they are read.
 */
public final class AutomatonCompiler {

    private static final int[] NONE = new int[0];

    private AutomatonCompiler() {
    }

    public static CompiledAutomaton compile(Trie trie, PatternSet patterns) {
        return compile(trie, patterns, AutomatonConfiguration.SymbolKind.CHAR);
    }

    public static CompiledAutomaton compile(Trie trie, PatternSet patterns, AutomatonConfiguration.SymbolKind symbolKind) {
        Objects.requireNonNull(trie, "trie");
        Objects.requireNonNull(patterns, "patterns");

        final int n = trie.stateCount();
        final Alphabet alphabet = Alphabet.of(trie.symbols());
        final int cols = alphabet.columns();
        long cells = (long) n * cols;
        if (cells > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("transition table too large: " + n + " states x " + cols + " columns");
        }

        final int[] delta = new int[(int) cells]; // 0 == ROOT
        final int[] fail = new int[n];
        final int[] depth = new int[n];
        final int[][] outputs = new int[n][];

        IntArrayFIFOQueue queue = new IntArrayFIFOQueue(Math.max(16, n));
        queue.enqueue(Trie.ROOT);
        fail[Trie.ROOT] = Trie.ROOT;

        int visited = 0;
        while (!queue.isEmpty()) {
            final int s = queue.dequeueInt();
            visited++;
            final int row = s * cols;
            final int failRow = fail[s] * cols;
            depth[s] = trie.depth(s);

            if (s != Trie.ROOT) {
                System.arraycopy(delta, failRow, delta, row, cols);
            }
            outputs[s] = s == Trie.ROOT
                    ? sortedCopy(trie.directMatches(s))
                    : mergeAscending(sortedCopy(trie.directMatches(s)), outputs[fail[s]]);

            trie.forEachChild(s, (symbol, child) -> {
                int c = alphabet.column(symbol);
                // Root's children fail to the root; deeper ones follow the parent's fail chain.
                fail[child] = s == Trie.ROOT ? Trie.ROOT : delta[failRow + c];
                delta[row + c] = child;
                queue.enqueue(child);
            });
        }
        if (visited != n) {
            throw new IllegalStateException("trie has " + n + " states but only " + visited + " are reachable");
        }

        int[] offsets = new int[n + 1];
        for (int s = 0; s < n; s++) {
            offsets[s + 1] = offsets[s] + outputs[s].length;
        }
        int[] ids = new int[offsets[n]];
        for (int s = 0; s < n; s++) {
            System.arraycopy(outputs[s], 0, ids, offsets[s], outputs[s].length);
        }

        if (AhoLogger.isDebugEnabled()) {
            AhoLogger.debug("Compiled automaton: " + n + " states, " + cols + " columns, "
                    + ids.length + " output entries for " + patterns.size() + " patterns");
        }
        return new CompiledAutomaton(patterns, alphabet, symbolKind, delta, fail, depth, offsets, ids);
    }

    private static int[] sortedCopy(IntList ids) {
        if (ids.isEmpty()) {
            return NONE;
        }
        int[] out = ids.toIntArray();
        IntArrays.quickSort(out);
        return out;
    }

    // Both inputs ascending; the result keeps duplicates.
    static int[] mergeAscending(int[] a, int[] b) {
        if (a.length == 0) return b;
        if (b.length == 0) return a;
        int[] out = new int[a.length + b.length];
        int i = 0, j = 0, k = 0;
        while (i < a.length && j < b.length) {
            out[k++] = a[i] <= b[j] ? a[i++] : b[j++];
        }
        while (i < a.length) out[k++] = a[i++];
        while (j < b.length) out[k++] = b[j++];
        return out;
    }
}
