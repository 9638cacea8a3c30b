package trie;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import search.Pattern;
import utilities.AlphabetMapper;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Trie
 *
 * Prefix tree stored as a state arena. State 0 is the root; every other state is created
 * by extending an existing path by one symbol, so explicit edges always form a tree and
 * state ids are dense and stable.
 *
 * Each state keeps the ids of the patterns that end exactly at it (direct matches).
 * Removing a string only clears its direct matches; states are never deleted.
 */
public final class Trie {

    public static final int ROOT = 0;
    public static final int NO_STATE = -1;

    private final ArrayList<Int2IntOpenHashMap> children;
    private final IntArrayList depth;
    private final ArrayList<IntArrayList> direct;
    private final AlphabetMapper symbols;

    // Id handed out by the String convenience overloads.
    private int nextAnonymousId = 0;

    public Trie() {
        this(16);
    }

    // expectedStates pre-sizes the state arena; the alphabet can never be larger than the edge count.
    public Trie(int expectedStates) {
        int capacity = Math.max(expectedStates, 1);
        this.children = new ArrayList<>(capacity);
        this.depth = new IntArrayList(capacity);
        this.direct = new ArrayList<>(capacity);
        this.symbols = new AlphabetMapper(Math.min(capacity, 1 << 16));
        newState(0);
    }

    private int newState(int d) {
        Int2IntOpenHashMap map = new Int2IntOpenHashMap(2);
        map.defaultReturnValue(NO_STATE);
        children.add(map);
        depth.add(d);
        direct.add(null);
        return children.size() - 1;
    }

    /**
     * Walk/extend the path for {@code symbols} and record {@code id} at its terminal state.
     * Returns the terminal state. An empty sequence records the id at the root.
     * A negative symbol is rejected before any state is created.
     */
    public int insert(int[] symbols, int id) {
        Objects.requireNonNull(symbols, "symbols");
        for (int c : symbols) {
            if (c < 0) {
                throw new IllegalArgumentException("symbols must be non-negative, got " + c);
            }
        }
        int s = ROOT;
        for (int c : symbols) {
            int next = children.get(s).get(c);
            if (next == NO_STATE) {
                this.symbols.insert(c);
                next = newState(depth.getInt(s) + 1);
                children.get(s).put(c, next);
            }
            s = next;
        }
        IntArrayList ids = direct.get(s);
        if (ids == null) {
            ids = new IntArrayList(1);
            direct.set(s, ids);
        }
        ids.add(id);
        return s;
    }

    public int insert(Pattern pattern) {
        return insert(pattern.symbols(), pattern.id());
    }

    public int insert(String s) {
        return insert(toSymbols(s), nextAnonymousId++);
    }

    // True iff exactly this string was inserted and not removed since.
    public boolean contains(String s) {
        return contains(toSymbols(s));
    }

    public boolean contains(int[] key) {
        int s = walk(key);
        return s != NO_STATE && !directMatches(s).isEmpty();
    }

    // True iff some inserted string has this prefix.
    public boolean startsWith(String prefix) {
        return walk(toSymbols(prefix)) != NO_STATE;
    }

    /**
     * Unmarks {@code s}; a no-op if it was never inserted. The path stays in place,
     * it just no longer terminates a pattern.
     */
    public boolean remove(String s) {
        return remove(toSymbols(s));
    }

    public boolean remove(int[] key) {
        int s = walk(key);
        if (s == NO_STATE || direct.get(s) == null || direct.get(s).isEmpty()) {
            return false;
        }
        direct.set(s, null);
        return true;
    }

    // State reached by following explicit edges, or NO_STATE.
    public int walk(int[] key) {
        int s = ROOT;
        for (int c : key) {
            s = children.get(s).get(c);
            if (s == NO_STATE) {
                return NO_STATE;
            }
        }
        return s;
    }

    public int stateCount() {
        return children.size();
    }

    public int depth(int state) {
        return depth.getInt(state);
    }

    public int child(int state, int symbol) {
        return children.get(state).get(symbol);
    }

    public int childCount(int state) {
        return children.get(state).size();
    }

    public IntList directMatches(int state) {
        IntArrayList ids = direct.get(state);
        return ids == null ? IntLists.emptyList() : IntLists.unmodifiable(ids);
    }

    @FunctionalInterface
    public interface EdgeVisitor {
        void visit(int symbol, int child);
    }

    // Explicit edges only, in no particular order.
    public void forEachChild(int state, EdgeVisitor visitor) {
        for (Int2IntMap.Entry e : children.get(state).int2IntEntrySet()) {
            visitor.visit(e.getIntKey(), e.getIntValue());
        }
    }

    // Distinct symbols on any edge, ascending.
    public int[] symbols() {
        return symbols.symbols();
    }

    public int alphabetSize() {
        return symbols.getSize();
    }

    private static int[] toSymbols(String s) {
        Objects.requireNonNull(s, "s");
        int[] out = new int[s.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = s.charAt(i);
        }
        return out;
    }
}
