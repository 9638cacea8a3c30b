package automaton;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

import java.util.Arrays;
import java.util.Objects;

/**
 * Maps raw symbols to dense transition-table columns.
 *
 * Column 0 stands for every symbol that occurs in no pattern; the k distinct pattern
 * symbols get columns 1..k in ascending symbol order. Immutable after construction.
 */
public final class Alphabet {

    public static final int OTHER = 0;

    // Symbols below this bound use a flat lookup array, the rest a hash map.
    static final int DIRECT_LOOKUP_LIMIT = 1 << 16;

    private final int[] symbols;
    private final int[] direct;
    private final Int2IntOpenHashMap sparse;

    private Alphabet(int[] symbols) {
        this.symbols = symbols;
        int max = symbols.length == 0 ? -1 : symbols[symbols.length - 1];
        if (max < DIRECT_LOOKUP_LIMIT) {
            this.direct = new int[max + 1];
            for (int i = 0; i < symbols.length; i++) {
                direct[symbols[i]] = i + 1;
            }
            this.sparse = null;
        } else {
            this.direct = null;
            this.sparse = new Int2IntOpenHashMap(symbols.length);
            this.sparse.defaultReturnValue(OTHER);
            for (int i = 0; i < symbols.length; i++) {
                sparse.put(symbols[i], i + 1);
            }
        }
    }

    /**
     * @param distinctSymbols non-negative, distinct, ascending
     */
    public static Alphabet of(int[] distinctSymbols) {
        Objects.requireNonNull(distinctSymbols, "distinctSymbols");
        int[] copy = distinctSymbols.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] < 0) {
                throw new IllegalArgumentException("symbols must be non-negative");
            }
            if (i > 0 && copy[i] <= copy[i - 1]) {
                throw new IllegalArgumentException("symbols must be distinct and ascending");
            }
        }
        return new Alphabet(copy);
    }

    public int column(int symbol) {
        if (direct != null) {
            return symbol >= 0 && symbol < direct.length ? direct[symbol] : OTHER;
        }
        return sparse.get(symbol);
    }

    // Number of table columns, including the OTHER column.
    public int columns() {
        return symbols.length + 1;
    }

    public int symbolCount() {
        return symbols.length;
    }

    // Symbol for a column >= 1.
    public int symbol(int column) {
        if (column <= OTHER || column > symbols.length) {
            throw new IndexOutOfBoundsException("column " + column);
        }
        return symbols[column - 1];
    }

    public boolean contains(int symbol) {
        return column(symbol) != OTHER;
    }

    @Override
    public String toString() {
        return "Alphabet" + Arrays.toString(symbols);
    }
}
