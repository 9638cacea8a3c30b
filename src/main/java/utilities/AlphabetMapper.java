package utilities;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * Assigns dense column ids to raw symbols, in first-seen order.
 * Id 0 is reserved for "any symbol that was never inserted".
 */
public class AlphabetMapper {
    public static final int UNMAPPED = 0;

    int nextId = 1;
    float loadFactor = 0.75f;

    // Primitive map to avoid boxing
    private final Int2IntOpenHashMap symbolToId;

    int capacity;

    public AlphabetMapper(int capacity) {
        this.capacity = Math.max(1, capacity);

        // Pre-size to the expected alphabet size to avoid rehashing.
        this.symbolToId = new Int2IntOpenHashMap(this.capacity, loadFactor);
        this.symbolToId.defaultReturnValue(UNMAPPED);
    }

    public int getSize() {
        return symbolToId.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public int insert(int symbol) {
        if (symbol < 0) {
            throw new IllegalArgumentException("symbol must be non-negative: " + symbol);
        }
        int id = symbolToId.get(symbol);
        if (id == UNMAPPED) {
            id = nextId;
            nextId++;
            symbolToId.put(symbol, id);
        }
        return id;
    }

    // Lookup only; never grows the mapping.
    public int getId(int symbol) {
        return symbolToId.get(symbol);
    }

    public boolean contains(int symbol) {
        return symbolToId.containsKey(symbol);
    }

    // All mapped symbols, ascending.
    public int[] symbols() {
        int[] out = symbolToId.keySet().toIntArray();
        IntArrays.quickSort(out);
        return out;
    }

    public void clear() {
        symbolToId.clear();
        nextId = 1; // keep 0 reserved
    }
}
