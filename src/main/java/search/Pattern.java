package search;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One search string of a {@link PatternSet}. The id is the pattern's position in the set.
 */
public final class Pattern {
    private final int id;
    private final int[] symbols;
    private final String patternTxt;

    Pattern(int id, int[] symbols, String patternTxt) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative");
        }
        this.id = id;
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.patternTxt = Objects.requireNonNull(patternTxt, "patternTxt");
        for (int s : symbols) {
            if (s < 0) {
                throw new IllegalArgumentException("symbols must be non-negative, got " + s);
            }
        }
    }

    public static Pattern of(int id, String s) {
        Objects.requireNonNull(s, "s");
        int[] symbols = new int[s.length()];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = s.charAt(i);
        }
        return new Pattern(id, symbols, s);
    }

    public static Pattern of(int id, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        int[] symbols = new int[bytes.length];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = bytes[i] & 0xff;
        }
        return new Pattern(id, symbols, new String(bytes, StandardCharsets.ISO_8859_1));
    }

    public static Pattern utf8(int id, String s) {
        Objects.requireNonNull(s, "s");
        Pattern p = of(id, s.getBytes(StandardCharsets.UTF_8));
        return new Pattern(id, p.symbols, s);
    }

    public static Pattern of(int id, int[] symbols) {
        Objects.requireNonNull(symbols, "symbols");
        StringBuilder human = new StringBuilder();
        for (int i = 0; i < symbols.length; i++) {
            if (i > 0) human.append(' ');
            human.append(symbols[i]);
        }
        return new Pattern(id, symbols.clone(), human.toString());
    }

    public int id() {
        return id;
    }

    public int length() {
        return symbols.length;
    }

    public boolean isEmpty() {
        return symbols.length == 0;
    }

    public int symbolAt(int index) {
        return symbols[index];
    }

    public int[] symbols() {
        return symbols.clone();
    }

    public String text() {
        return patternTxt;
    }

    // Same id, same symbols.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern)) return false;
        Pattern other = (Pattern) o;
        return id == other.id && Arrays.equals(symbols, other.symbols);
    }

    @Override
    public int hashCode() {
        return 31 * id + Arrays.hashCode(symbols);
    }

    @Override
    public String toString() {
        return "Pattern{" + id + ": \"" + patternTxt + "\"}";
    }
}
