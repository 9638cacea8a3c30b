package search;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Read-only, random access view over a run of non-negative integer symbols.
 * Chars map to their UTF-16 code unit, bytes to their unsigned value.
 */
public interface SymbolSequence {

    int length();

    int symbolAt(int index);

    default boolean isEmpty() {
        return length() == 0;
    }

    static SymbolSequence of(CharSequence text) {
        Objects.requireNonNull(text, "text");
        return new SymbolSequence() {
            @Override
            public int length() {
                return text.length();
            }

            @Override
            public int symbolAt(int index) {
                return text.charAt(index);
            }
        };
    }

    static SymbolSequence of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new SymbolSequence() {
            @Override
            public int length() {
                return bytes.length;
            }

            @Override
            public int symbolAt(int index) {
                return bytes[index] & 0xff;
            }
        };
    }

    static SymbolSequence of(int[] symbols) {
        Objects.requireNonNull(symbols, "symbols");
        return new SymbolSequence() {
            @Override
            public int length() {
                return symbols.length;
            }

            @Override
            public int symbolAt(int index) {
                return symbols[index];
            }
        };
    }

    static SymbolSequence utf8(CharSequence text) {
        Objects.requireNonNull(text, "text");
        return of(text.toString().getBytes(StandardCharsets.UTF_8));
    }
}
