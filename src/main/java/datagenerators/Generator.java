package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

// Seeded text and pattern workloads for tests and the benchmark driver.
public final class Generator {

    public static final char[] LOWER_LATIN = "abcdefghijklmnopqrstuvwxyz".toCharArray();

    private Generator() {
    }

    public static String generateUniform(int length, int minDomain, int maxDomain, long seed) {
        checkDomain(minDomain, maxDomain);
        if (length < 0) throw new IllegalArgumentException("length < 0");

        RandomGenerator rng = new Well19937c(seed);
        int alphabetSize = maxDomain - minDomain;
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = (char) (minDomain + rng.nextInt(alphabetSize));
        }
        return new String(chars);
    }

    public static String generateZipf(int length,
                                      int minDomain,
                                      int maxDomain,
                                      double exponent,
                                      long seed) {
        checkDomain(minDomain, maxDomain);
        if (length < 0) throw new IllegalArgumentException("length < 0");
        // We want codes in the half open interval [minDomain, maxDomain)
        int alphabetSize = maxDomain - minDomain;

        RandomGenerator rng = new Well19937c(seed);

        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);

        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            int rank = dist.sample();
            chars[i] = (char) (minDomain + (rank - 1));
        }
        return new String(chars);
    }

    // Uniform text over an explicit alphabet.
    public static String generateFrom(char[] alphabet, int length, long seed) {
        Objects.requireNonNull(alphabet, "alphabet");
        if (alphabet.length == 0) throw new IllegalArgumentException("alphabet must not be empty");
        if (length < 0) throw new IllegalArgumentException("length < 0");
        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet[rng.nextInt(alphabet.length)];
        }
        return new String(chars);
    }

    /**
     * Patterns with lengths in [minLen, maxLen]. Roughly {@code hitRatio} of them are cut out of
     * {@code text} so they are guaranteed to occur; the rest are drawn from {@code alphabet}.
     */
    public static List<String> samplePatterns(String text,
                                              char[] alphabet,
                                              int count,
                                              int minLen,
                                              int maxLen,
                                              double hitRatio,
                                              long seed) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(alphabet, "alphabet");
        if (minLen <= 0 || maxLen < minLen) {
            throw new IllegalArgumentException("need 0 < minLen <= maxLen");
        }
        if (hitRatio < 0.0 || hitRatio > 1.0) {
            throw new IllegalArgumentException("hitRatio must be in [0,1]");
        }
        RandomGenerator rng = new Well19937c(seed);
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int len = minLen + rng.nextInt(maxLen - minLen + 1);
            if (text.length() >= len && rng.nextDouble() < hitRatio) {
                int start = rng.nextInt(text.length() - len + 1);
                out.add(text.substring(start, start + len));
            } else {
                char[] chars = new char[len];
                for (int j = 0; j < len; j++) {
                    chars[j] = alphabet[rng.nextInt(alphabet.length)];
                }
                out.add(new String(chars));
            }
        }
        return out;
    }

    // Alternating mono-character blocks; worst case for overlapping suffix outputs.
    public static String generateAlternatingBlocks(int totalLength, int blockLength, char[] alphabet) {
        if (totalLength < 0) throw new IllegalArgumentException("totalLength < 0");
        if (blockLength <= 0) throw new IllegalArgumentException("blockLength must be positive");
        Objects.requireNonNull(alphabet, "alphabet");
        if (alphabet.length == 0) throw new IllegalArgumentException("alphabet must not be empty");

        StringBuilder sb = new StringBuilder(totalLength);
        int symbolIndex = 0;
        while (sb.length() < totalLength) {
            char symbol = alphabet[symbolIndex % alphabet.length];
            int runLength = Math.min(blockLength, totalLength - sb.length());
            sb.append(String.valueOf(symbol).repeat(runLength));
            symbolIndex++;
        }
        return sb.toString();
    }

    private static void checkDomain(int minDomain, int maxDomain) {
        if (minDomain < Character.MIN_VALUE) throw new IllegalArgumentException("minDomain < 0");
        if (maxDomain <= minDomain) throw new IllegalArgumentException("maxDomain must be greater than minDomain");
        if (maxDomain - 1 > Character.MAX_VALUE) throw new IllegalArgumentException("maxDomain - 1 exceeds Character.MAX_VALUE");
    }
}
