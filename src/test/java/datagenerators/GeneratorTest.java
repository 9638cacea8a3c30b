package datagenerators;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeneratorTest {

    @Test
    void sameSeedSameText() {
        assertEquals(Generator.generateZipf(500, 'a', 'z' + 1, 1.1, 9L),
                Generator.generateZipf(500, 'a', 'z' + 1, 1.1, 9L));
        assertEquals(Generator.generateUniform(500, 'a', 'f', 9L),
                Generator.generateUniform(500, 'a', 'f', 9L));
    }

    @Test
    void textStaysInsideDomain() {
        String s = Generator.generateUniform(1_000, 'a', 'd', 1L);
        assertEquals(1_000, s.length());
        assertTrue(s.chars().allMatch(c -> c >= 'a' && c < 'd'));

        String z = Generator.generateZipf(1_000, 'a', 'z' + 1, 1.5, 1L);
        assertTrue(z.chars().allMatch(c -> c >= 'a' && c <= 'z'));
    }

    @Test
    void sampledHitsOccurInText() {
        String text = Generator.generateFrom(new char[]{'x', 'y'}, 200, 5L);
        List<String> patterns = Generator.samplePatterns(text, new char[]{'x', 'y'}, 50, 2, 5, 1.0, 6L);

        assertEquals(50, patterns.size());
        for (String p : patterns) {
            assertTrue(p.length() >= 2 && p.length() <= 5);
            assertTrue(text.contains(p), p);
        }
    }

    @Test
    void alternatingBlocks() {
        assertEquals("aabbaab", Generator.generateAlternatingBlocks(7, 2, new char[]{'a', 'b'}));
    }

    @Test
    void badArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Generator.generateUniform(10, 'b', 'a', 1L));
        assertThrows(IllegalArgumentException.class,
                () -> Generator.samplePatterns("abc", new char[]{'a'}, 1, 0, 2, 0.5, 1L));
        assertThrows(IllegalArgumentException.class,
                () -> Generator.generateAlternatingBlocks(5, 0, new char[]{'a'}));
        assertThrows(IllegalArgumentException.class, () -> Generator.generateFrom(new char[]{'a'}, -1, 1L));
    }
}
