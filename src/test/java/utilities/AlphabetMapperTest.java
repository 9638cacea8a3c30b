package utilities;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlphabetMapperTest {

    @Test
    void idsStartAtOneInFirstSeenOrder() {
        AlphabetMapper mapper = new AlphabetMapper(4);

        assertEquals(1, mapper.insert('z'));
        assertEquals(2, mapper.insert('a'));
        assertEquals(1, mapper.insert('z'));
        assertEquals(2, mapper.getSize());
        assertEquals(AlphabetMapper.UNMAPPED, mapper.getId('q'));
        assertFalse(mapper.contains('q'));
        assertTrue(mapper.contains('a'));
    }

    @Test
    void symbolsAreReturnedAscending() {
        AlphabetMapper mapper = new AlphabetMapper(1);
        mapper.insert(30);
        mapper.insert(10);
        mapper.insert(20);

        assertArrayEquals(new int[]{10, 20, 30}, mapper.symbols());
    }

    @Test
    void clearRestartsNumbering() {
        AlphabetMapper mapper = new AlphabetMapper(2);
        mapper.insert(5);
        mapper.clear();
        assertEquals(0, mapper.getSize());
        assertEquals(1, mapper.insert(7));
    }

    @Test
    void negativeSymbolsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AlphabetMapper(1).insert(-1));
    }
}
