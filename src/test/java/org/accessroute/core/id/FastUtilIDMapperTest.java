package org.accessroute.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilIDMapperTest {

    @Test
    @DisplayName("Baseline Correctness: ordered ids map both ways")
    void testOrderedMapping() {
        IDMapper mapper = IDMapper.fromOrderedIds(List.of("gate", "library", "cafeteria"));

        assertEquals(0, mapper.toInternal("gate"));
        assertEquals(2, mapper.toInternal("cafeteria"));
        assertEquals("library", mapper.toExternal(1));

        assertTrue(mapper.containsExternal("gate"));
        assertFalse(mapper.containsExternal("Gate"));
        assertTrue(mapper.containsInternal(2));
        assertFalse(mapper.containsInternal(3));
        assertFalse(mapper.containsInternal(-1));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Unicode Support: non-Latin node ids")
    void testUnicodeIds() {
        IDMapper mapper = new FastUtilIDMapper(List.of("Bloco_Ç", "図書館"));

        assertEquals(1, mapper.toInternal("図書館"));
        assertEquals("Bloco_Ç", mapper.toExternal(0));
    }

    @Test
    @DisplayName("Exception Path: unknown external id")
    void testUnknownExternalId() {
        IDMapper mapper = IDMapper.fromOrderedIds(List.of("a"));

        assertThrows(IDMapper.UnknownIDException.class, () -> mapper.toInternal("b"));
        assertFalse(mapper.containsExternal(null));
    }

    @Test
    @DisplayName("Exception Path: internal id out of bounds")
    void testInvalidInternalId() {
        IDMapper mapper = IDMapper.fromOrderedIds(List.of("a"));

        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(1));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(-1));
    }

    @Test
    @DisplayName("Validation: duplicate, blank and null ids are rejected")
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(null));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(List.of("a", "b", "a")));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(List.of("a", " ")));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(Arrays.asList("a", null)));
    }

    @Test
    @DisplayName("Edge Case: empty mapper")
    void testEmptyMapper() {
        IDMapper mapper = IDMapper.fromOrderedIds(List.of());

        assertEquals(0, mapper.size());
        assertFalse(mapper.containsInternal(0));
    }
}
