package com.iplicense.search.suggest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class EditDistanceTest {
    @Test
    void countsInsertionsDeletionsAndSubstitutions() {
        assertEquals(3, EditDistance.between("kitten", "sitting"));
        assertEquals(1, EditDistance.between("lgo", "logo"));
        assertEquals(3, EditDistance.between("", "abc"));
        assertEquals(0, EditDistance.between("same", "same"));
    }

    @Test
    void distanceIsCaseSensitiveButSimilarityIsNot() {
        assertEquals(1, EditDistance.between("Logo", "logo"));
        assertEquals(1.0, EditDistance.similarity("Logo", "logo"));
        assertEquals(0.75, EditDistance.similarity("lgo", "logo"));
    }
}
