package com.network.matching.ranking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RankingMode Tests")
class RankingModeTest {

    @ParameterizedTest
    @ValueSource(strings = {"rerank", "RERANK", " Rerank "})
    void parsesRerank(String value) {
        assertEquals(RankingMode.RERANK, RankingMode.fromString(value));
    }

    @Test
    @DisplayName("Should reject unknown or blank modes")
    void rejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> RankingMode.fromString("semantic"));
        assertThrows(IllegalArgumentException.class, () -> RankingMode.fromString(""));
        assertThrows(IllegalArgumentException.class, () -> RankingMode.fromString(null));
    }
}
