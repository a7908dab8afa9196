package com.credential.dedupe.review;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReviewDecision Tests")
class ReviewDecisionTest {

    @Test
    @DisplayName("keepOne carries the chosen record id")
    void keepOneCarriesId() {
        ReviewDecision decision = ReviewDecision.keepOne("rec-1");

        assertEquals(ReviewAction.KEEP_ONE, decision.action());
        assertEquals("rec-1", decision.recordId());
    }

    @Test
    @DisplayName("keepOne without a record id is rejected")
    void keepOneRequiresId() {
        assertThrows(IllegalArgumentException.class, () -> ReviewDecision.keepOne(" "));
        assertThrows(IllegalArgumentException.class, () -> ReviewDecision.keepOne(null));
    }

    @ParameterizedTest
    @EnumSource(value = ReviewAction.class, names = {"KEEP_BEST", "KEEP_ALL", "SKIP"})
    @DisplayName("Actions other than keepOne take no record id")
    void otherActionsRejectId(ReviewAction action) {
        assertThrows(IllegalArgumentException.class, () -> new ReviewDecision(action, "rec-1"));
        assertNull(new ReviewDecision(action, null).recordId());
    }

    @Test
    @DisplayName("Only keepOne and keepBest discard records")
    void discardingActions() {
        assertTrue(ReviewAction.KEEP_ONE.discardsRecords());
        assertTrue(ReviewAction.KEEP_BEST.discardsRecords());
        assertFalse(ReviewAction.KEEP_ALL.discardsRecords());
        assertFalse(ReviewAction.SKIP.discardsRecords());
    }
}
