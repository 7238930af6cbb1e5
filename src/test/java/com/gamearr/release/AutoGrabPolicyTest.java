package com.gamearr.release;

import com.gamearr.model.CatalogEntry;
import com.gamearr.model.MatchResult;
import com.gamearr.model.ReleaseCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AutoGrabPolicyTest {

    private static final CatalogEntry ENTRY = CatalogEntry.wanted(1, "Hades", null);

    @Test
    void thresholdsAreInclusive() {
        assertTrue(AutoGrabPolicy.shouldAutoGrab(100, 5, 100, 5));
        assertFalse(AutoGrabPolicy.shouldAutoGrab(99, 50, 100, 5));
        assertFalse(AutoGrabPolicy.shouldAutoGrab(200, 4, 100, 5));
    }

    @Test
    void selectsFirstQualifyingInFeedOrder() {
        List<MatchResult> matches = List.of(match("a", 80, 10, false), match("b", 120, 10, false), match("c", 150, 10, false));

        MatchResult chosen = AutoGrabPolicy.selectFirstQualifying(matches, 100, 5).orElseThrow();

        assertEquals(120, chosen.score());
        assertEquals("b", chosen.release().guid());
    }

    @Test
    void skipsUnderSeededAndAdditionalContent() {
        List<MatchResult> matches = List.of(match("a", 200, 1, false), match("b", 200, 50, true), match("c", 110, 6, false));

        assertEquals("c", AutoGrabPolicy.selectFirstQualifying(matches, 100, 5).orElseThrow().release().guid());
    }

    @Test
    void nothingQualifying() {
        assertTrue(AutoGrabPolicy.selectFirstQualifying(List.of(match("a", 90, 90, false)), 100, 5).isEmpty());
        assertTrue(AutoGrabPolicy.selectFirstQualifying(null, 100, 5).isEmpty());
    }

    private static MatchResult match(String guid, int score, int seeders, boolean dlc) {
        ReleaseCandidate release = new ReleaseCandidate(guid, "Hades " + guid, 1L << 30, seeders, 0, "idx", null, "url-" + guid);
        return new MatchResult(release, ENTRY, "hades", "hades", score, 1.0, null, null, dlc);
    }
}
