package guraa.stampdetect.service;

import guraa.stampdetect.config.StampProperties;
import guraa.stampdetect.model.BoundingBox;
import guraa.stampdetect.model.MatchCandidate;
import guraa.stampdetect.model.PatchVerification;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionPolicyTest {

    private final DecisionPolicy policy = new DecisionPolicy(new StampProperties());
    private final BoundingBox box = new BoundingBox(10, 10, 100, 100);

    @Test
    void strongCoarseNeedsScoreAndMargin() {
        Decision strong = policy.decide(0.92, 0.10, null, false);
        Decision narrow = policy.decide(0.92, 0.03, null, false);

        assertTrue(strong.isMatch());
        assertEquals(Decision.Reason.STRONG_COARSE, strong.getReason());
        assertFalse(narrow.isMatch());
        assertEquals(Decision.Reason.NO_MATCH, narrow.getReason());
    }

    @Test
    void bandedMatchNeedsALocatedBox() {
        PatchVerification weak = new PatchVerification(box, 0.12, 0.0);

        Decision withBox = policy.decide(0.82, 0.06, weak, false);
        Decision withoutBox = policy.decide(0.82, 0.06, null, false);

        assertTrue(withBox.isMatch());
        assertEquals("banded-with-refine", withBox.getReason().getLabel());
        assertFalse(withoutBox.isMatch());
    }

    @Test
    void bandedMatchRejectsPoorPatch() {
        PatchVerification poor = new PatchVerification(box, 0.05, 0.20);

        assertFalse(policy.decide(0.85, 0.06, poor, false).isMatch());
    }

    @Test
    void strongPatchStillNeedsTheBand() {
        PatchVerification strong = new PatchVerification(box, 0.9, 0.9);

        assertFalse(policy.decide(0.79, 0.2, strong, false).isMatch());
        assertFalse(policy.decide(0.85, 0.04, strong, false).isMatch());
    }

    @Test
    void exhaustedBudgetIsReportedInsteadOfNoMatch() {
        Decision decision = policy.decide(0.4, 0.0, null, true);

        assertFalse(decision.isMatch());
        assertEquals("budget-exhausted", decision.getReason().getLabel());
    }

    @Test
    void aMatchWinsOverAnExhaustedBudget() {
        assertEquals(Decision.Reason.STRONG_COARSE, policy.decide(0.95, 0.2, null, true).getReason());
    }

    @Test
    void decisionIsMonotonicInTopScore() {
        PatchVerification patch = new PatchVerification(box, 0.3, 0.3);
        for (double margin : new double[]{0.0, 0.055, 0.08}) {
            boolean matched = false;
            for (int i = 0; i <= 100; i++) {
                boolean match = policy.decide(i / 100.0, margin, patch, false).isMatch();
                assertFalse(matched && !match, "match lost at score " + i / 100.0);
                matched |= match;
            }
        }
    }

    @Test
    void rankingMarginIsTopMinusRunnerUp() {
        CoarseRanking ranking = new CoarseRanking(List.of(
                candidate("a.png", 0.93),
                candidate("b.png", 0.80)), false);

        Decision decision = policy.decide(ranking, null);

        assertTrue(decision.isMatch());
        assertEquals(0.13, decision.getMargin(), 1e-9);
    }

    @Test
    void emptyRankingIsNoMatch() {
        Decision decision = policy.decide(CoarseRanking.empty(false), null);

        assertFalse(decision.isMatch());
        assertEquals(0.0, decision.getMargin());
    }

    private static MatchCandidate candidate(String stamp, double score) {
        return MatchCandidate.builder().stampName(stamp).fusedScore(score).build();
    }
}
