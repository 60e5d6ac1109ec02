package guraa.stampdetect.service;

import guraa.stampdetect.config.StampProperties;
import guraa.stampdetect.model.PatchVerification;
import org.springframework.stereotype.Component;

/**
 * Turns the top fused score, its margin over the runner-up and the optional patch
 * verification into a match verdict.
 */
@Component
public class DecisionPolicy {

    static final double STRONG_NCC = 0.68;
    static final double STRONG_SSIM = 0.62;

    private final StampProperties properties;

    public DecisionPolicy(StampProperties properties) {
        this.properties = properties;
    }

    public Decision decide(CoarseRanking ranking, PatchVerification verification) {
        double top = ranking.best().map(c -> c.getFusedScore()).orElse(0.0);
        return decide(top, top - ranking.runnerUpScore(), verification, ranking.isBudgetExhausted());
    }

    /**
     * Decide a match.
     *
     * @param fused Top fused score
     * @param margin Top score minus the runner-up score
     * @param verification Patch verification of the located box, may be null
     * @param budgetExhausted Whether the deadline passed before the evidence was complete
     * @return The verdict
     */
    public Decision decide(double fused, double margin, PatchVerification verification, boolean budgetExhausted) {
        if (fused >= properties.getThresholdHi() && margin >= properties.getMarginMin()) {
            return new Decision(true, Decision.Reason.STRONG_COARSE, margin);
        }

        boolean inBand = fused >= properties.getThresholdLo() && margin >= properties.getMarginLo();
        if (inBand && verification != null && verification.getBox() != null) {
            double ncc = verification.getNcc();
            double ssim = verification.getSsim();
            boolean strong = ncc >= STRONG_NCC || ssim >= STRONG_SSIM;
            boolean banded = ncc >= properties.getNccBand() || ssim >= properties.getSsimBand();
            if (strong || banded) {
                return new Decision(true, Decision.Reason.BANDED_WITH_REFINE, margin);
            }
        }

        return new Decision(false,
                budgetExhausted ? Decision.Reason.BUDGET_EXHAUSTED : Decision.Reason.NO_MATCH, margin);
    }
}
