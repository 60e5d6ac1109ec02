package guraa.stampdetect.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A scored page/stamp pairing. Produced by the coarse matcher, ranked, then discarded.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class MatchCandidate {

    private final int pageIndex;
    private final String stampName;
    private final double fusedScore;

    private final double edgeSim;
    private final double colorSim;
    private final double hashSim;

    /**
     * Only set by the refine stage.
     */
    private final double ssim;
    private final boolean refined;
}
