package guraa.stampdetect.service;

import guraa.stampdetect.model.BoundingBox;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Best window found by the {@link SpatialLocator}, in page coordinates.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class LocatorResult {

    /**
     * Null when no window fit on the page or none was evaluated before the deadline.
     */
    private final BoundingBox box;
    private final double score;
    private final int windowsEvaluated;

    /**
     * True when the search stopped because the deadline passed.
     */
    private final boolean truncated;

    public static LocatorResult none(int windowsEvaluated, boolean truncated) {
        return new LocatorResult(null, 0.0, windowsEvaluated, truncated);
    }

    public boolean hasBox() {
        return box != null;
    }
}
