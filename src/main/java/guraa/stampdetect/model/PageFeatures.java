package guraa.stampdetect.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Features of one normalized page, computed once per detection run.
 */
@Getter
@RequiredArgsConstructor
public class PageFeatures {

    private final int pageIndex;
    private final RasterImage page;
    private final FeatureTriplet triplet;

    /**
     * Greyscale plane used for the refine-stage SSIM.
     */
    private final double[] ssimPlane;
}
