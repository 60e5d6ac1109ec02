package guraa.stampdetect.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The three cheap features every page and every stamp variant is reduced to.
 * Arrays are shared, never mutated after construction.
 */
@Getter
@RequiredArgsConstructor
public class FeatureTriplet {

    /**
     * 64-bit difference hash.
     */
    private final long hash;

    /**
     * Hue/saturation histogram, sums to 1.
     */
    private final double[] histogram;

    /**
     * L2-normalized Sobel magnitudes over a fixed square grid.
     */
    private final float[] edgeDescriptor;
}
