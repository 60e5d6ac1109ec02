package guraa.stampdetect.visual;

import guraa.stampdetect.model.FeatureTriplet;

import java.awt.image.BufferedImage;

/**
 * Reduces an image to its {@link FeatureTriplet}.
 */
public final class FeatureExtractor {

    private FeatureExtractor() {
    }

    public static FeatureTriplet extract(BufferedImage img) {
        return new FeatureTriplet(
                PerceptualHash.compute(img),
                ColorHistogram.compute(img),
                EdgeDescriptor.compute(img));
    }
}
