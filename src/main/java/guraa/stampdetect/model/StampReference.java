package guraa.stampdetect.model;

import lombok.Getter;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * A reference stamp with its robustness variants. The first variant is always the
 * unperturbed base image.
 */
@Getter
public class StampReference {

    private final String name;
    private final BufferedImage baseImage;
    private final List<FeatureTriplet> variants;
    private final double[] ssimPlane;

    public StampReference(String name, BufferedImage baseImage, List<FeatureTriplet> variants, double[] ssimPlane) {
        if (variants == null || variants.isEmpty()) {
            throw new IllegalArgumentException("Stamp " + name + " needs at least its base variant");
        }
        this.name = name;
        this.baseImage = baseImage;
        this.variants = List.copyOf(variants);
        this.ssimPlane = ssimPlane;
    }

    public FeatureTriplet primary() {
        return variants.get(0);
    }
}
