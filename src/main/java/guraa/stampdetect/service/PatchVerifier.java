package guraa.stampdetect.service;

import guraa.stampdetect.model.BoundingBox;
import guraa.stampdetect.model.PatchVerification;
import guraa.stampdetect.model.StampReference;
import guraa.stampdetect.visual.EdgeDescriptor;
import guraa.stampdetect.visual.ImageOps;
import guraa.stampdetect.visual.SSIMCalculator;
import guraa.stampdetect.visual.Similarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Confirms a located box by comparing the crop under it with the stamp.
 */
@Slf4j
@Component
public class PatchVerifier {

    public Optional<PatchVerification> verify(BufferedImage page, BoundingBox box, StampReference stamp) {
        if (box == null) {
            return Optional.empty();
        }
        BufferedImage patch;
        try {
            patch = ImageOps.crop(page, box);
        } catch (RuntimeException e) {
            log.debug("Could not crop {} from page: {}", box, e.getMessage());
            return Optional.empty();
        }

        float[] patchEdge = EdgeDescriptor.compute(patch);
        double ncc = Similarity.ncc(patchEdge, stamp.primary().getEdgeDescriptor());
        double ssim = SSIMCalculator.calculate(SSIMCalculator.plane(patch), stamp.getSsimPlane());
        return Optional.of(new PatchVerification(box, ncc, ssim));
    }
}
