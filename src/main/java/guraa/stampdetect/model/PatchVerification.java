package guraa.stampdetect.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Localized confirmation of a coarse match: the located box and how well the crop
 * under it agrees with the stamp.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class PatchVerification {

    private final BoundingBox box;
    private final double ncc;
    private final double ssim;
}
