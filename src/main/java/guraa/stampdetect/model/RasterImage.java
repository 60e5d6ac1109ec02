package guraa.stampdetect.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.awt.image.BufferedImage;

/**
 * A page image handed to feature extraction. Always already normalized to the
 * configured maximum dimension.
 */
@Getter
@RequiredArgsConstructor
public class RasterImage {

    /**
     * Where the raster came from.
     */
    public enum Source {
        EMBEDDED,
        RENDERED,
        PACKAGE,
        IMAGE
    }

    private final BufferedImage image;
    private final Source source;

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }

    public int getChannels() {
        return image.getColorModel().getNumComponents();
    }
}
