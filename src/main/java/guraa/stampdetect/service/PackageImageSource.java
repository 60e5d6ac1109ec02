package guraa.stampdetect.service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;

/**
 * Pulls the raster media out of a word-processor package.
 */
public interface PackageImageSource {

    /**
     * @param packageBytes The package contents
     * @param maxEntries Maximum number of images to return
     * @return Decoded images in package order
     * @throws IOException If the package cannot be read
     */
    List<BufferedImage> extractPackageImages(byte[] packageBytes, int maxEntries) throws IOException;
}
