package guraa.stampdetect.visual;

import java.awt.image.BufferedImage;

/**
 * 64-bit difference hash (dHash) of an image.
 */
public final class PerceptualHash {

    private static final int GRID_WIDTH = 9;
    private static final int GRID_HEIGHT = 8;

    private PerceptualHash() {
    }

    /**
     * Downsample to a 9x8 greyscale grid and emit one bit per horizontally adjacent
     * pair, set when the left pixel is brighter. Rows are emitted top to bottom, most
     * significant bit first.
     *
     * @param img The image
     * @return The 64-bit fingerprint
     */
    public static long compute(BufferedImage img) {
        double[] gray = ImageOps.grayPlane(ImageOps.resize(img, GRID_WIDTH, GRID_HEIGHT));
        long hash = 0L;
        for (int row = 0; row < GRID_HEIGHT; row++) {
            for (int col = 0; col < GRID_WIDTH - 1; col++) {
                double left = gray[row * GRID_WIDTH + col];
                double right = gray[row * GRID_WIDTH + col + 1];
                hash = (hash << 1) | (left > right ? 1L : 0L);
            }
        }
        return hash;
    }

    /**
     * Fraction of matching bits, 0..1.
     */
    public static double similarity(long a, long b) {
        return (64 - Long.bitCount(a ^ b)) / 64.0;
    }
}
