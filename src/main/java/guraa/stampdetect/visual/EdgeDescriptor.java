package guraa.stampdetect.visual;

import java.awt.image.BufferedImage;

/**
 * Gradient-magnitude descriptor over a fixed square grid.
 */
public final class EdgeDescriptor {

    public static final int DEFAULT_SIZE = 128;

    private static final double[] SOBEL_X = {
            -1, 0, 1,
            -2, 0, 2,
            -1, 0, 1
    };
    private static final double[] SOBEL_Y = {
            -1, -2, -1,
             0,  0,  0,
             1,  2,  1
    };

    /**
     * The convolution runs in signed floating point, so there is no fixed-point
     * offset to recenter.
     */
    private static final double CONVOLUTION_BIAS = 0.0;

    private EdgeDescriptor() {
    }

    public static float[] compute(BufferedImage img) {
        return compute(img, DEFAULT_SIZE);
    }

    /**
     * Cover-resize to {@code size x size} greyscale, apply Sobel X/Y and L2-normalize
     * the per-pixel gradient magnitudes.
     *
     * @param img The image
     * @param size Grid side length
     * @return Unit-length vector of {@code size * size} magnitudes, or all zeros for a flat image
     */
    public static float[] compute(BufferedImage img, int size) {
        double[] gray = ImageOps.grayPlane(ImageOps.resizeCover(img, size, size));
        double[] gx = ImageOps.convolve3x3(gray, size, size, SOBEL_X);
        double[] gy = ImageOps.convolve3x3(gray, size, size, SOBEL_Y);

        double[] magnitudes = new double[gray.length];
        double sumSquares = 0;
        for (int i = 0; i < magnitudes.length; i++) {
            double mag = Math.hypot(gx[i] - CONVOLUTION_BIAS, gy[i] - CONVOLUTION_BIAS);
            magnitudes[i] = mag;
            sumSquares += mag * mag;
        }

        double norm = Math.sqrt(sumSquares) + 1e-8;
        float[] descriptor = new float[magnitudes.length];
        for (int i = 0; i < descriptor.length; i++) {
            descriptor[i] = (float) (magnitudes[i] / norm);
        }
        return descriptor;
    }
}
