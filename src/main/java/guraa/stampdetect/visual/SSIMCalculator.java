package guraa.stampdetect.visual;

import java.awt.image.BufferedImage;

/**
 * Global structural similarity between two images.
 * Both images are reduced to the same 128x128 greyscale plane and compared as a single
 * window, which is enough to rank stamp candidates and is far cheaper than a sliding
 * window.
 */
public final class SSIMCalculator {

    public static final int PLANE_SIZE = 128;

    // Constants for SSIM calculation
    private static final double L = 255;
    private static final double K1 = 0.01;
    private static final double K2 = 0.03;
    private static final double C1 = Math.pow(L * K1, 2);
    private static final double C2 = Math.pow(L * K2, 2);

    private SSIMCalculator() {
    }

    /**
     * Calculate the SSIM between two images.
     *
     * @param img1 The first image
     * @param img2 The second image
     * @return The SSIM value (0.0 to 1.0)
     */
    public static double calculate(BufferedImage img1, BufferedImage img2) {
        return calculate(plane(img1), plane(img2));
    }

    /**
     * The 128x128 greyscale plane SSIM works on. Callers that compare one image many
     * times compute this once.
     */
    public static double[] plane(BufferedImage img) {
        return ImageOps.grayPlane(ImageOps.resizeCover(img, PLANE_SIZE, PLANE_SIZE));
    }

    /**
     * Calculate the SSIM between two planes of equal length.
     *
     * @param window1 The first plane
     * @param window2 The second plane
     * @return The SSIM value (0.0 to 1.0), never NaN
     */
    public static double calculate(double[] window1, double[] window2) {
        int n = Math.min(window1.length, window2.length);
        if (n < 2) {
            return 0.0;
        }

        // Compute means
        double mean1 = 0, mean2 = 0;
        for (int i = 0; i < n; i++) {
            mean1 += window1[i];
            mean2 += window2[i];
        }
        mean1 /= n;
        mean2 /= n;

        // Compute sample variances and covariance
        double variance1 = 0, variance2 = 0, covariance = 0;
        for (int i = 0; i < n; i++) {
            double diff1 = window1[i] - mean1;
            double diff2 = window2[i] - mean2;
            variance1 += diff1 * diff1;
            variance2 += diff2 * diff2;
            covariance += diff1 * diff2;
        }
        variance1 /= n - 1;
        variance2 /= n - 1;
        covariance /= n - 1;

        double numerator = (2 * mean1 * mean2 + C1) * (2 * covariance + C2);
        double denominator = (mean1 * mean1 + mean2 * mean2 + C1) * (variance1 + variance2 + C2);

        return Similarity.clamp01(numerator / denominator);
    }
}
