package guraa.stampdetect.visual;

import java.awt.image.BufferedImage;

/**
 * Normalized 2-D hue/saturation histogram.
 */
public final class ColorHistogram {

    public static final int DEFAULT_HUE_BINS = 16;
    public static final int DEFAULT_SAT_BINS = 8;

    private static final int SAMPLE_SIZE = 128;

    private ColorHistogram() {
    }

    public static double[] compute(BufferedImage img) {
        return compute(img, DEFAULT_HUE_BINS, DEFAULT_SAT_BINS);
    }

    /**
     * Cover-resize to 128x128 and accumulate hue/saturation counts, normalized to sum 1.
     * Bin {@code h * satBins + s}.
     */
    public static double[] compute(BufferedImage img, int hueBins, int satBins) {
        BufferedImage sample = ImageOps.resizeCover(img, SAMPLE_SIZE, SAMPLE_SIZE);
        int[] pixels = sample.getRGB(0, 0, SAMPLE_SIZE, SAMPLE_SIZE, null, 0, SAMPLE_SIZE);
        double[] hist = new double[hueBins * satBins];

        for (int rgb : pixels) {
            double r = ((rgb >> 16) & 0xFF) / 255.0;
            double g = ((rgb >> 8) & 0xFF) / 255.0;
            double b = (rgb & 0xFF) / 255.0;
            double max = Math.max(r, Math.max(g, b));
            double min = Math.min(r, Math.min(g, b));
            double delta = max - min;

            double hue = 0;
            if (delta != 0) {
                if (max == r) {
                    hue = (g - b) / delta + (g < b ? 6 : 0);
                } else if (max == g) {
                    hue = (b - r) / delta + 2;
                } else {
                    hue = (r - g) / delta + 4;
                }
                hue /= 6;
            }
            double saturation = max == 0 ? 0 : delta / max;

            int hi = Math.min(hueBins - 1, (int) Math.floor(hue * hueBins));
            int si = Math.min(satBins - 1, (int) Math.floor(saturation * satBins));
            hist[hi * satBins + si] += 1;
        }

        double sum = 0;
        for (double v : hist) {
            sum += v;
        }
        for (int i = 0; i < hist.length; i++) {
            hist[i] /= (sum + 1e-8);
        }
        return hist;
    }
}
