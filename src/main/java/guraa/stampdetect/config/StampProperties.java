package guraa.stampdetect.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuning knobs for stamp detection, bound from {@code app.stamp.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.stamp")
public class StampProperties {

    /**
     * Directory the reference stamps are loaded from.
     */
    private String directory = "public/stamps";

    // Robustness variants built for each stamp
    private boolean robustAugmentations = true;
    private double augBlurSigma = 0.8;
    private int augJpegQuality = 60;
    private boolean augGrayscale = true;
    private float augGrayscaleContrast = 1.05f;
    private float augGrayscaleOffset = -5f;

    // Decision thresholds
    private double thresholdHi = 0.88;
    private double thresholdLo = 0.80;
    private double marginMin = 0.07;
    private double marginLo = 0.05;
    private double nccBand = 0.10;
    private double ssimBand = 0.25;

    private long timeBudgetMs = 8000;

    // Document normalization
    private boolean renderAlways = true;
    private boolean renderFallback = true;
    private int renderDpi = 144;
    private int renderTopPages = 3;
    private int maxPages = 12;
    private int maxStamps = 64;
    private int maxImageDimension = 1600;

    // Coarse matching
    private int coarseTopK = 6;
    private double prelocThreshold = 0.80;

    // Locator
    private int locDownsampleWidth = 900;
    private int locBase = 160;
    private List<Double> locScales = new ArrayList<>(List.of(0.6, 0.8, 1.0, 1.25));
    private int locStride = 28;
    private int locMaxPatches = 360;
    private int locTopK = 6;
    private long locatorMinRemainingMs = 300;

    private long secondPassMinRemainingMs = 600;
}
