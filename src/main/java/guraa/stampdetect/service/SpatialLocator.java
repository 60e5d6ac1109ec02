package guraa.stampdetect.service;

import guraa.stampdetect.config.StampProperties;
import guraa.stampdetect.core.TimeBudget;
import guraa.stampdetect.model.BoundingBox;
import guraa.stampdetect.visual.EdgeDescriptor;
import guraa.stampdetect.visual.ImageOps;
import guraa.stampdetect.visual.Similarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bounded multi-scale sliding-window search for the region of a page whose edge
 * descriptor best matches a stamp.
 */
@Slf4j
@Component
public class SpatialLocator {

    private static final int MIN_WINDOW = 64;

    private final StampProperties properties;

    public SpatialLocator(StampProperties properties) {
        this.properties = properties;
    }

    /**
     * Search a page for a stamp.
     * The page is reduced to the configured search width first; window positions are
     * mapped back to page coordinates and clamped into the page.
     *
     * @param page The normalized page image
     * @param stampEdge Edge descriptor of the unperturbed stamp
     * @param budget The running time budget
     * @return The best window, or no box when nothing could be evaluated
     */
    public LocatorResult locate(BufferedImage page, float[] stampEdge, TimeBudget budget) {
        int srcW = page.getWidth();
        int srcH = page.getHeight();

        double scaleDown = Math.min(1.0, properties.getLocDownsampleWidth() / (double) srcW);
        int dsW = Math.max(1, (int) Math.round(srcW * scaleDown));
        int dsH = Math.max(1, (int) Math.round(srcH * scaleDown));
        BufferedImage search = (dsW == srcW && dsH == srcH) ? ImageOps.toRgb(page) : ImageOps.resize(page, dsW, dsH);

        List<Window> windows = new ArrayList<>();
        int maxPatches = Math.max(0, properties.getLocMaxPatches());
        int stride = Math.max(1, properties.getLocStride());
        boolean truncated = false;

        scan:
        for (double scale : properties.getLocScales()) {
            int side = Math.max(MIN_WINDOW, (int) Math.round(properties.getLocBase() * scale));
            for (int y = 0; y + side <= dsH; y += stride) {
                for (int x = 0; x + side <= dsW; x += stride) {
                    // Scales and rows are visited in order, so the cap decides which of them get scanned
                    if (windows.size() >= maxPatches) {
                        break scan;
                    }
                    if (budget.isExhausted()) {
                        truncated = true;
                        break scan;
                    }
                    float[] edge = EdgeDescriptor.compute(search.getSubimage(x, y, side, side));
                    windows.add(new Window(x, y, side, Similarity.cosine(stampEdge, edge)));
                }
            }
        }

        if (windows.isEmpty()) {
            log.debug("Locator found no window on a {}x{} page", srcW, srcH);
            return LocatorResult.none(0, truncated);
        }

        windows.sort(Comparator.comparingDouble((Window w) -> w.score).reversed());
        double inv = srcW / (double) dsW;
        double invY = srcH / (double) dsH;

        BoundingBox best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Window w : windows.subList(0, Math.min(Math.max(1, properties.getLocTopK()), windows.size()))) {
            BoundingBox box = toPage(w, inv, invY, srcW, srcH);
            if (w.score > bestScore) {
                bestScore = w.score;
                best = box;
            }
        }

        log.debug("Locator evaluated {} windows, best {} at {}", windows.size(), bestScore, best);
        return new LocatorResult(best, bestScore, windows.size(), truncated);
    }

    static BoundingBox toPage(Window w, double invX, double invY, int srcW, int srcH) {
        int bx = (int) Math.round(w.x * invX);
        int by = (int) Math.round(w.y * invY);
        int bw = (int) Math.round(w.side * invX);
        int bh = (int) Math.round(w.side * invY);

        bx = Math.max(0, Math.min(bx, srcW - 1));
        by = Math.max(0, Math.min(by, srcH - 1));
        bw = Math.max(1, Math.min(bw, srcW - bx));
        bh = Math.max(1, Math.min(bh, srcH - by));
        return new BoundingBox(bx, by, bw, bh);
    }

    static final class Window {
        final int x;
        final int y;
        final int side;
        final double score;

        Window(int x, int y, int side, double score) {
            this.x = x;
            this.y = y;
            this.side = side;
            this.score = score;
        }
    }
}
