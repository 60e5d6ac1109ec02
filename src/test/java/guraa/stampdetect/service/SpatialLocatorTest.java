package guraa.stampdetect.service;

import guraa.stampdetect.TestImages;
import guraa.stampdetect.config.StampProperties;
import guraa.stampdetect.core.TimeBudget;
import guraa.stampdetect.model.BoundingBox;
import guraa.stampdetect.visual.EdgeDescriptor;
import org.junit.jupiter.api.Test;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpatialLocatorTest {

    private final StampProperties properties = new StampProperties();
    private final SpatialLocator locator = new SpatialLocator(properties);
    private final float[] stampEdge = EdgeDescriptor.compute(TestImages.redRingStamp());

    @Test
    void boxesStayInsideThePage() {
        BufferedImage page = TestImages.pageWithStamp(1200, 900, TestImages.redRingStamp(), 900, 640, 240);

        LocatorResult result = locator.locate(page, stampEdge, TimeBudget.ofMillis(30_000));

        assertTrue(result.hasBox());
        assertTrue(result.getBox().fitsWithin(page.getWidth(), page.getHeight()), result.getBox().toString());
        assertTrue(result.getWindowsEvaluated() <= properties.getLocMaxPatches());
        assertFalse(result.isTruncated());
    }

    @Test
    void boxLandsOnStampNearTopOfPage() {
        int stampX = 100;
        int stampY = 60;
        int side = 240;
        BufferedImage page = TestImages.pageWithStamp(1200, 900, TestImages.redRingStamp(), stampX, stampY, side);

        LocatorResult result = locator.locate(page, stampEdge, TimeBudget.ofMillis(30_000));

        assertTrue(result.hasBox());
        BoundingBox box = result.getBox();
        Rectangle stamp = new Rectangle(stampX, stampY, side, side);
        Rectangle found = new Rectangle(box.getX(), box.getY(), box.getWidth(), box.getHeight());
        assertTrue(stamp.intersects(found), box + " misses the stamp");
        assertTrue(stamp.contains(found.getCenterX(), found.getCenterY()), box + " is not centred on the stamp");
        assertTrue(result.getScore() > 0.0);
    }

    @Test
    void oddPageSizesStayInside() {
        properties.setLocScales(List.of(1.0));
        for (int[] size : new int[][]{{64, 64}, {131, 977}, {1599, 203}, {901, 901}}) {
            BufferedImage page = TestImages.pageWithStamp(size[0], size[1], TestImages.redRingStamp(), 0, 0, 60);

            LocatorResult result = locator.locate(page, stampEdge, TimeBudget.ofMillis(30_000));

            if (result.hasBox()) {
                BoundingBox box = result.getBox();
                assertTrue(box.fitsWithin(size[0], size[1]), box + " outside " + size[0] + "x" + size[1]);
            }
        }
    }

    @Test
    void pageSmallerThanAnyWindowHasNoBox() {
        BufferedImage page = new BufferedImage(50, 50, BufferedImage.TYPE_INT_RGB);

        LocatorResult result = locator.locate(page, stampEdge, TimeBudget.ofMillis(30_000));

        assertFalse(result.hasBox());
    }

    @Test
    void exhaustedBudgetStopsTheSearch() {
        BufferedImage page = TestImages.pageWithStamp(800, 800, TestImages.redRingStamp(), 100, 100, 200);

        LocatorResult result = locator.locate(page, stampEdge, TimeBudget.ofMillis(0));

        assertFalse(result.hasBox());
        assertTrue(result.isTruncated());
    }

    @Test
    void mappingClampsIntoPage() {
        SpatialLocator.Window window = new SpatialLocator.Window(880, 880, 160, 1.0);

        BoundingBox box = SpatialLocator.toPage(window, 1.2, 1.2, 1100, 1100);

        assertTrue(box.fitsWithin(1100, 1100), box.toString());
    }
}
