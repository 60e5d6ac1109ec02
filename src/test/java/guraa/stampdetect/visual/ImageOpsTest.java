package guraa.stampdetect.visual;

import guraa.stampdetect.TestImages;
import guraa.stampdetect.model.BoundingBox;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ImageOpsTest {

    @Test
    void resizeNormalizeCapsLongerSideAndKeepsAspect() {
        BufferedImage wide = new BufferedImage(3200, 800, BufferedImage.TYPE_INT_RGB);

        BufferedImage out = ImageOps.resizeNormalize(wide, 1600);

        assertEquals(1600, out.getWidth());
        assertEquals(400, out.getHeight());
    }

    @Test
    void resizeNormalizeNeverEnlarges() {
        BufferedImage small = new BufferedImage(300, 200, BufferedImage.TYPE_INT_RGB);

        BufferedImage out = ImageOps.resizeNormalize(small, 1600);

        assertSame(small, out);
    }

    @Test
    void decodeRejectsGarbage() {
        assertThrows(IOException.class, () -> ImageOps.decode(new byte[]{1, 2, 3, 4, 5}));
    }

    @Test
    void decodeReturnsRgb() throws IOException {
        BufferedImage decoded = ImageOps.decode(TestImages.png(TestImages.redRingStamp()));

        assertEquals(BufferedImage.TYPE_INT_RGB, decoded.getType());
        assertEquals(TestImages.STAMP_SIZE, decoded.getWidth());
    }

    @Test
    void grayscaleLinearProducesNeutralPixels() {
        BufferedImage gray = ImageOps.grayscaleLinear(TestImages.redRingStamp(), 1.05f, -5f);

        for (int y = 0; y < gray.getHeight(); y += 37) {
            for (int x = 0; x < gray.getWidth(); x += 37) {
                int rgb = gray.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                assertEquals(r, g);
                assertEquals(g, b);
            }
        }
    }

    @Test
    void perturbationsKeepDimensions() throws IOException {
        BufferedImage stamp = TestImages.redRingStamp();

        BufferedImage blurred = ImageOps.gaussianBlur(stamp, 0.8);
        BufferedImage jpeg = ImageOps.jpegRecompress(stamp, 60);

        assertEquals(stamp.getWidth(), blurred.getWidth());
        assertEquals(stamp.getHeight(), blurred.getHeight());
        assertEquals(stamp.getWidth(), jpeg.getWidth());
        assertEquals(stamp.getHeight(), jpeg.getHeight());
    }

    @Test
    void gaussianKernelSumsToOne() {
        double sum = 0;
        for (double v : ImageOps.gaussianKernel(0.8)) {
            sum += v;
        }
        assertEquals(1.0, sum, 1e-9);
    }

    @Test
    void cropOutsideImageThrows() {
        BufferedImage img = new BufferedImage(100, 100, BufferedImage.TYPE_INT_RGB);

        assertThrows(IllegalArgumentException.class, () -> ImageOps.crop(img, new BoundingBox(50, 50, 60, 10)));
        assertEquals(40, ImageOps.crop(img, new BoundingBox(60, 0, 40, 10)).getWidth());
    }

    @Test
    void convolveWithIdentityKernelIsNoOp() {
        double[] plane = {1, 2, 3, 4, 5, 6};
        double[] identity = {0, 0, 0, 0, 1, 0, 0, 0, 0};

        double[] out = ImageOps.convolve3x3(plane, 3, 2, identity);

        for (int i = 0; i < plane.length; i++) {
            assertEquals(plane[i], out[i], 1e-12);
        }
    }
}
