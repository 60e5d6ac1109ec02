package guraa.stampdetect.visual;

import guraa.stampdetect.model.BoundingBox;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.RescaleOp;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Raster codec helpers: decoding, resizing, greyscale planes, convolution and the
 * perturbations used to build stamp variants. All methods return new images and never
 * modify their input.
 */
public final class ImageOps {

    public static final int DEFAULT_MAX_DIMENSION = 1600;

    private ImageOps() {
    }

    /**
     * Decode an encoded raster (PNG, JPEG, GIF, BMP).
     *
     * @param bytes The encoded image
     * @return The decoded image in RGB
     * @throws IOException If no installed reader understands the bytes
     */
    public static BufferedImage decode(byte[] bytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("No image reader could decode " + bytes.length + " bytes");
        }
        return toRgb(image);
    }

    /**
     * Copy an image into {@code TYPE_INT_RGB}, flattening transparency onto white.
     */
    public static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) {
            return src;
        }
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, src.getWidth(), src.getHeight());
        g.drawImage(src, 0, 0, null);
        g.dispose();
        return rgb;
    }

    /**
     * Scale an image so its longer side is at most {@code maxDim}. Aspect ratio is kept
     * and the image is never enlarged.
     *
     * @param src The image
     * @param maxDim Maximum length of the longer side
     * @return The normalized RGB image
     */
    public static BufferedImage resizeNormalize(BufferedImage src, int maxDim) {
        BufferedImage rgb = toRgb(src);
        int longer = Math.max(rgb.getWidth(), rgb.getHeight());
        if (longer <= maxDim) {
            return rgb;
        }
        double scale = maxDim / (double) longer;
        int w = Math.max(1, (int) Math.round(rgb.getWidth() * scale));
        int h = Math.max(1, (int) Math.round(rgb.getHeight() * scale));
        return resize(rgb, w, h);
    }

    /**
     * Resize to exactly {@code width x height}, ignoring aspect ratio. Large reductions
     * are done in halving steps so thin strokes survive.
     */
    public static BufferedImage resize(BufferedImage src, int width, int height) {
        BufferedImage current = toRgb(src);
        int w = current.getWidth();
        int h = current.getHeight();

        while (w / 2 >= width && h / 2 >= height) {
            w /= 2;
            h /= 2;
            current = drawScaled(current, w, h);
        }
        if (w != width || h != height) {
            current = drawScaled(current, width, height);
        }
        return current;
    }

    /**
     * Resize to {@code width x height} after center-cropping the source to the target
     * aspect ratio, so nothing is stretched.
     */
    public static BufferedImage resizeCover(BufferedImage src, int width, int height) {
        double targetAspect = width / (double) height;
        int sw = src.getWidth();
        int sh = src.getHeight();
        int cropW = sw;
        int cropH = sh;
        if (sw / (double) sh > targetAspect) {
            cropW = Math.max(1, (int) Math.round(sh * targetAspect));
        } else {
            cropH = Math.max(1, (int) Math.round(sw / targetAspect));
        }
        int x = (sw - cropW) / 2;
        int y = (sh - cropH) / 2;
        BufferedImage cropped = (cropW == sw && cropH == sh) ? src : src.getSubimage(x, y, cropW, cropH);
        return resize(cropped, width, height);
    }

    private static BufferedImage drawScaled(BufferedImage src, int width, int height) {
        BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.drawImage(src, 0, 0, width, height, null);
        g.dispose();
        return resized;
    }

    /**
     * Luminance of every pixel, row-major, in the range 0..255.
     */
    public static double[] grayPlane(BufferedImage img) {
        int width = img.getWidth();
        int height = img.getHeight();
        int[] pixels = img.getRGB(0, 0, width, height, null, 0, width);
        double[] plane = new double[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            int rgb = pixels[i];
            int r = (rgb >> 16) & 0xFF;
            int g = (rgb >> 8) & 0xFF;
            int b = rgb & 0xFF;
            // Approximates 0.299R + 0.587G + 0.114B
            plane[i] = (r * 76 + g * 150 + b * 29) >> 8;
        }
        return plane;
    }

    /**
     * Convolve a single-channel plane with a 3x3 kernel, replicating edge pixels.
     * The output is signed and unclamped.
     */
    public static double[] convolve3x3(double[] plane, int width, int height, double[] kernel) {
        if (kernel.length != 9) {
            throw new IllegalArgumentException("Expected a 3x3 kernel");
        }
        double[] out = new double[plane.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0;
                int k = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    int yy = Math.min(height - 1, Math.max(0, y + dy));
                    for (int dx = -1; dx <= 1; dx++) {
                        int xx = Math.min(width - 1, Math.max(0, x + dx));
                        sum += plane[yy * width + xx] * kernel[k++];
                    }
                }
                out[y * width + x] = sum;
            }
        }
        return out;
    }

    /**
     * Normalized 1-D Gaussian kernel with radius {@code ceil(3 * sigma)}.
     */
    static double[] gaussianKernel(double sigma) {
        int radius = Math.max(1, (int) Math.ceil(3 * sigma));
        double[] kernel = new double[2 * radius + 1];
        double sum = 0;
        for (int i = -radius; i <= radius; i++) {
            double value = Math.exp(-(i * i) / (2 * sigma * sigma));
            kernel[i + radius] = value;
            sum += value;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }

    /**
     * Separable Gaussian blur of all three color channels.
     *
     * @param src The image
     * @param sigma Standard deviation in pixels; values {@code <= 0} return a copy
     * @return The blurred image
     */
    public static BufferedImage gaussianBlur(BufferedImage src, double sigma) {
        BufferedImage rgb = toRgb(src);
        int width = rgb.getWidth();
        int height = rgb.getHeight();
        int[] pixels = rgb.getRGB(0, 0, width, height, null, 0, width);
        if (sigma <= 0) {
            BufferedImage copy = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            copy.setRGB(0, 0, width, height, pixels, 0, width);
            return copy;
        }

        double[] kernel = gaussianKernel(sigma);
        int radius = kernel.length / 2;
        int[] horizontal = new int[pixels.length];
        int[] vertical = new int[pixels.length];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double r = 0, g = 0, b = 0;
                for (int k = -radius; k <= radius; k++) {
                    int xx = Math.min(width - 1, Math.max(0, x + k));
                    int p = pixels[y * width + xx];
                    double w = kernel[k + radius];
                    r += ((p >> 16) & 0xFF) * w;
                    g += ((p >> 8) & 0xFF) * w;
                    b += (p & 0xFF) * w;
                }
                horizontal[y * width + x] = pack(r, g, b);
            }
        }
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double r = 0, g = 0, b = 0;
                for (int k = -radius; k <= radius; k++) {
                    int yy = Math.min(height - 1, Math.max(0, y + k));
                    int p = horizontal[yy * width + x];
                    double w = kernel[k + radius];
                    r += ((p >> 16) & 0xFF) * w;
                    g += ((p >> 8) & 0xFF) * w;
                    b += (p & 0xFF) * w;
                }
                vertical[y * width + x] = pack(r, g, b);
            }
        }

        BufferedImage blurred = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        blurred.setRGB(0, 0, width, height, vertical, 0, width);
        return blurred;
    }

    private static int pack(double r, double g, double b) {
        int ri = clampChannel(r);
        int gi = clampChannel(g);
        int bi = clampChannel(b);
        return (ri << 16) | (gi << 8) | bi;
    }

    private static int clampChannel(double v) {
        return (int) Math.max(0, Math.min(255, Math.round(v)));
    }

    /**
     * Round-trip an image through lossy JPEG compression.
     *
     * @param src The image
     * @param quality JPEG quality, 1..100
     * @return The decoded, recompressed image
     * @throws IOException If no JPEG writer is installed or encoding fails
     */
    public static BufferedImage jpegRecompress(BufferedImage src, int quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ImageOutputStream output = new MemoryCacheImageOutputStream(buffer)) {
            writer.setOutput(output);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(Math.max(0.01f, Math.min(1f, quality / 100f)));
            writer.write(null, new IIOImage(toRgb(src), null, null), param);
        } finally {
            writer.dispose();
        }
        return decode(buffer.toByteArray());
    }

    /**
     * Greyscale copy with a linear contrast adjustment {@code out = scale * in + offset}.
     */
    public static BufferedImage grayscaleLinear(BufferedImage src, float scale, float offset) {
        BufferedImage gray = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = gray.createGraphics();
        g.drawImage(toRgb(src), 0, 0, null);
        g.dispose();

        RescaleOp op = new RescaleOp(scale, offset, null);
        op.filter(gray, gray);
        return toRgb(gray);
    }

    /**
     * Copy the region under {@code box}.
     *
     * @throws IllegalArgumentException If the box is not fully inside the image
     */
    public static BufferedImage crop(BufferedImage src, BoundingBox box) {
        if (box == null || !box.fitsWithin(src.getWidth(), src.getHeight())) {
            throw new IllegalArgumentException("Crop " + box + " outside " + src.getWidth() + "x" + src.getHeight());
        }
        BufferedImage patch = new BufferedImage(box.getWidth(), box.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = patch.createGraphics();
        g.drawImage(src.getSubimage(box.getX(), box.getY(), box.getWidth(), box.getHeight()), 0, 0, null);
        g.dispose();
        return patch;
    }
}
