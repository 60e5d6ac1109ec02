package guraa.stampdetect;

import guraa.stampdetect.visual.ImageOps;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Synthesized stamps and documents for tests.
 */
public final class TestImages {

    public static final int STAMP_SIZE = 400;

    private TestImages() {
    }

    /**
     * Red double ring with bars on white.
     */
    public static BufferedImage redRingStamp() {
        BufferedImage img = new BufferedImage(STAMP_SIZE, STAMP_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, STAMP_SIZE, STAMP_SIZE);

        g.setColor(new Color(200, 20, 30));
        g.setStroke(new BasicStroke(18));
        g.drawOval(40, 40, 320, 320);
        g.setStroke(new BasicStroke(8));
        g.drawOval(110, 110, 180, 180);
        g.fillRect(120, 170, 160, 20);
        g.fillRect(120, 215, 160, 20);
        g.fillRect(150, 120, 30, 30);
        g.dispose();
        return img;
    }

    /**
     * Green diagonal stripes, no white.
     */
    public static BufferedImage greenStripeStamp() {
        BufferedImage img = new BufferedImage(STAMP_SIZE, STAMP_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(new Color(20, 90, 40));
        g.fillRect(0, 0, STAMP_SIZE, STAMP_SIZE);
        g.setColor(new Color(60, 160, 80));
        g.setStroke(new BasicStroke(24));
        for (int i = -STAMP_SIZE; i < STAMP_SIZE * 2; i += 80) {
            g.drawLine(i, 0, i + STAMP_SIZE, STAMP_SIZE);
        }
        g.dispose();
        return img;
    }

    /**
     * A white page with {@code stamp} drawn at the given position and size.
     */
    public static BufferedImage pageWithStamp(int width, int height, BufferedImage stamp, int x, int y, int side) {
        BufferedImage page = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = page.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, width, height);
        g.drawImage(ImageOps.resize(stamp, side, side), x, y, null);
        g.dispose();
        return page;
    }

    public static byte[] png(BufferedImage img) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }

    public static Path writePng(Path dir, String name, BufferedImage img) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, png(img));
        return file;
    }

    /**
     * Single A4 page with {@code img} embedded losslessly.
     */
    public static byte[] pdfWithImage(BufferedImage img) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            PDImageXObject image = LosslessFactory.createFromImage(document, img);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.drawImage(image, 100, 400, 200, 200);
            }
            return save(document);
        }
    }

    public static byte[] blankPdf(int pages) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (int i = 0; i < pages; i++) {
                document.addPage(new PDPage(PDRectangle.A4));
            }
            return save(document);
        }
    }

    private static byte[] save(PDDocument document) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        return out.toByteArray();
    }

    /**
     * Minimal DOCX package holding {@code img} as its only media entry.
     */
    public static byte[] docxWithImage(BufferedImage img) throws IOException {
        return docxWithImages(img);
    }

    /**
     * Minimal DOCX package with one media entry per image, named {@code image1.png} onwards.
     */
    public static byte[] docxWithImages(BufferedImage... images) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            putEntry(zip, "[Content_Types].xml",
                    "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                            + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"
                            + "<Default Extension=\"png\" ContentType=\"image/png\"/></Types>");
            putEntry(zip, "word/document.xml",
                    "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                            + "<w:document xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\">"
                            + "<w:body/></w:document>");
            for (int i = 0; i < images.length; i++) {
                zip.putNextEntry(new ZipEntry("word/media/image" + (i + 1) + ".png"));
                zip.write(png(images[i]));
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }

    /**
     * A ZIP archive that is not an OOXML package.
     */
    public static byte[] plainZip() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            putEntry(zip, "readme.txt", "hello");
        }
        return out.toByteArray();
    }

    private static void putEntry(ZipOutputStream zip, String name, String content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }
}
