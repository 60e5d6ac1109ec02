package guraa.stampdetect.service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;

/**
 * Turns a PDF into rasters. Implementations own all PDF parsing; the detector only sees
 * the decoded images.
 */
public interface PdfRasterSource {

    /**
     * Raster images embedded in the first {@code maxPages} pages, in page order.
     *
     * @param pdfBytes The PDF file contents
     * @param maxPages Maximum number of pages to walk
     * @return The decoded images, possibly empty
     * @throws IOException If the document cannot be parsed
     */
    List<BufferedImage> extractEmbeddedImages(byte[] pdfBytes, int maxPages) throws IOException;

    /**
     * Rasterize the first {@code maxPages} pages at {@code dpi}.
     *
     * @param pdfBytes The PDF file contents
     * @param dpi Rendering resolution
     * @param maxPages Maximum number of pages to render
     * @return One image per rendered page
     * @throws IOException If the document cannot be parsed
     */
    List<BufferedImage> renderPages(byte[] pdfBytes, int dpi, int maxPages) throws IOException;
}
