package guraa.stampdetect.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rasterizes PDF pages with retries and a low-DPI fallback for problematic pages.
 */
@Slf4j
public final class PdfRenderer {

    private static final int DEFAULT_DPI = 144;
    private static final int FALLBACK_DPI = 72;
    private static final int MAX_RETRIES = 2;

    private PdfRenderer() {
    }

    /**
     * Render the first {@code maxPages} pages. Pages that cannot be rendered are skipped
     * rather than replaced with a placeholder, since a placeholder would be scored as
     * page content.
     *
     * @param document The PDF document
     * @param dpi The DPI setting for rendering
     * @param maxPages Maximum number of pages to render
     * @return The rendered pages, in page order
     */
    public static List<BufferedImage> renderPages(PDDocument document, int dpi, int maxPages) {
        if (document == null) {
            throw new IllegalArgumentException("Document cannot be null");
        }
        if (dpi <= 0) dpi = DEFAULT_DPI;

        int count = Math.min(document.getNumberOfPages(), Math.max(0, maxPages));
        PDFRenderer renderer = new PDFRenderer(document);
        List<BufferedImage> pages = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            try {
                pages.add(renderPageWithRetry(renderer, i, dpi));
            } catch (IOException e) {
                log.warn("Skipping page {} after rendering failed: {}", i + 1, e.getMessage());
            }
        }
        return pages;
    }

    /**
     * Renders a specific page with retry mechanism for improved reliability.
     *
     * @param renderer The PDF renderer
     * @param pageIndex The zero-based page index to render
     * @param dpi The DPI setting for rendering
     * @return The rendered page as a BufferedImage
     * @throws IOException If rendering fails after all retries and the fallback
     */
    static BufferedImage renderPageWithRetry(PDFRenderer renderer, int pageIndex, int dpi) throws IOException {
        int attempts = 0;

        while (true) {
            try {
                return renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
            } catch (Exception e) {
                attempts++;
                if (attempts >= MAX_RETRIES) {
                    log.warn("Standard rendering failed for page {}, trying {} dpi", pageIndex + 1, FALLBACK_DPI);
                    try {
                        return renderer.renderImageWithDPI(pageIndex, Math.min(dpi, FALLBACK_DPI), ImageType.RGB);
                    } catch (Exception fallbackEx) {
                        throw new IOException("Failed to render page " + (pageIndex + 1), fallbackEx);
                    }
                }
                log.debug("Rendering attempt {} failed for page {}: {}", attempts, pageIndex + 1, e.getMessage());
            }
        }
    }
}
