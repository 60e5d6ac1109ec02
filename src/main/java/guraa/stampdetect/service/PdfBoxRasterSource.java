package guraa.stampdetect.service;

import guraa.stampdetect.util.PdfImageExtractor;
import guraa.stampdetect.util.PdfLoader;
import guraa.stampdetect.util.PdfRenderer;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link PdfRasterSource} backed by Apache PDFBox.
 */
@Slf4j
@Component
public class PdfBoxRasterSource implements PdfRasterSource {

    @Override
    public List<BufferedImage> extractEmbeddedImages(byte[] pdfBytes, int maxPages) throws IOException {
        try (PDDocument document = PdfLoader.load(pdfBytes)) {
            int pageCount = Math.min(document.getNumberOfPages(), maxPages);
            PdfImageExtractor extractor = new PdfImageExtractor();
            List<BufferedImage> images = new ArrayList<>();

            for (int i = 0; i < pageCount; i++) {
                try {
                    images.addAll(extractor.extractImagesFromPage(document.getPage(i), i));
                } catch (IOException e) {
                    log.warn("Skipping images on page {}: {}", i + 1, e.getMessage());
                }
            }
            log.debug("Extracted {} embedded images from {} pages", images.size(), pageCount);
            return images;
        }
    }

    @Override
    public List<BufferedImage> renderPages(byte[] pdfBytes, int dpi, int maxPages) throws IOException {
        try (PDDocument document = PdfLoader.load(pdfBytes)) {
            List<BufferedImage> pages = PdfRenderer.renderPages(document, dpi, maxPages);
            log.debug("Rendered {} pages at {} dpi", pages.size(), dpi);
            return pages;
        }
    }
}
