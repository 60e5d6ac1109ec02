package guraa.stampdetect.service;

import guraa.stampdetect.config.StampProperties;
import guraa.stampdetect.core.DocumentExtractionException;
import guraa.stampdetect.core.DocumentType;
import guraa.stampdetect.core.TimeBudget;
import guraa.stampdetect.core.UnsupportedDocumentTypeException;
import guraa.stampdetect.model.RasterImage;
import guraa.stampdetect.util.DocumentTypeDetector;
import guraa.stampdetect.visual.ImageOps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts an uploaded document into normalized page images.
 * PDFs contribute their embedded images and, when configured or when they have none,
 * rendered pages; DOCX packages contribute their media entries; images are passed through.
 */
@Slf4j
@Service
public class DocumentNormalizer {

    private final PdfRasterSource pdfRasterSource;
    private final PackageImageSource packageImageSource;
    private final StampProperties properties;

    public DocumentNormalizer(PdfRasterSource pdfRasterSource,
                              PackageImageSource packageImageSource,
                              StampProperties properties) {
        this.pdfRasterSource = pdfRasterSource;
        this.packageImageSource = packageImageSource;
        this.properties = properties;
    }

    /**
     * Normalize a document buffer into page images.
     *
     * @param buffer The document contents
     * @param declaredMediaType The media type the uploader declared, may be null
     * @param budget The running time budget
     * @return The container type and its normalized page images
     * @throws UnsupportedDocumentTypeException If the buffer is not a PDF, DOCX or image
     * @throws DocumentExtractionException If the document cannot be parsed or decoded
     */
    public NormalizedDocument normalizeToImages(byte[] buffer, String declaredMediaType, TimeBudget budget)
            throws DocumentExtractionException {
        if (buffer == null || buffer.length == 0) {
            throw new DocumentExtractionException("Empty document");
        }

        DocumentType type = DocumentTypeDetector.detect(buffer, declaredMediaType);
        log.debug("Detected {} for declared type {}", type, declaredMediaType);

        switch (type) {
            case PDF:
                return new NormalizedDocument(type, normalizePdf(buffer, budget));
            case DOCX:
                return new NormalizedDocument(type, normalizeDocx(buffer));
            case IMAGE:
                return new NormalizedDocument(type, List.of(normalizeImage(buffer)));
            default:
                throw new UnsupportedDocumentTypeException(declaredMediaType);
        }
    }

    /**
     * Rendered pages only, for the second detection pass over a PDF.
     *
     * @param pdfBytes The PDF contents
     * @param budget The running time budget
     * @return Normalized rendered pages; empty when the budget is already spent
     * @throws DocumentExtractionException If the PDF cannot be rendered
     */
    public List<RasterImage> renderPdfPages(byte[] pdfBytes, TimeBudget budget) throws DocumentExtractionException {
        if (budget.isExhausted()) {
            return List.of();
        }
        int pages = Math.min(properties.getMaxPages(), Math.max(1, properties.getRenderTopPages()));
        try {
            List<BufferedImage> renders = pdfRasterSource.renderPages(pdfBytes, properties.getRenderDpi(), pages);
            return normalizeAll(renders, RasterImage.Source.RENDERED, properties.getMaxPages());
        } catch (DocumentExtractionException e) {
            throw e;
        } catch (IOException e) {
            throw new DocumentExtractionException("Failed to render PDF pages", e);
        }
    }

    private List<RasterImage> normalizePdf(byte[] buffer, TimeBudget budget) throws DocumentExtractionException {
        List<RasterImage> images;
        try {
            List<BufferedImage> embedded = pdfRasterSource.extractEmbeddedImages(buffer, properties.getMaxPages());
            images = normalizeAll(embedded, RasterImage.Source.EMBEDDED, properties.getMaxPages());
        } catch (DocumentExtractionException e) {
            throw e;
        } catch (IOException e) {
            throw new DocumentExtractionException("Failed to extract images from PDF", e);
        }

        boolean wantRender = properties.isRenderAlways() || (images.isEmpty() && properties.isRenderFallback());
        if (wantRender && !budget.isExhausted()) {
            try {
                images.addAll(renderPdfPages(buffer, budget));
            } catch (DocumentExtractionException e) {
                log.warn("Page rendering failed, continuing with {} embedded images: {}", images.size(), e.getMessage());
            }
        }
        return images;
    }

    private List<RasterImage> normalizeDocx(byte[] buffer) throws DocumentExtractionException {
        try {
            List<BufferedImage> media = packageImageSource.extractPackageImages(buffer, properties.getMaxPages());
            return normalizeAll(media, RasterImage.Source.PACKAGE, properties.getMaxPages());
        } catch (DocumentExtractionException e) {
            throw e;
        } catch (IOException e) {
            throw new DocumentExtractionException("Failed to read DOCX package", e);
        }
    }

    private RasterImage normalizeImage(byte[] buffer) throws DocumentExtractionException {
        try {
            BufferedImage decoded = ImageOps.decode(buffer);
            return new RasterImage(ImageOps.resizeNormalize(decoded, properties.getMaxImageDimension()), RasterImage.Source.IMAGE);
        } catch (IOException e) {
            throw new DocumentExtractionException("Unable to decode image", e);
        }
    }

    private List<RasterImage> normalizeAll(List<BufferedImage> images, RasterImage.Source source, int limit) {
        List<RasterImage> normalized = new ArrayList<>();
        for (BufferedImage image : images) {
            if (normalized.size() >= limit) {
                break;
            }
            normalized.add(new RasterImage(ImageOps.resizeNormalize(image, properties.getMaxImageDimension()), source));
        }
        return normalized;
    }
}
