package guraa.stampdetect.util;

import guraa.stampdetect.core.DocumentExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;

/**
 * Loads in-memory PDF buffers with a fallback for documents too large for main memory.
 */
@Slf4j
public final class PdfLoader {

    private PdfLoader() {
    }

    /**
     * Load a PDF document from bytes.
     *
     * @param pdfBytes The PDF file contents
     * @return The loaded document; the caller closes it
     * @throws DocumentExtractionException If the document cannot be loaded with any method
     */
    public static PDDocument load(byte[] pdfBytes) throws DocumentExtractionException {
        // First attempt: standard in-memory loading
        try {
            return PDDocument.load(pdfBytes);
        } catch (InvalidPasswordException e) {
            throw new DocumentExtractionException("PDF is password protected", e);
        } catch (Exception e) {
            log.warn("Standard PDF loading failed: {}. Trying with temp-file buffering...", e.getMessage());
        }

        // Second attempt: buffer through temp files
        try {
            return PDDocument.load(pdfBytes, "", null, null, MemoryUsageSetting.setupTempFileOnly());
        } catch (Exception e) {
            throw new DocumentExtractionException(
                    "Failed to load PDF document. The file may be corrupted or use unsupported features.", e);
        }
    }
}
