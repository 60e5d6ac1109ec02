package guraa.stampdetect.util;

import guraa.stampdetect.core.DocumentType;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Works out what kind of container a buffer is. Magic bytes win; the declared media type
 * is only a fallback.
 */
@Slf4j
public final class DocumentTypeDetector {

    private static final String CONTENT_TYPES_ENTRY = "[Content_Types].xml";

    private DocumentTypeDetector() {
    }

    public static DocumentType detect(byte[] buffer, String declaredMediaType) {
        DocumentType sniffed = sniff(buffer);
        if (sniffed != DocumentType.UNKNOWN) {
            return sniffed;
        }

        String mime = declaredMediaType == null ? "" : declaredMediaType.toLowerCase(Locale.ROOT);
        if (mime.contains("pdf")) {
            return DocumentType.PDF;
        }
        if (mime.contains("word") || mime.contains("officedocument")) {
            return DocumentType.DOCX;
        }
        if (mime.startsWith("image/")) {
            return DocumentType.IMAGE;
        }
        return DocumentType.UNKNOWN;
    }

    static DocumentType sniff(byte[] b) {
        if (b == null || b.length < 4) {
            return DocumentType.UNKNOWN;
        }
        if (isPdf(b)) {
            return DocumentType.PDF;
        }
        if (b[0] == 'P' && b[1] == 'K') {
            return isDocx(b) ? DocumentType.DOCX : DocumentType.UNKNOWN;
        }
        if (isImage(b)) {
            return DocumentType.IMAGE;
        }
        return DocumentType.UNKNOWN;
    }

    public static boolean isPdf(byte[] b) {
        return b != null && b.length > 4 && b[0] == '%' && b[1] == 'P' && b[2] == 'D' && b[3] == 'F';
    }

    /**
     * A ZIP container holding {@code [Content_Types].xml}.
     */
    public static boolean isDocx(byte[] b) {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(b))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (CONTENT_TYPES_ENTRY.equals(entry.getName())) {
                    return true;
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Buffer looked like a ZIP but could not be read: {}", e.getMessage());
        }
        return false;
    }

    private static boolean isImage(byte[] b) {
        // PNG
        if ((b[0] & 0xFF) == 0x89 && b[1] == 'P' && b[2] == 'N' && b[3] == 'G') {
            return true;
        }
        // JPEG
        if ((b[0] & 0xFF) == 0xFF && (b[1] & 0xFF) == 0xD8 && (b[2] & 0xFF) == 0xFF) {
            return true;
        }
        // GIF
        if (b[0] == 'G' && b[1] == 'I' && b[2] == 'F' && b[3] == '8') {
            return true;
        }
        // BMP
        return b[0] == 'B' && b[1] == 'M';
    }
}
