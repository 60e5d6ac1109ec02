package guraa.stampdetect.core;

/**
 * The uploaded buffer is neither a PDF, a DOCX package nor a decodable image.
 */
public class UnsupportedDocumentTypeException extends DocumentExtractionException {

    public UnsupportedDocumentTypeException(String mimeType) {
        super("Unsupported document type" + (mimeType != null ? ": " + mimeType : ""));
    }
}
