package guraa.stampdetect.core;

import java.io.IOException;

/**
 * Thrown when a document cannot be turned into page images at all.
 * Detection reports this as a hard failure ({@code success=false}).
 */
public class DocumentExtractionException extends IOException {

    public DocumentExtractionException(String message) {
        super(message);
    }

    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
