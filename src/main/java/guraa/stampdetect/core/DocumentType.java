package guraa.stampdetect.core;

/**
 * Container types the normalizer knows how to turn into page images.
 */
public enum DocumentType {
    PDF,
    DOCX,
    IMAGE,
    UNKNOWN
}
