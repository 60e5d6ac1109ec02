package guraa.stampdetect.service;

import guraa.stampdetect.core.DocumentType;
import guraa.stampdetect.model.RasterImage;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * The page images of a document together with the container type they came from.
 */
@Getter
@RequiredArgsConstructor
public class NormalizedDocument {

    private final DocumentType type;
    private final List<RasterImage> pages;

    public boolean isEmpty() {
        return pages.isEmpty();
    }
}
