package guraa.stampdetect.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one detection run. Every field is always serialized; {@code bbox} is null
 * and {@code ncc}/{@code ssim} are zero when localization did not run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class DetectionResult {

    public static final String NOTE_NO_STAMPS = "No stamps loaded.";
    public static final String NOTE_NO_IMAGES = "No images found in document.";

    private boolean success;
    private boolean match;
    private double score;

    /**
     * 1-based index of the winning page image.
     */
    private Integer page;
    private String stamp;
    private double margin;
    private BoundingBox bbox;
    private double ncc;
    private double ssim;
    private String reason;
    private String note;
    private String error;
    private long timeMs;

    public static DetectionResult soft(String note, long timeMs) {
        return DetectionResult.builder()
                .success(true)
                .match(false)
                .reason("no-match")
                .note(note)
                .timeMs(timeMs)
                .build();
    }

    public static DetectionResult failure(String error, long timeMs) {
        return DetectionResult.builder()
                .success(false)
                .match(false)
                .error(error)
                .timeMs(timeMs)
                .build();
    }
}
