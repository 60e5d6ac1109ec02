package guraa.stampdetect.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Axis-aligned region in the coordinate space of the page image it was found on.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox {

    private int x;
    private int y;
    private int width;
    private int height;

    public boolean fitsWithin(int pageWidth, int pageHeight) {
        return x >= 0 && y >= 0 && width > 0 && height > 0
                && x + width <= pageWidth && y + height <= pageHeight;
    }
}
