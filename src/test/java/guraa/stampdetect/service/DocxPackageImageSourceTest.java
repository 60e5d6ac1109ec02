package guraa.stampdetect.service;

import guraa.stampdetect.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DocxPackageImageSourceTest {

    @Test
    void readsEveryMediaEntry() throws IOException {
        byte[] docx = TestImages.docxWithImages(TestImages.redRingStamp(), TestImages.greenStripeStamp());

        List<BufferedImage> images = new DocxPackageImageSource().extractPackageImages(docx, 10);

        assertEquals(2, images.size());
    }

    @Test
    void decoderCrashSkipsOnlyThatEntry() throws IOException {
        byte[] docx = TestImages.docxWithImages(TestImages.redRingStamp(), TestImages.greenStripeStamp());
        DocxPackageImageSource source = new DocxPackageImageSource() {
            @Override
            BufferedImage decodeEntry(String name, byte[] data) throws IOException {
                if (name.endsWith("image1.png")) {
                    throw new ArrayIndexOutOfBoundsException("corrupt palette");
                }
                return super.decodeEntry(name, data);
            }
        };

        List<BufferedImage> images = source.extractPackageImages(docx, 10);

        assertEquals(1, images.size());
        assertEquals(TestImages.STAMP_SIZE, images.get(0).getWidth());
    }

    @Test
    void entryLimitIsHonoured() throws IOException {
        byte[] docx = TestImages.docxWithImages(TestImages.redRingStamp(), TestImages.greenStripeStamp());

        assertEquals(1, new DocxPackageImageSource().extractPackageImages(docx, 1).size());
    }
}
