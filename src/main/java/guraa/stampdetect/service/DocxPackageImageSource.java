package guraa.stampdetect.service;

import guraa.stampdetect.core.DocumentExtractionException;
import guraa.stampdetect.visual.ImageOps;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Reads raster entries from a DOCX package's {@code word/media/} folder.
 */
@Slf4j
@Component
public class DocxPackageImageSource implements PackageImageSource {

    private static final Pattern MEDIA_ENTRY =
            Pattern.compile("^word/media/.+\\.(png|jpe?g|gif|bmp)$", Pattern.CASE_INSENSITIVE);

    @Override
    public List<BufferedImage> extractPackageImages(byte[] packageBytes, int maxEntries) throws IOException {
        List<BufferedImage> images = new ArrayList<>();

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(packageBytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null && images.size() < maxEntries) {
                if (entry.isDirectory() || !MEDIA_ENTRY.matcher(entry.getName()).matches()) {
                    continue;
                }
                byte[] data = IOUtils.toByteArray(zip);
                try {
                    images.add(decodeEntry(entry.getName(), data));
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping undecodable package entry {}: {}", entry.getName(), e.getMessage());
                }
            }
        } catch (ZipException | IllegalArgumentException e) {
            throw new DocumentExtractionException("Corrupt DOCX package", e);
        }

        log.debug("Extracted {} images from package media", images.size());
        return images;
    }

    BufferedImage decodeEntry(String name, byte[] data) throws IOException {
        return ImageOps.decode(data);
    }
}
