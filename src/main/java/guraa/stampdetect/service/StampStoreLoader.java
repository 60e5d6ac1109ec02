package guraa.stampdetect.service;

import guraa.stampdetect.config.StampProperties;
import guraa.stampdetect.model.FeatureTriplet;
import guraa.stampdetect.model.StampReference;
import guraa.stampdetect.visual.FeatureExtractor;
import guraa.stampdetect.visual.ImageOps;
import guraa.stampdetect.visual.SSIMCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link StampStore} from the image files in a directory.
 */
@Slf4j
@Component
public class StampStoreLoader {

    private static final Pattern STAMP_FILE = Pattern.compile(".+\\.(png|jpe?g|gif|bmp)$", Pattern.CASE_INSENSITIVE);

    private final StampProperties properties;

    public StampStoreLoader(StampProperties properties) {
        this.properties = properties;
    }

    /**
     * Load every supported image in {@code directory}, in file name order, up to the
     * configured stamp limit. Unreadable files are skipped.
     *
     * @param directory The stamp directory
     * @return The loaded store; empty when the directory does not exist
     * @throws IOException If the directory exists but cannot be listed
     */
    public StampStore loadReferences(Path directory) throws IOException {
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Stamp directory {} does not exist, no stamps loaded", directory);
            return StampStore.empty(directory);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> STAMP_FILE.matcher(p.getFileName().toString()).matches())
                    .sorted()
                    .limit(Math.max(0, properties.getMaxStamps()))
                    .collect(Collectors.toList());
        }

        List<StampReference> stamps = new ArrayList<>();
        for (Path file : files) {
            try {
                stamps.add(buildReference(file));
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping stamp {}: {}", file.getFileName(), e.getMessage());
            }
        }

        log.info("Loaded {} reference stamps from {}", stamps.size(), directory);
        return new StampStore(stamps, directory, Instant.now());
    }

    StampReference buildReference(Path file) throws IOException {
        BufferedImage base = ImageOps.resizeNormalize(ImageOps.decode(Files.readAllBytes(file)),
                properties.getMaxImageDimension());
        String name = file.getFileName().toString();

        List<FeatureTriplet> variants = new ArrayList<>();
        variants.add(FeatureExtractor.extract(base));
        if (properties.isRobustAugmentations()) {
            for (BufferedImage variant : buildVariants(name, base)) {
                variants.add(FeatureExtractor.extract(variant));
            }
        }
        log.debug("Stamp {} has {} variants", name, variants.size());
        return new StampReference(name, base, variants, SSIMCalculator.plane(base));
    }

    private List<BufferedImage> buildVariants(String name, BufferedImage base) {
        List<BufferedImage> variants = new ArrayList<>();
        try {
            variants.add(ImageOps.gaussianBlur(base, properties.getAugBlurSigma()));
        } catch (RuntimeException e) {
            log.debug("Blur variant failed for {}: {}", name, e.getMessage());
        }
        try {
            variants.add(ImageOps.jpegRecompress(base, properties.getAugJpegQuality()));
        } catch (IOException | RuntimeException e) {
            log.debug("JPEG variant failed for {}: {}", name, e.getMessage());
        }
        if (properties.isAugGrayscale()) {
            try {
                variants.add(ImageOps.grayscaleLinear(base,
                        properties.getAugGrayscaleContrast(), properties.getAugGrayscaleOffset()));
            } catch (RuntimeException e) {
                log.debug("Greyscale variant failed for {}: {}", name, e.getMessage());
            }
        }
        return variants;
    }
}
