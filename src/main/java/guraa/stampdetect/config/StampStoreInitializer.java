package guraa.stampdetect.config;

import guraa.stampdetect.service.StampDetectionService;
import guraa.stampdetect.service.StampStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Loads the reference stamps once at startup. A missing directory only leaves the store
 * empty; the application still starts.
 */
@Configuration
public class StampStoreInitializer {
    private static final Logger logger = LoggerFactory.getLogger(StampStoreInitializer.class);

    @Bean
    public CommandLineRunner initStamps(StampDetectionService detectionService, StampProperties properties) {
        return args -> {
            logger.info("Loading reference stamps from {}", properties.getDirectory());
            StampStore store = detectionService.initStamps(Paths.get(properties.getDirectory()));
            if (store.isEmpty()) {
                logger.warn("No reference stamps available; every detection will report no stamps loaded");
            }
        };
    }
}
