package guraa.stampdetect;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for the stamp detection service.
 */
@Slf4j
@SpringBootApplication
public class StampDetectApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        // Rendering and ImageIO run without a display
        System.getProperties().putIfAbsent("java.awt.headless", "true");

        SpringApplication.run(StampDetectApplication.class, args);

        logStartupInfo(Duration.between(startTime, Instant.now()));
    }

    /**
     * Log information about the application startup.
     *
     * @param startupTime The time taken to start up
     */
    private static void logStartupInfo(Duration startupTime) {
        log.info("==========================================================");
        log.info("Stamp detection service started in {}", formatDuration(startupTime));
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  Available processors: {}", Runtime.getRuntime().availableProcessors());
        log.info("  JVM Max memory: {} MB", Runtime.getRuntime().maxMemory() / (1024 * 1024));
        log.info("==========================================================");
    }

    private static String formatDuration(Duration duration) {
        long minutes = duration.toMinutesPart();
        long seconds = duration.toSecondsPart();
        long millis = duration.toMillisPart();

        if (minutes > 0) {
            return String.format("%dm %d.%03ds", minutes, seconds, millis);
        }
        return String.format("%d.%03ds", seconds, millis);
    }

    @EventListener
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Application is shutting down");
    }
}
