package guraa.stampdetect.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the detection pipeline.
 */
@Slf4j
@Configuration
public class ConcurrencyConfig {

    private final int availableProcessors = Runtime.getRuntime().availableProcessors();

    @Value("${app.concurrency.detection-threads:0}")
    @Getter @Setter
    private int detectionThreads;

    /**
     * Executor for per-page feature extraction and the page x stamp scoring fan-out.
     * Defaults to one thread per core, capped at eight.
     */
    @Bean(name = "detectionExecutor")
    public ExecutorService detectionExecutor() {
        int threads = detectionThreads > 0 ? detectionThreads : Math.max(1, Math.min(8, availableProcessors));
        log.info("Creating detection executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, createThreadFactory("stamp-detect-"));
    }

    /**
     * Create a thread factory with proper naming and error handling.
     *
     * @param prefix Thread name prefix
     * @return A ThreadFactory
     */
    static ThreadFactory createThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Uncaught exception in thread {}: {}", t.getName(), e.getMessage(), e));
            return thread;
        };
    }
}
