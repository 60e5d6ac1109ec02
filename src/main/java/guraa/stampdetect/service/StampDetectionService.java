package guraa.stampdetect.service;

import guraa.stampdetect.config.StampProperties;
import guraa.stampdetect.core.DocumentType;
import guraa.stampdetect.core.TimeBudget;
import guraa.stampdetect.model.BoundingBox;
import guraa.stampdetect.model.DetectionResult;
import guraa.stampdetect.model.MatchCandidate;
import guraa.stampdetect.model.PageFeatures;
import guraa.stampdetect.model.PatchVerification;
import guraa.stampdetect.model.RasterImage;
import guraa.stampdetect.model.StampReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for stamp detection: normalizes the document, ranks pages against the
 * reference stamps, localizes and verifies the best candidate and applies the decision
 * policy, all within one time budget.
 */
@Slf4j
@Service
public class StampDetectionService {

    static final String PIPELINE_TAG = "hybrid(images+render)";

    private final StampStoreLoader storeLoader;
    private final DocumentNormalizer normalizer;
    private final CoarseMatcher coarseMatcher;
    private final SpatialLocator locator;
    private final PatchVerifier patchVerifier;
    private final DecisionPolicy decisionPolicy;
    private final StampProperties properties;

    private final AtomicReference<StampStore> store = new AtomicReference<>();

    public StampDetectionService(StampStoreLoader storeLoader,
                                 DocumentNormalizer normalizer,
                                 CoarseMatcher coarseMatcher,
                                 SpatialLocator locator,
                                 PatchVerifier patchVerifier,
                                 DecisionPolicy decisionPolicy,
                                 StampProperties properties) {
        this.storeLoader = storeLoader;
        this.normalizer = normalizer;
        this.coarseMatcher = coarseMatcher;
        this.locator = locator;
        this.patchVerifier = patchVerifier;
        this.decisionPolicy = decisionPolicy;
        this.properties = properties;
    }

    /**
     * Load the reference stamps from a directory and publish them. Never throws; a
     * directory that cannot be read leaves an empty store.
     *
     * @param directory The stamp directory
     * @return The published store
     */
    public StampStore initStamps(Path directory) {
        StampStore loaded;
        try {
            loaded = storeLoader.loadReferences(directory);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load stamps from {}: {}", directory, e.getMessage(), e);
            loaded = StampStore.empty(directory);
        }
        store.set(loaded);
        return loaded;
    }

    /**
     * Reload the stamps from the configured directory.
     */
    public StampStore reloadStamps() {
        return initStamps(Paths.get(properties.getDirectory()));
    }

    /**
     * The published store, loading it from the configured directory on first use.
     */
    public StampStore currentStore() {
        StampStore current = store.get();
        if (current != null) {
            return current;
        }
        synchronized (store) {
            current = store.get();
            return current != null ? current : reloadStamps();
        }
    }

    /**
     * Detect whether a document carries one of the reference stamps.
     *
     * @param fileBuffer The document contents
     * @param mimeType The declared media type, may be null
     * @return The outcome; {@code success} is false only for unsupported or unreadable input
     */
    public DetectionResult detectStampOnBuffer(byte[] fileBuffer, String mimeType) {
        TimeBudget budget = TimeBudget.ofMillis(properties.getTimeBudgetMs());

        StampStore stamps = currentStore();
        if (stamps.isEmpty()) {
            return DetectionResult.soft(DetectionResult.NOTE_NO_STAMPS, budget.elapsedMillis());
        }

        try {
            NormalizedDocument document = normalizer.normalizeToImages(fileBuffer, mimeType, budget);
            if (document.isEmpty()) {
                return DetectionResult.soft(DetectionResult.NOTE_NO_IMAGES, budget.elapsedMillis());
            }

            PassOutcome outcome = runPass(document.getPages(), stamps, budget);

            if (document.getType() == DocumentType.PDF && !outcome.decision.isMatch()
                    && properties.isRenderFallback()
                    && budget.remainingMillis() > properties.getSecondPassMinRemainingMs()) {
                outcome = secondPass(fileBuffer, stamps, budget, outcome);
            }

            DetectionResult result = toResult(outcome, budget);
            log.info("Detection finished: {} score={} stamp={} page={} in {}ms",
                    outcome.decision.getReason().getLabel(), result.getScore(), result.getStamp(),
                    result.getPage(), result.getTimeMs());
            return result;
        } catch (IOException e) {
            log.warn("Detection failed: {}", e.getMessage());
            return DetectionResult.failure(e.getMessage(), budget.elapsedMillis());
        } catch (RuntimeException e) {
            log.error("Unexpected error during detection: {}", e.getMessage(), e);
            return DetectionResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    budget.elapsedMillis());
        }
    }

    private PassOutcome secondPass(byte[] pdfBytes, StampStore stamps, TimeBudget budget, PassOutcome first) {
        try {
            List<RasterImage> renders = normalizer.renderPdfPages(pdfBytes, budget);
            if (renders.isEmpty()) {
                return first;
            }
            PassOutcome second = runPass(renders, stamps, budget);
            if (second.decision.isMatch() || second.topScore() > first.topScore()) {
                log.debug("Render pass replaces first pass ({} > {})", second.topScore(), first.topScore());
                return second;
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Render pass failed, keeping first pass: {}", e.getMessage());
        }
        return first;
    }

    PassOutcome runPass(List<RasterImage> images, StampStore stamps, TimeBudget budget) {
        List<PageFeatures> features = coarseMatcher.computePageFeatures(images, budget);
        CoarseRanking ranking = features.isEmpty()
                ? CoarseRanking.empty(budget.isExhausted())
                : coarseMatcher.matchPages(features, stamps, budget);

        PatchVerification verification = null;
        Optional<MatchCandidate> top = ranking.best();
        if (top.isPresent() && top.get().getFusedScore() >= properties.getPrelocThreshold()
                && budget.remainingMillis() > properties.getLocatorMinRemainingMs()) {
            verification = localize(images, stamps, top.get(), budget);
        }

        Decision decision = decisionPolicy.decide(ranking, verification);
        log.debug("Pass over {} images: top={} decision={}", images.size(), top.orElse(null), decision);
        return new PassOutcome(ranking, verification, decision);
    }

    private PatchVerification localize(List<RasterImage> images, StampStore stamps,
                                       MatchCandidate top, TimeBudget budget) {
        Optional<StampReference> stamp = stamps.find(top.getStampName());
        if (stamp.isEmpty() || top.getPageIndex() >= images.size()) {
            return null;
        }
        RasterImage page = images.get(top.getPageIndex());
        LocatorResult located = locator.locate(page.getImage(), stamp.get().primary().getEdgeDescriptor(), budget);
        if (!located.hasBox()) {
            return null;
        }
        return patchVerifier.verify(page.getImage(), located.getBox(), stamp.get()).orElse(null);
    }

    private DetectionResult toResult(PassOutcome outcome, TimeBudget budget) {
        Optional<MatchCandidate> top = outcome.ranking.best();
        PatchVerification verification = outcome.verification;
        BoundingBox box = verification != null ? verification.getBox() : null;

        return DetectionResult.builder()
                .success(true)
                .match(outcome.decision.isMatch())
                .score(round3(outcome.topScore()))
                .page(top.map(c -> c.getPageIndex() + 1).orElse(null))
                .stamp(top.map(MatchCandidate::getStampName).orElse(null))
                .margin(round3(outcome.decision.getMargin()))
                .bbox(box)
                .ncc(verification != null ? round3(verification.getNcc()) : 0.0)
                .ssim(verification != null ? round3(verification.getSsim()) : 0.0)
                .reason(outcome.decision.getReason().getLabel())
                .note(note(outcome.decision.getReason()))
                .timeMs(budget.elapsedMillis())
                .build();
    }

    String note(Decision.Reason reason) {
        return reason.getLabel() + " | " + PIPELINE_TAG
                + " | TH_HI=" + properties.getThresholdHi() + ", TH_LO=" + properties.getThresholdLo();
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    static final class PassOutcome {
        final CoarseRanking ranking;
        final PatchVerification verification;
        final Decision decision;

        PassOutcome(CoarseRanking ranking, PatchVerification verification, Decision decision) {
            this.ranking = ranking;
            this.verification = verification;
            this.decision = decision;
        }

        double topScore() {
            return ranking.best().map(MatchCandidate::getFusedScore).orElse(0.0);
        }
    }
}
