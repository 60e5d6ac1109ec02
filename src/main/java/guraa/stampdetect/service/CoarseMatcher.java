package guraa.stampdetect.service;

import guraa.stampdetect.config.StampProperties;
import guraa.stampdetect.core.TimeBudget;
import guraa.stampdetect.model.FeatureTriplet;
import guraa.stampdetect.model.MatchCandidate;
import guraa.stampdetect.model.PageFeatures;
import guraa.stampdetect.model.RasterImage;
import guraa.stampdetect.model.StampReference;
import guraa.stampdetect.visual.FeatureExtractor;
import guraa.stampdetect.visual.PerceptualHash;
import guraa.stampdetect.visual.SSIMCalculator;
import guraa.stampdetect.visual.Similarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Two-stage page x stamp scoring.
 * Stage one fuses edge, color and hash similarity for every pairing, keeping the best
 * variant of each stamp. Stage two adds global SSIM for the top few pairings only.
 */
@Slf4j
@Component
public class CoarseMatcher {

    static final double QUICK_EDGE_WEIGHT = 0.42;
    static final double QUICK_COLOR_WEIGHT = 0.38;
    static final double QUICK_HASH_WEIGHT = 0.20;

    static final double REFINE_EDGE_WEIGHT = 0.35;
    static final double REFINE_COLOR_WEIGHT = 0.25;
    static final double REFINE_HASH_WEIGHT = 0.20;
    static final double REFINE_SSIM_WEIGHT = 0.20;

    private static final Comparator<MatchCandidate> RANKING = Comparator
            .comparingDouble(MatchCandidate::getFusedScore).reversed()
            .thenComparingInt(MatchCandidate::getPageIndex)
            .thenComparing(MatchCandidate::getStampName);

    private final ExecutorService executorService;
    private final StampProperties properties;

    public CoarseMatcher(@Qualifier("detectionExecutor") ExecutorService executorService,
                         StampProperties properties) {
        this.executorService = executorService;
        this.properties = properties;
    }

    /**
     * Compute the features of every page in parallel. Pages not started before the
     * budget ran out are left out.
     *
     * @param pages Normalized page images
     * @param budget The running time budget
     * @return Features in page order
     */
    public List<PageFeatures> computePageFeatures(List<RasterImage> pages, TimeBudget budget) {
        List<CompletableFuture<PageFeatures>> tasks = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            final int pageIndex = i;
            final RasterImage page = pages.get(i);
            tasks.add(CompletableFuture.supplyAsync(() -> {
                if (budget.isExhausted()) {
                    return null;
                }
                return new PageFeatures(pageIndex, page,
                        FeatureExtractor.extract(page.getImage()),
                        SSIMCalculator.plane(page.getImage()));
            }, executorService));
        }

        return collect(tasks, budget);
    }

    /**
     * Rank every page/stamp pairing.
     *
     * @param pages Page features
     * @param store The reference stamps
     * @param budget The running time budget
     * @return The ranking, possibly partial
     */
    public CoarseRanking matchPages(List<PageFeatures> pages, StampStore store, TimeBudget budget) {
        if (pages.isEmpty() || store.isEmpty()) {
            return CoarseRanking.empty(budget.isExhausted());
        }
        AtomicBoolean interrupted = new AtomicBoolean(false);

        List<CompletableFuture<List<MatchCandidate>>> tasks = new ArrayList<>();
        for (PageFeatures page : pages) {
            tasks.add(CompletableFuture.supplyAsync(
                    () -> scorePage(page, store.getStamps(), budget, interrupted), executorService));
        }

        List<MatchCandidate> quick = new ArrayList<>();
        for (List<MatchCandidate> partial : collect(tasks, budget)) {
            quick.addAll(partial);
        }
        quick.sort(RANKING);
        if (tasks.stream().anyMatch(t -> !t.isDone())) {
            interrupted.set(true);
        }
        log.debug("Stage one scored {} pairings", quick.size());

        List<MatchCandidate> ranked = new ArrayList<>();
        int topK = Math.min(Math.max(0, properties.getCoarseTopK()), quick.size());
        for (int i = 0; i < topK; i++) {
            MatchCandidate candidate = quick.get(i);
            if (budget.isExhausted()) {
                interrupted.set(true);
                ranked.addAll(quick.subList(i, topK));
                break;
            }
            try {
                ranked.add(refine(candidate, pages, store));
            } catch (RuntimeException e) {
                log.debug("Dropping candidate {} on page {}: {}",
                        candidate.getStampName(), candidate.getPageIndex() + 1, e.getMessage());
            }
        }
        ranked.sort(RANKING);

        return new CoarseRanking(ranked, interrupted.get() || (ranked.isEmpty() && budget.isExhausted()));
    }

    private List<MatchCandidate> scorePage(PageFeatures page, List<StampReference> stamps,
                                           TimeBudget budget, AtomicBoolean interrupted) {
        List<MatchCandidate> candidates = new ArrayList<>();
        for (StampReference stamp : stamps) {
            if (budget.isExhausted()) {
                interrupted.set(true);
                break;
            }
            try {
                candidates.add(bestOverVariants(page, stamp));
            } catch (RuntimeException e) {
                log.debug("Skipping stamp {} on page {}: {}", stamp.getName(), page.getPageIndex() + 1, e.getMessage());
            }
        }
        return candidates;
    }

    MatchCandidate bestOverVariants(PageFeatures page, StampReference stamp) {
        FeatureTriplet pageTriplet = page.getTriplet();
        MatchCandidate best = null;
        for (FeatureTriplet variant : stamp.getVariants()) {
            double edgeSim = Similarity.clamp01(
                    Similarity.cosine(variant.getEdgeDescriptor(), pageTriplet.getEdgeDescriptor()));
            double colorSim = Similarity.bhattacharyya(variant.getHistogram(), pageTriplet.getHistogram());
            double hashSim = PerceptualHash.similarity(variant.getHash(), pageTriplet.getHash());
            double fused = QUICK_EDGE_WEIGHT * edgeSim + QUICK_COLOR_WEIGHT * colorSim + QUICK_HASH_WEIGHT * hashSim;

            if (best == null || fused > best.getFusedScore()) {
                best = MatchCandidate.builder()
                        .pageIndex(page.getPageIndex())
                        .stampName(stamp.getName())
                        .fusedScore(fused)
                        .edgeSim(edgeSim)
                        .colorSim(colorSim)
                        .hashSim(hashSim)
                        .build();
            }
        }
        return best;
    }

    private MatchCandidate refine(MatchCandidate candidate, List<PageFeatures> pages, StampStore store) {
        PageFeatures page = pages.stream()
                .filter(p -> p.getPageIndex() == candidate.getPageIndex())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No features for page " + candidate.getPageIndex()));
        StampReference stamp = store.find(candidate.getStampName())
                .orElseThrow(() -> new IllegalStateException("Unknown stamp " + candidate.getStampName()));

        double ssim = SSIMCalculator.calculate(page.getSsimPlane(), stamp.getSsimPlane());
        double fused = REFINE_EDGE_WEIGHT * candidate.getEdgeSim()
                + REFINE_COLOR_WEIGHT * candidate.getColorSim()
                + REFINE_HASH_WEIGHT * candidate.getHashSim()
                + REFINE_SSIM_WEIGHT * ssim;

        return candidate.toBuilder()
                .fusedScore(fused)
                .ssim(ssim)
                .refined(true)
                .build();
    }

    /**
     * Wait for the tasks until the budget runs out and return the results that are
     * available. Null results and failed tasks are dropped.
     */
    private <T> List<T> collect(List<CompletableFuture<T>> tasks, TimeBudget budget) {
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                    .get(budget.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Budget ran out with {} tasks pending", tasks.stream().filter(t -> !t.isDone()).count());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Detection task failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }

        List<T> results = new ArrayList<>();
        for (CompletableFuture<T> task : tasks) {
            if (!task.isDone() || task.isCompletedExceptionally()) {
                continue;
            }
            T value = task.join();
            if (value != null) {
                results.add(value);
            }
        }
        return results;
    }
}
