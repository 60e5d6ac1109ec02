package guraa.stampdetect.service;

import guraa.stampdetect.TestImages;
import guraa.stampdetect.config.StampProperties;
import guraa.stampdetect.core.TimeBudget;
import guraa.stampdetect.model.MatchCandidate;
import guraa.stampdetect.model.PageFeatures;
import guraa.stampdetect.model.RasterImage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoarseMatcherTest {

    @TempDir
    Path dir;

    private ExecutorService executor;
    private StampProperties properties;
    private CoarseMatcher matcher;
    private StampStore store;

    @BeforeEach
    void setUp() throws IOException {
        executor = Executors.newFixedThreadPool(2);
        properties = new StampProperties();
        matcher = new CoarseMatcher(executor, properties);

        TestImages.writePng(dir, "green.png", TestImages.greenStripeStamp());
        TestImages.writePng(dir, "red.png", TestImages.redRingStamp());
        store = new StampStoreLoader(properties).loadReferences(dir);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void ranksTheMatchingStampFirst() {
        List<RasterImage> pages = List.of(
                new RasterImage(TestImages.greenStripeStamp(), RasterImage.Source.IMAGE),
                new RasterImage(TestImages.redRingStamp(), RasterImage.Source.IMAGE));
        TimeBudget budget = TimeBudget.ofMillis(30_000);

        List<PageFeatures> features = matcher.computePageFeatures(pages, budget);
        CoarseRanking ranking = matcher.matchPages(features, store, budget);

        assertEquals(2, features.size());
        assertFalse(ranking.isBudgetExhausted());
        assertEquals(4, ranking.getCandidates().size());

        List<MatchCandidate> candidates = ranking.getCandidates();
        for (int i = 1; i < candidates.size(); i++) {
            assertTrue(candidates.get(i - 1).getFusedScore() >= candidates.get(i).getFusedScore());
        }
        assertTrue(candidates.stream().allMatch(MatchCandidate::isRefined));
        assertTrue(ranking.best().get().getFusedScore() > 0.95);
        assertTrue(ranking.margin() >= 0.0);
        assertEquals(ranking.best().get().getFusedScore() - ranking.runnerUpScore(), ranking.margin(), 1e-12);
    }

    @Test
    void onlyTopCandidatesAreRefined() {
        properties.setCoarseTopK(1);
        List<RasterImage> pages = List.of(new RasterImage(TestImages.redRingStamp(), RasterImage.Source.IMAGE));
        TimeBudget budget = TimeBudget.ofMillis(30_000);

        CoarseRanking ranking = matcher.matchPages(matcher.computePageFeatures(pages, budget), store, budget);

        assertEquals(1, ranking.getCandidates().size());
        assertEquals("red.png", ranking.best().get().getStampName());
        assertEquals(0.0, ranking.runnerUpScore());
    }

    @Test
    void exhaustedBudgetGivesFlaggedEmptyRanking() {
        List<RasterImage> pages = List.of(new RasterImage(TestImages.redRingStamp(), RasterImage.Source.IMAGE));
        TimeBudget budget = TimeBudget.ofMillis(0);

        List<PageFeatures> features = matcher.computePageFeatures(pages, budget);
        CoarseRanking ranking = matcher.matchPages(features, store, budget);

        assertTrue(features.isEmpty());
        assertTrue(ranking.getCandidates().isEmpty());
        assertTrue(ranking.isBudgetExhausted());
        assertFalse(ranking.best().isPresent());
    }

    @Test
    void edgeSimilarityIsNeverNegative() {
        List<RasterImage> pages = List.of(new RasterImage(TestImages.greenStripeStamp(), RasterImage.Source.IMAGE));
        PageFeatures page = matcher.computePageFeatures(pages, TimeBudget.ofMillis(30_000)).get(0);

        MatchCandidate candidate = matcher.bestOverVariants(page, store.find("red.png").get());

        assertTrue(candidate.getEdgeSim() >= 0.0 && candidate.getEdgeSim() <= 1.0);
        assertFalse(candidate.isRefined());
    }
}
