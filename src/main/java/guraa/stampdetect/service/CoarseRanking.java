package guraa.stampdetect.service;

import guraa.stampdetect.model.MatchCandidate;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Candidates ordered by descending fused score. When the time budget ran out during
 * matching the list holds whatever was scored so far.
 */
@Getter
public class CoarseRanking {

    private final List<MatchCandidate> candidates;
    private final boolean budgetExhausted;

    public CoarseRanking(List<MatchCandidate> candidates, boolean budgetExhausted) {
        this.candidates = List.copyOf(candidates);
        this.budgetExhausted = budgetExhausted;
    }

    public static CoarseRanking empty(boolean budgetExhausted) {
        return new CoarseRanking(List.of(), budgetExhausted);
    }

    public Optional<MatchCandidate> best() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /**
     * Fused score of the second candidate, 0 when there is none.
     */
    public double runnerUpScore() {
        return candidates.size() > 1 ? candidates.get(1).getFusedScore() : 0.0;
    }

    public double margin() {
        return best().map(top -> top.getFusedScore() - runnerUpScore()).orElse(0.0);
    }
}
