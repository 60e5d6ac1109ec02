package guraa.stampdetect.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Verdict of the {@link DecisionPolicy}.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class Decision {

    public enum Reason {
        STRONG_COARSE("strong-coarse"),
        BANDED_WITH_REFINE("banded-with-refine"),
        NO_MATCH("no-match"),
        BUDGET_EXHAUSTED("budget-exhausted");

        private final String label;

        Reason(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final boolean match;
    private final Reason reason;
    private final double margin;
}
