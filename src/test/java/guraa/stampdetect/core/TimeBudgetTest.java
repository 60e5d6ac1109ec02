package guraa.stampdetect.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeBudgetTest {

    @Test
    void zeroBudgetIsExhaustedImmediately() {
        TimeBudget budget = TimeBudget.ofMillis(0);

        assertTrue(budget.isExhausted());
        assertEquals(0, budget.remainingMillis());
    }

    @Test
    void negativeBudgetCountsAsZero() {
        assertEquals(0, TimeBudget.ofMillis(-5).getBudgetMillis());
    }

    @Test
    void hugeBudgetDoesNotWrapAround() {
        TimeBudget budget = TimeBudget.ofMillis(10_000_000_000_000L);

        assertFalse(budget.isExhausted());
        assertTrue(budget.remainingMillis() > 1_000_000_000L);
        assertEquals(TimeBudget.unlimited().getBudgetMillis(), budget.getBudgetMillis());
    }

    @Test
    void maxValueBudgetIsUnlimited() {
        TimeBudget budget = TimeBudget.ofMillis(Long.MAX_VALUE);

        assertFalse(budget.isExhausted());
    }
}
