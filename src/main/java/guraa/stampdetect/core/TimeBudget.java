package guraa.stampdetect.core;

/**
 * Wall-clock deadline for a single detection run.
 * The deadline is fixed when the budget is created; loops poll {@link #isExhausted()}
 * and return their best partial result instead of throwing.
 */
public final class TimeBudget {

    private final long startNanos;
    private final long deadlineNanos;
    private final long budgetMillis;

    private static final long MAX_BUDGET_MILLIS = Long.MAX_VALUE / 2_000_000L;

    private TimeBudget(long budgetMillis) {
        this.budgetMillis = Math.max(0, Math.min(budgetMillis, MAX_BUDGET_MILLIS));
        this.startNanos = System.nanoTime();
        this.deadlineNanos = startNanos + this.budgetMillis * 1_000_000L;
    }

    /**
     * Start a budget that expires {@code millis} from now. Negative values are treated as zero,
     * values beyond what the nanosecond clock can represent as {@link #unlimited()}.
     *
     * @param millis The budget in milliseconds
     * @return The running budget
     */
    public static TimeBudget ofMillis(long millis) {
        return new TimeBudget(millis);
    }

    /**
     * A budget that never runs out in practice, for callers outside the request path.
     */
    public static TimeBudget unlimited() {
        return new TimeBudget(MAX_BUDGET_MILLIS);
    }

    public boolean isExhausted() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    public long remainingMillis() {
        long remaining = (deadlineNanos - System.nanoTime()) / 1_000_000L;
        return Math.max(0, remaining);
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    public long getBudgetMillis() {
        return budgetMillis;
    }
}
