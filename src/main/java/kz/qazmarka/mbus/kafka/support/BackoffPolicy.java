package kz.qazmarka.mbus.kafka.support;

/**
 * Линейная политика backoff: задержка перед повтором {@code attempt * step}.
 */
public final class BackoffPolicy {
    private final long stepMillis;

    public BackoffPolicy(long stepMillis) {
        if (stepMillis < 0L) {
            throw new IllegalArgumentException("stepMillis должен быть >= 0");
        }
        this.stepMillis = stepMillis;
    }

    /**
     * Задержка перед повтором номер {@code attempt} (1, 2, 3 …), мс.
     */
    public long delayMillis(int attempt) {
        return stepMillis * Math.max(1, attempt);
    }

    public long stepMillis() {
        return stepMillis;
    }
}
