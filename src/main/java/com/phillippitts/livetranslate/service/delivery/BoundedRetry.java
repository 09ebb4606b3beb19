package com.phillippitts.livetranslate.service.delivery;

import com.phillippitts.livetranslate.exception.DeliveryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs an action until it succeeds or the attempt budget is spent.
 *
 * <p>Only {@link DeliveryException} is retried. Any other runtime exception ends the sequence
 * at once and is reported as the last error. There is no back-off: a failed socket write is
 * retried immediately with the same payload.
 */
public final class BoundedRetry {

    private static final Logger LOG = LogManager.getLogger(BoundedRetry.class);

    private final int maxAttempts;

    public BoundedRetry(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs {@code action} at most {@link #maxAttempts()} times.
     *
     * @param label short description for log lines (typically the connection id)
     * @return how the sequence ended; never throws for action failures
     */
    public Result run(String label, Runnable action) {
        RuntimeException lastError = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                action.run();
                if (attempt > 1) {
                    LOG.info("{} succeeded on attempt {}/{}", label, attempt, maxAttempts);
                }
                return new Result(true, attempt, null);
            } catch (DeliveryException e) {
                lastError = e;
                LOG.warn("{} attempt {}/{} failed: {}", label, attempt, maxAttempts, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("{} attempt {}/{} failed unexpectedly; not retrying", label, attempt, maxAttempts, e);
                return new Result(false, attempt, e);
            }
        }
        return new Result(false, attempt, lastError);
    }

    /**
     * @param lastError null when {@code succeeded}
     */
    public record Result(boolean succeeded, int attempts, RuntimeException lastError) {

        public boolean retriesExhausted() {
            return !succeeded && lastError instanceof DeliveryException;
        }
    }
}
