package io.packageoperator.store;

import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-runs a read-modify-write action while it fails with {@link ConflictException}.
 * <p>
 * The action must re-read the object on every attempt. When the calling thread is interrupted
 * between attempts the loop stops with a {@link CancellationException}.
 */
public final class RetryOnConflict {

    public static final int DEFAULT_ATTEMPTS = 5;

    private static final Logger log = LoggerFactory.getLogger(RetryOnConflict.class);

    private final int attempts;

    public RetryOnConflict(int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive");
        }
        this.attempts = attempts;
    }

    public static RetryOnConflict withDefaults() {
        return new RetryOnConflict(DEFAULT_ATTEMPTS);
    }

    public int attempts() {
        return attempts;
    }

    public <T> T call(String action, Supplier<T> body) {
        ConflictException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Interrupted while " + action);
            }
            try {
                return body.get();
            } catch (ConflictException e) {
                last = e;
                log.debug("Conflict while {} (attempt {}/{})", action, attempt, attempts);
            }
        }
        throw last;
    }

    public void run(String action, Runnable body) {
        call(action, () -> {
            body.run();
            return null;
        });
    }
}
