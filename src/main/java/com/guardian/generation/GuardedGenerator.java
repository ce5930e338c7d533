package com.guardian.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds and retries calls to a {@link TextGenerator}.
 *
 * <p>Each attempt runs on a small daemon pool and is abandoned after
 * {@code timeout}. Up to {@code maxAttempts} attempts are made with a fixed
 * backoff between them. When all attempts fail the outcome is surfaced, never
 * hidden:</p>
 * <ul>
 *   <li>last failure was a timeout: {@link GenerationTimeoutException}</li>
 *   <li>anything else: {@link GenerationFailedException}</li>
 * </ul>
 */
public class GuardedGenerator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GuardedGenerator.class);

    private final TextGenerator delegate;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration backoff;
    private final ExecutorService executor;

    public GuardedGenerator(TextGenerator delegate, Duration timeout, int maxAttempts, Duration backoff, int poolSize) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("generation timeout must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.delegate = delegate;
        this.timeout = timeout;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff == null ? Duration.ZERO : backoff;
        this.executor = Executors.newFixedThreadPool(Math.max(1, poolSize), new DaemonThreadFactory());
    }

    public String generate(String prompt) {
        Throwable lastFailure = null;
        boolean lastWasTimeout = false;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Future<String> future = executor.submit(() -> delegate.generate(prompt));
            try {
                String output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (output != null && !output.isBlank()) {
                    return output;
                }
                lastFailure = new GenerationFailedException("backend returned an empty completion");
                lastWasTimeout = false;
            } catch (TimeoutException ex) {
                future.cancel(true);
                lastFailure = ex;
                lastWasTimeout = true;
            } catch (ExecutionException ex) {
                lastFailure = ex.getCause();
                lastWasTimeout = isTimeout(ex.getCause());
            } catch (InterruptedException ex) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new GenerationFailedException("interrupted while waiting for generation", ex);
            }
            log.warn("Generation attempt {}/{} failed ({}): {}", attempt, maxAttempts,
                lastWasTimeout ? "timeout" : "error", describe(lastFailure));
            if (attempt < maxAttempts) {
                pause();
            }
        }

        if (lastWasTimeout) {
            throw new GenerationTimeoutException("no completion within " + timeout.toMillis()
                + " ms after " + maxAttempts + " attempt(s)", lastFailure);
        }
        throw new GenerationFailedException("generation failed after " + maxAttempts
            + " attempt(s): " + describe(lastFailure), lastFailure);
    }

    public Duration timeout() {
        return timeout;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private void pause() {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new GenerationFailedException("interrupted during generation backoff", ex);
        }
    }

    private static boolean isTimeout(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException || t instanceof GenerationTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "unknown";
        }
        return failure.getClass().getSimpleName()
            + (failure.getMessage() == null ? "" : ": " + failure.getMessage());
    }

    private static final class DaemonThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "guardian-generator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
