package com.underscoreresearch.stash.utils;

import java.util.concurrent.Callable;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class RetryUtils {
    public static final int DEFAULT_BASE = 1000;
    public static final int DEFAULT_RETRIES = 5;

    public static <T> T retry(Callable<T> callable,
                              ShouldRetry shouldRetry) throws Exception {
        return retry(DEFAULT_RETRIES, DEFAULT_BASE, callable, shouldRetry);
    }

    public static <T> T retry(int retries, int retryBase, Callable<T> callable,
                              ShouldRetry shouldRetry) throws Exception {
        if (retries < 0) {
            retries = DEFAULT_RETRIES;
        }

        for (int attempt = 0; true; attempt++) {
            try {
                return callCallable(callable);
            } catch (InterruptedException | ProcessingStoppedException exc) {
                throw exc;
            } catch (InternalInterruptedException exc) {
                throw (InterruptedException) exc.getCause();
            } catch (Exception exc) {
                if (attempt >= retries || (shouldRetry != null && !shouldRetry.shouldRetry(exc))) {
                    throw exc;
                }
                long delay = (long) Math.pow(2, attempt) * retryBase;
                log.warn("Call failed, retrying in {} ms (attempt {} of {}): {}", delay, attempt + 1, retries,
                        exc.getMessage(), exc);
                Thread.sleep(delay);
            }
        }
    }

    private static <T> T callCallable(Callable<T> callable) throws Exception {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Interrupted before call");
        }
        try {
            return callable.call();
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            throw new InternalInterruptedException(exc);
        }
    }

    /**
     * Decides whether a failed call is worth another attempt.
     */
    @FunctionalInterface
    public interface ShouldRetry {
        boolean shouldRetry(Exception exc);
    }

    private static class InternalInterruptedException extends RuntimeException {
        public InternalInterruptedException(InterruptedException exc) {
            super(exc);
        }
    }
}
