package com.underscoreresearch.stash.utils;

import static org.hamcrest.MatcherAssert.assertThat;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RetryUtilsTest {
    @AfterEach
    public void cleanup() {
        Thread.interrupted();
    }

    @Test
    public void retryTestSecondSucceed() throws Exception {
        AtomicInteger integer = new AtomicInteger();
        assertThat(RetryUtils.retry(3, 5, () -> {
            if (integer.incrementAndGet() < 2) {
                throw new IOException("");
            }
            return integer.get();
        }, null), Is.is(2));

        assertThat(integer.get(), Is.is(2));
    }

    @Test
    public void firstTrySucceed() throws Exception {
        AtomicInteger integer = new AtomicInteger();
        assertThat(RetryUtils.retry(integer::incrementAndGet, null), Is.is(1));
    }

    @Test
    public void noRetry() {
        AtomicInteger integer = new AtomicInteger();
        Assertions.assertThrows(FileNotFoundException.class, () -> RetryUtils.retry(3, 5, () -> {
            integer.incrementAndGet();
            throw new FileNotFoundException("missing");
        }, (exc) -> !(exc instanceof FileNotFoundException)));
        assertThat(integer.get(), Is.is(1));
    }

    @Test
    public void failAfterRetry() {
        AtomicInteger integer = new AtomicInteger();
        Assertions.assertThrows(IOException.class, () -> RetryUtils.retry(3, 5, () -> {
            integer.incrementAndGet();
            throw new IOException("broken");
        }, null));
        assertThat(integer.get(), Is.is(4));
    }

    @Test
    public void noRetriesConfigured() {
        AtomicInteger integer = new AtomicInteger();
        Assertions.assertThrows(IOException.class, () -> RetryUtils.retry(0, 5, () -> {
            integer.incrementAndGet();
            throw new IOException("broken");
        }, null));
        assertThat(integer.get(), Is.is(1));
    }

    @Test
    public void negativeRetriesUseDefault() {
        AtomicInteger integer = new AtomicInteger();
        Assertions.assertThrows(IOException.class, () -> RetryUtils.retry(-1, 1, () -> {
            integer.incrementAndGet();
            throw new IOException("broken");
        }, null));
        assertThat(integer.get(), Is.is(RetryUtils.DEFAULT_RETRIES + 1));
    }

    @Test
    public void interruptedBeforeCall() {
        AtomicInteger integer = new AtomicInteger();
        Thread.currentThread().interrupt();
        Assertions.assertThrows(InterruptedException.class, () -> RetryUtils.retry(integer::incrementAndGet, null));
        assertThat(integer.get(), Is.is(0));
    }

    @Test
    public void interruptedDuringCall() {
        AtomicInteger integer = new AtomicInteger();
        Assertions.assertThrows(InterruptedException.class, () -> RetryUtils.retry(3, 5, () -> {
            integer.incrementAndGet();
            throw new InterruptedException();
        }, null));
        assertThat(integer.get(), Is.is(1));
        assertThat(Thread.currentThread().isInterrupted(), Is.is(true));
    }

    @Test
    public void testExceptionType() {
        Assertions.assertThrows(IOException.class, () -> RetryUtils.retry(() -> {
            throw new IOException("Message");
        }, (exc) -> {
            assertThat(exc.getClass(), Is.is(IOException.class));
            assertThat(exc.getMessage(), Is.is("Message"));
            return false;
        }));
    }
}
