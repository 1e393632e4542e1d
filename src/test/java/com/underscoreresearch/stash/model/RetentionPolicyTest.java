package com.underscoreresearch.stash.model;

import static org.hamcrest.MatcherAssert.assertThat;

import java.time.Instant;
import java.time.LocalDateTime;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RetentionPolicyTest {
    @Test
    public void cutoff() {
        RetentionPolicy policy = new RetentionPolicy(30, 1);
        assertThat(policy.cutoff(Instant.parse("2024-03-31T12:00:00.750Z")),
                Is.is(Instant.parse("2024-03-01T12:00:00.750Z")));
    }

    @Test
    public void expiredBelowOneSecond() {
        RetentionPolicy policy = new RetentionPolicy(1, 0);
        LocalDateTime timestamp = LocalDateTime.of(2024, 1, 1, 0, 0, 0);
        assertThat(policy.isExpired(timestamp, Instant.parse("2024-01-02T00:00:00.900Z")), Is.is(true));
        assertThat(policy.isExpired(timestamp, Instant.parse("2024-01-02T00:00:00Z")), Is.is(false));
    }

    @Test
    public void invalid() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetentionPolicy(0, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetentionPolicy(-5, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetentionPolicy(30, -1));
        assertThat(new RetentionPolicy(1, 0).getKeepLatest(), Is.is(0));
    }
}
