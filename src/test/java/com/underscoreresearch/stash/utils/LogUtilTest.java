package com.underscoreresearch.stash.utils;

import static org.hamcrest.MatcherAssert.assertThat;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.Test;

class LogUtilTest {
    @Test
    public void readableAge() {
        assertThat(LogUtil.readableAge(Duration.ofMinutes(45)), Is.is("45m"));
        assertThat(LogUtil.readableAge(Duration.ofDays(12).plusHours(3)), Is.is("12d"));
    }

    @Test
    public void readableDuration() {
        assertThat(LogUtil.readableDuration(Duration.ofSeconds(75)), Is.is("1:15"));
        assertThat(LogUtil.readableDuration(Duration.ofSeconds(3 * 3600 + 2 * 60 + 1)), Is.is("3:02:01"));
    }

    @Test
    public void formatDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("path", "data");
        details.put("size", "1 B");
        assertThat(LogUtil.formatDetails(details), Is.is("path=data, size=1 B"));
        assertThat(LogUtil.formatDetails(Map.of()), Is.is(""));
    }
}
