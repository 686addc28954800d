package com.forecastaccuracy.service;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class RequestGenerationTrackerTest {

    private final RequestGenerationTracker tracker = new RequestGenerationTracker();

    @Test
    void register_withoutGeneration_assignsIncreasingNumbers() {
        assertThat(tracker.register("export", null)).isEqualTo(1L);
        assertThat(tracker.register("export", null)).isEqualTo(2L);
        assertThat(tracker.register("import", null)).isEqualTo(1L);
    }

    @Test
    void isCurrent_onlyForLatestGeneration() {
        long first = tracker.register("export", 3L);
        long second = tracker.register("export", 4L);

        assertThat(tracker.isCurrent("export", first)).isFalse();
        assertThat(tracker.isCurrent("export", second)).isTrue();
    }

    @Test
    void register_olderGenerationDoesNotMoveLatestBack() {
        tracker.register("export", 7L);
        long late = tracker.register("export", 5L);

        assertThat(tracker.isCurrent("export", late)).isFalse();
        assertThat(tracker.latest("export")).isEqualTo(7L);
    }

    @Test
    void isCurrent_unknownKey_isFalse() {
        assertThat(tracker.isCurrent("nope", 1L)).isFalse();
    }

    @Test
    void register_manyKeys_keepsTrackedKeysBounded() {
        ReflectionTestUtils.setField(tracker, "maxTrackedKeys", 100);

        for (int i = 0; i < 10_000; i++) {
            tracker.register("series-" + i, null);
        }

        assertThat(tracker.trackedKeys()).isEqualTo(100);
        assertThat(tracker.latest("series-9999")).isEqualTo(1L);
        assertThat(tracker.latest("series-0")).isZero();
    }

    @Test
    void register_recentlyUsedKeySurvivesEviction() {
        ReflectionTestUtils.setField(tracker, "maxTrackedKeys", 2);

        tracker.register("export", null);
        tracker.register("import", null);
        tracker.register("export", null);
        tracker.register("tra_export", null);

        assertThat(tracker.trackedKeys()).isEqualTo(2);
        assertThat(tracker.latest("export")).isEqualTo(2L);
        assertThat(tracker.latest("import")).isZero();
    }
}
