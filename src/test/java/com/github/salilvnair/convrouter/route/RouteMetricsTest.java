package com.github.salilvnair.convrouter.route;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.github.salilvnair.convrouter.support.TestConstants.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RouteMetricsTest {

    @Test
    void hourWindowRestartsOnceElapsed() {
        RouteMetrics metrics = RouteMetrics.empty("r")
                .record(true, 1.0, 0.8, T0)
                .record(true, 1.0, 0.8, T0.plus(Duration.ofMinutes(59)));

        assertEquals(2, metrics.executionsLastHour());

        metrics = metrics.record(true, 1.0, 0.8, T0.plus(Duration.ofHours(1)));

        assertEquals(1, metrics.executionsLastHour());
        assertEquals(T0.plus(Duration.ofHours(1)), metrics.hourWindowStart());
        assertEquals(3, metrics.executionsLastDay());
        assertEquals(T0, metrics.dayWindowStart());
    }

    @Test
    void dayWindowRestartsOnceElapsed() {
        RouteMetrics metrics = RouteMetrics.empty("r")
                .record(true, 1.0, 0.8, T0)
                .record(false, 1.0, 0.8, T0.plus(Duration.ofHours(5)))
                .record(true, 1.0, 0.8, T0.plus(Duration.ofDays(1)));

        assertEquals(1, metrics.executionsLastDay());
        assertEquals(3, metrics.totalExecutions());
        assertEquals(1, metrics.failedExecutions());
    }

    @Test
    void recordDoesNotMutateThePreviousValue() {
        RouteMetrics empty = RouteMetrics.empty("r");

        empty.record(true, 5.0, 0.9, T0);

        assertEquals(0, empty.totalExecutions());
    }
}
