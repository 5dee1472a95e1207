package com.crisisnavigator.collectors.support;

import com.crisisnavigator.collectors.api.Collector;
import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.CollectorResult;
import com.crisisnavigator.core.events.CollectorTickCompleted;
import com.crisisnavigator.core.events.CollectorTickStarted;
import com.crisisnavigator.core.events.Event;
import org.junit.jupiter.api.Assertions;

import java.time.Duration;
import java.util.List;

public final class CollectorContractAssertions {
    private CollectorContractAssertions() {
    }

    public static CollectorResult assertContract(
            Collector collector,
            CollectorContext ctx,
            EventCapture capture,
            Duration budget,
            boolean expectFailure
    ) {
        int startedBefore = capture.byType(CollectorTickStarted.class).size();
        int completedBefore = capture.byType(CollectorTickCompleted.class).size();

        CollectorResult result = Assertions.assertTimeoutPreemptively(budget, () -> collector.poll(ctx).join());

        Assertions.assertEquals(startedBefore + 1, capture.byType(CollectorTickStarted.class).size(),
                "collector should emit one start event");
        Assertions.assertEquals(completedBefore + 1, capture.byType(CollectorTickCompleted.class).size(),
                "collector should emit one completion event");
        Assertions.assertEquals(!expectFailure, result.success(), result.message());
        assertTickEnvelope(capture.all(), collector.name());
        return result;
    }

    private static void assertTickEnvelope(List<Event> events, String collectorName) {
        int started = -1;
        int completed = -1;
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            if (event instanceof CollectorTickStarted tick && tick.collectorName().equals(collectorName)) {
                started = i;
            }
            if (event instanceof CollectorTickCompleted tick && tick.collectorName().equals(collectorName)) {
                completed = i;
            }
        }
        Assertions.assertTrue(started >= 0 && started < completed, "tick start must precede tick completion");
        Assertions.assertEquals(events.size() - 1, completed, "tick completion must be the last event");
    }
}
