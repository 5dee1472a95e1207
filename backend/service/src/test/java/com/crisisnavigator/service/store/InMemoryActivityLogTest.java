package com.crisisnavigator.service.store;

import com.crisisnavigator.core.bus.EventBus;
import com.crisisnavigator.core.events.ActivityRecorded;
import com.crisisnavigator.core.model.Activity;
import com.crisisnavigator.core.model.ActivityLevel;
import com.crisisnavigator.service.support.TestCollectors;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryActivityLogTest {
    @Test
    void recentReturnsNewestFirstUpToLimit() {
        InMemoryActivityLog log = new InMemoryActivityLog(new EventBus(), TestCollectors.fixedClock());
        log.record(Activity.DATA_INGESTION, "first", ActivityLevel.INFO);
        log.record(Activity.DATA_INGESTION, "second", ActivityLevel.INFO);
        log.record(Activity.AI_ANALYSIS, "third", ActivityLevel.WARNING);

        assertEquals(List.of("third", "second"), log.recent(2).stream().map(Activity::message).toList());
        assertEquals(3, log.recent(20).size());
    }

    @Test
    void oldestEntriesFallOffAtCapacity() {
        InMemoryActivityLog log = new InMemoryActivityLog(new EventBus(), TestCollectors.fixedClock(), 2);
        log.record(Activity.DATA_INGESTION, "a", ActivityLevel.INFO);
        log.record(Activity.DATA_INGESTION, "b", ActivityLevel.INFO);
        log.record(Activity.DATA_INGESTION, "c", ActivityLevel.INFO);

        assertEquals(List.of("c", "b"), log.recent(10).stream().map(Activity::message).toList());
        assertThrows(IllegalArgumentException.class,
                () -> new InMemoryActivityLog(new EventBus(), TestCollectors.fixedClock(), 0));
    }

    @Test
    void publishesEachRecordedActivity() {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
        List<ActivityRecorded> recorded = new CopyOnWriteArrayList<>();
        bus.subscribe(ActivityRecorded.class, recorded::add);
        InMemoryActivityLog log = new InMemoryActivityLog(bus, TestCollectors.fixedClock());

        Activity activity = log.record(Activity.AI_ANALYSIS, "High severity flood analyzed - X", ActivityLevel.ERROR);

        assertEquals(1, recorded.size());
        assertEquals(activity.id(), recorded.get(0).activityId());
        assertEquals("error", recorded.get(0).level());
        assertEquals(TestCollectors.NOW, recorded.get(0).timestamp());
    }
}
