package com.crisisnavigator.service.store;

import com.crisisnavigator.collectors.api.ActivityLog;
import com.crisisnavigator.core.bus.EventBus;
import com.crisisnavigator.core.events.ActivityRecorded;
import com.crisisnavigator.core.model.Activity;
import com.crisisnavigator.core.model.ActivityLevel;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public class InMemoryActivityLog implements ActivityLog {
    public static final int DEFAULT_CAPACITY = 500;

    private final EventBus eventBus;
    private final Clock clock;
    private final int capacity;
    private final Deque<Activity> entries = new ArrayDeque<>();

    public InMemoryActivityLog(EventBus eventBus, Clock clock) {
        this(eventBus, clock, DEFAULT_CAPACITY);
    }

    public InMemoryActivityLog(EventBus eventBus, Clock clock, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.capacity = capacity;
    }

    @Override
    public Activity record(String type, String message, ActivityLevel level) {
        Activity activity = new Activity(UUID.randomUUID().toString(), type, message, level, clock.instant());
        synchronized (entries) {
            entries.addFirst(activity);
            while (entries.size() > capacity) {
                entries.removeLast();
            }
        }
        eventBus.publish(new ActivityRecorded(
                activity.timestamp(),
                activity.id(),
                activity.type(),
                activity.message(),
                activity.level().label()
        ));
        return activity;
    }

    @Override
    public List<Activity> recent(int limit) {
        List<Activity> result = new ArrayList<>();
        synchronized (entries) {
            Iterator<Activity> newestFirst = entries.iterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                result.add(newestFirst.next());
            }
        }
        return result;
    }
}
