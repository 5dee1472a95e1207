package com.crisisnavigator.service.store;

import com.crisisnavigator.collectors.api.DisasterStore;
import com.crisisnavigator.core.model.Disaster;
import com.crisisnavigator.core.model.NewDisaster;
import com.crisisnavigator.core.model.SystemStats;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

public class InMemoryDisasterStore implements DisasterStore {
    static final Comparator<Disaster> DISPLAY_ORDER = Comparator
            .comparingInt((Disaster disaster) -> disaster.processed() ? 0 : 1)
            .thenComparing(Comparator.comparingInt(InMemoryDisasterStore::severityOf).reversed())
            .thenComparing(Disaster::createdAt, Comparator.reverseOrder());

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Disaster> disasters = new LinkedHashMap<>();
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public InMemoryDisasterStore(Clock clock) {
        this(clock, () -> UUID.randomUUID().toString());
    }

    public InMemoryDisasterStore(Clock clock, Supplier<String> idGenerator) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator is required");
    }

    @Override
    public List<Disaster> listAll() {
        List<Disaster> snapshot = snapshot();
        snapshot.sort(DISPLAY_ORDER);
        return snapshot;
    }

    @Override
    public Optional<Disaster> get(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(disasters.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Disaster create(NewDisaster draft) {
        lock.lock();
        try {
            return insert(draft);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Disaster> insertUnlessDuplicate(NewDisaster draft, Predicate<List<Disaster>> isDuplicate) {
        lock.lock();
        try {
            if (isDuplicate.test(List.copyOf(disasters.values()))) {
                return Optional.empty();
            }
            return Optional.of(insert(draft));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Disaster> update(String id, UnaryOperator<Disaster> mutation) {
        lock.lock();
        try {
            Disaster current = disasters.get(id);
            if (current == null) {
                return Optional.empty();
            }
            Disaster mutated = Objects.requireNonNull(mutation.apply(current), "mutation returned null");
            if (!current.id().equals(mutated.id())) {
                throw new IllegalArgumentException("Disaster id cannot change on update: " + id);
            }
            Disaster updated = mutated.withUpdatedAt(clock.instant());
            disasters.put(id, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Disaster> listUnprocessed() {
        List<Disaster> pending = new ArrayList<>();
        for (Disaster disaster : snapshot()) {
            if (!disaster.processed()) {
                pending.add(disaster);
            }
        }
        return pending;
    }

    @Override
    public SystemStats stats() {
        return SystemStats.of(snapshot(), clock.instant());
    }

    private Disaster insert(NewDisaster draft) {
        String id = idGenerator.get();
        if (disasters.containsKey(id)) {
            throw new IllegalStateException("Duplicate disaster id generated: " + id);
        }
        Disaster disaster = Disaster.fromDraft(id, draft, clock.instant());
        disasters.put(id, disaster);
        return disaster;
    }

    private List<Disaster> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(disasters.values());
        } finally {
            lock.unlock();
        }
    }

    private static int severityOf(Disaster disaster) {
        return disaster.severity() == null ? 0 : disaster.severity();
    }
}
