package com.crisisnavigator.collectors.api;

import com.crisisnavigator.core.model.Disaster;
import com.crisisnavigator.core.model.NewDisaster;
import com.crisisnavigator.core.model.SystemStats;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

public interface DisasterStore {
    /** Processed first, then severity descending, then newest created first. */
    List<Disaster> listAll();

    Optional<Disaster> get(String id);

    Disaster create(NewDisaster draft);

    /**
     * Runs {@code isDuplicate} against the current events and inserts the draft only when it returns
     * false. Check and insert are atomic with respect to every other write on the store.
     */
    Optional<Disaster> insertUnlessDuplicate(NewDisaster draft, Predicate<List<Disaster>> isDuplicate);

    Optional<Disaster> update(String id, UnaryOperator<Disaster> mutation);

    List<Disaster> listUnprocessed();

    SystemStats stats();
}
