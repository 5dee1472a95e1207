package com.crisisnavigator.collectors.feed;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.core.dedup.DeduplicationGate;
import com.crisisnavigator.core.events.DisasterIngested;
import com.crisisnavigator.core.geo.CoordinateResolver;
import com.crisisnavigator.core.geo.GeoPoint;
import com.crisisnavigator.core.model.Disaster;
import com.crisisnavigator.core.model.NewDisaster;

import java.util.Objects;
import java.util.Optional;

public class IngestionPipeline {
    public enum Outcome {
        CREATED,
        DUPLICATE,
        NO_LOCATION
    }

    private final DeduplicationGate gate;
    private final CoordinateResolver resolver;

    public IngestionPipeline(DeduplicationGate gate, CoordinateResolver resolver) {
        this.gate = Objects.requireNonNull(gate, "gate is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
    }

    public Outcome admit(CandidateEvent candidate, String source, CollectorContext ctx) {
        Optional<GeoPoint> base = locate(candidate);
        if (base.isEmpty()) {
            return Outcome.NO_LOCATION;
        }
        GeoPoint position = candidate.jitterKey() == null
                ? base.get()
                : resolver.jitter(base.get().latitude(), base.get().longitude(), candidate.jitterKey());

        NewDisaster draft = NewDisaster.pending(
                candidate.type(),
                candidate.displayTitle(),
                candidate.description(),
                position,
                candidate.timestamp(),
                candidate.rawData()
        );
        Optional<Disaster> created = ctx.disasterStore().insertUnlessDuplicate(
                draft,
                existing -> gate.isDuplicate(candidate.title(), candidate.regionKey(), candidate.timestamp(), existing)
        );
        if (created.isEmpty()) {
            return Outcome.DUPLICATE;
        }

        Disaster disaster = created.get();
        ctx.eventBus().publish(new DisasterIngested(
                ctx.clock().instant(),
                disaster.id(),
                source,
                disaster.type(),
                disaster.title(),
                disaster.latitude(),
                disaster.longitude()
        ));
        return Outcome.CREATED;
    }

    private Optional<GeoPoint> locate(CandidateEvent candidate) {
        GeoPoint explicit = candidate.location();
        if (explicit != null) {
            return GeoPoint.isUsable(explicit.latitude(), explicit.longitude()) ? Optional.of(explicit) : Optional.empty();
        }
        return resolver.resolve(candidate.regionKey());
    }
}
