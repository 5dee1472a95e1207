package com.crisisnavigator.collectors.feed;

import java.util.List;

public record FeedBatch(List<CandidateEvent> candidates, int rejected) {
    public FeedBatch {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
