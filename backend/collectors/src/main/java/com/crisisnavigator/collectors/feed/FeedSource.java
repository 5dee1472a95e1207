package com.crisisnavigator.collectors.feed;

import com.crisisnavigator.collectors.api.CollectorContext;
import com.crisisnavigator.collectors.api.FeedFetchException;

import java.time.Instant;

public interface FeedSource {
    String name();

    /** Human-readable feed name used in activity messages. */
    String label();

    int lookbackDays(CollectorContext ctx);

    FeedBatch fetch(Instant cutoff, CollectorContext ctx) throws FeedFetchException;
}
