package com.crisisnavigator.collectors.api;

import com.crisisnavigator.core.model.Disaster;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

public interface AnalysisProvider {
    /** Completes with the provider's JSON analysis of the event, or exceptionally when the call fails. */
    CompletableFuture<JsonNode> analyze(Disaster disaster);
}
