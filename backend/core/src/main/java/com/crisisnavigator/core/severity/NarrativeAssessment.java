package com.crisisnavigator.core.severity;

import java.util.Optional;

public record NarrativeAssessment(Optional<SeverityBand> band, Optional<Integer> score) {
    public static final NarrativeAssessment NONE = new NarrativeAssessment(Optional.empty(), Optional.empty());
}
