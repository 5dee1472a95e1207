package com.crisisnavigator.core.severity;

public record SeverityAssessment(SeverityBand band, int score, SeverityBand evidenceBand, int highTriggerCount) {
}
