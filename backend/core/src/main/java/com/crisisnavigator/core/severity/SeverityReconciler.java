package com.crisisnavigator.core.severity;

/**
 * Combines the three severity signals of one analysis into a single band and score.
 *
 * <p>The band comes from the narrative when it names one, otherwise from the evidence. The score
 * comes from the narrative when it states one, otherwise from the raw numeric claim, and is then
 * clamped into the chosen band so the two can never disagree.
 */
public class SeverityReconciler {
    static final double DEFAULT_RAW_SCORE = 3d;

    public SeverityAssessment reconcile(AnalysisPayload payload) {
        return reconcile(payload.evidence(), NarrativeParser.parse(payload.narrative()), payload.rawScore());
    }

    public SeverityAssessment reconcile(Evidence evidence, NarrativeAssessment narrative, Double rawScore) {
        SeverityBand evidenceBand = evidenceBand(evidence);
        SeverityBand band = narrative.band().orElse(evidenceBand);
        Double base = narrative.score().map(Integer::doubleValue).orElseGet(() -> normalizeRawScore(rawScore));
        return new SeverityAssessment(band, band.clamp(base), evidenceBand, evidence.highTriggerCount());
    }

    public static SeverityBand evidenceBand(Evidence evidence) {
        int triggers = evidence.highTriggerCount();
        if (triggers >= 2) {
            return SeverityBand.HIGH;
        }
        if (triggers == 1 || evidence.hasModerateSignal()) {
            return SeverityBand.MEDIUM;
        }
        return SeverityBand.LOW;
    }

    // Absent stays absent so the band midpoint applies; present but non-numeric falls back to 3.
    static Double normalizeRawScore(Double rawScore) {
        if (rawScore == null) {
            return null;
        }
        if (!Double.isFinite(rawScore)) {
            return DEFAULT_RAW_SCORE;
        }
        return Math.max(1d, Math.min(10d, rawScore));
    }
}
