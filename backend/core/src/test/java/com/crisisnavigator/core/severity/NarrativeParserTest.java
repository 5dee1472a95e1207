package com.crisisnavigator.core.severity;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NarrativeParserTest {
    @Test
    void readsBandPhrases() {
        assertEquals(Optional.of(SeverityBand.HIGH), NarrativeParser.parseBand("This is a high severity flood."));
        assertEquals(Optional.of(SeverityBand.HIGH), NarrativeParser.parseBand("A High-Severity event."));
        assertEquals(Optional.of(SeverityBand.MEDIUM), NarrativeParser.parseBand("The event is classified as moderate."));
        assertEquals(Optional.of(SeverityBand.LOW), NarrativeParser.parseBand("Overall severity: low."));
        assertEquals(Optional.of(SeverityBand.MEDIUM), NarrativeParser.parseBand("Severity level is medium for now."));
    }

    @Test
    void earliestBandPhraseWins() {
        String text = "Initially classified as low, but observers fear a high severity escalation.";

        assertEquals(Optional.of(SeverityBand.LOW), NarrativeParser.parseBand(text));
    }

    @Test
    void noBandWhenNarrativeIsSilent() {
        assertEquals(Optional.empty(), NarrativeParser.parseBand("Heavy rain continues across the region."));
        assertEquals(Optional.empty(), NarrativeParser.parseBand("Low-lying areas flooded."));
    }

    @Test
    void readsScoresInPriorityOrder() {
        assertEquals(Optional.of(7), NarrativeParser.parseScore("Rated 7/10 by responders."));
        assertEquals(Optional.of(6), NarrativeParser.parseScore("Rated 6 out of 10 overall."));
        assertEquals(Optional.of(8), NarrativeParser.parseScore("Severity score of 8."));
        assertEquals(Optional.of(4), NarrativeParser.parseScore("Severity is 9 according to some, but we rate it 4/10."));
    }

    @Test
    void scoresAreRoundedAndClamped() {
        assertEquals(Optional.of(10), NarrativeParser.parseScore("Estimated 9.6/10."));
        assertEquals(Optional.of(10), NarrativeParser.parseScore("Scored 12/10 by one outlet."));
        assertEquals(Optional.of(1), NarrativeParser.parseScore("Scored 0/10."));
    }

    @Test
    void datesAreNotMistakenForScores() {
        assertEquals(Optional.empty(), NarrativeParser.parseScore("Reported on 2024/10/05 by local media."));
    }

    @Test
    void groupedCountsAreNotMistakenForScores() {
        assertEquals(Optional.empty(), NarrativeParser.parseScore("The severity of the flooding has displaced 1,200 people."));
        assertEquals(Optional.empty(), NarrativeParser.parseScore("Severity remains unclear after 12,500 evacuations."));
        assertEquals(Optional.of(7), NarrativeParser.parseScore("Severity score: 7, with 5,000 people displaced."));
    }

    @Test
    void parseCombinesBandAndScore() {
        NarrativeAssessment assessment = NarrativeParser.parse("Severity: high. We estimate 9/10.");

        assertEquals(Optional.of(SeverityBand.HIGH), assessment.band());
        assertEquals(Optional.of(9), assessment.score());
        assertEquals(NarrativeAssessment.NONE, NarrativeParser.parse("   "));
        assertEquals(NarrativeAssessment.NONE, NarrativeParser.parse(null));
    }
}
