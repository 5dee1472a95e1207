package com.crisisnavigator.core.severity;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a severity the narrative states about itself: a band phrase ("high severity",
 * "classified as low", "overall severity: medium") and, separately, a numeric score
 * ("7/10", "7 out of 10", "severity score: 7").
 */
public final class NarrativeParser {
    private static final String BAND_WORD = "(high|medium|moderate|low)";
    private static final String NUMBER = "(\\d{1,2}(?:\\.\\d+)?)";

    private static final List<Pattern> BAND_PATTERNS = List.of(
            Pattern.compile("\\b" + BAND_WORD + "[\\s-]+severity\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bclassified\\s+as\\s+(?:an?\\s+)?" + BAND_WORD + "\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile(
                    "\\bseverity(?:\\s+(?:level|rating|classification))?\\s*(?:is|:|-|=)\\s*" + BAND_WORD + "\\b",
                    Pattern.CASE_INSENSITIVE
            )
    );

    // Priority order: first pattern that matches anywhere wins. Digits inside a grouped count ("1,200") never match.
    private static final List<Pattern> SCORE_PATTERNS = List.of(
            Pattern.compile("(?<![\\d./])" + NUMBER + "\\s*/\\s*10(?![\\d/])"),
            Pattern.compile("(?<![\\d.])" + NUMBER + "\\s+out\\s+of\\s+10(?!\\d)", Pattern.CASE_INSENSITIVE),
            Pattern.compile(
                    "\\bseverity\\b[^0-9\\n]{0,40}?(?<![\\d.,])" + NUMBER + "(?![\\d,]*\\d)(?!\\.\\d)",
                    Pattern.CASE_INSENSITIVE
            )
    );

    private NarrativeParser() {
    }

    public static NarrativeAssessment parse(String text) {
        if (text == null || text.isBlank()) {
            return NarrativeAssessment.NONE;
        }
        return new NarrativeAssessment(parseBand(text), parseScore(text));
    }

    static Optional<SeverityBand> parseBand(String text) {
        int earliest = Integer.MAX_VALUE;
        String label = null;
        for (Pattern pattern : BAND_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && matcher.start() < earliest) {
                earliest = matcher.start();
                label = matcher.group(1);
            }
        }
        return SeverityBand.fromLabel(label);
    }

    static Optional<Integer> parseScore(String text) {
        for (Pattern pattern : SCORE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                double value = Double.parseDouble(matcher.group(1));
                return Optional.of((int) Math.max(1, Math.min(10, Math.round(value))));
            }
        }
        return Optional.empty();
    }
}
