package com.crisisnavigator.core.severity;

public record Evidence(
        int fatalities,
        int injuries,
        int displaced,
        double economicLossUsd,
        boolean emergencyDeclared,
        boolean emergencyDeclaredRegionalOnly,
        boolean internationalAid,
        boolean crossBorderImpact,
        boolean majorInfrastructureDisruption,
        boolean environmentalHazard,
        boolean rapidEscalation
) {
    public static final int HIGH_DISPLACED = 1000;
    public static final int MODERATE_DISPLACED = 100;
    public static final double HIGH_ECONOMIC_LOSS_USD = 100_000_000d;
    public static final double MODERATE_ECONOMIC_LOSS_USD = 5_000_000d;

    public static final Evidence NONE = new Evidence(0, 0, 0, 0d,
            false, false, false, false, false, false, false);

    public int highTriggerCount() {
        int count = 0;
        if (fatalities >= 1) {
            count++;
        }
        if (displaced >= HIGH_DISPLACED) {
            count++;
        }
        if (majorInfrastructureDisruption) {
            count++;
        }
        if (crossBorderImpact) {
            count++;
        }
        if (emergencyDeclared) {
            count++;
        }
        if (internationalAid) {
            count++;
        }
        if (rapidEscalation) {
            count++;
        }
        if (economicLossUsd >= HIGH_ECONOMIC_LOSS_USD) {
            count++;
        }
        return count;
    }

    public boolean hasModerateSignal() {
        return injuries > 0
                || (displaced >= MODERATE_DISPLACED && displaced < HIGH_DISPLACED)
                || economicLossUsd >= MODERATE_ECONOMIC_LOSS_USD
                || emergencyDeclaredRegionalOnly;
    }
}
