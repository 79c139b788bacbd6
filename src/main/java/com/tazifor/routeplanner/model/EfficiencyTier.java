package com.tazifor.routeplanner.model;

/**
 * Coarse bucket of an efficiency score, used by clients to colour cards.
 */
public enum EfficiencyTier {
    HIGH,    // 70..100
    MEDIUM,  // 40..69
    LOW;     // 0..39

    public static EfficiencyTier of(int efficiencyScore) {
        if (efficiencyScore >= 70) return HIGH;
        if (efficiencyScore >= 40) return MEDIUM;
        return LOW;
    }
}
