package com.resonance.matrix.scoring;

/**
 * Coefficients of the resonance boost and decay formulas.
 *
 * <pre>
 * boost = min(ctr, ctrCap) * ctrWeight
 *       + min(dwellSeconds / 60, dwellCapMinutes) * dwellWeight
 *       + min(traversalDepth, depthCap) * depthWeight
 *       + min(returnVisits, returnCap) * returnWeight
 * </pre>
 *
 * <p>Nodes without a signal in the run decay by {@code unobservedDecayStep} (capped at
 * {@code unobservedDecayCap}); nodes with one decay by {@code ageDecayPerDay} per day of
 * age (capped at {@code ageDecayCap}). Resonance never drops below {@code resonanceFloor}.</p>
 */
public record ScoringWeights(
        double resonanceFloor,
        double ctrCap,
        double ctrWeight,
        double dwellCapMinutes,
        double dwellWeight,
        double depthCap,
        double depthWeight,
        double returnCap,
        double returnWeight,
        double unobservedDecayStep,
        double unobservedDecayCap,
        double ageDecayPerDay,
        double ageDecayCap
) {
    public ScoringWeights {
        if (resonanceFloor < 0) {
            throw new IllegalArgumentException("resonanceFloor must be non-negative");
        }
        if (ctrCap < 0 || dwellCapMinutes < 0 || depthCap < 0 || returnCap < 0) {
            throw new IllegalArgumentException("Caps must be non-negative");
        }
        if (ctrWeight < 0 || dwellWeight < 0 || depthWeight < 0 || returnWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (unobservedDecayStep < 0 || ageDecayPerDay < 0) {
            throw new IllegalArgumentException("Decay rates must be non-negative");
        }
        if (unobservedDecayCap < 0 || ageDecayCap < 0 || ageDecayCap > 0.5 || unobservedDecayCap > ageDecayCap) {
            throw new IllegalArgumentException("Decay caps must satisfy 0 <= unobservedDecayCap <= ageDecayCap <= 0.5");
        }
    }

    /**
     * The production coefficients: ctr x4 capped at 0.25, dwell 0.3/min capped at 5 min,
     * depth 0.15 capped at 5, return visits 0.2 capped at 5, 0.05 step decay capped at 0.3,
     * 0.01/day age decay capped at 0.5, floor 0.5.
     */
    public static ScoringWeights defaults() {
        return new ScoringWeights(0.5, 0.25, 4.0, 5.0, 0.3, 5.0, 0.15, 5.0, 0.2,
                0.05, 0.3, 0.01, 0.5);
    }
}
