package com.okrcoach.core.habit;

/**
 * How automatic a habit has become.
 *
 * <ul>
 *   <li>fewer than 10 reps or consistency below .5 → {@link #CONSCIOUS_EFFORT}</li>
 *   <li>fewer than 30 reps or below .7 → {@link #OCCASIONAL_AUTOMATIC}</li>
 *   <li>fewer than 50 reps or below .85 → {@link #MOSTLY_AUTOMATIC}</li>
 *   <li>otherwise → {@link #FULLY_AUTOMATIC}</li>
 * </ul>
 */
public enum Automaticity {
    CONSCIOUS_EFFORT,
    OCCASIONAL_AUTOMATIC,
    MOSTLY_AUTOMATIC,
    FULLY_AUTOMATIC;

    public static Automaticity of(int repetitions, double consistency) {
        if (repetitions < 10 || consistency < 0.5)  return CONSCIOUS_EFFORT;
        if (repetitions < 30 || consistency < 0.7)  return OCCASIONAL_AUTOMATIC;
        if (repetitions < 50 || consistency < 0.85) return MOSTLY_AUTOMATIC;
        return FULLY_AUTOMATIC;
    }
}
