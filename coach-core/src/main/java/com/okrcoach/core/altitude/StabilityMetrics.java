package com.okrcoach.core.altitude;

/**
 * Session-level altitude health.
 *
 * <ul>
 *   <li>{@code driftReductionRate}         – share of drifts that triggered an intervention (1.0 with no drift).</li>
 *   <li>{@code averageInterventionSuccess} – share of interventions scored ≥ 0.7.</li>
 *   <li>{@code scopeConsistency}           – the tracker's stability score.</li>
 * </ul>
 */
public record StabilityMetrics(
    double driftReductionRate,
    double averageInterventionSuccess,
    double scopeConsistency
) {}
