package com.okrcoach.core.checkpoint;

/**
 * Outcome of a backtrack: the updated tracker and the SCARF-safe framing for the user.
 *
 * @param tracker           tracker with {@code fromCheckpointId} unmarked
 * @param event             the recorded backtrack event
 * @param reframe           full text shown to the user
 * @param whatWasDiscovered short statement of what prompted the revisit
 * @param howItImproves     why revisiting leads to a better OKR
 */
public record BacktrackResult(
    CheckpointProgressTracker tracker,
    BacktrackEvent event,
    String reframe,
    String whatWasDiscovered,
    String howItImproves
) {}
