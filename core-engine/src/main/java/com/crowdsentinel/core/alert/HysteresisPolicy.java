package com.crowdsentinel.core.alert;

import com.crowdsentinel.core.model.AlertLevel;

import java.io.Serializable;
import java.time.Instant;

/**
 * Contract for downgrade policies of the alert state machine.
 * <p>
 * Upgrades are always immediate. A policy is consulted only when the raw
 * target level for a score is below the current level, and decides how far
 * the level may actually fall. Implementations must never return a level
 * above the current one or below the target.
 * </p>
 * <p>
 * Policies must be {@link Serializable} because the engine holding them is
 * snapshotted in checkpointed keyed state.
 * </p>
 */
public interface HysteresisPolicy extends Serializable {

    /**
     * Decide the level to move to when the score points below the current
     * level.
     *
     * @param state  current alert state
     * @param target raw target level for {@code score}, strictly below the
     *               current level
     * @param score  clamped extended risk score
     * @param at     timestamp of the sample being evaluated
     * @return the new level, between {@code target} and the current level
     *         inclusive
     */
    AlertLevel resolveDowngrade(AlertState state, AlertLevel target, double score, Instant at);

    /**
     * @return configuration name of the policy
     */
    String getName();
}
