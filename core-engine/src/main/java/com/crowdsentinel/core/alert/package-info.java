/**
 * Hysteresis alert state machine.
 *
 * <p>
 * {@link com.crowdsentinel.core.alert.AlertStateMachine} upgrades instantly
 * and delegates downgrades to a
 * {@link com.crowdsentinel.core.alert.HysteresisPolicy} created by
 * {@link com.crowdsentinel.core.alert.HysteresisPolicyFactory}:
 * </p>
 * <ul>
 * <li>{@link com.crowdsentinel.core.alert.ThresholdHysteresisPolicy} -
 * separate fall-back thresholds (default)</li>
 * <li>{@link com.crowdsentinel.core.alert.MinimumHoldPolicy} - minimum dwell
 * time after a transition</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.crowdsentinel.core.alert;
