/**
 * Engine orchestration.
 *
 * <p>
 * {@link com.crowdsentinel.core.engine.RiskEngine} ties sanitizing,
 * normalization, risk scoring, the alert state machine and history into a
 * single ingest call per sample.
 * </p>
 *
 * @since 1.0.0
 */
package com.crowdsentinel.core.engine;
