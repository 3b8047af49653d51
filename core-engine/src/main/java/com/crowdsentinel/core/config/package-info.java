/**
 * Configuration loading and validation for the Crowd Sentinel risk engine.
 *
 * <p>
 * The engine is configured in YAML and loaded by
 * {@link com.crowdsentinel.core.config.EngineConfigLoader} into an
 * {@link com.crowdsentinel.core.config.EngineConfig} instance. Validation
 * runs automatically after parsing: weight vectors that do not sum to 1 or an
 * inconsistent alert ladder stop the engine before the first sample.
 * </p>
 *
 * @since 1.0.0
 */
package com.crowdsentinel.core.config;
