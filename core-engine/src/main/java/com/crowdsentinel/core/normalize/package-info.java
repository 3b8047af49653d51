/**
 * Raw-measurement sanitization and index normalization.
 *
 * <p>
 * {@link com.crowdsentinel.core.normalize.SampleSanitizer} repairs missing or
 * out-of-range fields, and
 * {@link com.crowdsentinel.core.normalize.IndexNormalizer} turns the repaired
 * reading into an {@link com.crowdsentinel.core.model.IndexSet}.
 * </p>
 *
 * @since 1.0.0
 */
package com.crowdsentinel.core.normalize;
