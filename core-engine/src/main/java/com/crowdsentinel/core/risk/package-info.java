/**
 * DANP-weighted composite risk and behavioral-intention blending.
 *
 * @since 1.0.0
 */
package com.crowdsentinel.core.risk;
