/**
 * Bounded in-memory record of published risk snapshots.
 */
package com.crowdsentinel.core.history;
