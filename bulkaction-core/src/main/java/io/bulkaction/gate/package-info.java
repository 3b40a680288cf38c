/**
 * Submission-time concurrency ceiling and cooldown.
 */
package io.bulkaction.gate;
