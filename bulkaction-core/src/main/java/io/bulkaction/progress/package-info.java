/**
 * Progress counters, checkpoint history and ETA.
 */
package io.bulkaction.progress;
