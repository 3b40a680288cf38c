/**
 * Retention housekeeping: expired undo windows and old terminal executions.
 */
package io.bulkaction.purge;
