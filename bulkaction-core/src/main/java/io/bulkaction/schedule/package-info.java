/**
 * Deferred executions: activation, cancellation and rescheduling.
 */
package io.bulkaction.schedule;
