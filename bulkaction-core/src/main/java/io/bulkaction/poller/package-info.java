/**
 * Database poller feeding waiting batches to the dispatcher's cold queue.
 */
package io.bulkaction.poller;
