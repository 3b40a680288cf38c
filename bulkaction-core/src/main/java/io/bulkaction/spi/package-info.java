/**
 * Extension points: ledger and record persistence, target resolution, cache, event sink,
 * authorization and metrics.
 */
package io.bulkaction.spi;
