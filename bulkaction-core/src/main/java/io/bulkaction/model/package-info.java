/**
 * Ledger rows and value types: executions, batches, snapshots, filters and target records.
 */
package io.bulkaction.model;
