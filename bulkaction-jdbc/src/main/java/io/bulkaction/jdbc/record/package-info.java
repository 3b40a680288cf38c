/**
 * Access to the target tables: resolving filters to ids and reading or writing rows.
 */
package io.bulkaction.jdbc.record;
