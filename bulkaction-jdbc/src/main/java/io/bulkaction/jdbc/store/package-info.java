/**
 * JDBC implementations of the execution, batch and snapshot stores.
 */
package io.bulkaction.jdbc.store;
