/**
 * JDBC persistence for the engine: connection plumbing and shared helpers.
 *
 * <p>Ledger stores live in {@link io.bulkaction.jdbc.store}; access to the target tables in
 * {@link io.bulkaction.jdbc.record}. DDL for H2 and PostgreSQL ships under
 * {@code bulkaction/schema-*.sql} on the classpath.
 */
package io.bulkaction.jdbc;
