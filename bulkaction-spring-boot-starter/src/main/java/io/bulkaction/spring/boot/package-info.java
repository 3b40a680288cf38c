/**
 * Spring Boot auto-configuration for the bulk action engine.
 *
 * <p>Add this module next to a {@link javax.sql.DataSource} to get a started
 * {@link io.bulkaction.BulkActionEngine} bean backed by the JDBC stores.
 */
package io.bulkaction.spring.boot;
