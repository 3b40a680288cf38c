/**
 * Micrometer binding for the engine's {@link io.bulkaction.spi.MetricsExporter}.
 */
package io.bulkaction.micrometer;
