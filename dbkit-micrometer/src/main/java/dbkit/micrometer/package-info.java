/**
 * Micrometer bridge for {@link dbkit.spi.RepositoryMetrics}.
 */
package dbkit.micrometer;
