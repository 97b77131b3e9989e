/**
 * Extension points: the {@link dbkit.spi.Session} unit of work and the
 * {@link dbkit.spi.RepositoryMetrics} hook.
 */
package dbkit.spi;
