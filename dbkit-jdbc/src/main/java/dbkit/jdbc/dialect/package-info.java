/**
 * Built-in {@link dbkit.jdbc.spi.Dialect} implementations and the {@link dbkit.jdbc.dialect.Dialects} registry.
 */
package dbkit.jdbc.dialect;
