/**
 * JDBC extension points.
 */
package dbkit.jdbc.spi;
