/**
 * Validated configuration values: connection settings and the application version.
 */
package dbkit.config;
