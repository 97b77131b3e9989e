/**
 * Internal helpers for identifiers and timestamps.
 */
package dbkit.util;
