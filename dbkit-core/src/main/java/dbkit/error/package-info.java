/**
 * Typed error taxonomy. Every exception carries an {@link dbkit.error.ErrorKind} and the
 * status code callers may map to their own external representation.
 */
package dbkit.error;
