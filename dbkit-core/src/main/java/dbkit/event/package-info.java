/**
 * In-process named events with "once" handlers.
 */
package dbkit.event;
