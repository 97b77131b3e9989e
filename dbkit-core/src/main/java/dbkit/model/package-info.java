/**
 * Entity model: the {@link dbkit.model.Entity} base contract, the optional capability
 * interfaces and the {@link dbkit.model.EntityType} descriptor repositories are bound to.
 */
package dbkit.model;
