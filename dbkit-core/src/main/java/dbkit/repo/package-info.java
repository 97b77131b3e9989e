/**
 * Repository API: the {@link dbkit.repo.Repository} contract and its query parameter types.
 */
package dbkit.repo;
