package dbkit.repo;

import java.util.Objects;

/**
 * Single-column ordering for {@link Repository#list(ListFilter, Page, Sort)}.
 *
 * <p>The column must exist on the entity type; this is checked when the query is built.
 *
 * @param column column name
 * @param direction sort direction
 */
public record Sort(String column, SortDirection direction) {

  public Sort {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(direction, "direction");
  }

  public static Sort asc(String column) {
    return new Sort(column, SortDirection.ASC);
  }

  public static Sort desc(String column) {
    return new Sort(column, SortDirection.DESC);
  }
}
