package dbkit.model;

/**
 * Convenience base class holding the {@code id} column.
 */
public abstract class BaseEntity implements Entity {

  private Long id;

  @Override
  public Long getId() {
    return id;
  }

  @Override
  public void setId(Long id) {
    this.id = id;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + "}";
  }
}
