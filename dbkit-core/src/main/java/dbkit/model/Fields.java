package dbkit.model;

import java.util.Set;

/**
 * Names of the standard columns contributed by {@link Entity} and the capability interfaces.
 */
public final class Fields {
  public static final String ID = "id";
  public static final String UUID = "uuid";
  public static final String CREATED_AT = "created_at";
  public static final String UPDATED_AT = "updated_at";
  public static final String DELETED_AT = "deleted_at";
  public static final String DEACTIVATED_AT = "deactivated_at";

  static final Set<String> RESERVED = Set.of(ID, UUID, CREATED_AT, UPDATED_AT, DELETED_AT, DEACTIVATED_AT);

  private Fields() {}
}
