package dbkit.event;

/**
 * Handler invoked by {@link EventDispatcher#emit(String, Object)}.
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Handles one emission.
   *
   * @param data the emitted payload, may be {@code null}
   * @return a result collected by the emitter, may be {@code null}
   */
  Object handle(Object data);
}
