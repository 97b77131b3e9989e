package dbkit.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe, synchronous named-event dispatcher.
 *
 * <p>Handlers run on the emitting thread in registration order and their return values are
 * collected. A handler registered with {@link #once} is unregistered before it runs, so it fires at
 * most once even when emits race. If a handler throws, the exception propagates to the emitter and
 * the remaining handlers are not run.
 *
 * <pre>{@code
 * EventDispatcher events = new EventDispatcher()
 *     .on("widget.created", data -> audit.record(data))
 *     .once("startup", data -> warmUp());
 * List<Object> results = events.emit("widget.created", widget);
 * }</pre>
 */
public final class EventDispatcher {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  private final Map<String, CopyOnWriteArrayList<Registration>> handlers = new ConcurrentHashMap<>();

  public EventDispatcher on(String event, EventHandler handler) {
    return register(event, handler, false);
  }

  public EventDispatcher once(String event, EventHandler handler) {
    return register(event, handler, true);
  }

  /**
   * Registers a handler.
   *
   * @param event event name
   * @param handler handler
   * @param once if {@code true}, the handler is removed the first time it is invoked
   * @return this dispatcher for chaining
   */
  public EventDispatcher on(String event, EventHandler handler, boolean once) {
    return register(event, handler, once);
  }

  /**
   * Emits an event.
   *
   * @param event event name
   * @param data payload passed to each handler
   * @return handler results in invocation order; empty if no handler is registered
   */
  public List<Object> emit(String event, Object data) {
    Objects.requireNonNull(event, "event");
    CopyOnWriteArrayList<Registration> registrations = handlers.get(event);
    if (registrations == null || registrations.isEmpty()) {
      return List.of();
    }
    List<Object> results = new ArrayList<>();
    for (Registration registration : registrations) {
      if (registration.once) {
        if (!registration.fired.compareAndSet(false, true)) {
          continue;
        }
        registrations.remove(registration);
      }
      results.add(registration.handler.handle(data));
    }
    logger.log(Level.FINE, "Emitted {0} to {1} handler(s)", new Object[]{event, results.size()});
    return results;
  }

  /**
   * Removes every handler registered for {@code event}.
   */
  public void off(String event) {
    handlers.remove(Objects.requireNonNull(event, "event"));
  }

  public int listenerCount(String event) {
    CopyOnWriteArrayList<Registration> registrations = handlers.get(event);
    return registrations == null ? 0 : registrations.size();
  }

  private EventDispatcher register(String event, EventHandler handler, boolean once) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(handler, "handler");
    handlers.computeIfAbsent(event, ignored -> new CopyOnWriteArrayList<>()).add(new Registration(handler, once));
    return this;
  }

  private static final class Registration {
    final EventHandler handler;
    final boolean once;
    final AtomicBoolean fired = new AtomicBoolean();

    Registration(EventHandler handler, boolean once) {
      this.handler = handler;
      this.once = once;
    }
  }
}
