package io.bulkaction.action;

import io.bulkaction.action.builtin.ArchiveAction;
import io.bulkaction.action.builtin.ForceDeleteAction;
import io.bulkaction.action.builtin.RestoreAction;
import io.bulkaction.action.builtin.SoftDeleteAction;
import io.bulkaction.action.builtin.UpdateFieldsAction;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe {@link ActionRegistry}. Registering a second handler under an existing name
 * fails.
 */
public final class DefaultActionRegistry implements ActionRegistry {
  private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Returns a registry holding {@code delete}, {@code force_delete}, {@code restore},
   * {@code update} and {@code archive}.
   */
  public static DefaultActionRegistry withBuiltIns() {
    return new DefaultActionRegistry()
        .register(new SoftDeleteAction())
        .register(new ForceDeleteAction())
        .register(new RestoreAction())
        .register(new UpdateFieldsAction())
        .register(new ArchiveAction());
  }

  public DefaultActionRegistry register(ActionHandler handler) {
    Objects.requireNonNull(handler, "handler");
    ActionHandler existing = handlers.putIfAbsent(handler.name(), handler);
    if (existing != null) {
      throw new IllegalStateException("Action already registered: " + handler.name());
    }
    return this;
  }

  @Override
  public ActionHandler handlerFor(String name) {
    return name == null ? null : handlers.get(name);
  }

  @Override
  public Set<String> names() {
    return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
  }
}
