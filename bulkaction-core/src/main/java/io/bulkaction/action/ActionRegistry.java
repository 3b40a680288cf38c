package io.bulkaction.action;

import java.util.Set;

/**
 * Name-keyed lookup of action handlers.
 */
public interface ActionRegistry {

  /**
   * @return the handler registered under {@code name}, or {@code null}
   */
  ActionHandler handlerFor(String name);

  Set<String> names();
}
