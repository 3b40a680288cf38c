package io.bulkaction.action;

import io.bulkaction.model.EntityType;
import io.bulkaction.model.MutationType;
import io.bulkaction.model.UndoOperation;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named mutation that can be applied to each record of an execution.
 *
 * <p>Handlers are registered by name in an {@link ActionRegistry}. A handler either returns
 * {@link ActionResult#failure(String)} or throws to fail one record; the batch carries on
 * with the next record either way.
 */
public interface ActionHandler {

  /** Marker for {@link #declareUndoFields} meaning "capture every column". */
  Set<String> ALL_FIELDS = Set.of("*");

  String name();

  MutationType mutationType();

  default UndoOperation undoOperationType() {
    return mutationType().undoOperation();
  }

  /**
   * Columns whose current values must be captured before this handler mutates a record.
   *
   * @return column names, or {@link #ALL_FIELDS}
   */
  Set<String> declareUndoFields(EntityType entity, Map<String, Object> parameters);

  /**
   * Checks parameters at submission time.
   *
   * @throws io.bulkaction.SpecInvalidException if the parameters cannot work for this entity
   */
  default void validateParameters(EntityType entity, Map<String, Object> parameters) {
  }

  /**
   * Column values this handler will write to every record, checked against the entity's
   * columns at submission time. Empty when the handler writes nothing fixed.
   */
  default Map<String, Object> writtenValues(EntityType entity, Map<String, Object> parameters) {
    return Map.of();
  }

  ActionResult execute(ActionContext context) throws Exception;

  /**
   * Builds a handler from a function, for custom actions that need no parameter validation.
   */
  static ActionHandler of(String name, MutationType mutationType, Set<String> undoFields,
      RecordAction action) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(mutationType, "mutationType");
    Objects.requireNonNull(undoFields, "undoFields");
    Objects.requireNonNull(action, "action");
    return new ActionHandler() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public MutationType mutationType() {
        return mutationType;
      }

      @Override
      public Set<String> declareUndoFields(EntityType entity, Map<String, Object> parameters) {
        return undoFields;
      }

      @Override
      public ActionResult execute(ActionContext context) throws Exception {
        return action.apply(context);
      }
    };
  }

  @FunctionalInterface
  interface RecordAction {
    ActionResult apply(ActionContext context) throws Exception;
  }
}
