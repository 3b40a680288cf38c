package io.bulkaction.action.builtin;

import io.bulkaction.SpecInvalidException;
import io.bulkaction.action.ActionContext;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionResult;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.MutationType;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@code restore}: clears the soft-delete column.
 */
public final class RestoreAction implements ActionHandler {
  public static final String NAME = "restore";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public MutationType mutationType() {
    return MutationType.REINSTATE;
  }

  @Override
  public Set<String> declareUndoFields(EntityType entity, Map<String, Object> parameters) {
    return Set.of(entity.softDeleteColumn());
  }

  @Override
  public void validateParameters(EntityType entity, Map<String, Object> parameters) {
    if (!entity.supportsSoftDelete()) {
      throw new SpecInvalidException("Entity " + entity.name() + " has no soft-delete column");
    }
  }

  @Override
  public ActionResult execute(ActionContext ctx) {
    Map<String, Object> values = new HashMap<>();
    values.put(ctx.entity().softDeleteColumn(), null);
    if (!ctx.records().update(ctx.connection(), ctx.entity(), ctx.record().id(), values)) {
      return ActionResult.failure("record " + ctx.record().id() + " disappeared");
    }
    return ActionResult.ok();
  }
}
