package io.bulkaction.action.builtin;

import io.bulkaction.SpecInvalidException;
import io.bulkaction.action.ActionContext;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionResult;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.MutationType;

import java.sql.Timestamp;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@code delete}: stamps the entity's soft-delete column. Records already deleted are left as they are.
 */
public final class SoftDeleteAction implements ActionHandler {
  public static final String NAME = "delete";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public MutationType mutationType() {
    return MutationType.SOFT_DELETE;
  }

  @Override
  public Set<String> declareUndoFields(EntityType entity, Map<String, Object> parameters) {
    return Set.of(entity.softDeleteColumn());
  }

  @Override
  public void validateParameters(EntityType entity, Map<String, Object> parameters) {
    if (!entity.supportsSoftDelete()) {
      throw new SpecInvalidException("Entity " + entity.name()
          + " has no soft-delete column; use force_delete");
    }
  }

  @Override
  public ActionResult execute(ActionContext ctx) {
    String column = ctx.entity().softDeleteColumn();
    if (ctx.record().get(column) != null) {
      return ActionResult.ok();
    }
    Map<String, Object> values = new HashMap<>();
    values.put(column, Timestamp.from(ctx.now()));
    if (!ctx.records().update(ctx.connection(), ctx.entity(), ctx.record().id(), values)) {
      return ActionResult.failure("record " + ctx.record().id() + " disappeared");
    }
    return ActionResult.ok();
  }
}
