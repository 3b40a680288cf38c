package io.bulkaction.action.builtin;

import io.bulkaction.action.ActionContext;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionResult;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.MutationType;

import java.util.Map;
import java.util.Set;

/**
 * {@code force_delete}: removes the row. The snapshot keeps every column so undo can insert it again.
 */
public final class ForceDeleteAction implements ActionHandler {
  public static final String NAME = "force_delete";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public MutationType mutationType() {
    return MutationType.DESTROY;
  }

  @Override
  public Set<String> declareUndoFields(EntityType entity, Map<String, Object> parameters) {
    return ALL_FIELDS;
  }

  @Override
  public ActionResult execute(ActionContext ctx) {
    if (!ctx.records().delete(ctx.connection(), ctx.entity(), ctx.record().id())) {
      return ActionResult.failure("record " + ctx.record().id() + " disappeared");
    }
    return ActionResult.ok();
  }
}
