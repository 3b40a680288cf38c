package io.bulkaction.action.builtin;

import io.bulkaction.action.ActionContext;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionResult;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.MutationType;

import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@code archive}: stamps the archive column and, when a {@code reason} parameter is given
 * and the entity has a reason column, records it.
 */
public final class ArchiveAction implements ActionHandler {
  public static final String NAME = "archive";
  public static final String REASON = "reason";

  private final String archivedAtColumn;
  private final String reasonColumn;

  public ArchiveAction() {
    this("archived_at", "archive_reason");
  }

  public ArchiveAction(String archivedAtColumn, String reasonColumn) {
    this.archivedAtColumn = Objects.requireNonNull(archivedAtColumn, "archivedAtColumn");
    this.reasonColumn = Objects.requireNonNull(reasonColumn, "reasonColumn");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public MutationType mutationType() {
    return MutationType.UPDATE_FIELDS;
  }

  @Override
  public Set<String> declareUndoFields(EntityType entity, Map<String, Object> parameters) {
    return Set.of(archivedAtColumn, reasonColumn);
  }

  @Override
  public ActionResult execute(ActionContext ctx) {
    if (!ctx.record().has(archivedAtColumn)) {
      return ActionResult.failure(ctx.entity().name() + " cannot be archived: no "
          + archivedAtColumn + " column");
    }
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(archivedAtColumn, Timestamp.from(ctx.now()));
    Object reason = ctx.parameters().get(REASON);
    if (reason != null && ctx.record().has(reasonColumn)) {
      values.put(reasonColumn, reason.toString());
    }
    if (!ctx.records().update(ctx.connection(), ctx.entity(), ctx.record().id(), values)) {
      return ActionResult.failure("record " + ctx.record().id() + " disappeared");
    }
    return ActionResult.ok();
  }
}
