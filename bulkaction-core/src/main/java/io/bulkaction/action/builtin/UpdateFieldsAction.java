package io.bulkaction.action.builtin;

import io.bulkaction.SpecInvalidException;
import io.bulkaction.action.ActionContext;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionResult;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.MutationType;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@code update}: writes the {@code data} parameter (column to value) to each record.
 * Only the written columns are captured for undo.
 */
public final class UpdateFieldsAction implements ActionHandler {
  public static final String NAME = "update";
  public static final String DATA = "data";

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
    Set<String> columns = new LinkedHashSet<>();
    for (String column : data(parameters).keySet()) {
      columns.add(column.toLowerCase(Locale.ROOT));
    }
    return columns;
  }

  @Override
  public void validateParameters(EntityType entity, Map<String, Object> parameters) {
    Object raw = parameters.get(DATA);
    if (!(raw instanceof Map<?, ?> map) || map.isEmpty()) {
      throw new SpecInvalidException("update requires a non-empty '" + DATA + "' map");
    }
    for (Object key : map.keySet()) {
      String column = String.valueOf(key);
      if (!EntityType.isIdentifier(column)) {
        throw new SpecInvalidException("Invalid column name in data: " + column);
      }
      if (column.equalsIgnoreCase(entity.idColumn())) {
        throw new SpecInvalidException("update cannot change the id column " + column);
      }
    }
  }

  @Override
  public Map<String, Object> writtenValues(EntityType entity, Map<String, Object> parameters) {
    return data(parameters);
  }

  @Override
  public ActionResult execute(ActionContext ctx) {
    Map<String, Object> data = data(ctx.parameters());
    if (!ctx.records().update(ctx.connection(), ctx.entity(), ctx.record().id(), data)) {
      return ActionResult.failure("record " + ctx.record().id() + " disappeared");
    }
    return ActionResult.ok();
  }

  private static Map<String, Object> data(Map<String, Object> parameters) {
    Map<String, Object> data = new LinkedHashMap<>();
    Object raw = parameters.get(DATA);
    if (raw instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        data.put(String.valueOf(entry.getKey()), entry.getValue());
      }
    }
    return data;
  }
}
