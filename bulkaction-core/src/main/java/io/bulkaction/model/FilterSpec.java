package io.bulkaction.model;

import io.bulkaction.SpecInvalidException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Selects the records of an entity type that an action applies to: an explicit id set,
 * a conjunction of predicates, or every record.
 */
public final class FilterSpec {

  public enum Kind {
    ALL,
    IDS,
    PREDICATES
  }

  private static final FilterSpec ALL = new FilterSpec(Kind.ALL, List.of(), List.of());

  private final Kind kind;
  private final List<String> ids;
  private final List<Predicate> predicates;

  private FilterSpec(Kind kind, List<String> ids, List<Predicate> predicates) {
    this.kind = kind;
    this.ids = ids;
    this.predicates = predicates;
  }

  public static FilterSpec all() {
    return ALL;
  }

  /**
   * Explicit ids. Duplicates are dropped; order is irrelevant since ids are streamed sorted.
   */
  public static FilterSpec ids(Collection<String> ids) {
    Objects.requireNonNull(ids, "ids");
    return new FilterSpec(Kind.IDS, List.copyOf(new LinkedHashSet<>(ids)), List.of());
  }

  public static FilterSpec where(Predicate... predicates) {
    return where(List.of(predicates));
  }

  public static FilterSpec where(List<Predicate> predicates) {
    Objects.requireNonNull(predicates, "predicates");
    return new FilterSpec(Kind.PREDICATES, List.of(), List.copyOf(predicates));
  }

  public Kind kind() {
    return kind;
  }

  public List<String> ids() {
    return ids;
  }

  public List<Predicate> predicates() {
    return predicates;
  }

  /**
   * Checks the filter's shape. Column existence is checked later by the target resolver.
   *
   * @throws SpecInvalidException if the filter is malformed
   */
  public void validate() {
    switch (kind) {
      case ALL -> {
      }
      case IDS -> {
        if (ids.isEmpty()) {
          throw new SpecInvalidException("Id filter must name at least one id");
        }
        for (String id : ids) {
          if (id == null || id.isBlank()) {
            throw new SpecInvalidException("Id filter contains a blank id");
          }
        }
      }
      case PREDICATES -> {
        if (predicates.isEmpty()) {
          throw new SpecInvalidException("Predicate filter must contain at least one predicate");
        }
        for (Predicate predicate : predicates) {
          validatePredicate(predicate);
        }
      }
    }
  }

  private static void validatePredicate(Predicate predicate) {
    if (!EntityType.isIdentifier(predicate.column())) {
      throw new SpecInvalidException("Invalid column name: " + predicate.column());
    }
    Operator op = predicate.operator();
    if (!op.acceptsValueCount(predicate.values().size())) {
      throw new SpecInvalidException("Operator " + op + " on " + predicate.column()
          + " requires " + op.describeArity() + ", got " + predicate.values().size());
    }
    for (Object value : predicate.values()) {
      if (value == null) {
        throw new SpecInvalidException("Operator " + op + " on " + predicate.column()
            + " cannot compare with null; use IS_NULL");
      }
    }
  }

  /**
   * Converts this filter to plain maps and lists for JSON storage.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("kind", kind.name());
    if (kind == Kind.IDS) {
      map.put("ids", ids);
    } else if (kind == Kind.PREDICATES) {
      List<Map<String, Object>> list = new ArrayList<>();
      for (Predicate p : predicates) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("column", p.column());
        entry.put("op", p.operator().name());
        entry.put("values", p.values());
        list.add(entry);
      }
      map.put("predicates", list);
    }
    return map;
  }

  /**
   * Rebuilds a filter from the output of {@link #toMap()}.
   *
   * @throws IllegalArgumentException if the map is not a stored filter
   */
  public static FilterSpec fromMap(Map<String, Object> map) {
    Object kindValue = map.get("kind");
    if (kindValue == null) {
      throw new IllegalArgumentException("Stored filter has no kind");
    }
    Kind kind = Kind.valueOf(kindValue.toString().toUpperCase(Locale.ROOT));
    switch (kind) {
      case IDS: {
        List<String> ids = new ArrayList<>();
        for (Object id : asList(map.get("ids"))) {
          ids.add(String.valueOf(id));
        }
        return ids(ids);
      }
      case PREDICATES: {
        List<Predicate> predicates = new ArrayList<>();
        for (Object item : asList(map.get("predicates"))) {
          Map<?, ?> entry = (Map<?, ?>) item;
          predicates.add(new Predicate(
              String.valueOf(entry.get("column")),
              Operator.valueOf(String.valueOf(entry.get("op"))),
              asList(entry.get("values"))));
        }
        return where(predicates);
      }
      default:
        return all();
    }
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object value) {
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List)) {
      throw new IllegalArgumentException("Expected list but got " + value.getClass().getName());
    }
    return (List<Object>) value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FilterSpec other)) {
      return false;
    }
    return kind == other.kind && ids.equals(other.ids) && predicates.equals(other.predicates);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, ids, predicates);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case ALL -> "FilterSpec[all]";
      case IDS -> "FilterSpec[ids=" + ids.size() + "]";
      case PREDICATES -> "FilterSpec[" + predicates + "]";
    };
  }
}
