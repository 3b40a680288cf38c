package io.bulkaction.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One column condition of a {@link FilterSpec}. Predicates of a filter are AND-ed.
 */
public record Predicate(String column, Operator operator, List<Object> values) {

  public Predicate {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(operator, "operator");
    values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
  }

  public static Predicate eq(String column, Object value) {
    return new Predicate(column, Operator.EQ, Collections.singletonList(value));
  }

  public static Predicate lt(String column, Object value) {
    return new Predicate(column, Operator.LT, Collections.singletonList(value));
  }

  public static Predicate gt(String column, Object value) {
    return new Predicate(column, Operator.GT, Collections.singletonList(value));
  }

  public static Predicate in(String column, Collection<?> values) {
    return new Predicate(column, Operator.IN, new ArrayList<>(values));
  }

  public static Predicate notIn(String column, Collection<?> values) {
    return new Predicate(column, Operator.NOT_IN, new ArrayList<>(values));
  }

  public static Predicate between(String column, Object low, Object high) {
    return new Predicate(column, Operator.BETWEEN, Arrays.asList(low, high));
  }

  public static Predicate isNull(String column) {
    return new Predicate(column, Operator.IS_NULL, List.of());
  }

  public static Predicate isNotNull(String column) {
    return new Predicate(column, Operator.IS_NOT_NULL, List.of());
  }
}
