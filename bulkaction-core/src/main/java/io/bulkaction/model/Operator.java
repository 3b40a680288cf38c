package io.bulkaction.model;

/**
 * Comparison operators a {@link Predicate} can apply to a column.
 */
public enum Operator {
  EQ(1, 1),
  LT(1, 1),
  GT(1, 1),
  IN(1, Integer.MAX_VALUE),
  NOT_IN(1, Integer.MAX_VALUE),
  BETWEEN(2, 2),
  IS_NULL(0, 0),
  IS_NOT_NULL(0, 0);

  private final int minValues;
  private final int maxValues;

  Operator(int minValues, int maxValues) {
    this.minValues = minValues;
    this.maxValues = maxValues;
  }

  public boolean acceptsValueCount(int count) {
    return count >= minValues && count <= maxValues;
  }

  public String describeArity() {
    if (minValues == maxValues) {
      return "exactly " + minValues + (minValues == 1 ? " value" : " values");
    }
    return "at least " + minValues + " value";
  }
}
