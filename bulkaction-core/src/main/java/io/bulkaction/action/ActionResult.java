package io.bulkaction.action;

/**
 * Outcome of applying an action to one record. A failure only affects that record.
 */
public record ActionResult(boolean success, String error) {
  private static final ActionResult SUCCESS = new ActionResult(true, null);

  public static ActionResult ok() {
    return SUCCESS;
  }

  public static ActionResult failure(String error) {
    return new ActionResult(false, error == null ? "action failed" : error);
  }
}
