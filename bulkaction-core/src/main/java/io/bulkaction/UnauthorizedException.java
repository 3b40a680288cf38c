package io.bulkaction;

public class UnauthorizedException extends BulkActionException {
  private final String actor;
  private final String action;
  private final String entityType;

  public UnauthorizedException(String actor, String action, String entityType) {
    super("Actor " + actor + " is not allowed to run '" + action + "' on " + entityType);
    this.actor = actor;
    this.action = action;
    this.entityType = entityType;
  }

  public String actor() {
    return actor;
  }

  public String action() {
    return action;
  }

  public String entityType() {
    return entityType;
  }
}
