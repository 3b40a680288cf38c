package io.bulkaction.spi;

/**
 * Decides whether an actor may run an action against an entity type.
 */
@FunctionalInterface
public interface AuthorizationPolicy {

  AuthorizationPolicy ALLOW_ALL = (actor, action, entityType) -> true;

  boolean isAllowed(String actor, String action, String entityType);
}
