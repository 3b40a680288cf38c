package io.bulkaction.model;

import io.bulkaction.SpecInvalidException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entity types that bulk actions may target, keyed by {@link EntityType#name()}.
 */
public final class EntityRegistry {
  private final Map<String, EntityType> types = new ConcurrentHashMap<>();

  public EntityRegistry register(EntityType type) {
    Objects.requireNonNull(type, "type");
    EntityType existing = types.putIfAbsent(type.name(), type);
    if (existing != null && !existing.equals(type)) {
      throw new IllegalStateException("Entity type already registered: " + type.name());
    }
    return this;
  }

  public Optional<EntityType> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(types.get(name));
  }

  /**
   * @throws SpecInvalidException if no entity type is registered under {@code name}
   */
  public EntityType require(String name) {
    return find(name).orElseThrow(() -> new SpecInvalidException("Unknown entity type: " + name));
  }

  public Collection<EntityType> all() {
    return Collections.unmodifiableCollection(types.values());
  }
}
