package io.bulkaction.model;

import io.bulkaction.SpecInvalidException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityTypeTest {

  @Test
  void rejectsNonIdentifierNames() {
    assertThrows(IllegalArgumentException.class, () -> EntityType.of("user", "app user", "id"));
    assertThrows(IllegalArgumentException.class, () -> EntityType.of("user", "app_user", "1d"));
    assertThrows(IllegalArgumentException.class,
        () -> new EntityType("user", "app_user", "id", "deleted-at"));
  }

  @Test
  void softDeleteSupportFollowsColumn() {
    assertFalse(EntityType.of("tag", "tag", "id").supportsSoftDelete());
    assertTrue(new EntityType("user", "app_user", "id", "deleted_at").supportsSoftDelete());
  }

  @Test
  void registryResolvesByName() {
    EntityRegistry registry = new EntityRegistry()
        .register(EntityType.of("tag", "tag", "id"));

    assertEquals("tag", registry.require("tag").table());
    assertTrue(registry.find("missing").isEmpty());
    assertThrows(SpecInvalidException.class, () -> registry.require("missing"));
  }

  @Test
  void registryRejectsConflictingRedefinition() {
    EntityRegistry registry = new EntityRegistry()
        .register(EntityType.of("tag", "tag", "id"));

    assertDoesNotThrow(() -> registry.register(EntityType.of("tag", "tag", "id")));
    assertThrows(IllegalStateException.class,
        () -> registry.register(EntityType.of("tag", "labels", "id")));
  }
}
