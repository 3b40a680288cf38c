package io.bulkaction.action;

import io.bulkaction.model.MutationType;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultActionRegistryTest {

  @Test
  void builtInsAreRegistered() {
    DefaultActionRegistry registry = DefaultActionRegistry.withBuiltIns();

    assertEquals(Set.of("archive", "delete", "force_delete", "restore", "update"),
        registry.names());
    assertEquals(MutationType.SOFT_DELETE, registry.handlerFor("delete").mutationType());
  }

  @Test
  void unknownNameReturnsNull() {
    DefaultActionRegistry registry = new DefaultActionRegistry();

    assertNull(registry.handlerFor("nope"));
    assertNull(registry.handlerFor(null));
  }

  @Test
  void customHandlerIsLookedUpByName() {
    ActionHandler touch = ActionHandler.of("touch", MutationType.UPDATE_FIELDS,
        Set.of("updated_at"), ctx -> ActionResult.ok());

    DefaultActionRegistry registry = DefaultActionRegistry.withBuiltIns().register(touch);

    assertSame(touch, registry.handlerFor("touch"));
  }

  @Test
  void duplicateNameIsRejected() {
    DefaultActionRegistry registry = DefaultActionRegistry.withBuiltIns();
    ActionHandler clash = ActionHandler.of("delete", MutationType.DESTROY,
        ActionHandler.ALL_FIELDS, ctx -> ActionResult.ok());

    assertThrows(IllegalStateException.class, () -> registry.register(clash));
  }

  @Test
  void namesViewIsUnmodifiable() {
    DefaultActionRegistry registry = DefaultActionRegistry.withBuiltIns();

    assertThrows(UnsupportedOperationException.class, () -> registry.names().add("x"));
  }
}
