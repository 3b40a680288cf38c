package io.bulkaction.action;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionResultTest {

  @Test
  void okIsASuccessWithoutError() {
    ActionResult result = ActionResult.ok();

    assertTrue(result.success());
    assertNull(result.error());
    assertSame(result, ActionResult.ok());
  }

  @Test
  void failureCarriesItsError() {
    ActionResult result = ActionResult.failure("row locked");

    assertFalse(result.success());
    assertEquals("row locked", result.error());
  }

  @Test
  void failureWithoutMessageGetsADefault() {
    assertEquals("action failed", ActionResult.failure(null).error());
  }
}
