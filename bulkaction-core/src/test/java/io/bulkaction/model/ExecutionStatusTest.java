package io.bulkaction.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionStatusTest {

  @Test
  void forwardTransitions() {
    assertTrue(ExecutionStatus.SCHEDULED.canTransitionTo(ExecutionStatus.PENDING));
    assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.PROCESSING));
    assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.COMPLETED));
    assertTrue(ExecutionStatus.PROCESSING.canTransitionTo(ExecutionStatus.COMPLETED));
    assertTrue(ExecutionStatus.PROCESSING.canTransitionTo(ExecutionStatus.FAILED));
  }

  @Test
  void cancellationFromEveryLiveStatus() {
    assertTrue(ExecutionStatus.SCHEDULED.canTransitionTo(ExecutionStatus.CANCELLED));
    assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.CANCELLED));
    assertTrue(ExecutionStatus.PROCESSING.canTransitionTo(ExecutionStatus.CANCELLED));
  }

  @Test
  void noBackwardMoves() {
    assertFalse(ExecutionStatus.PROCESSING.canTransitionTo(ExecutionStatus.PENDING));
    assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.SCHEDULED));
    assertFalse(ExecutionStatus.SCHEDULED.canTransitionTo(ExecutionStatus.PROCESSING));
  }

  @Test
  void terminalStatusesAreFinal() {
    for (ExecutionStatus terminal : EnumSet.of(ExecutionStatus.COMPLETED,
        ExecutionStatus.FAILED, ExecutionStatus.CANCELLED)) {
      assertTrue(terminal.isTerminal());
      for (ExecutionStatus target : ExecutionStatus.values()) {
        assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
      }
    }
  }
}
