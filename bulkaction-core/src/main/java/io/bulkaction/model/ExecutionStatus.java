package io.bulkaction.model;

/**
 * Lifecycle of an {@link Execution}.
 *
 * <p>{@code SCHEDULED -> PENDING -> PROCESSING -> {COMPLETED | FAILED | CANCELLED}}, plus
 * {@code SCHEDULED -> CANCELLED} and {@code PENDING -> CANCELLED}. A pending execution whose
 * target set is empty goes straight to {@code COMPLETED}. Nothing leaves a terminal status.
 */
public enum ExecutionStatus {
  SCHEDULED(0),
  PENDING(1),
  PROCESSING(2),
  COMPLETED(3),
  FAILED(4),
  CANCELLED(5);

  private final int code;

  ExecutionStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public boolean canTransitionTo(ExecutionStatus target) {
    return switch (this) {
      case SCHEDULED -> target == PENDING || target == CANCELLED;
      case PENDING -> target == PROCESSING || target == CANCELLED || target == COMPLETED
          || target == FAILED;
      case PROCESSING -> target.isTerminal();
      case COMPLETED, FAILED, CANCELLED -> false;
    };
  }

  public static ExecutionStatus fromCode(int code) {
    for (ExecutionStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown execution status code: " + code);
  }
}
