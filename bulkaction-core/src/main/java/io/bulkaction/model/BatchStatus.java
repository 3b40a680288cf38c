package io.bulkaction.model;

public enum BatchStatus {
  PENDING(0),
  PROCESSING(1),
  RETRY(2),
  COMPLETED(3),
  FAILED(4),
  CANCELLED(5);

  private final int code;

  BatchStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public static BatchStatus fromCode(int code) {
    for (BatchStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown batch status code: " + code);
  }
}
