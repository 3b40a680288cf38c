package io.bulkaction.dispatch;

import java.time.Duration;

public class BatchTimeoutException extends TransientBatchException {

  public BatchTimeoutException(String batchKey, Duration limit) {
    super("Batch " + batchKey + " exceeded its time limit of " + limit);
  }
}
