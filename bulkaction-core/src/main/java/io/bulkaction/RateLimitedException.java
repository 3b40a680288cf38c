package io.bulkaction;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when a submission is refused by admission control.
 *
 * <p>{@link #retryAfter()} is present when the refusal has a known end, such as a cooldown.
 */
public class RateLimitedException extends BulkActionException {

  public enum Reason {
    TOO_MANY_ACTIVE,
    COOLDOWN,
    TOO_MANY_RECORDS
  }

  private final Reason reason;
  private final Duration retryAfter;

  public RateLimitedException(Reason reason, String message, Duration retryAfter) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.retryAfter = retryAfter;
  }

  public static RateLimitedException tooManyActive(String actor, int ceiling) {
    return new RateLimitedException(Reason.TOO_MANY_ACTIVE,
        "Actor " + actor + " already has " + ceiling + " active bulk actions", null);
  }

  public static RateLimitedException inCooldown(String actor, Duration remaining) {
    return new RateLimitedException(Reason.COOLDOWN,
        "Actor " + actor + " is in cooldown for another " + remaining.toSeconds() + "s", remaining);
  }

  public static RateLimitedException tooManyRecords(long count, long max) {
    return new RateLimitedException(Reason.TOO_MANY_RECORDS,
        "Target set of " + count + " records exceeds the limit of " + max, null);
  }

  public Reason reason() {
    return reason;
  }

  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
