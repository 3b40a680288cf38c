package io.bulkaction.gate;

import io.bulkaction.RateLimitedException;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of {@link SubmissionGate#attempt(String)}.
 */
public record GateDecision(boolean allowed, RateLimitedException.Reason reason, Duration retryAfter,
    String message) {
  private static final GateDecision ALLOWED = new GateDecision(true, null, null, null);

  public static GateDecision allow() {
    return ALLOWED;
  }

  public static GateDecision deny(RateLimitedException.Reason reason, Duration retryAfter,
      String message) {
    return new GateDecision(false, reason, retryAfter, message);
  }

  public Optional<Duration> retryAfterDuration() {
    return Optional.ofNullable(retryAfter);
  }

  /**
   * @throws RateLimitedException if this decision is a denial
   */
  public void throwIfDenied() {
    if (!allowed) {
      throw new RateLimitedException(reason, message, retryAfter);
    }
  }
}
