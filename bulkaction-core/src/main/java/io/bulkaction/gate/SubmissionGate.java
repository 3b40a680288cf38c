package io.bulkaction.gate;

import io.bulkaction.BulkActionException;
import io.bulkaction.RateLimitedException;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.TtlCache;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Submission-time admission control: a per-actor ceiling on non-terminal executions plus a
 * cooldown window armed after large operations.
 *
 * <p>The gate answers immediately. It never queues or waits for a slot. Submissions without
 * an actor are always admitted.
 */
public final class SubmissionGate {
  static final String COOLDOWN_PREFIX = "bulkaction:cooldown:";

  private final ConnectionProvider connectionProvider;
  private final ExecutionStore executionStore;
  private final TtlCache cache;
  private final Clock clock;
  private final int maxConcurrentPerActor;
  private final Duration defaultCooldown;

  private SubmissionGate(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.cache = Objects.requireNonNull(builder.cache, "cache");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.maxConcurrentPerActor < 1) {
      throw new IllegalArgumentException("maxConcurrentPerActor must be >= 1");
    }
    this.maxConcurrentPerActor = builder.maxConcurrentPerActor;
    this.defaultCooldown = builder.cooldown;
  }

  public static Builder builder() {
    return new Builder();
  }

  public GateDecision attempt(String actor) {
    if (actor == null) {
      return GateDecision.allow();
    }
    Optional<Duration> cooldown = cooldownRemaining(actor);
    if (cooldown.isPresent()) {
      return GateDecision.deny(RateLimitedException.Reason.COOLDOWN, cooldown.get(),
          RateLimitedException.inCooldown(actor, cooldown.get()).getMessage());
    }
    int active = activeCount(actor);
    if (active >= maxConcurrentPerActor) {
      return GateDecision.deny(RateLimitedException.Reason.TOO_MANY_ACTIVE, null,
          RateLimitedException.tooManyActive(actor, maxConcurrentPerActor).getMessage());
    }
    return GateDecision.allow();
  }

  public int activeCount(String actor) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return executionStore.countActiveByActor(conn, actor);
    } catch (SQLException e) {
      throw new BulkActionException("Failed to count active executions for " + actor, e);
    }
  }

  public int remainingSlots(String actor) {
    return Math.max(0, maxConcurrentPerActor - activeCount(actor));
  }

  public void setCooldown(String actor) {
    setCooldown(actor, defaultCooldown);
  }

  public void setCooldown(String actor, Duration duration) {
    Objects.requireNonNull(actor, "actor");
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    cache.put(COOLDOWN_PREFIX + actor, clock.instant().plus(duration), duration);
  }

  public void clearCooldown(String actor) {
    cache.remove(COOLDOWN_PREFIX + actor);
  }

  public Optional<Duration> cooldownRemaining(String actor) {
    Optional<Instant> until = cache.get(COOLDOWN_PREFIX + actor, Instant.class);
    if (until.isEmpty()) {
      return Optional.empty();
    }
    Duration left = Duration.between(clock.instant(), until.get());
    return left.isNegative() || left.isZero() ? Optional.empty() : Optional.of(left);
  }

  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ExecutionStore executionStore;
    private TtlCache cache;
    private Clock clock;
    private int maxConcurrentPerActor = 5;
    private Duration cooldown = Duration.ofSeconds(60);

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder executionStore(ExecutionStore executionStore) {
      this.executionStore = executionStore;
      return this;
    }

    public Builder cache(TtlCache cache) {
      this.cache = cache;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@code 5}. */
    public Builder maxConcurrentPerActor(int maxConcurrentPerActor) {
      this.maxConcurrentPerActor = maxConcurrentPerActor;
      return this;
    }

    /** Optional. Length of {@link SubmissionGate#setCooldown(String)}. Defaults to 60 s. */
    public Builder cooldown(Duration cooldown) {
      this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
      return this;
    }

    public SubmissionGate build() {
      return new SubmissionGate(this);
    }
  }
}
