package io.bulkaction;

import io.bulkaction.model.FilterSpec;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a caller asks {@link BulkActionEngine#submit} to do.
 *
 * <p>Create instances via {@link #builder(String, String)}.
 */
public final class BulkActionRequest {
  private final String entityType;
  private final String actionName;
  private final FilterSpec filter;
  private final Map<String, Object> parameters;
  private final String actor;
  private final Integer batchSize;
  private final boolean undoEnabled;
  private final Duration undoWindow;
  private final Instant scheduledFor;
  private final boolean dryRun;

  private BulkActionRequest(Builder builder) {
    this.entityType = builder.entityType;
    this.actionName = builder.actionName;
    this.filter = Objects.requireNonNull(builder.filter, "filter");
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    this.actor = builder.actor;
    this.batchSize = builder.batchSize;
    this.undoEnabled = builder.undoEnabled;
    this.undoWindow = builder.undoWindow;
    this.scheduledFor = builder.scheduledFor;
    this.dryRun = builder.dryRun;
  }

  public static Builder builder(String entityType, String actionName) {
    return new Builder(entityType, actionName);
  }

  public String entityType() {
    return entityType;
  }

  public String actionName() {
    return actionName;
  }

  public FilterSpec filter() {
    return filter;
  }

  public Map<String, Object> parameters() {
    return parameters;
  }

  /** May be {@code null} for system-initiated work, which bypasses the per-actor gate. */
  public String actor() {
    return actor;
  }

  /** {@code null} means the engine default. */
  public Integer batchSize() {
    return batchSize;
  }

  public boolean undoEnabled() {
    return undoEnabled;
  }

  /** {@code null} means the engine default. */
  public Duration undoWindow() {
    return undoWindow;
  }

  /** {@code null} runs the action right away. */
  public Instant scheduledFor() {
    return scheduledFor;
  }

  /**
   * A dry run counts the matching records and records the outcome without mutating anything.
   * It ignores {@link #scheduledFor()}.
   */
  public boolean dryRun() {
    return dryRun;
  }

  @Override
  public String toString() {
    return "BulkActionRequest{entityType=" + entityType + ", action=" + actionName
        + ", filter=" + filter + ", actor=" + actor + ", scheduledFor=" + scheduledFor
        + (dryRun ? ", dryRun" : "") + "}";
  }

  public static final class Builder {
    private final String entityType;
    private final String actionName;
    private FilterSpec filter = FilterSpec.all();
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private String actor;
    private Integer batchSize;
    private boolean undoEnabled = true;
    private Duration undoWindow;
    private Instant scheduledFor;
    private boolean dryRun;

    private Builder(String entityType, String actionName) {
      this.entityType = Objects.requireNonNull(entityType, "entityType");
      this.actionName = Objects.requireNonNull(actionName, "actionName");
    }

    /** Optional. Defaults to {@link FilterSpec#all()}. */
    public Builder filter(FilterSpec filter) {
      this.filter = Objects.requireNonNull(filter, "filter");
      return this;
    }

    public Builder parameter(String name, Object value) {
      this.parameters.put(Objects.requireNonNull(name, "name"), value);
      return this;
    }

    public Builder parameters(Map<String, ?> parameters) {
      this.parameters.putAll(parameters);
      return this;
    }

    public Builder actor(String actor) {
      this.actor = actor;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Defaults to {@code true}. */
    public Builder undoEnabled(boolean undoEnabled) {
      this.undoEnabled = undoEnabled;
      return this;
    }

    public Builder undoWindow(Duration undoWindow) {
      this.undoWindow = undoWindow;
      return this;
    }

    public Builder scheduledFor(Instant scheduledFor) {
      this.scheduledFor = scheduledFor;
      return this;
    }

    public Builder dryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    public Builder dryRun() {
      return dryRun(true);
    }

    public BulkActionRequest build() {
      return new BulkActionRequest(this);
    }
  }
}
