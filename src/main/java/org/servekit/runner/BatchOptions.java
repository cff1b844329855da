package org.servekit.runner;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import java.util.Map;
import org.servekit.utils.SerializationUtils;

/**
 * How requests should be grouped into batches before they reach a {@link Runner}. Runners carry
 * these options for the component that assembles batches; they do not act on them.
 */
public final class BatchOptions {
  public static final int DEFAULT_MAX_BATCH_SIZE = 1000;
  public static final long DEFAULT_MAX_LATENCY_MILLIS = 10000;

  private final boolean enabled;
  private final int maxBatchSize;
  private final long maxLatencyMillis;

  @JsonCreator
  public BatchOptions(
      @JsonProperty("enabled") Boolean enabled,
      @JsonProperty("max_batch_size") Integer maxBatchSize,
      @JsonProperty("max_latency_ms") Long maxLatencyMillis) {
    this.enabled = enabled == null || enabled;
    this.maxBatchSize = maxBatchSize == null ? DEFAULT_MAX_BATCH_SIZE : maxBatchSize;
    this.maxLatencyMillis =
        maxLatencyMillis == null ? DEFAULT_MAX_LATENCY_MILLIS : maxLatencyMillis;
    Preconditions.checkArgument(this.maxBatchSize >= 1, "max_batch_size must be at least 1");
    Preconditions.checkArgument(this.maxLatencyMillis >= 0, "max_latency_ms must not be negative");
  }

  /** @return Options with batching enabled and the default limits */
  public static BatchOptions defaults() {
    return new BatchOptions(null, null, null);
  }

  /** Reads options from their map form, filling in defaults for missing entries */
  public static BatchOptions fromMap(Map<String, Object> options) {
    if (options == null) {
      return defaults();
    }
    return SerializationUtils.convertValue(options, BatchOptions.class);
  }

  @JsonProperty("enabled")
  public boolean isEnabled() {
    return enabled;
  }

  @JsonProperty("max_batch_size")
  public int getMaxBatchSize() {
    return maxBatchSize;
  }

  @JsonProperty("max_latency_ms")
  public long getMaxLatencyMillis() {
    return maxLatencyMillis;
  }
}
