package org.servekit.runner;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import org.servekit.utils.SerializationUtils;

/**
 * The CPU and GPU budget available to a {@link Runner}. A quota is supplied by the caller when the
 * runner is constructed and never changes afterwards.
 */
public final class ResourceQuota {
  private final double cpu;
  private final List<Integer> gpus;

  /**
   * @param cpu The number of CPUs, possibly fractional; must be positive
   * @param gpus Ordered GPU device ids, may be empty
   */
  @JsonCreator
  public ResourceQuota(
      @JsonProperty(value = "cpu", required = true) Double cpu,
      @JsonProperty("gpus") List<Integer> gpus) {
    Preconditions.checkArgument(cpu != null, "A resource quota must declare its cpu count");
    Preconditions.checkArgument(
        cpu > 0 && !cpu.isInfinite(), "The cpu count must be a positive number, got %s", cpu);
    this.cpu = cpu;
    this.gpus = gpus == null ? ImmutableList.of() : ImmutableList.copyOf(gpus);
  }

  /** Creates a CPU-only quota */
  public static ResourceQuota ofCpu(double cpu) {
    return new ResourceQuota(cpu, null);
  }

  /**
   * Reads a quota from its map form {@code {"cpu": 2.0, "gpus": [0, 1]}}
   *
   * @throws IllegalArgumentException If the map has no cpu entry or holds invalid values
   */
  public static ResourceQuota fromMap(Map<String, Object> quota) {
    Preconditions.checkNotNull(quota, "Resource quota must not be null");
    return SerializationUtils.convertValue(quota, ResourceQuota.class);
  }

  @JsonProperty("cpu")
  public double getCpu() {
    return cpu;
  }

  @JsonProperty("gpus")
  public List<Integer> getGpus() {
    return gpus;
  }

  @Override
  public String toString() {
    return String.format("ResourceQuota(cpu=%s, gpus=%s)", cpu, gpus);
  }
}
