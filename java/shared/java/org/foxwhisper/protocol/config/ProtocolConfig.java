//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.config;

import java.time.Duration;
import java.util.function.Function;

/**
 * Tunable bounds of the protocol core. None of these values are part of the wire protocol; peers
 * may run with different settings.
 *
 * <p>Instances are immutable. Use {@link #defaults()}, {@link #newBuilder()} or {@link
 * #fromEnvironment()}.
 */
public final class ProtocolConfig {

  public static final String PROPERTY_NAMESPACE = "org.foxwhisper.protocol.config";

  public static final int DEFAULT_MAX_SKIPPED_KEYS = 1000;
  public static final int DEFAULT_MAX_FORWARD_GAP = 200;
  public static final int DEFAULT_MAX_RETIRED_CHAINS = 32;
  public static final int DEFAULT_RETAINED_EPOCHS = 1;
  public static final Duration DEFAULT_MAX_CLOCK_SKEW = Duration.ofMinutes(5);
  public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_EPOCH_TRANSITION_TIMEOUT = Duration.ofSeconds(30);

  private static final ProtocolConfig DEFAULTS = newBuilder().build();

  private final int maxSkippedKeys;
  private final int maxForwardGap;
  private final int maxRetiredChains;
  private final int retainedEpochs;
  private final Duration maxClockSkew;
  private final Duration handshakeTimeout;
  private final Duration epochTransitionTimeout;

  private ProtocolConfig(Builder builder) {
    this.maxSkippedKeys = builder.maxSkippedKeys;
    this.maxForwardGap = builder.maxForwardGap;
    this.maxRetiredChains = builder.maxRetiredChains;
    this.retainedEpochs = builder.retainedEpochs;
    this.maxClockSkew = builder.maxClockSkew;
    this.handshakeTimeout = builder.handshakeTimeout;
    this.epochTransitionTimeout = builder.epochTransitionTimeout;
  }

  public static ProtocolConfig defaults() {
    return DEFAULTS;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Reads overrides from the environment first, then from System properties namespaced by {@link
   * #PROPERTY_NAMESPACE}. Unset values keep their defaults.
   *
   * <p>Recognized names: {@code FOXWHISPER_MAX_SKIPPED_KEYS}, {@code FOXWHISPER_MAX_FORWARD_GAP},
   * {@code FOXWHISPER_MAX_RETIRED_CHAINS}, {@code FOXWHISPER_RETAINED_EPOCHS}, {@code
   * FOXWHISPER_MAX_CLOCK_SKEW_MS}, {@code FOXWHISPER_HANDSHAKE_TIMEOUT_MS}, {@code
   * FOXWHISPER_EPOCH_TRANSITION_TIMEOUT_MS}.
   */
  public static ProtocolConfig fromEnvironment() {
    return fromLookup(ProtocolConfig::lookup);
  }

  static ProtocolConfig fromLookup(Function<String, String> lookup) {
    Builder builder = newBuilder();
    String value;
    if ((value = lookup.apply("FOXWHISPER_MAX_SKIPPED_KEYS")) != null) {
      builder.setMaxSkippedKeys(parseInt("FOXWHISPER_MAX_SKIPPED_KEYS", value));
    }
    if ((value = lookup.apply("FOXWHISPER_MAX_FORWARD_GAP")) != null) {
      builder.setMaxForwardGap(parseInt("FOXWHISPER_MAX_FORWARD_GAP", value));
    }
    if ((value = lookup.apply("FOXWHISPER_MAX_RETIRED_CHAINS")) != null) {
      builder.setMaxRetiredChains(parseInt("FOXWHISPER_MAX_RETIRED_CHAINS", value));
    }
    if ((value = lookup.apply("FOXWHISPER_RETAINED_EPOCHS")) != null) {
      builder.setRetainedEpochs(parseInt("FOXWHISPER_RETAINED_EPOCHS", value));
    }
    if ((value = lookup.apply("FOXWHISPER_MAX_CLOCK_SKEW_MS")) != null) {
      builder.setMaxClockSkew(parseMillis("FOXWHISPER_MAX_CLOCK_SKEW_MS", value));
    }
    if ((value = lookup.apply("FOXWHISPER_HANDSHAKE_TIMEOUT_MS")) != null) {
      builder.setHandshakeTimeout(parseMillis("FOXWHISPER_HANDSHAKE_TIMEOUT_MS", value));
    }
    if ((value = lookup.apply("FOXWHISPER_EPOCH_TRANSITION_TIMEOUT_MS")) != null) {
      builder.setEpochTransitionTimeout(
          parseMillis("FOXWHISPER_EPOCH_TRANSITION_TIMEOUT_MS", value));
    }
    return builder.build();
  }

  private static String lookup(String name) {
    String result = System.getenv(name);
    if (result != null) {
      return result;
    }
    return System.getProperty(PROPERTY_NAMESPACE + "." + name);
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " is not an integer: " + value, e);
    }
  }

  private static Duration parseMillis(String name, String value) {
    try {
      return Duration.ofMillis(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " is not a number of milliseconds: " + value, e);
    }
  }

  /** Upper bound on cached out-of-order message keys per session or per group sender. */
  public int getMaxSkippedKeys() {
    return maxSkippedKeys;
  }

  /** Largest index jump a single incoming message may cause. */
  public int getMaxForwardGap() {
    return maxForwardGap;
  }

  /** How many superseded remote ratchet keys a session remembers for replay detection. */
  public int getMaxRetiredChains() {
    return maxRetiredChains;
  }

  /** Number of superseded epochs whose sender keys stay usable for in-flight messages. */
  public int getRetainedEpochs() {
    return retainedEpochs;
  }

  public Duration getMaxClockSkew() {
    return maxClockSkew;
  }

  public Duration getHandshakeTimeout() {
    return handshakeTimeout;
  }

  public Duration getEpochTransitionTimeout() {
    return epochTransitionTimeout;
  }

  public static final class Builder {
    private int maxSkippedKeys = DEFAULT_MAX_SKIPPED_KEYS;
    private int maxForwardGap = DEFAULT_MAX_FORWARD_GAP;
    private int maxRetiredChains = DEFAULT_MAX_RETIRED_CHAINS;
    private int retainedEpochs = DEFAULT_RETAINED_EPOCHS;
    private Duration maxClockSkew = DEFAULT_MAX_CLOCK_SKEW;
    private Duration handshakeTimeout = DEFAULT_HANDSHAKE_TIMEOUT;
    private Duration epochTransitionTimeout = DEFAULT_EPOCH_TRANSITION_TIMEOUT;

    private Builder() {}

    public Builder setMaxSkippedKeys(int maxSkippedKeys) {
      this.maxSkippedKeys = requirePositive("maxSkippedKeys", maxSkippedKeys);
      return this;
    }

    public Builder setMaxForwardGap(int maxForwardGap) {
      this.maxForwardGap = requirePositive("maxForwardGap", maxForwardGap);
      return this;
    }

    public Builder setMaxRetiredChains(int maxRetiredChains) {
      this.maxRetiredChains = requirePositive("maxRetiredChains", maxRetiredChains);
      return this;
    }

    public Builder setRetainedEpochs(int retainedEpochs) {
      if (retainedEpochs < 0) {
        throw new IllegalArgumentException("retainedEpochs must not be negative");
      }
      this.retainedEpochs = retainedEpochs;
      return this;
    }

    public Builder setMaxClockSkew(Duration maxClockSkew) {
      this.maxClockSkew = requirePositive("maxClockSkew", maxClockSkew);
      return this;
    }

    public Builder setHandshakeTimeout(Duration handshakeTimeout) {
      this.handshakeTimeout = requirePositive("handshakeTimeout", handshakeTimeout);
      return this;
    }

    public Builder setEpochTransitionTimeout(Duration epochTransitionTimeout) {
      this.epochTransitionTimeout =
          requirePositive("epochTransitionTimeout", epochTransitionTimeout);
      return this;
    }

    public ProtocolConfig build() {
      if (maxForwardGap > maxSkippedKeys) {
        throw new IllegalArgumentException("maxForwardGap must not exceed maxSkippedKeys");
      }
      return new ProtocolConfig(this);
    }

    private static int requirePositive(String name, int value) {
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be positive");
      }
      return value;
    }

    private static Duration requirePositive(String name, Duration value) {
      if (value == null || value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException(name + " must be positive");
      }
      return value;
    }
  }
}
