//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.time.Duration;

/** Limits enforced by {@link SfuHandler}. Instances are immutable. */
public final class SfuPolicy {

  public static final Duration DEFAULT_MAX_TOKEN_SKEW = Duration.ofMinutes(5);
  public static final int DEFAULT_NONCE_CACHE_SIZE = 4096;
  public static final int DEFAULT_MAX_SUBSCRIBERS_PER_TRACK = 64;
  public static final int DEFAULT_MAX_TRACKS_PER_PARTICIPANT = 8;
  public static final long DEFAULT_MAX_BITRATE_BPS = 8_000_000L;
  public static final int DEFAULT_TRANSCRIPT_CAPACITY = 100_000;

  private static final SfuPolicy DEFAULTS = newBuilder().build();

  private final Duration maxTokenSkew;
  private final int nonceCacheSize;
  private final int maxSubscribersPerTrack;
  private final int maxTracksPerParticipant;
  private final long maxBitrateBps;
  private final int transcriptCapacity;

  private SfuPolicy(Builder builder) {
    this.maxTokenSkew = builder.maxTokenSkew;
    this.nonceCacheSize = builder.nonceCacheSize;
    this.maxSubscribersPerTrack = builder.maxSubscribersPerTrack;
    this.maxTracksPerParticipant = builder.maxTracksPerParticipant;
    this.maxBitrateBps = builder.maxBitrateBps;
    this.transcriptCapacity = builder.transcriptCapacity;
  }

  public static SfuPolicy defaults() {
    return DEFAULTS;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Duration getMaxTokenSkew() {
    return maxTokenSkew;
  }

  /** Number of recent auth nonces remembered for replay detection. */
  public int getNonceCacheSize() {
    return nonceCacheSize;
  }

  public int getMaxSubscribersPerTrack() {
    return maxSubscribersPerTrack;
  }

  public int getMaxTracksPerParticipant() {
    return maxTracksPerParticipant;
  }

  public long getMaxBitrateBps() {
    return maxBitrateBps;
  }

  /** Number of transcript entries kept; the oldest are dropped first. */
  public int getTranscriptCapacity() {
    return transcriptCapacity;
  }

  public static final class Builder {
    private Duration maxTokenSkew = DEFAULT_MAX_TOKEN_SKEW;
    private int nonceCacheSize = DEFAULT_NONCE_CACHE_SIZE;
    private int maxSubscribersPerTrack = DEFAULT_MAX_SUBSCRIBERS_PER_TRACK;
    private int maxTracksPerParticipant = DEFAULT_MAX_TRACKS_PER_PARTICIPANT;
    private long maxBitrateBps = DEFAULT_MAX_BITRATE_BPS;
    private int transcriptCapacity = DEFAULT_TRANSCRIPT_CAPACITY;

    private Builder() {}

    public Builder setMaxTokenSkew(Duration maxTokenSkew) {
      if (maxTokenSkew == null || maxTokenSkew.isNegative() || maxTokenSkew.isZero()) {
        throw new IllegalArgumentException("maxTokenSkew must be positive");
      }
      this.maxTokenSkew = maxTokenSkew;
      return this;
    }

    public Builder setNonceCacheSize(int nonceCacheSize) {
      this.nonceCacheSize = requirePositive("nonceCacheSize", nonceCacheSize);
      return this;
    }

    public Builder setMaxSubscribersPerTrack(int maxSubscribersPerTrack) {
      this.maxSubscribersPerTrack =
          requirePositive("maxSubscribersPerTrack", maxSubscribersPerTrack);
      return this;
    }

    public Builder setMaxTracksPerParticipant(int maxTracksPerParticipant) {
      this.maxTracksPerParticipant =
          requirePositive("maxTracksPerParticipant", maxTracksPerParticipant);
      return this;
    }

    public Builder setMaxBitrateBps(long maxBitrateBps) {
      if (maxBitrateBps <= 0) {
        throw new IllegalArgumentException("maxBitrateBps must be positive");
      }
      this.maxBitrateBps = maxBitrateBps;
      return this;
    }

    public Builder setTranscriptCapacity(int transcriptCapacity) {
      this.transcriptCapacity = requirePositive("transcriptCapacity", transcriptCapacity);
      return this;
    }

    public SfuPolicy build() {
      return new SfuPolicy(this);
    }

    private static int requirePositive(String name, int value) {
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be positive");
      }
      return value;
    }
  }
}
