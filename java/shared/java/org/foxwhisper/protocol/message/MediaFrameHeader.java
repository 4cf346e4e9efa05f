//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.message;

import java.util.Map;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.InvalidVersionException;
import org.foxwhisper.protocol.cbor.CborException;
import org.foxwhisper.protocol.cbor.CborMap;
import org.foxwhisper.protocol.crypto.Hashes;
import org.foxwhisper.protocol.util.Hex;

/**
 * The cleartext routing header of one encrypted media frame. This is everything a forwarding node
 * gets to see about a frame.
 */
public final class MediaFrameHeader extends ProtocolMessage {

  private final String callId;
  private final String participantId;
  private final String streamId;
  private final long frameSequence;
  private final long mediaEpoch;
  private final String layer;

  /**
   * @param layer the simulcast layer, or {@code null} for single-layer streams
   */
  public MediaFrameHeader(
      String callId,
      String participantId,
      String streamId,
      long frameSequence,
      long mediaEpoch,
      String layer) {
    if (frameSequence < 0 || mediaEpoch < 0) {
      throw new IllegalArgumentException("negative sequence or epoch");
    }
    this.callId = callId;
    this.participantId = participantId;
    this.streamId = streamId;
    this.frameSequence = frameSequence;
    this.mediaEpoch = mediaEpoch;
    this.layer = layer;
  }

  public static MediaFrameHeader deserialize(byte[] serialized) throws InvalidMessageException {
    try {
      return decodeAs(serialized, MediaFrameHeader.class);
    } catch (InvalidVersionException e) {
      throw new InvalidMessageException(e.getCode(), e.getMessage(), e);
    }
  }

  static MediaFrameHeader fromFields(CborMap fields) throws CborException {
    fields.requireOnly(
        "version",
        "call_id",
        "participant_id",
        "stream_id",
        "frame_sequence",
        "media_epoch",
        "layer");
    long frameSequence = fields.getLong("frame_sequence");
    long mediaEpoch = fields.getLong("media_epoch");
    if (frameSequence < 0 || mediaEpoch < 0) {
      throw new CborException("negative sequence or epoch");
    }
    return new MediaFrameHeader(
        fields.getString("call_id"),
        fields.getString("participant_id"),
        fields.getString("stream_id"),
        frameSequence,
        mediaEpoch,
        fields.getOptionalString("layer"));
  }

  @Override
  public MessageType getType() {
    return MessageType.MEDIA_FRAME;
  }

  @Override
  protected Map<String, Object> toFields() {
    Map<String, Object> fields = newFieldMap();
    fields.put("call_id", callId);
    fields.put("participant_id", participantId);
    fields.put("stream_id", streamId);
    fields.put("frame_sequence", frameSequence);
    fields.put("media_epoch", mediaEpoch);
    if (layer != null) {
      fields.put("layer", layer);
    }
    return fields;
  }

  /** SHA-256 of the canonical header encoding. Used as the frame's AEAD associated data. */
  public byte[] getDigest() {
    return Hashes.sha256(serialize());
  }

  /** Lowercase hex of {@link #getDigest()}, as recorded in routing transcripts. */
  public String getDigestHex() {
    return Hex.toStringCondensed(getDigest());
  }

  public String getCallId() {
    return callId;
  }

  public String getParticipantId() {
    return participantId;
  }

  public String getStreamId() {
    return streamId;
  }

  public long getFrameSequence() {
    return frameSequence;
  }

  public long getMediaEpoch() {
    return mediaEpoch;
  }

  public String getLayer() {
    return layer;
  }
}
