//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

/**
 * Binds a media key id to the one participant of one call that may fetch it, from a given media
 * epoch on. The SFU only ever holds the key as an opaque blob encrypted end to end.
 */
public final class KeyGrant {
  private final String keyId;
  private final String callId;
  private final String participantId;
  private final long mediaEpoch;
  private final byte[] encryptedKeyBlob;

  public KeyGrant(
      String keyId, String callId, String participantId, long mediaEpoch, byte[] encryptedKeyBlob) {
    if (mediaEpoch < 0) {
      throw new IllegalArgumentException("negative media epoch");
    }
    this.keyId = keyId;
    this.callId = callId;
    this.participantId = participantId;
    this.mediaEpoch = mediaEpoch;
    this.encryptedKeyBlob = encryptedKeyBlob == null ? null : encryptedKeyBlob.clone();
  }

  public String getKeyId() {
    return keyId;
  }

  public String getCallId() {
    return callId;
  }

  public String getParticipantId() {
    return participantId;
  }

  public long getMediaEpoch() {
    return mediaEpoch;
  }

  /** The opaque key blob, or {@code null} if the grant carries none. */
  public byte[] getEncryptedKeyBlob() {
    return encryptedKeyBlob == null ? null : encryptedKeyBlob.clone();
  }

  boolean hasSameBinding(KeyGrant other) {
    return callId.equals(other.callId) && participantId.equals(other.participantId);
  }
}
