//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.message;

import java.util.Map;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.InvalidVersionException;
import org.foxwhisper.protocol.cbor.CanonicalCbor;
import org.foxwhisper.protocol.cbor.CborException;
import org.foxwhisper.protocol.cbor.CborMap;
import org.foxwhisper.protocol.crypto.Hashes;

/**
 * Second handshake flight. Commits to the complete init message through {@code init_hash}, so
 * the hash of its signed fields is the hash of the whole transcript.
 */
public final class HandshakeResponseMessage extends ProtocolMessage {

  private final String suite;
  private final DeviceAddress sender;
  private final DeviceAddress recipient;
  private final byte[] identityKey;
  private final byte[] ephemeralKey;
  private final byte[] kemCiphertext;
  private final byte[] nonce;
  private final long timestamp;
  private final byte[] initHash;
  private final byte[] deviceSignature;
  private final byte[] identitySignature;

  public HandshakeResponseMessage(
      String suite,
      DeviceAddress sender,
      DeviceAddress recipient,
      byte[] identityKey,
      byte[] ephemeralKey,
      byte[] kemCiphertext,
      byte[] nonce,
      long timestamp,
      byte[] initHash,
      byte[] deviceSignature,
      byte[] identitySignature) {
    this.suite = suite;
    this.sender = sender;
    this.recipient = recipient;
    this.identityKey = identityKey.clone();
    this.ephemeralKey = ephemeralKey.clone();
    this.kemCiphertext = kemCiphertext.clone();
    this.nonce = nonce.clone();
    this.timestamp = timestamp;
    this.initHash = initHash.clone();
    this.deviceSignature = deviceSignature.clone();
    this.identitySignature = identitySignature.clone();
  }

  /** @throws InvalidVersionException if the message carries an unsupported version */
  public static HandshakeResponseMessage deserialize(byte[] serialized)
      throws InvalidMessageException, InvalidVersionException {
    return decodeAs(serialized, HandshakeResponseMessage.class);
  }

  static HandshakeResponseMessage fromFields(CborMap fields) throws CborException {
    fields.requireOnly(
        "version",
        "suite",
        "identity_id",
        "device_id",
        "recipient_id",
        "recipient_device_id",
        "identity_key",
        "ephemeral_key",
        "kem_ciphertext",
        "nonce",
        "timestamp",
        "init_hash",
        "device_signature",
        "identity_signature");
    return new HandshakeResponseMessage(
        fields.getString("suite"),
        HandshakeInitMessage.address(fields.getString("identity_id"), fields.getInt("device_id")),
        HandshakeInitMessage.address(
            fields.getString("recipient_id"), fields.getInt("recipient_device_id")),
        fields.getBytes("identity_key"),
        fields.getBytes("ephemeral_key"),
        fields.getBytes("kem_ciphertext"),
        fields.getBytes("nonce"),
        fields.getLong("timestamp"),
        fields.getBytes("init_hash", Hashes.SHA256_LENGTH),
        fields.getBytes("device_signature"),
        fields.getBytes("identity_signature"));
  }

  @Override
  public MessageType getType() {
    return MessageType.HANDSHAKE_RESPONSE;
  }

  public Map<String, Object> getSignedFields() {
    Map<String, Object> fields = newFieldMap();
    fields.put("suite", suite);
    fields.put("identity_id", sender.getName());
    fields.put("device_id", sender.getDeviceId());
    fields.put("recipient_id", recipient.getName());
    fields.put("recipient_device_id", recipient.getDeviceId());
    fields.put("identity_key", identityKey);
    fields.put("ephemeral_key", ephemeralKey);
    fields.put("kem_ciphertext", kemCiphertext);
    fields.put("nonce", nonce);
    fields.put("timestamp", timestamp);
    fields.put("init_hash", initHash);
    return fields;
  }

  /** The transcript hash: SHA-256 of the canonical encoding of {@link #getSignedFields()}. */
  public byte[] getSignedHash() {
    return Hashes.sha256(CanonicalCbor.encode(getSignedFields()));
  }

  @Override
  protected Map<String, Object> toFields() {
    Map<String, Object> fields = getSignedFields();
    fields.put("device_signature", deviceSignature);
    fields.put("identity_signature", identitySignature);
    return fields;
  }

  public String getSuite() {
    return suite;
  }

  public DeviceAddress getSender() {
    return sender;
  }

  public DeviceAddress getRecipient() {
    return recipient;
  }

  public byte[] getIdentityKey() {
    return identityKey.clone();
  }

  public byte[] getEphemeralKey() {
    return ephemeralKey.clone();
  }

  public byte[] getKemCiphertext() {
    return kemCiphertext.clone();
  }

  public byte[] getNonce() {
    return nonce.clone();
  }

  public long getTimestamp() {
    return timestamp;
  }

  public byte[] getInitHash() {
    return initHash.clone();
  }

  public byte[] getDeviceSignature() {
    return deviceSignature.clone();
  }

  public byte[] getIdentitySignature() {
    return identitySignature.clone();
  }
}
