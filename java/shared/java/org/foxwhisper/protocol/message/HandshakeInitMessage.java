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
 * First handshake flight. Carries the initiator's ephemeral X25519 key and its published Kyber
 * key, signed first by the device key and then by the identity key.
 */
public final class HandshakeInitMessage extends ProtocolMessage {

  private final String suite;
  private final DeviceAddress sender;
  private final DeviceAddress recipient;
  private final byte[] identityKey;
  private final byte[] ephemeralKey;
  private final byte[] kemPublicKey;
  private final byte[] nonce;
  private final long timestamp;
  private final byte[] deviceSignature;
  private final byte[] identitySignature;

  public HandshakeInitMessage(
      String suite,
      DeviceAddress sender,
      DeviceAddress recipient,
      byte[] identityKey,
      byte[] ephemeralKey,
      byte[] kemPublicKey,
      byte[] nonce,
      long timestamp,
      byte[] deviceSignature,
      byte[] identitySignature) {
    this.suite = suite;
    this.sender = sender;
    this.recipient = recipient;
    this.identityKey = identityKey.clone();
    this.ephemeralKey = ephemeralKey.clone();
    this.kemPublicKey = kemPublicKey.clone();
    this.nonce = nonce.clone();
    this.timestamp = timestamp;
    this.deviceSignature = deviceSignature.clone();
    this.identitySignature = identitySignature.clone();
  }

  /** @throws InvalidVersionException if the message carries an unsupported version */
  public static HandshakeInitMessage deserialize(byte[] serialized)
      throws InvalidMessageException, InvalidVersionException {
    return decodeAs(serialized, HandshakeInitMessage.class);
  }

  static HandshakeInitMessage fromFields(CborMap fields) throws CborException {
    fields.requireOnly(
        "version",
        "suite",
        "identity_id",
        "device_id",
        "recipient_id",
        "recipient_device_id",
        "identity_key",
        "ephemeral_key",
        "kem_public_key",
        "nonce",
        "timestamp",
        "device_signature",
        "identity_signature");
    return new HandshakeInitMessage(
        fields.getString("suite"),
        address(fields.getString("identity_id"), fields.getInt("device_id")),
        address(fields.getString("recipient_id"), fields.getInt("recipient_device_id")),
        fields.getBytes("identity_key"),
        fields.getBytes("ephemeral_key"),
        fields.getBytes("kem_public_key"),
        fields.getBytes("nonce"),
        fields.getLong("timestamp"),
        fields.getBytes("device_signature"),
        fields.getBytes("identity_signature"));
  }

  static DeviceAddress address(String name, int deviceId) throws CborException {
    try {
      return new DeviceAddress(name, deviceId);
    } catch (IllegalArgumentException e) {
      throw new CborException("invalid device address", e);
    }
  }

  @Override
  public MessageType getType() {
    return MessageType.HANDSHAKE_INIT;
  }

  /** The fields covered by both signatures. */
  public Map<String, Object> getSignedFields() {
    Map<String, Object> fields = newFieldMap();
    fields.put("suite", suite);
    fields.put("identity_id", sender.getName());
    fields.put("device_id", sender.getDeviceId());
    fields.put("recipient_id", recipient.getName());
    fields.put("recipient_device_id", recipient.getDeviceId());
    fields.put("identity_key", identityKey);
    fields.put("ephemeral_key", ephemeralKey);
    fields.put("kem_public_key", kemPublicKey);
    fields.put("nonce", nonce);
    fields.put("timestamp", timestamp);
    return fields;
  }

  /** SHA-256 of the canonical encoding of {@link #getSignedFields()}. */
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

  public byte[] getKemPublicKey() {
    return kemPublicKey.clone();
  }

  public byte[] getNonce() {
    return nonce.clone();
  }

  public long getTimestamp() {
    return timestamp;
  }

  public byte[] getDeviceSignature() {
    return deviceSignature.clone();
  }

  public byte[] getIdentitySignature() {
    return identitySignature.clone();
  }
}
