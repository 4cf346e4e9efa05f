//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.util.LinkedHashMap;
import java.util.Map;
import org.foxwhisper.protocol.cbor.CanonicalCbor;
import org.foxwhisper.protocol.crypto.Hashes;

/**
 * A client's proof that it holds the SFU auth key derived from its handshake with the call.
 *
 * <p>The MAC is HMAC-SHA256 over the canonical encoding of the call id, client id, timestamp and
 * nonce.
 */
public final class ClientAuthToken {
  private final String callId;
  private final String clientId;
  private final long timestamp;
  private final String nonce;
  private final byte[] mac;

  public ClientAuthToken(String callId, String clientId, long timestamp, String nonce, byte[] mac) {
    this.callId = callId;
    this.clientId = clientId;
    this.timestamp = timestamp;
    this.nonce = nonce;
    this.mac = mac.clone();
  }

  /** Creates a token authenticated under {@code authKey}. */
  public static ClientAuthToken create(
      byte[] authKey, String callId, String clientId, long timestamp, String nonce) {
    byte[] mac = computeMac(authKey, callId, clientId, timestamp, nonce);
    return new ClientAuthToken(callId, clientId, timestamp, nonce, mac);
  }

  static byte[] computeMac(
      byte[] authKey, String callId, String clientId, long timestamp, String nonce) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("call_id", callId);
    fields.put("client_id", clientId);
    fields.put("timestamp", timestamp);
    fields.put("nonce", nonce);
    return Hashes.hmacSha256(authKey, CanonicalCbor.encode(fields));
  }

  /** Whether the MAC verifies under {@code authKey}, compared in constant time. */
  public boolean verify(byte[] authKey) {
    byte[] expected = computeMac(authKey, callId, clientId, timestamp, nonce);
    return Hashes.constantTimeEquals(expected, mac);
  }

  public String getCallId() {
    return callId;
  }

  public String getClientId() {
    return clientId;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public String getNonce() {
    return nonce;
  }

  public byte[] getMac() {
    return mac.clone();
  }
}
