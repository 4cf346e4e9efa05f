//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.nio.charset.StandardCharsets;
import org.foxwhisper.protocol.ecc.ECKeyPair;
import org.foxwhisper.protocol.ecc.ECPublicKey;
import org.foxwhisper.protocol.kdf.HKDF;

/**
 * The output of a completed handshake: the 32-byte root secret, the transcript hash it was bound
 * to, and the ephemeral keys that seed the first ratchet step.
 */
public final class HandshakeResult {

  public enum Role {
    INITIATOR,
    RESPONDER
  }

  private static final String SFU_AUTH_LABEL = "FW-SFU-ClientAuth";

  private final Role role;
  private final DeviceAddress localAddress;
  private final DeviceAddress remoteAddress;
  private final byte[] rootSecret;
  private final byte[] transcriptHash;
  private final byte[] sessionId;
  private final ECKeyPair localEphemeral;
  private final ECPublicKey remoteEphemeral;
  private final long trustViewVersion;

  HandshakeResult(
      Role role,
      DeviceAddress localAddress,
      DeviceAddress remoteAddress,
      byte[] rootSecret,
      byte[] transcriptHash,
      byte[] sessionId,
      ECKeyPair localEphemeral,
      ECPublicKey remoteEphemeral,
      long trustViewVersion) {
    this.role = role;
    this.localAddress = localAddress;
    this.remoteAddress = remoteAddress;
    this.rootSecret = rootSecret;
    this.transcriptHash = transcriptHash;
    this.sessionId = sessionId;
    this.localEphemeral = localEphemeral;
    this.remoteEphemeral = remoteEphemeral;
    this.trustViewVersion = trustViewVersion;
  }

  public Role getRole() {
    return role;
  }

  public DeviceAddress getLocalAddress() {
    return localAddress;
  }

  public DeviceAddress getRemoteAddress() {
    return remoteAddress;
  }

  public byte[] getRootSecret() {
    return rootSecret.clone();
  }

  public byte[] getTranscriptHash() {
    return transcriptHash.clone();
  }

  public byte[] getSessionId() {
    return sessionId.clone();
  }

  public ECKeyPair getLocalEphemeral() {
    return localEphemeral;
  }

  public ECPublicKey getRemoteEphemeral() {
    return remoteEphemeral;
  }

  /** Version of the trust view the peer was checked against. */
  public long getTrustViewVersion() {
    return trustViewVersion;
  }

  /**
   * Derives the key a client uses to authenticate to a forwarding node, when this handshake was
   * run with that node.
   */
  public byte[] deriveSfuAuthKey(String clientId) {
    byte[] info = (SFU_AUTH_LABEL + clientId).getBytes(StandardCharsets.UTF_8);
    return HKDF.deriveSecrets(rootSecret, info, 32);
  }
}
