//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import org.foxwhisper.protocol.config.ProtocolConfig;
import org.foxwhisper.protocol.crypto.Hashes;
import org.foxwhisper.protocol.ecc.Curve;
import org.foxwhisper.protocol.ecc.ECKeyPair;
import org.foxwhisper.protocol.ecc.ECPublicKey;
import org.foxwhisper.protocol.kdf.HKDF;
import org.foxwhisper.protocol.kem.KEMEncapsulation;
import org.foxwhisper.protocol.kem.KEMKeyType;
import org.foxwhisper.protocol.logging.Log;
import org.foxwhisper.protocol.message.HandshakeInitMessage;
import org.foxwhisper.protocol.message.HandshakeResponseMessage;
import org.foxwhisper.protocol.state.DeviceDirectory;
import org.foxwhisper.protocol.state.DeviceKeyStore;
import org.foxwhisper.protocol.state.DeviceRecord;
import org.foxwhisper.protocol.state.TrustView;
import org.foxwhisper.protocol.util.ByteUtil;

/**
 * Runs the two-flight hybrid handshake between two devices.
 *
 * <ol>
 *   <li>The initiator sends a fresh X25519 key and its published Kyber-1024 key, signed with its
 *       device key and then its identity key ({@link #initiate}).
 *   <li>The responder checks the initiator against the current {@link TrustView}, answers with its
 *       own X25519 key and a Kyber ciphertext, and signs the whole transcript ({@link #respond}).
 *   <li>The initiator verifies the response and decapsulates ({@link #complete}).
 * </ol>
 *
 * <p>Both sides derive {@code HKDF(X25519 || Kyber, salt = transcript hash)}. Any difference in the
 * transcripts changes the hash, so both signatures and the root secret disagree. Nothing is ever
 * negotiated downward: an unknown suite, version or key size is rejected.
 */
public class HandshakeEngine {

  private static final String TAG = "HandshakeEngine";

  public static final String SUITE = "fw-hybrid-x25519-kyber1024";
  public static final int NONCE_SIZE = 16;
  public static final int ROOT_SECRET_SIZE = 32;

  private static final KEMKeyType KEM_KEY_TYPE = KEMKeyType.KYBER_1024;
  private static final byte[] ROOT_INFO =
      "FoxWhisper-Handshake-Root-v1".getBytes(StandardCharsets.UTF_8);
  private static final byte[] SESSION_ID_LABEL =
      "FoxWhisper-SessionId".getBytes(StandardCharsets.UTF_8);

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final DeviceKeyStore keyStore;
  private final DeviceDirectory directory;
  private final ProtocolConfig config;
  private final Clock clock;

  public HandshakeEngine(DeviceKeyStore keyStore, DeviceDirectory directory) {
    this(keyStore, directory, ProtocolConfig.defaults(), Clock.systemUTC());
  }

  public HandshakeEngine(
      DeviceKeyStore keyStore, DeviceDirectory directory, ProtocolConfig config, Clock clock) {
    this.keyStore = keyStore;
    this.directory = directory;
    this.config = config;
    this.clock = clock;
  }

  public DeviceAddress getLocalAddress() {
    return keyStore.getLocalAddress();
  }

  /**
   * Starts a handshake with {@code remoteAddress}.
   *
   * @throws RevokedDeviceException if either device has been revoked
   * @throws TranscriptException if either device is unknown or not yet active
   */
  public PendingHandshake initiate(DeviceAddress remoteAddress) throws TranscriptException {
    TrustView view = directory.getCurrentView();
    view.requireActive(keyStore.getLocalAddress());
    view.requireActive(remoteAddress);

    ECKeyPair ephemeral = Curve.generateKeyPair();
    byte[] nonce = new byte[NONCE_SIZE];
    SECURE_RANDOM.nextBytes(nonce);
    long timestamp = clock.millis();

    HandshakeInitMessage unsigned =
        new HandshakeInitMessage(
            SUITE,
            keyStore.getLocalAddress(),
            remoteAddress,
            keyStore.getIdentityKey().serialize(),
            ephemeral.getPublicKey().serialize(),
            keyStore.getKemPublicKey().serialize(),
            nonce,
            timestamp,
            new byte[0],
            new byte[0]);

    byte[] signedHash = unsigned.getSignedHash();
    byte[] deviceSignature = keyStore.signWithDeviceKey(signedHash);
    byte[] identitySignature =
        keyStore.signWithIdentityKey(ByteUtil.combine(signedHash, deviceSignature));

    HandshakeInitMessage init =
        new HandshakeInitMessage(
            SUITE,
            keyStore.getLocalAddress(),
            remoteAddress,
            keyStore.getIdentityKey().serialize(),
            ephemeral.getPublicKey().serialize(),
            keyStore.getKemPublicKey().serialize(),
            nonce,
            timestamp,
            deviceSignature,
            identitySignature);

    Log.i(TAG, "initiating handshake " + keyStore.getLocalAddress() + " -> " + remoteAddress);
    return new PendingHandshake(init, ephemeral, clock.instant());
  }

  /**
   * Verifies an incoming init message and produces the response along with this side's result.
   *
   * @throws InvalidVersionException if the suite or a key size is not supported
   * @throws RevokedDeviceException if the initiator has been revoked
   * @throws TranscriptException if a signature, identity or timestamp check fails
   */
  public HandshakeResponse respond(HandshakeInitMessage init) throws TranscriptException {
    requireSuite(init.getSuite());
    if (!init.getRecipient().equals(keyStore.getLocalAddress())) {
      throw new TranscriptException(
          ErrorCode.TRANSCRIPT_MISMATCH, "handshake addressed to " + init.getRecipient());
    }

    TrustView view = directory.getCurrentView();
    view.requireActive(keyStore.getLocalAddress());
    DeviceRecord initiator = view.requireActive(init.getSender());

    requireLength("ephemeral key", init.getEphemeralKey(), ECPublicKey.KEY_SIZE);
    requireLength("KEM public key", init.getKemPublicKey(), KEM_KEY_TYPE.getPublicKeyLength());
    if (init.getNonce().length != NONCE_SIZE) {
      throw new TranscriptException(ErrorCode.TRANSCRIPT_MISMATCH, "bad nonce length");
    }
    if (!Arrays.equals(init.getIdentityKey(), initiator.getIdentityKey().serialize())
        || !Arrays.equals(init.getKemPublicKey(), initiator.getKemPublicKey().serialize())) {
      throw new TranscriptException(
          ErrorCode.TRANSCRIPT_MISMATCH, "init keys do not match published device record");
    }

    verifySignatures(
        initiator, init.getSignedHash(), init.getDeviceSignature(), init.getIdentitySignature());
    requireFresh(init.getTimestamp());

    ECPublicKey initiatorEphemeral = decodeEphemeral(init.getEphemeralKey());
    ECKeyPair ephemeral = Curve.generateKeyPair();
    byte[] classicalSecret = agree(initiatorEphemeral, ephemeral);
    KEMEncapsulation encapsulation = initiator.getKemPublicKey().encapsulate();

    byte[] nonce = new byte[NONCE_SIZE];
    SECURE_RANDOM.nextBytes(nonce);
    long timestamp = clock.millis();
    byte[] initHash = Hashes.sha256(init.serialize());

    HandshakeResponseMessage unsigned =
        new HandshakeResponseMessage(
            SUITE,
            keyStore.getLocalAddress(),
            init.getSender(),
            keyStore.getIdentityKey().serialize(),
            ephemeral.getPublicKey().serialize(),
            encapsulation.getCiphertext(),
            nonce,
            timestamp,
            initHash,
            new byte[0],
            new byte[0]);

    byte[] transcriptHash = unsigned.getSignedHash();
    byte[] deviceSignature = keyStore.signWithDeviceKey(transcriptHash);
    byte[] identitySignature =
        keyStore.signWithIdentityKey(ByteUtil.combine(transcriptHash, deviceSignature));

    HandshakeResponseMessage response =
        new HandshakeResponseMessage(
            SUITE,
            keyStore.getLocalAddress(),
            init.getSender(),
            keyStore.getIdentityKey().serialize(),
            ephemeral.getPublicKey().serialize(),
            encapsulation.getCiphertext(),
            nonce,
            timestamp,
            initHash,
            deviceSignature,
            identitySignature);

    HandshakeResult result =
        deriveResult(
            HandshakeResult.Role.RESPONDER,
            init.getSender(),
            classicalSecret,
            encapsulation.getSharedSecret(),
            transcriptHash,
            ephemeral,
            initiatorEphemeral,
            view.getVersion());

    Log.i(TAG, "responded to handshake from " + init.getSender());
    return new HandshakeResponse(response, result);
  }

  /**
   * Verifies the responder's answer and derives the initiator's result.
   *
   * @throws TranscriptException if the response does not answer {@code pending}, a check fails, or
   *     {@code pending} has already been completed or has expired
   */
  public HandshakeResult complete(PendingHandshake pending, HandshakeResponseMessage response)
      throws TranscriptException {
    requireSuite(response.getSuite());
    if (!response.getSender().equals(pending.getRemoteAddress())
        || !response.getRecipient().equals(keyStore.getLocalAddress())) {
      throw new TranscriptException(
          ErrorCode.TRANSCRIPT_MISMATCH, "response does not belong to this handshake");
    }
    byte[] expectedInitHash = Hashes.sha256(pending.getInitMessage().serialize());
    if (!Arrays.equals(response.getInitHash(), expectedInitHash)) {
      throw new TranscriptException(
          ErrorCode.TRANSCRIPT_MISMATCH, "response does not commit to our init message");
    }
    Duration age = Duration.between(pending.getCreatedAt(), clock.instant());
    if (age.compareTo(config.getHandshakeTimeout()) > 0) {
      throw new TranscriptException(ErrorCode.STALE_TRANSCRIPT, "pending handshake expired");
    }

    TrustView view = directory.getCurrentView();
    DeviceRecord responder = view.requireActive(response.getSender());

    requireLength("ephemeral key", response.getEphemeralKey(), ECPublicKey.KEY_SIZE);
    requireLength(
        "KEM ciphertext", response.getKemCiphertext(), KEM_KEY_TYPE.getCiphertextLength());
    if (response.getNonce().length != NONCE_SIZE) {
      throw new TranscriptException(ErrorCode.TRANSCRIPT_MISMATCH, "bad nonce length");
    }
    if (!Arrays.equals(response.getIdentityKey(), responder.getIdentityKey().serialize())) {
      throw new TranscriptException(
          ErrorCode.TRANSCRIPT_MISMATCH, "response identity does not match device record");
    }

    byte[] transcriptHash = response.getSignedHash();
    verifySignatures(
        responder, transcriptHash, response.getDeviceSignature(), response.getIdentitySignature());
    requireFresh(response.getTimestamp());

    if (!pending.markCompleted()) {
      throw new TranscriptException(
          ErrorCode.TRANSCRIPT_MISMATCH, "pending handshake already completed");
    }

    ECPublicKey responderEphemeral = decodeEphemeral(response.getEphemeralKey());
    byte[] classicalSecret = agree(responderEphemeral, pending.getEphemeralKeyPair());
    byte[] kemSecret;
    try {
      kemSecret = keyStore.decapsulate(response.getKemCiphertext());
    } catch (InvalidKeyException e) {
      throw new InvalidVersionException(ErrorCode.UNSUPPORTED_ALGORITHM, e.getMessage());
    }

    Log.i(TAG, "completed handshake with " + response.getSender());
    return deriveResult(
        HandshakeResult.Role.INITIATOR,
        response.getSender(),
        classicalSecret,
        kemSecret,
        transcriptHash,
        pending.getEphemeralKeyPair(),
        responderEphemeral,
        view.getVersion());
  }

  private HandshakeResult deriveResult(
      HandshakeResult.Role role,
      DeviceAddress remoteAddress,
      byte[] classicalSecret,
      byte[] kemSecret,
      byte[] transcriptHash,
      ECKeyPair localEphemeral,
      ECPublicKey remoteEphemeral,
      long trustViewVersion) {
    byte[] inputKeyMaterial = ByteUtil.combine(classicalSecret, kemSecret);
    byte[] rootSecret =
        HKDF.deriveSecrets(inputKeyMaterial, transcriptHash, ROOT_INFO, ROOT_SECRET_SIZE);
    byte[] sessionId =
        ByteUtil.trim(Hashes.sha256(SESSION_ID_LABEL, transcriptHash), 16);

    ByteUtil.erase(inputKeyMaterial);
    ByteUtil.erase(classicalSecret);
    ByteUtil.erase(kemSecret);

    return new HandshakeResult(
        role,
        keyStore.getLocalAddress(),
        remoteAddress,
        rootSecret,
        transcriptHash,
        sessionId,
        localEphemeral,
        remoteEphemeral,
        trustViewVersion);
  }

  private static void requireSuite(String suite) throws InvalidVersionException {
    if (!SUITE.equals(suite)) {
      throw new InvalidVersionException(
          ErrorCode.UNSUPPORTED_ALGORITHM, "unsupported handshake suite " + suite);
    }
  }

  private static void requireLength(String what, byte[] value, int expected)
      throws InvalidVersionException {
    if (value.length != expected) {
      throw new InvalidVersionException(
          ErrorCode.UNSUPPORTED_ALGORITHM, what + " has unsupported length " + value.length);
    }
  }

  private static void verifySignatures(
      DeviceRecord signer, byte[] transcriptHash, byte[] deviceSignature, byte[] identitySignature)
      throws TranscriptException {
    if (!signer.getSigningKey().verifySignature(transcriptHash, deviceSignature)) {
      throw new TranscriptException(
          ErrorCode.INVALID_SIGNATURE, "bad device signature from " + signer.getAddress());
    }
    if (!signer
        .getIdentityKey()
        .verifySignature(ByteUtil.combine(transcriptHash, deviceSignature), identitySignature)) {
      throw new TranscriptException(
          ErrorCode.INVALID_SIGNATURE, "bad identity signature from " + signer.getAddress());
    }
  }

  private void requireFresh(long timestamp) throws TranscriptException {
    Duration skew = Duration.between(Instant.ofEpochMilli(timestamp), clock.instant()).abs();
    if (skew.compareTo(config.getMaxClockSkew()) > 0) {
      throw new TranscriptException(
          ErrorCode.STALE_TRANSCRIPT, "handshake timestamp outside allowed skew");
    }
  }

  private static ECPublicKey decodeEphemeral(byte[] serialized) throws TranscriptException {
    try {
      return Curve.decodePoint(serialized);
    } catch (InvalidKeyException e) {
      throw new InvalidVersionException(ErrorCode.UNSUPPORTED_ALGORITHM, e.getMessage());
    }
  }

  private static byte[] agree(ECPublicKey theirs, ECKeyPair ours) throws TranscriptException {
    try {
      return ours.calculateAgreement(theirs);
    } catch (InvalidKeyException e) {
      throw new TranscriptException(ErrorCode.INVALID_KEY, "ephemeral key agreement failed", e);
    }
  }
}
