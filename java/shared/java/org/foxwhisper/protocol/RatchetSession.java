//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import org.foxwhisper.protocol.config.ProtocolConfig;
import org.foxwhisper.protocol.crypto.Aes256Gcm;
import org.foxwhisper.protocol.ecc.Curve;
import org.foxwhisper.protocol.ecc.ECKeyPair;
import org.foxwhisper.protocol.ecc.ECPublicKey;
import org.foxwhisper.protocol.logging.Log;
import org.foxwhisper.protocol.message.EncryptedMessage;
import org.foxwhisper.protocol.ratchet.ChainKey;
import org.foxwhisper.protocol.ratchet.ChainStep;
import org.foxwhisper.protocol.ratchet.MessageKeys;
import org.foxwhisper.protocol.ratchet.RootKey;
import org.foxwhisper.protocol.ratchet.SkippedKeyCache;
import org.foxwhisper.protocol.ratchet.SkippedKeyId;
import org.foxwhisper.protocol.state.DeviceDirectory;
import org.foxwhisper.protocol.state.RatchetState;
import org.foxwhisper.protocol.state.SessionStore;
import org.foxwhisper.protocol.util.ByteUtil;

/**
 * The pairwise double ratchet between the local device and one remote device.
 *
 * <p>Once a session has been initialized from a {@link HandshakeResult}, this class can be used for
 * all encrypt/decrypt operations with that device. Every operation works on a copy of the stored
 * state and writes it back in a single store call at the end, so a failed operation leaves the
 * session untouched.
 *
 * <p>A {@link RatchetIntegrityException} means the session has been deleted and a new handshake is
 * required. A {@link DuplicateMessageException} or {@link InvalidMessageException} leaves the
 * session usable.
 *
 * <p>This class is not thread-safe.
 */
public class RatchetSession {

  private static final String TAG = "RatchetSession";
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final SessionStore sessionStore;
  private final DeviceDirectory directory;
  private final DeviceAddress remoteAddress;
  private final ProtocolConfig config;
  private final Clock clock;

  public RatchetSession(
      SessionStore sessionStore, DeviceDirectory directory, DeviceAddress remoteAddress) {
    this(sessionStore, directory, remoteAddress, ProtocolConfig.defaults(), Clock.systemUTC());
  }

  public RatchetSession(
      SessionStore sessionStore,
      DeviceDirectory directory,
      DeviceAddress remoteAddress,
      ProtocolConfig config,
      Clock clock) {
    this.sessionStore = sessionStore;
    this.directory = directory;
    this.remoteAddress = remoteAddress;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Creates (or replaces) the session from a completed handshake.
   *
   * <p>Each side's handshake ephemeral becomes its first ratchet key. The initiator derives its
   * sending chain from DH(initiator ephemeral, responder ephemeral); the responder derives the
   * matching receiving chain and immediately ratchets once more to get its own sending chain, so
   * both sides can send right away.
   */
  public void initialize(HandshakeResult result) throws InvalidKeyException {
    if (!result.getRemoteAddress().equals(remoteAddress)) {
      throw new IllegalArgumentException("handshake was with " + result.getRemoteAddress());
    }

    RootKey rootKey = new RootKey(result.getRootSecret());
    ECKeyPair localEphemeral = result.getLocalEphemeral();
    ECPublicKey remoteEphemeral = result.getRemoteEphemeral();
    RatchetState state;

    if (result.getRole() == HandshakeResult.Role.INITIATOR) {
      ChainStep sending = rootKey.createChain(remoteEphemeral, localEphemeral);
      state =
          new RatchetState(
              result.getSessionId(),
              result.getLocalAddress(),
              remoteAddress,
              sending.getRootKey(),
              localEphemeral,
              remoteEphemeral,
              sending.getChainKey(),
              null,
              config.getMaxSkippedKeys(),
              config.getMaxRetiredChains());
    } else {
      ChainStep receiving = rootKey.createChain(remoteEphemeral, localEphemeral);
      ECKeyPair ratchetKey = Curve.generateKeyPair();
      ChainStep sending = receiving.getRootKey().createChain(remoteEphemeral, ratchetKey);
      state =
          new RatchetState(
              result.getSessionId(),
              result.getLocalAddress(),
              remoteAddress,
              sending.getRootKey(),
              ratchetKey,
              remoteEphemeral,
              sending.getChainKey(),
              receiving.getChainKey(),
              config.getMaxSkippedKeys(),
              config.getMaxRetiredChains());
    }

    sessionStore.storeSession(remoteAddress, state);
    Log.i(TAG, "initialized session with " + remoteAddress + " as " + result.getRole());
  }

  public boolean hasSession() {
    return sessionStore.containsSession(remoteAddress);
  }

  public DeviceAddress getRemoteAddress() {
    return remoteAddress;
  }

  /**
   * Encrypt a message.
   *
   * @param plaintext The plaintext message bytes.
   * @return The encrypted message, carrying the current ratchet key and counters.
   * @throws NoSessionException if there is no session with the remote device
   * @throws RevokedDeviceException if the remote device was revoked; the session is deleted
   */
  public EncryptedMessage encrypt(byte[] plaintext)
      throws NoSessionException, RevokedDeviceException {
    RatchetState state = loadState();

    ChainKey sendChain = state.getSendChain();
    MessageKeys messageKeys = sendChain.getMessageKeys();

    byte[] messageId = new byte[EncryptedMessage.MESSAGE_ID_LENGTH];
    SECURE_RANDOM.nextBytes(messageId);
    long timestamp = clock.millis();
    byte[] ratchetKey = state.getLocalRatchetKey().getPublicKey().serialize();
    byte[] associatedData =
        EncryptedMessage.associatedData(
            state.getSessionId(),
            messageId,
            state.getLocalAddress(),
            remoteAddress,
            timestamp,
            ratchetKey,
            messageKeys.getCounter(),
            state.getPreviousCounter());

    byte[] iv = Aes256Gcm.generateNonce();
    byte[] sealed = Aes256Gcm.encrypt(messageKeys.getCipherKey(), iv, plaintext, associatedData);
    byte[][] parts =
        ByteUtil.split(sealed, sealed.length - Aes256Gcm.TAG_SIZE, Aes256Gcm.TAG_SIZE);

    state.setSendChain(sendChain.getNextChainKey());
    ByteUtil.erase(messageKeys.getCipherKey());
    sessionStore.storeSession(remoteAddress, state);

    return new EncryptedMessage(
        state.getSessionId(),
        messageId,
        state.getLocalAddress(),
        remoteAddress,
        timestamp,
        ratchetKey,
        messageKeys.getCounter(),
        state.getPreviousCounter(),
        iv,
        parts[0],
        parts[1]);
  }

  /**
   * Decrypt a serialized {@link EncryptedMessage}.
   *
   * @see #decrypt(EncryptedMessage)
   */
  public byte[] decrypt(byte[] serialized)
      throws NoSessionException,
          InvalidMessageException,
          DuplicateMessageException,
          RatchetIntegrityException,
          RevokedDeviceException {
    return decrypt(EncryptedMessage.deserialize(serialized));
  }

  /**
   * Decrypt a message.
   *
   * @return The plaintext.
   * @throws NoSessionException if there is no session with the remote device
   * @throws InvalidMessageException if the message is not for this session or fails authentication
   * @throws DuplicateMessageException if the message key for this index has already been used
   * @throws RatchetIntegrityException if the header is impossible for this session; the session
   *     has been deleted
   * @throws RevokedDeviceException if the remote device was revoked; the session is deleted
   */
  public byte[] decrypt(EncryptedMessage message)
      throws NoSessionException,
          InvalidMessageException,
          DuplicateMessageException,
          RatchetIntegrityException,
          RevokedDeviceException {
    RatchetState state = loadState();

    if (!Arrays.equals(message.getSessionId(), state.getSessionId())) {
      throw new InvalidMessageException("message belongs to a different session");
    }
    if (!message.getSender().equals(remoteAddress)
        || !message.getRecipient().equals(state.getLocalAddress())) {
      throw new InvalidMessageException("message addressed " + message.getSender() + " -> "
          + message.getRecipient());
    }

    ECPublicKey theirRatchetKey;
    try {
      theirRatchetKey = Curve.decodePoint(message.getRatchetKey());
    } catch (InvalidKeyException e) {
      throw new InvalidMessageException("invalid ratchet key", e);
    }

    byte[] messageKey;
    try {
      messageKey =
          getOrCreateMessageKey(
              state, theirRatchetKey, message.getIndex(), message.getPreviousChainLength());
    } catch (RatchetIntegrityException e) {
      sessionStore.deleteSession(remoteAddress);
      Log.w(TAG, "destroyed session with " + remoteAddress + ": " + e.getCode());
      throw e;
    }

    byte[] plaintext =
        Aes256Gcm.decrypt(
            messageKey,
            message.getIv(),
            ByteUtil.combine(message.getCiphertext(), message.getTag()),
            message.getAssociatedData());
    ByteUtil.erase(messageKey);

    sessionStore.storeSession(remoteAddress, state);
    return plaintext;
  }

  private RatchetState loadState() throws NoSessionException, RevokedDeviceException {
    if (directory.getCurrentView().isRevoked(remoteAddress)) {
      sessionStore.deleteSession(remoteAddress);
      Log.w(TAG, "remote device revoked, destroyed session with " + remoteAddress);
      throw new RevokedDeviceException(remoteAddress);
    }

    RatchetState state = sessionStore.loadSession(remoteAddress);
    if (state == null) {
      throw new NoSessionException(remoteAddress, "no session for " + remoteAddress);
    }
    return state;
  }

  private byte[] getOrCreateMessageKey(
      RatchetState state, ECPublicKey theirRatchetKey, int index, int previousChainLength)
      throws DuplicateMessageException, RatchetIntegrityException, InvalidMessageException {
    byte[] skipped = state.getSkippedKeys().remove(new SkippedKeyId(theirRatchetKey, index));
    if (skipped != null) {
      return skipped;
    }

    ChainKey receiveChain = state.getReceiveChain();

    if (theirRatchetKey.equals(state.getRemoteRatchetKey())) {
      if (receiveChain == null) {
        throw integrityFailure(ErrorCode.DH_REPLAY, "message on a chain that was never opened");
      }
      if (index < receiveChain.getIndex()) {
        throw new DuplicateMessageException(
            "received message with old counter: " + receiveChain.getIndex() + " , " + index);
      }
      return advanceReceiveChain(state, theirRatchetKey, index);
    }

    Integer retiredLength = state.getRetiredChainLength(theirRatchetKey);
    if (retiredLength != null) {
      if (index < retiredLength) {
        throw new DuplicateMessageException("message key from a retired chain was already used");
      }
      throw integrityFailure(
          ErrorCode.DH_REPLAY, "retired ratchet key reused beyond its final length");
    }

    if (receiveChain != null) {
      if (previousChainLength < receiveChain.getIndex()) {
        throw integrityFailure(
            ErrorCode.BACKWARD_INDEX,
            "previous chain length "
                + previousChainLength
                + " is behind received index "
                + receiveChain.getIndex());
      }
      skipReceiveChain(state, state.getRemoteRatchetKey(), previousChainLength);
      state.retireRemoteKey(state.getRemoteRatchetKey(), previousChainLength);
    } else {
      state.retireRemoteKey(state.getRemoteRatchetKey(), 0);
    }

    stepRatchet(state, theirRatchetKey);
    return advanceReceiveChain(state, theirRatchetKey, index);
  }

  private void stepRatchet(RatchetState state, ECPublicKey theirRatchetKey)
      throws InvalidMessageException {
    try {
      ChainStep receiving =
          state.getRootKey().createChain(theirRatchetKey, state.getLocalRatchetKey());
      ECKeyPair ourNewRatchetKey = Curve.generateKeyPair();
      ChainStep sending =
          receiving.getRootKey().createChain(theirRatchetKey, ourNewRatchetKey);

      state.setRootKey(sending.getRootKey());
      state.setReceiveChain(receiving.getChainKey());
      state.setPreviousCounter(state.getSendChain().getIndex());
      state.setSendChain(sending.getChainKey());
      state.setLocalRatchetKey(ourNewRatchetKey);
      state.setRemoteRatchetKey(theirRatchetKey);
    } catch (InvalidKeyException e) {
      throw new InvalidMessageException("ratchet key agreement failed", e);
    }
  }

  private void skipReceiveChain(RatchetState state, ECPublicKey ratchetKey, int until)
      throws RatchetIntegrityException {
    ChainKey current = walkReceiveChain(state, ratchetKey, until);
    state.setReceiveChain(current);
  }

  private byte[] advanceReceiveChain(RatchetState state, ECPublicKey ratchetKey, int index)
      throws RatchetIntegrityException {
    ChainKey current = walkReceiveChain(state, ratchetKey, index);
    MessageKeys messageKeys = current.getMessageKeys();
    ChainKey next = current.getNextChainKey();
    if (current != state.getReceiveChain()) {
      current.erase();
    }
    state.setReceiveChain(next);
    return messageKeys.getCipherKey();
  }

  /**
   * Caches the message keys of every index from the current receive position up to (not
   * including) {@code target} and returns the chain key positioned at {@code target}.
   */
  private ChainKey walkReceiveChain(RatchetState state, ECPublicKey ratchetKey, int target)
      throws RatchetIntegrityException {
    ChainKey start = state.getReceiveChain();
    int gap = target - start.getIndex();
    if (gap > config.getMaxForwardGap()) {
      throw integrityFailure(
          ErrorCode.GAP_OVERFLOW, "index gap " + gap + " exceeds " + config.getMaxForwardGap());
    }

    SkippedKeyCache<SkippedKeyId> cache = state.getSkippedKeys();
    if (!cache.hasRoomFor(gap)) {
      throw integrityFailure(
          ErrorCode.CACHE_OVERFLOW, "skipped key cache cannot hold " + gap + " more keys");
    }

    ChainKey current = start;
    while (current.getIndex() < target) {
      MessageKeys messageKeys = current.getMessageKeys();
      cache.put(new SkippedKeyId(ratchetKey, messageKeys.getCounter()), messageKeys.getCipherKey());
      ByteUtil.erase(messageKeys.getCipherKey());
      ChainKey next = current.getNextChainKey();
      if (current != start) {
        current.erase();
      }
      current = next;
    }
    return current;
  }

  private RatchetIntegrityException integrityFailure(ErrorCode code, String message) {
    return new RatchetIntegrityException(code, remoteAddress, message);
  }
}
