//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.InvalidKeyException;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.cbor.CanonicalCbor;
import org.foxwhisper.protocol.cbor.CborException;
import org.foxwhisper.protocol.cbor.CborMap;
import org.foxwhisper.protocol.ecc.ECKeyPair;
import org.foxwhisper.protocol.ecc.ECPrivateKey;
import org.foxwhisper.protocol.ecc.ECPublicKey;
import org.foxwhisper.protocol.ratchet.ChainKey;
import org.foxwhisper.protocol.ratchet.RootKey;
import org.foxwhisper.protocol.ratchet.SkippedKeyCache;
import org.foxwhisper.protocol.ratchet.SkippedKeyId;

/**
 * Complete ratchet state of one pairwise session.
 *
 * <p>Instances are mutable working copies: load one from a {@link SessionStore}, advance it, and
 * store it back only once the whole operation has succeeded.
 */
public final class RatchetState {

  private final byte[] sessionId;
  private final DeviceAddress localAddress;
  private final DeviceAddress remoteAddress;
  private final int maxRetiredChains;

  private RootKey rootKey;
  private ECKeyPair localRatchetKey;
  private ECPublicKey remoteRatchetKey;
  private ChainKey sendChain;
  private ChainKey receiveChain;
  private int previousCounter;
  private final SkippedKeyCache<SkippedKeyId> skippedKeys;
  private final LinkedHashMap<ECPublicKey, Integer> retiredChains = new LinkedHashMap<>();

  public RatchetState(
      byte[] sessionId,
      DeviceAddress localAddress,
      DeviceAddress remoteAddress,
      RootKey rootKey,
      ECKeyPair localRatchetKey,
      ECPublicKey remoteRatchetKey,
      ChainKey sendChain,
      ChainKey receiveChain,
      int maxSkippedKeys,
      int maxRetiredChains) {
    this.sessionId = sessionId.clone();
    this.localAddress = localAddress;
    this.remoteAddress = remoteAddress;
    this.rootKey = rootKey;
    this.localRatchetKey = localRatchetKey;
    this.remoteRatchetKey = remoteRatchetKey;
    this.sendChain = sendChain;
    this.receiveChain = receiveChain;
    this.previousCounter = 0;
    this.skippedKeys = new SkippedKeyCache<>(maxSkippedKeys);
    this.maxRetiredChains = maxRetiredChains;
  }

  public RatchetState(byte[] serialized) throws InvalidMessageException {
    try {
      CborMap fields = CborMap.of(CanonicalCbor.decode(serialized));
      this.sessionId = fields.getBytes("session_id");
      this.localAddress = DeviceAddress.parse(fields.getString("local"));
      this.remoteAddress = DeviceAddress.parse(fields.getString("remote"));
      this.maxRetiredChains = fields.getInt("max_retired_chains");
      this.rootKey = new RootKey(fields.getBytes("root_key"));
      this.localRatchetKey =
          ECKeyPair.fromPrivateKey(new ECPrivateKey(fields.getBytes("local_ratchet_private")));
      this.remoteRatchetKey = new ECPublicKey(fields.getBytes("remote_ratchet_key"));
      this.sendChain =
          new ChainKey(
              fields.getBytes("send_chain_key"),
              fields.getInt("send_index"),
              ChainKey.SESSION_MESSAGE_KEY_INFO);
      this.receiveChain =
          fields.has("receive_chain_key")
              ? new ChainKey(
                  fields.getBytes("receive_chain_key"),
                  fields.getInt("receive_index"),
                  ChainKey.SESSION_MESSAGE_KEY_INFO)
              : null;
      this.previousCounter = fields.getInt("previous_counter");

      this.skippedKeys = new SkippedKeyCache<>(fields.getInt("max_skipped_keys"));
      for (Object entry : fields.getList("skipped_keys")) {
        CborMap skipped = CborMap.of(entry);
        skippedKeys.put(
            new SkippedKeyId(new ECPublicKey(skipped.getBytes("dh")), skipped.getInt("index")),
            skipped.getBytes("key"));
      }
      for (Object entry : fields.getList("retired_chains")) {
        CborMap retired = CborMap.of(entry);
        retiredChains.put(new ECPublicKey(retired.getBytes("dh")), retired.getInt("length"));
      }
    } catch (CborException | InvalidKeyException | IllegalArgumentException e) {
      throw new InvalidMessageException("corrupt ratchet state", e);
    }
  }

  public byte[] serialize() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("session_id", sessionId);
    fields.put("local", localAddress.toString());
    fields.put("remote", remoteAddress.toString());
    fields.put("max_retired_chains", maxRetiredChains);
    fields.put("max_skipped_keys", skippedKeys.capacity());
    fields.put("root_key", rootKey.getKeyBytes());
    fields.put("local_ratchet_private", localRatchetKey.getPrivateKey().serialize());
    fields.put("remote_ratchet_key", remoteRatchetKey.serialize());
    fields.put("send_chain_key", sendChain.getKey());
    fields.put("send_index", sendChain.getIndex());
    if (receiveChain != null) {
      fields.put("receive_chain_key", receiveChain.getKey());
      fields.put("receive_index", receiveChain.getIndex());
    }
    fields.put("previous_counter", previousCounter);

    List<Object> skipped = new ArrayList<>();
    for (Map.Entry<SkippedKeyId, byte[]> entry : skippedKeys.entries()) {
      Map<String, Object> encoded = new LinkedHashMap<>();
      encoded.put("dh", entry.getKey().getRatchetKey().serialize());
      encoded.put("index", entry.getKey().getIndex());
      encoded.put("key", entry.getValue());
      skipped.add(encoded);
    }
    fields.put("skipped_keys", skipped);

    List<Object> retired = new ArrayList<>();
    for (Map.Entry<ECPublicKey, Integer> entry : retiredChains.entrySet()) {
      Map<String, Object> encoded = new LinkedHashMap<>();
      encoded.put("dh", entry.getKey().serialize());
      encoded.put("length", entry.getValue());
      retired.add(encoded);
    }
    fields.put("retired_chains", retired);

    return CanonicalCbor.encode(fields);
  }

  public byte[] getSessionId() {
    return sessionId.clone();
  }

  public DeviceAddress getLocalAddress() {
    return localAddress;
  }

  public DeviceAddress getRemoteAddress() {
    return remoteAddress;
  }

  public RootKey getRootKey() {
    return rootKey;
  }

  public void setRootKey(RootKey rootKey) {
    this.rootKey = rootKey;
  }

  public ECKeyPair getLocalRatchetKey() {
    return localRatchetKey;
  }

  public void setLocalRatchetKey(ECKeyPair localRatchetKey) {
    this.localRatchetKey = localRatchetKey;
  }

  public ECPublicKey getRemoteRatchetKey() {
    return remoteRatchetKey;
  }

  public void setRemoteRatchetKey(ECPublicKey remoteRatchetKey) {
    this.remoteRatchetKey = remoteRatchetKey;
  }

  public ChainKey getSendChain() {
    return sendChain;
  }

  public void setSendChain(ChainKey sendChain) {
    if (this.sendChain != null && this.sendChain != sendChain) {
      this.sendChain.erase();
    }
    this.sendChain = sendChain;
  }

  /** The current receiving chain, or {@code null} before the first remote ratchet step. */
  public ChainKey getReceiveChain() {
    return receiveChain;
  }

  public void setReceiveChain(ChainKey receiveChain) {
    if (this.receiveChain != null && this.receiveChain != receiveChain) {
      this.receiveChain.erase();
    }
    this.receiveChain = receiveChain;
  }

  /** Length of the sending chain that preceded the current one. */
  public int getPreviousCounter() {
    return previousCounter;
  }

  public void setPreviousCounter(int previousCounter) {
    this.previousCounter = previousCounter;
  }

  public SkippedKeyCache<SkippedKeyId> getSkippedKeys() {
    return skippedKeys;
  }

  /**
   * Returns the final length of a superseded receiving chain, or {@code null} if {@code
   * ratchetKey} was never retired (or has been forgotten).
   */
  public Integer getRetiredChainLength(ECPublicKey ratchetKey) {
    return retiredChains.get(ratchetKey);
  }

  /** Remembers a superseded remote ratchet key. The oldest entry is forgotten when full. */
  public void retireRemoteKey(ECPublicKey ratchetKey, int finalLength) {
    retiredChains.remove(ratchetKey);
    retiredChains.put(ratchetKey, finalLength);
    while (retiredChains.size() > maxRetiredChains) {
      ECPublicKey oldest = retiredChains.keySet().iterator().next();
      retiredChains.remove(oldest);
    }
  }
}
