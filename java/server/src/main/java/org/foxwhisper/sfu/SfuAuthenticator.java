//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.foxwhisper.protocol.logging.Log;

/**
 * Verifies {@link ClientAuthToken}s against per-client auth keys.
 *
 * <p>Checks run in a fixed order: the MAC first, then the timestamp skew, then the nonce. A nonce
 * is only consumed by a token that passed the first two checks, so forged or expired tokens cannot
 * burn a legitimate client's nonces.
 */
public class SfuAuthenticator {
  private static final String TAG = "SfuAuthenticator";

  private final Map<String, byte[]> clientKeys = new ConcurrentHashMap<>();
  private final NonceCache nonceCache;
  private final Duration maxSkew;
  private final Clock clock;

  public SfuAuthenticator(SfuPolicy policy, Clock clock) {
    this.nonceCache = new NonceCache(policy.getNonceCacheSize());
    this.maxSkew = policy.getMaxTokenSkew();
    this.clock = clock;
  }

  /**
   * Registers the auth key a client proves possession of, usually from {@code
   * HandshakeResult.deriveSfuAuthKey(clientId)}.
   */
  public void registerClient(String callId, String clientId, byte[] authKey) {
    clientKeys.put(clientKey(callId, clientId), authKey.clone());
  }

  public void unregisterClient(String callId, String clientId) {
    clientKeys.remove(clientKey(callId, clientId));
  }

  public AuthResult authenticate(ClientAuthToken token) {
    byte[] authKey = clientKeys.get(clientKey(token.getCallId(), token.getClientId()));
    if (authKey == null || !token.verify(authKey)) {
      Log.w(TAG, "impersonation attempt for " + token.getClientId() + " in " + token.getCallId());
      return AuthResult.IMPERSONATION;
    }

    long skew = Math.abs(clock.millis() - token.getTimestamp());
    if (skew > maxSkew.toMillis()) {
      Log.i(TAG, "expired token from " + token.getClientId() + ", skew " + skew + "ms");
      return AuthResult.TOKEN_EXPIRED;
    }

    if (!nonceCache.add(token.getCallId() + "/" + token.getClientId() + ":" + token.getNonce())) {
      Log.w(TAG, "replayed token from " + token.getClientId());
      return AuthResult.REPLAY;
    }
    return AuthResult.ACCEPTED;
  }

  NonceCache getNonceCache() {
    return nonceCache;
  }

  private static String clientKey(String callId, String clientId) {
    return callId + "/" + clientId;
  }
}
