//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.foxwhisper.protocol.config.ProtocolConfig;
import org.foxwhisper.protocol.logging.Log;
import org.foxwhisper.protocol.message.HandshakeInitMessage;
import org.foxwhisper.protocol.message.HandshakeResponseMessage;
import org.foxwhisper.protocol.state.DeviceDirectory;
import org.foxwhisper.protocol.state.SessionStore;

/**
 * SessionBuilder is responsible for setting up ratchet sessions with remote devices.
 *
 * <p>Sessions are built by running a {@link HandshakeEngine} exchange and seeding a {@link
 * RatchetSession} from its result:
 *
 * <ol>
 *   <li>The initiator calls {@link #establish(DeviceAddress, HandshakeTransport)}, or drives the
 *       exchange itself with {@link HandshakeEngine#initiate(DeviceAddress)} and {@link
 *       #complete(PendingHandshake, HandshakeResponseMessage)}.
 *   <li>The responder calls {@link #accept(HandshakeInitMessage)} and returns the response.
 * </ol>
 */
public class SessionBuilder {

  private static final String TAG = "SessionBuilder";

  private final HandshakeEngine engine;
  private final SessionStore sessionStore;
  private final DeviceDirectory directory;
  private final ProtocolConfig config;
  private final Clock clock;

  public SessionBuilder(
      HandshakeEngine engine,
      SessionStore sessionStore,
      DeviceDirectory directory,
      ProtocolConfig config,
      Clock clock) {
    this.engine = engine;
    this.sessionStore = sessionStore;
    this.directory = directory;
    this.config = config;
    this.clock = clock;
  }

  /** Returns a session handle for {@code remoteAddress}, whether or not a session exists yet. */
  public RatchetSession sessionFor(DeviceAddress remoteAddress) {
    return new RatchetSession(sessionStore, directory, remoteAddress, config, clock);
  }

  /**
   * Answers a handshake init and stores the resulting session.
   *
   * @return the response to send back to the initiator
   */
  public HandshakeResponseMessage accept(HandshakeInitMessage init)
      throws TranscriptException, InvalidKeyException {
    HandshakeResponse response = engine.respond(init);
    sessionFor(init.getSender()).initialize(response.getResult());
    return response.getMessage();
  }

  /** Finishes an initiator handshake and stores the resulting session. */
  public RatchetSession complete(PendingHandshake pending, HandshakeResponseMessage response)
      throws TranscriptException, InvalidKeyException {
    HandshakeResult result = engine.complete(pending, response);
    RatchetSession session = sessionFor(pending.getRemoteAddress());
    session.initialize(result);
    return session;
  }

  /**
   * Runs a complete handshake with {@code remoteAddress} over {@code transport}.
   *
   * <p>The returned future fails with a {@link ProtocolTimeoutException} if no response arrives
   * within the configured handshake timeout. In that case no session is stored and a late
   * response is discarded. Other failures complete the future with the underlying {@link
   * ProtocolException}.
   */
  public CompletableFuture<RatchetSession> establish(
      DeviceAddress remoteAddress, HandshakeTransport transport) {
    PendingHandshake pending;
    try {
      pending = engine.initiate(remoteAddress);
    } catch (TranscriptException e) {
      return CompletableFuture.failedFuture(e);
    }

    Duration timeout = config.getHandshakeTimeout();
    return transport
        .exchange(pending.getInitMessage())
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (response, error) -> {
              if (error != null) {
                Throwable cause = unwrap(error);
                if (cause instanceof TimeoutException) {
                  pending.markCompleted();
                  Log.w(TAG, "handshake with " + remoteAddress + " timed out");
                  throw new CompletionException(
                      new ProtocolTimeoutException("handshake with " + remoteAddress, timeout));
                }
                throw new CompletionException(cause);
              }
              try {
                return complete(pending, response);
              } catch (ProtocolException e) {
                throw new CompletionException(e);
              }
            });
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
