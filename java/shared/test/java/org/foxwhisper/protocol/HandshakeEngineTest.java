//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;

import java.time.Duration;
import java.util.Arrays;
import org.foxwhisper.protocol.config.ProtocolConfig;
import org.foxwhisper.protocol.message.HandshakeInitMessage;
import org.foxwhisper.protocol.message.HandshakeResponseMessage;
import org.foxwhisper.protocol.state.DeviceDirectory;
import org.foxwhisper.protocol.util.TestClock;
import org.foxwhisper.protocol.util.TestLogger;
import org.junit.ClassRule;
import org.junit.Test;

public class HandshakeEngineTest {
  @ClassRule public static final TestLogger logger = new TestLogger();

  private final TestClock clock = new TestClock();
  private final DeviceDirectory directory = new DeviceDirectory();
  private final TestDevice alice =
      TestDevice.create("alice", directory, ProtocolConfig.defaults(), clock);
  private final TestDevice bob =
      TestDevice.create("bob", directory, ProtocolConfig.defaults(), clock);

  @Test
  public void bothSidesDeriveTheSameSecrets() throws Exception {
    HandshakeEngine aliceEngine = alice.newEngine();
    PendingHandshake pending = aliceEngine.initiate(bob.getAddress());
    HandshakeResponse response = bob.newEngine().respond(pending.getInitMessage());
    HandshakeResult aliceResult = aliceEngine.complete(pending, response.getMessage());
    HandshakeResult bobResult = response.getResult();

    assertArrayEquals(aliceResult.getRootSecret(), bobResult.getRootSecret());
    assertArrayEquals(aliceResult.getTranscriptHash(), bobResult.getTranscriptHash());
    assertArrayEquals(aliceResult.getSessionId(), bobResult.getSessionId());
    assertEquals(HandshakeResult.Role.INITIATOR, aliceResult.getRole());
    assertEquals(HandshakeResult.Role.RESPONDER, bobResult.getRole());
    assertEquals(bob.getAddress(), aliceResult.getRemoteAddress());
    assertEquals(
        aliceResult.getLocalEphemeral().getPublicKey(), bobResult.getRemoteEphemeral());
    assertArrayEquals(
        aliceResult.deriveSfuAuthKey("alice"), bobResult.deriveSfuAuthKey("alice"));
    assertFalse(
        Arrays.equals(aliceResult.deriveSfuAuthKey("alice"), aliceResult.deriveSfuAuthKey("bob")));
  }

  @Test
  public void separateHandshakesDeriveDifferentSecrets() throws Exception {
    HandshakeResult first = runHandshake();
    HandshakeResult second = runHandshake();
    assertFalse(Arrays.equals(first.getRootSecret(), second.getRootSecret()));
    assertFalse(Arrays.equals(first.getSessionId(), second.getSessionId()));
  }

  @Test
  public void tamperedCiphertextFailsSignature() throws Exception {
    HandshakeEngine aliceEngine = alice.newEngine();
    PendingHandshake pending = aliceEngine.initiate(bob.getAddress());
    HandshakeResponseMessage response =
        bob.newEngine().respond(pending.getInitMessage()).getMessage();

    byte[] ciphertext = response.getKemCiphertext();
    ciphertext[17] ^= 0x01;
    HandshakeResponseMessage tampered =
        new HandshakeResponseMessage(
            response.getSuite(),
            response.getSender(),
            response.getRecipient(),
            response.getIdentityKey(),
            response.getEphemeralKey(),
            ciphertext,
            response.getNonce(),
            response.getTimestamp(),
            response.getInitHash(),
            response.getDeviceSignature(),
            response.getIdentitySignature());

    TranscriptException e =
        assertThrows(TranscriptException.class, () -> aliceEngine.complete(pending, tampered));
    assertThat(e.getCode(), is(ErrorCode.INVALID_SIGNATURE));
  }

  @Test
  public void tamperedInitFailsSignature() throws Exception {
    HandshakeInitMessage init = alice.newEngine().initiate(bob.getAddress()).getInitMessage();
    byte[] nonce = init.getNonce();
    nonce[0] ^= 0x01;
    HandshakeInitMessage tampered = copyOf(init, init.getSuite(), nonce);

    TranscriptException e =
        assertThrows(TranscriptException.class, () -> bob.newEngine().respond(tampered));
    assertThat(e.getCode(), is(ErrorCode.INVALID_SIGNATURE));
  }

  @Test
  public void unknownSuiteIsRejected() throws Exception {
    HandshakeInitMessage init = alice.newEngine().initiate(bob.getAddress()).getInitMessage();
    HandshakeInitMessage downgraded = copyOf(init, "fw-x25519-only", init.getNonce());

    InvalidVersionException e =
        assertThrows(InvalidVersionException.class, () -> bob.newEngine().respond(downgraded));
    assertThat(e.getCode(), is(ErrorCode.UNSUPPORTED_ALGORITHM));
  }

  @Test
  public void revokedInitiatorIsRejected() throws Exception {
    HandshakeInitMessage init = alice.newEngine().initiate(bob.getAddress()).getInitMessage();
    directory.revoke(alice.getAddress());

    RevokedDeviceException e =
        assertThrows(RevokedDeviceException.class, () -> bob.newEngine().respond(init));
    assertThat(e.getCode(), is(ErrorCode.REVOKED_DEVICE));
    assertThrows(RevokedDeviceException.class, () -> bob.newEngine().initiate(alice.getAddress()));
  }

  @Test
  public void unknownRecipientIsRejected() {
    TranscriptException e =
        assertThrows(
            TranscriptException.class,
            () -> alice.newEngine().initiate(new DeviceAddress("mallory", 1)));
    assertThat(e.getCode(), is(ErrorCode.UNKNOWN_DEVICE));
  }

  @Test
  public void staleInitIsRejected() throws Exception {
    HandshakeInitMessage init = alice.newEngine().initiate(bob.getAddress()).getInitMessage();
    clock.advance(Duration.ofMinutes(6));

    TranscriptException e =
        assertThrows(TranscriptException.class, () -> bob.newEngine().respond(init));
    assertThat(e.getCode(), is(ErrorCode.STALE_TRANSCRIPT));
  }

  @Test
  public void expiredPendingHandshakeIsRejected() throws Exception {
    HandshakeEngine aliceEngine = alice.newEngine();
    PendingHandshake pending = aliceEngine.initiate(bob.getAddress());
    HandshakeResponseMessage response =
        bob.newEngine().respond(pending.getInitMessage()).getMessage();
    clock.advance(ProtocolConfig.DEFAULT_HANDSHAKE_TIMEOUT.plusSeconds(1));

    TranscriptException e =
        assertThrows(TranscriptException.class, () -> aliceEngine.complete(pending, response));
    assertThat(e.getCode(), is(ErrorCode.STALE_TRANSCRIPT));
  }

  @Test
  public void responseMustAnswerPendingInit() throws Exception {
    HandshakeEngine aliceEngine = alice.newEngine();
    PendingHandshake first = aliceEngine.initiate(bob.getAddress());
    PendingHandshake second = aliceEngine.initiate(bob.getAddress());
    HandshakeResponseMessage secondResponse =
        bob.newEngine().respond(second.getInitMessage()).getMessage();

    TranscriptException e =
        assertThrows(TranscriptException.class, () -> aliceEngine.complete(first, secondResponse));
    assertThat(e.getCode(), is(ErrorCode.TRANSCRIPT_MISMATCH));
  }

  @Test
  public void pendingHandshakeCompletesOnce() throws Exception {
    HandshakeEngine aliceEngine = alice.newEngine();
    PendingHandshake pending = aliceEngine.initiate(bob.getAddress());
    HandshakeResponseMessage response =
        bob.newEngine().respond(pending.getInitMessage()).getMessage();
    aliceEngine.complete(pending, response);

    TranscriptException e =
        assertThrows(TranscriptException.class, () -> aliceEngine.complete(pending, response));
    assertThat(e.getCode(), is(ErrorCode.TRANSCRIPT_MISMATCH));
  }

  @Test
  public void initAddressedElsewhereIsRejected() throws Exception {
    TestDevice carol = TestDevice.create("carol", directory, ProtocolConfig.defaults(), clock);
    HandshakeInitMessage init = alice.newEngine().initiate(bob.getAddress()).getInitMessage();

    TranscriptException e =
        assertThrows(TranscriptException.class, () -> carol.newEngine().respond(init));
    assertThat(e.getCode(), is(ErrorCode.TRANSCRIPT_MISMATCH));
  }

  @Test
  public void initSurvivesWireEncoding() throws Exception {
    HandshakeEngine aliceEngine = alice.newEngine();
    PendingHandshake pending = aliceEngine.initiate(bob.getAddress());
    HandshakeInitMessage received =
        HandshakeInitMessage.deserialize(pending.getInitMessage().serialize());
    HandshakeResponse response = bob.newEngine().respond(received);
    HandshakeResponseMessage receivedResponse =
        HandshakeResponseMessage.deserialize(response.getMessage().serialize());

    HandshakeResult result = aliceEngine.complete(pending, receivedResponse);
    assertArrayEquals(response.getResult().getRootSecret(), result.getRootSecret());
  }

  private HandshakeResult runHandshake() throws Exception {
    HandshakeEngine aliceEngine = alice.newEngine();
    PendingHandshake pending = aliceEngine.initiate(bob.getAddress());
    HandshakeResponse response = bob.newEngine().respond(pending.getInitMessage());
    return aliceEngine.complete(pending, response.getMessage());
  }

  private static HandshakeInitMessage copyOf(
      HandshakeInitMessage init, String suite, byte[] nonce) {
    return new HandshakeInitMessage(
        suite,
        init.getSender(),
        init.getRecipient(),
        init.getIdentityKey(),
        init.getEphemeralKey(),
        init.getKemPublicKey(),
        nonce,
        init.getTimestamp(),
        init.getDeviceSignature(),
        init.getIdentitySignature());
  }
}
