//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import junit.framework.TestCase;
import org.foxwhisper.protocol.message.MediaFrameHeader;

public class SfuHandlerTest extends TestCase {
  private static final String CALL = "call-1";
  private static final List<String> LAYERS = Arrays.asList("low", "high");

  private final ManualClock clock = new ManualClock();
  private int nonces;
  private SfuHandler handler;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    handler =
        new SfuHandler(
            SfuPolicy.newBuilder()
                .setMaxTracksPerParticipant(2)
                .setMaxSubscribersPerTrack(2)
                .setMaxBitrateBps(1_000_000)
                .setTranscriptCapacity(4)
                .build(),
            clock);
  }

  private ClientAuthToken register(String participantId) {
    byte[] key = new byte[32];
    new SecureRandom().nextBytes(key);
    handler.registerClient(CALL, participantId, key);
    return ClientAuthToken.create(key, CALL, participantId, clock.millis(), "nonce-" + nonces++);
  }

  private void admit(String participantId) {
    assertEquals(AuthResult.ACCEPTED, handler.authenticate(register(participantId)));
    assertTrue(handler.join(CALL, participantId).isAllowed());
  }

  private static MediaFrameHeader frame(String sender, String track, long sequence, String layer) {
    return new MediaFrameHeader(CALL, sender, track, sequence, 0, layer);
  }

  private static void assertDenied(SfuErrorCode expected, SfuDecision<?> decision) {
    assertFalse("expected " + expected, decision.isAllowed());
    assertEquals(expected, decision.getErrorCode());
  }

  public void testJoinRequiresAuthentication() {
    assertDenied(SfuErrorCode.NOT_AUTHENTICATED, handler.join(CALL, "alice"));
    assertDenied(SfuErrorCode.NOT_AUTHENTICATED, handler.publish(CALL, "alice", "cam", LAYERS));

    register("alice");
    assertDenied(SfuErrorCode.NOT_AUTHENTICATED, handler.join(CALL, "alice"));
    assertEquals(3, handler.getMetrics().getDenials(SfuErrorCode.NOT_AUTHENTICATED));
  }

  public void testAuthenticatedButNotJoined() {
    assertEquals(AuthResult.ACCEPTED, handler.authenticate(register("alice")));
    assertDenied(SfuErrorCode.NOT_JOINED, handler.publish(CALL, "alice", "cam", LAYERS));
    assertDenied(SfuErrorCode.NOT_JOINED, handler.subscribe(CALL, "alice", "cam", null));
  }

  public void testImpersonationIsCounted() {
    register("alice");
    byte[] forgedKey = new byte[32];
    ClientAuthToken forged = ClientAuthToken.create(forgedKey, CALL, "alice", clock.millis(), "x");

    assertEquals(AuthResult.IMPERSONATION, handler.authenticate(forged));
    assertEquals(1, handler.getMetrics().getDenials(SfuErrorCode.IMPERSONATION));
    assertNull(handler.getParticipant(CALL, "alice"));
  }

  public void testReplayedTokenIsRejected() {
    ClientAuthToken token = register("alice");
    assertEquals(AuthResult.ACCEPTED, handler.authenticate(token));
    assertEquals(AuthResult.REPLAY, handler.authenticate(token));
    assertEquals(1, handler.getMetrics().getAuthResults(AuthResult.REPLAY));
  }

  public void testRoutesBySubscribedLayer() {
    admit("alice");
    admit("bob");
    admit("carol");
    assertTrue(handler.publish(CALL, "alice", "cam", LAYERS).isAllowed());
    assertTrue(handler.subscribe(CALL, "carol", "cam", null).isAllowed());
    assertTrue(handler.subscribe(CALL, "bob", "cam", "high").isAllowed());

    RoutingAction high = handler.routeFrame(frame("alice", "cam", 1, "high")).getValue();
    assertEquals(Arrays.asList("bob", "carol"), high.getRecipients());
    assertEquals("alice", high.getPublisherId());

    RoutingAction low = handler.routeFrame(frame("alice", "cam", 2, "low")).getValue();
    assertEquals(Collections.singletonList("carol"), low.getRecipients());
    assertEquals(2, handler.getMetrics().getRoutedFrames());
  }

  public void testUnknownTrack() {
    admit("alice");
    assertDenied(SfuErrorCode.UNAUTHORIZED_SUBSCRIBE, handler.subscribe(CALL, "alice", "x", null));
    assertDenied(
        SfuErrorCode.UNAUTHORIZED_SUBSCRIBE, handler.routeFrame(frame("alice", "x", 1, null)));
  }

  public void testSimulcastSpoof() {
    admit("alice");
    admit("bob");
    handler.publish(CALL, "alice", "cam", LAYERS);

    assertDenied(SfuErrorCode.SIMULCAST_SPOOF, handler.subscribe(CALL, "bob", "cam", "ultra"));
    assertDenied(
        SfuErrorCode.SIMULCAST_SPOOF, handler.routeFrame(frame("alice", "cam", 1, "ultra")));
  }

  public void testDuplicateRoute() {
    admit("alice");
    admit("bob");
    assertTrue(handler.publish(CALL, "alice", "cam", LAYERS).isAllowed());

    assertDenied(SfuErrorCode.DUPLICATE_ROUTE, handler.publish(CALL, "bob", "cam", LAYERS));
    assertEquals("alice", handler.getTrack(CALL, "cam").getPublisherId());
  }

  public void testHijackedTrackIsLogged() {
    admit("alice");
    admit("bob");
    handler.publish(CALL, "alice", "cam", LAYERS);

    assertDenied(SfuErrorCode.HIJACKED_TRACK, handler.routeFrame(frame("bob", "cam", 1, "low")));

    List<SfuTranscriptEntry> transcript = handler.getTranscript();
    assertEquals(1, transcript.size());
    SfuTranscriptEntry entry = transcript.get(0);
    assertEquals(SfuTranscriptEntry.Action.DENIED, entry.getAction());
    assertEquals(SfuErrorCode.HIJACKED_TRACK, entry.getReason());
    assertEquals("bob", entry.getParticipantId());
    assertEquals(frame("bob", "cam", 1, "low").getDigestHex(), entry.getHeaderDigest());
  }

  public void testReplayedSequence() {
    admit("alice");
    handler.publish(CALL, "alice", "cam", LAYERS);

    assertTrue(handler.routeFrame(frame("alice", "cam", 5, "low")).isAllowed());
    assertDenied(SfuErrorCode.REPLAY_TRACK, handler.routeFrame(frame("alice", "cam", 5, "low")));
    assertDenied(SfuErrorCode.REPLAY_TRACK, handler.routeFrame(frame("alice", "cam", 4, "high")));
    assertTrue(handler.routeFrame(frame("alice", "cam", 6, "high")).isAllowed());
  }

  public void testBitrateReports() {
    admit("alice");
    admit("bob");
    handler.publish(CALL, "alice", "cam", LAYERS);

    assertTrue(handler.reportBitrate(CALL, "alice", "cam", 800_000).isAllowed());
    assertDenied(
        SfuErrorCode.BITRATE_ABUSE, handler.reportBitrate(CALL, "alice", "cam", 2_000_000));
    assertDenied(SfuErrorCode.HIJACKED_TRACK, handler.reportBitrate(CALL, "bob", "cam", 1));
  }

  public void testResourceLimits() {
    admit("alice");
    admit("bob");
    admit("carol");
    admit("dave");
    assertTrue(handler.publish(CALL, "alice", "cam", LAYERS).isAllowed());
    assertTrue(handler.publish(CALL, "alice", "mic", null).isAllowed());
    assertDenied(SfuErrorCode.TRACK_LIMIT, handler.publish(CALL, "alice", "screen", null));

    assertTrue(handler.subscribe(CALL, "bob", "cam", null).isAllowed());
    assertTrue(handler.subscribe(CALL, "carol", "cam", null).isAllowed());
    assertDenied(SfuErrorCode.SUBSCRIBER_LIMIT, handler.subscribe(CALL, "dave", "cam", null));
    // changing layer is not a new subscription
    assertTrue(handler.subscribe(CALL, "bob", "cam", "low").isAllowed());
  }

  public void testKeyGrantsAreBoundToGrantee() {
    admit("alice");
    admit("bob");
    admit("carol");
    byte[] blob = "wrapped key".getBytes(StandardCharsets.UTF_8);
    assertTrue(handler.grantKey(CALL, "alice", "k1", "bob", 0, blob).isAllowed());

    KeyGrant grant = handler.requestKey(CALL, "bob", "k1", 0).getValue();
    assertTrue(Arrays.equals(blob, grant.getEncryptedKeyBlob()));

    assertDenied(SfuErrorCode.KEY_LEAK_ATTEMPT, handler.requestKey(CALL, "carol", "k1", 0));
    assertDenied(SfuErrorCode.KEY_LEAK_ATTEMPT, handler.requestKey("call-2", "bob", "k1", 0));
    assertDenied(SfuErrorCode.KEY_LEAK_ATTEMPT, handler.requestKey(CALL, "mallory", "k1", 0));
    assertDenied(
        SfuErrorCode.KEY_LEAK_ATTEMPT, handler.grantKey(CALL, "carol", "k1", "carol", 0, blob));
    assertDenied(SfuErrorCode.KEY_LEAK_ATTEMPT, handler.requestKey(CALL, "bob", "k9", 0));
  }

  public void testEpochAdvanceRevokesOldGrants() {
    admit("alice");
    admit("bob");
    byte[] blob = new byte[] {1, 2, 3};
    handler.grantKey(CALL, "alice", "k1", "bob", 0, blob);
    handler.grantKey(CALL, "alice", "k2", "bob", 2, blob);

    assertTrue(handler.advanceMediaEpoch(CALL, 1).isAllowed());
    assertEquals(1, handler.getMediaEpoch(CALL));

    assertDenied(SfuErrorCode.KEY_LEAK_ATTEMPT, handler.requestKey(CALL, "bob", "k1", 1));
    assertDenied(SfuErrorCode.STALE_KEY_REUSE, handler.requestKey(CALL, "bob", "k2", 1));
    assertTrue(handler.requestKey(CALL, "bob", "k2", 2).isAllowed());
    assertDenied(
        SfuErrorCode.STALE_KEY_REUSE, handler.grantKey(CALL, "alice", "k3", "bob", 0, blob));
    assertDenied(SfuErrorCode.STALE_KEY_REUSE, handler.advanceMediaEpoch(CALL, 0));
  }

  public void testLeaveTearsDownState() {
    admit("alice");
    admit("bob");
    handler.publish(CALL, "alice", "cam", LAYERS);
    handler.subscribe(CALL, "bob", "cam", null);
    handler.grantKey(CALL, "alice", "k1", "bob", 0, new byte[] {1});

    assertTrue(handler.leave(CALL, "bob").isAllowed());
    assertTrue(handler.getTrack(CALL, "cam").getSubscribers().isEmpty());
    assertDenied(SfuErrorCode.KEY_LEAK_ATTEMPT, handler.requestKey(CALL, "bob", "k1", 0));
    assertDenied(SfuErrorCode.NOT_JOINED, handler.leave(CALL, "bob"));

    assertTrue(handler.leave(CALL, "alice").isAllowed());
    assertNull(handler.getTrack(CALL, "cam"));
    assertDenied(
        SfuErrorCode.UNAUTHORIZED_SUBSCRIBE, handler.routeFrame(frame("alice", "cam", 1, null)));
  }

  public void testDeniedLeaveKeepsAuthentication() {
    assertEquals(AuthResult.ACCEPTED, handler.authenticate(register("alice")));

    assertDenied(SfuErrorCode.NOT_JOINED, handler.leave(CALL, "alice"));
    SfuParticipant alice = handler.getParticipant(CALL, "alice");
    assertNotNull(alice);
    assertTrue(alice.isAuthenticated());
    assertTrue(handler.join(CALL, "alice").isAllowed());
  }

  public void testParticipantThatLeftIsNoLongerAuthorized() {
    admit("alice");
    SfuParticipant alice = handler.getParticipant(CALL, "alice");

    assertTrue(handler.leave(CALL, "alice").isAllowed());
    assertFalse(alice.isJoined());
    assertFalse(alice.isAuthenticated());
    assertNull(handler.getParticipant(CALL, "alice"));
    assertDenied(SfuErrorCode.NOT_AUTHENTICATED, handler.join(CALL, "alice"));
  }

  public void testLeaveRacingPublishLeavesNoTrack() throws Exception {
    for (int round = 0; round < 200; round++) {
      String participantId = "alice-" + round;
      String trackId = "cam-" + round;
      admit(participantId);

      CountDownLatch start = new CountDownLatch(1);
      Thread publisher =
          new Thread(
              () -> {
                awaitQuietly(start);
                handler.publish(CALL, participantId, trackId, LAYERS);
              });
      publisher.start();
      start.countDown();
      assertTrue(handler.leave(CALL, participantId).isAllowed());
      publisher.join();

      assertNull("round " + round, handler.getTrack(CALL, trackId));
    }
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public void testTranscriptIsBounded() {
    admit("alice");
    admit("bob");
    handler.publish(CALL, "alice", "cam", LAYERS);
    handler.subscribe(CALL, "bob", "cam", null);

    for (int sequence = 1; sequence <= 6; sequence++) {
      handler.routeFrame(frame("alice", "cam", sequence, "low"));
    }

    List<SfuTranscriptEntry> transcript = handler.getTranscript();
    assertEquals(4, transcript.size());
    assertEquals(2, handler.getTranscriptLog().getDroppedCount());
    SfuTranscriptEntry last = transcript.get(3);
    assertEquals(6, last.getFrameSequence());
    assertEquals(SfuTranscriptEntry.Action.ROUTED, last.getAction());
    assertEquals(Collections.singletonList("bob"), last.getSubscriberIds());
    assertNull(last.getReason());
  }
}
