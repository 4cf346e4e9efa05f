//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.foxwhisper.protocol.logging.Log;
import org.foxwhisper.protocol.message.MediaFrameHeader;

/**
 * The routing and authorization state machine of an untrusted selective forwarding unit.
 *
 * <p>The handler never sees plaintext media or keys. It authenticates participants, tracks who
 * publishes and subscribes to which track, hands out opaque key blobs to the participants they
 * were granted to, and routes frames strictly by their (call, participant, track) identifiers.
 *
 * <p>Requests are answered with {@link SfuDecision}s; abusive requests are denied with a stable
 * {@link SfuErrorCode} and leave all other state untouched. Every frame, routed or denied, adds one
 * entry to the {@link SfuTranscript}.
 *
 * <p>This class is thread-safe. Each participant, track and key grant is guarded on its own; there
 * is no handler-wide lock.
 */
public class SfuHandler {
  private static final String TAG = "SfuHandler";

  private final SfuPolicy policy;
  private final Clock clock;
  private final SfuAuthenticator authenticator;
  private final SfuTranscript transcript;
  private final SfuMetrics metrics = new SfuMetrics();

  private final Map<EntityKey, SfuParticipant> participants = new ConcurrentHashMap<>();
  private final Map<EntityKey, SfuTrack> tracks = new ConcurrentHashMap<>();
  private final Map<String, KeyGrant> keyGrants = new ConcurrentHashMap<>();
  private final Map<String, Long> mediaEpochs = new ConcurrentHashMap<>();

  public SfuHandler() {
    this(SfuPolicy.defaults(), Clock.systemUTC());
  }

  public SfuHandler(SfuPolicy policy, Clock clock) {
    this.policy = policy;
    this.clock = clock;
    this.authenticator = new SfuAuthenticator(policy, clock);
    this.transcript = new SfuTranscript(policy.getTranscriptCapacity());
  }

  /** Registers the key {@code clientId} proves possession of when joining {@code callId}. */
  public void registerClient(String callId, String clientId, byte[] authKey) {
    authenticator.registerClient(callId, clientId, authKey);
  }

  public AuthResult authenticate(ClientAuthToken token) {
    AuthResult result = authenticator.authenticate(token);
    metrics.recordAuth(result);
    if (result == AuthResult.ACCEPTED) {
      participants.compute(
          new EntityKey(token.getCallId(), token.getClientId()),
          (key, participant) -> {
            SfuParticipant authenticated =
                participant == null ? new SfuParticipant(key.callId, key.id) : participant;
            authenticated.markAuthenticated();
            return authenticated;
          });
    } else if (result == AuthResult.IMPERSONATION) {
      metrics.recordDenial(SfuErrorCode.IMPERSONATION);
    }
    return result;
  }

  public SfuDecision<Void> join(String callId, String participantId) {
    SfuParticipant participant = participants.get(new EntityKey(callId, participantId));
    if (participant == null || !participant.isAuthenticated()) {
      return deny(SfuErrorCode.NOT_AUTHENTICATED, participantId + " has not authenticated");
    }
    participant.markJoined();
    Log.i(TAG, participantId + " joined " + callId);
    return SfuDecision.allow();
  }

  /**
   * Removes a joined participant along with its tracks, subscriptions and key grants. A participant
   * that has not joined is denied and keeps its authentication.
   */
  public SfuDecision<Void> leave(String callId, String participantId) {
    EntityKey key = new EntityKey(callId, participantId);
    SfuParticipant participant = participants.get(key);
    if (participant == null) {
      return deny(SfuErrorCode.NOT_JOINED, participantId + " is not in " + callId);
    }
    Set<String> publishedTracks;
    synchronized (participant) {
      if (!participant.isJoined()) {
        return deny(SfuErrorCode.NOT_JOINED, participantId + " is not in " + callId);
      }
      participant.markLeft();
      participants.remove(key, participant);
      publishedTracks = participant.getPublishedTracks();
    }

    for (String trackId : publishedTracks) {
      tracks.remove(new EntityKey(callId, trackId));
    }
    for (SfuTrack track : tracks.values()) {
      if (track.getCallId().equals(callId)) {
        track.removeSubscriber(participantId);
      }
    }
    keyGrants
        .values()
        .removeIf(
            grant ->
                grant.getCallId().equals(callId) && grant.getParticipantId().equals(participantId));
    authenticator.unregisterClient(callId, participantId);
    Log.i(TAG, participantId + " left " + callId);
    return SfuDecision.allow();
  }

  /**
   * Publishes a track owned by {@code participantId}.
   *
   * @param layers the simulcast layers the track carries, or {@code null} for a single-layer track
   */
  public SfuDecision<Void> publish(
      String callId, String participantId, String trackId, Collection<String> layers) {
    SfuParticipant participant = participants.get(new EntityKey(callId, participantId));
    SfuDecision<Void> denied = requireJoined(participant, callId, participantId);
    if (denied != null) {
      return denied;
    }

    SfuTrack track = new SfuTrack(callId, trackId, participantId, layers);
    synchronized (participant) {
      if (!participant.isJoined()) {
        return deny(SfuErrorCode.NOT_JOINED, participantId + " left " + callId);
      }
      if (participant.getTrackCount() >= policy.getMaxTracksPerParticipant()) {
        return deny(SfuErrorCode.TRACK_LIMIT, participantId + " has too many tracks");
      }
      if (tracks.putIfAbsent(new EntityKey(callId, trackId), track) != null) {
        return deny(SfuErrorCode.DUPLICATE_ROUTE, "track " + trackId + " is already published");
      }
      participant.addTrack(trackId);
    }
    Log.i(TAG, participantId + " published " + trackId + " in " + callId);
    return SfuDecision.allow();
  }

  /**
   * Subscribes to a published track.
   *
   * @param layer the simulcast layer wanted, or {@code null} for every layer
   */
  public SfuDecision<Void> subscribe(
      String callId, String participantId, String trackId, String layer) {
    SfuParticipant participant = participants.get(new EntityKey(callId, participantId));
    SfuDecision<Void> denied = requireJoined(participant, callId, participantId);
    if (denied != null) {
      return denied;
    }

    SfuTrack track = tracks.get(new EntityKey(callId, trackId));
    if (track == null) {
      return deny(SfuErrorCode.UNAUTHORIZED_SUBSCRIBE, "no track " + trackId + " in " + callId);
    }
    if (layer != null && !track.getLayers().contains(layer)) {
      return deny(
          SfuErrorCode.SIMULCAST_SPOOF,
          "layer " + layer + " not advertised by " + trackId + " " + track.getLayers());
    }
    synchronized (participant) {
      if (!participant.isJoined()) {
        return deny(SfuErrorCode.NOT_JOINED, participantId + " left " + callId);
      }
      if (!track.addSubscriber(participantId, layer, policy.getMaxSubscribersPerTrack())) {
        return deny(SfuErrorCode.SUBSCRIBER_LIMIT, trackId + " has too many subscribers");
      }
    }
    return SfuDecision.allow();
  }

  /**
   * Records that {@code grantee} may fetch key {@code keyId} of {@code callId} from {@code
   * mediaEpoch} on. A key id stays bound to its first (call, participant); the epoch and blob of
   * that binding may be updated.
   */
  public SfuDecision<Void> grantKey(
      String callId,
      String grantedBy,
      String keyId,
      String grantee,
      long mediaEpoch,
      byte[] encryptedKeyBlob) {
    SfuParticipant granter = participants.get(new EntityKey(callId, grantedBy));
    SfuDecision<Void> denied = requireJoined(granter, callId, grantedBy);
    if (denied != null) {
      return denied;
    }
    if (mediaEpoch < getMediaEpoch(callId)) {
      return deny(
          SfuErrorCode.STALE_KEY_REUSE, "grant for epoch " + mediaEpoch + " of " + callId);
    }

    KeyGrant grant = new KeyGrant(keyId, callId, grantee, mediaEpoch, encryptedKeyBlob);
    KeyGrant stored =
        keyGrants.compute(
            keyId,
            (id, existing) ->
                existing == null || existing.hasSameBinding(grant) ? grant : existing);
    if (stored != grant) {
      return deny(SfuErrorCode.KEY_LEAK_ATTEMPT, "key " + keyId + " is bound elsewhere");
    }
    return SfuDecision.allow();
  }

  public SfuDecision<KeyGrant> requestKey(
      String callId, String participantId, String keyId, long mediaEpoch) {
    SfuParticipant participant = participants.get(new EntityKey(callId, participantId));
    if (participant == null || !participant.isAuthenticated()) {
      return deny(SfuErrorCode.KEY_LEAK_ATTEMPT, participantId + " has not authenticated");
    }
    KeyGrant grant = keyGrants.get(keyId);
    if (grant == null) {
      return deny(SfuErrorCode.KEY_LEAK_ATTEMPT, "no grant for key " + keyId);
    }
    if (!grant.getCallId().equals(callId)) {
      return deny(SfuErrorCode.KEY_LEAK_ATTEMPT, "key " + keyId + " belongs to another call");
    }
    if (!grant.getParticipantId().equals(participantId)) {
      return deny(
          SfuErrorCode.KEY_LEAK_ATTEMPT, "key " + keyId + " was not granted to " + participantId);
    }
    if (mediaEpoch < grant.getMediaEpoch()) {
      return deny(
          SfuErrorCode.STALE_KEY_REUSE,
          "epoch " + mediaEpoch + " is older than grant epoch " + grant.getMediaEpoch());
    }
    return SfuDecision.allow(grant);
  }

  /** Moves the call to {@code mediaEpoch} and revokes every key grant of an older epoch. */
  public SfuDecision<Void> advanceMediaEpoch(String callId, long mediaEpoch) {
    long current = mediaEpochs.merge(callId, mediaEpoch, Math::max);
    if (current != mediaEpoch) {
      return deny(
          SfuErrorCode.STALE_KEY_REUSE, callId + " is already at media epoch " + current);
    }
    keyGrants
        .values()
        .removeIf(
            grant -> grant.getCallId().equals(callId) && grant.getMediaEpoch() < mediaEpoch);
    Log.i(TAG, callId + " advanced to media epoch " + mediaEpoch);
    return SfuDecision.allow();
  }

  public long getMediaEpoch(String callId) {
    Long epoch = mediaEpochs.get(callId);
    return epoch == null ? 0 : epoch;
  }

  /** Routes one frame by its header identifiers. The payload is never inspected. */
  public SfuDecision<RoutingAction> routeFrame(MediaFrameHeader header) {
    String digest = header.getDigestHex();
    SfuTrack track = tracks.get(new EntityKey(header.getCallId(), header.getStreamId()));
    if (track == null) {
      return denyFrame(header, digest, SfuErrorCode.UNAUTHORIZED_SUBSCRIBE, "unknown track");
    }
    if (!track.getPublisherId().equals(header.getParticipantId())) {
      return denyFrame(
          header, digest, SfuErrorCode.HIJACKED_TRACK, "track owned by " + track.getPublisherId());
    }
    if (header.getLayer() != null && !track.getLayers().contains(header.getLayer())) {
      return denyFrame(
          header, digest, SfuErrorCode.SIMULCAST_SPOOF, "layer " + header.getLayer());
    }

    List<String> recipients;
    synchronized (track) {
      if (!track.advanceSequence(header.getFrameSequence())) {
        return denyFrame(
            header, digest, SfuErrorCode.REPLAY_TRACK, "sequence " + header.getFrameSequence());
      }
      recipients = track.recipientsFor(header.getLayer());
    }

    transcript.append(
        new SfuTranscriptEntry(
            clock.millis(),
            header.getCallId(),
            header.getParticipantId(),
            header.getStreamId(),
            header.getMediaEpoch(),
            header.getFrameSequence(),
            SfuTranscriptEntry.Action.ROUTED,
            null,
            recipients,
            digest));
    metrics.recordRoutedFrame();
    return SfuDecision.allow(
        new RoutingAction(
            header.getCallId(),
            header.getStreamId(),
            header.getParticipantId(),
            recipients,
            digest));
  }

  /** Checks a publisher's reported send rate against the policy cap. */
  public SfuDecision<Void> reportBitrate(
      String callId, String participantId, String trackId, long bitsPerSecond) {
    SfuTrack track = tracks.get(new EntityKey(callId, trackId));
    if (track == null) {
      return deny(SfuErrorCode.UNAUTHORIZED_SUBSCRIBE, "no track " + trackId + " in " + callId);
    }
    if (!track.getPublisherId().equals(participantId)) {
      return deny(SfuErrorCode.HIJACKED_TRACK, participantId + " does not own " + trackId);
    }
    if (bitsPerSecond > policy.getMaxBitrateBps()) {
      return deny(
          SfuErrorCode.BITRATE_ABUSE,
          trackId + " at " + bitsPerSecond + "bps exceeds " + policy.getMaxBitrateBps());
    }
    return SfuDecision.allow();
  }

  public SfuParticipant getParticipant(String callId, String participantId) {
    return participants.get(new EntityKey(callId, participantId));
  }

  public SfuTrack getTrack(String callId, String trackId) {
    return tracks.get(new EntityKey(callId, trackId));
  }

  public List<SfuTranscriptEntry> getTranscript() {
    return transcript.getEntries();
  }

  public SfuTranscript getTranscriptLog() {
    return transcript;
  }

  public SfuMetrics getMetrics() {
    return metrics;
  }

  SfuAuthenticator getAuthenticator() {
    return authenticator;
  }

  private SfuDecision<Void> requireJoined(
      SfuParticipant participant, String callId, String participantId) {
    if (participant == null || !participant.isAuthenticated()) {
      return deny(SfuErrorCode.NOT_AUTHENTICATED, participantId + " has not authenticated");
    }
    if (!participant.isJoined()) {
      return deny(SfuErrorCode.NOT_JOINED, participantId + " has not joined " + callId);
    }
    return null;
  }

  private <T> SfuDecision<T> deny(SfuErrorCode code, String detail) {
    metrics.recordDenial(code);
    Log.w(TAG, code + ": " + detail);
    return SfuDecision.deny(code, detail);
  }

  private SfuDecision<RoutingAction> denyFrame(
      MediaFrameHeader header, String digest, SfuErrorCode code, String detail) {
    transcript.append(
        new SfuTranscriptEntry(
            clock.millis(),
            header.getCallId(),
            header.getParticipantId(),
            header.getStreamId(),
            header.getMediaEpoch(),
            header.getFrameSequence(),
            SfuTranscriptEntry.Action.DENIED,
            code,
            Collections.<String>emptyList(),
            digest));
    return deny(code, header.getStreamId() + ": " + detail);
  }

  private static final class EntityKey {
    private final String callId;
    private final String id;

    EntityKey(String callId, String id) {
      this.callId = Objects.requireNonNull(callId);
      this.id = Objects.requireNonNull(id);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof EntityKey)) return false;
      EntityKey that = (EntityKey) other;
      return callId.equals(that.callId) && id.equals(that.id);
    }

    @Override
    public int hashCode() {
      return Objects.hash(callId, id);
    }
  }
}
