//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.DuplicateMessageException;
import org.foxwhisper.protocol.EpochForkException;
import org.foxwhisper.protocol.EpochIntegrityException;
import org.foxwhisper.protocol.ErrorCode;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.NoSessionException;
import org.foxwhisper.protocol.ProtocolTimeoutException;
import org.foxwhisper.protocol.RatchetIntegrityException;
import org.foxwhisper.protocol.RatchetSession;
import org.foxwhisper.protocol.RevokedDeviceException;
import org.foxwhisper.protocol.SenderKeyPoisoningException;
import org.foxwhisper.protocol.config.ProtocolConfig;
import org.foxwhisper.protocol.crypto.Aes256Gcm;
import org.foxwhisper.protocol.groups.state.SenderKeyRecord;
import org.foxwhisper.protocol.groups.state.SenderKeyStore;
import org.foxwhisper.protocol.logging.Log;
import org.foxwhisper.protocol.message.EncryptedMessage;
import org.foxwhisper.protocol.message.EpochAuthenticityRecord;
import org.foxwhisper.protocol.message.GroupMessage;
import org.foxwhisper.protocol.message.SenderKeyDistributionMessage;
import org.foxwhisper.protocol.ratchet.ChainKey;
import org.foxwhisper.protocol.ratchet.MessageKeys;
import org.foxwhisper.protocol.ratchet.SkippedKeyCache;
import org.foxwhisper.protocol.state.DeviceDirectory;
import org.foxwhisper.protocol.state.DeviceKeyStore;
import org.foxwhisper.protocol.state.DeviceRecord;
import org.foxwhisper.protocol.state.SessionStore;
import org.foxwhisper.protocol.state.TrustView;
import org.foxwhisper.protocol.util.ByteUtil;
import org.foxwhisper.protocol.util.Hex;

/**
 * Tracks the epochs of every group the local device belongs to and encrypts and decrypts group
 * messages under per-epoch sender keys.
 *
 * <p>Epochs form a hash chain of signed {@link EpochAuthenticityRecord}s. Each accepted epoch gets
 * a fresh random sender chain root for the local device, which is distributed to the other members
 * of that epoch over their pairwise {@link RatchetSession}s. Received roots are first-write-wins
 * per (group, epoch, sender).
 *
 * <p>Two validly signed records with the same parent put the group in {@link GroupStatus#FORKED}.
 * Encryption and decryption then fail with {@link EpochForkException} until {@link
 * #reconcile(String)} selects the surviving branch.
 *
 * <p>A distribution that arrives before the record of its epoch, while the group is forked, or
 * before the local device has resolved a fork its sender already resolved is held, up to {@value
 * #MAX_HELD_DISTRIBUTIONS} at a time, and applied once the epoch is accepted.
 *
 * <p>All operations are synchronized on the manager. {@link #transitionAsync} does not hold the
 * lock while it waits for the broadcast.
 */
public class GroupEpochManager {

  private static final String TAG = "GroupEpochManager";
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  static final int MAX_HELD_DISTRIBUTIONS = 256;

  private final DeviceKeyStore keyStore;
  private final DeviceDirectory directory;
  private final SessionStore sessionStore;
  private final SenderKeyStore senderKeyStore;
  private final ProtocolConfig config;
  private final Clock clock;
  private final Map<String, GroupContext> groups = new HashMap<>();
  private final Deque<SenderKeyDistributionMessage> heldDistributions = new ArrayDeque<>();

  public GroupEpochManager(
      DeviceKeyStore keyStore,
      DeviceDirectory directory,
      SessionStore sessionStore,
      SenderKeyStore senderKeyStore) {
    this(
        keyStore,
        directory,
        sessionStore,
        senderKeyStore,
        ProtocolConfig.defaults(),
        Clock.systemUTC());
  }

  public GroupEpochManager(
      DeviceKeyStore keyStore,
      DeviceDirectory directory,
      SessionStore sessionStore,
      SenderKeyStore senderKeyStore,
      ProtocolConfig config,
      Clock clock) {
    this.keyStore = keyStore;
    this.directory = directory;
    this.sessionStore = sessionStore;
    this.senderKeyStore = senderKeyStore;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Creates a group with the local device as an admin and issues its first epoch record.
   *
   * @return the accepted genesis epoch and the local sender key distributions
   * @throws EpochIntegrityException if the local device is not among {@code admins} or the admins
   *     are not all members
   */
  public synchronized EpochUpdate createGroup(
      String groupId, Collection<DeviceAddress> members, Collection<DeviceAddress> admins)
      throws EpochIntegrityException {
    if (groups.containsKey(groupId)) {
      throw new IllegalStateException("group already exists: " + groupId);
    }
    DeviceAddress localAddress = keyStore.getLocalAddress();
    if (!admins.contains(localAddress)) {
      throw new EpochIntegrityException(
          ErrorCode.NOT_AN_ADMIN, "creator must be an admin of " + groupId);
    }

    EpochAuthenticityRecord genesis =
        sign(
            new EpochAuthenticityRecord(
                groupId,
                0,
                EpochAuthenticityRecord.GENESIS_PREVIOUS_HASH,
                members,
                admins,
                localAddress,
                clock.millis(),
                Collections.<DeviceAddress, byte[]>emptyMap()));
    requireShape(genesis);

    GroupContext context = new GroupContext(groupId);
    GroupEpochState state = context.add(genesis);
    context.tip = state;
    groups.put(groupId, context);
    Log.i(TAG, "created group " + state);
    return accept(context, state);
  }

  /**
   * Starts tracking a group from an epoch record received out of band, for example in an
   * invitation.
   *
   * <p>No earlier history is needed. The record must be signed only by admins it lists itself,
   * each of them active and verifying, and it must list the local device as a member.
   */
  public synchronized EpochUpdate joinGroup(EpochAuthenticityRecord record)
      throws EpochIntegrityException {
    if (groups.containsKey(record.getGroupId())) {
      return applyEpochRecord(record);
    }
    requireShape(record);
    verifySignatures(record, record.getAdmins());
    if (!record.getMembers().contains(keyStore.getLocalAddress())) {
      throw new EpochIntegrityException(
          ErrorCode.NOT_A_MEMBER, "not a member of " + record.getGroupId());
    }

    GroupContext context = new GroupContext(record.getGroupId());
    GroupEpochState state = context.add(record);
    context.tip = state;
    groups.put(record.getGroupId(), context);
    Log.i(TAG, "joined group " + state);
    return accept(context, state);
  }

  /**
   * Builds and signs the record for the next epoch with the given membership. The record is not
   * applied; gather countersignatures with {@link #countersign} if needed, then pass it to {@link
   * #applyEpochRecord} on every member.
   *
   * @throws EpochIntegrityException if the local device is not an admin of the current epoch, the
   *     group is forked, or the admins are not all members
   */
  public synchronized EpochAuthenticityRecord proposeTransition(
      String groupId, Collection<DeviceAddress> members, Collection<DeviceAddress> admins)
      throws EpochIntegrityException {
    GroupContext context = requireActive(groupId);
    GroupEpochState tip = context.tip;
    DeviceAddress localAddress = keyStore.getLocalAddress();
    if (!tip.isAdmin(localAddress)) {
      throw new EpochIntegrityException(
          ErrorCode.NOT_AN_ADMIN, localAddress + " is not an admin of " + tip);
    }

    EpochAuthenticityRecord proposal =
        new EpochAuthenticityRecord(
            groupId,
            tip.getEpoch() + 1,
            tip.getHash(),
            members,
            admins,
            localAddress,
            clock.millis(),
            Collections.<DeviceAddress, byte[]>emptyMap());
    requireShape(proposal);
    return sign(proposal);
  }

  /** Adds the local device's signature to a proposed record whose parent is known locally. */
  public synchronized EpochAuthenticityRecord countersign(EpochAuthenticityRecord record)
      throws EpochIntegrityException {
    GroupContext context = requireGroup(record.getGroupId());
    GroupEpochState parent = context.known.get(Hex.toStringCondensed(record.getPreviousHash()));
    if (parent == null) {
      throw new EpochIntegrityException(
          ErrorCode.HASH_CHAIN_BREAK, "unknown parent for epoch " + record.getEpoch());
    }
    DeviceAddress localAddress = keyStore.getLocalAddress();
    if (!parent.isAdmin(localAddress)) {
      throw new EpochIntegrityException(
          ErrorCode.NOT_AN_ADMIN, localAddress + " is not an admin of " + parent);
    }
    return sign(record);
  }

  /**
   * Validates an epoch record against the known hash chain and applies it.
   *
   * <p>A record extending the current tip is accepted: the local device generates a new sender key
   * for it and the update carries the distributions. A valid record that shares its parent with a
   * known record forks the group.
   *
   * @throws EpochIntegrityException with {@link ErrorCode#HASH_CHAIN_BREAK} if the parent is
   *     unknown, {@link ErrorCode#STALE_EPOCH_REF} if the epoch does not follow the parent, {@link
   *     ErrorCode#MEMBERSHIP_MISMATCH} if an admin is not a member, or {@link
   *     ErrorCode#MISSING_ADMIN_SIGNATURE} / {@link ErrorCode#INVALID_ADMIN_SIGNATURE} if the
   *     record is not properly signed by admins of the parent epoch
   */
  public synchronized EpochUpdate applyEpochRecord(EpochAuthenticityRecord record)
      throws EpochIntegrityException {
    GroupContext context = requireGroup(record.getGroupId());
    GroupEpochState candidate = new GroupEpochState(record);

    GroupEpochState existing = context.known.get(candidate.getHashHex());
    if (existing != null) {
      return new EpochUpdate(EpochUpdate.Outcome.DUPLICATE, existing);
    }
    if (context.discarded.containsKey(candidate.getHashHex())
        || context.discarded.containsKey(candidate.getPreviousHashHex())) {
      Log.i(TAG, "ignoring record on a discarded branch: " + candidate);
      return new EpochUpdate(EpochUpdate.Outcome.DISCARDED, candidate);
    }

    GroupEpochState parent = context.known.get(candidate.getPreviousHashHex());
    if (parent == null) {
      throw new EpochIntegrityException(
          ErrorCode.HASH_CHAIN_BREAK, "unknown parent for " + candidate);
    }
    if (record.getEpoch() != parent.getEpoch() + 1) {
      throw new EpochIntegrityException(
          ErrorCode.STALE_EPOCH_REF,
          "epoch " + record.getEpoch() + " does not follow parent " + parent);
    }
    requireShape(record);
    verifySignatures(record, parent.getAdmins());

    GroupEpochState sibling = context.findSibling(candidate);
    GroupEpochState state = context.add(record);

    if (context.status == GroupStatus.FORKED) {
      if (sibling != null && parent.getEpoch() < context.forkParent.getEpoch()) {
        Log.w(TAG, "earlier fork in " + context.groupId + " at epoch " + state.getEpoch());
        context.forkParent = parent;
      }
      return new EpochUpdate(EpochUpdate.Outcome.RECORDED, state);
    }
    if (sibling != null) {
      context.status = GroupStatus.FORKED;
      context.forkParent = parent;
      Log.w(
          TAG,
          "fork detected in "
              + context.groupId
              + " at epoch "
              + state.getEpoch()
              + ": "
              + sibling.getHashHex()
              + " vs "
              + state.getHashHex());
      return new EpochUpdate(EpochUpdate.Outcome.FORK_DETECTED, state);
    }
    if (parent != context.tip) {
      return new EpochUpdate(EpochUpdate.Outcome.RECORDED, state);
    }

    context.tip = state;
    Log.i(TAG, "advanced to " + state);
    return accept(context, state);
  }

  /**
   * Proposes the next epoch, waits for {@code broadcaster} to return the countersigned record, and
   * applies it.
   *
   * <p>The future fails with {@link ProtocolTimeoutException} when the broadcast does not complete
   * within the configured transition timeout, and with an {@link EpochIntegrityException} carrying
   * {@link ErrorCode#STALE_EPOCH} when the group has moved on in the meantime. In both cases the
   * group is left as it was.
   */
  public CompletableFuture<EpochUpdate> transitionAsync(
      String groupId,
      Collection<DeviceAddress> members,
      Collection<DeviceAddress> admins,
      EpochBroadcaster broadcaster) {
    EpochAuthenticityRecord proposal;
    try {
      proposal = proposeTransition(groupId, members, admins);
    } catch (EpochIntegrityException e) {
      return CompletableFuture.failedFuture(e);
    }

    Duration timeout = config.getEpochTransitionTimeout();
    return broadcaster
        .broadcast(proposal)
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (record, error) -> {
              if (error != null) {
                Throwable cause = unwrap(error);
                if (cause instanceof TimeoutException) {
                  Log.w(TAG, "epoch transition of " + groupId + " timed out");
                  throw new CompletionException(
                      new ProtocolTimeoutException("epoch transition of " + groupId, timeout));
                }
                throw new CompletionException(cause);
              }
              try {
                return applyIfCurrent(proposal, record);
              } catch (EpochIntegrityException e) {
                throw new CompletionException(e);
              }
            });
  }

  private synchronized EpochUpdate applyIfCurrent(
      EpochAuthenticityRecord proposal, EpochAuthenticityRecord record)
      throws EpochIntegrityException {
    if (!record.hasSameBody(proposal)) {
      throw new EpochIntegrityException(
          ErrorCode.HASH_CHAIN_BREAK, "broadcast returned a different record");
    }
    GroupContext context = requireActive(proposal.getGroupId());
    if (!Arrays.equals(context.tip.getHash(), proposal.getPreviousHash())) {
      Log.i(TAG, "discarding stale transition to epoch " + proposal.getEpoch());
      throw new EpochIntegrityException(
          ErrorCode.STALE_EPOCH,
          proposal.getGroupId() + " moved past epoch " + (proposal.getEpoch() - 1));
    }
    return applyEpochRecord(record);
  }

  /**
   * Resolves a fork. Every known record growing from the fork point is ranked by {@link
   * ForkReconciler}; the losing branches are forgotten, every sender key from the fork epoch on is
   * dropped, and the local device issues a new sender key for the surviving tip.
   *
   * <p>If the surviving branch is itself forked further down, the group stays {@link
   * GroupStatus#FORKED} at that point and needs another call.
   *
   * @throws IllegalStateException if the group is not forked
   */
  public synchronized ReconciliationResult reconcile(String groupId)
      throws EpochIntegrityException {
    GroupContext context = requireGroup(groupId);
    if (context.status != GroupStatus.FORKED) {
      throw new IllegalStateException("group " + groupId + " is not forked");
    }

    List<ForkReconciler.Branch> branches = new ArrayList<>();
    for (GroupEpochState child : context.childrenOf(context.forkParent)) {
      branches.add(new ForkReconciler.Branch(child.getRecord(), context.branchDepth(child)));
    }
    ReconciliationResult result = ForkReconciler.reconcile(branches);

    GroupEpochState winner = context.known.get(result.getWinner().getHashHex());
    long acceptedOnLosingBranches = 0;
    for (EpochAuthenticityRecord loser : result.getLosers()) {
      acceptedOnLosingBranches += context.discardBranch(context.known.get(loser.getHashHex()));
    }
    context.resetEpoch = winner.getEpoch();
    context.resetWinner = winner.getHash();
    if (result.requires(HealingAction.resetSenderChains())) {
      senderKeyStore.deleteSenderKeysFrom(groupId, winner.getEpoch());
    }
    Log.i(
        TAG,
        "reconciled "
            + groupId
            + ": kept "
            + winner
            + ", dropped "
            + result.getLosers().size()
            + " branch(es), actions "
            + result.getHealingActions());

    Map<DeviceAddress, EncryptedMessage> distributions = new TreeMap<>();
    Set<DeviceAddress> pending = new TreeSet<>();
    GroupEpochState nestedFork = context.findForkPoint(winner);
    if (nestedFork != null) {
      context.tip = nestedFork;
      context.forkParent = nestedFork;
      Log.w(TAG, groupId + " is still forked after " + nestedFork);
      return result.withLocalOutcome(acceptedOnLosingBranches, distributions, pending);
    }

    context.tip = context.deepestDescendant(winner);
    context.status = GroupStatus.ACTIVE;
    context.forkParent = null;
    context.forgetBefore(context.tip.getEpoch() - config.getRetainedEpochs() - 1);
    if (context.tip.isMember(keyStore.getLocalAddress())) {
      issueSenderKey(context, context.tip, distributions, pending);
    }
    releaseHeldDistributions(groupId);
    return result.withLocalOutcome(acceptedOnLosingBranches, distributions, pending);
  }

  /**
   * Encrypts {@code plaintext} to the current epoch under the local sender key.
   *
   * @throws EpochForkException if the group is forked
   * @throws EpochIntegrityException if the local device is not a member of the current epoch
   * @throws NoSessionException if the local sender key for the current epoch is missing
   */
  public synchronized GroupMessage encrypt(String groupId, byte[] plaintext)
      throws EpochIntegrityException, NoSessionException {
    GroupContext context = requireActive(groupId);
    GroupEpochState tip = context.tip;
    DeviceAddress localAddress = keyStore.getLocalAddress();
    if (!tip.isMember(localAddress)) {
      throw new EpochIntegrityException(
          ErrorCode.NOT_A_MEMBER, localAddress + " is not a member of " + tip);
    }

    SenderKeyRecord record = senderKeyStore.loadSenderKey(groupId, tip.getEpoch(), localAddress);
    if (record == null) {
      throw new NoSessionException("no local sender key for " + tip);
    }

    ChainKey chainKey = record.getChainKey();
    MessageKeys messageKeys = chainKey.getMessageKeys();
    long timestamp = clock.millis();
    byte[] associatedData =
        GroupMessage.associatedData(
            groupId, tip.getEpoch(), localAddress, messageKeys.getCounter(), timestamp);
    byte[] iv = Aes256Gcm.generateNonce();
    byte[] sealed = Aes256Gcm.encrypt(messageKeys.getCipherKey(), iv, plaintext, associatedData);
    byte[][] parts =
        ByteUtil.split(sealed, sealed.length - Aes256Gcm.TAG_SIZE, Aes256Gcm.TAG_SIZE);

    record.setChainKey(chainKey.getNextChainKey());
    ByteUtil.erase(messageKeys.getCipherKey());
    senderKeyStore.storeSenderKey(record);

    return new GroupMessage(
        groupId,
        tip.getEpoch(),
        localAddress,
        messageKeys.getCounter(),
        timestamp,
        iv,
        parts[0],
        parts[1]);
  }

  /**
   * Decrypts a group message.
   *
   * @throws EpochForkException if the group is forked
   * @throws EpochIntegrityException if the epoch is too old ({@link ErrorCode#STALE_EPOCH}), not
   *     known on the current branch ({@link ErrorCode#UNKNOWN_EPOCH}), or the sender or local
   *     device is not one of its members ({@link ErrorCode#NOT_A_MEMBER})
   * @throws NoSessionException if no sender key has been received for the sender and epoch
   * @throws DuplicateMessageException if this index has already been decrypted
   * @throws InvalidMessageException if the index jump is too large or authentication fails
   * @throws RevokedDeviceException if the sender has been revoked
   */
  public synchronized byte[] decrypt(GroupMessage message)
      throws EpochIntegrityException,
          NoSessionException,
          DuplicateMessageException,
          InvalidMessageException,
          RevokedDeviceException {
    GroupContext context = requireActive(message.getGroupId());
    GroupEpochState epoch = resolveEpoch(context, message.getEpoch());
    DeviceAddress sender = message.getSender();
    requireMembers(epoch, sender);

    if (directory.getCurrentView().isRevoked(sender)) {
      senderKeyStore.deleteSenderKey(message.getGroupId(), message.getEpoch(), sender);
      throw new RevokedDeviceException(sender);
    }

    SenderKeyRecord record =
        senderKeyStore.loadSenderKey(message.getGroupId(), message.getEpoch(), sender);
    if (record == null) {
      throw new NoSessionException(sender, "no sender key from " + sender + " for " + epoch);
    }

    byte[] messageKey = getOrCreateMessageKey(record, message.getIndex());
    byte[] plaintext =
        Aes256Gcm.decrypt(
            messageKey,
            message.getIv(),
            ByteUtil.combine(message.getCiphertext(), message.getTag()),
            message.getAssociatedData());
    ByteUtil.erase(messageKey);

    senderKeyStore.storeSenderKey(record);
    context.recordAccepted(epoch);
    return plaintext;
  }

  /**
   * Decrypts a sender key distribution received over the pairwise session with its sender and
   * stores the chain root.
   *
   * <p>Redelivery of the same root is ignored. A different root for a (group, epoch, sender) that
   * already has one is rejected and the stored root is kept. A distribution that cannot be placed
   * yet is held and applied when its epoch is accepted; the pairwise message is consumed either
   * way.
   *
   * @return {@code false} if the distribution is being held
   * @throws SenderKeyPoisoningException if a different root is already stored
   * @throws EpochIntegrityException if the distribution names an epoch that is no longer retained
   *     or on a discarded branch, or the sender is not a member of it
   */
  public synchronized boolean processDistribution(EncryptedMessage message)
      throws EpochIntegrityException,
          NoSessionException,
          DuplicateMessageException,
          InvalidMessageException,
          RatchetIntegrityException,
          RevokedDeviceException {
    DeviceAddress sender = message.getSender();
    byte[] plaintext = sessionFor(sender).decrypt(message);
    SenderKeyDistributionMessage distribution = SenderKeyDistributionMessage.deserialize(plaintext);
    ByteUtil.erase(plaintext);

    if (!distribution.getSender().equals(sender)) {
      throw new InvalidMessageException(
          "distribution for " + distribution.getSender() + " arrived from " + sender);
    }
    if (applyDistribution(distribution)) {
      return true;
    }
    hold(distribution);
    return false;
  }

  /** Returns {@code false} if the distribution cannot be placed yet. */
  private boolean applyDistribution(SenderKeyDistributionMessage distribution)
      throws EpochIntegrityException {
    GroupContext context = groups.get(distribution.getGroupId());
    if (context == null || context.status == GroupStatus.FORKED) {
      return false;
    }
    DeviceAddress sender = distribution.getSender();
    long epochNumber = distribution.getEpoch();
    if (epochNumber < context.tip.getEpoch() - config.getRetainedEpochs()) {
      throw new EpochIntegrityException(
          ErrorCode.STALE_EPOCH,
          "distribution for epoch " + epochNumber + " is no longer retained");
    }

    switch (context.compareReset(distribution)) {
      case NEWER:
        return false;
      case OLDER:
        if (epochNumber >= context.resetEpoch) {
          Log.i(
              TAG,
              "dropping sender key from "
                  + sender
                  + " issued before the fork at epoch "
                  + context.resetEpoch
                  + " was resolved");
          return true;
        }
        break;
      default:
        break;
    }

    String hashHex = Hex.toStringCondensed(distribution.getEpochRecordHash());
    if (context.discarded.containsKey(hashHex)) {
      throw new EpochIntegrityException(
          ErrorCode.UNKNOWN_EPOCH, "distribution for a discarded branch of " + context.groupId);
    }
    GroupEpochState epoch = context.known.get(hashHex);
    if (epoch == null) {
      return false;
    }
    if (epoch.getEpoch() != epochNumber) {
      throw new EpochIntegrityException(
          ErrorCode.UNKNOWN_EPOCH,
          "distribution names epoch " + epochNumber + " for record " + epoch);
    }
    if (context.ancestorAt(epochNumber) != epoch) {
      return false;
    }
    requireMembers(epoch, sender);

    SenderKeyRecord existing =
        senderKeyStore.loadSenderKey(distribution.getGroupId(), epochNumber, sender);
    if (existing != null) {
      if (existing.hasSameRoot(distribution.getChainRoot())) {
        Log.d(TAG, "ignoring repeated sender key from " + sender + " for " + epoch);
        return true;
      }
      Log.w(TAG, "rejecting conflicting sender key from " + sender + " for " + epoch);
      throw new SenderKeyPoisoningException(sender, "conflicting chain root for " + epoch);
    }

    senderKeyStore.storeSenderKey(
        new SenderKeyRecord(
            distribution.getGroupId(),
            epochNumber,
            distribution.getEpochRecordHash(),
            sender,
            distribution.getChainRoot(),
            config.getMaxSkippedKeys()));
    Log.i(TAG, "stored sender key from " + sender + " for " + epoch);
    return true;
  }

  private void hold(SenderKeyDistributionMessage distribution) {
    if (heldDistributions.size() >= MAX_HELD_DISTRIBUTIONS) {
      SenderKeyDistributionMessage evicted = heldDistributions.removeFirst();
      Log.w(
          TAG,
          "dropping held sender key from "
              + evicted.getSender()
              + " for epoch "
              + evicted.getEpoch()
              + " of "
              + evicted.getGroupId());
    }
    heldDistributions.addLast(distribution);
    Log.i(
        TAG,
        "holding sender key from "
            + distribution.getSender()
            + " for epoch "
            + distribution.getEpoch()
            + " of "
            + distribution.getGroupId());
  }

  private void releaseHeldDistributions(String groupId) {
    Iterator<SenderKeyDistributionMessage> held = heldDistributions.iterator();
    while (held.hasNext()) {
      SenderKeyDistributionMessage distribution = held.next();
      if (!distribution.getGroupId().equals(groupId)) {
        continue;
      }
      try {
        if (applyDistribution(distribution)) {
          held.remove();
        }
      } catch (EpochIntegrityException e) {
        Log.w(TAG, "discarding held sender key from " + distribution.getSender(), e);
        held.remove();
      }
    }
  }

  /**
   * Encrypts the local sender key of the current epoch to one member, for members whose session
   * was established after the epoch began.
   */
  public synchronized EncryptedMessage distributeTo(String groupId, DeviceAddress member)
      throws EpochIntegrityException, NoSessionException, RevokedDeviceException {
    GroupContext context = requireActive(groupId);
    GroupEpochState tip = context.tip;
    if (!tip.isMember(member)) {
      throw new EpochIntegrityException(ErrorCode.NOT_A_MEMBER, member + " is not in " + tip);
    }
    SenderKeyRecord record =
        senderKeyStore.loadSenderKey(groupId, tip.getEpoch(), keyStore.getLocalAddress());
    if (record == null) {
      throw new NoSessionException("no local sender key for " + tip);
    }
    return sessionFor(member)
        .encrypt(distributionFor(context, tip, record.getChainRoot()).serialize());
  }

  public synchronized GroupEpochState getCurrentEpoch(String groupId)
      throws EpochIntegrityException {
    return requireGroup(groupId).tip;
  }

  public synchronized GroupStatus getStatus(String groupId) throws EpochIntegrityException {
    return requireGroup(groupId).status;
  }

  public synchronized boolean isKnownGroup(String groupId) {
    return groups.containsKey(groupId);
  }

  private EpochUpdate accept(GroupContext context, GroupEpochState state) {
    senderKeyStore.deleteSenderKeysBefore(
        context.groupId, state.getEpoch() - config.getRetainedEpochs());
    context.forgetBefore(state.getEpoch() - config.getRetainedEpochs() - 1);

    if (!state.isMember(keyStore.getLocalAddress())) {
      Log.i(TAG, "local device is not a member of " + state);
      releaseHeldDistributions(context.groupId);
      return new EpochUpdate(EpochUpdate.Outcome.ACCEPTED, state);
    }

    Map<DeviceAddress, EncryptedMessage> distributions = new TreeMap<>();
    Set<DeviceAddress> pending = new TreeSet<>();
    issueSenderKey(context, state, distributions, pending);
    releaseHeldDistributions(context.groupId);
    return new EpochUpdate(EpochUpdate.Outcome.ACCEPTED, state, distributions, pending);
  }

  private void issueSenderKey(
      GroupContext context,
      GroupEpochState state,
      Map<DeviceAddress, EncryptedMessage> distributions,
      Set<DeviceAddress> pending) {
    DeviceAddress localAddress = keyStore.getLocalAddress();
    byte[] chainRoot = new byte[SenderKeyDistributionMessage.CHAIN_ROOT_LENGTH];
    SECURE_RANDOM.nextBytes(chainRoot);

    senderKeyStore.storeSenderKey(
        new SenderKeyRecord(
            state.getGroupId(),
            state.getEpoch(),
            state.getHash(),
            localAddress,
            chainRoot,
            config.getMaxSkippedKeys()));
    byte[] serialized = distributionFor(context, state, chainRoot).serialize();
    ByteUtil.erase(chainRoot);

    for (DeviceAddress member : state.getMembers()) {
      if (member.equals(localAddress)) {
        continue;
      }
      RatchetSession session = sessionFor(member);
      if (!session.hasSession()) {
        pending.add(member);
        continue;
      }
      try {
        distributions.put(member, session.encrypt(serialized));
      } catch (NoSessionException e) {
        pending.add(member);
      } catch (RevokedDeviceException e) {
        Log.w(TAG, "not distributing to revoked member " + member);
      }
    }
    ByteUtil.erase(serialized);
  }

  private SenderKeyDistributionMessage distributionFor(
      GroupContext context, GroupEpochState state, byte[] chainRoot) {
    return new SenderKeyDistributionMessage(
        state.getGroupId(),
        state.getEpoch(),
        state.getHash(),
        keyStore.getLocalAddress(),
        chainRoot,
        context.resetEpoch,
        context.resetWinner);
  }

  private RatchetSession sessionFor(DeviceAddress remoteAddress) {
    return new RatchetSession(sessionStore, directory, remoteAddress, config, clock);
  }

  private byte[] getOrCreateMessageKey(SenderKeyRecord record, int index)
      throws DuplicateMessageException, InvalidMessageException {
    SkippedKeyCache<Integer> cache = record.getSkippedKeys();
    byte[] skipped = cache.remove(index);
    if (skipped != null) {
      return skipped;
    }

    ChainKey start = record.getChainKey();
    if (index < start.getIndex()) {
      throw new DuplicateMessageException(
          "received message with old counter: " + start.getIndex() + " , " + index);
    }
    int gap = index - start.getIndex();
    if (gap > config.getMaxForwardGap()) {
      throw new InvalidMessageException(
          ErrorCode.GAP_OVERFLOW, "index gap " + gap + " exceeds " + config.getMaxForwardGap());
    }
    if (!cache.hasRoomFor(gap)) {
      throw new InvalidMessageException(
          ErrorCode.CACHE_OVERFLOW, "skipped key cache cannot hold " + gap + " more keys");
    }

    ChainKey current = start;
    while (current.getIndex() < index) {
      MessageKeys messageKeys = current.getMessageKeys();
      cache.put(messageKeys.getCounter(), messageKeys.getCipherKey());
      ByteUtil.erase(messageKeys.getCipherKey());
      ChainKey next = current.getNextChainKey();
      if (current != start) {
        current.erase();
      }
      current = next;
    }

    MessageKeys messageKeys = current.getMessageKeys();
    ChainKey next = current.getNextChainKey();
    if (current != start) {
      current.erase();
    }
    record.setChainKey(next);
    return messageKeys.getCipherKey();
  }

  private EpochAuthenticityRecord sign(EpochAuthenticityRecord record) {
    return record.withSignature(
        keyStore.getLocalAddress(), keyStore.signWithDeviceKey(record.getHash()));
  }

  private static void requireShape(EpochAuthenticityRecord record)
      throws EpochIntegrityException {
    if (record.getAdmins().isEmpty()) {
      throw new EpochIntegrityException(
          ErrorCode.MEMBERSHIP_MISMATCH, "epoch " + record.getEpoch() + " has no admins");
    }
    if (!record.getMembers().containsAll(record.getAdmins())) {
      throw new EpochIntegrityException(
          ErrorCode.MEMBERSHIP_MISMATCH,
          "admins of epoch " + record.getEpoch() + " are not all members");
    }
  }

  private void verifySignatures(
      EpochAuthenticityRecord record, Set<DeviceAddress> authorizedAdmins)
      throws EpochIntegrityException {
    Map<DeviceAddress, byte[]> signatures = record.getSignatures();
    if (signatures.isEmpty()) {
      throw new EpochIntegrityException(
          ErrorCode.MISSING_ADMIN_SIGNATURE, "epoch " + record.getEpoch() + " is unsigned");
    }
    if (!signatures.containsKey(record.getIssuedBy())) {
      throw new EpochIntegrityException(
          ErrorCode.MISSING_ADMIN_SIGNATURE,
          "issuer " + record.getIssuedBy() + " did not sign epoch " + record.getEpoch());
    }

    TrustView view = directory.getCurrentView();
    byte[] hash = record.getHash();
    for (Map.Entry<DeviceAddress, byte[]> signature : signatures.entrySet()) {
      DeviceAddress signer = signature.getKey();
      if (!authorizedAdmins.contains(signer)) {
        throw new EpochIntegrityException(
            ErrorCode.INVALID_ADMIN_SIGNATURE, signer + " may not sign epoch " + record.getEpoch());
      }
      DeviceRecord device = view.getDevice(signer);
      if (device == null || !device.isActive()) {
        throw new EpochIntegrityException(
            ErrorCode.INVALID_ADMIN_SIGNATURE, "signer " + signer + " is not an active device");
      }
      if (!device.getSigningKey().verifySignature(hash, signature.getValue())) {
        throw new EpochIntegrityException(
            ErrorCode.INVALID_ADMIN_SIGNATURE, "bad signature from " + signer);
      }
    }
  }

  private void requireMembers(GroupEpochState epoch, DeviceAddress sender)
      throws EpochIntegrityException {
    if (!epoch.isMember(sender)) {
      throw new EpochIntegrityException(ErrorCode.NOT_A_MEMBER, sender + " is not in " + epoch);
    }
    DeviceAddress localAddress = keyStore.getLocalAddress();
    if (!epoch.isMember(localAddress)) {
      throw new EpochIntegrityException(
          ErrorCode.NOT_A_MEMBER, localAddress + " is not in " + epoch);
    }
  }

  private GroupEpochState resolveEpoch(GroupContext context, long epoch)
      throws EpochIntegrityException {
    long current = context.tip.getEpoch();
    if (epoch > current) {
      throw new EpochIntegrityException(
          ErrorCode.UNKNOWN_EPOCH, "epoch " + epoch + " is ahead of " + context.tip);
    }
    if (epoch < current - config.getRetainedEpochs()) {
      throw new EpochIntegrityException(
          ErrorCode.STALE_EPOCH, "epoch " + epoch + " is no longer retained");
    }
    GroupEpochState state = context.ancestorAt(epoch);
    if (state == null) {
      throw new EpochIntegrityException(
          ErrorCode.UNKNOWN_EPOCH, "epoch " + epoch + " predates local history");
    }
    return state;
  }

  private GroupContext requireGroup(String groupId) throws EpochIntegrityException {
    GroupContext context = groups.get(groupId);
    if (context == null) {
      throw new EpochIntegrityException(ErrorCode.UNKNOWN_GROUP, "unknown group " + groupId);
    }
    return context;
  }

  private GroupContext requireActive(String groupId) throws EpochIntegrityException {
    GroupContext context = requireGroup(groupId);
    if (context.status == GroupStatus.FORKED) {
      throw new EpochForkException(groupId);
    }
    return context;
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  private enum ResetOrder {
    SAME,
    OLDER,
    NEWER
  }

  /** Everything known locally about one group. */
  private static final class GroupContext {
    private final String groupId;
    private final Map<String, GroupEpochState> known = new HashMap<>();
    private final Map<String, Long> discarded = new HashMap<>();
    private final Map<String, Long> acceptedMessages = new HashMap<>();
    private GroupEpochState tip;
    private GroupStatus status = GroupStatus.ACTIVE;
    private GroupEpochState forkParent;
    private long resetEpoch;
    private byte[] resetWinner;

    GroupContext(String groupId) {
      this.groupId = groupId;
    }

    GroupEpochState add(EpochAuthenticityRecord record) {
      GroupEpochState state = new GroupEpochState(record);
      known.put(state.getHashHex(), state);
      return state;
    }

    GroupEpochState findSibling(GroupEpochState candidate) {
      for (GroupEpochState state : known.values()) {
        if (state.getEpoch() == candidate.getEpoch()
            && state.getPreviousHashHex().equals(candidate.getPreviousHashHex())
            && !state.getHashHex().equals(candidate.getHashHex())) {
          return state;
        }
      }
      return null;
    }

    List<GroupEpochState> childrenOf(GroupEpochState parent) {
      List<GroupEpochState> children = new ArrayList<>();
      for (GroupEpochState state : known.values()) {
        if (state.getPreviousHashHex().equals(parent.getHashHex())) {
          children.add(state);
        }
      }
      return children;
    }

    /** The shallowest record at or below {@code root} with more than one known child. */
    GroupEpochState findForkPoint(GroupEpochState root) {
      GroupEpochState forkPoint = null;
      for (GroupEpochState state : known.values()) {
        if ((forkPoint == null || state.getEpoch() < forkPoint.getEpoch())
            && descendsFrom(state, root)
            && childrenOf(state).size() > 1) {
          forkPoint = state;
        }
      }
      return forkPoint;
    }

    /** The record for {@code epoch} on the path from the oldest kept record to the tip. */
    GroupEpochState ancestorAt(long epoch) {
      GroupEpochState current = tip;
      while (current != null && current.getEpoch() > epoch) {
        current = known.get(current.getPreviousHashHex());
      }
      return current != null && current.getEpoch() == epoch ? current : null;
    }

    boolean descendsFrom(GroupEpochState state, GroupEpochState root) {
      GroupEpochState current = state;
      while (current != null && current.getEpoch() > root.getEpoch()) {
        current = known.get(current.getPreviousHashHex());
      }
      return current != null && current.getHashHex().equals(root.getHashHex());
    }

    long branchDepth(GroupEpochState root) {
      long depth = root.getDepth();
      for (GroupEpochState state : known.values()) {
        if (state.getDepth() > depth && descendsFrom(state, root)) {
          depth = state.getDepth();
        }
      }
      return depth;
    }

    /** The deepest record extending {@code root}; equal depths resolve to the smaller hash. */
    GroupEpochState deepestDescendant(GroupEpochState root) {
      GroupEpochState best = root;
      for (GroupEpochState state : known.values()) {
        if (!descendsFrom(state, root)) {
          continue;
        }
        if (state.getDepth() > best.getDepth()
            || (state.getDepth() == best.getDepth()
                && ByteUtil.compareUnsigned(state.getHash(), best.getHash()) < 0)) {
          best = state;
        }
      }
      return best;
    }

    /** Forgets {@code root} and everything extending it; returns the messages accepted there. */
    long discardBranch(GroupEpochState root) {
      List<GroupEpochState> branch = new ArrayList<>();
      for (GroupEpochState state : known.values()) {
        if (descendsFrom(state, root)) {
          branch.add(state);
        }
      }
      long accepted = 0;
      for (GroupEpochState state : branch) {
        known.remove(state.getHashHex());
        discarded.put(state.getHashHex(), state.getEpoch());
        Long count = acceptedMessages.remove(state.getHashHex());
        if (count != null) {
          accepted += count;
        }
      }
      return accepted;
    }

    /** Drops everything older than {@code horizon} except the tip. */
    void forgetBefore(long horizon) {
      Iterator<GroupEpochState> states = known.values().iterator();
      while (states.hasNext()) {
        GroupEpochState state = states.next();
        if (state.getEpoch() < horizon && state != tip) {
          states.remove();
          acceptedMessages.remove(state.getHashHex());
        }
      }
      discarded.values().removeIf(epoch -> epoch < horizon);
    }

    void recordAccepted(GroupEpochState state) {
      acceptedMessages.merge(state.getHashHex(), 1L, Long::sum);
    }

    /** Places the fork resolution a distribution was issued under relative to the local one. */
    ResetOrder compareReset(SenderKeyDistributionMessage distribution) {
      byte[] theirs = distribution.getResetWinner();
      if (Arrays.equals(theirs, resetWinner)) {
        return ResetOrder.SAME;
      }
      if (theirs == null || discarded.containsKey(Hex.toStringCondensed(theirs))) {
        return ResetOrder.OLDER;
      }
      if (resetWinner == null || distribution.getResetEpoch() >= resetEpoch) {
        return ResetOrder.NEWER;
      }
      return ResetOrder.OLDER;
    }
  }
}
