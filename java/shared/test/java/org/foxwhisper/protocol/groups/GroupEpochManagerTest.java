//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.DuplicateMessageException;
import org.foxwhisper.protocol.EpochForkException;
import org.foxwhisper.protocol.EpochIntegrityException;
import org.foxwhisper.protocol.ErrorCode;
import org.foxwhisper.protocol.InvalidMessageException;
import org.foxwhisper.protocol.NoSessionException;
import org.foxwhisper.protocol.ProtocolException;
import org.foxwhisper.protocol.ProtocolTimeoutException;
import org.foxwhisper.protocol.RevokedDeviceException;
import org.foxwhisper.protocol.SenderKeyPoisoningException;
import org.foxwhisper.protocol.TestDevice;
import org.foxwhisper.protocol.config.ProtocolConfig;
import org.foxwhisper.protocol.message.EncryptedMessage;
import org.foxwhisper.protocol.message.EpochAuthenticityRecord;
import org.foxwhisper.protocol.message.GroupMessage;
import org.foxwhisper.protocol.message.SenderKeyDistributionMessage;
import org.foxwhisper.protocol.state.DeviceDirectory;
import org.foxwhisper.protocol.util.ByteUtil;
import org.foxwhisper.protocol.util.TestLogger;
import org.junit.Before;
import org.junit.ClassRule;
import org.junit.Test;

public class GroupEpochManagerTest {
  @ClassRule public static final TestLogger logger = new TestLogger();

  private static final String GROUP = "book-club";
  private static final ProtocolConfig CONFIG =
      ProtocolConfig.newBuilder().setEpochTransitionTimeout(Duration.ofMillis(200)).build();

  private final DeviceDirectory directory = new DeviceDirectory();
  private final GroupMember alice = new GroupMember("alice", directory, CONFIG);
  private final GroupMember bob = new GroupMember("bob", directory, CONFIG);
  private final GroupMember carol = new GroupMember("carol", directory, CONFIG);

  @Before
  public void connectMembers() throws Exception {
    TestDevice.establish(alice.getDevice(), bob.getDevice());
    TestDevice.establish(alice.getDevice(), carol.getDevice());
    TestDevice.establish(bob.getDevice(), carol.getDevice());
  }

  @Test
  public void membersExchangeMessages() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);

    GroupMessage message = alice.getManager().encrypt(GROUP, bytes("hello group"));
    assertEquals(0, message.getEpoch());
    assertEquals("hello group", decrypt(bob, message));
    assertEquals("hello group", decrypt(carol, GroupMessage.deserialize(message.serialize())));

    GroupMessage reply = carol.getManager().encrypt(GROUP, bytes("hi alice"));
    assertEquals("hi alice", decrypt(alice, reply));
    assertEquals("hi alice", decrypt(bob, reply));
  }

  @Test
  public void outOfOrderAndDuplicateGroupMessages() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);

    List<GroupMessage> inflight = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      inflight.add(alice.getManager().encrypt(GROUP, bytes("message " + i)));
    }

    assertEquals("message 3", decrypt(bob, inflight.get(3)));
    assertEquals("message 1", decrypt(bob, inflight.get(1)));
    GroupEpochManager manager = bob.getManager();
    assertThrows(DuplicateMessageException.class, () -> manager.decrypt(inflight.get(3)));
    assertThrows(DuplicateMessageException.class, () -> manager.decrypt(inflight.get(1)));
    assertEquals("message 0", decrypt(bob, inflight.get(0)));
  }

  @Test
  public void tamperedGroupMessageLeavesKeyUsable() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    GroupMessage message = alice.getManager().encrypt(GROUP, bytes("untouched"));

    byte[] ciphertext = message.getCiphertext().clone();
    ciphertext[0] ^= 0x01;
    GroupMessage tampered =
        new GroupMessage(
            message.getGroupId(),
            message.getEpoch(),
            message.getSender(),
            message.getIndex(),
            message.getTimestamp(),
            message.getIv(),
            ciphertext,
            message.getTag());

    InvalidMessageException e =
        assertThrows(InvalidMessageException.class, () -> bob.getManager().decrypt(tampered));
    assertEquals(ErrorCode.DECRYPTION_FAILED, e.getCode());
    assertEquals("untouched", decrypt(bob, message));
  }

  @Test
  public void removedMemberCannotReadNewEpoch() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    GroupMessage beforeRemoval = alice.getManager().encrypt(GROUP, bytes("still epoch 0"));

    EpochAuthenticityRecord withoutCarol =
        alice.getManager().proposeTransition(GROUP, addresses(alice, bob), addresses(alice));
    List<EpochUpdate> updates = applyAll(withoutCarol, alice, bob, carol);
    assertEquals(EpochUpdate.Outcome.ACCEPTED, updates.get(2).getOutcome());
    assertTrue(updates.get(2).getDistributions().isEmpty());
    assertTrue(updates.get(0).getDistributions().containsKey(bob.getAddress()));
    assertFalse(updates.get(0).getDistributions().containsKey(carol.getAddress()));
    deliverAll(updates, alice, bob, carol);

    GroupMessage afterRemoval = alice.getManager().encrypt(GROUP, bytes("epoch 1"));
    assertEquals(1, afterRemoval.getEpoch());
    assertEquals("epoch 1", decrypt(bob, afterRemoval));

    EpochIntegrityException e =
        assertThrows(
            EpochIntegrityException.class, () -> carol.getManager().decrypt(afterRemoval));
    assertThat(e.getCode(), is(ErrorCode.NOT_A_MEMBER));
    assertThrows(
        EpochIntegrityException.class,
        () -> carol.getManager().encrypt(GROUP, bytes("let me in")));

    assertEquals("still epoch 0", decrypt(bob, beforeRemoval));
  }

  @Test
  public void addedMemberCannotReadEarlierEpoch() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    GroupMessage earlier = alice.getManager().encrypt(GROUP, bytes("before dave"));

    GroupMember dave = new GroupMember("dave", directory, CONFIG);
    TestDevice.establish(alice.getDevice(), dave.getDevice());
    TestDevice.establish(bob.getDevice(), dave.getDevice());
    TestDevice.establish(carol.getDevice(), dave.getDevice());

    EpochAuthenticityRecord withDave =
        alice
            .getManager()
            .proposeTransition(GROUP, addresses(alice, bob, carol, dave), addresses(alice));
    List<EpochUpdate> updates = applyAll(withDave, alice, bob, carol);
    updates.add(dave.getManager().joinGroup(withDave));
    deliverAll(updates, alice, bob, carol, dave);

    GroupMessage later = alice.getManager().encrypt(GROUP, bytes("welcome dave"));
    assertEquals("welcome dave", decrypt(dave, later));
    assertEquals("welcome dave", decrypt(carol, later));

    EpochIntegrityException e =
        assertThrows(EpochIntegrityException.class, () -> dave.getManager().decrypt(earlier));
    assertThat(e.getCode(), is(ErrorCode.UNKNOWN_EPOCH));
  }

  @Test
  public void epochsOutsideRetentionAreStale() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    GroupMessage epochZero = alice.getManager().encrypt(GROUP, bytes("epoch 0"));

    advance(alice, addresses(alice, bob, carol), alice, bob, carol);
    advance(alice, addresses(alice, bob, carol), alice, bob, carol);
    assertEquals(2, bob.getManager().getCurrentEpoch(GROUP).getEpoch());

    EpochIntegrityException e =
        assertThrows(EpochIntegrityException.class, () -> bob.getManager().decrypt(epochZero));
    assertThat(e.getCode(), is(ErrorCode.STALE_EPOCH));
  }

  @Test
  public void conflictingSenderKeyAtEpochThreeIsRejected() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    for (int i = 0; i < 3; i++) {
      advance(alice, addresses(alice, bob, carol), alice, bob, carol);
    }
    GroupEpochState epochThree = bob.getManager().getCurrentEpoch(GROUP);
    assertEquals(3, epochThree.getEpoch());

    byte[] forgedRoot = new byte[SenderKeyDistributionMessage.CHAIN_ROOT_LENGTH];
    new SecureRandom().nextBytes(forgedRoot);
    SenderKeyDistributionMessage forged =
        new SenderKeyDistributionMessage(
            GROUP, 3, epochThree.getHash(), alice.getAddress(), forgedRoot);
    EncryptedMessage delivery =
        alice.getDevice().sessionWith(bob.getDevice()).encrypt(forged.serialize());

    SenderKeyPoisoningException e =
        assertThrows(
            SenderKeyPoisoningException.class,
            () -> bob.getManager().processDistribution(delivery));
    assertThat(e.getCode(), is(ErrorCode.SENDER_KEY_POISONING));
    assertEquals(alice.getAddress(), e.getSender());

    GroupMessage genuine = alice.getManager().encrypt(GROUP, bytes("real key"));
    assertEquals("real key", decrypt(bob, genuine));
  }

  @Test
  public void repeatedDistributionIsIgnored() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    EncryptedMessage again = alice.getManager().distributeTo(GROUP, bob.getAddress());
    bob.getManager().processDistribution(again);

    assertEquals("same key", decrypt(bob, alice.getManager().encrypt(GROUP, bytes("same key"))));
  }

  @Test
  public void distributionNamingTheWrongEpochIsRejected() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    byte[] genesisHash = bob.getManager().getCurrentEpoch(GROUP).getHash();
    SenderKeyDistributionMessage mislabeled =
        new SenderKeyDistributionMessage(GROUP, 1, genesisHash, alice.getAddress(), new byte[32]);
    EncryptedMessage delivery =
        alice.getDevice().sessionWith(bob.getDevice()).encrypt(mislabeled.serialize());

    assertCode(ErrorCode.UNKNOWN_EPOCH, () -> bob.getManager().processDistribution(delivery));
  }

  @Test
  public void distributionArrivingBeforeItsRecordIsHeld() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    EpochAuthenticityRecord next =
        alice.getManager().proposeTransition(GROUP, addresses(alice, bob, carol), addresses(alice));
    EpochUpdate aliceUpdate = alice.getManager().applyEpochRecord(next);

    EncryptedMessage early = aliceUpdate.getDistributions().get(bob.getAddress());
    assertFalse(bob.getManager().processDistribution(early));
    assertEquals(0, bob.getManager().getCurrentEpoch(GROUP).getEpoch());

    bob.getManager().applyEpochRecord(next);
    GroupMessage message = alice.getManager().encrypt(GROUP, bytes("epoch 1"));
    assertEquals(1, message.getEpoch());
    assertEquals("epoch 1", decrypt(bob, message));
  }

  @Test
  public void distributionForGroupNotYetJoinedIsHeld() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    GroupMember dave = new GroupMember("dave", directory, CONFIG);
    TestDevice.establish(alice.getDevice(), dave.getDevice());

    EpochAuthenticityRecord withDave =
        alice
            .getManager()
            .proposeTransition(GROUP, addresses(alice, bob, carol, dave), addresses(alice));
    EpochUpdate aliceUpdate = alice.getManager().applyEpochRecord(withDave);
    EncryptedMessage early = aliceUpdate.getDistributions().get(dave.getAddress());
    assertFalse(dave.getManager().processDistribution(early));

    dave.getManager().joinGroup(withDave);
    assertEquals("hi dave", decrypt(dave, alice.getManager().encrypt(GROUP, bytes("hi dave"))));
  }

  @Test
  public void heldDistributionsAreBounded() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    EpochAuthenticityRecord next =
        alice.getManager().proposeTransition(GROUP, addresses(alice, bob, carol), addresses(alice));
    EpochUpdate aliceUpdate = alice.getManager().applyEpochRecord(next);
    assertFalse(
        bob.getManager().processDistribution(aliceUpdate.getDistributions().get(bob.getAddress())));

    SecureRandom random = new SecureRandom();
    for (int i = 0; i < GroupEpochManager.MAX_HELD_DISTRIBUTIONS; i++) {
      byte[] unknownHash = new byte[32];
      random.nextBytes(unknownHash);
      SenderKeyDistributionMessage filler =
          new SenderKeyDistributionMessage(
              GROUP, 1, unknownHash, alice.getAddress(), new byte[32]);
      assertFalse(
          bob.getManager()
              .processDistribution(
                  alice.getDevice().sessionWith(bob.getDevice()).encrypt(filler.serialize())));
    }

    bob.getManager().applyEpochRecord(next);
    GroupMessage message = alice.getManager().encrypt(GROUP, bytes("evicted"));
    assertThrows(NoSessionException.class, () -> bob.getManager().decrypt(message));
  }

  @Test
  public void revokedSenderIsRejected() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    GroupMessage fromBob = bob.getManager().encrypt(GROUP, bytes("before revocation"));

    directory.revoke(bob.getAddress());

    assertThrows(RevokedDeviceException.class, () -> alice.getManager().decrypt(fromBob));
    assertEquals(null, alice.getSenderKeyStore().loadSenderKey(GROUP, 0, bob.getAddress()));
  }

  @Test
  public void onlyAdminsMayTransition() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);

    EpochIntegrityException e =
        assertThrows(
            EpochIntegrityException.class,
            () ->
                bob.getManager()
                    .proposeTransition(GROUP, addresses(alice, bob), addresses(alice)));
    assertThat(e.getCode(), is(ErrorCode.NOT_AN_ADMIN));

    EpochAuthenticityRecord tip = bob.getManager().getCurrentEpoch(GROUP).getRecord();
    EpochAuthenticityRecord selfPromotion =
        sign(
            bob,
            new EpochAuthenticityRecord(
                GROUP,
                1,
                tip.getHash(),
                addresses(alice, bob, carol),
                addresses(bob),
                bob.getAddress(),
                System.currentTimeMillis(),
                Collections.<DeviceAddress, byte[]>emptyMap()));
    e =
        assertThrows(
            EpochIntegrityException.class,
            () -> carol.getManager().applyEpochRecord(selfPromotion));
    assertThat(e.getCode(), is(ErrorCode.INVALID_ADMIN_SIGNATURE));
  }

  @Test
  public void malformedChainsAreRejected() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    byte[] genesisHash = bob.getManager().getCurrentEpoch(GROUP).getHash();

    EpochAuthenticityRecord orphan =
        sign(alice, record(alice, 1, new byte[32], addresses(alice, bob, carol), addresses(alice)));
    assertCode(ErrorCode.HASH_CHAIN_BREAK, () -> bob.getManager().applyEpochRecord(orphan));

    EpochAuthenticityRecord skipping =
        sign(alice, record(alice, 2, genesisHash, addresses(alice, bob, carol), addresses(alice)));
    assertCode(ErrorCode.STALE_EPOCH_REF, () -> bob.getManager().applyEpochRecord(skipping));

    EpochAuthenticityRecord unsigned =
        record(alice, 1, genesisHash, addresses(alice, bob, carol), addresses(alice));
    assertCode(
        ErrorCode.MISSING_ADMIN_SIGNATURE, () -> bob.getManager().applyEpochRecord(unsigned));

    EpochAuthenticityRecord adminOutside =
        sign(alice, record(alice, 1, genesisHash, addresses(bob, carol), addresses(alice)));
    assertCode(
        ErrorCode.MEMBERSHIP_MISMATCH, () -> bob.getManager().applyEpochRecord(adminOutside));

    assertEquals(0, bob.getManager().getCurrentEpoch(GROUP).getEpoch());
    assertEquals(GroupStatus.ACTIVE, bob.getManager().getStatus(GROUP));
  }

  @Test
  public void joinRequiresSelfListedAdminSignature() throws Exception {
    EpochAuthenticityRecord invitation =
        sign(
            carol,
            new EpochAuthenticityRecord(
                "other-group",
                4,
                new byte[32],
                addresses(alice, bob, carol),
                addresses(alice),
                carol.getAddress(),
                System.currentTimeMillis(),
                Collections.<DeviceAddress, byte[]>emptyMap()));

    assertCode(ErrorCode.INVALID_ADMIN_SIGNATURE, () -> bob.getManager().joinGroup(invitation));
    assertFalse(bob.getManager().isKnownGroup("other-group"));
  }

  @Test
  public void unknownGroupIsReported() {
    assertCode(ErrorCode.UNKNOWN_GROUP, () -> alice.getManager().encrypt("nope", bytes("x")));
  }

  @Test
  public void forkIsDetectedAndReconciledIdentically() throws Exception {
    createGroup(addresses(alice, bob), alice, bob, carol);

    EpochAuthenticityRecord keepCarol =
        alice
            .getManager()
            .proposeTransition(GROUP, addresses(alice, bob, carol), addresses(alice, bob));
    EpochAuthenticityRecord dropCarol =
        bob.getManager().proposeTransition(GROUP, addresses(alice, bob), addresses(alice, bob));

    // carol reads one message on the keepCarol branch before the fork shows up
    EpochUpdate aliceFirst = alice.getManager().applyEpochRecord(keepCarol);
    carol.getManager().applyEpochRecord(keepCarol);
    carol.receive(aliceFirst.getDistributions());
    decrypt(carol, alice.getManager().encrypt(GROUP, bytes("on keepCarol")));

    assertEquals(
        EpochUpdate.Outcome.FORK_DETECTED,
        alice.getManager().applyEpochRecord(dropCarol).getOutcome());
    bob.getManager().applyEpochRecord(dropCarol);
    assertEquals(
        EpochUpdate.Outcome.FORK_DETECTED,
        bob.getManager().applyEpochRecord(keepCarol).getOutcome());
    assertEquals(
        EpochUpdate.Outcome.FORK_DETECTED,
        carol.getManager().applyEpochRecord(dropCarol).getOutcome());

    assertEquals(GroupStatus.FORKED, carol.getManager().getStatus(GROUP));
    assertThrows(
        EpochForkException.class, () -> alice.getManager().encrypt(GROUP, bytes("blocked")));

    ReconciliationResult aliceResult = alice.getManager().reconcile(GROUP);
    ReconciliationResult bobResult = bob.getManager().reconcile(GROUP);
    ReconciliationResult carolResult = carol.getManager().reconcile(GROUP);

    boolean keepCarolWins = ByteUtil.compareUnsigned(keepCarol.getHash(), dropCarol.getHash()) < 0;
    EpochAuthenticityRecord expected = keepCarolWins ? keepCarol : dropCarol;
    for (ReconciliationResult result : Arrays.asList(aliceResult, bobResult, carolResult)) {
      assertEquals(expected.getHashHex(), result.getWinner().getHashHex());
      assertTrue(result.requires(HealingAction.resetSenderChains()));
      assertTrue(result.requires(HealingAction.requestFullResync()));
    }
    assertEquals(keepCarolWins ? 0 : 1, carolResult.getMessagesAcceptedOnLosingBranch());
    for (GroupMember member : Arrays.asList(alice, bob, carol)) {
      assertEquals(expected.getHashHex(), member.getManager().getCurrentEpoch(GROUP).getHashHex());
      assertEquals(GroupStatus.ACTIVE, member.getManager().getStatus(GROUP));
    }

    List<ReconciliationResult> results = Arrays.asList(aliceResult, bobResult, carolResult);
    for (GroupMember member : Arrays.asList(alice, bob, carol)) {
      for (ReconciliationResult result : results) {
        member.receive(result.getDistributions());
      }
    }
    GroupMessage afterHeal = bob.getManager().encrypt(GROUP, bytes("healed"));
    assertEquals("healed", decrypt(alice, afterHeal));
    if (keepCarolWins) {
      assertEquals("healed", decrypt(carol, afterHeal));
    }

    EpochAuthenticityRecord loser = keepCarolWins ? dropCarol : keepCarol;
    GroupMember loserIssuer = keepCarolWins ? bob : alice;
    EpochAuthenticityRecord onLosingBranch =
        sign(
            loserIssuer,
            record(loserIssuer, 2, loser.getHash(), loser.getMembers(), loser.getAdmins()));
    assertEquals(
        EpochUpdate.Outcome.DISCARDED,
        alice.getManager().applyEpochRecord(onLosingBranch).getOutcome());
    assertEquals(expected.getHashHex(), alice.getManager().getCurrentEpoch(GROUP).getHashHex());

    // only records removed by reconcile are remembered, not what grows from them later
    EpochAuthenticityRecord beyondLosingBranch =
        sign(
            loserIssuer,
            record(
                loserIssuer, 3, onLosingBranch.getHash(), loser.getMembers(), loser.getAdmins()));
    assertCode(
        ErrorCode.HASH_CHAIN_BREAK,
        () -> alice.getManager().applyEpochRecord(beyondLosingBranch));
  }

  @Test
  public void senderKeysCrossingAForkSurviveReconcile() throws Exception {
    createGroup(addresses(alice, bob), alice, bob, carol);
    EpochAuthenticityRecord first =
        alice
            .getManager()
            .proposeTransition(GROUP, addresses(alice, bob, carol), addresses(alice, bob));
    EpochAuthenticityRecord second =
        bob.getManager().proposeTransition(GROUP, addresses(alice, bob), addresses(alice, bob));

    EpochUpdate aliceAccepted = alice.getManager().applyEpochRecord(first);
    alice.getManager().applyEpochRecord(second);
    bob.getManager().applyEpochRecord(second);
    bob.getManager().applyEpochRecord(first);
    assertEquals(GroupStatus.FORKED, bob.getManager().getStatus(GROUP));

    // issued before alice resolved the fork, then again after
    EncryptedMessage beforeReset = aliceAccepted.getDistributions().get(bob.getAddress());
    assertFalse(bob.getManager().processDistribution(beforeReset));
    ReconciliationResult aliceResult = alice.getManager().reconcile(GROUP);
    EncryptedMessage afterReset = aliceResult.getDistributions().get(bob.getAddress());
    assertFalse(bob.getManager().processDistribution(afterReset));

    ReconciliationResult bobResult = bob.getManager().reconcile(GROUP);
    assertEquals(aliceResult.getWinner().getHashHex(), bobResult.getWinner().getHashHex());
    alice.receive(bobResult.getDistributions());

    GroupMessage fromAlice = alice.getManager().encrypt(GROUP, bytes("after the fork"));
    assertEquals("after the fork", decrypt(bob, fromAlice));
    GroupMessage fromBob = bob.getManager().encrypt(GROUP, bytes("agreed"));
    assertEquals("agreed", decrypt(alice, fromBob));
  }

  @Test
  public void threeWayForkConvergesWhateverTheArrivalOrder() throws Exception {
    createGroup(addresses(alice, bob), alice, bob, carol);
    byte[] genesisHash = alice.getManager().getCurrentEpoch(GROUP).getHash();
    EpochAuthenticityRecord r1 =
        alice
            .getManager()
            .proposeTransition(GROUP, addresses(alice, bob, carol), addresses(alice, bob));
    EpochAuthenticityRecord r2 =
        bob.getManager().proposeTransition(GROUP, addresses(alice, bob), addresses(alice, bob));
    EpochAuthenticityRecord r3 =
        sign(alice, record(alice, 1, genesisHash, addresses(alice, bob, carol), addresses(alice)));
    EpochAuthenticityRecord r3Child =
        sign(alice, record(alice, 2, r3.getHash(), addresses(alice, bob, carol), addresses(alice)));

    for (EpochAuthenticityRecord record : Arrays.asList(r1, r2, r3, r3Child)) {
      bob.getManager().applyEpochRecord(record);
    }
    for (EpochAuthenticityRecord record : Arrays.asList(r3, r3Child, r1, r2)) {
      carol.getManager().applyEpochRecord(record);
    }
    ReconciliationResult bobResult = bob.getManager().reconcile(GROUP);
    ReconciliationResult carolResult = carol.getManager().reconcile(GROUP);

    for (ReconciliationResult result : Arrays.asList(bobResult, carolResult)) {
      assertEquals(r3.getHashHex(), result.getWinner().getHashHex());
      assertEquals(2, result.getLosers().size());
    }
    assertEquals(bobResult.getHealingActions(), carolResult.getHealingActions());
    for (GroupMember member : Arrays.asList(bob, carol)) {
      assertEquals(r3Child.getHashHex(), member.getManager().getCurrentEpoch(GROUP).getHashHex());
      assertEquals(GroupStatus.ACTIVE, member.getManager().getStatus(GROUP));
    }
  }

  @Test
  public void forkInsideTheWinningBranchNeedsAnotherReconcile() throws Exception {
    createGroup(addresses(alice, bob), alice, bob, carol);
    EpochAuthenticityRecord r1 =
        alice
            .getManager()
            .proposeTransition(GROUP, addresses(alice, bob, carol), addresses(alice, bob));
    EpochAuthenticityRecord r2 =
        bob.getManager().proposeTransition(GROUP, addresses(alice, bob), addresses(alice, bob));
    EpochAuthenticityRecord left =
        sign(bob, record(bob, 2, r2.getHash(), addresses(alice, bob), addresses(alice, bob)));
    EpochAuthenticityRecord right =
        sign(alice, record(alice, 2, r2.getHash(), addresses(alice, bob), addresses(alice, bob)));
    for (EpochAuthenticityRecord record : Arrays.asList(r1, r2, left, right)) {
      carol.getManager().applyEpochRecord(record);
    }

    assertEquals(r2.getHashHex(), carol.getManager().reconcile(GROUP).getWinner().getHashHex());
    assertEquals(GroupStatus.FORKED, carol.getManager().getStatus(GROUP));

    EpochAuthenticityRecord expected =
        ByteUtil.compareUnsigned(left.getHash(), right.getHash()) < 0 ? left : right;
    assertEquals(
        expected.getHashHex(), carol.getManager().reconcile(GROUP).getWinner().getHashHex());
    assertEquals(GroupStatus.ACTIVE, carol.getManager().getStatus(GROUP));
    assertEquals(expected.getHashHex(), carol.getManager().getCurrentEpoch(GROUP).getHashHex());
  }

  @Test
  public void recordsBehindTheRetentionWindowAreForgotten() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    byte[] genesisHash = bob.getManager().getCurrentEpoch(GROUP).getHash();
    EpochAuthenticityRecord offGenesis =
        sign(alice, record(alice, 1, genesisHash, addresses(alice, bob), addresses(alice)));

    advance(alice, addresses(alice, bob, carol), alice, bob, carol);
    advance(alice, addresses(alice, bob, carol), alice, bob, carol);
    byte[] epochTwoHash = bob.getManager().getCurrentEpoch(GROUP).getHash();
    advance(alice, addresses(alice, bob, carol), alice, bob, carol);

    assertCode(ErrorCode.HASH_CHAIN_BREAK, () -> bob.getManager().applyEpochRecord(offGenesis));
    assertEquals(GroupStatus.ACTIVE, bob.getManager().getStatus(GROUP));

    EpochAuthenticityRecord offEpochTwo =
        sign(alice, record(alice, 3, epochTwoHash, addresses(alice, bob), addresses(alice)));
    assertEquals(
        EpochUpdate.Outcome.FORK_DETECTED,
        bob.getManager().applyEpochRecord(offEpochTwo).getOutcome());
  }

  @Test
  public void longerBranchWinsRegardlessOfHash() throws Exception {
    createGroup(addresses(alice, bob), alice, bob, carol);
    EpochAuthenticityRecord first =
        alice
            .getManager()
            .proposeTransition(GROUP, addresses(alice, bob, carol), addresses(alice, bob));
    EpochAuthenticityRecord second =
        bob.getManager().proposeTransition(GROUP, addresses(alice, bob), addresses(alice, bob));
    boolean firstSmaller = ByteUtil.compareUnsigned(first.getHash(), second.getHash()) < 0;
    EpochAuthenticityRecord larger = firstSmaller ? second : first;
    GroupMember largerIssuer = firstSmaller ? bob : alice;

    carol.getManager().applyEpochRecord(first);
    carol.getManager().applyEpochRecord(second);
    EpochAuthenticityRecord extension =
        sign(
            largerIssuer,
            record(largerIssuer, 2, larger.getHash(), larger.getMembers(), larger.getAdmins()));
    assertEquals(
        EpochUpdate.Outcome.RECORDED,
        carol.getManager().applyEpochRecord(extension).getOutcome());

    ReconciliationResult result = carol.getManager().reconcile(GROUP);
    assertEquals(larger.getHashHex(), result.getWinner().getHashHex());
    assertEquals(extension.getHashHex(), carol.getManager().getCurrentEpoch(GROUP).getHashHex());
  }

  @Test
  public void reconcileRequiresFork() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);
    assertThrows(IllegalStateException.class, () -> alice.getManager().reconcile(GROUP));
  }

  @Test
  public void asyncTransitionApplies() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);

    EpochUpdate update =
        alice
            .getManager()
            .transitionAsync(
                GROUP,
                addresses(alice, bob),
                addresses(alice),
                CompletableFuture::completedFuture)
            .get(5, TimeUnit.SECONDS);

    assertEquals(EpochUpdate.Outcome.ACCEPTED, update.getOutcome());
    assertEquals(1, alice.getManager().getCurrentEpoch(GROUP).getEpoch());
    assertThat(update.getDistributions().keySet(), contains(bob.getAddress()));
  }

  @Test
  public void asyncTransitionTimesOut() throws Exception {
    createGroup(addresses(alice), alice, bob, carol);

    CompletableFuture<EpochUpdate> result =
        alice
            .getManager()
            .transitionAsync(
                GROUP,
                addresses(alice, bob),
                addresses(alice),
                proposal -> new CompletableFuture<>());

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
    assertThat(e.getCause(), instanceOf(ProtocolTimeoutException.class));
    assertEquals(0, alice.getManager().getCurrentEpoch(GROUP).getEpoch());
  }

  @Test
  public void asyncTransitionOvertakenIsStale() throws Exception {
    createGroup(addresses(alice, bob), alice, bob, carol);
    EpochAuthenticityRecord competing =
        bob.getManager().proposeTransition(GROUP, addresses(alice, bob, carol), addresses(bob));

    CompletableFuture<EpochUpdate> result =
        alice
            .getManager()
            .transitionAsync(
                GROUP,
                addresses(alice, bob),
                addresses(alice),
                proposal -> {
                  try {
                    alice.getManager().applyEpochRecord(competing);
                  } catch (EpochIntegrityException e) {
                    return CompletableFuture.failedFuture(e);
                  }
                  return CompletableFuture.completedFuture(proposal);
                });

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
    assertThat(e.getCause(), instanceOf(EpochIntegrityException.class));
    assertEquals(ErrorCode.STALE_EPOCH, ((ProtocolException) e.getCause()).getCode());
    assertEquals(
        competing.getHashHex(), alice.getManager().getCurrentEpoch(GROUP).getHashHex());
  }

  @Test
  public void countersignedRecordCarriesBothSignatures() throws Exception {
    createGroup(addresses(alice, bob), alice, bob, carol);
    EpochAuthenticityRecord proposal =
        alice.getManager().proposeTransition(GROUP, addresses(alice, bob), addresses(alice, bob));
    EpochAuthenticityRecord countersigned = bob.getManager().countersign(proposal);

    assertThat(countersigned.getSignatures().keySet(), hasItem(bob.getAddress()));
    assertEquals(2, countersigned.getSignatures().size());
    assertArrayEquals(proposal.getHash(), countersigned.getHash());
    assertEquals(
        EpochUpdate.Outcome.ACCEPTED,
        carol.getManager().applyEpochRecord(countersigned).getOutcome());
    assertEquals(
        EpochUpdate.Outcome.DUPLICATE,
        carol.getManager().applyEpochRecord(proposal).getOutcome());
  }

  /** Creates the group on alice, has everyone else join, and delivers every sender key. */
  private void createGroup(Collection<DeviceAddress> admins, GroupMember... everyone)
      throws Exception {
    GroupMember[] others = Arrays.copyOfRange(everyone, 1, everyone.length);
    EpochUpdate genesis =
        everyone[0].getManager().createGroup(GROUP, addresses(everyone), admins);
    List<EpochUpdate> updates = new ArrayList<>();
    updates.add(genesis);
    for (GroupMember member : others) {
      updates.add(member.getManager().joinGroup(genesis.getState().getRecord()));
    }
    deliverAll(updates, everyone);
  }

  private static void advance(
      GroupMember proposer, List<DeviceAddress> members, GroupMember... everyone)
      throws Exception {
    EpochAuthenticityRecord next =
        proposer
            .getManager()
            .proposeTransition(GROUP, members, Collections.singletonList(proposer.getAddress()));
    deliverAll(applyAll(next, everyone), everyone);
  }

  private static List<EpochUpdate> applyAll(
      EpochAuthenticityRecord record, GroupMember... everyone) throws Exception {
    List<EpochUpdate> updates = new ArrayList<>();
    for (GroupMember member : everyone) {
      updates.add(member.getManager().applyEpochRecord(record));
    }
    return updates;
  }

  private static void deliverAll(List<EpochUpdate> updates, GroupMember... everyone)
      throws Exception {
    for (EpochUpdate update : updates) {
      for (GroupMember member : everyone) {
        member.receive(update.getDistributions());
      }
    }
  }

  private static EpochAuthenticityRecord record(
      GroupMember issuer,
      long epoch,
      byte[] previousHash,
      Collection<DeviceAddress> members,
      Collection<DeviceAddress> admins) {
    return new EpochAuthenticityRecord(
        GROUP,
        epoch,
        previousHash,
        members,
        admins,
        issuer.getAddress(),
        System.currentTimeMillis(),
        Collections.<DeviceAddress, byte[]>emptyMap());
  }

  private static EpochAuthenticityRecord sign(
      GroupMember signer, EpochAuthenticityRecord record) {
    return record.withSignature(
        signer.getAddress(),
        signer.getDevice().getKeyStore().signWithDeviceKey(record.getHash()));
  }

  private static void assertCode(ErrorCode expected, ThrowingCall call) {
    ProtocolException e = assertThrows(ProtocolException.class, call::run);
    assertEquals(expected, e.getCode());
  }

  private interface ThrowingCall {
    void run() throws Exception;
  }

  private static List<DeviceAddress> addresses(GroupMember... members) {
    List<DeviceAddress> result = new ArrayList<>();
    for (GroupMember member : members) {
      result.add(member.getAddress());
    }
    return result;
  }

  private static String decrypt(GroupMember member, GroupMessage message) throws Exception {
    return new String(member.getManager().decrypt(message), StandardCharsets.UTF_8);
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
