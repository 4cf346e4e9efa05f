//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.message.EncryptedMessage;
import org.foxwhisper.protocol.message.EpochAuthenticityRecord;

/** Outcome of resolving a fork between epoch records that share a parent. */
public final class ReconciliationResult {
  private final EpochAuthenticityRecord winner;
  private final List<EpochAuthenticityRecord> losers;
  private final List<HealingAction> healingActions;
  private final long messagesAcceptedOnLosingBranch;
  private final SortedMap<DeviceAddress, EncryptedMessage> distributions;
  private final SortedSet<DeviceAddress> pendingMembers;

  ReconciliationResult(
      EpochAuthenticityRecord winner,
      List<EpochAuthenticityRecord> losers,
      List<HealingAction> healingActions) {
    this(
        winner,
        losers,
        healingActions,
        0,
        Collections.<DeviceAddress, EncryptedMessage>emptyMap(),
        Collections.<DeviceAddress>emptySet());
  }

  private ReconciliationResult(
      EpochAuthenticityRecord winner,
      List<EpochAuthenticityRecord> losers,
      List<HealingAction> healingActions,
      long messagesAcceptedOnLosingBranch,
      Map<DeviceAddress, EncryptedMessage> distributions,
      Set<DeviceAddress> pendingMembers) {
    this.winner = winner;
    this.losers = Collections.unmodifiableList(new ArrayList<>(losers));
    this.healingActions = Collections.unmodifiableList(healingActions);
    this.messagesAcceptedOnLosingBranch = messagesAcceptedOnLosingBranch;
    this.distributions = Collections.unmodifiableSortedMap(new TreeMap<>(distributions));
    this.pendingMembers = Collections.unmodifiableSortedSet(new TreeSet<>(pendingMembers));
  }

  ReconciliationResult withLocalOutcome(
      long messagesAcceptedOnLosingBranch,
      Map<DeviceAddress, EncryptedMessage> distributions,
      Set<DeviceAddress> pendingMembers) {
    return new ReconciliationResult(
        winner,
        losers,
        healingActions,
        messagesAcceptedOnLosingBranch,
        distributions,
        pendingMembers);
  }

  public EpochAuthenticityRecord getWinner() {
    return winner;
  }

  /** The other records of the fork, best ranked first. */
  public List<EpochAuthenticityRecord> getLosers() {
    return losers;
  }

  /** Healing actions in a fixed order: by action type, then by device. */
  public List<HealingAction> getHealingActions() {
    return healingActions;
  }

  public boolean requires(HealingAction action) {
    return healingActions.contains(action);
  }

  /**
   * Messages this device decrypted under the losing branches before the fork was detected. They are
   * not invalidated.
   */
  public long getMessagesAcceptedOnLosingBranch() {
    return messagesAcceptedOnLosingBranch;
  }

  /** Fresh sender key distributions for the winning branch, one per reachable member. */
  public SortedMap<DeviceAddress, EncryptedMessage> getDistributions() {
    return distributions;
  }

  /** Members of the winning tip without an established session. */
  public SortedSet<DeviceAddress> getPendingMembers() {
    return pendingMembers;
  }
}
