//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.message.EncryptedMessage;

/** What applying an epoch record did to the local view of a group. */
public final class EpochUpdate {

  public enum Outcome {
    /** The record became the new tip. */
    ACCEPTED,
    /** The record was already known. */
    DUPLICATE,
    /** The record conflicts with a known sibling; the group is now forked. */
    FORK_DETECTED,
    /** The record is valid but does not extend the tip. It is kept for reconciliation. */
    RECORDED,
    /** The record belongs to a branch that lost an earlier reconciliation. */
    DISCARDED
  }

  private final Outcome outcome;
  private final GroupEpochState state;
  private final SortedMap<DeviceAddress, EncryptedMessage> distributions;
  private final SortedSet<DeviceAddress> pendingMembers;

  EpochUpdate(Outcome outcome, GroupEpochState state) {
    this(
        outcome,
        state,
        Collections.<DeviceAddress, EncryptedMessage>emptyMap(),
        Collections.<DeviceAddress>emptySet());
  }

  EpochUpdate(
      Outcome outcome,
      GroupEpochState state,
      Map<DeviceAddress, EncryptedMessage> distributions,
      Set<DeviceAddress> pendingMembers) {
    this.outcome = outcome;
    this.state = state;
    this.distributions = Collections.unmodifiableSortedMap(new TreeMap<>(distributions));
    this.pendingMembers = Collections.unmodifiableSortedSet(new TreeSet<>(pendingMembers));
  }

  public Outcome getOutcome() {
    return outcome;
  }

  /** The epoch the applied record describes. */
  public GroupEpochState getState() {
    return state;
  }

  /**
   * The local device's new sender key, encrypted to each member of the new epoch. Send each entry
   * to its key.
   */
  public SortedMap<DeviceAddress, EncryptedMessage> getDistributions() {
    return distributions;
  }

  /**
   * Members that could not be sent a distribution because no session exists yet. Call {@link
   * GroupEpochManager#distributeTo} once one does.
   */
  public SortedSet<DeviceAddress> getPendingMembers() {
    return pendingMembers;
  }
}
