//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.message.EpochAuthenticityRecord;
import org.foxwhisper.protocol.util.ByteUtil;

/**
 * Picks the surviving branch of a fork. The decision depends only on the set of branches, never on
 * the order they are passed in or on local history, so every member reaches the same result.
 *
 * <p>The branch whose hash chain reaches further wins. Equal depths fall back to the conflicting
 * record with the smaller hash, compared as unsigned bytes.
 */
public final class ForkReconciler {

  private static final Comparator<Branch> PRECEDENCE =
      (a, b) -> {
        if (a.getTipDepth() != b.getTipDepth()) {
          return Long.compare(b.getTipDepth(), a.getTipDepth());
        }
        return ByteUtil.compareUnsigned(a.getRecord().getHash(), b.getRecord().getHash());
      };

  private ForkReconciler() {}

  /** One side of a fork: the conflicting record and the deepest epoch known to extend it. */
  public static final class Branch {
    private final EpochAuthenticityRecord record;
    private final long tipDepth;

    public Branch(EpochAuthenticityRecord record, long tipDepth) {
      if (tipDepth < record.getEpoch()) {
        throw new IllegalArgumentException("branch tip is behind its own root");
      }
      this.record = record;
      this.tipDepth = tipDepth;
    }

    public EpochAuthenticityRecord getRecord() {
      return record;
    }

    public long getTipDepth() {
      return tipDepth;
    }
  }

  public static ReconciliationResult reconcile(Branch first, Branch second) {
    return reconcile(Arrays.asList(first, second));
  }

  /**
   * Ranks every branch that grew from the same parent.
   *
   * @throws IllegalArgumentException if fewer than two branches are given, or two of them are not
   *     distinct children of one parent
   */
  public static ReconciliationResult reconcile(Collection<Branch> branches) {
    if (branches.size() < 2) {
      throw new IllegalArgumentException("a fork needs at least two branches");
    }
    List<Branch> ranked = new ArrayList<>(branches);
    EpochAuthenticityRecord reference = ranked.get(0).getRecord();
    Set<String> hashes = new HashSet<>();
    for (Branch branch : ranked) {
      EpochAuthenticityRecord record = branch.getRecord();
      if (!record.getGroupId().equals(reference.getGroupId())
          || record.getEpoch() != reference.getEpoch()
          || !Arrays.equals(record.getPreviousHash(), reference.getPreviousHash())) {
        throw new IllegalArgumentException("records do not conflict: different group or parent");
      }
      if (!hashes.add(record.getHashHex())) {
        throw new IllegalArgumentException("records do not conflict: identical bodies");
      }
    }
    ranked.sort(PRECEDENCE);

    List<EpochAuthenticityRecord> records = new ArrayList<>();
    for (Branch branch : ranked) {
      records.add(branch.getRecord());
    }
    return new ReconciliationResult(
        records.get(0), records.subList(1, records.size()), healingActions(records));
  }

  private static List<HealingAction> healingActions(List<EpochAuthenticityRecord> records) {
    SortedSet<HealingAction> actions = new TreeSet<>();
    actions.add(HealingAction.resetSenderChains());
    for (int i = 0; i < records.size(); i++) {
      for (int j = i + 1; j < records.size(); j++) {
        EpochAuthenticityRecord a = records.get(i);
        EpochAuthenticityRecord b = records.get(j);
        if (!a.getMembers().equals(b.getMembers()) || !a.getAdmins().equals(b.getAdmins())) {
          actions.add(HealingAction.requestFullResync());
        }
        for (DeviceAddress signer : a.getSignatures().keySet()) {
          if (b.getSignatures().containsKey(signer)) {
            actions.add(HealingAction.revokeMember(signer));
          }
        }
      }
    }
    return new ArrayList<>(actions);
  }
}
