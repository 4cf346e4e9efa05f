//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.groups;

import java.util.concurrent.CompletableFuture;
import org.foxwhisper.protocol.message.EpochAuthenticityRecord;

/**
 * Publishes a proposed epoch record to the group and collects admin countersignatures.
 *
 * <p>The returned future yields the record as it should be applied, normally the proposal with any
 * countersignatures added.
 */
public interface EpochBroadcaster {
  public CompletableFuture<EpochAuthenticityRecord> broadcast(EpochAuthenticityRecord proposal);
}
