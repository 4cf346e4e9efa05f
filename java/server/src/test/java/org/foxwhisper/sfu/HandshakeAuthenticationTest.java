//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import junit.framework.TestCase;
import org.foxwhisper.protocol.DeviceAddress;
import org.foxwhisper.protocol.HandshakeEngine;
import org.foxwhisper.protocol.HandshakeResponse;
import org.foxwhisper.protocol.HandshakeResult;
import org.foxwhisper.protocol.IdentityKeyPair;
import org.foxwhisper.protocol.PendingHandshake;
import org.foxwhisper.protocol.state.DeviceDirectory;
import org.foxwhisper.protocol.state.impl.InMemoryDeviceKeyStore;

/** A client authenticates to the router with the key derived from its handshake with it. */
public class HandshakeAuthenticationTest extends TestCase {

  private static InMemoryDeviceKeyStore device(String name, DeviceDirectory directory) {
    DeviceAddress address = new DeviceAddress(name, 1);
    InMemoryDeviceKeyStore keyStore =
        InMemoryDeviceKeyStore.generate(address, IdentityKeyPair.generate());
    directory.register(keyStore.createDeviceRecord());
    directory.activate(address);
    return keyStore;
  }

  public void testHandshakeKeyAuthenticatesClient() throws Exception {
    DeviceDirectory directory = new DeviceDirectory();
    InMemoryDeviceKeyStore client = device("alice", directory);
    InMemoryDeviceKeyStore router = device("sfu", directory);

    HandshakeEngine clientEngine = new HandshakeEngine(client, directory);
    PendingHandshake pending = clientEngine.initiate(router.getLocalAddress());
    HandshakeResponse response =
        new HandshakeEngine(router, directory).respond(pending.getInitMessage());
    HandshakeResult clientSide = clientEngine.complete(pending, response.getMessage());

    ManualClock clock = new ManualClock();
    SfuHandler handler = new SfuHandler(SfuPolicy.defaults(), clock);
    handler.registerClient(
        "call-1", "alice", response.getResult().deriveSfuAuthKey("alice"));

    ClientAuthToken token =
        ClientAuthToken.create(
            clientSide.deriveSfuAuthKey("alice"), "call-1", "alice", clock.millis(), "n1");
    assertEquals(AuthResult.ACCEPTED, handler.authenticate(token));
    assertTrue(handler.join("call-1", "alice").isAllowed());

    ClientAuthToken wrongLabel =
        ClientAuthToken.create(
            clientSide.deriveSfuAuthKey("bob"), "call-1", "alice", clock.millis(), "n2");
    assertEquals(AuthResult.IMPERSONATION, handler.authenticate(wrongLabel));
  }
}
