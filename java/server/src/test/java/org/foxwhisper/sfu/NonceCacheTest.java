//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.sfu;

import junit.framework.TestCase;

public class NonceCacheTest extends TestCase {

  public void testRejectsRepeats() {
    NonceCache cache = new NonceCache(4);
    assertTrue(cache.add("a"));
    assertTrue(cache.add("b"));
    assertFalse(cache.add("a"));
    assertEquals(2, cache.size());
  }

  public void testEvictsOldestWhenFull() {
    NonceCache cache = new NonceCache(2);
    cache.add("a");
    cache.add("b");
    cache.add("c");

    assertEquals(2, cache.size());
    assertFalse(cache.contains("a"));
    assertTrue(cache.contains("b"));
    assertTrue(cache.contains("c"));
    // evicted entries are accepted again
    assertTrue(cache.add("a"));
  }

  public void testCapacityMustBePositive() {
    try {
      new NonceCache(0);
      fail();
    } catch (IllegalArgumentException expected) {
      assertEquals("capacity must be positive", expected.getMessage());
    }
  }
}
