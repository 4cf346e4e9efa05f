//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.cbor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Typed, schema-checked view of a decoded CBOR map with text keys. */
public final class CborMap {
  private final Map<?, ?> entries;

  private CborMap(Map<?, ?> entries) {
    this.entries = entries;
  }

  public static CborMap of(Object decoded) throws CborException {
    if (!(decoded instanceof Map)) {
      throw new CborException("expected a map");
    }
    return new CborMap((Map<?, ?>) decoded);
  }

  /** Unwraps a tagged map, checking the tag number. */
  public static CborMap untag(Object decoded, long expectedTag) throws CborException {
    if (!(decoded instanceof CborTag)) {
      throw new CborException("expected tagged item");
    }
    CborTag tag = (CborTag) decoded;
    if (tag.getTag() != expectedTag) {
      throw new CborException("unexpected tag " + tag.getTag());
    }
    return of(tag.getContent());
  }

  /** Rejects any key not in {@code allowed}. */
  public CborMap requireOnly(String... allowed) throws CborException {
    Set<String> known = new HashSet<>(Arrays.asList(allowed));
    for (Object key : entries.keySet()) {
      if (!known.contains(key)) {
        throw new CborException("unexpected field " + key);
      }
    }
    return this;
  }

  public boolean has(String key) {
    return entries.containsKey(key) && entries.get(key) != null;
  }

  public byte[] getBytes(String key) throws CborException {
    return require(key, byte[].class);
  }

  public byte[] getBytes(String key, int expectedLength) throws CborException {
    byte[] value = getBytes(key);
    if (value.length != expectedLength) {
      throw new CborException("field " + key + " has length " + value.length);
    }
    return value;
  }

  public byte[] getOptionalBytes(String key) throws CborException {
    return has(key) ? getBytes(key) : null;
  }

  public long getLong(String key) throws CborException {
    return require(key, Long.class);
  }

  public int getInt(String key) throws CborException {
    long value = getLong(key);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new CborException("field " + key + " out of range");
    }
    return (int) value;
  }

  public String getString(String key) throws CborException {
    return require(key, String.class);
  }

  public String getOptionalString(String key) throws CborException {
    return has(key) ? getString(key) : null;
  }

  public CborMap getMap(String key) throws CborException {
    return of(require(key, Map.class));
  }

  public List<?> getList(String key) throws CborException {
    return require(key, List.class);
  }

  public List<String> getStringList(String key) throws CborException {
    List<String> result = new ArrayList<>();
    for (Object element : getList(key)) {
      if (!(element instanceof String)) {
        throw new CborException("field " + key + " must contain text strings");
      }
      result.add((String) element);
    }
    return result;
  }

  private <T> T require(String key, Class<T> type) throws CborException {
    Object value = entries.get(key);
    if (value == null) {
      throw new CborException("missing field " + key);
    }
    if (!type.isInstance(value)) {
      throw new CborException("field " + key + " has wrong type");
    }
    return type.cast(value);
  }
}
