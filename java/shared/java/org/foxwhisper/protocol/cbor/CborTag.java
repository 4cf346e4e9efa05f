//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.cbor;

import java.util.Objects;

/** A semantically tagged data item (major type 6). */
public final class CborTag {
  private final long tag;
  private final Object content;

  public CborTag(long tag, Object content) {
    if (tag < 0) {
      throw new IllegalArgumentException("negative tag");
    }
    this.tag = tag;
    this.content = content;
  }

  public long getTag() {
    return tag;
  }

  public Object getContent() {
    return content;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CborTag)) return false;
    CborTag that = (CborTag) o;
    return tag == that.tag && Objects.equals(content, that.content);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tag, content);
  }
}
