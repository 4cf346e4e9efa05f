//
// Copyright 2026 Signal Messenger, LLC.
// SPDX-License-Identifier: AGPL-3.0-only
//

package org.foxwhisper.protocol.cbor;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.foxwhisper.protocol.util.ByteUtil;

/**
 * Deterministic CBOR (RFC 8949 section 4.2.1).
 *
 * <p>Encoding accepts {@code null}, {@link Boolean}, integral {@link Number}s, {@code byte[]},
 * {@link String}, {@link List}, {@link Map} and {@link CborTag}. Map entries are written in the
 * bytewise order of their encoded keys, and every head uses its shortest form. Floating point
 * values and indefinite lengths are never produced.
 *
 * <p>Decoding is strict: any input that this encoder would not have produced byte-for-byte is
 * rejected. Integers decode as {@link Long}, maps as insertion-ordered {@link Map}s.
 */
public final class CanonicalCbor {

  private static final int MAJOR_UNSIGNED = 0;
  private static final int MAJOR_NEGATIVE = 1;
  private static final int MAJOR_BYTES = 2;
  private static final int MAJOR_TEXT = 3;
  private static final int MAJOR_ARRAY = 4;
  private static final int MAJOR_MAP = 5;
  private static final int MAJOR_TAG = 6;
  private static final int MAJOR_SIMPLE = 7;

  private static final int SIMPLE_FALSE = 20;
  private static final int SIMPLE_TRUE = 21;
  private static final int SIMPLE_NULL = 22;

  private static final int MAX_DEPTH = 16;

  private CanonicalCbor() {}

  public static byte[] encode(Object value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    write(out, value, 0);
    return out.toByteArray();
  }

  public static Object decode(byte[] input) throws CborException {
    if (input == null) {
      throw new CborException("no input");
    }
    Reader reader = new Reader(input);
    Object value = reader.read(0);
    if (reader.position != input.length) {
      throw new CborException("trailing bytes after data item");
    }
    return value;
  }

  private static void write(ByteArrayOutputStream out, Object value, int depth) {
    if (depth > MAX_DEPTH) {
      throw new IllegalArgumentException("nesting too deep");
    }

    if (value == null) {
      out.write((MAJOR_SIMPLE << 5) | SIMPLE_NULL);
    } else if (value instanceof Boolean) {
      out.write((MAJOR_SIMPLE << 5) | ((Boolean) value ? SIMPLE_TRUE : SIMPLE_FALSE));
    } else if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      long number = ((Number) value).longValue();
      if (number >= 0) {
        writeHead(out, MAJOR_UNSIGNED, number);
      } else {
        writeHead(out, MAJOR_NEGATIVE, -1 - number);
      }
    } else if (value instanceof byte[]) {
      byte[] bytes = (byte[]) value;
      writeHead(out, MAJOR_BYTES, bytes.length);
      out.write(bytes, 0, bytes.length);
    } else if (value instanceof String) {
      byte[] utf8 = ((String) value).getBytes(StandardCharsets.UTF_8);
      writeHead(out, MAJOR_TEXT, utf8.length);
      out.write(utf8, 0, utf8.length);
    } else if (value instanceof List) {
      List<?> list = (List<?>) value;
      writeHead(out, MAJOR_ARRAY, list.size());
      for (Object element : list) {
        write(out, element, depth + 1);
      }
    } else if (value instanceof Map) {
      writeMap(out, (Map<?, ?>) value, depth);
    } else if (value instanceof CborTag) {
      CborTag tag = (CborTag) value;
      writeHead(out, MAJOR_TAG, tag.getTag());
      write(out, tag.getContent(), depth + 1);
    } else {
      throw new IllegalArgumentException("unsupported CBOR value: " + value.getClass().getName());
    }
  }

  private static void writeMap(ByteArrayOutputStream out, Map<?, ?> map, int depth) {
    List<byte[][]> entries = new ArrayList<>(map.size());
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String || entry.getKey() instanceof Number)) {
        throw new IllegalArgumentException("map keys must be text or integers");
      }
      ByteArrayOutputStream valueOut = new ByteArrayOutputStream();
      write(valueOut, entry.getValue(), depth + 1);
      entries.add(new byte[][] {encode(entry.getKey()), valueOut.toByteArray()});
    }

    Collections.sort(entries, (a, b) -> ByteUtil.compareUnsigned(a[0], b[0]));

    writeHead(out, MAJOR_MAP, entries.size());
    byte[] previousKey = null;
    for (byte[][] entry : entries) {
      if (previousKey != null && ByteUtil.compareUnsigned(previousKey, entry[0]) == 0) {
        throw new IllegalArgumentException("duplicate map key");
      }
      out.write(entry[0], 0, entry[0].length);
      out.write(entry[1], 0, entry[1].length);
      previousKey = entry[0];
    }
  }

  private static void writeHead(ByteArrayOutputStream out, int major, long argument) {
    int type = major << 5;
    if (argument < 24) {
      out.write(type | (int) argument);
    } else if (argument <= 0xffL) {
      out.write(type | 24);
      out.write((int) argument);
    } else if (argument <= 0xffffL) {
      out.write(type | 25);
      writeBigEndian(out, argument, 2);
    } else if (argument <= 0xffffffffL) {
      out.write(type | 26);
      writeBigEndian(out, argument, 4);
    } else {
      out.write(type | 27);
      writeBigEndian(out, argument, 8);
    }
  }

  private static void writeBigEndian(ByteArrayOutputStream out, long value, int length) {
    for (int i = length - 1; i >= 0; i--) {
      out.write((int) (value >>> (8 * i)) & 0xff);
    }
  }

  private static final class Reader {
    private final byte[] input;
    private int position;

    Reader(byte[] input) {
      this.input = input;
    }

    Object read(int depth) throws CborException {
      if (depth > MAX_DEPTH) {
        throw new CborException("nesting too deep");
      }

      int initial = next();
      int major = initial >>> 5;
      int additional = initial & 0x1f;

      if (major == MAJOR_SIMPLE) {
        switch (additional) {
          case SIMPLE_FALSE:
            return Boolean.FALSE;
          case SIMPLE_TRUE:
            return Boolean.TRUE;
          case SIMPLE_NULL:
            return null;
          case 25:
          case 26:
          case 27:
            throw new CborException("floating point values are not permitted");
          case 31:
            throw new CborException("unexpected break");
          default:
            throw new CborException("unsupported simple value " + additional);
        }
      }

      long argument = readArgument(additional);

      switch (major) {
        case MAJOR_UNSIGNED:
          return argument;
        case MAJOR_NEGATIVE:
          return -1 - argument;
        case MAJOR_BYTES:
          return take(argument);
        case MAJOR_TEXT:
          return decodeUtf8(take(argument));
        case MAJOR_ARRAY:
          {
            checkCount(argument);
            List<Object> list = new ArrayList<>((int) argument);
            for (long i = 0; i < argument; i++) {
              list.add(read(depth + 1));
            }
            return list;
          }
        case MAJOR_MAP:
          {
            checkCount(argument);
            Map<Object, Object> map = new LinkedHashMap<>();
            byte[] previousKey = null;
            for (long i = 0; i < argument; i++) {
              int keyStart = position;
              Object key = read(depth + 1);
              if (!(key instanceof String || key instanceof Long)) {
                throw new CborException("map keys must be text or integers");
              }
              byte[] encodedKey = Arrays.copyOfRange(input, keyStart, position);
              if (previousKey != null && ByteUtil.compareUnsigned(previousKey, encodedKey) >= 0) {
                throw new CborException("map keys out of canonical order or duplicated");
              }
              previousKey = encodedKey;
              map.put(key, read(depth + 1));
            }
            return map;
          }
        case MAJOR_TAG:
          return new CborTag(argument, read(depth + 1));
        default:
          throw new AssertionError("unreachable major type " + major);
      }
    }

    private long readArgument(int additional) throws CborException {
      if (additional < 24) {
        return additional;
      }
      long value;
      switch (additional) {
        case 24:
          value = readBigEndian(1);
          if (value < 24) throw new CborException("non-minimal integer encoding");
          return value;
        case 25:
          value = readBigEndian(2);
          if (value <= 0xffL) throw new CborException("non-minimal integer encoding");
          return value;
        case 26:
          value = readBigEndian(4);
          if (value <= 0xffffL) throw new CborException("non-minimal integer encoding");
          return value;
        case 27:
          value = readBigEndian(8);
          if (value >= 0 && value <= 0xffffffffL) {
            throw new CborException("non-minimal integer encoding");
          }
          if (value < 0) {
            throw new CborException("integer exceeds 63 bits");
          }
          return value;
        case 31:
          throw new CborException("indefinite-length items are not permitted");
        default:
          throw new CborException("reserved additional information " + additional);
      }
    }

    private long readBigEndian(int length) throws CborException {
      long value = 0;
      for (int i = 0; i < length; i++) {
        value = (value << 8) | next();
      }
      return value;
    }

    private int next() throws CborException {
      if (position >= input.length) {
        throw new CborException("truncated input");
      }
      return input[position++] & 0xff;
    }

    private byte[] take(long length) throws CborException {
      if (length > input.length - position) {
        throw new CborException("truncated input");
      }
      byte[] result = Arrays.copyOfRange(input, position, position + (int) length);
      position += (int) length;
      return result;
    }

    private void checkCount(long count) throws CborException {
      // Every element needs at least one byte.
      if (count > input.length - position) {
        throw new CborException("truncated input");
      }
    }

    private static String decodeUtf8(byte[] bytes) throws CborException {
      try {
        return StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
      } catch (CharacterCodingException e) {
        throw new CborException("invalid UTF-8 in text string", e);
      }
    }
  }
}
