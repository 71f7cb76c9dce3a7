/*
 * Copyright 2020 Yelp Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.yelp.nrtsuggest.suggest;

import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.ByteArrayDataOutput;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.BytesRef;

/**
 * Encodes suggestion entries as the records sorted offline before building the FST.
 *
 * <p>Layout: analyzed length (short), analyzed bytes, cost (int), then the surface bytes. With
 * payloads the surface is prefixed by its length (short) and followed by the payload bytes. The
 * cost is {@code Integer.MAX_VALUE - weight}, so ascending cost is descending weight.
 *
 * <p>Instances keep scratch buffers and are not thread safe.
 */
final class SuggestRecordCodec {
  /** Largest analyzed or surface length a record can hold. */
  static final int MAX_LENGTH = Short.MAX_VALUE - 2;

  /** Separates surface and payload bytes; also reserved in surface text. */
  static final int PAYLOAD_SEP = '\u001F';

  private final boolean hasPayloads;
  private final ByteArrayDataOutput output = new ByteArrayDataOutput();
  private final ByteArrayDataInput input = new ByteArrayDataInput();
  private byte[] buffer = new byte[0];

  SuggestRecordCodec(boolean hasPayloads) {
    this.hasPayloads = hasPayloads;
  }

  boolean hasPayloads() {
    return hasPayloads;
  }

  /**
   * Encode one analyzed path of an entry.
   *
   * @param analyzed analyzed path bytes
   * @param weight entry weight
   * @param surface utf8 surface form
   * @param payload entry payload, only used with payloads
   * @return record bytes, valid until the next call
   * @throws IllegalArgumentException if a length does not fit in a record, or a payload surface
   *     contains {@link #PAYLOAD_SEP}
   * @throws UnsupportedOperationException if the weight is negative or larger than an int
   */
  BytesRef encode(BytesRef analyzed, long weight, BytesRef surface, BytesRef payload) {
    if (analyzed.length > MAX_LENGTH) {
      throw new IllegalArgumentException(
          "cannot handle analyzed forms > "
              + MAX_LENGTH
              + " in length (got "
              + analyzed.length
              + ")");
    }
    int cost = encodeWeight(weight);
    // analyzed length + analyzed + cost + surface
    int requiredLength = 2 + analyzed.length + 4 + surface.length;
    if (hasPayloads) {
      if (surface.length > MAX_LENGTH) {
        throw new IllegalArgumentException(
            "cannot handle surface form > "
                + MAX_LENGTH
                + " in length (got "
                + surface.length
                + ")");
      }
      for (int i = 0; i < surface.length; i++) {
        if (surface.bytes[surface.offset + i] == PAYLOAD_SEP) {
          throw new IllegalArgumentException(
              "surface form cannot contain unit separator character U+001F; this character is reserved");
        }
      }
      requiredLength += 2 + payload.length;
    }

    buffer = ArrayUtil.grow(buffer, requiredLength);
    output.reset(buffer);
    output.writeShort((short) analyzed.length);
    output.writeBytes(analyzed.bytes, analyzed.offset, analyzed.length);
    output.writeInt(cost);
    if (hasPayloads) {
      output.writeShort((short) surface.length);
      output.writeBytes(surface.bytes, surface.offset, surface.length);
      output.writeBytes(payload.bytes, payload.offset, payload.length);
    } else {
      output.writeBytes(surface.bytes, surface.offset, surface.length);
    }
    assert output.getPosition() == requiredLength
        : output.getPosition() + " vs " + requiredLength;
    return new BytesRef(buffer, 0, output.getPosition());
  }

  /**
   * Decode record bytes into a reusable view. The view shares the record's byte array.
   *
   * @param bytes record bytes
   * @param record view to fill
   */
  void decode(BytesRef bytes, SuggestRecord record) {
    int end = bytes.offset + bytes.length;
    input.reset(bytes.bytes, bytes.offset, bytes.length);

    int analyzedLength = input.readShort();
    record.analyzed.bytes = bytes.bytes;
    record.analyzed.offset = input.getPosition();
    record.analyzed.length = analyzedLength;
    input.skipBytes(analyzedLength);

    record.cost = input.readInt();

    record.surface.bytes = bytes.bytes;
    record.payload.bytes = bytes.bytes;
    if (hasPayloads) {
      int surfaceLength = input.readShort();
      record.surface.offset = input.getPosition();
      record.surface.length = surfaceLength;
      record.payload.offset = record.surface.offset + surfaceLength;
      record.payload.length = end - record.payload.offset;
    } else {
      record.surface.offset = input.getPosition();
      record.surface.length = end - record.surface.offset;
      record.payload.offset = end;
      record.payload.length = 0;
    }
  }

  /** weight -> cost */
  static int encodeWeight(long weight) {
    if (weight < 0 || weight > Integer.MAX_VALUE) {
      throw new UnsupportedOperationException("cannot encode value: " + weight);
    }
    return Integer.MAX_VALUE - (int) weight;
  }

  /** cost -> weight */
  static int decodeWeight(long cost) {
    return (int) (Integer.MAX_VALUE - cost);
  }
}
