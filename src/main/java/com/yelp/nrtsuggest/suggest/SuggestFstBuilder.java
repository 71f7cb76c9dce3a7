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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.fst.ByteSequenceOutputs;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.FSTCompiler;
import org.apache.lucene.util.fst.PairOutputs;
import org.apache.lucene.util.fst.PairOutputs.Pair;
import org.apache.lucene.util.fst.PositiveIntOutputs;
import org.apache.lucene.util.fst.Util;

/**
 * Builds the suggestion FST from records sorted by {@link SuggestRecordComparator}.
 *
 * <p>Each key is the analyzed form followed by {@link #END_BYTE} and a dedup byte that tells apart
 * the surface forms sharing that analyzed form. The end byte makes an analyzed form sort before
 * every longer analyzed form it is a prefix of. Since records of one analyzed form arrive by
 * descending weight, only the first {@code maxSurfaceFormsPerAnalyzedForm} are kept, and a repeated
 * surface form keeps its highest weight.
 *
 * <p>Values are {@code (cost, surface)} pairs, or {@code (cost, surface + U+001F + payload)} with
 * payloads.
 */
final class SuggestFstBuilder {
  /** Marks the end of an analyzed form in an FST key. */
  static final int END_BYTE = 0x0;

  private final int maxSurfaceFormsPerAnalyzedForm;
  private final boolean hasPayloads;
  private final PairOutputs<Long, BytesRef> outputs;
  private final FSTCompiler<Pair<Long, BytesRef>> fstCompiler;

  private final BytesRefBuilder analyzed = new BytesRefBuilder();
  private final IntsRefBuilder scratchInts = new IntsRefBuilder();
  private BytesRefBuilder previousAnalyzed;
  // cleared for every new analyzed form, so it holds at most maxSurfaceFormsPerAnalyzedForm entries
  private final Set<BytesRef> seenSurfaceForms = new HashSet<>();
  private int dedup;
  private long keyCount;

  SuggestFstBuilder(int maxSurfaceFormsPerAnalyzedForm, boolean hasPayloads) {
    this.maxSurfaceFormsPerAnalyzedForm = maxSurfaceFormsPerAnalyzedForm;
    this.hasPayloads = hasPayloads;
    this.outputs = newOutputs();
    this.fstCompiler = new FSTCompiler<>(FST.INPUT_TYPE.BYTE1, outputs);
  }

  /** Outputs used by suggestion FSTs. */
  static PairOutputs<Long, BytesRef> newOutputs() {
    return new PairOutputs<>(PositiveIntOutputs.getSingleton(), ByteSequenceOutputs.getSingleton());
  }

  /**
   * Add the next sorted record.
   *
   * @param record decoded record, must not sort before the previous one
   * @return true if the record was added to the FST, false if it was dropped as a duplicate or
   *     beyond the surface form limit
   * @throws IOException on FST construction error
   */
  boolean add(SuggestRecord record) throws IOException {
    if (previousAnalyzed == null) {
      previousAnalyzed = new BytesRefBuilder();
      previousAnalyzed.copyBytes(record.analyzed);
      seenSurfaceForms.add(BytesRef.deepCopyOf(record.surface));
    } else if (record.analyzed.equals(previousAnalyzed.get())) {
      dedup++;
      if (dedup >= maxSurfaceFormsPerAnalyzedForm) {
        // higher weighted surface forms were seen first
        return false;
      }
      if (seenSurfaceForms.contains(record.surface)) {
        return false;
      }
      seenSurfaceForms.add(BytesRef.deepCopyOf(record.surface));
    } else {
      dedup = 0;
      previousAnalyzed.copyBytes(record.analyzed);
      seenSurfaceForms.clear();
      seenSurfaceForms.add(BytesRef.deepCopyOf(record.surface));
    }

    // both suffix bytes are written even without duplicates; exact match lookup relies on it
    analyzed.copyBytes(record.analyzed);
    analyzed.append((byte) END_BYTE);
    analyzed.append((byte) dedup);

    fstCompiler.add(
        Util.toIntsRef(analyzed.get(), scratchInts), outputs.newPair(record.cost, value(record)));
    keyCount++;
    return true;
  }

  private BytesRef value(SuggestRecord record) {
    if (!hasPayloads) {
      return BytesRef.deepCopyOf(record.surface);
    }
    BytesRef surface = record.surface;
    BytesRef payload = record.payload;
    BytesRef value = new BytesRef(surface.length + 1 + payload.length);
    System.arraycopy(surface.bytes, surface.offset, value.bytes, 0, surface.length);
    value.bytes[surface.length] = (byte) SuggestRecordCodec.PAYLOAD_SEP;
    System.arraycopy(
        payload.bytes, payload.offset, value.bytes, surface.length + 1, payload.length);
    value.length = value.bytes.length;
    return value;
  }

  /** Number of keys added to the FST. */
  long getKeyCount() {
    return keyCount;
  }

  /**
   * Compile the FST.
   *
   * @return the FST, or null if no key was added
   * @throws IOException on FST construction error
   */
  FST<Pair<Long, BytesRef>> finish() throws IOException {
    return fstCompiler.compile();
  }
}
