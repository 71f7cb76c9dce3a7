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

import java.util.Comparator;
import org.apache.lucene.util.BytesRef;

/**
 * Orders sort records by analyzed bytes, then cost (descending weight), then surface bytes. With
 * payloads only the surface portion takes part in the last comparison, never the payload.
 */
final class SuggestRecordComparator implements Comparator<BytesRef> {
  private final SuggestRecordCodec codec;
  private final SuggestRecord scratchA = new SuggestRecord();
  private final SuggestRecord scratchB = new SuggestRecord();

  SuggestRecordComparator(boolean hasPayloads) {
    this.codec = new SuggestRecordCodec(hasPayloads);
  }

  @Override
  public int compare(BytesRef a, BytesRef b) {
    codec.decode(a, scratchA);
    codec.decode(b, scratchB);

    int cmp = scratchA.analyzed.compareTo(scratchB.analyzed);
    if (cmp != 0) {
      return cmp;
    }

    assert scratchA.cost >= 0 && scratchB.cost >= 0;
    cmp = Long.compare(scratchA.cost, scratchB.cost);
    if (cmp != 0) {
      return cmp;
    }

    return scratchA.surface.compareTo(scratchB.surface);
  }
}
