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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.lucene.util.BytesRef;
import org.junit.Test;

public class SuggestRecordComparatorTest {

  private static BytesRef record(
      SuggestRecordCodec codec, String analyzed, long weight, String surface, String payload) {
    return BytesRef.deepCopyOf(
        codec.encode(
            new BytesRef(analyzed), weight, new BytesRef(surface), new BytesRef(payload)));
  }

  @Test
  public void testAnalyzedFirst() {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    SuggestRecordComparator comparator = new SuggestRecordComparator(false);
    BytesRef a = record(codec, "abc", 1, "zzz", "");
    BytesRef b = record(codec, "abd", 100, "aaa", "");
    assertTrue(comparator.compare(a, b) < 0);
    assertTrue(comparator.compare(b, a) > 0);
  }

  @Test
  public void testShorterAnalyzedFirst() {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    SuggestRecordComparator comparator = new SuggestRecordComparator(false);
    BytesRef a = record(codec, "ab", 1, "x", "");
    BytesRef b = record(codec, "abc", 1, "x", "");
    assertTrue(comparator.compare(a, b) < 0);
  }

  @Test
  public void testHigherWeightFirst() {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    SuggestRecordComparator comparator = new SuggestRecordComparator(false);
    BytesRef heavy = record(codec, "abc", 10, "b", "");
    BytesRef light = record(codec, "abc", 2, "a", "");
    assertTrue(comparator.compare(heavy, light) < 0);
  }

  @Test
  public void testSurfaceBreaksTies() {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    SuggestRecordComparator comparator = new SuggestRecordComparator(false);
    BytesRef upper = record(codec, "foo", 5, "FOO", "");
    BytesRef lower = record(codec, "foo", 5, "foo", "");
    assertTrue(comparator.compare(upper, lower) < 0);
    assertEquals(0, comparator.compare(upper, BytesRef.deepCopyOf(upper)));
  }

  @Test
  public void testPayloadIgnored() {
    SuggestRecordCodec codec = new SuggestRecordCodec(true);
    SuggestRecordComparator comparator = new SuggestRecordComparator(true);
    BytesRef a = record(codec, "foo", 5, "foo", "zzz");
    BytesRef b = record(codec, "foo", 5, "foo", "aaa");
    assertEquals(0, comparator.compare(a, b));
  }

  @Test
  public void testPayloadSurfaceCompared() {
    SuggestRecordCodec codec = new SuggestRecordCodec(true);
    SuggestRecordComparator comparator = new SuggestRecordComparator(true);
    // the payload bytes would sort "ab" last if they were compared
    BytesRef a = record(codec, "x", 5, "ab", "zz");
    BytesRef b = record(codec, "x", 5, "abc", "");
    assertTrue(comparator.compare(a, b) < 0);
  }
}
