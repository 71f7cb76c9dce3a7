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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.PairOutputs.Pair;
import org.apache.lucene.util.fst.Util;
import org.junit.Test;

public class SuggestFstBuilderTest {

  /** Records must be added in comparator order, as the sorter delivers them. */
  private static boolean add(
      SuggestFstBuilder builder,
      SuggestRecordCodec codec,
      String analyzed,
      long weight,
      String surface,
      String payload)
      throws IOException {
    BytesRef bytes =
        codec.encode(new BytesRef(analyzed), weight, new BytesRef(surface), new BytesRef(payload));
    SuggestRecord record = new SuggestRecord();
    codec.decode(bytes, record);
    return builder.add(record);
  }

  private static BytesRef key(String analyzed, int dedup) {
    BytesRefBuilder key = new BytesRefBuilder();
    key.copyChars(analyzed);
    key.append((byte) SuggestFstBuilder.END_BYTE);
    key.append((byte) dedup);
    return key.get();
  }

  @Test
  public void testEmpty() throws IOException {
    SuggestFstBuilder builder = new SuggestFstBuilder(256, false);
    assertNull(builder.finish());
    assertEquals(0, builder.getKeyCount());
  }

  @Test
  public void testKeysAndValues() throws IOException {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    SuggestFstBuilder builder = new SuggestFstBuilder(256, false);
    assertTrue(add(builder, codec, "abc", 10, "ABC", ""));
    assertTrue(add(builder, codec, "abc", 3, "abc", ""));
    assertTrue(add(builder, codec, "abcd", 7, "abcd", ""));
    FST<Pair<Long, BytesRef>> fst = builder.finish();
    assertNotNull(fst);
    assertEquals(3, builder.getKeyCount());

    Pair<Long, BytesRef> first = Util.get(fst, key("abc", 0));
    assertEquals(10, SuggestRecordCodec.decodeWeight(first.output1));
    assertEquals("ABC", first.output2.utf8ToString());
    Pair<Long, BytesRef> second = Util.get(fst, key("abc", 1));
    assertEquals(3, SuggestRecordCodec.decodeWeight(second.output1));
    assertEquals("abc", second.output2.utf8ToString());
    // dedup byte restarts for every analyzed form
    Pair<Long, BytesRef> third = Util.get(fst, key("abcd", 0));
    assertEquals("abcd", third.output2.utf8ToString());
  }

  @Test
  public void testDuplicateSurfaceKeepsHighestWeight() throws IOException {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    SuggestFstBuilder builder = new SuggestFstBuilder(256, false);
    assertTrue(add(builder, codec, "foo", 10, "foo", ""));
    assertFalse(add(builder, codec, "foo", 5, "foo", ""));
    assertTrue(add(builder, codec, "foo", 3, "bar", ""));
    FST<Pair<Long, BytesRef>> fst = builder.finish();
    assertEquals(2, builder.getKeyCount());

    assertEquals(10, SuggestRecordCodec.decodeWeight(Util.get(fst, key("foo", 0)).output1));
    // the dropped duplicate still used up dedup byte 1
    assertNull(Util.get(fst, key("foo", 1)));
    assertEquals("bar", Util.get(fst, key("foo", 2)).output2.utf8ToString());
  }

  @Test
  public void testSurfaceFormLimit() throws IOException {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    SuggestFstBuilder builder = new SuggestFstBuilder(2, false);
    assertTrue(add(builder, codec, "abc", 4, "abc", ""));
    assertTrue(add(builder, codec, "abc", 3, "aBC", ""));
    assertFalse(add(builder, codec, "abc", 2, "Abc", ""));
    assertFalse(add(builder, codec, "abc", 1, "ABC", ""));
    assertTrue(add(builder, codec, "abd", 1, "abd", ""));
    builder.finish();
    assertEquals(3, builder.getKeyCount());
  }

  @Test
  public void testPayloadValue() throws IOException {
    SuggestRecordCodec codec = new SuggestRecordCodec(true);
    SuggestFstBuilder builder = new SuggestFstBuilder(256, true);
    assertTrue(add(builder, codec, "ny", 5, "NY", "state"));
    // same surface with another payload is still a duplicate
    assertFalse(add(builder, codec, "ny", 1, "NY", "other"));
    FST<Pair<Long, BytesRef>> fst = builder.finish();

    assertEquals("NY\u001Fstate", Util.get(fst, key("ny", 0)).output2.utf8ToString());
  }

  @Test
  public void testEmptyAnalyzedForm() throws IOException {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    SuggestFstBuilder builder = new SuggestFstBuilder(256, false);
    assertTrue(add(builder, codec, "", 1, "the", ""));
    assertTrue(add(builder, codec, "a", 1, "a", ""));
    FST<Pair<Long, BytesRef>> fst = builder.finish();
    assertEquals("the", Util.get(fst, key("", 0)).output2.utf8ToString());
  }
}
