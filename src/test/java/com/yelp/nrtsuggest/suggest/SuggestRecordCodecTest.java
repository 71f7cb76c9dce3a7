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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.apache.lucene.util.BytesRef;
import org.junit.Test;

public class SuggestRecordCodecTest {

  @Test
  public void testDecodeWithoutPayload() {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    BytesRef bytes =
        codec.encode(new BytesRef("new\u001Fyork"), 7, new BytesRef("New York"), new BytesRef());
    SuggestRecord record = new SuggestRecord();
    codec.decode(BytesRef.deepCopyOf(bytes), record);

    assertEquals("new\u001Fyork", record.analyzed.utf8ToString());
    assertEquals(Integer.MAX_VALUE - 7, record.cost);
    assertEquals("New York", record.surface.utf8ToString());
    assertEquals(0, record.payload.length);
  }

  @Test
  public void testDecodeWithPayload() {
    SuggestRecordCodec codec = new SuggestRecordCodec(true);
    BytesRef bytes =
        codec.encode(new BytesRef("ny"), 3, new BytesRef("NY"), new BytesRef("state=NY"));
    SuggestRecord record = new SuggestRecord();
    codec.decode(BytesRef.deepCopyOf(bytes), record);

    assertEquals("ny", record.analyzed.utf8ToString());
    assertEquals("NY", record.surface.utf8ToString());
    assertEquals("state=NY", record.payload.utf8ToString());
  }

  @Test
  public void testDecodeWithOffset() {
    SuggestRecordCodec codec = new SuggestRecordCodec(true);
    BytesRef bytes = codec.encode(new BytesRef("ab"), 1, new BytesRef("AB"), new BytesRef("p"));
    byte[] shifted = new byte[bytes.length + 5];
    System.arraycopy(bytes.bytes, bytes.offset, shifted, 3, bytes.length);
    SuggestRecord record = new SuggestRecord();
    codec.decode(new BytesRef(shifted, 3, bytes.length), record);

    assertEquals("ab", record.analyzed.utf8ToString());
    assertEquals("AB", record.surface.utf8ToString());
    assertEquals("p", record.payload.utf8ToString());
  }

  @Test
  public void testWeightRange() {
    assertEquals(Integer.MAX_VALUE, SuggestRecordCodec.encodeWeight(0));
    assertEquals(0, SuggestRecordCodec.encodeWeight(Integer.MAX_VALUE));
    assertEquals(42, SuggestRecordCodec.decodeWeight(SuggestRecordCodec.encodeWeight(42)));
    assertThrows(UnsupportedOperationException.class, () -> SuggestRecordCodec.encodeWeight(-1));
    assertThrows(
        UnsupportedOperationException.class,
        () -> SuggestRecordCodec.encodeWeight(Integer.MAX_VALUE + 1L));
  }

  @Test
  public void testHigherWeightLowerCost() {
    assertTrue(SuggestRecordCodec.encodeWeight(100) < SuggestRecordCodec.encodeWeight(10));
  }

  @Test
  public void testAnalyzedTooLong() {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    BytesRef analyzed = new BytesRef(new byte[SuggestRecordCodec.MAX_LENGTH + 1]);
    assertThrows(
        IllegalArgumentException.class,
        () -> codec.encode(analyzed, 1, new BytesRef("x"), new BytesRef()));
  }

  @Test
  public void testSurfaceTooLongWithPayloads() {
    SuggestRecordCodec codec = new SuggestRecordCodec(true);
    BytesRef surface = new BytesRef(new byte[SuggestRecordCodec.MAX_LENGTH + 1]);
    assertThrows(
        IllegalArgumentException.class,
        () -> codec.encode(new BytesRef("x"), 1, surface, new BytesRef()));
  }

  @Test
  public void testLongSurfaceWithoutPayloads() {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    BytesRef surface = new BytesRef(new byte[SuggestRecordCodec.MAX_LENGTH + 10]);
    BytesRef bytes = codec.encode(new BytesRef("x"), 1, surface, new BytesRef());
    SuggestRecord record = new SuggestRecord();
    codec.decode(bytes, record);
    assertEquals(SuggestRecordCodec.MAX_LENGTH + 10, record.surface.length);
  }

  @Test
  public void testSeparatorInPayloadSurface() {
    SuggestRecordCodec codec = new SuggestRecordCodec(true);
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> codec.encode(new BytesRef("a"), 1, new BytesRef("a\u001Fb"), new BytesRef()));
    assertTrue(e.getMessage().contains("U+001F"));
  }

  @Test
  public void testSeparatorAllowedWithoutPayloads() {
    SuggestRecordCodec codec = new SuggestRecordCodec(false);
    BytesRef bytes = codec.encode(new BytesRef("a"), 1, new BytesRef("a\u001Fb"), new BytesRef());
    SuggestRecord record = new SuggestRecord();
    codec.decode(bytes, record);
    assertEquals("a\u001Fb", record.surface.utf8ToString());
  }
}
