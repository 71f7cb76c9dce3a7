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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FilterDirectory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefIterator;
import org.apache.lucene.util.OfflineSorter;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ExternalRecordSorterTest {
  private Directory dir;

  @Before
  public void before() {
    dir = new ByteBuffersDirectory();
  }

  @After
  public void after() throws IOException {
    dir.close();
  }

  private ExternalRecordSorter newSorter() throws IOException {
    return new ExternalRecordSorter(dir, "sorter_test", Comparator.naturalOrder());
  }

  private static List<String> drain(BytesRefIterator iterator) throws IOException {
    List<String> values = new ArrayList<>();
    for (BytesRef ref = iterator.next(); ref != null; ref = iterator.next()) {
      values.add(ref.utf8ToString());
    }
    return values;
  }

  @Test
  public void testSortAndCleanup() throws IOException {
    ExternalRecordSorter sorter = newSorter();
    sorter.add(new BytesRef("pear"));
    sorter.add(new BytesRef("apple"));
    sorter.add(new BytesRef("fig"));
    sorter.add(new BytesRef("apple"));
    assertEquals(4, sorter.getRecordCount());

    BytesRefIterator sorted = sorter.sort();
    // only the sorted copy remains during iteration
    assertEquals(1, dir.listAll().length);
    assertEquals(List.of("apple", "apple", "fig", "pear"), drain(sorted));

    sorter.close();
    assertEquals(0, dir.listAll().length);
  }

  @Test
  public void testEmpty() throws IOException {
    ExternalRecordSorter sorter = newSorter();
    BytesRefIterator sorted = sorter.sort();
    assertNull(sorted.next());
    sorter.close();
    assertEquals(0, dir.listAll().length);
  }

  @Test
  public void testAbortBeforeSort() throws IOException {
    ExternalRecordSorter sorter = newSorter();
    sorter.add(new BytesRef("a"));
    assertEquals(1, dir.listAll().length);
    sorter.abort();
    assertEquals(0, dir.listAll().length);
  }

  @Test
  public void testAbortAfterSort() throws IOException {
    ExternalRecordSorter sorter = newSorter();
    sorter.add(new BytesRef("b"));
    sorter.add(new BytesRef("a"));
    BytesRefIterator sorted = sorter.sort();
    assertEquals(new BytesRef("a"), sorted.next());
    sorter.abort();
    assertEquals(0, dir.listAll().length);
  }

  @Test
  public void testAddAfterSort() throws IOException {
    ExternalRecordSorter sorter = newSorter();
    sorter.sort();
    try {
      assertThrows(IllegalStateException.class, () -> sorter.add(new BytesRef("a")));
      assertThrows(IllegalStateException.class, sorter::sort);
    } finally {
      sorter.close();
    }
  }

  @Test
  public void testCustomComparator() throws IOException {
    ExternalRecordSorter sorter =
        new ExternalRecordSorter(dir, "sorter_test", Comparator.<BytesRef>reverseOrder());
    sorter.add(new BytesRef("a"));
    sorter.add(new BytesRef("c"));
    sorter.add(new BytesRef("b"));
    assertEquals(List.of("c", "b", "a"), drain(sorter.sort()));
    sorter.close();
  }

  @Test
  public void testSpillAndMergeLargerThanBuffer() throws IOException {
    List<String> expected = new ArrayList<>();
    // 30000 records of 100 bytes need several 1mb partitions
    String padding = "x".repeat(92);
    for (int i = 0; i < 30000; i++) {
      expected.add(String.format("%08d", i) + padding);
    }
    List<String> shuffled = new ArrayList<>(expected);
    Collections.shuffle(shuffled, new Random(42));

    int[] tempOutputs = new int[1];
    Directory countingDir =
        new FilterDirectory(dir) {
          @Override
          public IndexOutput createTempOutput(String prefix, String suffix, IOContext context)
              throws IOException {
            tempOutputs[0]++;
            return super.createTempOutput(prefix, suffix, context);
          }
        };
    ExternalRecordSorter sorter =
        new ExternalRecordSorter(
            countingDir,
            "sorter_test",
            Comparator.naturalOrder(),
            OfflineSorter.BufferSize.megabytes(1),
            2);
    for (String value : shuffled) {
      sorter.add(new BytesRef(value));
    }
    BytesRefIterator sorted = sorter.sort();
    // unsorted input, at least two spilled partitions and the merged output
    assertTrue(tempOutputs[0] >= 4);
    assertEquals(1, dir.listAll().length);
    assertEquals(expected, drain(sorted));

    sorter.close();
    assertEquals(0, dir.listAll().length);
  }
}
