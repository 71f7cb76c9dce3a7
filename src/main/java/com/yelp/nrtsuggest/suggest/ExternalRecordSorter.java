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

import java.io.Closeable;
import java.io.IOException;
import java.util.Comparator;
import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefIterator;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.OfflineSorter;

/**
 * Spills records to a temporary file, sorts them on disk and streams them back in order. The sort
 * never holds the whole input in memory, and knows nothing about the records beyond the
 * comparator.
 *
 * <p>Usage: {@link #add} every record, call {@link #sort} once and iterate the result, then {@link
 * #close} on success or {@link #abort} on failure. Both remove every temporary file.
 */
final class ExternalRecordSorter implements Closeable {
  private final Directory tempDir;
  private final String tempFileNamePrefix;
  private final Comparator<BytesRef> comparator;
  private final OfflineSorter.BufferSize ramBufferSize;
  private final int maxTempFiles;

  private IndexOutput tempInput;
  private OfflineSorter.ByteSequencesWriter writer;
  private OfflineSorter.ByteSequencesReader reader;
  private String unsortedFileName;
  private String sortedFileName;
  private long recordCount;

  ExternalRecordSorter(
      Directory tempDir, String tempFileNamePrefix, Comparator<BytesRef> comparator)
      throws IOException {
    this(
        tempDir,
        tempFileNamePrefix,
        comparator,
        OfflineSorter.BufferSize.automatic(),
        OfflineSorter.MAX_TEMPFILES);
  }

  /**
   * @param ramBufferSize memory used to sort one partition before it is spilled
   * @param maxTempFiles maximum number of partitions merged at once
   */
  ExternalRecordSorter(
      Directory tempDir,
      String tempFileNamePrefix,
      Comparator<BytesRef> comparator,
      OfflineSorter.BufferSize ramBufferSize,
      int maxTempFiles)
      throws IOException {
    this.tempDir = tempDir;
    this.tempFileNamePrefix = tempFileNamePrefix;
    this.comparator = comparator;
    this.ramBufferSize = ramBufferSize;
    this.maxTempFiles = maxTempFiles;
    this.tempInput = tempDir.createTempOutput(tempFileNamePrefix, "input", IOContext.DEFAULT);
    this.unsortedFileName = tempInput.getName();
    this.writer = new OfflineSorter.ByteSequencesWriter(tempInput);
  }

  /** Append one record to the unsorted spill file. */
  void add(BytesRef record) throws IOException {
    if (writer == null) {
      throw new IllegalStateException("records cannot be added after sort");
    }
    writer.write(record);
    recordCount++;
  }

  long getRecordCount() {
    return recordCount;
  }

  /**
   * Sort all added records. The unsorted spill file is deleted once the sorted copy exists.
   *
   * @return iterator over the sorted records, valid until this sorter is closed
   * @throws IOException on error writing or reading temporary files
   */
  BytesRefIterator sort() throws IOException {
    if (writer == null) {
      throw new IllegalStateException("records are already sorted");
    }
    CodecUtil.writeFooter(tempInput);
    writer.close();
    writer = null;
    tempInput = null;

    sortedFileName =
        new OfflineSorter(
                tempDir, tempFileNamePrefix, comparator, ramBufferSize, maxTempFiles, -1, null, 0)
            .sort(unsortedFileName);

    tempDir.deleteFile(unsortedFileName);
    unsortedFileName = null;

    reader =
        new OfflineSorter.ByteSequencesReader(
            tempDir.openChecksumInput(sortedFileName, IOContext.READONCE), sortedFileName);
    return reader;
  }

  /** Close open files and delete temporary files, propagating any error. */
  @Override
  public void close() throws IOException {
    try {
      IOUtils.close(writer, reader);
    } finally {
      writer = null;
      reader = null;
      deleteTempFiles();
    }
  }

  /** Close open files and delete temporary files, suppressing errors so the root cause surfaces. */
  void abort() {
    IOUtils.closeWhileHandlingException(writer, reader);
    writer = null;
    reader = null;
    IOUtils.deleteFilesIgnoringExceptions(tempDir, unsortedFileName, sortedFileName);
    unsortedFileName = null;
    sortedFileName = null;
  }

  private void deleteTempFiles() throws IOException {
    try {
      if (unsortedFileName != null) {
        tempDir.deleteFile(unsortedFileName);
      }
    } finally {
      unsortedFileName = null;
      if (sortedFileName != null) {
        String name = sortedFileName;
        sortedFileName = null;
        tempDir.deleteFile(name);
      }
    }
  }
}
