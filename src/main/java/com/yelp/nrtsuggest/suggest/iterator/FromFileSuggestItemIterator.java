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
package com.yelp.nrtsuggest.suggest.iterator;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import org.apache.lucene.search.suggest.InputIterator;
import org.apache.lucene.util.BytesRef;

/**
 * An {@link InputIterator} that pulls from a line file, using U+001f to join the suggest text,
 * weight, and optional payload.
 *
 * <p>The format is expected to be: suggest_text␟weight or suggest_text␟weight␟payload
 */
public class FromFileSuggestItemIterator implements InputIterator, Closeable {

  // INFORMATION SEPARATOR ONE to separate fields in each line.
  public static final String FIELD_SEPARATOR = "\u001f";

  private final BufferedReader reader;
  private final boolean hasPayload;
  private final int fieldNum;

  private int lineCount;
  /** How many suggestions were found. */
  public int suggestCount;

  private BytesRef text;
  private long weight;
  private BytesRef payload;

  public FromFileSuggestItemIterator(File sourceFile, boolean hasPayload) throws IOException {
    reader =
        new BufferedReader(
            new InputStreamReader(new FileInputStream(sourceFile), StandardCharsets.UTF_8),
            65536);
    this.hasPayload = hasPayload;
    this.suggestCount = 0;
    this.fieldNum = 2 + (hasPayload ? 1 : 0);
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  @Override
  public long weight() {
    return weight;
  }

  @Override
  public BytesRef payload() {
    if (hasPayload) {
      return payload;
    }
    return null;
  }

  @Override
  public boolean hasPayloads() {
    return hasPayload;
  }

  @Override
  public Set<BytesRef> contexts() {
    return null;
  }

  @Override
  public boolean hasContexts() {
    return false;
  }

  @Override
  public BytesRef next() throws IOException {
    while (true) {
      String line = reader.readLine();
      if (line == null) {
        return null;
      }
      lineCount++;
      if (parseLine(line)) {
        break;
      }
    }
    suggestCount++;
    return text;
  }

  private boolean parseLine(String line) {
    if (line.trim().isEmpty()) {
      return false;
    }

    // keep trailing empty payloads
    String[] fieldArray = line.split(FIELD_SEPARATOR, -1);
    if (fieldArray.length != fieldNum) {
      throw new IllegalArgumentException(
          "line " + lineCount + " is malformed: expected " + fieldNum + " fields");
    }
    int itemIndex = 0;

    text = new BytesRef(fieldArray[itemIndex++]);
    try {
      weight = Long.parseLong(fieldArray[itemIndex++].trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("line " + lineCount + " has an invalid weight", e);
    }
    if (hasPayload) {
      payload = new BytesRef(fieldArray[itemIndex]);
    }
    return true;
  }
}
