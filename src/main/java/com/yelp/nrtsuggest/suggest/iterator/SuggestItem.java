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

import java.util.Objects;
import org.apache.lucene.util.BytesRef;

/** One suggestion: surface text, weight and an optional payload. */
public class SuggestItem {
  private final BytesRef text;
  private final long weight;
  private final BytesRef payload;

  public SuggestItem(String text, long weight) {
    this(new BytesRef(text), weight, null);
  }

  public SuggestItem(String text, long weight, String payload) {
    this(new BytesRef(text), weight, new BytesRef(payload));
  }

  public SuggestItem(BytesRef text, long weight, BytesRef payload) {
    this.text = Objects.requireNonNull(text);
    this.weight = weight;
    this.payload = payload;
  }

  public BytesRef getText() {
    return text;
  }

  public long getWeight() {
    return weight;
  }

  /** Payload bytes, or null if the item has none. */
  public BytesRef getPayload() {
    return payload;
  }
}
