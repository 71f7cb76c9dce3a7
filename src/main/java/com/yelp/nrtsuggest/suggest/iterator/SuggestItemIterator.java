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

import java.util.Iterator;
import java.util.List;
import java.util.Set;
import org.apache.lucene.search.suggest.InputIterator;
import org.apache.lucene.util.BytesRef;

/**
 * An {@link InputIterator} over in memory {@link SuggestItem}s. Unless given explicitly, payloads
 * are enabled when the first item has one. With payloads enabled an item without payload gets an
 * empty one.
 */
public class SuggestItemIterator implements InputIterator {
  private static final BytesRef EMPTY_PAYLOAD = new BytesRef();

  private final Iterator<SuggestItem> items;
  private final boolean hasPayloads;
  private SuggestItem current;

  public SuggestItemIterator(List<SuggestItem> items) {
    this(items, !items.isEmpty() && items.get(0).getPayload() != null);
  }

  public SuggestItemIterator(List<SuggestItem> items, boolean hasPayloads) {
    this.items = items.iterator();
    this.hasPayloads = hasPayloads;
  }

  @Override
  public BytesRef next() {
    if (items.hasNext()) {
      current = items.next();
      return current.getText();
    }
    current = null;
    return null;
  }

  @Override
  public long weight() {
    return current.getWeight();
  }

  @Override
  public BytesRef payload() {
    if (!hasPayloads) {
      return null;
    }
    return current.getPayload() == null ? EMPTY_PAYLOAD : current.getPayload();
  }

  @Override
  public boolean hasPayloads() {
    return hasPayloads;
  }

  @Override
  public Set<BytesRef> contexts() {
    return null;
  }

  @Override
  public boolean hasContexts() {
    return false;
  }
}
