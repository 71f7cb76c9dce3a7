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

import org.apache.lucene.util.BytesRef;

/**
 * Reusable view over one decoded sort record. The byte fields point into the record bytes they
 * were decoded from and are only valid until that buffer is reused.
 */
final class SuggestRecord {
  final BytesRef analyzed = new BytesRef();
  long cost;
  final BytesRef surface = new BytesRef();
  /** Empty unless the record was written with payloads. */
  final BytesRef payload = new BytesRef();
}
