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
package com.yelp.nrtsuggest.analysis;

/**
 * Provider of a named analysis component, such as an {@link org.apache.lucene.analysis.Analyzer}.
 *
 * @param <T> provided component type
 */
@FunctionalInterface
public interface AnalysisProvider<T> {

  /**
   * Create a new instance of the component.
   *
   * @param name name the component was registered with
   * @return component instance
   */
  T get(String name);
}
