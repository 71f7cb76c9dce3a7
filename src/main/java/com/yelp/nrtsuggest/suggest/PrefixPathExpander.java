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

import java.io.IOException;
import java.util.List;
import org.apache.lucene.search.suggest.analyzing.FSTUtil;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.PairOutputs.Pair;

/** Extends the prefix paths that seed the top N completion search. */
@FunctionalInterface
public interface PrefixPathExpander {
  PrefixPathExpander IDENTITY = (prefixPaths, lookupAutomaton, fst) -> prefixPaths;

  /**
   * Get all paths the completion search should start from.
   *
   * @param prefixPaths FST nodes reached by the lookup automaton
   * @param lookupAutomaton determinized lookup automaton
   * @param fst suggestion FST
   * @return search start paths
   * @throws IOException on error reading the FST
   */
  List<FSTUtil.Path<Pair<Long, BytesRef>>> expand(
      List<FSTUtil.Path<Pair<Long, BytesRef>>> prefixPaths,
      Automaton lookupAutomaton,
      FST<Pair<Long, BytesRef>> fst)
      throws IOException;
}
