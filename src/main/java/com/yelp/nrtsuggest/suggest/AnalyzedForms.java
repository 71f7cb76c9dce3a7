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
import java.util.LinkedHashSet;
import java.util.Set;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.TokenStreamToAutomaton;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.LimitedFiniteStringsIterator;
import org.apache.lucene.util.automaton.Operations;

/**
 * Turns text into analyzed byte automata. Index text is expanded into its distinct finite paths,
 * query text into a determinized automaton used to walk the FST.
 */
class AnalyzedForms {
  private final SeparatorNormalizer normalizer;
  private final AutomatonConverter automatonConverter;
  private final boolean preservePositionIncrements;
  private final int maxGraphExpansions;

  AnalyzedForms(SuggesterOptions options, AutomatonConverter automatonConverter) {
    this.normalizer = new SeparatorNormalizer(options.isPreserveSep());
    this.automatonConverter = automatonConverter;
    this.preservePositionIncrements = options.isPreservePositionIncrements();
    this.maxGraphExpansions = options.getMaxGraphExpansions();
  }

  private TokenStreamToAutomaton newTokenStreamToAutomaton() {
    TokenStreamToAutomaton tsta = new TokenStreamToAutomaton();
    tsta.setPreservePositionIncrements(preservePositionIncrements);
    tsta.setFinalOffsetGapAsHole(true);
    return tsta;
  }

  private Automaton analyze(Analyzer analyzer, String text) throws IOException {
    Automaton automaton;
    try (TokenStream ts = analyzer.tokenStream("", text)) {
      automaton = newTokenStreamToAutomaton().toAutomaton(ts);
    }
    return normalizer.normalize(automaton);
  }

  /**
   * Analyze a surface form and collect the distinct analyzed paths of its token graph, at most
   * maxGraphExpansions of them.
   *
   * @param analyzer index analyzer
   * @param surfaceForm utf8 surface text
   * @return analyzed paths, one label per byte
   * @throws IOException on analysis error
   */
  Set<IntsRef> toFiniteStrings(Analyzer analyzer, BytesRef surfaceForm) throws IOException {
    Automaton automaton = automatonConverter.convert(analyze(analyzer, surfaceForm.utf8ToString()));
    assert Operations.isFinite(automaton);

    // an analyzer that builds a graph (synonyms, word delimiters) yields several paths
    Set<IntsRef> paths = new LinkedHashSet<>();
    LimitedFiniteStringsIterator finiteStrings =
        new LimitedFiniteStringsIterator(automaton, maxGraphExpansions);
    for (IntsRef string; (string = finiteStrings.next()) != null; ) {
      paths.add(IntsRef.deepCopyOf(string));
    }
    return paths;
  }

  /**
   * Analyze query text into a deterministic automaton. The {@link AutomatonConverter} is not
   * applied here.
   *
   * @param analyzer query analyzer
   * @param key query text
   * @return determinized lookup automaton
   * @throws IOException on analysis error
   */
  Automaton toLookupAutomaton(Analyzer analyzer, CharSequence key) throws IOException {
    Automaton automaton = analyze(analyzer, key.toString());
    return Operations.determinize(automaton, Operations.DEFAULT_DETERMINIZE_WORK_LIMIT);
  }
}
