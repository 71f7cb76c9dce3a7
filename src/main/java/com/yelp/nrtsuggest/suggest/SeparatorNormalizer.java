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

import org.apache.lucene.analysis.TokenStreamToAutomaton;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.Operations;
import org.apache.lucene.util.automaton.Transition;

/**
 * Rewrites the position separator and position hole labels produced by {@link
 * TokenStreamToAutomaton}.
 *
 * <p>A separator becomes {@link #SEP_LABEL} when separators are preserved, otherwise it is spliced
 * out: the outgoing transitions and the accept status of its destination are copied onto its
 * source. Holes are always spliced out, which leaves two separators next to each other; those only
 * match another hole at lookup time.
 *
 * <p>Splicing can make the automaton non-deterministic. The returned automaton computes its own
 * deterministic flag, so callers must determinize it before intersecting it with an FST.
 */
public class SeparatorNormalizer {
  /** Label used for a preserved token boundary. */
  public static final int SEP_LABEL = '\u001F';

  private final boolean preserveSep;

  public SeparatorNormalizer(boolean preserveSep) {
    this.preserveSep = preserveSep;
  }

  public boolean isPreserveSep() {
    return preserveSep;
  }

  /**
   * Build a normalized copy of the given automaton. The input is not modified.
   *
   * @param automaton acyclic automaton over byte labels
   * @return automaton without hole labels and with separators remapped or removed
   */
  public Automaton normalize(Automaton automaton) {
    Automaton.Builder result =
        new Automaton.Builder(automaton.getNumStates(), automaton.getNumTransitions());
    result.copyStates(automaton);

    Transition t = new Transition();
    int[] topoOrder = Operations.topoSortStates(automaton);
    // children before parents, so spliced destinations are already rewritten
    for (int i = topoOrder.length - 1; i >= 0; i--) {
      int state = topoOrder[i];
      int count = automaton.initTransition(state, t);
      for (int j = 0; j < count; j++) {
        automaton.getNextTransition(t);
        if (t.min == TokenStreamToAutomaton.POS_SEP) {
          assert t.max == TokenStreamToAutomaton.POS_SEP;
          if (preserveSep) {
            result.addTransition(state, t.dest, SEP_LABEL);
          } else {
            result.addEpsilon(state, t.dest);
          }
        } else if (t.min == TokenStreamToAutomaton.HOLE) {
          assert t.max == TokenStreamToAutomaton.HOLE;
          result.addEpsilon(state, t.dest);
        } else {
          result.addTransition(state, t.dest, t.min, t.max);
        }
      }
    }
    return result.finish();
  }
}
