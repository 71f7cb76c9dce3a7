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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.search.suggest.InputIterator;
import org.apache.lucene.search.suggest.Lookup;
import org.apache.lucene.search.suggest.analyzing.FSTUtil;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.apache.lucene.util.BytesRefIterator;
import org.apache.lucene.util.CharsRefBuilder;
import org.apache.lucene.util.IntsRef;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.PairOutputs.Pair;
import org.apache.lucene.util.fst.Util;
import org.apache.lucene.util.fst.Util.Result;
import org.apache.lucene.util.fst.Util.TopResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Suggests completions by matching the analyzed form of the query against the analyzed forms of
 * the suggestions, while returning the original surface text.
 *
 * <p>The index is a weighted FST from analyzed form to {@code (cost, surface)}. It is built by
 * analyzing every input with the index analyzer, expanding its token graph into distinct byte
 * paths, sorting one record per path offline in the temp directory, and feeding the sorted,
 * deduplicated records to the FST compiler. Analyzing means that "ghost chrome" can be suggested
 * for "ghost chr" even when stop words or case differ, and that a synonym graph can contribute
 * several paths for one suggestion.
 *
 * <p>Lookup analyzes the query with the query analyzer, intersects the resulting automaton with the
 * FST and runs a best first search for the highest weighted completions. With {@link
 * SuggesterOptions#isExactFirst()} a suggestion whose surface form equals the query is returned
 * first regardless of its weight. Duplicate surface forms reached through different graph paths
 * are returned once.
 *
 * <p>{@link #build} must not run concurrently with itself. Lookups never block and may run
 * concurrently with each other and with a build; they see either the old or the new index.
 *
 * <p>Example usage: 1. create the suggester with a temp directory and analyzers 2. call build with
 * an {@link InputIterator} 3. call lookup, or store the index and load it into another instance.
 */
public class AnalyzingFstSuggester extends Lookup {
  private static final Logger logger = LoggerFactory.getLogger(AnalyzingFstSuggester.class);

  private static final int HOLE_CHAR = 0x1E;
  private static final int SEP_CHAR = 0x1F;

  private final Analyzer indexAnalyzer;
  private final Analyzer queryAnalyzer;
  private final SuggesterOptions options;
  private final Directory tempDir;
  private final String tempFileNamePrefix;
  private final AutomatonConverter automatonConverter;
  private final PrefixPathExpander prefixPathExpander;
  private final AnalyzedForms analyzedForms;
  private final Object buildLock = new Object();

  private volatile SuggestIndex index = SuggestIndex.EMPTY;

  /** Index and query with the same analyzer and the default options. */
  public AnalyzingFstSuggester(Directory tempDir, String tempFileNamePrefix, Analyzer analyzer) {
    this(tempDir, tempFileNamePrefix, analyzer, analyzer);
  }

  /** Use the default options: exact first, preserve separators, 256 surface forms, no limit. */
  public AnalyzingFstSuggester(
      Directory tempDir,
      String tempFileNamePrefix,
      Analyzer indexAnalyzer,
      Analyzer queryAnalyzer) {
    this(tempDir, tempFileNamePrefix, indexAnalyzer, queryAnalyzer, SuggesterOptions.defaults());
  }

  public AnalyzingFstSuggester(
      Directory tempDir,
      String tempFileNamePrefix,
      Analyzer indexAnalyzer,
      Analyzer queryAnalyzer,
      SuggesterOptions options) {
    this(
        tempDir,
        tempFileNamePrefix,
        indexAnalyzer,
        queryAnalyzer,
        options,
        AutomatonConverter.IDENTITY,
        PrefixPathExpander.IDENTITY);
  }

  /**
   * Create a new suggester.
   *
   * @param tempDir directory holding the temporary sort files during build
   * @param tempFileNamePrefix prefix of the temporary file names
   * @param indexAnalyzer analyzer for suggestion text at build time
   * @param queryAnalyzer analyzer for query text at lookup time
   * @param options build and lookup options
   * @param automatonConverter transform applied to index and lookup automata
   * @param prefixPathExpander transform applied to the prefix paths before the completion search
   */
  public AnalyzingFstSuggester(
      Directory tempDir,
      String tempFileNamePrefix,
      Analyzer indexAnalyzer,
      Analyzer queryAnalyzer,
      SuggesterOptions options,
      AutomatonConverter automatonConverter,
      PrefixPathExpander prefixPathExpander) {
    if (tempDir == null) {
      throw new IllegalArgumentException("tempDir must not be null");
    }
    if (indexAnalyzer == null || queryAnalyzer == null) {
      throw new IllegalArgumentException("indexAnalyzer and queryAnalyzer must be specified");
    }
    this.tempDir = tempDir;
    this.tempFileNamePrefix = tempFileNamePrefix;
    this.indexAnalyzer = indexAnalyzer;
    this.queryAnalyzer = queryAnalyzer;
    this.options = options;
    this.automatonConverter = automatonConverter;
    this.prefixPathExpander = prefixPathExpander;
    this.analyzedForms = new AnalyzedForms(options, automatonConverter);
  }

  public SuggesterOptions getOptions() {
    return options;
  }

  @Override
  public void build(InputIterator iterator) throws IOException {
    if (iterator.hasContexts()) {
      throw new IllegalArgumentException("this suggester doesn't support contexts");
    }
    synchronized (buildLock) {
      long startNs = System.nanoTime();
      boolean hasPayloads = iterator.hasPayloads();
      SuggestRecordCodec codec = new SuggestRecordCodec(hasPayloads);
      ExternalRecordSorter sorter =
          new ExternalRecordSorter(
              tempDir, tempFileNamePrefix, new SuggestRecordComparator(hasPayloads));

      SuggestIndex built;
      boolean success = false;
      try {
        long count = 0;
        int maxAnalyzedPathsForOneInput = 0;
        BytesRef emptyPayload = new BytesRef();
        BytesRefBuilder scratch = new BytesRefBuilder();

        BytesRef surfaceForm;
        while ((surfaceForm = iterator.next()) != null) {
          Set<IntsRef> paths = analyzedForms.toFiniteStrings(indexAnalyzer, surfaceForm);
          maxAnalyzedPathsForOneInput = Math.max(maxAnalyzedPathsForOneInput, paths.size());

          long weight = iterator.weight();
          BytesRef payload = hasPayloads ? iterator.payload() : emptyPayload;
          for (IntsRef path : paths) {
            BytesRef analyzed = Util.toBytesRef(path, scratch);
            sorter.add(codec.encode(analyzed, weight, surfaceForm, payload));
          }
          count++;
        }

        BytesRefIterator sorted = sorter.sort();
        SuggestFstBuilder fstBuilder =
            new SuggestFstBuilder(options.getMaxSurfaceFormsPerAnalyzedForm(), hasPayloads);
        SuggestRecord record = new SuggestRecord();
        for (BytesRef bytes = sorted.next(); bytes != null; bytes = sorted.next()) {
          codec.decode(bytes, record);
          fstBuilder.add(record);
        }
        built =
            new SuggestIndex(fstBuilder.finish(), count, maxAnalyzedPathsForOneInput, hasPayloads);

        logger.info(
            "Built suggest index: {} entries, {} paths, {} keys, max paths {}, {} bytes, {} ms",
            count,
            sorter.getRecordCount(),
            fstBuilder.getKeyCount(),
            maxAnalyzedPathsForOneInput,
            built.ramBytesUsed(),
            (System.nanoTime() - startNs) / 1_000_000);
        success = true;
      } finally {
        if (success) {
          sorter.close();
        } else {
          logger.warn("Suggest index build failed, removing temporary files");
          sorter.abort();
        }
      }
      index = built;
    }
  }

  @Override
  public boolean store(DataOutput output) throws IOException {
    SuggestIndex current = index;
    if (current.fst == null) {
      // loads back as an empty suggester
      output.writeVLong(0);
      return false;
    }
    output.writeVLong(current.count);
    current.fst.save(output, output);
    output.writeVInt(current.maxAnalyzedPathsForOneInput);
    output.writeByte((byte) (current.hasPayloads ? 1 : 0));
    logger.info("Stored suggest index with {} entries", current.count);
    return true;
  }

  @Override
  public boolean load(DataInput input) throws IOException {
    long count = input.readVLong();
    if (count == 0) {
      index = SuggestIndex.EMPTY;
      return false;
    }
    FST<Pair<Long, BytesRef>> fst = new FST<>(input, input, SuggestFstBuilder.newOutputs());
    int maxAnalyzedPathsForOneInput = input.readVInt();
    boolean hasPayloads = input.readByte() == 1;
    index = new SuggestIndex(fst, count, maxAnalyzedPathsForOneInput, hasPayloads);
    logger.info("Loaded suggest index with {} entries, {} bytes", count, fst.ramBytesUsed());
    return true;
  }

  @Override
  public List<LookupResult> lookup(
      CharSequence key, Set<BytesRef> contexts, boolean onlyMorePopular, int num)
      throws IOException {
    if (num <= 0) {
      throw new IllegalArgumentException("num must be > 0 (got: " + num + ")");
    }
    if (onlyMorePopular) {
      throw new IllegalArgumentException("this suggester only works with onlyMorePopular=false");
    }
    if (contexts != null) {
      throw new IllegalArgumentException("this suggester doesn't support contexts");
    }
    for (int i = 0; i < key.length(); i++) {
      if (key.charAt(i) == HOLE_CHAR) {
        throw new IllegalArgumentException(
            "lookup key cannot contain HOLE character U+001E; this character is reserved");
      }
      if (key.charAt(i) == SEP_CHAR) {
        throw new IllegalArgumentException(
            "lookup key cannot contain unit separator character U+001F; this character is reserved");
      }
    }
    if (key.length() == 0) {
      return Collections.emptyList();
    }

    // one snapshot for the whole lookup, a concurrent build swaps in a new one
    SuggestIndex current = index;
    if (current.fst == null) {
      return Collections.emptyList();
    }

    long startNs = System.nanoTime();
    List<LookupResult> results = new SuggestSearch(current, new BytesRef(key)).search(key, num);
    if (logger.isDebugEnabled()) {
      logger.debug(
          "Lookup '{}' returned {} results in {} us",
          key,
          results.size(),
          (System.nanoTime() - startNs) / 1000);
    }
    return results;
  }

  /** Not supported by this suggester. */
  public Object get(CharSequence key) {
    throw new UnsupportedOperationException();
  }

  @Override
  public long getCount() {
    return index.count;
  }

  /** Returns byte size of the underlying FST. */
  @Override
  public long ramBytesUsed() {
    return index.ramBytesUsed();
  }

  /** Largest number of analyzed paths one input expanded to in the current index. */
  public int getMaxAnalyzedPathsForOneInput() {
    return index.maxAnalyzedPathsForOneInput;
  }

  /** Whether the current index was built with payloads. */
  public boolean hasPayloads() {
    return index.hasPayloads;
  }

  /** State of a single lookup. Nothing here is shared between lookups. */
  private class SuggestSearch {
    private final SuggestIndex current;
    private final FST<Pair<Long, BytesRef>> fst;
    private final BytesRef utf8Key;
    private final CharsRefBuilder spare = new CharsRefBuilder();

    SuggestSearch(SuggestIndex current, BytesRef utf8Key) {
      this.current = current;
      this.fst = current.fst;
      this.utf8Key = utf8Key;
    }

    List<LookupResult> search(CharSequence key, int num) throws IOException {
      Automaton lookupAutomaton = analyzedForms.toLookupAutomaton(queryAnalyzer, key);
      List<FSTUtil.Path<Pair<Long, BytesRef>>> prefixPaths =
          FSTUtil.intersectPrefixPaths(automatonConverter.convert(lookupAutomaton), fst);

      final List<LookupResult> results = new ArrayList<>();
      if (options.isExactFirst()) {
        LookupResult exact = findExactMatch(prefixPaths);
        if (exact != null) {
          results.add(exact);
          if (results.size() == num) {
            return results;
          }
        }
      }

      Util.TopNSearcher<Pair<Long, BytesRef>> searcher =
          new Util.TopNSearcher<>(
              fst,
              num - results.size(),
              (int)
                  Math.min(
                      Integer.MAX_VALUE,
                      (long) num * Math.max(1, current.maxAnalyzedPathsForOneInput)),
              WEIGHT_COMPARATOR) {
            private final Set<BytesRef> seen = new HashSet<>();

            @Override
            protected boolean acceptResult(IntsRef input, Pair<Long, BytesRef> output) {
              // graph analysis can reach one surface form through several paths
              if (seen.contains(output.output2)) {
                return false;
              }
              seen.add(output.output2);
              // already returned by the exact match search
              return !options.isExactFirst() || !sameSurfaceForm(output.output2);
            }
          };

      prefixPaths = prefixPathExpander.expand(prefixPaths, lookupAutomaton, fst);
      for (FSTUtil.Path<Pair<Long, BytesRef>> path : prefixPaths) {
        searcher.addStartPaths(path.fstNode, path.output, true, path.input);
      }

      TopResults<Pair<Long, BytesRef>> completions = searcher.search();
      assert completions.isComplete;
      for (Result<Pair<Long, BytesRef>> completion : completions) {
        results.add(toLookupResult(completion.output));
        if (results.size() == num) {
          break;
        }
      }
      return results;
    }

    /**
     * Search the analyzed forms equal to the query for a surface form equal to the query. A
     * prefix path ending at a node with an END_BYTE arc has exactly the query's analyzed form.
     */
    private LookupResult findExactMatch(List<FSTUtil.Path<Pair<Long, BytesRef>>> prefixPaths)
        throws IOException {
      FST.BytesReader bytesReader = fst.getBytesReader();
      FST.Arc<Pair<Long, BytesRef>> scratchArc = new FST.Arc<>();

      int count = 0;
      for (FSTUtil.Path<Pair<Long, BytesRef>> path : prefixPaths) {
        if (fst.findTargetArc(SuggestFstBuilder.END_BYTE, path.fstNode, scratchArc, bytesReader)
            != null) {
          count++;
        }
      }
      if (count == 0) {
        return null;
      }

      // surface form limit pruning may have removed the match below one of several nodes, so
      // every end node is searched
      int topN = count * options.getMaxSurfaceFormsPerAnalyzedForm();
      Util.TopNSearcher<Pair<Long, BytesRef>> searcher =
          new Util.TopNSearcher<>(fst, topN, topN, WEIGHT_COMPARATOR);
      for (FSTUtil.Path<Pair<Long, BytesRef>> path : prefixPaths) {
        if (fst.findTargetArc(SuggestFstBuilder.END_BYTE, path.fstNode, scratchArc, bytesReader)
            != null) {
          searcher.addStartPaths(
              scratchArc, fst.outputs.add(path.output, scratchArc.output()), false, path.input);
        }
      }

      TopResults<Pair<Long, BytesRef>> completions = searcher.search();
      assert completions.isComplete;

      // linear scan, bounded by the end nodes times maxSurfaceFormsPerAnalyzedForm
      for (Result<Pair<Long, BytesRef>> completion : completions) {
        if (sameSurfaceForm(completion.output.output2)) {
          return toLookupResult(completion.output);
        }
      }
      return null;
    }

    private boolean sameSurfaceForm(BytesRef output2) {
      if (current.hasPayloads) {
        // output2 holds at least the PAYLOAD_SEP byte
        if (utf8Key.length >= output2.length) {
          return false;
        }
        for (int i = 0; i < utf8Key.length; i++) {
          if (utf8Key.bytes[utf8Key.offset + i] != output2.bytes[output2.offset + i]) {
            return false;
          }
        }
        return output2.bytes[output2.offset + utf8Key.length] == SuggestRecordCodec.PAYLOAD_SEP;
      }
      return utf8Key.bytesEquals(output2);
    }

    private LookupResult toLookupResult(Pair<Long, BytesRef> output) {
      BytesRef output2 = output.output2;
      long weight = SuggestRecordCodec.decodeWeight(output.output1);
      if (!current.hasPayloads) {
        spare.copyUTF8Bytes(output2);
        return new LookupResult(spare.toString(), weight);
      }

      int sepIndex = -1;
      for (int i = 0; i < output2.length; i++) {
        if (output2.bytes[output2.offset + i] == SuggestRecordCodec.PAYLOAD_SEP) {
          sepIndex = i;
          break;
        }
      }
      assert sepIndex != -1;
      spare.copyUTF8Bytes(output2.bytes, output2.offset, sepIndex);
      int payloadLength = output2.length - sepIndex - 1;
      BytesRef payload = new BytesRef(payloadLength);
      System.arraycopy(
          output2.bytes, output2.offset + sepIndex + 1, payload.bytes, 0, payloadLength);
      payload.length = payloadLength;
      return new LookupResult(spare.toString(), weight, payload);
    }
  }

  private static final Comparator<Pair<Long, BytesRef>> WEIGHT_COMPARATOR =
      (left, right) -> left.output1.compareTo(right.output1);

  /** Immutable FST and metadata, swapped as a whole by build and load. */
  private static final class SuggestIndex {
    static final SuggestIndex EMPTY = new SuggestIndex(null, 0, 0, false);

    final FST<Pair<Long, BytesRef>> fst;
    final long count;
    final int maxAnalyzedPathsForOneInput;
    final boolean hasPayloads;

    SuggestIndex(
        FST<Pair<Long, BytesRef>> fst,
        long count,
        int maxAnalyzedPathsForOneInput,
        boolean hasPayloads) {
      this.fst = fst;
      this.count = count;
      this.maxAnalyzedPathsForOneInput = maxAnalyzedPathsForOneInput;
      this.hasPayloads = hasPayloads;
    }

    long ramBytesUsed() {
      return fst == null ? 0 : fst.ramBytesUsed();
    }
  }
}
