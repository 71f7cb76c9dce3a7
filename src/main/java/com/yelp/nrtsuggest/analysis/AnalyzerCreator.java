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

import com.yelp.nrtsuggest.config.ConfigKeyNotFoundException;
import com.yelp.nrtsuggest.config.YamlConfigReader;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.text.MessageFormat;
import java.text.ParseException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.classic.ClassicAnalyzer;
import org.apache.lucene.analysis.core.KeywordAnalyzer;
import org.apache.lucene.analysis.core.SimpleAnalyzer;
import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.analysis.custom.CustomAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.util.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link Analyzer} instances by name. A name resolves, in order, to a registered predefined
 * analyzer, a custom analyzer defined in the {@code analyzers} config section, or a Lucene analyzer
 * class loaded by its name relative to {@code org.apache.lucene.analysis}, such as {@code
 * en.English}.
 *
 * <p>Custom analyzers are built with {@link CustomAnalyzer}:
 *
 * <pre>
 *   analyzers:
 *     lowercase_whitespace:
 *       charFilters:
 *         - htmlStrip
 *       tokenizer: whitespace
 *       tokenFilters:
 *         - lowercase
 *         - name: synonym
 *           params:
 *             synonyms: synonyms.txt
 *       positionIncrementGap: 100
 * </pre>
 */
public class AnalyzerCreator {
  private static final Logger logger = LoggerFactory.getLogger(AnalyzerCreator.class);

  private static final String LUCENE_ANALYZER_PATH = "org.apache.lucene.analysis.{0}Analyzer";
  private static final String CUSTOM_SECTION = "analyzers";
  static final String STANDARD = "standard";
  static final String CLASSIC = "classic";
  static final String WHITESPACE = "whitespace";
  static final String SIMPLE = "simple";
  static final String KEYWORD = "keyword";

  private final YamlConfigReader configReader;
  private final List<String> customAnalyzerNames;
  private final Map<String, AnalysisProvider<? extends Analyzer>> analyzerMap = new HashMap<>();

  /**
   * Constructor.
   *
   * @param configReader reader for custom analyzer definitions
   */
  public AnalyzerCreator(YamlConfigReader configReader) {
    this.configReader = configReader;
    this.customAnalyzerNames = configReader.getKeysOrEmpty(CUSTOM_SECTION);
    registerAnalyzer(STANDARD, name -> new StandardAnalyzer());
    registerAnalyzer(CLASSIC, name -> new ClassicAnalyzer());
    registerAnalyzer(WHITESPACE, name -> new WhitespaceAnalyzer());
    registerAnalyzer(SIMPLE, name -> new SimpleAnalyzer());
    registerAnalyzer(KEYWORD, name -> new KeywordAnalyzer());
  }

  /**
   * Register a named analyzer provider.
   *
   * @throws IllegalArgumentException if an analyzer with this name is already registered
   */
  public void registerAnalyzer(String name, AnalysisProvider<? extends Analyzer> provider) {
    if (analyzerMap.containsKey(name)) {
      throw new IllegalArgumentException("Analyzer " + name + " already exists");
    }
    analyzerMap.put(name, provider);
  }

  /**
   * Get a new analyzer instance for the given name.
   *
   * @param name predefined, custom, or Lucene class relative analyzer name
   * @return analyzer instance
   * @throws AnalyzerCreationException if the name cannot be resolved or the analyzer cannot be
   *     built
   */
  public Analyzer getAnalyzer(String name) {
    if (name == null || name.isEmpty()) {
      throw new AnalyzerCreationException("Analyzer name must not be empty");
    }
    AnalysisProvider<? extends Analyzer> provider = analyzerMap.get(name);
    if (provider != null) {
      return provider.get(name);
    }
    if (customAnalyzerNames.contains(name)) {
      return getCustomAnalyzer(name);
    }
    // Try to dynamically load the analyzer class
    try {
      String className = MessageFormat.format(LUCENE_ANALYZER_PATH, name);
      return (Analyzer)
          AnalyzerCreator.class
              .getClassLoader()
              .loadClass(className)
              .getDeclaredConstructor()
              .newInstance();
    } catch (InstantiationException
        | IllegalAccessException
        | NoSuchMethodException
        | ClassNotFoundException
        | InvocationTargetException
        | ClassCastException e) {
      throw new AnalyzerCreationException("Unable to find predefined analyzer: " + name, e);
    }
  }

  private Analyzer getCustomAnalyzer(String name) {
    String prefix = CUSTOM_SECTION + "." + name + ".";
    CustomAnalyzer.Builder builder = CustomAnalyzer.builder();
    try {
      Integer positionIncrementGap = configReader.getInteger(prefix + "positionIncrementGap", null);
      if (positionIncrementGap != null) {
        builder.withPositionIncrementGap(positionIncrementGap);
      }
      Integer offsetGap = configReader.getInteger(prefix + "offsetGap", null);
      if (offsetGap != null) {
        builder.withOffsetGap(offsetGap);
      }
      String matchVersion = configReader.getString(prefix + "defaultMatchVersion", null);
      if (matchVersion != null) {
        builder.withDefaultMatchVersion(Version.parseLeniently(matchVersion));
      }

      for (NameAndParams charFilter :
          configReader.getList(
              prefix + "charFilters", NameAndParams.READER, Collections.emptyList())) {
        builder.addCharFilter(charFilter.getName(), charFilter.getParams());
      }

      NameAndParams tokenizer = configReader.get(prefix + "tokenizer", NameAndParams.READER);
      builder.withTokenizer(tokenizer.getName(), tokenizer.getParams());

      for (NameAndParams tokenFilter :
          configReader.getList(
              prefix + "tokenFilters", NameAndParams.READER, Collections.emptyList())) {
        builder.addTokenFilter(tokenFilter.getName(), tokenFilter.getParams());
      }

      CustomAnalyzer analyzer = builder.build();
      logger.debug("Built custom analyzer {}: {}", name, analyzer);
      return analyzer;
    } catch (ConfigKeyNotFoundException e) {
      throw new AnalyzerCreationException("Custom analyzer " + name + " requires a tokenizer", e);
    } catch (ParseException | IOException | IllegalArgumentException e) {
      throw new AnalyzerCreationException("Unable to create custom analyzer: " + name, e);
    }
  }
}
