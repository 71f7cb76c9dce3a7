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
package com.yelp.nrtsuggest.config;

import com.yelp.nrtsuggest.suggest.SuggesterOptions;

/** Class containing the build and lookup options of the suggester. */
public class SuggesterConfig {
  private static final String CONFIG_PREFIX = "suggester.";
  static final boolean DEFAULT_EXACT_FIRST = true;
  static final boolean DEFAULT_PRESERVE_SEP = true;
  static final boolean DEFAULT_PRESERVE_POSITION_INCREMENTS = true;

  /**
   * Create options from provided configuration reader. Missing keys take the values of {@link
   * SuggesterOptions#defaults()}.
   *
   * @param configReader config reader
   * @return validated suggester options
   * @throws IllegalArgumentException if a configured limit is out of range
   */
  public static SuggesterOptions fromConfig(YamlConfigReader configReader) {
    boolean exactFirst = configReader.getBoolean(CONFIG_PREFIX + "exactFirst", DEFAULT_EXACT_FIRST);
    boolean preserveSep =
        configReader.getBoolean(CONFIG_PREFIX + "preserveSep", DEFAULT_PRESERVE_SEP);
    int maxSurfaceForms =
        configReader.getInteger(
            CONFIG_PREFIX + "maxSurfaceFormsPerAnalyzedForm",
            SuggesterOptions.DEFAULT_MAX_SURFACE_FORMS_PER_ANALYZED_FORM);
    int maxGraphExpansions =
        configReader.getInteger(
            CONFIG_PREFIX + "maxGraphExpansions", SuggesterOptions.UNLIMITED_GRAPH_EXPANSIONS);
    boolean preservePositionIncrements =
        configReader.getBoolean(
            CONFIG_PREFIX + "preservePositionIncrements", DEFAULT_PRESERVE_POSITION_INCREMENTS);
    return SuggesterOptions.newBuilder()
        .setExactFirst(exactFirst)
        .setPreserveSep(preserveSep)
        .setMaxSurfaceFormsPerAnalyzedForm(maxSurfaceForms)
        .setMaxGraphExpansions(maxGraphExpansions)
        .setPreservePositionIncrements(preservePositionIncrements)
        .build();
  }

  private SuggesterConfig() {}
}
