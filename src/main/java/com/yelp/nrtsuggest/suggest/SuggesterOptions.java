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

/**
 * Immutable build and lookup options of an {@link AnalyzingFstSuggester}. All values are validated
 * when the options are created, so a suggester never starts with an invalid configuration.
 */
public class SuggesterOptions {
  /** Always return the exact match first, regardless of weight. */
  public static final int EXACT_FIRST = 1;
  /** Preserve token boundaries in the analyzed form. */
  public static final int PRESERVE_SEP = 2;

  public static final int DEFAULT_MAX_SURFACE_FORMS_PER_ANALYZED_FORM = 256;
  public static final int UNLIMITED_GRAPH_EXPANSIONS = -1;

  // one dedup byte per analyzed form bounds this
  static final int MAX_SURFACE_FORMS_LIMIT = 256;

  private final boolean exactFirst;
  private final boolean preserveSep;
  private final int maxSurfaceFormsPerAnalyzedForm;
  private final int maxGraphExpansions;
  private final boolean preservePositionIncrements;

  private SuggesterOptions(Builder builder) {
    if (builder.maxSurfaceFormsPerAnalyzedForm <= 0
        || builder.maxSurfaceFormsPerAnalyzedForm > MAX_SURFACE_FORMS_LIMIT) {
      throw new IllegalArgumentException(
          "maxSurfaceFormsPerAnalyzedForm must be > 0 and <= "
              + MAX_SURFACE_FORMS_LIMIT
              + " (got: "
              + builder.maxSurfaceFormsPerAnalyzedForm
              + ")");
    }
    if (builder.maxGraphExpansions < 1
        && builder.maxGraphExpansions != UNLIMITED_GRAPH_EXPANSIONS) {
      throw new IllegalArgumentException(
          "maxGraphExpansions must be -1 (no limit) or > 0 (got: "
              + builder.maxGraphExpansions
              + ")");
    }
    this.exactFirst = builder.exactFirst;
    this.preserveSep = builder.preserveSep;
    this.maxSurfaceFormsPerAnalyzedForm = builder.maxSurfaceFormsPerAnalyzedForm;
    this.maxGraphExpansions = builder.maxGraphExpansions;
    this.preservePositionIncrements = builder.preservePositionIncrements;
  }

  /** Options with {@code EXACT_FIRST | PRESERVE_SEP}, 256 surface forms, no expansion limit. */
  public static SuggesterOptions defaults() {
    return newBuilder().build();
  }

  /**
   * Create options from an {@link #EXACT_FIRST} / {@link #PRESERVE_SEP} bit mask.
   *
   * @throws IllegalArgumentException if the mask contains any other bit, or a limit is out of
   *     range
   */
  public static SuggesterOptions fromFlags(
      int options,
      int maxSurfaceFormsPerAnalyzedForm,
      int maxGraphExpansions,
      boolean preservePositionIncrements) {
    if ((options & ~(EXACT_FIRST | PRESERVE_SEP)) != 0) {
      throw new IllegalArgumentException(
          "options should only contain EXACT_FIRST and PRESERVE_SEP; got " + options);
    }
    return newBuilder()
        .setExactFirst((options & EXACT_FIRST) != 0)
        .setPreserveSep((options & PRESERVE_SEP) != 0)
        .setMaxSurfaceFormsPerAnalyzedForm(maxSurfaceFormsPerAnalyzedForm)
        .setMaxGraphExpansions(maxGraphExpansions)
        .setPreservePositionIncrements(preservePositionIncrements)
        .build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public boolean isExactFirst() {
    return exactFirst;
  }

  public boolean isPreserveSep() {
    return preserveSep;
  }

  public int getMaxSurfaceFormsPerAnalyzedForm() {
    return maxSurfaceFormsPerAnalyzedForm;
  }

  /** Maximum number of analyzed paths kept for one input, or -1 for no limit. */
  public int getMaxGraphExpansions() {
    return maxGraphExpansions;
  }

  public boolean isPreservePositionIncrements() {
    return preservePositionIncrements;
  }

  @Override
  public String toString() {
    return "SuggesterOptions{exactFirst="
        + exactFirst
        + ", preserveSep="
        + preserveSep
        + ", maxSurfaceFormsPerAnalyzedForm="
        + maxSurfaceFormsPerAnalyzedForm
        + ", maxGraphExpansions="
        + maxGraphExpansions
        + ", preservePositionIncrements="
        + preservePositionIncrements
        + "}";
  }

  public static class Builder {
    private boolean exactFirst = true;
    private boolean preserveSep = true;
    private int maxSurfaceFormsPerAnalyzedForm = DEFAULT_MAX_SURFACE_FORMS_PER_ANALYZED_FORM;
    private int maxGraphExpansions = UNLIMITED_GRAPH_EXPANSIONS;
    private boolean preservePositionIncrements = true;

    private Builder() {}

    public Builder setExactFirst(boolean exactFirst) {
      this.exactFirst = exactFirst;
      return this;
    }

    public Builder setPreserveSep(boolean preserveSep) {
      this.preserveSep = preserveSep;
      return this;
    }

    public Builder setMaxSurfaceFormsPerAnalyzedForm(int maxSurfaceFormsPerAnalyzedForm) {
      this.maxSurfaceFormsPerAnalyzedForm = maxSurfaceFormsPerAnalyzedForm;
      return this;
    }

    public Builder setMaxGraphExpansions(int maxGraphExpansions) {
      this.maxGraphExpansions = maxGraphExpansions;
      return this;
    }

    public Builder setPreservePositionIncrements(boolean preservePositionIncrements) {
      this.preservePositionIncrements = preservePositionIncrements;
      return this;
    }

    /**
     * Validate and create the options.
     *
     * @throws IllegalArgumentException if a limit is out of range
     */
    public SuggesterOptions build() {
      return new SuggesterOptions(this);
    }
  }
}
