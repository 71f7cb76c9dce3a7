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
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Top level configuration of the suggest tool, read from a yaml stream. */
public class SuggestConfiguration {
  private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([A-Za-z0-9_]+)}");

  public static final Path DEFAULT_USER_DIR =
      Paths.get(System.getProperty("user.home"), "nrtsuggest");
  public static final Path DEFAULT_INDEX_FILE =
      Paths.get(DEFAULT_USER_DIR.toString(), "suggest.fst");
  public static final Path DEFAULT_TEMP_DIR = Paths.get(System.getProperty("java.io.tmpdir"));
  public static final String DEFAULT_TEMP_FILE_PREFIX = "suggest";
  public static final String DEFAULT_ANALYZER = "standard";

  private final String indexFile;
  private final String tempDir;
  private final String tempFilePrefix;
  private final String indexAnalyzer;
  private final String queryAnalyzer;
  private final SuggesterOptions suggesterOptions;

  private final YamlConfigReader configReader;

  public SuggestConfiguration(InputStream yamlStream) {
    configReader = new YamlConfigReader(yamlStream);

    indexFile =
        substituteEnvVariables(configReader.getString("indexFile", DEFAULT_INDEX_FILE.toString()));
    tempDir =
        substituteEnvVariables(configReader.getString("tempDir", DEFAULT_TEMP_DIR.toString()));
    tempFilePrefix = configReader.getString("tempFilePrefix", DEFAULT_TEMP_FILE_PREFIX);
    indexAnalyzer = configReader.getString("indexAnalyzer", DEFAULT_ANALYZER);
    // query side defaults to whatever the index side uses
    queryAnalyzer = configReader.getString("queryAnalyzer", indexAnalyzer);
    suggesterOptions = SuggesterConfig.fromConfig(configReader);
  }

  public String getIndexFile() {
    return indexFile;
  }

  public String getTempDir() {
    return tempDir;
  }

  public String getTempFilePrefix() {
    return tempFilePrefix;
  }

  public String getIndexAnalyzer() {
    return indexAnalyzer;
  }

  public String getQueryAnalyzer() {
    return queryAnalyzer;
  }

  public SuggesterOptions getSuggesterOptions() {
    return suggesterOptions;
  }

  /** Get the underlying reader, for components that read their own config sections. */
  public YamlConfigReader getConfigReader() {
    return configReader;
  }

  static String substituteEnvVariables(String s) {
    String result = s;
    Matcher matcher = ENV_VAR_PATTERN.matcher(s);
    Set<String> foundVars = null;
    while (matcher.find()) {
      if (foundVars == null) {
        foundVars = new HashSet<>();
      }
      foundVars.add(matcher.group(1));
    }

    if (foundVars == null) {
      return result;
    }

    for (String envVar : foundVars) {
      String envStr = System.getenv(envVar);
      if (envStr == null) {
        envStr = "";
      }
      result = result.replace("${" + envVar + "}", envStr);
    }
    return result;
  }
}
