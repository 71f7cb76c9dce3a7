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
package com.yelp.nrtsuggest.cli;

import com.yelp.nrtsuggest.analysis.AnalyzerCreator;
import com.yelp.nrtsuggest.config.SuggestConfiguration;
import com.yelp.nrtsuggest.suggest.AnalyzingFstSuggester;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/*Each new command needs to be added here*/
@CommandLine.Command(
    name = "nrtsuggest",
    synopsisSubcommandLabel = "COMMAND",
    subcommands = {
      BuildSuggestCommand.class,
      SuggestLookupCommand.class,
      CommandLine.HelpCommand.class
    })
public class SuggestCommand implements Runnable {
  private static final Logger logger = LoggerFactory.getLogger(SuggestCommand.class);

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "Yaml config file, uses default settings if not set")
  private String configFile;

  private SuggestConfiguration configuration;

  public static void main(String[] args) {
    System.exit(new CommandLine(new SuggestCommand()).execute(args));
  }

  @Override
  public void run() {
    // if only the base command is run, just print the usage
    new CommandLine(this).execute("help");
  }

  /** Get the configuration read from the config file, or the default one. */
  public SuggestConfiguration getConfiguration() throws IOException {
    if (configuration == null) {
      if (configFile == null) {
        configuration = new SuggestConfiguration(new ByteArrayInputStream(new byte[0]));
      } else {
        logger.info("Reading config file: {}", configFile);
        try (InputStream configStream = Files.newInputStream(Paths.get(configFile))) {
          configuration = new SuggestConfiguration(configStream);
        }
      }
    }
    return configuration;
  }

  /**
   * Create a suggester with the configured analyzers and options. The caller owns the analyzers
   * of the returned suggester through {@link SuggesterResources}.
   */
  SuggesterResources createSuggester(Directory tempDir) throws IOException {
    SuggestConfiguration config = getConfiguration();
    AnalyzerCreator analyzerCreator = new AnalyzerCreator(config.getConfigReader());
    Analyzer indexAnalyzer = analyzerCreator.getAnalyzer(config.getIndexAnalyzer());
    Analyzer queryAnalyzer =
        config.getQueryAnalyzer().equals(config.getIndexAnalyzer())
            ? indexAnalyzer
            : analyzerCreator.getAnalyzer(config.getQueryAnalyzer());
    AnalyzingFstSuggester suggester =
        new AnalyzingFstSuggester(
            tempDir,
            config.getTempFilePrefix(),
            indexAnalyzer,
            queryAnalyzer,
            config.getSuggesterOptions());
    return new SuggesterResources(suggester, indexAnalyzer, queryAnalyzer);
  }

  /** Suggester along with the analyzers that must be closed once it is no longer used. */
  static class SuggesterResources implements AutoCloseable {
    final AnalyzingFstSuggester suggester;
    private final Analyzer indexAnalyzer;
    private final Analyzer queryAnalyzer;

    SuggesterResources(
        AnalyzingFstSuggester suggester, Analyzer indexAnalyzer, Analyzer queryAnalyzer) {
      this.suggester = suggester;
      this.indexAnalyzer = indexAnalyzer;
      this.queryAnalyzer = queryAnalyzer;
    }

    @Override
    public void close() {
      indexAnalyzer.close();
      if (queryAnalyzer != indexAnalyzer) {
        queryAnalyzer.close();
      }
    }
  }
}
