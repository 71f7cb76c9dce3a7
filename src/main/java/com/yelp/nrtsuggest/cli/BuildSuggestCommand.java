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

import com.yelp.nrtsuggest.config.SuggestConfiguration;
import com.yelp.nrtsuggest.suggest.AnalyzingFstSuggester;
import com.yelp.nrtsuggest.suggest.iterator.FromFileSuggestItemIterator;
import java.io.File;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import picocli.CommandLine;

@CommandLine.Command(
    name = BuildSuggestCommand.BUILD_SUGGEST,
    description = "Build a suggest index from a line file and store it")
public class BuildSuggestCommand implements Callable<Integer> {
  public static final String BUILD_SUGGEST = "buildSuggest";

  @CommandLine.ParentCommand private SuggestCommand baseCmd;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
      names = {"-i", "--input"},
      description =
          "Line file of suggestions, fields separated by U+001F: text, weight, optional payload",
      required = true)
  private String input;

  @CommandLine.Option(
      names = {"--payloads"},
      description = "If every input line has a payload field")
  private boolean payloads;

  @CommandLine.Option(
      names = {"--indexFile"},
      description = "File to store the index in, overrides the config value")
  private String indexFile;

  @Override
  public Integer call() throws Exception {
    SuggestConfiguration config = baseCmd.getConfiguration();
    Path indexPath = Paths.get(indexFile == null ? config.getIndexFile() : indexFile);
    Path tempPath = Paths.get(config.getTempDir());
    Files.createDirectories(tempPath);

    try (Directory tempDir = FSDirectory.open(tempPath);
        SuggestCommand.SuggesterResources resources = baseCmd.createSuggester(tempDir);
        FromFileSuggestItemIterator iterator =
            new FromFileSuggestItemIterator(new File(input), payloads)) {
      AnalyzingFstSuggester suggester = resources.suggester;
      suggester.build(iterator);

      Path parent = indexPath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (OutputStream out = Files.newOutputStream(indexPath)) {
        suggester.store(out);
      }
      spec.commandLine()
          .getOut()
          .println(
              "Built suggest index: "
                  + indexPath
                  + ", entries: "
                  + suggester.getCount()
                  + ", bytes: "
                  + suggester.ramBytesUsed());
    }
    return 0;
  }
}
