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
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.lucene.search.suggest.Lookup.LookupResult;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import picocli.CommandLine;

@CommandLine.Command(
    name = SuggestLookupCommand.SUGGEST_LOOKUP,
    description = "Load a stored suggest index and print the completions of a text")
public class SuggestLookupCommand implements Callable<Integer> {

  public static final String SUGGEST_LOOKUP = "suggestLookup";

  @CommandLine.ParentCommand private SuggestCommand baseCmd;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
      names = {"--suggestText"},
      description = "Text used for generating suggestions",
      required = true)
  private String suggestText;

  @CommandLine.Option(
      names = {"--count"},
      description = "Maximum count of suggestions to return (default: ${DEFAULT-VALUE})",
      defaultValue = "5")
  private int count;

  @CommandLine.Option(
      names = {"--indexFile"},
      description = "File the index was stored in, overrides the config value")
  private String indexFile;

  @Override
  public Integer call() throws Exception {
    SuggestConfiguration config = baseCmd.getConfiguration();
    Path indexPath = Paths.get(indexFile == null ? config.getIndexFile() : indexFile);
    PrintWriter out = spec.commandLine().getOut();

    // lookup never writes temp files
    try (Directory tempDir = new ByteBuffersDirectory();
        SuggestCommand.SuggesterResources resources = baseCmd.createSuggester(tempDir)) {
      AnalyzingFstSuggester suggester = resources.suggester;
      boolean loaded;
      try (InputStream in = Files.newInputStream(indexPath)) {
        loaded = suggester.load(in);
      }
      if (!loaded) {
        out.println("Suggest index is empty: " + indexPath);
        return 0;
      }
      List<LookupResult> results = suggester.lookup(suggestText, false, count);
      for (LookupResult result : results) {
        StringBuilder line = new StringBuilder();
        line.append(result.key).append('\t').append(result.value);
        if (result.payload != null) {
          line.append('\t').append(result.payload.utf8ToString());
        }
        out.println(line);
      }
    }
    return 0;
  }
}
