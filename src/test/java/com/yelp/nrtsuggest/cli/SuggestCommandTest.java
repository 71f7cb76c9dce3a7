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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import picocli.CommandLine;

public class SuggestCommandTest {

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private Path configFile;
  private Path indexFile;
  private Path tempDir;
  private StringWriter output;

  @Before
  public void before() throws IOException {
    tempDir = folder.newFolder("tmp").toPath();
    indexFile = folder.getRoot().toPath().resolve("index").resolve("suggest.fst");
    configFile = folder.getRoot().toPath().resolve("config.yaml");
    Files.writeString(
        configFile,
        String.join(
            "\n",
            "indexFile: " + indexFile,
            "tempDir: " + tempDir,
            "tempFilePrefix: cli_test",
            "indexAnalyzer: standard",
            "suggester:",
            "  maxSurfaceFormsPerAnalyzedForm: 16"));
  }

  private int execute(String... args) {
    output = new StringWriter();
    CommandLine cmd = new CommandLine(new SuggestCommand());
    cmd.setOut(new PrintWriter(output, true));
    return cmd.execute(args);
  }

  private List<String> outputLines() {
    return output.toString().lines().collect(Collectors.toList());
  }

  private File writeInput(String... lines) throws IOException {
    Path input = folder.newFile().toPath();
    Files.write(input, List.of(lines), StandardCharsets.UTF_8);
    return input.toFile();
  }

  @Test
  public void testBuildAndLookup() throws IOException {
    File input =
        writeInput("new york\u001f10", "new york city\u001f5", "new york yankees\u001f7");

    int exitCode = execute("--config=" + configFile, "buildSuggest", "--input=" + input);
    assertEquals(0, exitCode);
    assertTrue(Files.exists(indexFile));
    assertTrue(output.toString().contains("entries: 3"));
    assertEquals(0, tempDir.toFile().list().length);

    exitCode =
        execute("--config=" + configFile, "suggestLookup", "--suggestText=new y", "--count=2");
    assertEquals(0, exitCode);
    assertEquals(List.of("new york\t10", "new york yankees\t7"), outputLines());
  }

  @Test
  public void testPayloads() throws IOException {
    File input = writeInput("new york\u001f10\u001fNY", "boston\u001f3\u001fMA");

    int exitCode =
        execute("--config=" + configFile, "buildSuggest", "--input=" + input, "--payloads");
    assertEquals(0, exitCode);

    exitCode = execute("--config=" + configFile, "suggestLookup", "--suggestText=bo");
    assertEquals(0, exitCode);
    assertEquals(List.of("boston\t3\tMA"), outputLines());
  }

  @Test
  public void testIndexFileOverride() throws IOException {
    File input = writeInput("seattle\u001f4");
    Path otherIndex = folder.getRoot().toPath().resolve("other.fst");

    int exitCode =
        execute(
            "--config=" + configFile,
            "buildSuggest",
            "--input=" + input,
            "--indexFile=" + otherIndex);
    assertEquals(0, exitCode);
    assertTrue(Files.exists(otherIndex));
    assertFalse(Files.exists(indexFile));

    exitCode =
        execute(
            "--config=" + configFile,
            "suggestLookup",
            "--suggestText=sea",
            "--indexFile=" + otherIndex);
    assertEquals(0, exitCode);
    assertEquals(List.of("seattle\t4"), outputLines());
  }

  @Test
  public void testEmptyIndex() throws IOException {
    File input = writeInput();

    assertEquals(0, execute("--config=" + configFile, "buildSuggest", "--input=" + input));
    assertEquals(0, execute("--config=" + configFile, "suggestLookup", "--suggestText=a"));
    assertTrue(output.toString().startsWith("Suggest index is empty"));
  }

  @Test
  public void testMalformedInput() throws IOException {
    File input = writeInput("no weight here");

    int exitCode = execute("--config=" + configFile, "buildSuggest", "--input=" + input);
    assertEquals(1, exitCode);
    assertFalse(Files.exists(indexFile));
    assertEquals(0, tempDir.toFile().list().length);
  }

  @Test
  public void testMissingIndexFile() {
    int exitCode = execute("--config=" + configFile, "suggestLookup", "--suggestText=a");
    assertEquals(1, exitCode);
  }

  @Test
  public void testMissingRequiredOption() {
    assertEquals(2, execute("--config=" + configFile, "buildSuggest"));
  }
}
