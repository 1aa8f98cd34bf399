/*
 * Copyright 2017 The Closure Compiler Authors.
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


package com.google.javascript.ts2fable;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommandLineRunnerTest {

  @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

  private final ByteArrayOutputStream outReader = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errReader = new ByteArrayOutputStream();

  private CommandLineRunner createRunner(String... args) {
    return new CommandLineRunner(
        args,
        new PrintStream(outReader, true, UTF_8),
        new PrintStream(errReader, true, UTF_8));
  }

  private String out() {
    return outReader.toString(UTF_8);
  }

  private String err() {
    return errReader.toString(UTF_8);
  }

  @Test
  public void testHelp() {
    CommandLineRunner runner = createRunner("--help");
    assertThat(runner.isConfigValid()).isTrue();
    assertThat(runner.run()).isEqualTo(0);
    assertThat(out()).contains("Usage: ts2fable [options] INPUT OUTPUT [INPUT OUTPUT ...]");
    assertThat(out()).contains("--import_ambient_variables");
  }

  @Test
  public void testNoArguments() {
    CommandLineRunner runner = createRunner();
    assertThat(runner.isConfigValid()).isFalse();
    assertThat(runner.run()).isEqualTo(1);
    assertThat(err()).contains("Expected pairs of INPUT OUTPUT files, got 0 files");
    assertThat(err()).contains("Usage: ts2fable");
  }

  @Test
  public void testOddArguments() {
    CommandLineRunner runner = createRunner("a.d.ts", "A.fs", "b.d.ts");
    assertThat(runner.isConfigValid()).isFalse();
    assertThat(runner.run()).isEqualTo(1);
    assertThat(err()).contains("got 3 files");
  }

  @Test
  public void testBadLoggingLevel() {
    CommandLineRunner runner = createRunner("--logging_level", "LOUD", "a.d.ts", "A.fs");
    assertThat(runner.isConfigValid()).isFalse();
    assertThat(err()).contains("Bad value for --logging_level: LOUD");
  }

  @Test
  public void testUnknownFlag() {
    assertThat(createRunner("--frobnicate", "a.d.ts", "A.fs").isConfigValid()).isFalse();
  }

  @Test
  public void testDefaultOptions() {
    TranslatorOptions options = createRunner("a.d.ts", "A.fs").createOptions();
    assertThat(options.getNamespace()).isNull();
    assertThat(options.getImportAmbientVariables()).isFalse();
    assertThat(options.getBrowserOpen()).isEqualTo(TranslatorOptions.DEFAULT_BROWSER_OPEN);
  }

  @Test
  public void testFlagsSetOptions() {
    TranslatorOptions options =
        createRunner(
                "--namespace",
                "Bindings",
                "--import_ambient_variables",
                "--browser_open",
                "Browser",
                "a.d.ts",
                "A.fs")
            .createOptions();
    assertThat(options.getNamespace()).isEqualTo("Bindings");
    assertThat(options.getImportAmbientVariables()).isTrue();
    assertThat(options.getBrowserOpen()).isEqualTo("Browser");
  }

  @Test
  public void testTranslatesPairs() throws IOException {
    Path first = tempFolder.newFile("first.d.ts").toPath();
    Files.writeString(first, "interface A { x: number; }\n", UTF_8);
    Path second = tempFolder.newFile("second.d.ts").toPath();
    Files.writeString(second, "declare function f(): void;\n", UTF_8);
    Path root = tempFolder.getRoot().toPath();

    int status =
        createRunner(
                first.toString(),
                root.resolve("First.fs").toString(),
                second.toString(),
                root.resolve("gen/Second.fs").toString())
            .run();

    assertThat(status).isEqualTo(0);
    assertThat(Files.readAllLines(root.resolve("First.fs"), UTF_8))
        .containsAtLeast("module rec First", "    abstract x: float with get, set")
        .inOrder();
    assertThat(Files.readAllLines(root.resolve("gen/Second.fs"), UTF_8))
        .containsAtLeast("module rec Second", "    abstract f: unit -> unit")
        .inOrder();
  }

  @Test
  public void testStopsAtFirstFailure() throws IOException {
    Path broken = tempFolder.newFile("broken.d.ts").toPath();
    Files.writeString(broken, "interface {\n", UTF_8);
    Path good = tempFolder.newFile("good.d.ts").toPath();
    Files.writeString(good, "interface A {}\n", UTF_8);
    Path root = tempFolder.getRoot().toPath();

    int status =
        createRunner(
                broken.toString(),
                root.resolve("Broken.fs").toString(),
                good.toString(),
                root.resolve("Good.fs").toString())
            .run();

    assertThat(status).isEqualTo(1);
    assertThat(Files.exists(root.resolve("Broken.fs"))).isFalse();
    assertThat(Files.exists(root.resolve("Good.fs"))).isFalse();
  }

  @Test
  public void testMissingInput() {
    Path root = tempFolder.getRoot().toPath();
    int status =
        createRunner(root.resolve("missing.d.ts").toString(), root.resolve("M.fs").toString())
            .run();
    assertThat(status).isEqualTo(1);
  }
}
