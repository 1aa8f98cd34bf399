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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.parsing.DeclarationParser;
import com.google.javascript.ts2fable.parsing.DeclarationSyntaxException;
import com.google.javascript.ts2fable.parsing.SyntaxNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Translates TypeScript declaration files into F# bindings for Fable.
 *
 * <p>A translation parses the declarations, lowers them into the F# type model, merges repeated
 * interfaces and namespaces, runs the fix passes of the {@link PassConfig} and prints the result.
 * Files are translated one at a time; the translator keeps no state from one file to the next
 * other than the diagnostics collected by its {@link ErrorManager}.
 */
public class Translator {

  private static final Logger logger = Logger.getLogger("com.google.javascript.ts2fable");

  static final DiagnosticType PARSE_ERROR = DiagnosticType.error("TS2FABLE_PARSE_ERROR", "{0}");

  static final DiagnosticType READ_ERROR =
      DiagnosticType.error("TS2FABLE_READ_ERROR", "Cannot read {0}: {1}");

  static final DiagnosticType WRITE_ERROR =
      DiagnosticType.error("TS2FABLE_WRITE_ERROR", "Cannot write {0}: {1}");

  private final TranslatorOptions options;
  private final ErrorManager errorManager;
  private final PassConfig passConfig;

  /** The root namespace of the file being translated. */
  private String namespace = "";

  public Translator(TranslatorOptions options) {
    this(options, new LoggerErrorManager(logger));
  }

  public Translator(TranslatorOptions options, ErrorManager errorManager) {
    this.options = options;
    this.errorManager = errorManager;
    this.passConfig = new DefaultPassConfig(options);
  }

  public static void setLoggingLevel(Level level) {
    logger.setLevel(level);
  }

  public TranslatorOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /** The root namespace of the file being translated. */
  public String getNamespace() {
    return namespace;
  }

  public boolean hasErrors() {
    return errorManager.getErrorCount() > 0;
  }

  /**
   * Translates {@code input} and writes the result to {@code output}, creating its parent
   * directories when needed. The root namespace is the configured one, or the output file name
   * without its extension.
   *
   * @return whether the file was translated; failures have been reported to the error manager
   */
  public boolean translateFile(Path input, Path output) {
    logger.info("Translating " + input + " to " + output);
    String source;
    try {
      source = Files.readString(input, UTF_8);
    } catch (IOException e) {
      report(TranslationError.make(READ_ERROR, input.toString(), String.valueOf(e.getMessage())));
      return false;
    }
    String fileNamespace =
        options.getNamespace() != null
            ? options.getNamespace()
            : MoreFiles.getNameWithoutExtension(output);
    ImmutableList<String> lines = translate(input.toString(), source, fileNamespace);
    if (lines == null) {
      return false;
    }
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      StringBuilder text = new StringBuilder();
      for (String line : lines) {
        text.append(line).append('\n');
      }
      Files.writeString(output, text, UTF_8);
    } catch (IOException e) {
      report(TranslationError.make(WRITE_ERROR, output.toString(), String.valueOf(e.getMessage())));
      return false;
    }
    logger.info("Wrote " + lines.size() + " lines to " + output);
    return true;
  }

  /**
   * Translates declaration source text.
   *
   * @return the printed lines, or null if a fatal error was reported
   */
  public @Nullable ImmutableList<String> translate(
      String sourceName, String source, String namespace) {
    try {
      return CodePrinter.print(translateToModel(sourceName, source, namespace));
    } catch (TranslationException e) {
      report(e.getError());
      return null;
    }
  }

  /**
   * Parses, lowers, merges and fixes {@code source}, without printing it.
   *
   * @throws TranslationException on a fatal error
   */
  @VisibleForTesting
  FsFile translateToModel(String sourceName, String source, String namespace) {
    this.namespace = namespace;
    SyntaxNode root;
    try {
      root = DeclarationParser.parse(sourceName, source);
    } catch (DeclarationSyntaxException e) {
      throw new TranslationException(
          TranslationError.make(
              e.getSourceName(), e.getLineno(), e.getCharno(), PARSE_ERROR, e.getDescription()),
          e);
    }
    FsFile file =
        new DeclarationReader(sourceName, errorManager)
            .readSourceFile(root, namespace, options.getOpens());
    file = file.withModules(DeclarationMerger.mergeFileModules(file.modules()));
    file = runPasses(passConfig.getModuleFixes(), file);
    return runPasses(passConfig.getFixPasses(), file);
  }

  private FsFile runPasses(List<PassFactory> factories, FsFile file) {
    for (PassFactory factory : factories) {
      if (!factory.isEnabled(options)) {
        continue;
      }
      logger.fine(factory.getName());
      file = factory.create(this).process(file);
    }
    return file;
  }

  private void report(TranslationError error) {
    errorManager.report(error.defaultLevel(), error);
  }
}
