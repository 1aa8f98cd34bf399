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

import com.google.common.annotations.VisibleForTesting;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * CommandLineRunner translates TypeScript declaration files given on the command line.
 *
 * <p>Arguments come in pairs of input and output file, for example:
 *
 * <pre>
 * java -jar ts2fable.jar node_modules/left-pad/index.d.ts src/LeftPad.fs
 * </pre>
 *
 * <p>Pairs are translated in order. The first file that fails stops the run with exit status 1.
 */
public class CommandLineRunner {

  private static class Flags {
    @Option(name = "--help", usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--namespace",
        usage =
            "The root namespace of the generated modules. Defaults to the output file name"
                + " without its extension")
    private String namespace = null;

    @Option(
        name = "--import_ambient_variables",
        usage = "Translate 'declare var' statements into imports of the declaring module")
    private boolean importAmbientVariables = false;

    @Option(
        name = "--browser_open",
        usage = "The namespace opened by files that refer to HTML DOM types")
    private String browserOpen = TranslatorOptions.DEFAULT_BROWSER_OPEN;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level values) for translator"
                + " progress. Does not control errors or warnings for the translated files")
    private String loggingLevel = Level.WARNING.getName();

    @Argument(metaVar = "INPUT OUTPUT", usage = "Pairs of declaration file and F# output file")
    private List<String> arguments = new ArrayList<>();

    private final CmdLineParser parser;

    Flags() {
      parser = new CmdLineParser(this);
    }

    void parse(String[] args) throws CmdLineException {
      parser.parseArgument(args);
      try {
        Level.parse(loggingLevel);
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --logging_level: " + loggingLevel);
      }
      if (!displayHelp && (arguments.isEmpty() || arguments.size() % 2 != 0)) {
        throw new CmdLineException(
            parser, "Expected pairs of INPUT OUTPUT files, got " + arguments.size() + " files");
      }
    }

    void printUsage(PrintStream ps) {
      ps.println("Usage: ts2fable [options] INPUT OUTPUT [INPUT OUTPUT ...]");
      parser.printUsage(ps);
      ps.flush();
    }
  }

  private final Flags flags = new Flags();
  private final PrintStream out;
  private final PrintStream err;
  private boolean isConfigValid = true;

  CommandLineRunner(String[] args) {
    this(args, System.out, System.err);
  }

  @VisibleForTesting
  CommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
    try {
      flags.parse(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      err.flush();
      isConfigValid = false;
    }
  }

  @VisibleForTesting
  boolean isConfigValid() {
    return isConfigValid;
  }

  @VisibleForTesting
  TranslatorOptions createOptions() {
    return new TranslatorOptions()
        .setNamespace(flags.namespace)
        .setImportAmbientVariables(flags.importAmbientVariables)
        .setBrowserOpen(flags.browserOpen);
  }

  /**
   * Runs the translation.
   *
   * @return the process exit status: 0 on success, 1 on a usage or translation error
   */
  public int run() {
    if (!isConfigValid) {
      flags.printUsage(err);
      return 1;
    }
    if (flags.displayHelp) {
      flags.printUsage(out);
      return 0;
    }
    Translator.setLoggingLevel(Level.parse(flags.loggingLevel));
    Translator translator = new Translator(createOptions());
    List<String> arguments = flags.arguments;
    for (int i = 0; i < arguments.size(); i += 2) {
      Path input = Paths.get(arguments.get(i));
      Path output = Paths.get(arguments.get(i + 1));
      if (!translator.translateFile(input, output)) {
        translator.getErrorManager().generateReport();
        return 1;
      }
    }
    translator.getErrorManager().generateReport();
    return 0;
  }

  /** Runs the translator. */
  public static void main(String[] args) {
    System.exit(new CommandLineRunner(args).run());
  }
}
