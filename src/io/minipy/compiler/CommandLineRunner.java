/*
 * Copyright 2026 The Minipy Authors.
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

package io.minipy.compiler;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Stopwatch;
import com.google.common.io.Files;
import io.minipy.ast.Node;
import io.minipy.compiler.parsing.AstReadException;
import io.minipy.compiler.parsing.JsonAstReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * CommandLineRunner translates flags into minimizer options and runs the minimizer over each
 * input.
 *
 * <p>Inputs are syntax trees in the JSON layout read by {@link JsonAstReader}, conventionally
 * named after the program they describe plus {@code .json} ({@code app.py.json}). When the
 * program itself sits next to its tree it competes as the raw candidate. Without {@code --out},
 * {@code app.py.json} is written to {@code app.min.py}, or {@code app.max.py} with {@code
 * --unparse}.
 *
 * <pre>
 * public static void main(String[] args) {
 *   CommandLineRunner runner = new CommandLineRunner(args);
 *   if (runner.shouldRunMinimizer()) {
 *     runner.run();
 *   }
 *   if (runner.hasErrors()) {
 *     System.exit(-1);
 *   }
 * }
 * </pre>
 *
 * This class is not thread-safe.
 */
public class CommandLineRunner {

  private static final Logger logger = Logger.getLogger(CommandLineRunner.class.getName());

  private static final String TREE_SUFFIX = ".json";

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--out",
        aliases = {"-o"},
        usage = "Output file, one per input in the same order. You may specify multiple")
    private List<String> outputs = new ArrayList<>();

    @Option(
        name = "--no_compress",
        handler = BooleanOptionHandler.class,
        usage = "Don't use compression algorithms (lzma, zlib, gzip or bz2)")
    private boolean noCompress = false;

    @Option(
        name = "--force_compress",
        handler = BooleanOptionHandler.class,
        usage = "Always emit an lzma stub, even when it is longer")
    private boolean forceCompress = false;

    @Option(
        name = "--unparse",
        handler = BooleanOptionHandler.class,
        usage = "Return from compressed to standard view")
    private boolean unparse = false;

    @Option(
        name = "--no_suffix",
        handler = BooleanOptionHandler.class,
        usage = "Overwrite the program file instead of adding .min (.max for --unparse)")
    private boolean noSuffix = false;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level values) for minimizer"
                + " progress")
    private String loggingLevel = Level.WARNING.getName();

    @Argument private List<String> arguments = new ArrayList<>();

    private final CmdLineParser parser;

    private Level loggingLevelParsed;

    Flags() {
      parser = new CmdLineParser(this);
    }

    private void parse(List<String> args) throws CmdLineException {
      parser.parseArgument(args.toArray(new String[] {}));

      try {
        loggingLevelParsed = Level.parse(loggingLevel.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --logging_level: " + loggingLevel, e);
      }
      if (arguments.isEmpty()) {
        throw new CmdLineException(parser, "No inputs given");
      }
      if (!outputs.isEmpty() && outputs.size() != arguments.size()) {
        throw new CmdLineException(
            parser,
            "Got " + outputs.size() + " outputs for " + arguments.size() + " inputs");
      }
    }

    private void printUsage(PrintStream ps) {
      ps.println("Usage: minipy [options] TREE.json...");
      parser.printUsage(ps);
      ps.flush();
    }

    private void printShortUsageAfterErrors(PrintStream ps) {
      ps.print("Sample usage: ");
      ps.println("[--no_compress] [--unparse] [--out (-o) VAL] app.py.json");
      ps.println("Run with --help for all options and details");
      ps.flush();
    }
  }

  private final Flags flags = new Flags();

  private final PrintStream out;

  /** Cached error stream to avoid passing it as a parameter to helper functions. */
  private final PrintStream errorStream;

  private boolean runMinimizer = false;

  private boolean errors = false;

  protected CommandLineRunner(String[] args) {
    this(args, System.out, System.err);
  }

  protected CommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.out = out;
    this.errorStream = err;
    initConfigFromFlags(args);
  }

  private static List<String> processArgs(String[] args) {
    // Accept "--flag=value" as well as args4j's "--flag value".
    Pattern argPattern = Pattern.compile("(--?[a-zA-Z_]+)=(.*)");
    Pattern quotesPattern = Pattern.compile("^['\"](.*)['\"]$");
    List<String> processedArgs = new ArrayList<>();

    for (String arg : args) {
      Matcher matcher = argPattern.matcher(arg);
      if (matcher.matches()) {
        processedArgs.add(matcher.group(1));

        String value = matcher.group(2);
        Matcher quotesMatcher = quotesPattern.matcher(value);
        if (quotesMatcher.matches()) {
          processedArgs.add(quotesMatcher.group(1));
        } else {
          processedArgs.add(value);
        }
      } else {
        processedArgs.add(arg);
      }
    }

    return processedArgs;
  }

  private void reportError(String message) {
    errors = true;
    errorStream.println(message);
    errorStream.flush();
  }

  private void initConfigFromFlags(String[] args) {
    try {
      flags.parse(processArgs(args));
    } catch (CmdLineException e) {
      if (!flags.displayHelp) {
        reportError(e.getMessage());
      }
    }

    if (flags.displayHelp) {
      flags.printUsage(out);
    } else if (errors) {
      flags.printShortUsageAfterErrors(errorStream);
    } else {
      runMinimizer = true;
    }
  }

  MinimizerOptions createOptions() {
    MinimizerOptions options = new MinimizerOptions();
    options.setCompress(!flags.noCompress);
    options.setForceCompress(flags.forceCompress);
    return options;
  }

  /** Minimizes or restores every input, reporting failures per file. */
  public void run() {
    Logger.getLogger("io.minipy").setLevel(flags.loggingLevelParsed);
    Minimizer minimizer = new Minimizer(createOptions());
    Stopwatch stopwatch = Stopwatch.createStarted();
    for (int i = 0; i < flags.arguments.size(); i++) {
      File input = new File(flags.arguments.get(i));
      File program = programFile(input);
      File output =
          flags.outputs.isEmpty()
              ? outputFile(program, flags.noSuffix ? "" : (flags.unparse ? ".max" : ".min"))
              : new File(flags.outputs.get(i));
      if (output.equals(input)) {
        reportError("ERROR - " + input + " would be overwritten by its own output");
        continue;
      }
      try {
        processFile(minimizer, input, program, output);
      } catch (IOException e) {
        reportError("ERROR - " + input + " read error: " + e.getMessage());
      } catch (AstReadException e) {
        reportError("ERROR - " + input + ": " + e.getMessage());
      }
    }
    logger.info("Total time = " + stopwatch.elapsed(TimeUnit.MILLISECONDS) + "ms");
  }

  private void processFile(Minimizer minimizer, File input, File program, File output)
      throws IOException, AstReadException {
    String json = Files.asCharSource(input, UTF_8).read();
    if (json.isBlank()) {
      out.println("Empty input file.");
      return;
    }
    Node tree = JsonAstReader.read(json);
    String raw =
        program.equals(input) || !program.isFile()
            ? null
            : Files.asCharSource(program, UTF_8).read();

    String result;
    if (!flags.unparse) {
      result = minimizer.minimize(tree, raw);
    } else if (flags.noCompress) {
      result = minimizer.prettyPrint(tree);
    } else {
      result = minimizer.restore(tree);
    }
    Files.asCharSink(output, UTF_8).write(result);

    String reference = raw != null ? raw : minimizer.prettyPrint(tree);
    logger.info(input + ": " + reference.length() + " -> " + result.length() + " chars");
    double level = 1.0 - (double) result.length() / Math.max(1, reference.length());
    out.println(
        program
            + " -> "
            + output
            + " | Compressing level "
            + String.format(Locale.ROOT, "%.3f%%", 100.0 * level));
  }

  /** The program a tree file describes: {@code app.py.json} describes {@code app.py}. */
  static File programFile(File tree) {
    String name = tree.getName();
    if (!name.endsWith(TREE_SUFFIX) || name.length() == TREE_SUFFIX.length()) {
      return tree;
    }
    return new File(tree.getParentFile(), name.substring(0, name.length() - TREE_SUFFIX.length()));
  }

  /** Inserts {@code suffix} before the extension: {@code app.py} becomes {@code app.min.py}. */
  static File outputFile(File program, String suffix) {
    String name = program.getName();
    int dot = name.lastIndexOf('.');
    String renamed =
        dot <= 0 ? name + suffix : name.substring(0, dot) + suffix + name.substring(dot);
    return new File(program.getParentFile(), renamed);
  }

  /**
   * @return Whether the configuration is valid and specifies to run the minimizer.
   */
  public boolean shouldRunMinimizer() {
    return runMinimizer;
  }

  /**
   * @return Whether the configuration or any input has errors.
   */
  public boolean hasErrors() {
    return errors;
  }

  /** Runs the minimizer. Exits cleanly in the event of an error. */
  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args);
    if (runner.shouldRunMinimizer()) {
      runner.run();
    }
    if (runner.hasErrors()) {
      System.exit(-1);
    }
  }
}
