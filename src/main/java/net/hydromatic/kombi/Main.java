/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kombi;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.kombi.ast.Ast;
import net.hydromatic.kombi.ast.Term;
import net.hydromatic.kombi.compile.Evaluator;
import net.hydromatic.kombi.compile.Reducer;
import net.hydromatic.kombi.compile.ReductionLimitException;
import net.hydromatic.kombi.compile.Tracer;
import net.hydromatic.kombi.compile.Tracers;
import net.hydromatic.kombi.compile.TypeChecker;
import net.hydromatic.kombi.parse.KombiParseException;
import net.hydromatic.kombi.type.Type;
import net.hydromatic.kombi.type.TypeSystem;
import net.hydromatic.kombi.util.KombiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command-line evaluator.
 *
 * <p>Reads a term from a file, optionally applies it to a term read from a
 * second file, type-checks it (if it is typed), reduces it, and prints the
 * result.
 */
public class Main {
  private final ConfigImpl config;
  private final PrintWriter out;
  private final PrintWriter err;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final int status;
    try (PrintWriter out = writer(System.out);
        PrintWriter err = writer(System.err)) {
      status = run(ImmutableList.copyOf(args), out, err);
    }
    System.exit(status);
  }

  /** Parses arguments, runs, and returns the exit status. */
  static int run(List<String> args, PrintWriter out, PrintWriter err) {
    final Config config;
    try {
      config = parse(Config.DEFAULT, args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      usage(err::println);
      return 1;
    }
    return new Main(config, out, err).run();
  }

  /** Creates a Main. */
  public Main(Config config, PrintWriter out, PrintWriter err) {
    this.config = (ConfigImpl) requireNonNull(config);
    this.out = requireNonNull(out);
    this.err = requireNonNull(err);
  }

  private static PrintWriter writer(PrintStream stream) {
    return new PrintWriter(new OutputStreamWriter(stream, UTF_8), true);
  }

  /**
   * Parses an argument list to an equivalent Config.
   *
   * @throws IllegalArgumentException if an argument is not valid
   */
  public static Config parse(Config config, List<String> argList) {
    ConfigImpl c = (ConfigImpl) config;
    for (int i = 0; i < argList.size(); i++) {
      final String arg = argList.get(i);
      if (arg.equals("--debug") || arg.equals("-d")) {
        c = c.withDebug(true);
      } else if (arg.equals("--trace") || arg.equals("-t")) {
        c = c.withTrace(true);
      } else if (arg.equals("--help") || arg.equals("-h")) {
        c = c.withHelp(true);
      } else if (arg.equals("--arg") || arg.equals("-a")) {
        if (++i >= argList.size()) {
          throw new IllegalArgumentException("missing value for " + arg);
        }
        c = c.withArgFile(new File(argList.get(i)));
      } else if (arg.startsWith("--arg=")) {
        c = c.withArgFile(new File(arg.substring("--arg=".length())));
      } else if (arg.startsWith("--max-steps=")) {
        final String value = arg.substring("--max-steps=".length());
        try {
          c = c.withMaxSteps(Integer.parseInt(value));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("invalid step limit: " + value);
        }
      } else if (arg.startsWith("-") && !arg.equals("-")) {
        throw new IllegalArgumentException("unknown option: " + arg);
      } else if (c.file != null) {
        throw new IllegalArgumentException("unexpected argument: " + arg);
      } else {
        c = c.withFile(new File(arg));
      }
    }
    return c;
  }

  static void usage(Consumer<String> outLines) {
    String[] usageLines = {
      "Usage: kombi [options] <file>",
      "",
      "Options:",
      "  -a, --arg <file>   apply the term to the term in <file>",
      "  -d, --debug        print terms and types in structural form",
      "  -t, --trace        print each reduction step to standard error",
      "  --max-steps=N      fail if reduction takes more than N steps",
      "  -h, --help         print this help",
    };
    Arrays.asList(usageLines).forEach(outLines);
  }

  /** Runs, and returns the exit status: 0 for success, 1 for failure. */
  public int run() {
    if (config.help) {
      usage(out::println);
      return 0;
    }
    if (config.file == null) {
      err.println("no input file");
      usage(err::println);
      return 1;
    }
    Tracer tracer = Tracers.empty();
    if (config.trace) {
      tracer =
          Tracers.withOnStep(
              tracer, (term, step) -> err.println("step " + step + ": " + term));
    }
    final Evaluator evaluator =
        new Evaluator(new TypeSystem(), tracer, config.maxSteps);
    final Ast.Program program;
    final Ast.@Nullable Program arg;
    final Term term;
    try {
      program = read(evaluator, config.file);
      arg = config.argFile == null ? null : read(evaluator, config.argFile);
      term = evaluator.apply(program, arg);
    } catch (IOException e) {
      return 1;
    } catch (KombiParseException e) {
      return fail(e);
    }

    final @Nullable Type type;
    try {
      type = evaluator.check(program, arg, term);
    } catch (TypeChecker.TypeException e) {
      err.println("Term " + term + " is not well-typed: " + e.getMessage());
      return 1;
    }

    final Term normalForm;
    try {
      normalForm = evaluator.reduce(term);
    } catch (ReductionLimitException e) {
      return fail(e);
    }
    out.println(new Evaluator.Result(term, normalForm, type).describe(config.debug));
    return 0;
  }

  /** Reads and parses a program from a file. */
  private Ast.Program read(Evaluator evaluator, File file) throws IOException {
    final String text;
    try {
      text = Files.asCharSource(file, UTF_8).read();
    } catch (IOException e) {
      err.println("Unable to open file " + file + ": " + e.getMessage());
      throw e;
    }
    return evaluator.parse(text, file.getPath());
  }

  private int fail(KombiException e) {
    err.println(e.describeTo(new StringBuilder()));
    return 1;
  }

  /** Command-line configuration. */
  public interface Config {
    Config DEFAULT =
        new ConfigImpl(null, null, false, false, Reducer.UNBOUNDED, false);

    /** Sets the file that contains the term to evaluate. */
    Config withFile(File file);

    /** Sets the file that contains the argument to apply the term to. */
    Config withArgFile(@Nullable File argFile);

    /** Sets whether to print terms and types in structural form. */
    Config withDebug(boolean debug);

    /** Sets whether to print each reduction step. */
    Config withTrace(boolean trace);

    /** Sets the maximum number of β-steps; -1 means no limit. */
    Config withMaxSteps(int maxSteps);

    /** Sets whether to print help and exit. */
    Config withHelp(boolean help);
  }

  /** Implementation of {@link Config}. */
  private static class ConfigImpl implements Config {
    private final @Nullable File file;
    private final @Nullable File argFile;
    private final boolean debug;
    private final boolean trace;
    private final int maxSteps;
    private final boolean help;

    private ConfigImpl(
        @Nullable File file,
        @Nullable File argFile,
        boolean debug,
        boolean trace,
        int maxSteps,
        boolean help) {
      this.file = file;
      this.argFile = argFile;
      this.debug = debug;
      this.trace = trace;
      this.maxSteps = maxSteps;
      this.help = help;
    }

    @Override
    public ConfigImpl withFile(File file) {
      if (file.equals(this.file)) {
        return this;
      }
      return new ConfigImpl(file, argFile, debug, trace, maxSteps, help);
    }

    @Override
    public ConfigImpl withArgFile(@Nullable File argFile) {
      if (argFile == null ? this.argFile == null : argFile.equals(this.argFile)) {
        return this;
      }
      return new ConfigImpl(file, argFile, debug, trace, maxSteps, help);
    }

    @Override
    public ConfigImpl withDebug(boolean debug) {
      if (this.debug == debug) {
        return this;
      }
      return new ConfigImpl(file, argFile, debug, trace, maxSteps, help);
    }

    @Override
    public ConfigImpl withTrace(boolean trace) {
      if (this.trace == trace) {
        return this;
      }
      return new ConfigImpl(file, argFile, debug, trace, maxSteps, help);
    }

    @Override
    public ConfigImpl withMaxSteps(int maxSteps) {
      if (this.maxSteps == maxSteps) {
        return this;
      }
      return new ConfigImpl(file, argFile, debug, trace, maxSteps, help);
    }

    @Override
    public ConfigImpl withHelp(boolean help) {
      if (this.help == help) {
        return this;
      }
      return new ConfigImpl(file, argFile, debug, trace, maxSteps, help);
    }
  }
}

// End Main.java
