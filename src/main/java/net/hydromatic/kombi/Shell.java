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
import static net.hydromatic.kombi.util.Static.parenDepth;
import static net.hydromatic.kombi.util.Static.str;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Runnables;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.kombi.compile.CompileException;
import net.hydromatic.kombi.compile.Evaluator;
import net.hydromatic.kombi.compile.Reducer;
import net.hydromatic.kombi.compile.ReductionLimitException;
import net.hydromatic.kombi.compile.Tracers;
import net.hydromatic.kombi.parse.KombiParseException;
import net.hydromatic.kombi.type.TypeSystem;
import net.hydromatic.kombi.util.KombiException;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.MaskingCallback;
import org.jline.reader.Parser;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/** Interactive shell for lambda terms, powered by JLine3. */
public class Shell {
  private final ConfigImpl config;
  private final Terminal terminal;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Config config;
    try {
      config = parse(Config.DEFAULT, ImmutableList.copyOf(args));
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      usage(System.err::println);
      System.exit(1);
      return;
    }
    try {
      final Shell shell = create(config, System.in, System.out);
      shell.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Shell. */
  public static Shell create(Config config, InputStream in, OutputStream out)
      throws IOException {
    final TerminalBuilder builder = TerminalBuilder.builder();
    builder.streams(in, out);
    builder.encoding(UTF_8);
    final ConfigImpl configImpl = (ConfigImpl) config;
    builder.system(configImpl.system);
    if (!configImpl.system) {
      // The default provider for non-system terminals reads nothing from the
      // given streams.
      builder.provider("exec");
    }
    builder.dumb(configImpl.dumb);
    if (configImpl.dumb) {
      builder.type("dumb");
    }
    final Terminal terminal = builder.build();
    return new Shell(config, terminal);
  }

  /** Creates a Shell. */
  public Shell(Config config, Terminal terminal) {
    this.config = (ConfigImpl) requireNonNull(config);
    this.terminal = requireNonNull(terminal);
  }

  /**
   * Parses an argument list to an equivalent Config.
   *
   * @throws IllegalArgumentException if the step limit is not an integer
   */
  public static Config parse(Config config, List<String> argList) {
    ConfigImpl c = (ConfigImpl) config;
    for (String arg : argList) {
      if (arg.equals("--banner=false")) {
        c = c.withBanner(false);
      }
      if (arg.equals("--terminal=dumb")) {
        c = c.withDumb(true);
      }
      if (arg.equals("--system=false")) {
        c = c.withSystem(false);
      }
      if (arg.equals("--debug")) {
        c = c.withDebug(true);
      }
      if (arg.equals("--help")) {
        c = c.withHelp(true);
      }
      if (arg.startsWith("--max-steps=")) {
        final String value = arg.substring("--max-steps=".length());
        final int maxSteps;
        try {
          maxSteps = Integer.parseInt(value);
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("invalid step limit: " + value);
        }
        c = c.withMaxSteps(maxSteps);
      }
    }
    return c;
  }

  static void usage(Consumer<String> outLines) {
    String[] usageLines = {
      "Usage: java " + Shell.class.getName()
          + " [--banner=false] [--terminal=dumb] [--system=false]"
          + " [--debug] [--max-steps=N] [--help]",
    };
    Arrays.asList(usageLines).forEach(outLines);
  }

  static void help(Consumer<String> outLines) {
    String[] helpLines = {
      "Enter a lambda term, such as ((λx.x) (λy.y)) or (\\x:A.x).",
      "List of available commands:",
      "    help   Print this help",
      "    quit   Quit shell",
    };
    Arrays.asList(helpLines).forEach(outLines);
  }

  /**
   * Pauses after creating the terminal.
   *
   * <p>Calls the value set by {@link Config#withPauseFn(Runnable)} which, for
   * the default config, does nothing.
   */
  protected final void pause() {
    config.pauseFn.run();
  }

  /** Returns whether a line is empty, and we are not on a continuation line. */
  private static boolean canIgnoreLine(StringBuilder buf, String line) {
    return buf.length() == 0 && line.trim().isEmpty();
  }

  /**
   * Categorizes a line. Commands such as "quit" are only recognized if we are
   * not on a continuation line.
   */
  static Map.Entry<LineType, String> classify(StringBuilder buf, String line) {
    if (canIgnoreLine(buf, line)) {
      return Map.entry(LineType.IGNORE, "");
    }
    if (buf.length() == 0) {
      final String trimmed = line.trim();
      if (trimmed.equalsIgnoreCase("quit")
          || trimmed.equalsIgnoreCase("exit")) {
        return Map.entry(LineType.QUIT, "");
      }
      if (trimmed.equals("help") || trimmed.equals("?")) {
        return Map.entry(LineType.HELP, "");
      }
    }
    return Map.entry(LineType.REGULAR, line);
  }

  /** Generates a banner to be shown on startup. */
  private String banner() {
    return "kombi version 0.1"
        + " (java version \"" + System.getProperty("java.version")
        + "\", " + terminal.getName()
        + ", " + terminal.getType() + ")";
  }

  public void run() {
    if (config.help) {
      usage(terminal.writer()::println);
      terminal.writer().flush();
      return;
    }

    final Parser parser =
        new DefaultParser() {
          {
            setEofOnUnclosedBracket(DefaultParser.Bracket.ROUND);
            // "\" is a lambda, not an escape; there are no quotes
            setEscapeChars(new char[0]);
            setQuoteChars(new char[0]);
          }
        };

    final String lambdaPrompt =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.bold())
            .append("λ>")
            .style(AttributedStyle.DEFAULT)
            .append(" ")
            .toAnsi(terminal);
    final String continuationPrompt =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.bold())
            .append(" =")
            .style(AttributedStyle.DEFAULT)
            .append(" ")
            .toAnsi(terminal);

    if (config.banner) {
      terminal.writer().println(banner());
    }
    final LineReader lineReader =
        LineReaderBuilder.builder()
            .appName("kombi")
            .terminal(terminal)
            .parser(parser)
            .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
            .variable(LineReader.SECONDARY_PROMPT_PATTERN, continuationPrompt)
            .build();

    pause();
    final LineFn lineFn =
        new TerminalLineFn(lambdaPrompt, continuationPrompt, lineReader);
    final Evaluator evaluator =
        new Evaluator(new TypeSystem(), Tracers.empty(), config.maxSteps);
    new SubShell(lineFn, evaluator, config.debug, terminal.writer()::println)
        .run();
    terminal.writer().flush();
  }

  /** Shell configuration. */
  @SuppressWarnings("unused")
  public interface Config {
    @SuppressWarnings("UnstableApiUsage")
    Config DEFAULT =
        new ConfigImpl(
            true, false, true, false, false, Reducer.UNBOUNDED,
            Runnables.doNothing());

    Config withBanner(boolean banner);

    Config withDumb(boolean dumb);

    Config withSystem(boolean system);

    Config withDebug(boolean debug);

    Config withHelp(boolean help);

    Config withMaxSteps(int maxSteps);

    Config withPauseFn(Runnable runnable);
  }

  /** Implementation of {@link Config}. */
  private static class ConfigImpl implements Config {
    private final boolean banner;
    private final boolean dumb;
    private final boolean system;
    private final boolean debug;
    private final boolean help;
    private final int maxSteps;
    private final Runnable pauseFn;

    private ConfigImpl(
        boolean banner,
        boolean dumb,
        boolean system,
        boolean debug,
        boolean help,
        int maxSteps,
        Runnable pauseFn) {
      this.banner = banner;
      this.dumb = dumb;
      this.system = system;
      this.debug = debug;
      this.help = help;
      this.maxSteps = maxSteps;
      this.pauseFn = requireNonNull(pauseFn, "pauseFn");
    }

    @Override
    public ConfigImpl withBanner(boolean banner) {
      if (this.banner == banner) {
        return this;
      }
      return new ConfigImpl(
          banner, dumb, system, debug, help, maxSteps, pauseFn);
    }

    @Override
    public ConfigImpl withDumb(boolean dumb) {
      if (this.dumb == dumb) {
        return this;
      }
      return new ConfigImpl(
          banner, dumb, system, debug, help, maxSteps, pauseFn);
    }

    @Override
    public ConfigImpl withSystem(boolean system) {
      if (this.system == system) {
        return this;
      }
      return new ConfigImpl(
          banner, dumb, system, debug, help, maxSteps, pauseFn);
    }

    @Override
    public ConfigImpl withDebug(boolean debug) {
      if (this.debug == debug) {
        return this;
      }
      return new ConfigImpl(
          banner, dumb, system, debug, help, maxSteps, pauseFn);
    }

    @Override
    public ConfigImpl withHelp(boolean help) {
      if (this.help == help) {
        return this;
      }
      return new ConfigImpl(
          banner, dumb, system, debug, help, maxSteps, pauseFn);
    }

    @Override
    public ConfigImpl withMaxSteps(int maxSteps) {
      if (this.maxSteps == maxSteps) {
        return this;
      }
      return new ConfigImpl(
          banner, dumb, system, debug, help, maxSteps, pauseFn);
    }

    @Override
    public ConfigImpl withPauseFn(Runnable pauseFn) {
      if (this.pauseFn.equals(pauseFn)) {
        return this;
      }
      return new ConfigImpl(
          banner, dumb, system, debug, help, maxSteps, pauseFn);
    }
  }

  /**
   * Abstraction of a terminal's line reader. Can read lines from an input
   * (terminal or file) and categorize the lines.
   */
  interface LineFn {
    Map.Entry<LineType, String> read(StringBuilder buf);
  }

  /** Type of line from {@link LineFn}. */
  enum LineType {
    QUIT,
    EOF,
    INTERRUPT,
    IGNORE,
    HELP,
    REGULAR
  }

  /**
   * Simplified shell that works in both interactive mode (where input and
   * output is a terminal) and batch mode (where input is a reader, and output
   * is to a list of lines).
   */
  static class SubShell {
    private final LineFn lineFn;
    private final Evaluator evaluator;
    private final boolean debug;
    private final Consumer<String> outLines;

    SubShell(
        LineFn lineFn,
        Evaluator evaluator,
        boolean debug,
        Consumer<String> outLines) {
      this.lineFn = requireNonNull(lineFn);
      this.evaluator = requireNonNull(evaluator);
      this.debug = debug;
      this.outLines = requireNonNull(outLines);
    }

    void run() {
      final StringBuilder buf = new StringBuilder();
      for (; ; ) {
        final Map.Entry<LineType, String> line = lineFn.read(buf);
        switch (line.getKey()) {
          case EOF:
          case QUIT:
            return;

          case INTERRUPT:
            buf.setLength(0);
            continue;

          case IGNORE:
            continue;

          case HELP:
            help(outLines);
            continue;

          case REGULAR:
          default:
            buf.append(line.getValue());
            if (parenDepth(buf) > 0) {
              // Unbalanced parentheses; the term continues on the next line.
              buf.append("\n");
              continue;
            }
            command(str(buf));
        }
      }
    }

    /** Evaluates a program and prints its result or error. */
    void command(String code) {
      try {
        final Evaluator.Result result = evaluator.evaluate(code, "stdIn");
        outLines.accept(result.describe(debug));
      } catch (KombiParseException
          | CompileException
          | ReductionLimitException e) {
        outLines.accept(describe(e));
      }
    }

    private static String describe(KombiException e) {
      return e.describeTo(new StringBuilder()).toString();
    }
  }

  /** Implementation of {@link LineFn} that reads from a reader. */
  static class ReaderLineFn implements LineFn {
    private final BufferedReader reader;

    ReaderLineFn(BufferedReader reader) {
      this.reader = requireNonNull(reader);
    }

    @Override
    public Map.Entry<LineType, String> read(StringBuilder buf) {
      try {
        final String line = reader.readLine();
        if (line == null) {
          return Map.entry(LineType.EOF, "");
        }
        return classify(buf, line);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }

  /**
   * Implementation of {@link LineFn} that reads from JLine's terminal. It is
   * used for interactive sessions.
   */
  private static class TerminalLineFn implements LineFn {
    private final String prompt;
    private final String continuationPrompt;
    private final LineReader lineReader;

    TerminalLineFn(
        String prompt, String continuationPrompt, LineReader lineReader) {
      this.prompt = prompt;
      this.continuationPrompt = continuationPrompt;
      this.lineReader = lineReader;
    }

    @Override
    public Map.Entry<LineType, String> read(StringBuilder buf) {
      final String line;
      try {
        final String p = buf.length() == 0 ? prompt : continuationPrompt;
        final String rightPrompt = null;
        line = lineReader.readLine(p, rightPrompt, (MaskingCallback) null, null);
      } catch (UserInterruptException e) {
        return Map.entry(LineType.INTERRUPT, "");
      } catch (EndOfFileException e) {
        return Map.entry(LineType.EOF, "");
      }

      return classify(buf, line);
    }
  }
}

// End Shell.java
