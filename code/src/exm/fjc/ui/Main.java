/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.fjc.ui;

import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import exm.fjc.common.Logging;
import exm.fjc.common.Settings;
import exm.fjc.common.exceptions.FJCFatal;
import exm.fjc.common.exceptions.InvalidOptionException;

/**
 * Command line interface to the fjc compiler.  Compiler options are held
 * in Settings; -D on the command line overrides them.
 */
public class Main {
  private static final String HELP_FLAG = "h";
  private static final String VERBOSE_FLAG = "v";
  private static final String LOG_FLAG = "l";
  private static final String ROOT_FLAG = "r";
  private static final String SETTING_FLAG = "D";
  private static final String ANALYZE_ONLY_FLAG = "analyze-only";

  public static void main(String[] args) {
    try {
      System.exit(run(args));
    } catch (FJCFatal ex) {
      System.exit(ex.exitCode);
    }
  }

  /**
   * @return exit code
   * @throws FJCFatal on compilation failure
   */
  public static int run(String[] args) {
    Options opts = initOptions();
    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      return ExitCode.ERROR_COMMAND.code();
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      return ExitCode.SUCCESS.code();
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
                         "but got " + remainingArgs.length + " arguments");
      usage(opts);
      return ExitCode.ERROR_COMMAND.code();
    }
    String input = remainingArgs[0];
    String output = remainingArgs.length == 2 ? remainingArgs[1] :
                                                defaultOutput(input);

    Logger logger;
    try {
      Settings.initFJCProperties();
      applySettings(cmd, input, output);
      Settings.validate();
      logger = Logging.setupLogging(Settings.get(Settings.LOG_FILE),
                                    Settings.getBoolean(Settings.LOG_TRACE));
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    }

    logger.debug("fjc settings: " + Settings.getKeys().size() + " keys, " +
                 "input " + input + ", output " + output);
    new FJCompiler(logger).compile(input, output,
        cmd.hasOption(ANALYZE_ONLY_FLAG), System.out);
    return ExitCode.SUCCESS.code();
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    opts.addOption(VERBOSE_FLAG, "verbose", false, "Trace logging");
    opts.addOption(new Option(LOG_FLAG, "log", true, "Log file"));
    opts.addOption(new Option(ROOT_FLAG, "root", true,
                              "Project root for resolving imports"));

    Option setting = new Option(SETTING_FLAG, true,
                                "Compiler setting, e.g. -D fjc.indent=\"\t\"");
    setting.setArgs(2);
    setting.setValueSeparator('=');
    opts.addOption(setting);

    opts.addOption(null, ANALYZE_ONLY_FLAG, false,
                   "Print the analysis report instead of compiling");
    return opts;
  }

  private static void applySettings(CommandLine cmd, String input,
                                    String output) {
    Settings.set(Settings.INPUT_FILENAME, input);
    Settings.set(Settings.OUTPUT_FILENAME, output);
    if (cmd.hasOption(LOG_FLAG)) {
      Settings.set(Settings.LOG_FILE, cmd.getOptionValue(LOG_FLAG));
    }
    if (cmd.hasOption(VERBOSE_FLAG)) {
      Settings.set(Settings.LOG_TRACE, "true");
    }
    if (cmd.hasOption(ROOT_FLAG)) {
      Settings.set(Settings.PROJECT_ROOT, cmd.getOptionValue(ROOT_FLAG));
    }
    Properties props = cmd.getOptionProperties(SETTING_FLAG);
    for (String key: props.stringPropertyNames()) {
      Settings.set(key, props.getProperty(key));
    }
  }

  /**
   * input.fjs becomes input.js; a .js input is not overwritten
   */
  static String defaultOutput(String input) {
    String base = FilenameUtils.removeExtension(input);
    if (FilenameUtils.getExtension(input).equals("js")) {
      return base + ".out.js";
    }
    return base + ".js";
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("fjc [options] <input.fjs> [output.js]", opts, true);
  }
}
