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
package spwn.ui;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import spwn.common.Logging;
import spwn.common.Settings;
import spwn.common.exceptions.InvalidOptionException;
import spwn.common.exceptions.SPWNFatal;
import spwn.frontend.ParsedModule;

/**
 * Command line interface to the SPWN front end.  Options can also be
 * passed as Java properties.  See Settings.java for these.
 */
public class Main {
  private static final String TREE_FLAG = "t";
  private static final String AST_FLAG = "a";
  private static final String STRICT_FLAG = "s";
  private static final String MAX_DEPTH_FLAG = "m";
  private static final String HELP_FLAG = "h";

  public static void main(String[] args) {
    Options opts = initOptions();
    Args spwnArgs = processArgs(opts, args);
    if (spwnArgs == null) {
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      Settings.initProperties();
      recordArgValues(spwnArgs);
      Settings.validateProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      SPWNCompiler compiler = new SPWNCompiler(logger);
      ParsedModule module = compiler.compile(spwnArgs.inputFilename);
      if (spwnArgs.printTree) {
        System.out.print(module.ast.printTree());
      }
      if (spwnArgs.printAST) {
        SPWNCompiler.printStatements(module, System.out);
      }
    } catch (SPWNFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  static Options initOptions() {
    Options opts = new Options();
    opts.addOption(TREE_FLAG, "tree", false, "Print the parse tree");
    opts.addOption(AST_FLAG, "ast", false, "Print the built statements");
    opts.addOption(STRICT_FLAG, "strict", false,
                   "Fail if any construct is unsupported");
    Option maxDepth = new Option(MAX_DEPTH_FLAG, "max-depth", true,
                                 "Maximum nesting of blocks and expressions");
    maxDepth.setArgName("N");
    opts.addOption(maxDepth);
    opts.addOption(HELP_FLAG, "help", false, "Show this message");
    return opts;
  }

  /**
   * @return parsed arguments, or null if invalid
   */
  static Args processArgs(Options opts, String[] args) {
    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      return null;
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      System.exit(ExitCode.SUCCESS.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      return null;
    }

    return new Args(remainingArgs[0], cmd.hasOption(TREE_FLAG),
                    cmd.hasOption(AST_FLAG), cmd.hasOption(STRICT_FLAG),
                    cmd.getOptionValue(MAX_DEPTH_FLAG));
  }

  /**
   * Store command line values as settings, overriding properties
   */
  static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.strict) {
      Settings.set(Settings.PARSE_STRICT, "true");
    }
    if (args.maxDepth != null) {
      Settings.set(Settings.PARSE_MAX_DEPTH, args.maxDepth);
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("spwnc [options] <input.spwn>", opts);
  }

  static class Args {
    public final String inputFilename;
    public final boolean printTree;
    public final boolean printAST;
    public final boolean strict;
    /** Unvalidated value of --max-depth, or null */
    public final String maxDepth;

    public Args(String inputFilename, boolean printTree, boolean printAST,
                boolean strict, String maxDepth) {
      this.inputFilename = inputFilename;
      this.printTree = printTree;
      this.printAST = printAST;
      this.strict = strict;
      this.maxDepth = maxDepth;
    }
  }
}
