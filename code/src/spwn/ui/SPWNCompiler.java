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

import java.io.PrintStream;

import org.apache.log4j.Logger;

import spwn.common.Settings;
import spwn.common.exceptions.InvalidOptionException;
import spwn.common.exceptions.InvalidSyntaxException;
import spwn.common.exceptions.ModuleLoadException;
import spwn.common.exceptions.SPWNFatal;
import spwn.common.exceptions.UnsupportedConstructException;
import spwn.common.exceptions.UserException;
import spwn.frontend.ParsedModule;
import spwn.frontend.tree.Statement;

/**
 * Front end entry point: parses a file and builds its statements,
 * reporting errors and converting them to exit codes.
 */
public class SPWNCompiler {

  private final Logger logger;
  private final PrintStream errStream;

  public SPWNCompiler(Logger logger) {
    this(logger, System.err);
  }

  public SPWNCompiler(Logger logger, PrintStream errStream) {
    this.logger = logger;
    this.errStream = errStream;
  }

  /**
   * Parse a SPWN file and build its statement list
   * @param inputFile
   * @return the parsed module
   * @throws SPWNFatal with the exit code if anything went wrong
   */
  public ParsedModule compile(String inputFile) {
    try {
      logger.info("spwnc starting: " + inputFile);
      int maxDepth = Settings.getInt(Settings.PARSE_MAX_DEPTH);
      boolean strict = Settings.getBoolean(Settings.PARSE_STRICT);

      ParsedModule module = ParsedModule.parse(inputFile, maxDepth);
      if (strict && !module.diagnostics.isEmpty()) {
        throw new UnsupportedConstructException(inputFile,
                        module.diagnostics.getDiagnostics());
      }
      logger.debug("spwnc done: " + module.statements.size() +
                   " statements");
      return module;
    }
    catch (SPWNFatal e) {
      // Rethrow
      throw e;
    }
    catch (ModuleLoadException e) {
      reportUserError(e);
      throw new SPWNFatal(ExitCode.ERROR_IO.code());
    }
    catch (InvalidSyntaxException e) {
      reportUserError(e);
      for (String msg: e.getParserMessages()) {
        errStream.println("  " + msg);
      }
      throw new SPWNFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (UserException e) {
      reportUserError(e);
      throw new SPWNFatal(ExitCode.ERROR_USER.code());
    }
    catch (InvalidOptionException e) {
      errStream.println("spwnc error: " + e.getMessage());
      throw new SPWNFatal(ExitCode.ERROR_COMMAND.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new SPWNFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (RuntimeException e) {
      // Other error, possibly SPWNRuntimeError
      reportInternalError(e);
      throw new SPWNFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Write one line per statement
   */
  public static void printStatements(ParsedModule module, PrintStream out) {
    for (Statement stmt: module.statements) {
      out.println(stmt.getStartLine() + ": " + stmt);
    }
  }

  private void reportUserError(UserException e) {
    errStream.println("spwnc error:");
    errStream.println(e.getMessage());
    if (logger.isDebugEnabled())
      logger.debug("User error", e);
  }

  private void reportInternalError(Throwable e) {
    errStream.println("SPWNC INTERNAL ERROR");
    errStream.println("Please report this");
    logger.error("Internal error", e);
  }
}
