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
package spwn.frontend;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonToken;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.antlr.runtime.TokenStream;
import org.antlr.runtime.tree.CommonTreeAdaptor;
import org.apache.commons.io.FileUtils;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;

import spwn.ast.SpwnAST;
import spwn.ast.antlr.SPWNLexer;
import spwn.ast.antlr.SPWNParser;
import spwn.common.Logging;
import spwn.common.exceptions.InvalidSyntaxException;
import spwn.common.exceptions.ModuleLoadException;
import spwn.common.exceptions.NestingDepthException;
import spwn.common.exceptions.SPWNRuntimeError;
import spwn.common.exceptions.UserException;
import spwn.frontend.tree.Statement;

/**
 * Represents an input SPWN source file: its parse tree, the statements
 * built from it and any diagnostics from building them.
 */
public class ParsedModule {

  public ParsedModule(String filePath, SpwnAST ast,
                      List<Statement> statements,
                      DiagnosticList diagnostics) {
    this.inputFilePath = filePath;
    this.ast = ast;
    this.statements = ImmutableList.copyOf(statements);
    this.diagnostics = diagnostics;
  }

  public final String inputFilePath;
  public final SpwnAST ast;
  public final ImmutableList<Statement> statements;
  public final DiagnosticList diagnostics;

  /**
   * Parse the specified file and create a ParsedModule object
   * @param path
   * @param maxDepth maximum nesting depth
   * @return
   * @throws ModuleLoadException if the file can't be read
   * @throws InvalidSyntaxException if the source isn't valid SPWN
   * @throws NestingDepthException if nesting exceeds maxDepth
   */
  public static ParsedModule parse(String path, int maxDepth)
                                              throws UserException {
    String source;
    try {
      source = FileUtils.readFileToString(new File(path), Charsets.UTF_8);
    } catch (IOException e) {
      throw new ModuleLoadException(path, e);
    }
    return parseString(path, source, maxDepth);
  }

  /**
   * Parse source text
   * @param name file name to use in messages
   */
  public static ParsedModule parseString(String name, String source,
                                   int maxDepth) throws UserException {
    SpwnAST tree = runANTLR(name, source, maxDepth);

    DiagnosticList diagnostics = new DiagnosticList();
    TreeBuilder builder = new TreeBuilder(name, diagnostics, maxDepth);
    List<Statement> statements;
    try {
      statements = builder.buildProgram(tree);
    } catch (StackOverflowError e) {
      throw new NestingDepthException(name, tree.getLine(), maxDepth);
    }
    Logging.getSPWNLogger().debug("Built " + statements.size() +
        " statements from " + name + " with " + diagnostics.size() +
        " diagnostics");
    return new ParsedModule(name, tree, statements, diagnostics);
  }

  /**
     Use ANTLR to parse the input and get the Tree
   */
  private static SpwnAST runANTLR(String name, String source, int maxDepth)
      throws UserException {
    ANTLRStringStream input = new ANTLRStringStream(source);
    input.name = name;
    SPWNLexer lexer = new SPWNLexer(input);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    SPWNParser parser = new SPWNParser(tokens);
    parser.setTreeAdaptor(new SpwnTreeAdaptor());

    SPWNParser.program_return program = null;
    try {
      program = parser.program();
    } catch (RecognitionException e) {
      // Recovery failed: report along with anything collected before
      parser.displayRecognitionError(parser.getTokenNames(), e);
    } catch (StackOverflowError e) {
      Token last = tokens.LT(-1);
      throw new NestingDepthException(name,
                    last == null ? 0 : last.getLine(), maxDepth);
    }

    /* NOTE: in some cases the antlr parser will actually recover from
     *    errors, report the error and continue, generating the
     *    parse tree that it thinks is most plausible.  This is where
     *    we detect this case.
     */
    List<String> messages = new ArrayList<String>();
    messages.addAll(lexer.getErrorMessages());
    messages.addAll(parser.getErrorMessages());
    if (!messages.isEmpty()) {
      RecognitionException first = firstError(lexer.getFirstError(),
                                              parser.getFirstError());
      int line = first == null ? 0 : first.line;
      int col = first == null ? 0 : first.charPositionInLine;
      throw new InvalidSyntaxException(name, line, col, messages);
    }

    if (program == null || program.getTree() == null)
      throw new SPWNRuntimeError("Parser produced no tree for " + name);

    return (SpwnAST) program.getTree();
  }

  /**
   * @return whichever error comes first in the source
   */
  private static RecognitionException firstError(RecognitionException a,
                                                 RecognitionException b) {
    if (a == null) {
      return b;
    } else if (b == null) {
      return a;
    } else if (a.line < b.line || (a.line == b.line &&
               a.charPositionInLine <= b.charPositionInLine)) {
      return a;
    } else {
      return b;
    }
  }

  public static class SpwnTreeAdaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new SpwnAST(t);
    }

    /**
     * Placeholder for input skipped during error recovery.  The parse
     * always fails in this case, so the node is never built into
     * statements.
     */
    @Override
    public Object errorNode(TokenStream input, Token start, Token stop,
                            RecognitionException e) {
      CommonToken token = new CommonToken(Token.INVALID_TOKEN_TYPE,
                                          "<error>");
      if (start != null) {
        token.setLine(start.getLine());
        token.setCharPositionInLine(start.getCharPositionInLine());
      }
      return new SpwnAST(token);
    }
  }
}
