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
import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import spwn.ast.FilePosition;
import spwn.ast.SpwnAST;
import spwn.common.Settings;
import spwn.common.exceptions.NestingDepthException;
import spwn.common.exceptions.SPWNRuntimeError;
import spwn.common.exceptions.UserException;
import spwn.common.util.Pair;
import spwn.frontend.tree.Argument;
import spwn.frontend.tree.Call;
import spwn.frontend.tree.CompoundStatement;
import spwn.frontend.tree.Definition;
import spwn.frontend.tree.DictDef;
import spwn.frontend.tree.ErrorRaise;
import spwn.frontend.tree.Expression;
import spwn.frontend.tree.ForLoop;
import spwn.frontend.tree.HandleClass;
import spwn.frontend.tree.HandleID;
import spwn.frontend.tree.If;
import spwn.frontend.tree.Implementation;
import spwn.frontend.tree.Literals;
import spwn.frontend.tree.Macro;
import spwn.frontend.tree.Operator;
import spwn.frontend.tree.Path;
import spwn.frontend.tree.Statement;
import spwn.frontend.tree.Tag;
import spwn.frontend.tree.UnaryOperator;
import spwn.frontend.tree.ValueLiteral;
import spwn.frontend.tree.Variable;

/**
 * Builds the statement list for one source file from its parse tree.
 *
 * Node types the builder has no handling for don't stop the build:
 * a placeholder is substituted (END_OF_INPUT for a statement, the
 * number 0 for a value, nothing for a path element) and a
 * {@link Diagnostic} is reported to the sink.
 *
 * Depth counts source nesting: each statement block and each
 * expression (parenthesized, index, argument, element or precedence
 * tier) adds one level.  Going beyond the configured depth is an error.
 */
public class TreeBuilder {

  private final String inputFile;
  private final DiagnosticSink diagnostics;
  private final int maxDepth;

  /** Current nesting of blocks and expressions */
  private int depth = 0;

  public TreeBuilder(String inputFile, DiagnosticSink diagnostics,
                     int maxDepth) {
    this.inputFile = inputFile;
    this.diagnostics = diagnostics;
    this.maxDepth = maxDepth;
  }

  public TreeBuilder(String inputFile, DiagnosticSink diagnostics) {
    this(inputFile, diagnostics, Settings.DEFAULT_MAX_DEPTH);
  }

  public String getInputFile() {
    return inputFile;
  }

  /**
   * @param root PROGRAM node for a whole file
   * @return statements of the program, ending with END_OF_INPUT
   */
  public List<Statement> buildProgram(SpwnAST root) throws UserException {
    if (RuleKind.of(root) != RuleKind.PROGRAM) {
      throw new SPWNRuntimeError("Expected program root but got " +
                                 LogHelper.tokName(root.getType()));
    }
    LogHelper.debug(0, "Building tree for " + inputFile);
    return statements(root.children());
  }

  public ImmutableList<Statement> statements(List<SpwnAST> trees)
      throws UserException {
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    if (trees.isEmpty()) {
      return result.build();
    }
    enter(trees.get(0));
    try {
      for (SpwnAST tree: trees) {
        result.add(statement(tree));
      }
    } finally {
      exit();
    }
    return result.build();
  }

  public Statement statement(SpwnAST tree) throws UserException {
    int start = tree.getLine();
    int end = tree.lastLine();
    RuleKind kind = RuleKind.of(tree);
    LogHelper.trace(depth, "statement " + kind + " line " + start);
    switch (kind) {
      case CONTEXT_FORK:
        checkChildCount(tree, 1);
        return statement(tree.child(0)).withContextFork(true);
      case DEFINITION:
        return Statement.definition(Definition.fromAST(this, tree),
                                    start, end);
      case CALL:
        return Statement.call(Call.fromAST(this, tree), start, end);
      case EXPRESSION:
        return Statement.expression(expression(tree), start, end);
      case IF_STMT:
        return Statement.ifStatement(If.fromAST(this, tree), start, end);
      case FOR_LOOP:
        return Statement.forLoop(ForLoop.fromAST(this, tree), start, end);
      case RETURN_STMT:
        return Statement.returnStatement(returnValue(tree), start, end);
      case IMPLEMENT:
        return Statement.impl(Implementation.fromAST(this, tree),
                              start, end);
      case ADD_OBJECT:
        checkChildCount(tree, 1);
        return Statement.addObject(expression(tree.child(0)), start, end);
      case ERROR_STMT:
        checkChildCount(tree, 1);
        return Statement.error(new ErrorRaise(expression(tree.child(0))),
                               start, end);
      case EXTRACT_STMT:
        checkChildCount(tree, 1);
        return Statement.extract(expression(tree.child(0)), start, end);
      case TYPE_DEF:
        return Statement.typeDef(tree.getText(), start, end);
      case END_OF_INPUT:
        return Statement.endOfInput(start, end);
      default:
        unsupported(tree, "statement");
        return Statement.endOfInput(start, end);
    }
  }

  /**
   * A return with no value returns null
   */
  private Expression returnValue(SpwnAST tree) throws UserException {
    if (tree.getChildCount() == 0) {
      return Expression.of(ValueLiteral.nullValue());
    }
    return expression(tree.child(0));
  }

  /**
   * Operands and operators of one precedence tier.  A node that isn't
   * an EXPRESSION is taken as a single operand.
   */
  public Expression expression(SpwnAST tree) throws UserException {
    if (RuleKind.of(tree) != RuleKind.EXPRESSION) {
      return Expression.of(variable(tree));
    }
    enter(tree);
    try {
      List<Variable> values = new ArrayList<Variable>();
      List<Operator> operators = new ArrayList<Operator>();
      for (SpwnAST item: tree.children()) {
        if (RuleKind.of(item) == RuleKind.OPERATOR) {
          Operator op = Operator.fromToken(item.getText());
          if (op == null) {
            throw new SPWNRuntimeError("Unknown operator: " + item.getText());
          }
          operators.add(op);
        } else {
          values.add(variable(item));
        }
      }
      return new Expression(values, operators);
    } finally {
      exit();
    }
  }

  /**
   * Prefix operator, value and path of an operand.  A node that isn't
   * a VARIABLE is taken as a value with no prefix or path.
   */
  public Variable variable(SpwnAST tree) throws UserException {
    if (RuleKind.of(tree) != RuleKind.VARIABLE) {
      return Variable.of(value(tree));
    }
    int pos = 0;
    UnaryOperator operator = null;
    if (tree.getChildCount() > 0 &&
        RuleKind.of(tree.child(0)) == RuleKind.UNARY_OP) {
      operator = UnaryOperator.fromToken(tree.child(0).getText());
      if (operator == null) {
        throw new SPWNRuntimeError("Unknown prefix operator: " +
                                   tree.child(0).getText());
      }
      pos++;
    }
    if (tree.getChildCount() <= pos) {
      throw new SPWNRuntimeError("variable with no value at " +
                                 position(tree));
    }
    ValueLiteral value = value(tree.child(pos));
    List<Path> path = new ArrayList<Path>();
    for (SpwnAST pathTree: tree.children(pos + 1)) {
      Path p = path(pathTree);
      if (p != null) {
        path.add(p);
      }
    }
    return new Variable(operator, value, path);
  }

  /**
   * @return path element, or null if the node type is not supported
   */
  public Path path(SpwnAST tree) throws UserException {
    switch (RuleKind.of(tree)) {
      case SYMBOL:
        return Path.member(tree.getText());
      case INDEX:
        checkChildCount(tree, 1);
        return Path.index(expression(tree.child(0)));
      case ARGUMENTS:
        return Path.call(arguments(tree));
      default:
        unsupported(tree, "path");
        return null;
    }
  }

  public ValueLiteral value(SpwnAST tree) throws UserException {
    RuleKind kind = RuleKind.of(tree);
    switch (kind) {
      case VALUE_LITERAL:
        checkChildCount(tree, 1);
        return value(tree.child(0));
      case VARIABLE: {
        Variable var = variable(tree);
        if (var.isBare()) {
          return var.getValue();
        }
        return ValueLiteral.expression(Expression.of(var));
      }
      case EXPRESSION:
        return ValueLiteral.expression(expression(tree));
      case HANDLE_ID:
        return ValueLiteral.handle(handle(tree));
      case NUMBER_LIT:
        return number(tree);
      case BOOL_LIT:
        return ValueLiteral.bool(Literals.parseBool(tree.getText()));
      case NULL_LIT:
        return ValueLiteral.nullValue();
      case STRING_LIT:
        return ValueLiteral.string(Literals.strContent(tree.getText()));
      case SYMBOL:
        return ValueLiteral.symbol(tree.getText());
      case TYPE_INDICATOR:
        return ValueLiteral.typeIndicator(tree.getText());
      case IMPORT_LIT:
        checkChildCount(tree, 1);
        return ValueLiteral.importPath(
              new File(Literals.strContent(tree.child(0).getText())));
      case ARRAY: {
        List<Expression> elems = new ArrayList<Expression>();
        for (SpwnAST elem: tree.children()) {
          elems.add(expression(elem));
        }
        return ValueLiteral.array(elems);
      }
      case OBJECT:
        return ValueLiteral.object(objectProps(tree));
      case DICTIONARY:
        return ValueLiteral.dictionary(dictionary(tree));
      case CMP_STMT:
        return ValueLiteral.compoundStatement(
                  new CompoundStatement(statements(tree.children())));
      case MACRO_DEF:
        return ValueLiteral.macro(Macro.fromAST(this, tree));
      default:
        unsupported(tree, "value");
        return ValueLiteral.number(0);
    }
  }

  private ValueLiteral number(SpwnAST tree) {
    try {
      return ValueLiteral.number(Literals.parseNumber(tree.getText()));
    } catch (NumberFormatException e) {
      invalidLiteral(tree, "invalid number: " + tree.getText());
      return ValueLiteral.number(0);
    }
  }

  /**
   * 10g has a number then a class, ?g has just a class
   */
  public HandleID handle(SpwnAST tree) {
    if (tree.getChildCount() == 0) {
      throw new SPWNRuntimeError("handle with no class at " + position(tree));
    }
    SpwnAST first = tree.child(0);
    if (RuleKind.of(first) == RuleKind.NUMBER_LIT) {
      checkChildCount(tree, 2);
      HandleClass handleClass = handleClass(tree.child(1));
      Integer number = Literals.parseHandleNumber(first.getText());
      if (number == null) {
        invalidLiteral(first, "handle number must be between 0 and " +
                       HandleID.MAX_NUMBER + ": " + first.getText());
        number = 0;
      }
      return HandleID.explicit(number, handleClass);
    } else {
      return HandleID.unspecified(handleClass(first));
    }
  }

  private HandleClass handleClass(SpwnAST tree) {
    HandleClass handleClass = HandleClass.fromSuffix(tree.getText());
    if (handleClass == null) {
      invalidLiteral(tree, "unknown handle class: " + tree.getText());
      return HandleClass.GROUP;
    }
    return handleClass;
  }

  private List<Pair<Expression, Expression>> objectProps(SpwnAST tree)
      throws UserException {
    List<Pair<Expression, Expression>> props =
                      new ArrayList<Pair<Expression, Expression>>();
    for (SpwnAST prop: tree.children()) {
      if (RuleKind.of(prop) != RuleKind.OBJECT_PROP) {
        unsupported(prop, "object property");
        continue;
      }
      checkChildCount(prop, 2);
      props.add(Pair.create(expression(prop.child(0)),
                            expression(prop.child(1))));
    }
    return props;
  }

  public List<DictDef> dictionary(SpwnAST tree) throws UserException {
    List<DictDef> entries = new ArrayList<DictDef>();
    for (SpwnAST entry: tree.children()) {
      switch (RuleKind.of(entry)) {
        case DICT_ENTRY:
          checkChildCount(entry, 2);
          entries.add(DictDef.def(entry.child(0).getText(),
                                  expression(entry.child(1))));
          break;
        case DICT_EXTRACT:
          checkChildCount(entry, 1);
          entries.add(DictDef.extract(expression(entry.child(0))));
          break;
        default:
          unsupported(entry, "dictionary entry");
          break;
      }
    }
    return entries;
  }

  public ImmutableList<Argument> arguments(SpwnAST tree) throws UserException {
    ImmutableList.Builder<Argument> args = ImmutableList.builder();
    for (SpwnAST arg: tree.children()) {
      if (RuleKind.of(arg) != RuleKind.ARGUMENT) {
        unsupported(arg, "argument");
        continue;
      }
      args.add(argument(arg));
    }
    return args.build();
  }

  /**
   * name = value is a keyword argument, a lone value is positional
   */
  public Argument argument(SpwnAST tree) throws UserException {
    if (tree.getChildCount() == 2 &&
        RuleKind.of(tree.child(0)) == RuleKind.SYMBOL) {
      return Argument.keyword(tree.child(0).getText(),
                              expression(tree.child(1)));
    }
    checkChildCount(tree, 1);
    return Argument.positional(expression(tree.child(0)));
  }

  /**
   * @param trees NATIVE_TAG nodes, each a name with optional arguments
   */
  public Tag tags(List<SpwnAST> trees) throws UserException {
    if (trees.isEmpty()) {
      return Tag.EMPTY;
    }
    List<Pair<String, ImmutableList<Argument>>> tags =
                  new ArrayList<Pair<String, ImmutableList<Argument>>>();
    for (SpwnAST tag: trees) {
      if (RuleKind.of(tag) != RuleKind.NATIVE_TAG || tag.childCount() < 1) {
        unsupported(tag, "tag");
        continue;
      }
      String name = tag.child(0).getText();
      ImmutableList<Argument> args = tag.childCount() > 1 ?
                arguments(tag.child(1)) : ImmutableList.<Argument>of();
      tags.add(Pair.create(name, args));
    }
    return new Tag(tags);
  }

  public FilePosition position(SpwnAST tree) {
    return FilePosition.of(inputFile, tree);
  }

  private void enter(SpwnAST tree) throws NestingDepthException {
    depth++;
    if (depth > maxDepth) {
      depth = 0;
      throw new NestingDepthException(inputFile, tree.getLine(), maxDepth);
    }
  }

  private void exit() {
    if (depth > 0) {
      depth--;
    }
  }

  private void unsupported(SpwnAST tree, String context) {
    String rule = LogHelper.tokName(tree.getType());
    diagnostics.report(new Diagnostic(Diagnostic.Kind.UNSUPPORTED_CONSTRUCT,
        rule, position(tree), rule + " is not supported as a " + context));
  }

  private void invalidLiteral(SpwnAST tree, String message) {
    diagnostics.report(new Diagnostic(Diagnostic.Kind.INVALID_LITERAL,
        LogHelper.tokName(tree.getType()), position(tree), message));
  }

  private static void checkChildCount(SpwnAST tree, int expected) {
    if (tree.getChildCount() != expected) {
      throw new SPWNRuntimeError(LogHelper.tokName(tree.getType()) +
          ": expected " + expected + " children but got " +
          tree.getChildCount());
    }
  }
}
