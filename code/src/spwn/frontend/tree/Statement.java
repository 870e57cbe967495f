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
package spwn.frontend.tree;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import spwn.common.exceptions.SPWNRuntimeError;

/**
 * A statement with its source lines.  The context fork flag (-> stmt)
 * is carried through for the code generator.
 */
public class Statement {
  public static enum StatementKind {
    DEFINITION,
    CALL,
    EXPRESSION,
    TYPE_DEF,
    RETURN,
    IMPL,
    IF,
    FOR,
    ERROR,
    EXTRACT,
    ADD_OBJECT,
    /** End of program, also used in place of unsupported statements */
    END_OF_INPUT,
  }

  private final StatementKind kind;
  private final Object body;
  private final int startLine;
  private final int endLine;
  private final boolean contextFork;

  private Statement(StatementKind kind, Object body, int startLine,
                    int endLine, boolean contextFork) {
    this.kind = kind;
    this.body = body;
    this.startLine = startLine;
    this.endLine = Math.max(startLine, endLine);
    this.contextFork = contextFork;
  }

  private static Statement create(StatementKind kind, Object body,
                                  int startLine, int endLine) {
    Preconditions.checkNotNull(body, "%s statement needs a body", kind);
    return new Statement(kind, body, startLine, endLine, false);
  }

  public static Statement definition(Definition def, int start, int end) {
    return create(StatementKind.DEFINITION, def, start, end);
  }

  public static Statement call(Call call, int start, int end) {
    return create(StatementKind.CALL, call, start, end);
  }

  public static Statement expression(Expression expr, int start, int end) {
    return create(StatementKind.EXPRESSION, expr, start, end);
  }

  public static Statement typeDef(String name, int start, int end) {
    return create(StatementKind.TYPE_DEF, name, start, end);
  }

  public static Statement returnStatement(Expression value,
                                          int start, int end) {
    return create(StatementKind.RETURN, value, start, end);
  }

  public static Statement impl(Implementation impl, int start, int end) {
    return create(StatementKind.IMPL, impl, start, end);
  }

  public static Statement ifStatement(If stmt, int start, int end) {
    return create(StatementKind.IF, stmt, start, end);
  }

  public static Statement forLoop(ForLoop loop, int start, int end) {
    return create(StatementKind.FOR, loop, start, end);
  }

  public static Statement error(ErrorRaise error, int start, int end) {
    return create(StatementKind.ERROR, error, start, end);
  }

  public static Statement extract(Expression value, int start, int end) {
    return create(StatementKind.EXTRACT, value, start, end);
  }

  public static Statement addObject(Expression value, int start, int end) {
    return create(StatementKind.ADD_OBJECT, value, start, end);
  }

  public static Statement endOfInput(int start, int end) {
    return new Statement(StatementKind.END_OF_INPUT, null, start, end, false);
  }

  public Statement withContextFork(boolean contextFork) {
    return new Statement(kind, body, startLine, endLine, contextFork);
  }

  public StatementKind getKind() {
    return kind;
  }

  public int getStartLine() {
    return startLine;
  }

  public int getEndLine() {
    return endLine;
  }

  public boolean isContextFork() {
    return contextFork;
  }

  private void checkKind(StatementKind expected) {
    if (kind != expected) {
      throw new SPWNRuntimeError("Expected " + expected +
                                 " statement but was " + kind);
    }
  }

  public Definition getDefinition() {
    checkKind(StatementKind.DEFINITION);
    return (Definition)body;
  }

  public Call getCall() {
    checkKind(StatementKind.CALL);
    return (Call)body;
  }

  /**
   * Expression of an expression, return, extract or add statement
   */
  public Expression getExpression() {
    switch (kind) {
      case EXPRESSION:
      case RETURN:
      case EXTRACT:
      case ADD_OBJECT:
        return (Expression)body;
      default:
        throw new SPWNRuntimeError(kind + " statement has no expression");
    }
  }

  public String getTypeName() {
    checkKind(StatementKind.TYPE_DEF);
    return (String)body;
  }

  public Implementation getImpl() {
    checkKind(StatementKind.IMPL);
    return (Implementation)body;
  }

  public If getIf() {
    checkKind(StatementKind.IF);
    return (If)body;
  }

  public ForLoop getForLoop() {
    checkKind(StatementKind.FOR);
    return (ForLoop)body;
  }

  public ErrorRaise getError() {
    checkKind(StatementKind.ERROR);
    return (ErrorRaise)body;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Statement)) {
      return false;
    }
    Statement other = (Statement)obj;
    return kind == other.kind && Objects.equal(body, other.body) &&
           startLine == other.startLine && endLine == other.endLine &&
           contextFork == other.contextFork;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, body, startLine, endLine, contextFork);
  }

  @Override
  public String toString() {
    String prefix = contextFork ? "-> " : "";
    switch (kind) {
      case END_OF_INPUT:
        return prefix + "EOI";
      case TYPE_DEF:
        return prefix + "type @" + body;
      case RETURN:
        return prefix + "return " + body;
      case EXTRACT:
        return prefix + "extract " + body;
      case ADD_OBJECT:
        return prefix + "add " + body;
      default:
        return prefix + body;
    }
  }
}
