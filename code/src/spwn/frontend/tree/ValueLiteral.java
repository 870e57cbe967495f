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

import java.io.File;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import spwn.common.exceptions.SPWNRuntimeError;
import spwn.common.util.Pair;

/**
 * The base value of an operand.  The kind determines which accessor is
 * valid; calling another accessor is an internal error.
 */
public class ValueLiteral {
  public static enum Kind {
    HANDLE_ID,
    NUMBER,
    COMPOUND_STATEMENT,
    DICTIONARY,
    SYMBOL,
    BOOL,
    /** Parenthesized sub-expression */
    EXPRESSION,
    STRING,
    IMPORT,
    ARRAY,
    OBJECT,
    MACRO,
    /** Value already computed by a later stage, never built by parser */
    RESOLVED,
    TYPE_INDICATOR,
    NULL,
  }

  private static final ValueLiteral NULL_VALUE =
                                new ValueLiteral(Kind.NULL, null);

  private final Kind kind;
  private final Object payload;

  private ValueLiteral(Kind kind, Object payload) {
    this.kind = kind;
    this.payload = payload;
  }

  public static ValueLiteral handle(HandleID id) {
    return new ValueLiteral(Kind.HANDLE_ID, Preconditions.checkNotNull(id));
  }

  public static ValueLiteral number(double value) {
    return new ValueLiteral(Kind.NUMBER, value);
  }

  public static ValueLiteral compoundStatement(CompoundStatement body) {
    return new ValueLiteral(Kind.COMPOUND_STATEMENT,
                            Preconditions.checkNotNull(body));
  }

  public static ValueLiteral dictionary(List<DictDef> entries) {
    return new ValueLiteral(Kind.DICTIONARY, ImmutableList.copyOf(entries));
  }

  public static ValueLiteral symbol(String name) {
    return new ValueLiteral(Kind.SYMBOL, Preconditions.checkNotNull(name));
  }

  public static ValueLiteral bool(boolean value) {
    return new ValueLiteral(Kind.BOOL, value);
  }

  public static ValueLiteral expression(Expression expr) {
    return new ValueLiteral(Kind.EXPRESSION, Preconditions.checkNotNull(expr));
  }

  public static ValueLiteral string(String value) {
    return new ValueLiteral(Kind.STRING, Preconditions.checkNotNull(value));
  }

  public static ValueLiteral importPath(File path) {
    return new ValueLiteral(Kind.IMPORT, Preconditions.checkNotNull(path));
  }

  public static ValueLiteral array(List<Expression> elems) {
    return new ValueLiteral(Kind.ARRAY, ImmutableList.copyOf(elems));
  }

  public static ValueLiteral object(
                      List<Pair<Expression, Expression>> props) {
    return new ValueLiteral(Kind.OBJECT, ImmutableList.copyOf(props));
  }

  public static ValueLiteral macro(Macro macro) {
    return new ValueLiteral(Kind.MACRO, Preconditions.checkNotNull(macro));
  }

  public static ValueLiteral resolved(Object value) {
    return new ValueLiteral(Kind.RESOLVED, value);
  }

  public static ValueLiteral typeIndicator(String name) {
    return new ValueLiteral(Kind.TYPE_INDICATOR,
                            Preconditions.checkNotNull(name));
  }

  public static ValueLiteral nullValue() {
    return NULL_VALUE;
  }

  public Kind getKind() {
    return kind;
  }

  private void checkKind(Kind expected) {
    if (kind != expected) {
      throw new SPWNRuntimeError("Expected " + expected +
                                 " value literal but was " + kind);
    }
  }

  public HandleID getHandle() {
    checkKind(Kind.HANDLE_ID);
    return (HandleID)payload;
  }

  public double getNumber() {
    checkKind(Kind.NUMBER);
    return (Double)payload;
  }

  public CompoundStatement getCompoundStatement() {
    checkKind(Kind.COMPOUND_STATEMENT);
    return (CompoundStatement)payload;
  }

  @SuppressWarnings("unchecked")
  public List<DictDef> getDictionary() {
    checkKind(Kind.DICTIONARY);
    return (List<DictDef>)payload;
  }

  public String getSymbol() {
    checkKind(Kind.SYMBOL);
    return (String)payload;
  }

  public boolean getBool() {
    checkKind(Kind.BOOL);
    return (Boolean)payload;
  }

  public Expression getExpression() {
    checkKind(Kind.EXPRESSION);
    return (Expression)payload;
  }

  public String getString() {
    checkKind(Kind.STRING);
    return (String)payload;
  }

  public File getImport() {
    checkKind(Kind.IMPORT);
    return (File)payload;
  }

  @SuppressWarnings("unchecked")
  public List<Expression> getArray() {
    checkKind(Kind.ARRAY);
    return (List<Expression>)payload;
  }

  @SuppressWarnings("unchecked")
  public List<Pair<Expression, Expression>> getObject() {
    checkKind(Kind.OBJECT);
    return (List<Pair<Expression, Expression>>)payload;
  }

  public Macro getMacro() {
    checkKind(Kind.MACRO);
    return (Macro)payload;
  }

  public Object getResolved() {
    checkKind(Kind.RESOLVED);
    return payload;
  }

  public String getTypeIndicator() {
    checkKind(Kind.TYPE_INDICATOR);
    return (String)payload;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ValueLiteral)) {
      return false;
    }
    ValueLiteral other = (ValueLiteral)obj;
    return kind == other.kind && Objects.equal(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, payload);
  }

  @Override
  public String toString() {
    switch (kind) {
      case NULL:
        return "NULL";
      case EXPRESSION:
        return "(" + payload + ")";
      case STRING:
        return "STRING(\"" + payload + "\")";
      default:
        return kind + "(" + payload + ")";
    }
  }
}
