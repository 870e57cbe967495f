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

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * One operand: optional prefix operator, a value, then member, index
 * and call operations applied left to right.
 */
public class Variable {
  private final UnaryOperator operator;
  private final ValueLiteral value;
  private final ImmutableList<Path> path;

  public Variable(UnaryOperator operator, ValueLiteral value,
                  List<Path> path) {
    Preconditions.checkNotNull(value);
    this.operator = operator;
    this.value = value;
    this.path = ImmutableList.copyOf(path);
  }

  public static Variable of(ValueLiteral value) {
    return new Variable(null, value, ImmutableList.<Path>of());
  }

  /**
   * @return prefix operator, or null if none
   */
  public UnaryOperator getOperator() {
    return operator;
  }

  public ValueLiteral getValue() {
    return value;
  }

  public List<Path> getPath() {
    return path;
  }

  /**
   * @return true if just a value with no operator or path
   */
  public boolean isBare() {
    return operator == null && path.isEmpty();
  }

  public boolean endsWithCall() {
    return !path.isEmpty() &&
           path.get(path.size() - 1).getKind() == Path.Kind.CALL;
  }

  /**
   * Inverse of {@link Expression#asVariable()}: a bare parenthesized
   * expression is unwrapped, anything else becomes a single operand.
   */
  public Expression asExpression() {
    if (isBare() && value.getKind() == ValueLiteral.Kind.EXPRESSION) {
      return value.getExpression();
    }
    return Expression.of(this);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Variable)) {
      return false;
    }
    Variable other = (Variable)obj;
    return operator == other.operator && value.equals(other.value) &&
           path.equals(other.path);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(operator, value, path);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (operator != null) {
      sb.append(operator.token());
    }
    sb.append(value);
    for (Path p: path) {
      sb.append(p);
    }
    return sb.toString();
  }
}
