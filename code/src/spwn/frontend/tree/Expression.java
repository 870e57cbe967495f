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
import com.google.common.collect.ImmutableList;

import spwn.common.exceptions.SPWNRuntimeError;

/**
 * A chain of operands joined by operators from a single precedence
 * tier.  Operands of higher precedence appear as Variables whose value
 * is a nested Expression.  There is always one more operand than
 * there are operators.
 */
public class Expression {
  private final ImmutableList<Variable> values;
  private final ImmutableList<Operator> operators;

  public Expression(List<Variable> values, List<Operator> operators) {
    this.values = ImmutableList.copyOf(values);
    this.operators = ImmutableList.copyOf(operators);
    if (this.values.size() != this.operators.size() + 1) {
      throw new SPWNRuntimeError("Expression must have one more operand " +
          "than operators, but had " + this.values.size() + " operands and " +
          this.operators.size() + " operators");
    }
  }

  /**
   * @return expression with a single operand
   */
  public static Expression of(Variable value) {
    return new Expression(ImmutableList.of(value),
                          ImmutableList.<Operator>of());
  }

  public static Expression of(ValueLiteral value) {
    return of(Variable.of(value));
  }

  public List<Variable> getValues() {
    return values;
  }

  public List<Operator> getOperators() {
    return operators;
  }

  public boolean isSingleValue() {
    return operators.isEmpty();
  }

  /**
   * Wrap this expression as a parenthesized operand with no prefix
   * operator and no path.
   */
  public Variable asVariable() {
    return Variable.of(ValueLiteral.expression(this));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Expression)) {
      return false;
    }
    Expression other = (Expression)obj;
    return values.equals(other.values) && operators.equals(other.operators);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(values, operators);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(values.get(0));
    for (int i = 0; i < operators.size(); i++) {
      sb.append(' ').append(operators.get(i).token()).append(' ');
      sb.append(values.get(i + 1));
    }
    return sb.toString();
  }
}
