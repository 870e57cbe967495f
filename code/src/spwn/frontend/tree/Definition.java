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

import spwn.ast.SpwnAST;
import spwn.common.exceptions.SPWNRuntimeError;
import spwn.common.exceptions.UserException;
import spwn.frontend.RuleKind;
import spwn.frontend.TreeBuilder;

/**
 * Binding of a name to a value: name = expr.  A definition without a
 * name (let expr) binds the wildcard symbol.
 */
public class Definition {
  public static final String WILDCARD = "*";

  private final String symbol;
  private final Expression value;
  private final Tag properties;

  public Definition(String symbol, Expression value, Tag properties) {
    Preconditions.checkNotNull(symbol);
    Preconditions.checkNotNull(value);
    Preconditions.checkNotNull(properties);
    this.symbol = symbol;
    this.value = value;
    this.properties = properties;
  }

  public String getSymbol() {
    return symbol;
  }

  public Expression getValue() {
    return value;
  }

  public Tag getProperties() {
    return properties;
  }

  public boolean isWildcard() {
    return WILDCARD.equals(symbol);
  }

  public static Definition fromAST(TreeBuilder builder, SpwnAST tree)
      throws UserException {
    assert(RuleKind.of(tree) == RuleKind.DEFINITION);
    if (tree.getChildCount() < 1) {
      throw new SPWNRuntimeError("definition: no children");
    }
    SpwnAST first = tree.child(0);
    String symbol;
    Expression value;
    int tagStart;
    if (RuleKind.of(first) == RuleKind.SYMBOL) {
      if (tree.getChildCount() < 2) {
        throw new SPWNRuntimeError("definition: no value for " +
                                   first.getText());
      }
      symbol = first.getText();
      value = builder.expression(tree.child(1));
      tagStart = 2;
    } else {
      symbol = WILDCARD;
      value = builder.expression(first);
      tagStart = 1;
    }
    Tag properties = builder.tags(tree.children(tagStart));
    return new Definition(symbol, value, properties);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Definition)) {
      return false;
    }
    Definition other = (Definition)obj;
    return symbol.equals(other.symbol) && value.equals(other.value) &&
           properties.equals(other.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(symbol, value, properties);
  }

  @Override
  public String toString() {
    return (properties.isEmpty() ? "" : properties + " ") +
            symbol + " = " + value;
  }
}
