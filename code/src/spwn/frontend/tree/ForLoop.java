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

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import spwn.ast.SpwnAST;
import spwn.common.exceptions.SPWNRuntimeError;
import spwn.common.exceptions.UserException;
import spwn.frontend.TreeBuilder;

/**
 * for symbol in array { body }
 */
public class ForLoop {
  private final String symbol;
  private final Expression array;
  private final ImmutableList<Statement> body;

  public ForLoop(String symbol, Expression array, List<Statement> body) {
    this.symbol = symbol;
    this.array = array;
    this.body = ImmutableList.copyOf(body);
  }

  public String getSymbol() {
    return symbol;
  }

  public Expression getArray() {
    return array;
  }

  public List<Statement> getBody() {
    return body;
  }

  public static ForLoop fromAST(TreeBuilder builder, SpwnAST tree)
      throws UserException {
    if (tree.getChildCount() != 3) {
      throw new SPWNRuntimeError("for: expected 3 children but got " +
                                  tree.getChildCount());
    }
    String symbol = tree.child(0).getText();
    Expression array = builder.expression(tree.child(1));
    List<Statement> body = builder.statements(tree.child(2).children());
    return new ForLoop(symbol, array, body);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ForLoop)) {
      return false;
    }
    ForLoop other = (ForLoop)obj;
    return symbol.equals(other.symbol) && array.equals(other.array) &&
           body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(symbol, array, body);
  }

  @Override
  public String toString() {
    return "for " + symbol + " in " + array + " {" +
            Joiner.on("; ").join(body) + "}";
  }
}
